package com.cafeflow.common.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 주문 응답 DTO (주문 서비스 → 게이트웨이 → 클라이언트).
 *
 * <p>JPA 엔티티를 그대로 직렬화하지 않고 이 레코드로 변환해서 내보낸다.</p>
 */
public record OrderView(
        Long id,
        Long userId,
        String status,
        BigDecimal totalAmount,
        List<OrderLineView> items,
        LocalDateTime createdAt
) {}
