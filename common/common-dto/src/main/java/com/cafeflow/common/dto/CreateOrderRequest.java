package com.cafeflow.common.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * 주문 생성 요청 DTO.
 *
 * <p>게이트웨이가 받은 요청 본문이 그대로 주문 서비스로 전달된다.
 * Bean Validation으로 요청 데이터를 검증하여 잘못된 요청이
 * 다운스트림 호출까지 이어지는 것을 막는다.</p>
 */
public record CreateOrderRequest(
        @NotNull(message = "userId is required")
        Long userId,

        @NotEmpty(message = "items must not be empty")
        List<@Valid @NotNull(message = "item must not be null") OrderLineRequest> items
) {}
