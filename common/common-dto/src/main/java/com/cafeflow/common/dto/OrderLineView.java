package com.cafeflow.common.dto;

import java.math.BigDecimal;

/** 주문 항목 응답. unitPrice는 주문 시점의 가격 스냅샷이다. */
public record OrderLineView(
        Long productId,
        String productName,
        int quantity,
        BigDecimal unitPrice,
        BigDecimal subtotal
) {}
