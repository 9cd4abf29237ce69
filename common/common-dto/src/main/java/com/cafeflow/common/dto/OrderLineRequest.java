package com.cafeflow.common.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/** 주문 항목 요청 (상품 ID + 수량) */
public record OrderLineRequest(
        @NotNull(message = "productId is required")
        Long productId,

        @NotNull(message = "quantity is required")
        @Positive(message = "quantity must be at least 1")
        Integer quantity
) {}
