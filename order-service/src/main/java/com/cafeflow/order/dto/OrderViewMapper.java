package com.cafeflow.order.dto;

import com.cafeflow.common.dto.OrderLineView;
import com.cafeflow.common.dto.OrderView;
import com.cafeflow.order.entity.Order;
import com.cafeflow.order.entity.OrderItem;

/**
 * Order 엔티티 → 응답 DTO 변환. 엔티티를 API 응답에 직접 노출하지 않는다.
 */
public final class OrderViewMapper {

    private OrderViewMapper() {
    }

    public static OrderView toView(Order order) {
        return new OrderView(
                order.getId(),
                order.getUserId(),
                order.getStatus().name(),
                order.getTotalAmount(),
                order.getItems().stream().map(OrderViewMapper::toLine).toList(),
                order.getCreatedAt());
    }

    private static OrderLineView toLine(OrderItem item) {
        return new OrderLineView(item.getProductId(), item.getProductName(),
                item.getQuantity(), item.getUnitPrice(), item.getSubtotal());
    }
}
