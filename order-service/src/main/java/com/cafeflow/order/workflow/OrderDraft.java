package com.cafeflow.order.workflow;

import com.cafeflow.common.dto.CatalogItemSnapshot;
import com.cafeflow.common.dto.UserSnapshot;
import com.cafeflow.order.entity.Order;
import com.cafeflow.order.entity.OrderItem;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 주문 초안 (워크플로 1회 실행 동안의 중간 결과)
 *
 * <p>불변 값 객체. 단계가 진행될 때마다 {@code with*} 메서드로 새 초안을 만든다.
 * 사용자와 모든 항목이 확정되기 전에는 {@link #toOrder(String)}를 호출할 수 없다.</p>
 */
public final class OrderDraft {

    /** 요청된 주문 라인 (요청 순서 유지) */
    public record RequestedLine(Long productId, int quantity) {}

    /** 카탈로그 조회로 이름과 가격이 확정된 라인 */
    public record ResolvedLine(Long productId, String productName, int quantity, BigDecimal unitPrice) {

        public BigDecimal subtotal() {
            return unitPrice.multiply(BigDecimal.valueOf(quantity));
        }
    }

    private final Long requestedUserId;
    private final List<RequestedLine> requestedLines;
    private final UserSnapshot resolvedUser;
    private final List<ResolvedLine> resolvedLines;

    private OrderDraft(Long requestedUserId, List<RequestedLine> requestedLines,
                       UserSnapshot resolvedUser, List<ResolvedLine> resolvedLines) {
        this.requestedUserId = requestedUserId;
        this.requestedLines = List.copyOf(requestedLines);
        this.resolvedUser = resolvedUser;
        this.resolvedLines = resolvedLines == null ? null : List.copyOf(resolvedLines);
    }

    public static OrderDraft of(Long userId, List<RequestedLine> lines) {
        return new OrderDraft(userId, lines, null, null);
    }

    public OrderDraft withUser(UserSnapshot user) {
        Objects.requireNonNull(user, "user");
        return new OrderDraft(requestedUserId, requestedLines, user, null);
    }

    /**
     * 요청 라인마다 카탈로그 스냅샷의 이름과 가격을 고정한다.
     *
     * @param catalog productId → 조회된 항목. 요청된 모든 productId를 포함해야 한다.
     */
    public OrderDraft withResolvedItems(Map<Long, CatalogItemSnapshot> catalog) {
        if (resolvedUser == null) {
            throw new IllegalStateException("User must be resolved before items");
        }
        List<ResolvedLine> lines = requestedLines.stream()
                .map(line -> {
                    CatalogItemSnapshot item = catalog.get(line.productId());
                    if (item == null) {
                        throw new IllegalStateException("Unresolved product " + line.productId());
                    }
                    return new ResolvedLine(line.productId(), item.name(), line.quantity(), item.price());
                })
                .toList();
        return new OrderDraft(requestedUserId, requestedLines, resolvedUser, lines);
    }

    /** 중복을 제거한 productId (요청 순서 유지) */
    public Set<Long> distinctProductIds() {
        Set<Long> ids = new LinkedHashSet<>();
        requestedLines.forEach(line -> ids.add(line.productId()));
        return ids;
    }

    public boolean isComplete() {
        return resolvedUser != null && resolvedLines != null;
    }

    public Order toOrder(String idempotencyKey) {
        if (!isComplete()) {
            throw new IllegalStateException("Draft is not fully resolved");
        }
        Order order = Order.builder()
                .userId(requestedUserId)
                .idempotencyKey(idempotencyKey)
                .build();
        for (ResolvedLine line : resolvedLines) {
            order.addItem(OrderItem.builder()
                    .productId(line.productId())
                    .productName(line.productName())
                    .quantity(line.quantity())
                    .unitPrice(line.unitPrice())
                    .build());
        }
        return order;
    }

    public Long getRequestedUserId() {
        return requestedUserId;
    }

    public List<RequestedLine> getRequestedLines() {
        return requestedLines;
    }

    public UserSnapshot getResolvedUser() {
        return resolvedUser;
    }

    public List<ResolvedLine> getResolvedLines() {
        return resolvedLines;
    }
}
