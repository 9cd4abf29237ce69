package com.cafeflow.order.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

/**
 * 주문 항목(OrderItem) 엔티티 - Order 애그리거트의 구성 요소
 *
 * <h3>설계 포인트</h3>
 * <ul>
 *   <li>productId만 저장 (FK 없음): Catalog 서비스의 항목 PK를 참조</li>
 *   <li>productName, unitPrice는 주문 시점 스냅샷: 카탈로그가 나중에 바뀌어도 주문 내용은 불변</li>
 *   <li>@Setter(AccessLevel.PACKAGE): setOrder()는 같은 패키지의 Order.addItem()에서만 호출</li>
 * </ul>
 */
@Entity
@Table(name = "order_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderItem {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "order_item_seq")
    @SequenceGenerator(name = "order_item_seq", sequenceName = "order_item_seq", allocationSize = 50)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id")
    @Setter(AccessLevel.PACKAGE)
    private Order order;

    @Column(nullable = false)
    private Long productId;

    @Column(nullable = false)
    private String productName;    // 주문 시점의 항목 이름 스냅샷

    @Column(nullable = false)
    private int quantity;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal unitPrice;  // 주문 시점의 가격 스냅샷

    @Builder
    public OrderItem(Long productId, String productName, int quantity, BigDecimal unitPrice) {
        this.productId = productId;
        this.productName = productName;
        this.quantity = quantity;
        this.unitPrice = unitPrice;
    }

    /** 소계 계산: 가격 x 수량 */
    public BigDecimal getSubtotal() {
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }
}
