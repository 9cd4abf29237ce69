package com.cafeflow.order.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 주문(Order) 엔티티 - 주문 도메인의 애그리거트 루트(Aggregate Root)
 *
 * <h3>역할</h3>
 * 하나의 주문과 주문 항목(OrderItem) 컬렉션을 관리한다.
 * 항목 추가 시 합계를 다시 계산하여 totalAmount의 일관성을 보장한다.
 *
 * <h3>설계 포인트</h3>
 * <ul>
 *   <li>userId만 저장 (FK 없음): Users 서비스의 사용자 PK를 참조</li>
 *   <li>idempotencyKey 유니크 제약: 같은 키로 주문이 두 번 저장되지 않음</li>
 *   <li>SEQUENCE 전략 + allocationSize=50: ID 채번 최적화 (DB 왕복 감소)</li>
 *   <li>CascadeType.ALL + orphanRemoval: OrderItem 생명주기를 Order가 관리</li>
 * </ul>
 */
@Entity
@Table(name = "orders", indexes = {
        @Index(name = "idx_order_user_id", columnList = "userId"),
        @Index(name = "idx_order_idempotency_key", columnList = "idempotencyKey", unique = true)
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)  // JPA 프록시 생성용 기본 생성자 (외부 사용 금지)
@EntityListeners(AuditingEntityListener.class)       // @CreatedDate 자동 설정을 위한 리스너
public class Order {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "order_seq")
    @SequenceGenerator(name = "order_seq", sequenceName = "order_seq", allocationSize = 50)
    private Long id;

    @Version
    private Long version;

    @Column(nullable = false)
    private Long userId;     // 주문자 ID (Users 서비스의 사용자 PK 참조, FK 없음)

    // 클라이언트(또는 게이트웨이)가 보낸 Idempotency-Key. 없으면 null
    @Column(unique = true, length = 100)
    private String idempotencyKey;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<OrderItem> items = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private OrderStatus status;

    // 주문 총액 (OrderItem 추가 시 자동 재계산)
    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal totalAmount;

    @CreatedDate
    private LocalDateTime createdAt;   // 주문 생성 시각 (JPA Auditing 자동 설정)

    @Builder
    public Order(Long userId, String idempotencyKey) {
        this.userId = userId;
        this.idempotencyKey = idempotencyKey;
        this.status = OrderStatus.CREATED;
        this.totalAmount = BigDecimal.ZERO;       // 아이템 추가 시 재계산
    }

    /** 주문 항목 추가 및 양방향 관계 설정 + 총액 재계산 */
    public void addItem(OrderItem item) {
        items.add(item);
        item.setOrder(this);
        recalculateTotal();
    }

    private void recalculateTotal() {
        this.totalAmount = items.stream()
                .map(OrderItem::getSubtotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Order that)) return false;
        return id != null && id.equals(that.getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
