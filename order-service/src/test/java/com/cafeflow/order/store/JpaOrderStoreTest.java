package com.cafeflow.order.store;

import com.cafeflow.order.entity.Order;
import com.cafeflow.order.entity.OrderItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(JpaOrderStore.class)
class JpaOrderStoreTest {

    @Autowired
    private OrderStore orderStore;

    private static Order order(Long userId, String key, BigDecimal price) {
        Order order = Order.builder().userId(userId).idempotencyKey(key).build();
        order.addItem(OrderItem.builder()
                .productId(10L).productName("Latte").quantity(2).unitPrice(price)
                .build());
        return order;
    }

    @Test
    @DisplayName("저장 시 ID, 생성 시각, 항목이 함께 저장된다")
    void savesOrderWithItems() {
        Order saved = orderStore.save(order(1L, "k1", new BigDecimal("4.50")));

        assertThat(saved.getId()).isNotNull();
        assertThat(saved.getCreatedAt()).isNotNull();
        assertThat(orderStore.findById(saved.getId())).get()
                .satisfies(found -> {
                    assertThat(found.getItems()).hasSize(1);
                    assertThat(found.getTotalAmount()).isEqualByComparingTo("9.00");
                });
    }

    @Test
    @DisplayName("Idempotency-Key로 조회")
    void findsByIdempotencyKey() {
        Order saved = orderStore.save(order(1L, "k2", new BigDecimal("4.50")));

        assertThat(orderStore.findByIdempotencyKey("k2")).get()
                .extracting(Order::getId).isEqualTo(saved.getId());
        assertThat(orderStore.findByIdempotencyKey("unknown")).isEmpty();
    }

    @Test
    @DisplayName("같은 Idempotency-Key 두 번 저장 → 유니크 제약 위반")
    void rejectsDuplicateKey() {
        orderStore.save(order(1L, "dup", new BigDecimal("4.50")));

        assertThatThrownBy(() -> orderStore.save(order(2L, "dup", new BigDecimal("3.00"))))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("키 없는 주문은 여러 건 저장 가능, 사용자별 최신순 조회")
    void findsByUserNewestFirst() {
        Order first = orderStore.save(order(5L, null, new BigDecimal("4.50")));
        Order second = orderStore.save(order(5L, null, new BigDecimal("3.00")));
        orderStore.save(order(6L, null, new BigDecimal("1.00")));

        List<Order> orders = orderStore.findByUserId(5L);

        assertThat(orders).extracting(Order::getId).containsExactly(second.getId(), first.getId());
    }
}
