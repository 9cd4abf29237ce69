package com.cafeflow.order.store;

import com.cafeflow.order.entity.Order;

import java.util.List;
import java.util.Optional;

/**
 * 주문 저장소 협력자
 *
 * <p>워크플로와 서비스는 이 인터페이스만 알고, JPA 구현은 {@link JpaOrderStore}에 있다.
 * 조회 메서드는 항목까지 모두 로딩된 주문을 반환한다.</p>
 */
public interface OrderStore {

    /** 주문과 모든 항목을 한 트랜잭션으로 저장. 실패하면 아무것도 남지 않는다. */
    Order save(Order order);

    Optional<Order> findById(Long orderId);

    Optional<Order> findByIdempotencyKey(String idempotencyKey);

    List<Order> findByUserId(Long userId);
}
