package com.cafeflow.order.store;

import com.cafeflow.order.entity.Order;
import com.cafeflow.order.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Transactional(readOnly = true)  // 기본 읽기 전용 (더티 체킹 비활성화)
public class JpaOrderStore implements OrderStore {

    private final OrderRepository orderRepository;

    @Override
    @Transactional
    public Order save(Order order) {
        // flush로 제약 조건 위반을 트랜잭션 안에서 드러낸다
        return orderRepository.saveAndFlush(order);
    }

    @Override
    public Optional<Order> findById(Long orderId) {
        return orderRepository.findWithItemsById(orderId);
    }

    @Override
    public Optional<Order> findByIdempotencyKey(String idempotencyKey) {
        return orderRepository.findWithItemsByIdempotencyKey(idempotencyKey);
    }

    @Override
    public List<Order> findByUserId(Long userId) {
        return orderRepository.findAllWithItemsByUserId(userId);
    }
}
