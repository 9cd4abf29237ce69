package com.cafeflow.order.repository;

import com.cafeflow.order.entity.Order;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;

/**
 * 주문 저장소 - Order 엔티티의 데이터 액세스 계층
 *
 * <h3>Fetch Join 쿼리</h3>
 * <pre>
 * 일반 findById()는 Order만 조회하고, items는 Lazy Loading으로 별도 쿼리가 실행된다.
 * *WithItems* 쿼리는 LEFT JOIN FETCH로 Order + OrderItem을 한 번의 쿼리로 조회한다.
 * → N+1 문제 방지
 * </pre>
 */
public interface OrderRepository extends JpaRepository<Order, Long> {

    @Query("SELECT o FROM Order o LEFT JOIN FETCH o.items WHERE o.id = :id")
    Optional<Order> findWithItemsById(Long id);

    @Query("SELECT o FROM Order o LEFT JOIN FETCH o.items WHERE o.idempotencyKey = :idempotencyKey")
    Optional<Order> findWithItemsByIdempotencyKey(String idempotencyKey);

    @Query("SELECT DISTINCT o FROM Order o LEFT JOIN FETCH o.items WHERE o.userId = :userId ORDER BY o.id DESC")
    List<Order> findAllWithItemsByUserId(Long userId);
}
