package com.cafeflow.order.service;

import com.cafeflow.common.dto.CreateOrderRequest;
import com.cafeflow.common.dto.OrderView;
import com.cafeflow.common.exception.BusinessException;
import com.cafeflow.common.exception.ErrorCode;
import com.cafeflow.common.resilience.DependencyCallResult;
import com.cafeflow.common.resilience.FailureKind;
import com.cafeflow.order.dto.OrderViewMapper;
import com.cafeflow.order.entity.Order;
import com.cafeflow.order.store.OrderStore;
import com.cafeflow.order.workflow.OrderCreationWorkflowFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * 주문 서비스
 *
 * <h3>역할</h3>
 * 주문 생성/조회 유스케이스. 생성은 {@link com.cafeflow.order.workflow.OrderCreationWorkflow}에 위임하고,
 * 워크플로가 돌려준 실패 종류를 {@link BusinessException}으로 바꿔 컨트롤러 경계로 던진다.
 *
 * <h3>Idempotency-Key 처리</h3>
 * <pre>
 * 1. 같은 키로 저장된 주문이 있으면 워크플로를 실행하지 않고 그 주문을 반환
 * 2. 없으면 워크플로 실행 (키는 주문과 함께 저장, 유니크 제약)
 * 3. 동시에 같은 키로 들어온 두 요청 중 늦은 쪽은 저장 단계에서 제약 위반으로 실패
 *    → 먼저 저장된 주문을 다시 조회해서 반환
 * </pre>
 *
 * <p>원격 호출이 포함된 워크플로 전체를 DB 트랜잭션으로 감싸지 않는다.
 * 트랜잭션 경계는 OrderStore.save 한 번뿐이다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderService {

    private final OrderStore orderStore;
    private final OrderCreationWorkflowFactory workflowFactory;

    public OrderView createOrder(CreateOrderRequest request, String idempotencyKey) {
        if (idempotencyKey != null) {
            Optional<Order> existing = orderStore.findByIdempotencyKey(idempotencyKey);
            if (existing.isPresent()) {
                log.info("Replaying order for idempotency key {}: orderId={}",
                        idempotencyKey, existing.get().getId());
                return OrderViewMapper.toView(existing.get());
            }
        }

        DependencyCallResult<Order> result = workflowFactory.create().execute(request, idempotencyKey);
        if (result.isSuccess()) {
            return OrderViewMapper.toView(result.payload());
        }

        // 동시 요청 경합: 같은 키의 주문이 먼저 저장되었는지 확인
        if (result.kind() == FailureKind.INTERNAL && idempotencyKey != null) {
            Optional<Order> raced = orderStore.findByIdempotencyKey(idempotencyKey);
            if (raced.isPresent()) {
                log.info("Concurrent request with idempotency key {} already stored orderId={}",
                        idempotencyKey, raced.get().getId());
                return OrderViewMapper.toView(raced.get());
            }
        }
        throw BusinessException.of(result.kind(), result.message());
    }

    public OrderView getOrder(Long orderId) {
        return orderStore.findById(orderId)
                .map(OrderViewMapper::toView)
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));
    }

    public List<OrderView> getOrdersByUser(Long userId) {
        return orderStore.findByUserId(userId).stream()
                .map(OrderViewMapper::toView)
                .toList();
    }
}
