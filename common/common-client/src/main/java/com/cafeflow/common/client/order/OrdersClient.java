package com.cafeflow.common.client.order;

import com.cafeflow.common.client.DependencyNames;
import com.cafeflow.common.client.transport.BackendInvoker;
import com.cafeflow.common.dto.CreateOrderRequest;
import com.cafeflow.common.dto.OrderView;
import com.cafeflow.common.resilience.DependencyCallResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Order 서비스 어댑터
 *
 * <h3>재시도와 멱등성</h3>
 * 주문 생성도 타임아웃/연결 실패 시 재시도된다. 시도마다 같은 Idempotency-Key를
 * 보내므로 첫 시도가 실제로는 저장되었더라도 주문이 중복 생성되지 않는다.
 */
@Component
@RequiredArgsConstructor
public class OrdersClient {

    private final OrdersFeignClient ordersFeignClient;
    private final BackendInvoker backendInvoker;

    public DependencyCallResult<OrderView> createOrder(CreateOrderRequest request, String idempotencyKey) {
        return backendInvoker.invoke(DependencyNames.ORDERS,
                baseUri -> ordersFeignClient.createOrder(baseUri, idempotencyKey, request));
    }

    public DependencyCallResult<OrderView> getOrder(Long orderId) {
        return backendInvoker.invoke(DependencyNames.ORDERS,
                baseUri -> ordersFeignClient.getOrder(baseUri, orderId));
    }
}
