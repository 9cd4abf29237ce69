package com.cafeflow.common.client.order;

import com.cafeflow.common.dto.ApiResponse;
import com.cafeflow.common.dto.CreateOrderRequest;
import com.cafeflow.common.dto.OrderView;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;

import java.net.URI;

/**
 * Order 서비스 Feign 클라이언트 (게이트웨이 전용)
 */
@FeignClient(name = "orders", url = "http://discovery-resolved")
public interface OrdersFeignClient {

    /** 주문 생성. 같은 Idempotency-Key의 재전송은 최초 주문을 그대로 돌려받는다. */
    @PostMapping("/api/orders")
    ApiResponse<OrderView> createOrder(URI baseUri,
                                       @RequestHeader("Idempotency-Key") String idempotencyKey,
                                       @RequestBody CreateOrderRequest request);

    @GetMapping("/api/orders/{id}")
    ApiResponse<OrderView> getOrder(URI baseUri, @PathVariable("id") Long id);
}
