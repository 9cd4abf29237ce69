package com.cafeflow.gateway.controller;

import com.cafeflow.common.client.DependencyNames;
import com.cafeflow.common.client.order.OrdersClient;
import com.cafeflow.common.dto.ApiResponse;
import com.cafeflow.common.dto.CreateOrderRequest;
import com.cafeflow.common.dto.OrderView;
import com.cafeflow.gateway.route.GatewayRoutes;
import com.cafeflow.gateway.translation.GatewayResponseTranslator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * 주문 라우트
 *
 * <h3>Idempotency-Key 전파</h3>
 * <pre>
 * 1. 클라이언트가 Idempotency-Key를 보냈으면 그대로 order 서비스에 전달
 * 2. 없으면 게이트웨이가 UUID를 생성
 * 3. OrdersClient의 재시도는 모두 같은 키를 사용 → 주문 중복 생성 없음
 * </pre>
 */
@Slf4j
@RestController
@RequestMapping(GatewayRoutes.ORDERS)
@RequiredArgsConstructor
public class OrderGatewayController {

    private final OrdersClient ordersClient;
    private final GatewayResponseTranslator translator;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<OrderView> createOrder(
            @RequestHeader(value = GatewayRoutes.IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody CreateOrderRequest request) {
        String key = StringUtils.hasText(idempotencyKey) ? idempotencyKey : UUID.randomUUID().toString();
        log.debug("Forwarding order creation: userId={}, idempotencyKey={}", request.userId(), key);
        return ApiResponse.ok(translator.translate(DependencyNames.ORDERS, "createOrder",
                () -> ordersClient.createOrder(request, key)));
    }

    @GetMapping(GatewayRoutes.BY_ID)
    public ApiResponse<OrderView> getOrder(@PathVariable Long id) {
        return ApiResponse.ok(translator.translate(DependencyNames.ORDERS, "getOrder",
                () -> ordersClient.getOrder(id)));
    }
}
