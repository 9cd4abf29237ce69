package com.cafeflow.order.controller;

import com.cafeflow.common.dto.ApiResponse;
import com.cafeflow.common.dto.CreateOrderRequest;
import com.cafeflow.common.dto.OrderView;
import com.cafeflow.order.service.OrderService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 주문 REST API 컨트롤러 (order 백엔드)
 *
 * <h3>엔드포인트</h3>
 * <pre>
 * POST /api/orders             주문 생성 (201), Idempotency-Key 헤더 선택
 * GET  /api/orders/{id}        주문 단건 조회 (없으면 404)
 * GET  /api/orders?userId=     사용자의 주문 목록
 * </pre>
 *
 * <p>실패는 GlobalExceptionHandler가 ProblemDetail로 변환한다.</p>
 */
@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<OrderView> createOrder(
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey,
            @Valid @RequestBody CreateOrderRequest request) {
        return ApiResponse.ok(orderService.createOrder(request, idempotencyKey));
    }

    @GetMapping("/{id}")
    public ApiResponse<OrderView> getOrder(@PathVariable Long id) {
        return ApiResponse.ok(orderService.getOrder(id));
    }

    @GetMapping
    public ApiResponse<List<OrderView>> getOrdersByUser(@RequestParam Long userId) {
        return ApiResponse.ok(orderService.getOrdersByUser(userId));
    }
}
