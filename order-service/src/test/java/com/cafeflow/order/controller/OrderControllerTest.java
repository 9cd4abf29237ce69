package com.cafeflow.order.controller;

import com.cafeflow.common.dto.CreateOrderRequest;
import com.cafeflow.common.dto.OrderLineView;
import com.cafeflow.common.dto.OrderView;
import com.cafeflow.common.exception.BusinessException;
import com.cafeflow.common.exception.ErrorCode;
import com.cafeflow.common.exception.GlobalExceptionHandler;
import com.cafeflow.common.resilience.FailureKind;
import com.cafeflow.order.service.OrderService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class OrderControllerTest {

    @Mock
    private OrderService orderService;

    private MockMvc mockMvc;

    private static final OrderView VIEW = new OrderView(7L, 1L, "CREATED", new BigDecimal("9.00"),
            List.of(new OrderLineView(10L, "Latte", 2, new BigDecimal("4.50"), new BigDecimal("9.00"))),
            null);

    private static final String BODY = "{\"userId\":1,\"items\":[{\"productId\":10,\"quantity\":2}]}";

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new OrderController(orderService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("POST /api/orders → 201, Idempotency-Key 전달")
    void createOrder() throws Exception {
        given(orderService.createOrder(any(CreateOrderRequest.class), eq("key-1"))).willReturn(VIEW);

        mockMvc.perform(post("/api/orders")
                        .header("Idempotency-Key", "key-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.id").value(7))
                .andExpect(jsonPath("$.data.items[0].productName").value("Latte"));
    }

    @Test
    @DisplayName("Idempotency-Key 없이도 생성 가능")
    void createOrderWithoutKey() throws Exception {
        given(orderService.createOrder(any(CreateOrderRequest.class), isNull())).willReturn(VIEW);

        mockMvc.perform(post("/api/orders").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isCreated());
    }

    @Test
    @DisplayName("수량 0 → 400, 서비스 호출 없음")
    void rejectsNonPositiveQuantity() throws Exception {
        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":1,\"items\":[{\"productId\":10,\"quantity\":0}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("quantity must be at least 1"));

        verifyNoInteractions(orderService);
    }

    @Test
    @DisplayName("의존 서비스 장애 → 503 ProblemDetail")
    void dependencyOutageIs503() throws Exception {
        given(orderService.createOrder(any(CreateOrderRequest.class), any()))
                .willThrow(BusinessException.of(FailureKind.UNAVAILABLE, "catalog circuit open"));

        mockMvc.perform(post("/api/orders").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.detail").value(ErrorCode.SERVICE_UNAVAILABLE.getMessage()));
    }

    @Test
    @DisplayName("GET /api/orders/{id} 없는 주문 → 404")
    void missingOrderIs404() throws Exception {
        given(orderService.getOrder(99L)).willThrow(new BusinessException(ErrorCode.ORDER_NOT_FOUND));

        mockMvc.perform(get("/api/orders/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.type").value("https://cafeflow.dev/errors/order_not_found"));
    }

    @Test
    @DisplayName("GET /api/orders?userId= → 목록")
    void ordersByUser() throws Exception {
        given(orderService.getOrdersByUser(1L)).willReturn(List.of(VIEW));

        mockMvc.perform(get("/api/orders").param("userId", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].id").value(7));
    }
}
