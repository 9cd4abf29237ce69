package com.cafeflow.gateway.controller;

import com.cafeflow.common.client.order.OrdersClient;
import com.cafeflow.common.dto.CreateOrderRequest;
import com.cafeflow.common.dto.OrderView;
import com.cafeflow.common.resilience.DependencyCallResult;
import com.cafeflow.common.resilience.FailureKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class OrderGatewayControllerTest {

    @Mock
    private OrdersClient ordersClient;

    private MockMvc mockMvc;

    private static final String BODY = "{\"userId\":1,\"items\":[{\"productId\":10,\"quantity\":2}]}";
    private static final OrderView VIEW =
            new OrderView(7L, 1L, "CREATED", new BigDecimal("9.00"), List.of(), null);

    @BeforeEach
    void setUp() {
        mockMvc = GatewayControllerTestSupport.mockMvc(
                new OrderGatewayController(ordersClient, GatewayControllerTestSupport.translator()));
    }

    @Test
    @DisplayName("클라이언트가 보낸 Idempotency-Key를 그대로 전달")
    void forwardsClientKey() throws Exception {
        given(ordersClient.createOrder(any(CreateOrderRequest.class), eq("client-key")))
                .willReturn(DependencyCallResult.success(VIEW));

        mockMvc.perform(post("/api/orders")
                        .header("Idempotency-Key", "client-key")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.id").value(7));
    }

    @Test
    @DisplayName("키가 없으면 게이트웨이가 UUID 키를 만들어 전달")
    void generatesKeyWhenAbsent() throws Exception {
        given(ordersClient.createOrder(any(CreateOrderRequest.class), anyString()))
                .willReturn(DependencyCallResult.success(VIEW));

        mockMvc.perform(post("/api/orders").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isCreated());

        ArgumentCaptor<String> key = ArgumentCaptor.forClass(String.class);
        verify(ordersClient).createOrder(any(CreateOrderRequest.class), key.capture());
        assertThat(UUID.fromString(key.getValue())).isNotNull();
    }

    @Test
    @DisplayName("주문 서비스가 잘못된 입력으로 거절 → 400, 상세 메시지 전달")
    void rejectedOrderIs400() throws Exception {
        given(ordersClient.createOrder(any(CreateOrderRequest.class), anyString()))
                .willReturn(DependencyCallResult.failure(FailureKind.INVALID_ARGUMENT, "User 1 does not exist"));

        mockMvc.perform(post("/api/orders").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("User 1 does not exist"));
    }

    @Test
    @DisplayName("주문 서비스 장애 → 503")
    void ordersOutageIs503() throws Exception {
        given(ordersClient.createOrder(any(CreateOrderRequest.class), anyString()))
                .willReturn(DependencyCallResult.failure(FailureKind.UNAVAILABLE, "orders unavailable"));

        mockMvc.perform(post("/api/orders").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    @DisplayName("빈 항목 목록 → 게이트웨이에서 400, 다운스트림 호출 없음")
    void validatesBeforeForwarding() throws Exception {
        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":1,\"items\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("items must not be empty"));

        verifyNoInteractions(ordersClient);
    }

    @Test
    @DisplayName("GET /api/orders/{id} 없는 주문 → 404")
    void missingOrder() throws Exception {
        given(ordersClient.getOrder(99L))
                .willReturn(DependencyCallResult.failure(FailureKind.NOT_FOUND, "Order not found"));

        mockMvc.perform(get("/api/orders/99"))
                .andExpect(status().isNotFound());
    }
}
