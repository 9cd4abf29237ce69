package com.cafeflow.common.client.order;

import com.cafeflow.common.client.ResilienceFixture;
import com.cafeflow.common.client.discovery.ServiceDiscovery;
import com.cafeflow.common.dto.ApiResponse;
import com.cafeflow.common.dto.CreateOrderRequest;
import com.cafeflow.common.dto.OrderLineRequest;
import com.cafeflow.common.dto.OrderView;
import com.cafeflow.common.resilience.DependencyCallResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.net.ConnectException;
import java.net.URI;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class OrdersClientTest {

    private static final URI ORDERS_URI = URI.create("http://orders:8081");

    @Mock
    private OrdersFeignClient ordersFeignClient;
    @Mock
    private ServiceDiscovery serviceDiscovery;

    private ResilienceFixture fixture;
    private OrdersClient ordersClient;

    @BeforeEach
    void setUp() {
        fixture = new ResilienceFixture(serviceDiscovery);
        ordersClient = new OrdersClient(ordersFeignClient, fixture.invoker());
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    @DisplayName("주문 생성 재시도는 모든 시도에 같은 Idempotency-Key를 전달")
    void createOrder_RetriesWithSameKey() {
        // Given
        CreateOrderRequest request = new CreateOrderRequest(1L, List.of(new OrderLineRequest(10L, 2)));
        OrderView created = new OrderView(100L, 1L, "CREATED", new BigDecimal("9.00"), List.of(),
                LocalDateTime.of(2024, 1, 1, 12, 0));
        given(serviceDiscovery.resolve("orders")).willReturn(ORDERS_URI);
        given(ordersFeignClient.createOrder(ORDERS_URI, "key-1", request))
                .willThrow(new UncheckedIOException(new ConnectException("Connection refused")))
                .willReturn(ApiResponse.ok(created));

        // When
        DependencyCallResult<OrderView> result = ordersClient.createOrder(request, "key-1");

        // Then
        assertThat(result.payload().id()).isEqualTo(100L);
        verify(ordersFeignClient, times(2)).createOrder(ORDERS_URI, "key-1", request);
    }
}
