package com.cafeflow.order;

import com.cafeflow.common.client.catalog.CatalogFeignClient;
import com.cafeflow.common.client.user.UsersFeignClient;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cloud.openfeign.EnableFeignClients;

/**
 * CafeFlow Order Service - 주문 집계 서비스 진입점
 *
 * <h3>역할</h3>
 * 주문 생성 시 Users 서비스로 사용자를 검증하고 Catalog 서비스로 항목 가격을 확정한 뒤 저장한다.
 *
 * <h3>scanBasePackages 설명</h3>
 * <ul>
 *   <li>com.cafeflow.order - Order 서비스 자체 패키지</li>
 *   <li>com.cafeflow.common.exception - 공통 예외 처리 (GlobalExceptionHandler)</li>
 *   <li>com.cafeflow.common.resilience - 타임아웃/재시도/서킷 브레이커, 메트릭</li>
 *   <li>com.cafeflow.common.client.{discovery, transport, user, catalog} - 필요한 어댑터만
 *       (Orders 어댑터는 게이트웨이 전용)</li>
 * </ul>
 *
 * <h3>포트</h3>
 * Order Service: 8081
 */
@SpringBootApplication(scanBasePackages = {
        "com.cafeflow.order",
        "com.cafeflow.common.exception",
        "com.cafeflow.common.resilience",
        "com.cafeflow.common.client.discovery",
        "com.cafeflow.common.client.transport",
        "com.cafeflow.common.client.user",
        "com.cafeflow.common.client.catalog"
})
@EnableFeignClients(clients = {UsersFeignClient.class, CatalogFeignClient.class})
public class OrderServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrderServiceApplication.class, args);
    }
}
