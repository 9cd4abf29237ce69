package com.cafeflow.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cloud.openfeign.EnableFeignClients;

/**
 * CafeFlow Gateway Service - API Gateway 진입점
 *
 * <h3>역할</h3>
 * 모든 클라이언트 요청의 단일 진입점. 외부 JSON/HTTP 요청을 백엔드 호출로 변환하고,
 * 백엔드 호출마다 타임아웃, 재시도, 서킷 브레이커를 적용한다.
 *
 * <h3>요청 처리 흐름</h3>
 * <pre>
 * Client → Controller (라우팅)
 *        → GatewayResponseTranslator
 *        → Users / Catalog / Orders 어댑터 (breaker → retry → timeout → Feign)
 *        ← 성공: ApiResponse / 실패: ProblemDetail (GlobalExceptionHandler)
 * </pre>
 *
 * <h3>포트</h3>
 * Gateway: 8080 (모든 외부 요청은 여기로 진입)
 */
@SpringBootApplication(scanBasePackages = {
        "com.cafeflow.gateway",
        "com.cafeflow.common.exception",
        "com.cafeflow.common.resilience",
        "com.cafeflow.common.client"
})
@EnableFeignClients(basePackages = "com.cafeflow.common.client")
public class GatewayServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(GatewayServiceApplication.class, args);
    }
}
