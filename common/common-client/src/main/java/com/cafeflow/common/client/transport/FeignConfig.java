package com.cafeflow.common.client.transport;

import feign.Request;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Feign 클라이언트 소켓 타임아웃 설정
 *
 * <h3>역할</h3>
 * 서비스 간 HTTP 통신(OpenFeign)의 연결/읽기 타임아웃을 설정한다.
 * 호출 1회의 데드라인은 TimeoutExecutor가 책임지고, 여기 값은 그보다 길게 두어
 * 데드라인을 넘긴 전송 스레드가 소켓에 무한정 묶이지 않게 하는 안전망 역할만 한다.
 *
 * <h3>타임아웃 계층</h3>
 * <pre>
 * Gateway → orders 호출:   cafeflow.resilience.dependencies.orders.timeout
 *   └─ Order → users/catalog: 의존 서비스별 timeout (시도 1회 단위)
 *       └─ Feign:             2s connect + 10s read (가장 안쪽, 소켓 수준)
 * </pre>
 */
@Configuration
public class FeignConfig {

    @Bean
    public Request.Options feignRequestOptions() {
        return new Request.Options(
                2, TimeUnit.SECONDS,    // connectTimeout: TCP 연결 수립 제한 시간
                10, TimeUnit.SECONDS,   // readTimeout: 응답 대기 제한 시간
                false                   // followRedirects: 백엔드 간 호출은 리다이렉트 없음
        );
    }
}
