package com.cafeflow.gateway.translation;

import com.cafeflow.common.resilience.DependencyCallResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 게이트웨이 호출 로그
 *
 * <p>외부 요청 1건마다 의존 서비스 이름, 결과 종류, 지연 시간을 한 줄로 남긴다.
 * 클라이언트 오류(NOT_FOUND, INVALID_ARGUMENT)는 INFO, 장애성 실패는 WARN.</p>
 *
 * <pre>
 *   gateway call: dependency=users, operation=getUser, outcome=OK, latency=12ms
 *   gateway call: dependency=orders, operation=createOrder, outcome=DEPENDENCY_UNAVAILABLE, latency=0ms
 * </pre>
 */
@Slf4j
@Component
public class GatewayCallLogger {

    static final String OK = "OK";

    public void record(String dependency, String operation, DependencyCallResult<?> result, Duration latency) {
        String outcome = result.isSuccess() ? OK : result.kind().name();
        long latencyMs = latency.toMillis();
        if (result.isSuccess() || result.kind().isClientError()) {
            log.info("gateway call: dependency={}, operation={}, outcome={}, latency={}ms",
                    dependency, operation, outcome, latencyMs);
        } else {
            log.warn("gateway call: dependency={}, operation={}, outcome={}, latency={}ms, message={}",
                    dependency, operation, outcome, latencyMs, result.message());
        }
    }
}
