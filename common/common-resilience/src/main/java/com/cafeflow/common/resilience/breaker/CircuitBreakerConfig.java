package com.cafeflow.common.resilience.breaker;

import lombok.Builder;
import lombok.Getter;

import java.time.Duration;

/**
 * 의존 서비스별 서킷 브레이커 설정 (불변)
 *
 * <ul>
 *   <li>failureThreshold: CLOSED 상태에서 연속 실패 몇 번이면 OPEN으로 전환할지</li>
 *   <li>successThreshold: HALF_OPEN 상태에서 연속 성공 몇 번이면 CLOSED로 복귀할지</li>
 *   <li>resetTimeout: OPEN 이후 HALF_OPEN 시험 호출을 허용하기까지의 대기 시간</li>
 * </ul>
 */
@Getter
@Builder
public class CircuitBreakerConfig {

    @Builder.Default
    private final int failureThreshold = 5;

    @Builder.Default
    private final int successThreshold = 2;

    @Builder.Default
    private final Duration resetTimeout = Duration.ofSeconds(30);

    public static CircuitBreakerConfig defaultConfig() {
        return CircuitBreakerConfig.builder().build();
    }

    void validate() {
        if (failureThreshold < 1 || successThreshold < 1) {
            throw new IllegalArgumentException("Circuit breaker thresholds must be >= 1");
        }
        if (resetTimeout == null || resetTimeout.isNegative()) {
            throw new IllegalArgumentException("resetTimeout must be non-negative");
        }
    }
}
