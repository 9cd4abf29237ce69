package com.cafeflow.common.resilience;

import com.cafeflow.common.resilience.breaker.CircuitBreakerConfig;
import com.cafeflow.common.resilience.retry.RetryPolicy;

import java.time.Duration;

/**
 * 의존 서비스 하나에 적용되는 보호 정책 묶음 (데드라인 + 재시도 + 브레이커).
 */
public record DependencyPolicy(
        Duration timeout,
        RetryPolicy retryPolicy,
        CircuitBreakerConfig circuitBreakerConfig
) {
}
