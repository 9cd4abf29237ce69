package com.cafeflow.common.resilience;

import com.cafeflow.common.resilience.breaker.CircuitBreaker;
import com.cafeflow.common.resilience.breaker.CircuitBreakerRegistry;
import com.cafeflow.common.resilience.retry.RetryExecutor;
import com.cafeflow.common.resilience.timeout.TimeoutExecutor;

import java.util.function.Function;

/**
 * 타임아웃 + 재시도 + 서킷 브레이커 조합 실행기
 *
 * <h3>조합 순서 (바깥 → 안쪽)</h3>
 * <pre>
 * CircuitBreaker          (가장 바깥: 재시도 루프 전체를 호출 1건으로 집계)
 *   └─ Retry              (중간: 일시적 장애만 지수 백오프로 재시도)
 *       └─ Timeout        (가장 안쪽: 시도 1회마다 데드라인 적용)
 *           └─ 실제 전송 호출
 * </pre>
 *
 * <p>재시도 시도마다 브레이커 실패를 세면 논리적 호출 하나의 재시도만으로
 * 브레이커가 조기에 열린다. 그래서 브레이커는 재시도를 다 소진한 최종 결과만 기록한다.</p>
 *
 * ★ breaker(retry(timeout(op))): one exhausted retry sequence = one breaker outcome
 */
public class ResilientCallExecutor {

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RetryExecutor retryExecutor;
    private final TimeoutExecutor timeoutExecutor;
    private final Function<String, DependencyPolicy> policyLookup;

    public ResilientCallExecutor(CircuitBreakerRegistry circuitBreakerRegistry,
                                 RetryExecutor retryExecutor,
                                 TimeoutExecutor timeoutExecutor,
                                 Function<String, DependencyPolicy> policyLookup) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.retryExecutor = retryExecutor;
        this.timeoutExecutor = timeoutExecutor;
        this.policyLookup = policyLookup;
    }

    public <T> DependencyCallResult<T> call(String dependency, DependencyOperation<T> operation) {
        DependencyPolicy policy = policyLookup.apply(dependency);
        CircuitBreaker breaker = circuitBreakerRegistry.breakerFor(dependency);

        return breaker.call(() -> retryExecutor.withRetry(dependency, policy.retryPolicy(),
                () -> timeoutExecutor.withTimeout(dependency, policy.timeout(), operation)));
    }

    public CircuitBreakerRegistry getCircuitBreakerRegistry() {
        return circuitBreakerRegistry;
    }
}
