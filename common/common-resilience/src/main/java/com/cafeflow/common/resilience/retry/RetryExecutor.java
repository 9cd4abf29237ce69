package com.cafeflow.common.resilience.retry;

import com.cafeflow.common.resilience.DependencyCallResult;
import com.cafeflow.common.resilience.DependencyOperation;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongUnaryOperator;

/**
 * 지수 백오프 + 지터 재시도 실행기 (Resilience4j Retry 기반)
 *
 * <h3>동작</h3>
 * <pre>
 * 성공                     → 즉시 반환 (재시도 없음)
 * 재시도 불가 종류          → 즉시 반환 (NOT_FOUND, INVALID_ARGUMENT, DEPENDENCY_UNAVAILABLE, INTERNAL)
 * 마지막 시도              → 마지막 실패를 그대로 반환 (failAfterMaxAttempts = false)
 * 그 외                    → min(maxDelay, baseDelay * 2^k) + jitter[0, delay/2) 대기 후 재시도
 * </pre>
 *
 * <p>실패는 예외가 아니라 {@link DependencyCallResult} 값이므로 {@code retryOnResult}로 판정하고,
 * 예외는 재시도하지 않는다.</p>
 *
 * <p>DEPENDENCY_UNAVAILABLE(서킷 OPEN)을 재시도하면 시도 횟수만 낭비하고 장애를 길게 만들므로
 * 기본 분류기에서 제외된다.</p>
 *
 * <p>Retry 인스턴스는 의존 서비스 이름으로 {@link RetryRegistry}에 등록되어
 * resilience4j_retry_calls 메트릭으로 노출된다. 같은 이름에 다른 정책이 들어오면 인스턴스를 교체한다.</p>
 *
 * ★ Exponential backoff with jitter; failure kind preserved on exhaustion
 */
@Slf4j
public class RetryExecutor {

    private final RetryRegistry retryRegistry;
    // bound(ms) → [0, bound) 범위의 지터(ms)
    private final LongUnaryOperator jitter;
    private final Map<String, Binding> bindings = new ConcurrentHashMap<>();

    public RetryExecutor(RetryRegistry retryRegistry) {
        this(retryRegistry, bound -> bound <= 0 ? 0 : ThreadLocalRandom.current().nextLong(bound));
    }

    public RetryExecutor(RetryRegistry retryRegistry, LongUnaryOperator jitter) {
        this.retryRegistry = retryRegistry;
        this.jitter = jitter;
    }

    public <T> DependencyCallResult<T> withRetry(String dependency, RetryPolicy policy,
                                                 DependencyOperation<T> operation) {
        if (policy.maxAttempts() == 1) {
            return operation.call();
        }
        Retry retry = retryFor(dependency, policy);
        return retry.executeSupplier(operation::call);
    }

    Duration delayBeforeRetry(RetryPolicy policy, int retryIndex) {
        long delayMillis = policy.backoffDelay(retryIndex).toMillis();
        return Duration.ofMillis(delayMillis + jitter.applyAsLong(delayMillis / 2));
    }

    private Retry retryFor(String dependency, RetryPolicy policy) {
        Binding current = bindings.get(dependency);
        if (current != null && current.policy().equals(policy)) {
            return current.retry();
        }
        return bindings.compute(dependency, (name, existing) -> {
            if (existing != null && existing.policy().equals(policy)) {
                return existing;
            }
            RetryConfig config = toConfig(policy);
            Retry retry;
            if (retryRegistry.find(name).isPresent()) {
                retry = Retry.of(name, config);
                retryRegistry.replace(name, retry);
            } else {
                retry = retryRegistry.retry(name, config);
            }
            retry.getEventPublisher().onRetry(event ->
                    log.debug("[{}] retrying after {} (attempt {}/{}), waiting {}ms",
                            name, failureOf(event.getLastThrowable()), event.getNumberOfRetryAttempts() + 1,
                            policy.maxAttempts(), event.getWaitInterval().toMillis()));
            return new Binding(policy, retry);
        }).retry();
    }

    private RetryConfig toConfig(RetryPolicy policy) {
        return RetryConfig.<DependencyCallResult<?>>custom()
                .maxAttempts(policy.maxAttempts())
                .retryOnResult(result -> result.isFailure() && policy.isRetryable(result.kind()))
                .retryOnException(throwable -> false)
                .intervalFunction(attempt -> delayBeforeRetry(policy, attempt - 1).toMillis())
                .failAfterMaxAttempts(false)
                .build();
    }

    private static String failureOf(Throwable throwable) {
        return throwable == null ? "failed result" : throwable.getClass().getSimpleName();
    }

    private record Binding(RetryPolicy policy, Retry retry) {
    }
}
