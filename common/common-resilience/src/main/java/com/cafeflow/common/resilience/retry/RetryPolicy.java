package com.cafeflow.common.resilience.retry;

import com.cafeflow.common.resilience.FailureKind;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * 재시도 정책 (불변 설정 값)
 *
 * <p>k번째 재시도(0부터 시작) 전 대기 시간 = {@code min(maxDelay, baseDelay * 2^k)} + 지터.
 * 지터는 {@link RetryExecutor}가 {@code [0, delay/2)} 범위에서 더한다.</p>
 *
 * @param maxAttempts         최초 시도를 포함한 최대 시도 횟수 (1 = 재시도 없음)
 * @param baseDelay           첫 재시도 전 기본 대기 시간
 * @param maxDelay            대기 시간 상한 (지터 적용 전)
 * @param retryableClassifier 재시도 가능한 실패 종류 판별
 */
public record RetryPolicy(
        int maxAttempts,
        Duration baseDelay,
        Duration maxDelay,
        Predicate<FailureKind> retryableClassifier
) {

    /** TIMEOUT, CONNECTION_REFUSED, UNAVAILABLE만 재시도 */
    public static final Predicate<FailureKind> TRANSIENT_ONLY = FailureKind::isTransient;

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Retry delays must be non-negative");
        }
    }

    public static RetryPolicy of(int maxAttempts, Duration baseDelay, Duration maxDelay) {
        return new RetryPolicy(maxAttempts, baseDelay, maxDelay, TRANSIENT_ONLY);
    }

    public static RetryPolicy noRetry() {
        return of(1, Duration.ZERO, Duration.ZERO);
    }

    public boolean isRetryable(FailureKind kind) {
        return retryableClassifier.test(kind);
    }

    /**
     * k번째 재시도 전 대기 시간 (지터 적용 전).
     * 2^k 계산이 넘치면 maxDelay로 고정한다.
     */
    public Duration backoffDelay(int retryIndex) {
        long baseMillis = baseDelay.toMillis();
        long maxMillis = maxDelay.toMillis();
        if (retryIndex >= 62 || baseMillis > (maxMillis >> Math.min(retryIndex, 62))) {
            return maxDelay;
        }
        return Duration.ofMillis(Math.min(maxMillis, baseMillis << retryIndex));
    }
}
