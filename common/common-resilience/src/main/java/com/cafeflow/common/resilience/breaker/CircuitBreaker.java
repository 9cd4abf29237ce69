package com.cafeflow.common.resilience.breaker;

import com.cafeflow.common.resilience.DependencyCallResult;
import com.cafeflow.common.resilience.DependencyOperation;
import com.cafeflow.common.resilience.FailureKind;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 연속 실패 기반 서킷 브레이커 - 의존 서비스 하나당 인스턴스 하나
 *
 * <h3>역할</h3>
 * 장애가 난 의존 서비스를 일정 시간 호출하지 않아(Fail-Fast) 장애 전파와
 * 재시도 폭주를 막는다. 여러 요청 스레드가 같은 인스턴스를 공유하므로
 * 상태 변경은 모두 {@link ReentrantLock} 안에서 일어난다.
 *
 * <h3>호출 한 번의 임계 구역</h3>
 * <pre>
 * 1. [lock]   상태 확인 (OPEN이면 resetTimeout 경과 여부로 HALF_OPEN 전환 또는 즉시 실패)
 * 2. [unlock] 실제 호출 실행 (락 밖에서 실행 → 느린 호출이 다른 요청을 막지 않음)
 * 3. [lock]   결과 기록 (연속 성공/실패 카운터, 상태 전이)
 * </pre>
 *
 * <h3>세대(generation)</h3>
 * 상태가 바뀔 때마다 세대 번호가 올라간다. 호출은 허용된 시점의 세대를 기억하고,
 * 결과 기록 시 세대가 달라졌으면 그 결과는 버린다.
 * 예: CLOSED에서 시작한 느린 호출이 OPEN → HALF_OPEN 이후에 성공해도 시험 호출 성공으로 세지 않는다.
 *
 * <h3>집계 규칙</h3>
 * NOT_FOUND / INVALID_ARGUMENT는 의존 서비스가 정상적으로 "아니오"라고 답한 것이므로
 * 성공으로 집계한다. 그 외 모든 실패 종류는 실패로 집계한다.
 *
 * <h3>Retry와의 조합</h3>
 * 브레이커는 재시도 루프 전체를 하나의 호출로 감싼다.
 * 재시도를 다 소진한 논리적 호출 1건 = 실패 1건 (재시도 시도마다 집계하지 않음).
 *
 * ★ Consecutive-failure circuit breaker (CLOSED / OPEN / HALF_OPEN)
 */
@Slf4j
public class CircuitBreaker {

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private static final long REJECTED = -1;

    private final ReentrantLock lock = new ReentrantLock();

    // ── 아래 필드는 모두 lock으로 보호 ──
    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    private Instant openedAt;
    private long generation;

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        config.validate();
        this.name = name;
        this.config = config;
        this.clock = clock;
    }

    /**
     * 브레이커로 보호된 호출 실행.
     *
     * @return OPEN 상태(리셋 대기 중)이면 operation을 호출하지 않고
     *         {@link FailureKind#DEPENDENCY_UNAVAILABLE} 실패를 즉시 반환
     */
    public <T> DependencyCallResult<T> call(DependencyOperation<T> operation) {
        long admittedIn = tryAcquirePermission();
        if (admittedIn == REJECTED) {
            log.debug("Circuit breaker [{}] rejected call (OPEN)", name);
            return DependencyCallResult.failure(FailureKind.DEPENDENCY_UNAVAILABLE,
                    name + " is temporarily unavailable");
        }

        DependencyCallResult<T> result;
        try {
            result = operation.call();
        } catch (RuntimeException e) {
            // operation 계약 위반 → 실패로 기록 후 그대로 전파
            recordFailure(admittedIn);
            throw e;
        }

        if (result.isSuccess() || result.kind().isClientError()) {
            recordSuccess(admittedIn);
        } else {
            recordFailure(admittedIn);
        }
        return result;
    }

    /** @return 호출이 허용된 세대, 거부되면 {@link #REJECTED} */
    private long tryAcquirePermission() {
        lock.lock();
        try {
            if (state != CircuitBreakerState.OPEN) {
                return generation;
            }
            Duration sinceOpened = Duration.between(openedAt, clock.instant());
            if (sinceOpened.compareTo(config.getResetTimeout()) >= 0) {
                transitionTo(CircuitBreakerState.HALF_OPEN);
                consecutiveSuccesses = 0;
                return generation;
            }
            return REJECTED;
        } finally {
            lock.unlock();
        }
    }

    private void recordSuccess(long admittedIn) {
        lock.lock();
        try {
            if (admittedIn != generation) {
                log.debug("Circuit breaker [{}] ignored stale success from generation {}", name, admittedIn);
                return;
            }
            switch (state) {
                case HALF_OPEN -> {
                    consecutiveSuccesses++;
                    if (consecutiveSuccesses >= config.getSuccessThreshold()) {
                        transitionTo(CircuitBreakerState.CLOSED);
                        consecutiveFailures = 0;
                        consecutiveSuccesses = 0;
                    }
                }
                case CLOSED -> consecutiveFailures = 0;
                case OPEN -> {
                    // OPEN에서 허용된 호출은 없으므로 세대 검사에서 이미 걸러진다
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private void recordFailure(long admittedIn) {
        lock.lock();
        try {
            if (admittedIn != generation) {
                log.debug("Circuit breaker [{}] ignored stale failure from generation {}", name, admittedIn);
                return;
            }
            switch (state) {
                case HALF_OPEN -> open();
                case CLOSED -> {
                    consecutiveFailures++;
                    if (consecutiveFailures >= config.getFailureThreshold()) {
                        open();
                    }
                }
                case OPEN -> {
                    // 세대 검사에서 걸러짐. openedAt을 갱신하지 않는다
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private void open() {
        transitionTo(CircuitBreakerState.OPEN);
        openedAt = clock.instant();
        consecutiveSuccesses = 0;
    }

    private void transitionTo(CircuitBreakerState next) {
        if (state != next) {
            log.warn("Circuit breaker [{}] state change: {} -> {}", name, state, next);
            state = next;
            generation++;
        }
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    public CircuitBreakerState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public int getConsecutiveFailures() {
        lock.lock();
        try {
            return consecutiveFailures;
        } finally {
            lock.unlock();
        }
    }

    public int getConsecutiveSuccesses() {
        lock.lock();
        try {
            return consecutiveSuccesses;
        } finally {
            lock.unlock();
        }
    }

    /** 수동 복구/테스트용: CLOSED로 강제 리셋 */
    public void reset() {
        lock.lock();
        try {
            transitionTo(CircuitBreakerState.CLOSED);
            generation++;
            consecutiveFailures = 0;
            consecutiveSuccesses = 0;
            openedAt = null;
        } finally {
            lock.unlock();
        }
    }
}
