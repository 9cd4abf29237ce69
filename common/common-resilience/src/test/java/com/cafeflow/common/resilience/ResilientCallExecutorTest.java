package com.cafeflow.common.resilience;

import com.cafeflow.common.resilience.breaker.CircuitBreaker;
import com.cafeflow.common.resilience.breaker.CircuitBreakerConfig;
import com.cafeflow.common.resilience.breaker.CircuitBreakerRegistry;
import com.cafeflow.common.resilience.breaker.CircuitBreakerState;
import com.cafeflow.common.resilience.retry.RetryExecutor;
import com.cafeflow.common.resilience.retry.RetryPolicy;
import com.cafeflow.common.resilience.timeout.TimeoutExecutor;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ResilientCallExecutorTest {

    private static final Duration DEADLINE = Duration.ofMillis(50);

    private ExecutorService transport;
    private MutableClock clock;
    private CircuitBreakerRegistry registry;
    private ResilientCallExecutor executor;
    private final CountDownLatch hang = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        transport = Executors.newCachedThreadPool();
        clock = MutableClock.startingNow();
        registry = CircuitBreakerRegistry.of(CircuitBreakerConfig.builder()
                .failureThreshold(3)
                .successThreshold(1)
                .resetTimeout(Duration.ofSeconds(30))
                .build(), clock);
        DependencyPolicy policy = new DependencyPolicy(DEADLINE,
                RetryPolicy.of(3, Duration.ofMillis(10), Duration.ofMillis(100)),
                CircuitBreakerConfig.defaultConfig());
        executor = new ResilientCallExecutor(registry,
                new RetryExecutor(RetryRegistry.ofDefaults(), bound -> 0),
                new TimeoutExecutor(TimeLimiterRegistry.ofDefaults(), transport),
                name -> policy);
    }

    @AfterEach
    void tearDown() {
        hang.countDown();
        transport.shutdownNow();
    }

    private DependencyCallResult<String> hangUntilReleased() {
        try {
            hang.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return DependencyCallResult.success("too late");
    }

    @Test
    @DisplayName("두 번 타임아웃 후 세 번째 성공 → 브레이커에는 성공 1건만 기록")
    void retriedTimeoutsCountOnceAgainstBreaker() {
        // Given
        AtomicInteger attempts = new AtomicInteger();

        // When
        DependencyCallResult<String> result = executor.call("catalog", () ->
                attempts.incrementAndGet() < 3 ? hangUntilReleased() : DependencyCallResult.success("espresso"));

        // Then
        CircuitBreaker breaker = registry.breakerFor("catalog");
        assertThat(result.payload()).isEqualTo("espresso");
        assertThat(attempts.get()).isEqualTo(3);
        assertThat(breaker.getConsecutiveFailures()).isZero();
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    @DisplayName("재시도를 모두 소진한 실패 3건 → OPEN, 이후 호출은 전송 없이 즉시 실패")
    void exhaustedOutagesOpenBreaker() {
        // Given
        AtomicInteger transportCalls = new AtomicInteger();
        DependencyOperation<String> refused = () -> {
            transportCalls.incrementAndGet();
            return DependencyCallResult.failure(FailureKind.CONNECTION_REFUSED, "users refused the connection");
        };

        // When
        for (int i = 0; i < 3; i++) {
            DependencyCallResult<String> outcome = executor.call("users", refused);
            assertThat(outcome.kind()).isEqualTo(FailureKind.CONNECTION_REFUSED);
        }
        int callsBeforeOpen = transportCalls.get();
        DependencyCallResult<String> fourth = executor.call("users", refused);

        // Then
        assertThat(callsBeforeOpen).isEqualTo(9);   // 3 logical calls x 3 attempts
        assertThat(registry.breakerFor("users").getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(fourth.kind()).isEqualTo(FailureKind.DEPENDENCY_UNAVAILABLE);
        assertThat(transportCalls.get()).isEqualTo(callsBeforeOpen);
    }

    @Test
    @DisplayName("OPEN 상태의 빠른 실패는 재시도하지 않음")
    void openBreakerIsNotRetried() {
        registry.breakerFor("orders");
        for (int i = 0; i < 3; i++) {
            executor.call("orders", () -> DependencyCallResult.failure(FailureKind.INTERNAL, "bug"));
        }
        AtomicInteger calls = new AtomicInteger();

        DependencyCallResult<String> result = executor.call("orders", () -> {
            calls.incrementAndGet();
            return DependencyCallResult.success("x");
        });

        assertThat(result.kind()).isEqualTo(FailureKind.DEPENDENCY_UNAVAILABLE);
        assertThat(calls.get()).isZero();
    }

    @Test
    @DisplayName("의존 서비스마다 브레이커가 독립적")
    void breakersAreIsolatedPerDependency() {
        for (int i = 0; i < 3; i++) {
            executor.call("users", () -> DependencyCallResult.failure(FailureKind.INTERNAL, "bug"));
        }

        DependencyCallResult<String> catalog = executor.call("catalog", () -> DependencyCallResult.success("ok"));

        assertThat(catalog.isSuccess()).isTrue();
    }
}
