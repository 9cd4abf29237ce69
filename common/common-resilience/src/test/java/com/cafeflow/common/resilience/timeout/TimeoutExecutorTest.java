package com.cafeflow.common.resilience.timeout;

import com.cafeflow.common.resilience.DependencyCallResult;
import com.cafeflow.common.resilience.FailureKind;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class TimeoutExecutorTest {

    private ExecutorService executor;
    private TimeoutExecutor timeoutExecutor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        timeoutExecutor = new TimeoutExecutor(TimeLimiterRegistry.ofDefaults(), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("데드라인 안에 끝나면 결과를 그대로 반환")
    void returnsResultWithinDeadline() {
        DependencyCallResult<String> result = timeoutExecutor.withTimeout("users", Duration.ofSeconds(1),
                () -> DependencyCallResult.success("alice"));

        assertThat(result.payload()).isEqualTo("alice");
    }

    @Test
    @DisplayName("실패 결과도 변형 없이 전달")
    void passesFailureThrough() {
        DependencyCallResult<String> result = timeoutExecutor.withTimeout("users", Duration.ofSeconds(1),
                () -> DependencyCallResult.failure(FailureKind.NOT_FOUND, "no user"));

        assertThat(result.kind()).isEqualTo(FailureKind.NOT_FOUND);
        assertThat(result.message()).isEqualTo("no user");
    }

    @Test
    @DisplayName("데드라인을 넘기면 TIMEOUT, 호출자는 데드라인 근처에서 바로 돌아옴")
    void timesOutSlowOperation() {
        CountDownLatch never = new CountDownLatch(1);
        long started = System.nanoTime();

        DependencyCallResult<String> result = timeoutExecutor.withTimeout("slow-users", Duration.ofMillis(100),
                () -> {
                    try {
                        never.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return DependencyCallResult.success("late");
                });

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        assertThat(result.kind()).isEqualTo(FailureKind.TIMEOUT);
        assertThat(result.message()).contains("slow-users", "100ms");
        assertThat(elapsedMs).isLessThan(2_000);
    }

    @Test
    @DisplayName("같은 의존 서비스라도 호출마다 요청한 데드라인이 적용됨")
    void appliesDeadlinePerCallForSameDependency() {
        DependencyCallResult<String> fast = timeoutExecutor.withTimeout("catalog", Duration.ofSeconds(5),
                () -> DependencyCallResult.success("menu"));
        assertThat(fast.payload()).isEqualTo("menu");

        long started = System.nanoTime();
        DependencyCallResult<String> slow = timeoutExecutor.withTimeout("catalog", Duration.ofMillis(100),
                () -> {
                    try {
                        Thread.sleep(1_000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return DependencyCallResult.success("late");
                });

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        assertThat(slow.kind()).isEqualTo(FailureKind.TIMEOUT);
        assertThat(slow.message()).contains("100ms");
        assertThat(elapsedMs).isLessThan(1_000);
    }

    @Test
    @DisplayName("operation이 예외를 던지면 INTERNAL")
    void unexpectedExceptionBecomesInternal() {
        DependencyCallResult<String> result = timeoutExecutor.withTimeout("catalog", Duration.ofSeconds(1),
                () -> {
                    throw new IllegalStateException("bug");
                });

        assertThat(result.kind()).isEqualTo(FailureKind.INTERNAL);
    }

    @Test
    @DisplayName("전송 풀이 가득 차면 UNAVAILABLE")
    void saturatedExecutorBecomesUnavailable() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        ThreadPoolExecutor tiny = new ThreadPoolExecutor(1, 1, 0, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(1));
        try {
            tiny.submit(() -> {
                release.await();
                return null;
            });
            tiny.submit(() -> {
                release.await();
                return null;
            });
            TimeoutExecutor saturated = new TimeoutExecutor(TimeLimiterRegistry.ofDefaults(), tiny);

            DependencyCallResult<String> result = saturated.withTimeout("orders", Duration.ofSeconds(1),
                    () -> DependencyCallResult.success("never"));

            assertThat(result.kind()).isEqualTo(FailureKind.UNAVAILABLE);
        } finally {
            release.countDown();
            tiny.shutdownNow();
            tiny.awaitTermination(1, TimeUnit.SECONDS);
        }
    }
}
