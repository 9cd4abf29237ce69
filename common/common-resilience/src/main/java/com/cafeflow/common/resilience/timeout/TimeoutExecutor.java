package com.cafeflow.common.resilience.timeout;

import com.cafeflow.common.resilience.DependencyCallResult;
import com.cafeflow.common.resilience.DependencyOperation;
import com.cafeflow.common.resilience.FailureKind;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * 호출 단위 데드라인 래퍼 (Resilience4j TimeLimiter 기반)
 *
 * <h3>역할</h3>
 * operation을 전송 전용 스레드 풀에서 실행하고, 데드라인까지 결과가 없으면
 * {@link FailureKind#TIMEOUT}을 반환한다. 호출자는 데드라인보다 오래 기다리지 않는다.
 *
 * <h3>취소는 best-effort</h3>
 * 타임아웃 시 Future를 취소하지만, 이미 나간 원격 호출이 서버 쪽에서 중단된다는 보장은 없다.
 * 전송 계층(Feign read timeout)이 스레드를 결국 회수한다.
 *
 * <h3>계단식 타임아웃</h3>
 * <pre>
 * Gateway → orders 데드라인  (가장 바깥, 가장 길다)
 *   └─ order-service → users / catalog 데드라인
 *       └─ Feign connect/read 타임아웃 (가장 안쪽)
 * </pre>
 * 데드라인은 의존 서비스별로 설정하며 이 클래스가 임의로 늘리지 않는다.
 */
@Slf4j
public class TimeoutExecutor {

    private final TimeLimiterRegistry timeLimiterRegistry;
    private final ExecutorService transportExecutor;

    public TimeoutExecutor(TimeLimiterRegistry timeLimiterRegistry, ExecutorService transportExecutor) {
        this.timeLimiterRegistry = timeLimiterRegistry;
        this.transportExecutor = transportExecutor;
    }

    public <T> DependencyCallResult<T> withTimeout(String dependency, Duration deadline,
                                                   DependencyOperation<T> operation) {
        TimeLimiter timeLimiter = limiterFor(dependency, deadline);

        try {
            return timeLimiter.executeFutureSupplier(
                    () -> CompletableFuture.supplyAsync(operation::call, transportExecutor));
        } catch (TimeoutException e) {
            log.debug("[{}] call exceeded deadline of {}ms", dependency, deadline.toMillis());
            return DependencyCallResult.failure(FailureKind.TIMEOUT,
                    dependency + " did not respond within " + deadline.toMillis() + "ms");
        } catch (RejectedExecutionException e) {
            log.warn("[{}] transport executor saturated: {}", dependency, e.getMessage());
            return DependencyCallResult.failure(FailureKind.UNAVAILABLE,
                    dependency + " call could not be scheduled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DependencyCallResult.failure(FailureKind.UNAVAILABLE,
                    dependency + " call was interrupted");
        } catch (Exception e) {
            // operation은 실패를 값으로 반환해야 한다 → 여기 도달하면 프로그래밍 오류
            log.error("[{}] unexpected error during call", dependency, e);
            return DependencyCallResult.failure(FailureKind.INTERNAL,
                    dependency + " call failed unexpectedly");
        }
    }

    /**
     * 레지스트리의 TimeLimiter는 이름별로 처음 등록된 설정을 유지한다.
     * 요청된 데드라인과 다르면 새 인스턴스로 교체하고, 이번 호출은 항상 요청된 데드라인을 쓴다.
     */
    private TimeLimiter limiterFor(String dependency, Duration deadline) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(deadline)
                .cancelRunningFuture(true)
                .build();
        TimeLimiter registered = timeLimiterRegistry.timeLimiter(dependency, config);
        if (deadline.equals(registered.getTimeLimiterConfig().getTimeoutDuration())) {
            return registered;
        }
        TimeLimiter replacement = TimeLimiter.of(dependency, config);
        timeLimiterRegistry.replace(dependency, replacement);
        log.debug("[{}] deadline changed: {}ms -> {}ms", dependency,
                registered.getTimeLimiterConfig().getTimeoutDuration().toMillis(), deadline.toMillis());
        return replacement;
    }
}
