package com.cafeflow.common.resilience.config;

import com.cafeflow.common.resilience.ResilientCallExecutor;
import com.cafeflow.common.resilience.breaker.CircuitBreakerRegistry;
import com.cafeflow.common.resilience.retry.RetryExecutor;
import com.cafeflow.common.resilience.timeout.TimeoutExecutor;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Resilience 기본 구성 요소 Bean 등록
 *
 * <h3>역할</h3>
 * 서킷 브레이커 레지스트리, 재시도 실행기, 타임아웃 실행기를 만들고
 * 이를 조합한 {@link ResilientCallExecutor}를 모든 어댑터에 주입한다.
 *
 * <h3>전송 스레드 풀</h3>
 * 데드라인이 걸린 호출은 요청 스레드가 아닌 전송 전용 풀에서 실행된다.
 * 요청 스레드는 데드라인까지만 기다리고 돌아간다.
 * 풀과 큐 크기가 모두 차면 새 호출은 UNAVAILABLE로 즉시 실패한다.
 */
@Configuration
@EnableConfigurationProperties(ResilienceProperties.class)
public class ResilienceConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(ResilienceProperties properties, Clock clock) {
        return new CircuitBreakerRegistry(
                name -> properties.forDependency(name).getCircuitBreaker().toConfig(), clock);
    }

    @Bean
    public TimeLimiterRegistry timeLimiterRegistry() {
        return TimeLimiterRegistry.ofDefaults();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService transportExecutor(ResilienceProperties properties) {
        AtomicInteger sequence = new AtomicInteger();
        return new ThreadPoolExecutor(
                properties.getTransportPoolSize(), properties.getTransportPoolSize(),
                60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(properties.getTransportQueueCapacity()),
                runnable -> {
                    Thread thread = new Thread(runnable, "transport-" + sequence.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                });
    }

    @Bean
    public TimeoutExecutor timeoutExecutor(TimeLimiterRegistry timeLimiterRegistry,
                                           ExecutorService transportExecutor) {
        return new TimeoutExecutor(timeLimiterRegistry, transportExecutor);
    }

    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.ofDefaults();
    }

    @Bean
    public RetryExecutor retryExecutor(RetryRegistry retryRegistry) {
        return new RetryExecutor(retryRegistry);
    }

    @Bean
    public ResilientCallExecutor resilientCallExecutor(CircuitBreakerRegistry circuitBreakerRegistry,
                                                       RetryExecutor retryExecutor,
                                                       TimeoutExecutor timeoutExecutor,
                                                       ResilienceProperties properties) {
        return new ResilientCallExecutor(circuitBreakerRegistry, retryExecutor, timeoutExecutor,
                properties::policyFor);
    }
}
