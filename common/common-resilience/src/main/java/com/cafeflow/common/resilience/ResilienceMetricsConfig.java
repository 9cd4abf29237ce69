package com.cafeflow.common.resilience;

import com.cafeflow.common.resilience.breaker.CircuitBreakerRegistry;
import com.cafeflow.common.resilience.config.ResilienceProperties;
import io.github.resilience4j.bulkhead.ThreadPoolBulkheadRegistry;
import io.github.resilience4j.micrometer.tagged.TaggedRetryMetrics;
import io.github.resilience4j.micrometer.tagged.TaggedThreadPoolBulkheadMetrics;
import io.github.resilience4j.micrometer.tagged.TaggedTimeLimiterMetrics;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Configuration;

/**
 * Resilience 메트릭 설정 (Prometheus Metrics Registration)
 *
 * <p>서킷 브레이커 상태와 Resilience4j TimeLimiter / Retry / ThreadPoolBulkhead 메트릭을
 * Micrometer에 등록한다. /actuator/prometheus 에서 수집 가능.</p>
 *
 * <h3>등록되는 메트릭</h3>
 * <pre>
 *   ┌─────────────────────────┬──────────────────────────────────────────────────┐
 *   │ 구성 요소                │ Prometheus 메트릭                                 │
 *   ├─────────────────────────┼──────────────────────────────────────────────────┤
 *   │ Circuit Breaker         │ cafeflow_circuitbreaker_state{dependency}        │
 *   │                         │   0 = CLOSED, 1 = OPEN, 2 = HALF_OPEN            │
 *   │                         │ cafeflow_circuitbreaker_consecutive_failures     │
 *   ├─────────────────────────┼──────────────────────────────────────────────────┤
 *   │ TimeLimiter             │ resilience4j_timelimiter_calls_total             │
 *   ├─────────────────────────┼──────────────────────────────────────────────────┤
 *   │ Retry                   │ resilience4j_retry_calls_total{kind}             │
 *   ├─────────────────────────┼──────────────────────────────────────────────────┤
 *   │ ThreadPoolBulkhead      │ resilience4j_bulkhead_queue_depth                │
 *   │ (order-service 전용)     │ resilience4j_bulkhead_thread_pool_size           │
 *   └─────────────────────────┴──────────────────────────────────────────────────┘
 * </pre>
 *
 * <p>게이지는 설정에 이름이 있는 의존 서비스마다 등록된다.</p>
 */
@Configuration
public class ResilienceMetricsConfig {

    public ResilienceMetricsConfig(
            MeterRegistry meterRegistry,
            ResilienceProperties properties,
            CircuitBreakerRegistry circuitBreakerRegistry,
            TimeLimiterRegistry timeLimiterRegistry,
            RetryRegistry retryRegistry,
            ObjectProvider<ThreadPoolBulkheadRegistry> bulkheadRegistry) {

        // 의존 서비스별 브레이커 상태 게이지
        for (String dependency : properties.getDependencies().keySet()) {
            Gauge.builder("cafeflow.circuitbreaker.state", circuitBreakerRegistry,
                            registry -> registry.breakerFor(dependency).getState().ordinal())
                    .tag("dependency", dependency)
                    .description("0=CLOSED, 1=OPEN, 2=HALF_OPEN")
                    .register(meterRegistry);
            Gauge.builder("cafeflow.circuitbreaker.consecutive.failures", circuitBreakerRegistry,
                            registry -> registry.breakerFor(dependency).getConsecutiveFailures())
                    .tag("dependency", dependency)
                    .register(meterRegistry);
        }

        TaggedTimeLimiterMetrics.ofTimeLimiterRegistry(timeLimiterRegistry)
                .bindTo(meterRegistry);
        TaggedRetryMetrics.ofRetryRegistry(retryRegistry)
                .bindTo(meterRegistry);

        // 주문 항목 fan-out 벌크헤드는 order-service에만 존재
        bulkheadRegistry.ifAvailable(registry ->
                TaggedThreadPoolBulkheadMetrics.ofThreadPoolBulkheadRegistry(registry)
                        .bindTo(meterRegistry));
    }
}
