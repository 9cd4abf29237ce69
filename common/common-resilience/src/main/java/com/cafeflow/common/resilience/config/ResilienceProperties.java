package com.cafeflow.common.resilience.config;

import com.cafeflow.common.resilience.DependencyPolicy;
import com.cafeflow.common.resilience.breaker.CircuitBreakerConfig;
import com.cafeflow.common.resilience.retry.RetryPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 의존 서비스별 보호 정책 설정
 *
 * <pre>
 * cafeflow:
 *   resilience:
 *     transport-pool-size: 64
 *     defaults:
 *       timeout: 2s
 *     dependencies:
 *       users:
 *         timeout: 500ms          # 단건 조회: 짧은 데드라인
 *         retry:
 *           max-attempts: 3
 *           base-delay: 100ms
 *           max-delay: 1s
 *         circuit-breaker:
 *           failure-threshold: 3
 *           success-threshold: 2
 *           reset-timeout: 30s
 * </pre>
 *
 * <p>dependencies에 없는 이름은 defaults를 사용한다.</p>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "cafeflow.resilience")
public class ResilienceProperties {

    /**
     * Size of the shared pool that runs deadline-bounded transport calls
     * Default: 64
     */
    private int transportPoolSize = 64;

    /**
     * Pending transport calls allowed before new calls are rejected as UNAVAILABLE
     * Default: 256
     */
    private int transportQueueCapacity = 256;

    private Dependency defaults = new Dependency();

    private Map<String, Dependency> dependencies = new LinkedHashMap<>();

    public Dependency forDependency(String name) {
        return dependencies.getOrDefault(name, defaults);
    }

    public DependencyPolicy policyFor(String name) {
        return forDependency(name).toPolicy();
    }

    @Getter
    @Setter
    public static class Dependency {

        /** Per-attempt deadline */
        private Duration timeout = Duration.ofSeconds(2);

        private Retry retry = new Retry();

        private CircuitBreaker circuitBreaker = new CircuitBreaker();

        public DependencyPolicy toPolicy() {
            return new DependencyPolicy(timeout,
                    RetryPolicy.of(retry.getMaxAttempts(), retry.getBaseDelay(), retry.getMaxDelay()),
                    circuitBreaker.toConfig());
        }
    }

    @Getter
    @Setter
    public static class Retry {

        /** Attempts including the first one */
        private int maxAttempts = 3;

        private Duration baseDelay = Duration.ofMillis(100);

        private Duration maxDelay = Duration.ofSeconds(1);
    }

    @Getter
    @Setter
    public static class CircuitBreaker {

        private int failureThreshold = 5;

        private int successThreshold = 2;

        private Duration resetTimeout = Duration.ofSeconds(30);

        public CircuitBreakerConfig toConfig() {
            return CircuitBreakerConfig.builder()
                    .failureThreshold(failureThreshold)
                    .successThreshold(successThreshold)
                    .resetTimeout(resetTimeout)
                    .build();
        }
    }
}
