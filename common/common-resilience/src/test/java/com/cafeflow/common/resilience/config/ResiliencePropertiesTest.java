package com.cafeflow.common.resilience.config;

import com.cafeflow.common.resilience.DependencyPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResiliencePropertiesTest {

    private static ResilienceProperties bind(Map<String, String> source) {
        return new Binder(new MapConfigurationPropertySource(source))
                .bindOrCreate("cafeflow.resilience", ResilienceProperties.class);
    }

    @Test
    @DisplayName("의존 서비스별 설정 바인딩")
    void bindsPerDependencySettings() {
        ResilienceProperties properties = bind(Map.of(
                "cafeflow.resilience.dependencies.users.timeout", "500ms",
                "cafeflow.resilience.dependencies.users.retry.max-attempts", "4",
                "cafeflow.resilience.dependencies.users.circuit-breaker.failure-threshold", "3",
                "cafeflow.resilience.dependencies.users.circuit-breaker.reset-timeout", "10s"));

        DependencyPolicy policy = properties.policyFor("users");

        assertThat(policy.timeout()).isEqualTo(Duration.ofMillis(500));
        assertThat(policy.retryPolicy().maxAttempts()).isEqualTo(4);
        assertThat(policy.circuitBreakerConfig().getFailureThreshold()).isEqualTo(3);
        assertThat(policy.circuitBreakerConfig().getResetTimeout()).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    @DisplayName("설정에 없는 의존 서비스는 defaults 사용")
    void unknownDependencyFallsBackToDefaults() {
        ResilienceProperties properties = bind(Map.of(
                "cafeflow.resilience.defaults.timeout", "3s"));

        assertThat(properties.policyFor("orders").timeout()).isEqualTo(Duration.ofSeconds(3));
        assertThat(properties.policyFor("orders").circuitBreakerConfig().getFailureThreshold()).isEqualTo(5);
    }
}
