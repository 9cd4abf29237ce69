package com.cafeflow.order.config;

import io.github.resilience4j.bulkhead.ThreadPoolBulkhead;
import io.github.resilience4j.bulkhead.ThreadPoolBulkheadConfig;
import io.github.resilience4j.bulkhead.ThreadPoolBulkheadRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 주문 항목 fan-out용 ThreadPoolBulkhead 설정
 *
 * <h3>역할</h3>
 * Catalog 병렬 조회를 고정 크기 스레드 풀로 격리한다.
 * 동시에 많은 주문이 들어와도 Catalog로 나가는 호출 수는 max-concurrency를 넘지 않고,
 * 대기열까지 차면 새 조회는 BulkheadFullException으로 즉시 거절된다.
 *
 * <h3>★ vs 어노테이션 방식</h3>
 * {@code @Bulkhead(type = THREADPOOL)} 대신 Bean으로 주입받아
 * 워크플로가 CompletableFuture 묶음을 직접 제어한다 (첫 실패 시 조기 종료).
 */
@Configuration
@EnableConfigurationProperties(OrderProperties.class)
public class ItemResolutionConfig {

    public static final String BULKHEAD_NAME = "catalogItemResolution";

    @Bean
    public ThreadPoolBulkheadRegistry threadPoolBulkheadRegistry(OrderProperties properties) {
        OrderProperties.ItemResolution resolution = properties.getItemResolution();
        ThreadPoolBulkheadConfig config = ThreadPoolBulkheadConfig.custom()
                .coreThreadPoolSize(resolution.getMaxConcurrency())
                .maxThreadPoolSize(resolution.getMaxConcurrency())
                .queueCapacity(resolution.getQueueCapacity())
                .build();
        return ThreadPoolBulkheadRegistry.of(config);
    }

    @Bean
    public ThreadPoolBulkhead itemResolutionBulkhead(ThreadPoolBulkheadRegistry registry) {
        return registry.bulkhead(BULKHEAD_NAME);
    }
}
