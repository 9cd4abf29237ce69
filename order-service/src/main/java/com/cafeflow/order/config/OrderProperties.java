package com.cafeflow.order.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 주문 서비스 설정
 *
 * <pre>
 * cafeflow:
 *   order:
 *     item-resolution:
 *       max-concurrency: 8    # 항목 조회 동시 실행 수 (벌크헤드 스레드)
 *       queue-capacity: 32    # 벌크헤드 대기열, 초과 시 UNAVAILABLE
 *       deadline: 5s          # 항목 조회 전체 데드라인
 * </pre>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "cafeflow.order")
public class OrderProperties {

    private ItemResolution itemResolution = new ItemResolution();

    @Getter
    @Setter
    public static class ItemResolution {
        private int maxConcurrency = 8;
        private int queueCapacity = 32;
        private Duration deadline = Duration.ofSeconds(5);
    }
}
