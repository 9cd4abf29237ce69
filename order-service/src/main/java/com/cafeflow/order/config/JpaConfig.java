package com.cafeflow.order.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * JPA Auditing 설정
 *
 * <p>Order.createdAt ({@code @CreatedDate})을 저장 시점에 자동으로 채운다.</p>
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}
