package com.cafeflow.common.client.discovery;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 정적 서비스 목록 설정
 *
 * <pre>
 * cafeflow:
 *   discovery:
 *     services:
 *       users: http://localhost:8091
 *       catalog: http://localhost:8092,http://localhost:8093
 * </pre>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "cafeflow.discovery")
public class DiscoveryProperties {

    /**
     * Dependency name to base URLs of its instances
     */
    private Map<String, List<String>> services = new LinkedHashMap<>();
}
