package com.cafeflow.common.client.discovery;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * 설정 파일 기반 서비스 디스커버리 (라운드 로빈)
 *
 * <p>인스턴스가 여러 개면 호출마다 순서대로 돌아가며 반환한다.
 * 목록이 비어 있거나 설정에 없는 이름이면 {@link NoHealthyInstanceException}.</p>
 */
@Slf4j
@Component
@EnableConfigurationProperties(DiscoveryProperties.class)
public class StaticServiceDiscovery implements ServiceDiscovery {

    private final Map<String, List<URI>> instances;
    private final Map<String, AtomicInteger> cursors = new ConcurrentHashMap<>();

    public StaticServiceDiscovery(DiscoveryProperties properties) {
        this.instances = properties.getServices().entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey,
                        entry -> entry.getValue().stream()
                                .map(String::trim)
                                .filter(url -> !url.isEmpty())
                                .map(URI::create)
                                .toList()));
        log.info("Static discovery initialized: {}", instances);
    }

    @Override
    public URI resolve(String dependency) {
        List<URI> candidates = instances.getOrDefault(dependency, List.of());
        if (candidates.isEmpty()) {
            throw new NoHealthyInstanceException(dependency);
        }
        int next = cursors.computeIfAbsent(dependency, name -> new AtomicInteger())
                .getAndIncrement();
        return candidates.get(Math.floorMod(next, candidates.size()));
    }
}
