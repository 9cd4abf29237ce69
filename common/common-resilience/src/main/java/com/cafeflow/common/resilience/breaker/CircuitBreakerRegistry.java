package com.cafeflow.common.resilience.breaker;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * 의존 서비스 이름 → 서킷 브레이커 레지스트리
 *
 * <p>프로세스 전역 상태를 static 필드가 아닌 주입 가능한 객체로 표현한다.
 * 어댑터는 생성 시 이 레지스트리를 주입받고, 테스트는 매번 새 레지스트리를 만든다.</p>
 *
 * <p>브레이커는 처음 조회될 때 설정 조회 함수로 생성되며, 이후 같은 인스턴스가 재사용된다.</p>
 */
public class CircuitBreakerRegistry {

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final Function<String, CircuitBreakerConfig> configLookup;
    private final Clock clock;

    public CircuitBreakerRegistry(Function<String, CircuitBreakerConfig> configLookup, Clock clock) {
        this.configLookup = configLookup;
        this.clock = clock;
    }

    public static CircuitBreakerRegistry of(CircuitBreakerConfig config, Clock clock) {
        return new CircuitBreakerRegistry(name -> config, clock);
    }

    public CircuitBreaker breakerFor(String dependency) {
        return breakers.computeIfAbsent(dependency,
                name -> new CircuitBreaker(name, configLookup.apply(name), clock));
    }

    public Collection<CircuitBreaker> all() {
        return Collections.unmodifiableCollection(breakers.values());
    }
}
