package com.cafeflow.common.client.transport;

import com.cafeflow.common.client.discovery.NoHealthyInstanceException;
import com.cafeflow.common.client.discovery.ServiceDiscovery;
import com.cafeflow.common.dto.ApiResponse;
import com.cafeflow.common.resilience.DependencyCallResult;
import com.cafeflow.common.resilience.FailureKind;
import com.cafeflow.common.resilience.ResilientCallExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.function.Function;

/**
 * 어댑터 공통 호출 경로
 *
 * <h3>역할</h3>
 * 의존 서비스 호출 1건을 다음 순서로 감싼다.
 * <pre>
 * ResilientCallExecutor (breaker → retry → timeout)
 *   └─ 시도마다:
 *       1. ServiceDiscovery.resolve(dependency)   실패 시 DEPENDENCY_UNAVAILABLE
 *       2. Feign 호출 (기본 URI를 인자로 전달)
 *       3. 예외 → TransportErrorClassifier
 *       4. ApiResponse.data 추출                 비어 있으면 INTERNAL
 * </pre>
 *
 * <p>디스커버리는 시도마다 다시 조회하므로 재시도가 다른 인스턴스로 갈 수 있다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BackendInvoker {

    private final ResilientCallExecutor resilientCallExecutor;
    private final ServiceDiscovery serviceDiscovery;
    private final TransportErrorClassifier errorClassifier;

    public <T> DependencyCallResult<T> invoke(String dependency, Function<URI, ApiResponse<T>> call) {
        return resilientCallExecutor.call(dependency, () -> attempt(dependency, call));
    }

    private <T> DependencyCallResult<T> attempt(String dependency, Function<URI, ApiResponse<T>> call) {
        URI baseUri;
        try {
            baseUri = serviceDiscovery.resolve(dependency);
        } catch (NoHealthyInstanceException e) {
            log.warn("Discovery failed: {}", e.getMessage());
            return DependencyCallResult.failure(FailureKind.DEPENDENCY_UNAVAILABLE,
                    dependency + " has no available instance");
        }

        ApiResponse<T> response;
        try {
            response = call.apply(baseUri);
        } catch (RuntimeException e) {
            return errorClassifier.classify(dependency, e);
        }

        if (response == null || response.data() == null) {
            log.error("{} returned an empty response body", dependency);
            return DependencyCallResult.failure(FailureKind.INTERNAL,
                    dependency + " returned an empty response");
        }
        return DependencyCallResult.success(response.data());
    }
}
