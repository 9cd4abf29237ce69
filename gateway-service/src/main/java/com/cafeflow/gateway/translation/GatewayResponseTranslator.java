package com.cafeflow.gateway.translation;

import com.cafeflow.common.exception.BusinessException;
import com.cafeflow.common.resilience.DependencyCallResult;
import com.cafeflow.common.resilience.FailureKind;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * 프로토콜 변환 계층 (Protocol Translation Layer)
 *
 * <h3>역할</h3>
 * 어댑터 호출 결과를 HTTP 응답 쪽으로 넘긴다.
 * <ul>
 *   <li>성공: 페이로드를 그대로 반환 → 컨트롤러가 ApiResponse로 감싼다</li>
 *   <li>실패: {@link BusinessException#of(FailureKind, String)}로 던짐
 *       → GlobalExceptionHandler가 ProblemDetail로 변환</li>
 * </ul>
 *
 * <p>상태 코드 매핑은 {@code ErrorCode.of(FailureKind)} 한 곳에만 있다.</p>
 */
@Component
@RequiredArgsConstructor
public class GatewayResponseTranslator {

    private final GatewayCallLogger callLogger;

    public <T> T translate(String dependency, String operation, Supplier<DependencyCallResult<T>> call) {
        long started = System.nanoTime();
        DependencyCallResult<T> result;
        try {
            result = call.get();
        } catch (RuntimeException e) {
            callLogger.record(dependency, operation,
                    DependencyCallResult.failure(FailureKind.INTERNAL, e.getMessage()), elapsedSince(started));
            throw e;
        }
        callLogger.record(dependency, operation, result, elapsedSince(started));

        if (result.isFailure()) {
            throw BusinessException.of(result.kind(), result.message());
        }
        return result.payload();
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
