package com.cafeflow.common.client.transport;

import com.cafeflow.common.resilience.DependencyCallResult;
import com.cafeflow.common.resilience.FailureKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.FeignException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;

/**
 * 전송 계층 예외 → {@link FailureKind} 분류기
 *
 * <h3>역할</h3>
 * Feign 호출에서 발생한 예외를 어댑터 경계에서 실패 값으로 바꾼다.
 * 이 클래스 밖으로는 FeignException이 새어 나가지 않는다.
 *
 * <h3>분류 규칙</h3>
 * <pre>
 *   원인 체인에 ConnectException            → CONNECTION_REFUSED
 *   원인 체인에 SocketTimeoutException       → TIMEOUT
 *   HTTP 404                                → NOT_FOUND
 *   HTTP 400 / 409 / 422                    → INVALID_ARGUMENT
 *   HTTP 408                                → TIMEOUT
 *   HTTP 429 / 502 / 503 / 504              → UNAVAILABLE
 *   그 외 IOException (DNS 실패 등)          → UNAVAILABLE
 *   HTTP 500, 디코딩 실패, 그 외 모든 예외     → INTERNAL
 * </pre>
 *
 * <p>4xx 응답은 백엔드가 보낸 ProblemDetail의 {@code detail}을 메시지로 사용한다.</p>
 */
@Slf4j
@Component
public class TransportErrorClassifier {

    private final ObjectMapper objectMapper;

    public TransportErrorClassifier(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public <T> DependencyCallResult<T> classify(String dependency, Throwable error) {
        if (hasCause(error, ConnectException.class)) {
            return DependencyCallResult.failure(FailureKind.CONNECTION_REFUSED,
                    dependency + " refused the connection");
        }
        if (hasCause(error, SocketTimeoutException.class) || hasCause(error, HttpTimeoutException.class)) {
            return DependencyCallResult.failure(FailureKind.TIMEOUT,
                    dependency + " timed out at the socket level");
        }
        if (error instanceof FeignException feignException && feignException.status() > 0) {
            return classifyStatus(dependency, feignException);
        }
        if (hasCause(error, IOException.class)) {
            return DependencyCallResult.failure(FailureKind.UNAVAILABLE,
                    dependency + " is unreachable: " + rootMessage(error));
        }

        log.error("Unexpected transport failure calling {}", dependency, error);
        return DependencyCallResult.failure(FailureKind.INTERNAL,
                dependency + " call failed unexpectedly");
    }

    private <T> DependencyCallResult<T> classifyStatus(String dependency, FeignException e) {
        int status = e.status();
        FailureKind kind = switch (status) {
            case 404 -> FailureKind.NOT_FOUND;
            case 400, 409, 422 -> FailureKind.INVALID_ARGUMENT;
            case 408 -> FailureKind.TIMEOUT;
            case 429, 502, 503, 504 -> FailureKind.UNAVAILABLE;
            default -> FailureKind.INTERNAL;
        };

        if (kind.isClientError()) {
            String detail = problemDetail(e);
            return DependencyCallResult.failure(kind, detail != null
                    ? detail
                    : dependency + " rejected the request (status " + status + ")");
        }
        if (kind == FailureKind.INTERNAL) {
            log.warn("{} responded with status {}", dependency, status);
        }
        return DependencyCallResult.failure(kind, dependency + " responded with status " + status);
    }

    /** ProblemDetail 본문의 detail (없으면 ApiResponse의 message) */
    private String problemDetail(FeignException e) {
        String body = e.contentUTF8();
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            JsonNode detail = node.hasNonNull("detail") ? node.get("detail") : node.get("message");
            return detail != null && detail.isTextual() ? detail.asText() : null;
        } catch (IOException parseFailure) {
            log.debug("Non-JSON error body from downstream: {}", parseFailure.getMessage());
            return null;
        }
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (type.isInstance(current)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }

    private static String rootMessage(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
