package com.cafeflow.common.exception;

import com.cafeflow.common.resilience.FailureKind;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * 에러 코드 열거형 (Error Code Enum)
 *
 * <p>게이트웨이와 주문 서비스가 공유하는 에러 코드. 각 코드는 HTTP 상태 코드와
 * 클라이언트에게 보여줄 기본 메시지를 가진다.</p>
 *
 * <h3>FailureKind → 외부 상태 코드 매핑 (전체 매핑, 누락 없음)</h3>
 * <pre>
 *   NOT_FOUND               → 404 Not Found
 *   INVALID_ARGUMENT        → 400 Bad Request
 *   DEPENDENCY_UNAVAILABLE  → 503 Service Unavailable
 *   TIMEOUT                 → 503 Service Unavailable
 *   CONNECTION_REFUSED      → 503 Service Unavailable
 *   UNAVAILABLE             → 503 Service Unavailable
 *   INTERNAL                → 500 Internal Server Error
 * </pre>
 *
 * <p>{@link #of(FailureKind)}는 switch 식으로 작성되어 있어 FailureKind에 새 값이 추가되면
 * 컴파일 단계에서 누락이 드러난다.</p>
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // ── Common ──
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "Invalid input value"),
    ENTITY_NOT_FOUND(HttpStatus.NOT_FOUND, "Entity not found"),
    // 브레이커/재시도 내부 용어를 노출하지 않는 메시지
    SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable. Please try again later"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred"),

    // ── Order ──
    ORDER_NOT_FOUND(HttpStatus.NOT_FOUND, "Order not found");

    private final HttpStatus status;   // HTTP 응답 상태 코드
    private final String message;      // 기본 에러 메시지

    public static ErrorCode of(FailureKind kind) {
        return switch (kind) {
            case NOT_FOUND -> ENTITY_NOT_FOUND;
            case INVALID_ARGUMENT -> INVALID_INPUT;
            case DEPENDENCY_UNAVAILABLE, TIMEOUT, CONNECTION_REFUSED, UNAVAILABLE -> SERVICE_UNAVAILABLE;
            case INTERNAL -> INTERNAL_ERROR;
        };
    }

    /** 4xx 코드만 상세 메시지를 클라이언트에 그대로 전달한다. */
    public boolean exposesDetail() {
        return status.is4xxClientError();
    }
}
