package com.cafeflow.common.exception;

import com.cafeflow.common.resilience.FailureKind;
import lombok.Getter;

/**
 * 비즈니스 예외 (Business Exception)
 *
 * <p>컨트롤러 경계에서 실패를 HTTP 응답으로 바꾸기 위해 던지는 unchecked 예외.
 * {@link ErrorCode}와 결합하여 상태 코드와 메시지를 함께 전달하고,
 * {@link GlobalExceptionHandler}가 RFC 7807 ProblemDetail로 변환한다.</p>
 *
 * <h3>사용 예시</h3>
 * <pre>
 *   // 고정 에러 코드
 *   throw new BusinessException(ErrorCode.ORDER_NOT_FOUND);
 *
 *   // 다운스트림 실패 종류를 그대로 번역
 *   throw BusinessException.of(result.kind(), result.message());
 * </pre>
 */
@Getter
public class BusinessException extends RuntimeException {

    /** 에러 코드 (HTTP 상태 코드 + 기본 메시지) */
    private final ErrorCode errorCode;

    /** 다운스트림 실패에서 비롯된 경우 원래 실패 종류 (로그용, 그 외 null) */
    private final FailureKind failureKind;

    public BusinessException(ErrorCode errorCode) {
        this(errorCode, errorCode.getMessage(), null);
    }

    public BusinessException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    private BusinessException(ErrorCode errorCode, String message, FailureKind failureKind) {
        super(message);
        this.errorCode = errorCode;
        this.failureKind = failureKind;
    }

    /**
     * 실패 종류를 외부 에러 코드로 번역.
     * 4xx는 상세 메시지를 유지하고, 5xx는 내부 사정을 숨긴 기본 메시지를 사용한다.
     */
    public static BusinessException of(FailureKind kind, String detail) {
        ErrorCode errorCode = ErrorCode.of(kind);
        String message = errorCode.exposesDetail() && detail != null ? detail : errorCode.getMessage();
        return new BusinessException(errorCode, message, kind);
    }
}
