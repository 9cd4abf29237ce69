package com.cafeflow.common.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.net.URI;
import java.util.stream.Collectors;

/**
 * 전역 예외 처리기 (Global Exception Handler)
 *
 * <p>게이트웨이와 주문 서비스가 공유하는 중앙 집중식 예외 처리.
 * 모든 실패 응답을 RFC 7807 ProblemDetail 형식으로 통일한다.</p>
 *
 * <h3>처리하는 예외 유형</h3>
 * <ol>
 *   <li><b>BusinessException</b>: 번역된 다운스트림 실패, 도메인 규칙 위반</li>
 *   <li><b>MethodArgumentNotValidException</b>: Bean Validation 실패 → 400</li>
 *   <li><b>HttpMessageNotReadableException / 타입 불일치</b>: 잘못된 요청 본문/경로 → 400</li>
 *   <li><b>Exception</b>: 그 외 모든 예외 → 500 (스택 트레이스나 내부 타입을 응답에 노출하지 않음)</li>
 * </ol>
 *
 * <p>RFC 7807 ProblemDetail 응답 예시:</p>
 * <pre>
 *   {
 *     "type": "https://cafeflow.dev/errors/service_unavailable",
 *     "status": 503,
 *     "detail": "Service temporarily unavailable. Please try again later"
 *   }
 * </pre>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String ERROR_TYPE_BASE = "https://cafeflow.dev/errors/";

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ProblemDetail> handleBusinessException(BusinessException e) {
        ErrorCode errorCode = e.getErrorCode();
        if (errorCode.getStatus().is5xxServerError()) {
            log.warn("Request failed: code={}, kind={}, detail={}",
                    errorCode, e.getFailureKind(), e.getMessage());
        }
        return problem(errorCode.getStatus(), errorCode, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidation(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining(", "));
        return problem(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_INPUT,
                detail.isEmpty() ? ErrorCode.INVALID_INPUT.getMessage() : detail);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ProblemDetail> handleUnreadable(Exception e) {
        log.debug("Malformed request: {}", e.getMessage());
        return problem(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_INPUT,
                ErrorCode.INVALID_INPUT.getMessage());
    }

    /**
     * 예상하지 못한 예외. 전체 컨텍스트는 로그로만 남기고 응답에는 일반 메시지만 담는다.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnexpected(Exception e) {
        log.error("Unhandled exception", e);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.INTERNAL_ERROR,
                ErrorCode.INTERNAL_ERROR.getMessage());
    }

    private ResponseEntity<ProblemDetail> problem(HttpStatus status, ErrorCode errorCode, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        // type URI: 에러 코드명을 소문자로 변환하여 에러 문서 URI 생성
        problem.setType(URI.create(ERROR_TYPE_BASE + errorCode.name().toLowerCase()));
        return ResponseEntity.status(status).body(problem);
    }
}
