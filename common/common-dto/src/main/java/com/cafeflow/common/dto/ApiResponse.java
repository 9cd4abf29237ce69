package com.cafeflow.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 공통 API 응답 래퍼 (Common API Response Wrapper)
 *
 * <p>게이트웨이와 주문 서비스의 성공 응답 형식. 실패 응답은
 * GlobalExceptionHandler가 만드는 RFC 7807 ProblemDetail을 사용한다.</p>
 *
 * <h3>사용 예시</h3>
 * <pre>
 *   // 성공: {"success": true, "data": {...}}
 *   return ApiResponse.ok(orderView);
 * </pre>
 *
 * <p>Feign 클라이언트도 같은 타입으로 백엔드 응답을 역직렬화한다
 * ({@code ApiResponse<UserSnapshot>} 등).</p>
 *
 * @param <T> 응답 데이터의 타입 (제네릭)
 */
@JsonInclude(JsonInclude.Include.NON_NULL) // null 필드는 JSON에서 제외 (불필요한 네트워크 전송 방지)
public record ApiResponse<T>(
        boolean success, // 요청 성공 여부
        T data,          // 성공 시 응답 데이터 (실패 시 null)
        String message   // 부가 메시지 (대부분 null)
) {
    /** 성공 응답 팩토리 메서드 - data를 포함한 성공 응답 생성 */
    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }
}
