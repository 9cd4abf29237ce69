package com.cafeflow.common.resilience;

import java.util.Objects;
import java.util.function.Function;

/**
 * 다운스트림 호출 결과 (Success | Failure)
 *
 * <p>예외 대신 값으로 실패를 전달하는 태그드 유니온. {@code kind == null}이면 성공이다.
 * 어댑터는 전송 계층 예외를 모두 이 타입으로 변환하므로, 호출자는
 * 실패 종류({@link FailureKind})를 잃지 않고 그대로 위로 전파할 수 있다.</p>
 *
 * <pre>
 *   DependencyCallResult&lt;UserSnapshot&gt; result = usersClient.getUser(42L);
 *   if (result.isFailure()) {
 *       return DependencyCallResult.failure(result.kind(), result.message());
 *   }
 *   UserSnapshot user = result.payload();
 * </pre>
 *
 * @param <T> 성공 시 페이로드 타입
 */
public record DependencyCallResult<T>(
        T payload,          // 성공 시 응답 데이터 (실패 시 null)
        FailureKind kind,   // 실패 종류 (성공 시 null)
        String message      // 실패 메시지 (성공 시 null)
) {

    public static <T> DependencyCallResult<T> success(T payload) {
        return new DependencyCallResult<>(payload, null, null);
    }

    public static <T> DependencyCallResult<T> failure(FailureKind kind, String message) {
        Objects.requireNonNull(kind, "kind");
        return new DependencyCallResult<>(null, kind, message);
    }

    public boolean isSuccess() {
        return kind == null;
    }

    public boolean isFailure() {
        return kind != null;
    }

    /** 실패 종류와 메시지를 유지한 채 페이로드 타입만 바꾼다. */
    @SuppressWarnings("unchecked")
    public <R> DependencyCallResult<R> castFailure() {
        if (isSuccess()) {
            throw new IllegalStateException("Cannot cast a successful result");
        }
        return (DependencyCallResult<R>) this;
    }

    public <R> DependencyCallResult<R> map(Function<? super T, ? extends R> mapper) {
        if (isFailure()) {
            return castFailure();
        }
        return success(mapper.apply(payload));
    }

    public <R> DependencyCallResult<R> flatMap(Function<? super T, DependencyCallResult<R>> mapper) {
        if (isFailure()) {
            return castFailure();
        }
        return mapper.apply(payload);
    }
}
