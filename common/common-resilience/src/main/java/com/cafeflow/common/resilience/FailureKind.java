package com.cafeflow.common.resilience;

/**
 * 다운스트림 호출 실패 분류 (Failure Kind)
 *
 * <p>모든 Backend Client Adapter가 반환하는 {@link DependencyCallResult}의 실패 종류.
 * 어댑터 → 주문 워크플로 → 게이트웨이 번역 계층까지 종류가 그대로 보존되며,
 * 마지막 번역 단계에서만 HTTP 상태 코드로 변환된다.</p>
 *
 * <h3>분류 기준</h3>
 * <pre>
 *   클라이언트 오류 (재시도 X, 브레이커 실패로 집계 X)
 *     NOT_FOUND, INVALID_ARGUMENT
 *   일시적 장애 (재시도 O, 브레이커 실패로 집계 O)
 *     TIMEOUT, CONNECTION_REFUSED, UNAVAILABLE
 *   빠른 실패 (재시도 X, 브레이커 실패로 집계 O)
 *     DEPENDENCY_UNAVAILABLE  ← 서킷 OPEN 또는 디스커버리 실패
 *   치명적 오류 (재시도 X, 브레이커 실패로 집계 O)
 *     INTERNAL
 * </pre>
 */
public enum FailureKind {

    TIMEOUT,
    CONNECTION_REFUSED,
    // 서킷 OPEN 상태의 빠른 실패, 또는 서비스 디스커버리에서 인스턴스를 찾지 못한 경우
    DEPENDENCY_UNAVAILABLE,
    NOT_FOUND,
    INVALID_ARGUMENT,
    UNAVAILABLE,
    INTERNAL;

    /** 의존 서비스가 "정상적으로 거절"한 결과인지 (클라이언트 오류) */
    public boolean isClientError() {
        return this == NOT_FOUND || this == INVALID_ARGUMENT;
    }

    /** 기본 재시도 대상: 일시적일 가능성이 있는 장애만 */
    public boolean isTransient() {
        return this == TIMEOUT || this == CONNECTION_REFUSED || this == UNAVAILABLE;
    }

    /** 의존 서비스 장애로 보아 호출자에게 UNAVAILABLE로 노출해야 하는 종류 */
    public boolean isOutage() {
        return isTransient() || this == DEPENDENCY_UNAVAILABLE;
    }
}
