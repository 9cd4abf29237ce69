package com.cafeflow.common.resilience.breaker;

/**
 * 서킷 브레이커 상태
 *
 * <pre>
 * CLOSED ──(연속 실패 ≥ failureThreshold)──→ OPEN
 * OPEN ──(resetTimeout 경과 후 첫 호출)──→ HALF_OPEN
 * HALF_OPEN ──(연속 성공 ≥ successThreshold)──→ CLOSED
 * HALF_OPEN ──(실패 1회)──→ OPEN
 * </pre>
 */
public enum CircuitBreakerState {
    CLOSED,     // 정상 (실패 횟수 집계)
    OPEN,       // 차단 (호출 없이 즉시 실패)
    HALF_OPEN   // 시험 (복구 여부 확인)
}
