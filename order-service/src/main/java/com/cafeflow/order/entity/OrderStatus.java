package com.cafeflow.order.entity;

/**
 * 주문 상태
 *
 * <p>주문은 사용자 검증과 모든 항목의 가격 확정이 끝난 뒤에만 저장되므로
 * 저장된 주문은 항상 CREATED로 시작한다. 실패한 워크플로는 아무것도 남기지 않는다.</p>
 */
public enum OrderStatus {
    CREATED
}
