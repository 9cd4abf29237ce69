package com.cafeflow.order.workflow;

/**
 * 주문 생성 워크플로 상태
 *
 * <pre>
 * START → VALIDATING_USER → RESOLVING_ITEMS → PERSISTING → COMPLETED
 *              │                  │               │
 *              └──────────────────┴───────────────┴──────→ FAILED
 * </pre>
 */
public enum OrderWorkflowState {
    START,
    VALIDATING_USER,
    RESOLVING_ITEMS,
    PERSISTING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
