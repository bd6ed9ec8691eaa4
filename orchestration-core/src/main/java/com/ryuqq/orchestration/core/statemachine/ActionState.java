package com.ryuqq.orchestration.core.statemachine;

/**
 * Action 실행 상태.
 *
 * <p><strong>상태 전이 흐름:</strong></p>
 * <pre>
 * PENDING → DISPATCHED → SUCCEEDED
 *    │           │
 *    │           ├→ RETRYING → DISPATCHED (다음 후보 Provider)
 *    │           │      └→ CANCELLED
 *    │           └→ FAILED
 *    ├→ FAILED (예산 초과, 전송되지 않음)
 *    ├→ SKIPPED (상위 실패)
 *    └→ CANCELLED (배치 취소)
 * </pre>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public enum ActionState {

    /** 제출되었으나 아직 전송되지 않음 */
    PENDING,

    /** Router를 통해 전송됨 */
    DISPATCHED,

    /** 일시적 실패 후 백오프 대기 중 */
    RETRYING,

    /** 성공 (종료 상태) */
    SUCCEEDED,

    /** 실패 (종료 상태) */
    FAILED,

    /** 상위 레벨 실패로 건너뜀 (종료 상태) */
    SKIPPED,

    /** 배치 취소로 전송되지 않음 (종료 상태) */
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * @return SUCCEEDED, FAILED, SKIPPED, CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED || this == CANCELLED;
    }
}
