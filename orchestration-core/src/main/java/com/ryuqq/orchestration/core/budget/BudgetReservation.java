package com.ryuqq.orchestration.core.budget;

import com.ryuqq.orchestration.core.error.ActionError;

/**
 * 사전 예산 검사 결과이자 예약 토큰.
 *
 * <p>HALT가 아닌 경우 예상 비용이 예약되며, 호출 완료 후
 * {@link BudgetLedger#updateAfterCall} 또는 {@link BudgetLedger#release}로 해제해야 합니다.</p>
 *
 * @param id 예약 ID (HALT인 경우 0)
 * @param reservedUsd 예약 금액
 * @param action 가상 상태(현재 비용 + 진행 중 예약 + 예상 비용)에 대한 판정
 * @param degradation DEGRADE인 경우 권고 설정 (그 외 null)
 * @param error HALT인 경우 BUDGET_EXCEEDED 오류 (그 외 null)
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record BudgetReservation(
    long id,
    double reservedUsd,
    GuardrailAction action,
    DegradationConfig degradation,
    ActionError error
) {

    public BudgetReservation {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (action == GuardrailAction.HALT && error == null) {
            throw new IllegalArgumentException("halted reservation must carry an error");
        }
    }

    public static BudgetReservation halted(ActionError error) {
        return new BudgetReservation(0L, 0.0, GuardrailAction.HALT, null, error);
    }

    public boolean isHalted() {
        return action == GuardrailAction.HALT;
    }
}
