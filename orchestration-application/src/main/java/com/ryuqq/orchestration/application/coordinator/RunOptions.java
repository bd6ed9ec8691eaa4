package com.ryuqq.orchestration.application.coordinator;

import com.ryuqq.orchestration.core.budget.BudgetLedger;

/**
 * 배치 실행 옵션.
 *
 * @param stopOnFailure 레벨에서 실패가 있으면 이후 레벨을 건너뛸지 여부
 * @param budget 요청 체인 예산 장부 (null이면 예산 검사 없음)
 * @param cancellation 취소 신호 (null이면 새 신호)
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record RunOptions(
    boolean stopOnFailure,
    BudgetLedger budget,
    CancellationSignal cancellation
) {

    public RunOptions {
        cancellation = cancellation == null ? new CancellationSignal() : cancellation;
    }

    /**
     * 기본 옵션 (실패 시 계속 진행, 예산 검사 없음).
     *
     * @return RunOptions
     */
    public static RunOptions defaults() {
        return new RunOptions(false, null, null);
    }

    public RunOptions withStopOnFailure(boolean stopOnFailure) {
        return new RunOptions(stopOnFailure, budget, cancellation);
    }

    public RunOptions withBudget(BudgetLedger budget) {
        return new RunOptions(stopOnFailure, budget, cancellation);
    }

    public RunOptions withCancellation(CancellationSignal cancellation) {
        return new RunOptions(stopOnFailure, budget, cancellation);
    }

    public boolean hasBudget() {
        return budget != null;
    }
}
