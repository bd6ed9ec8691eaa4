package com.ryuqq.orchestration.core.budget;

/**
 * 예산 사용 현황.
 *
 * @param usedUsd 사용 금액
 * @param remainingUsd 잔여 금액 (0 이상)
 * @param usage 사용률 (사용 금액 / 한도)
 * @param warning 경고 임계값 도달 여부
 * @param exceeded 한도 초과 여부
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record BudgetStatus(
    double usedUsd,
    double remainingUsd,
    double usage,
    boolean warning,
    boolean exceeded
) {
}
