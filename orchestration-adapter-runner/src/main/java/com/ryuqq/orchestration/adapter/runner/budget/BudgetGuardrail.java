package com.ryuqq.orchestration.adapter.runner.budget;

import com.ryuqq.orchestration.core.budget.BudgetState;
import com.ryuqq.orchestration.core.budget.BudgetStatus;
import com.ryuqq.orchestration.core.budget.DegradationConfig;
import com.ryuqq.orchestration.core.budget.GuardrailAction;
import com.ryuqq.orchestration.core.budget.GuardrailConfig;
import com.ryuqq.orchestration.core.error.ActionError;
import com.ryuqq.orchestration.core.error.ErrorKind;

import java.util.Locale;

/**
 * 예산 Guardrail.
 *
 * <p><strong>판정 순서:</strong></p>
 * <ol>
 *   <li>초과 플래그 설정 → HALT</li>
 *   <li>사용률 &ge; hardLimitThreshold → HALT</li>
 *   <li>사용률 &ge; softLimitThreshold → DEGRADE (점진적 저하 비활성화 시 HALT)</li>
 *   <li>경고 임계값 도달 → WARN</li>
 *   <li>그 외 → CONTINUE</li>
 * </ol>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public class BudgetGuardrail {

    static final String SUGGESTION = "Retry with a higher budget limit or simplify your request";

    private final CostTracker costTracker;
    private final GuardrailConfig config;

    public BudgetGuardrail(CostTracker costTracker) {
        this(costTracker, new GuardrailConfig());
    }

    public BudgetGuardrail(CostTracker costTracker, GuardrailConfig config) {
        if (costTracker == null) {
            throw new IllegalArgumentException("costTracker cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.costTracker = costTracker;
        this.config = config;
    }

    /**
     * Guardrail 판정.
     *
     * @param state 예산 상태 (사전 검사 시 예상 비용을 더한 가상 상태)
     * @return 판정 결과
     */
    public GuardrailAction check(BudgetState state) {
        BudgetStatus status = costTracker.checkBudgetStatus(state);

        if (status.exceeded()) {
            return GuardrailAction.HALT;
        }
        if (status.usage() >= config.hardLimitThreshold()) {
            return GuardrailAction.HALT;
        }
        if (status.usage() >= config.softLimitThreshold()) {
            return config.enableGracefulDegradation() ? GuardrailAction.DEGRADE : GuardrailAction.HALT;
        }
        if (status.warning()) {
            return GuardrailAction.WARN;
        }
        return GuardrailAction.CONTINUE;
    }

    public boolean shouldHalt(BudgetState state) {
        return check(state) == GuardrailAction.HALT;
    }

    /**
     * 점진적 저하 권고 조회.
     *
     * @param state 예산 상태
     * @return DEGRADE인 경우 권고 설정, 그 외 null
     */
    public DegradationConfig degradationConfig(BudgetState state) {
        if (check(state) != GuardrailAction.DEGRADE) {
            return null;
        }
        Integer maxContextTokens = null;
        if (config.reduceContextOnDegradation()) {
            maxContextTokens = (int) (state.maxContextTokens() * config.contextReductionFactor());
        }
        return new DegradationConfig(config.fallbackModel(), maxContextTokens);
    }

    /**
     * 예산 초과 오류 생성.
     *
     * @param state 예산 상태
     * @return BUDGET_EXCEEDED 오류
     */
    public ActionError budgetExceededError(BudgetState state) {
        return budgetExceededError(state, state.totalCostUsd());
    }

    /**
     * 예상 비용을 포함한 예산 초과 오류 생성.
     *
     * @param state 현재 예산 상태
     * @param projectedCostUsd 예상 비용을 더한 누적 비용
     * @return BUDGET_EXCEEDED 오류
     */
    public ActionError budgetExceededError(BudgetState state, double projectedCostUsd) {
        BudgetStatus status = costTracker.checkBudgetStatus(state);
        String message = String.format(Locale.ROOT, "Budget limit of $%.2f exceeded. Current cost: $%.2f",
            state.limitUsd(), status.usedUsd());
        return ActionError.of(ErrorKind.BUDGET_EXCEEDED, message)
            .withAttribute("budgetLimitUsd", state.limitUsd())
            .withAttribute("currentCostUsd", status.usedUsd())
            .withAttribute("projectedCostUsd", projectedCostUsd)
            .withAttribute("budgetUsage", status.usage())
            .withAttribute("suggestion", SUGGESTION);
    }

    public CostTracker getCostTracker() {
        return costTracker;
    }

    public GuardrailConfig getConfig() {
        return config;
    }
}
