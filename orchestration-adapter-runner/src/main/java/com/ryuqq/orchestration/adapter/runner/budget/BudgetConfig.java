package com.ryuqq.orchestration.adapter.runner.budget;

import com.ryuqq.orchestration.core.budget.GuardrailConfig;
import com.ryuqq.orchestration.core.budget.ModelPricing;
import com.ryuqq.orchestration.core.budget.PricingRegistry;

import java.util.List;

/**
 * 요청 체인 예산 설정 (불변 record).
 *
 * @param limitUsd 체인당 예산 한도 (USD, 기본 10.0)
 * @param guardrail Guardrail 설정
 * @param pricing 기본 단가에 추가/덮어쓸 모델 단가
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record BudgetConfig(double limitUsd, GuardrailConfig guardrail, List<ModelPricing> pricing) {

    public BudgetConfig() {
        this(10.0, new GuardrailConfig(), List.of());
    }

    public BudgetConfig {
        if (limitUsd <= 0) {
            throw new IllegalArgumentException("limitUsd must be positive (current: " + limitUsd + ")");
        }
        guardrail = guardrail == null ? new GuardrailConfig() : guardrail;
        pricing = pricing == null ? List.of() : List.copyOf(pricing);
    }

    public BudgetConfig withLimitUsd(double limitUsd) {
        return new BudgetConfig(limitUsd, guardrail, pricing);
    }

    public BudgetConfig withGuardrail(GuardrailConfig guardrail) {
        return new BudgetConfig(limitUsd, guardrail, pricing);
    }

    /**
     * 기본 단가에 설정된 단가를 덮어쓴 레지스트리 생성.
     *
     * @return 새 레지스트리
     */
    public PricingRegistry newPricingRegistry() {
        PricingRegistry registry = new PricingRegistry();
        pricing.forEach(registry::register);
        return registry;
    }

    /**
     * 이 설정으로 Guardrail 생성.
     *
     * @return Guardrail
     */
    public BudgetGuardrail newGuardrail() {
        CostTracker tracker = new CostTracker(newPricingRegistry(), limitUsd, guardrail.warningThreshold());
        return new BudgetGuardrail(tracker, guardrail);
    }
}
