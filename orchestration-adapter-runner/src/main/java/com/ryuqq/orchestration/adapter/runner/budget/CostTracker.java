package com.ryuqq.orchestration.adapter.runner.budget;

import com.ryuqq.orchestration.core.budget.BudgetState;
import com.ryuqq.orchestration.core.budget.BudgetStatus;
import com.ryuqq.orchestration.core.budget.PricingRegistry;

import java.time.Instant;

/**
 * 호출 비용 계산 및 예산 상태 갱신.
 *
 * <p>모델 단가는 {@link PricingRegistry}에서 조회하며, 등록되지 않은 모델은
 * 기본 단가로 계산합니다.</p>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public class CostTracker {

    private final PricingRegistry pricing;
    private final double limitUsd;
    private final double warningThreshold;

    /**
     * 생성자.
     *
     * @param pricing 모델 단가 레지스트리
     * @param limitUsd 예산 한도 (USD, 양수)
     * @param warningThreshold 경고 임계값 (0 초과 1 이하)
     */
    public CostTracker(PricingRegistry pricing, double limitUsd, double warningThreshold) {
        if (pricing == null) {
            throw new IllegalArgumentException("pricing cannot be null");
        }
        if (limitUsd <= 0) {
            throw new IllegalArgumentException("limitUsd must be positive (current: " + limitUsd + ")");
        }
        if (warningThreshold <= 0 || warningThreshold > 1.0) {
            throw new IllegalArgumentException(
                "warningThreshold must be in (0, 1] (current: " + warningThreshold + ")");
        }
        this.pricing = pricing;
        this.limitUsd = limitUsd;
        this.warningThreshold = warningThreshold;
    }

    /**
     * 호출 비용 계산.
     *
     * @param model 모델명 (null이면 기본 단가)
     * @param inputTokens 입력 토큰 수
     * @param outputTokens 출력 토큰 수
     * @return 비용 (USD)
     */
    public double calculateCost(String model, long inputTokens, long outputTokens) {
        return pricing.getPricing(model).cost(inputTokens, outputTokens);
    }

    /**
     * 비어 있는 예산 상태 생성.
     *
     * @param now 세션 시작 시각
     * @return 초기 상태
     */
    public BudgetState newState(Instant now) {
        return BudgetState.initial(limitUsd, warningThreshold, now);
    }

    /**
     * 호출 한 건의 사용량을 반영한 새 상태.
     *
     * @param state 현재 상태
     * @param model 모델명
     * @param node 노드 이름
     * @param inputTokens 입력 토큰 수
     * @param outputTokens 출력 토큰 수
     * @param now 갱신 시각
     * @return 갱신된 상태
     */
    public BudgetState updateBudgetState(BudgetState state, String model, String node,
                                         long inputTokens, long outputTokens, Instant now) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (model == null) {
            throw new IllegalArgumentException("model cannot be null");
        }
        if (node == null) {
            throw new IllegalArgumentException("node cannot be null");
        }
        double cost = calculateCost(model, inputTokens, outputTokens);
        return state.plus(model, node, inputTokens, outputTokens, cost, now);
    }

    /**
     * 예산 사용 현황 계산.
     *
     * <p>경고 여부는 상태에 기록된 경고 임계값 기준이며, 사용률이 1 이상이거나
     * 초과 플래그가 설정되어 있으면 초과로 판정합니다.</p>
     *
     * @param state 예산 상태
     * @return 사용 현황
     */
    public BudgetStatus checkBudgetStatus(BudgetState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        double used = state.totalCostUsd();
        double usage = state.usage();
        return new BudgetStatus(used, Math.max(0.0, state.limitUsd() - used), usage,
            usage >= state.warningThreshold(), state.exceeded() || usage >= 1.0);
    }

    public double getLimitUsd() {
        return limitUsd;
    }

    public double getWarningThreshold() {
        return warningThreshold;
    }

    public PricingRegistry getPricing() {
        return pricing;
    }
}
