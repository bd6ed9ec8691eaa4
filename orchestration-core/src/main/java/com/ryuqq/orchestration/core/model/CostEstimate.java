package com.ryuqq.orchestration.core.model;

/**
 * Action 실행 전 예상 비용 정보.
 *
 * <p>Budget Guardrail의 사전 검사(projected check)에 사용됩니다.
 * 모델 이름과 예상 입력/출력 토큰 수로 예상 비용을 산출합니다.</p>
 *
 * @param model 호출할 모델 이름 (예: gpt-4, claude-sonnet)
 * @param inputTokens 예상 입력 토큰 수 (0 이상)
 * @param outputTokens 예상 출력 토큰 수 (0 이상)
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record CostEstimate(
    String model,
    long inputTokens,
    long outputTokens
) {

    public CostEstimate {
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model cannot be null or blank");
        }
        if (inputTokens < 0) {
            throw new IllegalArgumentException("inputTokens must be non-negative (current: " + inputTokens + ")");
        }
        if (outputTokens < 0) {
            throw new IllegalArgumentException("outputTokens must be non-negative (current: " + outputTokens + ")");
        }
    }

    public static CostEstimate of(String model, long inputTokens, long outputTokens) {
        return new CostEstimate(model, inputTokens, outputTokens);
    }

    public CostEstimate withModel(String model) {
        return new CostEstimate(model, inputTokens, outputTokens);
    }
}
