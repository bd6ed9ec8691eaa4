package com.ryuqq.orchestration.core.provider;

/**
 * Provider 요청당 비용 모델.
 *
 * <p>1K 토큰당 입력/출력 가격(USD)으로 요청 비용을 계산합니다.</p>
 *
 * @param inputPricePer1k 1K 입력 토큰당 가격
 * @param outputPricePer1k 1K 출력 토큰당 가격
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record CostModel(double inputPricePer1k, double outputPricePer1k) {

    /**
     * 무료 비용 모델.
     */
    public static final CostModel FREE = new CostModel(0.0, 0.0);

    public CostModel {
        if (inputPricePer1k < 0) {
            throw new IllegalArgumentException("inputPricePer1k must be non-negative (current: " + inputPricePer1k + ")");
        }
        if (outputPricePer1k < 0) {
            throw new IllegalArgumentException(
                "outputPricePer1k must be non-negative (current: " + outputPricePer1k + ")");
        }
    }

    /**
     * 토큰 사용량에 대한 비용 계산.
     *
     * @param inputTokens 입력 토큰 수
     * @param outputTokens 출력 토큰 수
     * @return 비용 (USD)
     */
    public double cost(long inputTokens, long outputTokens) {
        return (inputTokens / 1000.0) * inputPricePer1k + (outputTokens / 1000.0) * outputPricePer1k;
    }
}
