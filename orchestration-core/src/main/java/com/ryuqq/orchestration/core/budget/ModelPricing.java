package com.ryuqq.orchestration.core.budget;

/**
 * 모델별 가격 정보.
 *
 * @param modelName 모델명
 * @param inputPricePer1k 1K 입력 토큰당 가격 (USD)
 * @param outputPricePer1k 1K 출력 토큰당 가격 (USD)
 * @param provider 공급사 이름 (null 가능)
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record ModelPricing(
    String modelName,
    double inputPricePer1k,
    double outputPricePer1k,
    String provider
) {

    public ModelPricing {
        if (modelName == null || modelName.isBlank()) {
            throw new IllegalArgumentException("modelName cannot be null or blank");
        }
        if (inputPricePer1k < 0 || outputPricePer1k < 0) {
            throw new IllegalArgumentException("prices must be non-negative (current: "
                + inputPricePer1k + ", " + outputPricePer1k + ")");
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
