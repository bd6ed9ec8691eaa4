package com.ryuqq.orchestration.core.budget;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 모델 가격 레지스트리.
 *
 * <p>알려진 모델의 기본 가격을 가지고 시작하며, 등록되지 않은 모델에는
 * 보수적인 기본 가격(입력 0.01, 출력 0.03 / 1K 토큰)을 적용합니다.</p>
 *
 * <p>Thread-safe 합니다.</p>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public final class PricingRegistry {

    /**
     * 미등록 모델 기본 가격.
     */
    public static final ModelPricing DEFAULT_PRICING = new ModelPricing("unknown", 0.01, 0.03, "unknown");

    private final Map<String, ModelPricing> pricing = new ConcurrentHashMap<>();

    /**
     * 기본 모델 가격이 등록된 레지스트리 생성.
     */
    public PricingRegistry() {
        register(new ModelPricing("gpt-4", 0.03, 0.06, "openai"));
        register(new ModelPricing("gpt-4-turbo", 0.01, 0.03, "openai"));
        register(new ModelPricing("gpt-3.5-turbo", 0.0005, 0.0015, "openai"));
        register(new ModelPricing("claude-opus", 0.015, 0.075, "anthropic"));
        register(new ModelPricing("claude-sonnet", 0.003, 0.015, "anthropic"));
        register(new ModelPricing("claude-haiku", 0.00025, 0.00125, "anthropic"));
    }

    /**
     * 모델 가격 조회.
     *
     * @param modelName 모델명 (null이면 기본 가격)
     * @return 등록된 가격 또는 기본 가격
     */
    public ModelPricing getPricing(String modelName) {
        if (modelName == null) {
            return DEFAULT_PRICING;
        }
        return pricing.getOrDefault(modelName, DEFAULT_PRICING);
    }

    /**
     * 모델 가격 등록 또는 갱신.
     *
     * @param modelPricing 가격 정보
     */
    public void register(ModelPricing modelPricing) {
        if (modelPricing == null) {
            throw new IllegalArgumentException("modelPricing cannot be null");
        }
        pricing.put(modelPricing.modelName(), modelPricing);
    }

    public boolean isRegistered(String modelName) {
        return modelName != null && pricing.containsKey(modelName);
    }
}
