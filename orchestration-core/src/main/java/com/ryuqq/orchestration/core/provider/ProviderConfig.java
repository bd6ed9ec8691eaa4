package com.ryuqq.orchestration.core.provider;

import com.ryuqq.orchestration.core.model.ProviderId;
import com.ryuqq.orchestration.core.protection.RateLimiterConfig;

/**
 * Provider 정적 설정.
 *
 * <p>시작 시점에 로드되며 이후 변경되지 않습니다.
 * 건강 상태는 별도로 {@code ProviderHealthMonitor}가 관리합니다.</p>
 *
 * @param id Provider ID
 * @param name 표시 이름
 * @param priority 우선순위 (낮을수록 선호, 0 이상)
 * @param endpoint 엔드포인트 기술자 (Orchestration에서는 해석하지 않음, null 가능)
 * @param rateLimit Provider별 Rate Limit
 * @param costModel 비용 모델
 * @param model 기본 모델명 (null 가능)
 * @param thresholds 건강 판정 임계값
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record ProviderConfig(
    ProviderId id,
    String name,
    int priority,
    String endpoint,
    RateLimiterConfig rateLimit,
    CostModel costModel,
    String model,
    HealthThresholds thresholds
) {

    public ProviderConfig {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (priority < 0) {
            throw new IllegalArgumentException("priority must be non-negative (current: " + priority + ")");
        }
        if (rateLimit == null) {
            throw new IllegalArgumentException("rateLimit cannot be null");
        }
        if (name == null || name.isBlank()) {
            name = id.getValue();
        }
        costModel = costModel == null ? CostModel.FREE : costModel;
        thresholds = thresholds == null ? new HealthThresholds() : thresholds;
    }

    /**
     * 기본값으로 Provider 설정 생성.
     *
     * @param id Provider ID 문자열
     * @param priority 우선순위
     * @return 초당 10건, 버스트 10의 Rate Limit을 가진 설정
     */
    public static ProviderConfig of(String id, int priority) {
        return new ProviderConfig(ProviderId.of(id), id, priority, null,
            new RateLimiterConfig(10.0, 10), CostModel.FREE, null, new HealthThresholds());
    }

    public ProviderConfig withRateLimit(RateLimiterConfig rateLimit) {
        return new ProviderConfig(id, name, priority, endpoint, rateLimit, costModel, model, thresholds);
    }

    public ProviderConfig withCostModel(CostModel costModel) {
        return new ProviderConfig(id, name, priority, endpoint, rateLimit, costModel, model, thresholds);
    }

    public ProviderConfig withModel(String model) {
        return new ProviderConfig(id, name, priority, endpoint, rateLimit, costModel, model, thresholds);
    }

    public ProviderConfig withThresholds(HealthThresholds thresholds) {
        return new ProviderConfig(id, name, priority, endpoint, rateLimit, costModel, model, thresholds);
    }
}
