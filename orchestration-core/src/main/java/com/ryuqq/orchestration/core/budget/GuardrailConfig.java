package com.ryuqq.orchestration.core.budget;

/**
 * 예산 Guardrail 설정.
 *
 * <p><strong>판정 계단 (usage = cost / limit):</strong></p>
 * <ul>
 *   <li>exceeded 플래그 또는 usage &ge; 1.0 또는 usage &ge; hardLimitThreshold: HALT</li>
 *   <li>usage &ge; softLimitThreshold: 점진적 저하 활성화 시 DEGRADE, 아니면 HALT</li>
 *   <li>usage &ge; warningThreshold: WARN</li>
 *   <li>그 외: CONTINUE</li>
 * </ul>
 *
 * @param warningThreshold 경고 임계값 (기본 0.8)
 * @param softLimitThreshold 소프트 한도 임계값 (기본 0.9)
 * @param hardLimitThreshold 하드 한도 임계값 (기본 1.0, 1.0 이하)
 * @param enableGracefulDegradation 점진적 저하 활성화 (기본 true)
 * @param fallbackModel 저하 시 전환할 모델 (null 가능)
 * @param reduceContextOnDegradation 저하 시 컨텍스트 축소 여부 (기본 true)
 * @param contextReductionFactor 컨텍스트 축소 비율 (기본 0.5)
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record GuardrailConfig(
    double warningThreshold,
    double softLimitThreshold,
    double hardLimitThreshold,
    boolean enableGracefulDegradation,
    String fallbackModel,
    boolean reduceContextOnDegradation,
    double contextReductionFactor
) {

    public GuardrailConfig {
        if (warningThreshold <= 0.0) {
            throw new IllegalArgumentException("warningThreshold must be positive (current: " + warningThreshold + ")");
        }
        if (softLimitThreshold < warningThreshold) {
            throw new IllegalArgumentException(
                "softLimitThreshold must be >= warningThreshold (current: " + softLimitThreshold + ")");
        }
        if (hardLimitThreshold < softLimitThreshold || hardLimitThreshold > 1.0) {
            throw new IllegalArgumentException(
                "hardLimitThreshold must be between softLimitThreshold and 1.0 (current: " + hardLimitThreshold + ")");
        }
        if (contextReductionFactor <= 0.0 || contextReductionFactor > 1.0) {
            throw new IllegalArgumentException(
                "contextReductionFactor must be in (0, 1] (current: " + contextReductionFactor + ")");
        }
        if (fallbackModel != null && fallbackModel.isBlank()) {
            fallbackModel = null;
        }
    }

    /**
     * 기본 설정.
     */
    public GuardrailConfig() {
        this(0.8, 0.9, 1.0, true, null, true, 0.5);
    }

    public GuardrailConfig withThresholds(double warningThreshold, double softLimitThreshold) {
        return new GuardrailConfig(warningThreshold, softLimitThreshold, hardLimitThreshold,
            enableGracefulDegradation, fallbackModel, reduceContextOnDegradation, contextReductionFactor);
    }

    public GuardrailConfig withGracefulDegradation(boolean enableGracefulDegradation) {
        return new GuardrailConfig(warningThreshold, softLimitThreshold, hardLimitThreshold,
            enableGracefulDegradation, fallbackModel, reduceContextOnDegradation, contextReductionFactor);
    }

    public GuardrailConfig withFallbackModel(String fallbackModel) {
        return new GuardrailConfig(warningThreshold, softLimitThreshold, hardLimitThreshold,
            enableGracefulDegradation, fallbackModel, reduceContextOnDegradation, contextReductionFactor);
    }

    public GuardrailConfig withContextReduction(boolean reduceContextOnDegradation, double contextReductionFactor) {
        return new GuardrailConfig(warningThreshold, softLimitThreshold, hardLimitThreshold,
            enableGracefulDegradation, fallbackModel, reduceContextOnDegradation, contextReductionFactor);
    }
}
