package com.ryuqq.orchestration.core.provider;

/**
 * Provider 응답.
 *
 * @param payload 응답 본문 (Orchestration에서는 해석하지 않음, null 가능)
 * @param model 실제 응답한 모델 (null 가능)
 * @param inputTokens 소비한 입력 토큰 수
 * @param outputTokens 생성한 출력 토큰 수
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record ProviderResponse(
    Object payload,
    String model,
    long inputTokens,
    long outputTokens
) {

    public ProviderResponse {
        if (inputTokens < 0) {
            throw new IllegalArgumentException("inputTokens must be non-negative (current: " + inputTokens + ")");
        }
        if (outputTokens < 0) {
            throw new IllegalArgumentException("outputTokens must be non-negative (current: " + outputTokens + ")");
        }
    }

    public static ProviderResponse of(Object payload) {
        return new ProviderResponse(payload, null, 0, 0);
    }
}
