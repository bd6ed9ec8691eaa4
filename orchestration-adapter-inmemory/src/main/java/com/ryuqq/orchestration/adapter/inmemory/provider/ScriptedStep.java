package com.ryuqq.orchestration.adapter.inmemory.provider;

import com.ryuqq.orchestration.core.provider.ProviderResponse;

/**
 * {@link ProviderScript}의 단일 단계.
 *
 * <p>{@code response}와 {@code failure} 중 정확히 하나만 지정됩니다.
 * {@code delayMs}만큼 대기한 뒤 응답하거나 예외를 던집니다.</p>
 *
 * @param delayMs 응답 전 지연 (밀리초, 0 이상)
 * @param response 반환할 응답 (실패 단계면 null)
 * @param failure 던질 예외 (성공 단계면 null)
 * @author Orchestration Team
 * @since 1.0.0
 */
public record ScriptedStep(long delayMs, ProviderResponse response, RuntimeException failure) {

    public ScriptedStep {
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must be non-negative (current: " + delayMs + ")");
        }
        if ((response == null) == (failure == null)) {
            throw new IllegalArgumentException("exactly one of response or failure must be set");
        }
    }

    public static ScriptedStep respond(ProviderResponse response) {
        return new ScriptedStep(0L, response, null);
    }

    public static ScriptedStep fail(RuntimeException failure) {
        return new ScriptedStep(0L, null, failure);
    }

    public ScriptedStep withDelayMs(long delayMs) {
        return new ScriptedStep(delayMs, response, failure);
    }

    public boolean isFailure() {
        return failure != null;
    }
}
