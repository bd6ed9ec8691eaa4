package com.ryuqq.orchestration.core.provider;

import com.ryuqq.orchestration.core.model.Action;

import java.util.Map;

/**
 * Provider에게 전달되는 요청.
 *
 * <p>파라미터 맵은 Orchestration에서 해석하지 않고 그대로 전달됩니다.</p>
 *
 * @param requestId 요청 식별자 (로깅/추적용)
 * @param type 작업 유형
 * @param parameters 파라미터
 * @param model 요청 모델 (null이면 Provider 기본 모델)
 * @param timeoutMs 시도당 타임아웃 (밀리초)
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record ProviderRequest(
    String requestId,
    String type,
    Map<String, Object> parameters,
    String model,
    long timeoutMs
) {

    public ProviderRequest {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId cannot be null or blank");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive (current: " + timeoutMs + ")");
        }
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    /**
     * Action으로부터 요청 생성.
     *
     * @param action 실행할 Action
     * @return 요청 (모델은 예상 비용의 모델)
     */
    public static ProviderRequest from(Action action) {
        String model = action.estimate() == null ? null : action.estimate().model();
        return new ProviderRequest(action.id().getValue(), action.type(), action.parameters(), model,
            action.timeoutMs());
    }
}
