package com.ryuqq.orchestration.core.budget;

/**
 * 점진적 저하 권고 설정.
 *
 * <p>Guardrail이 DEGRADE를 반환한 경우에만 생성됩니다. 호출자는 호출 전에
 * 이 권고를 적용할 수 있으며, 권고 자체가 실행을 막지는 않습니다.</p>
 *
 * @param model 전환할 모델 (null이면 모델 유지)
 * @param maxContextTokens 축소된 최대 컨텍스트 토큰 수 (null이면 축소 없음)
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record DegradationConfig(String model, Integer maxContextTokens) {

    /**
     * Action 파라미터에 적용되는 컨텍스트 한도 키.
     */
    public static final String MAX_CONTEXT_TOKENS_KEY = "max_context_tokens";

    public boolean switchesModel() {
        return model != null;
    }

    public boolean reducesContext() {
        return maxContextTokens != null;
    }

    public boolean isEmpty() {
        return model == null && maxContextTokens == null;
    }
}
