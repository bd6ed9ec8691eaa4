package com.ryuqq.orchestration.core.error;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 구조화된 실패 정보.
 *
 * <p>ErrorKind와 메시지 외에, 호출자가 후속 조치를 결정할 수 있도록
 * 부가 속성(attributes)을 담습니다. 예를 들어 BUDGET_EXCEEDED는
 * 현재 비용과 한도를 속성으로 포함합니다.</p>
 *
 * @param kind 실패 분류
 * @param message 실패 메시지
 * @param attributes 부가 속성 (null이면 빈 맵)
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record ActionError(
    ErrorKind kind,
    String message,
    Map<String, Object> attributes
) {

    public ActionError {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /**
     * 속성 없이 ActionError 생성.
     *
     * @param kind 실패 분류
     * @param message 실패 메시지
     * @return ActionError 인스턴스
     */
    public static ActionError of(ErrorKind kind, String message) {
        return new ActionError(kind, message, Map.of());
    }

    /**
     * 속성을 하나 추가한 새 인스턴스 생성.
     *
     * @param key 속성 키
     * @param value 속성 값 (null 불가)
     * @return 새 ActionError
     */
    public ActionError withAttribute(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(attributes);
        merged.put(key, value);
        return new ActionError(kind, message, merged);
    }

    public boolean isTransient() {
        return kind.isTransient();
    }

    @Override
    public String toString() {
        return kind + ": " + message + (attributes.isEmpty() ? "" : " " + attributes);
    }
}
