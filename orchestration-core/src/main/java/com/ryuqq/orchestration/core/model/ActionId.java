package com.ryuqq.orchestration.core.model;

/**
 * Action의 배치 내 고유 식별자.
 *
 * <p>ActionId는 상위 Planner가 부여하며, 의존성 그래프의 노드 키로 사용됩니다.
 * 동일 배치 안에서 두 Action이 같은 ActionId를 가질 수 없습니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 점(.)만 허용</li>
 * </ul>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public final class ActionId {

    private final String value;

    private ActionId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ActionId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("ActionId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.]+$")) {
            throw new IllegalArgumentException(
                "ActionId contains invalid characters. Only alphanumeric, hyphen, underscore and dot are allowed");
        }
        this.value = value;
    }

    /**
     * ActionId 생성.
     *
     * @param value ActionId 값
     * @return ActionId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ActionId of(String value) {
        return new ActionId(value);
    }

    /**
     * ActionId 값 조회.
     *
     * @return ActionId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ActionId actionId = (ActionId) o;
        return value.equals(actionId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
