package com.ryuqq.orchestration.core.exception;

import com.ryuqq.orchestration.core.model.ActionId;

import java.util.List;
import java.util.Set;

/**
 * 의존성 그래프에 순환이 존재할 때 발생하는 예외.
 *
 * <p>실행 계획 수립 단계에서 즉시 발생하며, 어떤 Action도 실행되지 않습니다.
 * 순환은 호출자(Planner)의 오류이므로 자동으로 보정하지 않습니다.</p>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public class CyclicDependencyException extends RuntimeException {

    private final Set<ActionId> unresolved;

    /**
     * 생성자.
     *
     * @param unresolved 진입 차수가 0이 되지 못한 Action ID 집합
     */
    public CyclicDependencyException(Set<ActionId> unresolved) {
        super("Cyclic dependency detected among actions: " + sorted(unresolved));
        this.unresolved = Set.copyOf(unresolved);
    }

    /**
     * 순환에 걸려 실행할 수 없는 Action ID 조회.
     *
     * @return 미해결 Action ID 집합
     */
    public Set<ActionId> getUnresolved() {
        return unresolved;
    }

    private static List<String> sorted(Set<ActionId> ids) {
        return ids.stream().map(ActionId::getValue).sorted().toList();
    }
}
