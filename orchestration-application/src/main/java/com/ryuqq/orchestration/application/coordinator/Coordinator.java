package com.ryuqq.orchestration.application.coordinator;

import com.ryuqq.orchestration.core.exception.CyclicDependencyException;
import com.ryuqq.orchestration.core.model.Action;
import com.ryuqq.orchestration.core.model.ExecutionPlan;

import java.util.List;

/**
 * Execution Coordinator.
 *
 * <p>의존성 그래프로부터 실행 레벨을 계산하고, 레벨 순서대로 Action을 Router에 전송합니다.</p>
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * plan(actions)
 *   ↓ 위상 정렬 (BFS 레벨링), 순환 시 CyclicDependencyException
 * run(plan, options)
 *   for each level:
 *     1. 취소 확인 → 미전송 Action은 CANCELLED
 *     2. 레벨 내 Action 동시 전송 (maxConcurrency 제한)
 *        a. 예산 사전 검사 (HALT → BUDGET_EXCEEDED)
 *        b. Router.route(...)
 *        c. transient 실패 + 시도 여유 → 백오프 후 다음 후보 Provider로 재전송
 *     3. 레벨 완료 대기 (barrier)
 *     4. stopOnFailure && 실패 존재 → 이후 레벨 SKIPPED_DUE_TO_UPSTREAM_FAILURE
 * </pre>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public interface Coordinator {

    /**
     * 실행 계획 수립.
     *
     * @param actions 제출된 Action 목록
     * @return 레벨 순서의 실행 계획
     * @throws CyclicDependencyException 의존성 순환이 있는 경우 (어떤 Action도 실행되지 않음)
     * @throws IllegalArgumentException 중복 ID 또는 알 수 없는 의존성이 있는 경우
     */
    ExecutionPlan plan(List<Action> actions);

    /**
     * 실행 계획 수행.
     *
     * <p>반환 시점에 모든 Action은 정확히 하나의 종료 상태 결과를 가집니다.</p>
     *
     * @param plan 실행 계획
     * @param options 실행 옵션
     * @return 실행 요약
     */
    ExecutionSummary run(ExecutionPlan plan, RunOptions options);

    /**
     * 기본 옵션으로 실행 계획 수행.
     *
     * @param plan 실행 계획
     * @return 실행 요약
     */
    default ExecutionSummary run(ExecutionPlan plan) {
        return run(plan, RunOptions.defaults());
    }
}
