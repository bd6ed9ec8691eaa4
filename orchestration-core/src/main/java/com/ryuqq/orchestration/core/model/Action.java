package com.ryuqq.orchestration.core.model;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * 실행 단위 (Action).
 *
 * <p>Action은 상위 Planner가 생성하여 Coordinator에 제출하는 작업 단위이며,
 * 제출 이후에는 불변입니다. Coordinator는 Action을 읽기만 합니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>id:</strong> 배치 내 고유 식별자</li>
 *   <li><strong>type:</strong> 작업 유형 (비용 집계 시 node 이름으로도 사용)</li>
 *   <li><strong>parameters:</strong> 파라미터 맵 (Provider에게 불투명하게 전달)</li>
 *   <li><strong>dependencies:</strong> 선행되어야 하는 Action ID 목록</li>
 *   <li><strong>retryPolicy:</strong> 재시도 정책</li>
 *   <li><strong>timeoutMs:</strong> 시도당 Provider 응답 대기 시간</li>
 *   <li><strong>estimate:</strong> 예상 비용 (null 가능, 없으면 예상 비용 0으로 사전 검사)</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>{@code
 * Action summarize = Action.of("summarize", "llm.summarize")
 *     .withDependencies(ActionId.of("fetch-a"), ActionId.of("fetch-b"))
 *     .withEstimate(CostEstimate.of("gpt-4", 2000, 500));
 * }</pre>
 *
 * @param id Action ID
 * @param type 작업 유형
 * @param parameters 파라미터 (null이면 빈 맵)
 * @param dependencies 의존 Action ID 목록 (null이면 빈 목록, 중복 제거)
 * @param retryPolicy 재시도 정책
 * @param timeoutMs 시도당 타임아웃 (밀리초, 양수)
 * @param estimate 예상 비용 (null 가능)
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record Action(
    ActionId id,
    String type,
    Map<String, Object> parameters,
    List<ActionId> dependencies,
    RetryPolicy retryPolicy,
    long timeoutMs,
    CostEstimate estimate
) {

    /**
     * 기본 시도당 타임아웃 (30초).
     */
    public static final long DEFAULT_TIMEOUT_MS = 30_000L;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 유효하지 않은 경우
     */
    public Action {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive (current: " + timeoutMs + ")");
        }
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        dependencies = dependencies == null ? List.of() : List.copyOf(new LinkedHashSet<>(dependencies));
        // estimate는 null 허용
    }

    /**
     * 기본 정책으로 Action 생성.
     *
     * @param id Action ID 문자열
     * @param type 작업 유형
     * @return 의존성과 파라미터가 없는 Action
     */
    public static Action of(String id, String type) {
        return new Action(ActionId.of(id), type, Map.of(), List.of(), new RetryPolicy(), DEFAULT_TIMEOUT_MS, null);
    }

    public Action withParameters(Map<String, Object> parameters) {
        return new Action(id, type, parameters, dependencies, retryPolicy, timeoutMs, estimate);
    }

    public Action withDependencies(ActionId... dependencies) {
        return new Action(id, type, parameters, Arrays.asList(dependencies), retryPolicy, timeoutMs, estimate);
    }

    public Action withDependencies(List<ActionId> dependencies) {
        return new Action(id, type, parameters, dependencies, retryPolicy, timeoutMs, estimate);
    }

    public Action withRetryPolicy(RetryPolicy retryPolicy) {
        return new Action(id, type, parameters, dependencies, retryPolicy, timeoutMs, estimate);
    }

    public Action withTimeoutMs(long timeoutMs) {
        return new Action(id, type, parameters, dependencies, retryPolicy, timeoutMs, estimate);
    }

    public Action withEstimate(CostEstimate estimate) {
        return new Action(id, type, parameters, dependencies, retryPolicy, timeoutMs, estimate);
    }

    /**
     * 의존성이 없는 Action인지 확인.
     *
     * @return 의존성이 없으면 true
     */
    public boolean isRoot() {
        return dependencies.isEmpty();
    }
}
