package com.ryuqq.orchestration.application.coordinator;

import com.ryuqq.orchestration.core.error.ActionError;
import com.ryuqq.orchestration.core.model.ActionId;
import com.ryuqq.orchestration.core.model.ActionResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 배치 실행 결과 요약.
 *
 * <p>제출된 모든 Action은 정확히 하나의 권위 있는(terminal) 결과를 가집니다.
 * 재시도된 Action의 중간 시도 결과는 시도 이력({@link #getAttempts})에만 남습니다.</p>
 *
 * <p><strong>집계 항목:</strong></p>
 * <ul>
 *   <li>전체/성공/실패 수, 성공률</li>
 *   <li>총 지연 및 평균 지연 (권위 있는 결과 기준)</li>
 *   <li>오류 목록</li>
 *   <li>레벨별 결과</li>
 * </ul>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public final class ExecutionSummary {

    private final List<List<ActionResult>> levelResults;
    private final List<ActionResult> results;
    private final Map<ActionId, ActionResult> byId;
    private final Map<ActionId, List<ActionResult>> attempts;

    private ExecutionSummary(List<List<ActionResult>> levelResults, Map<ActionId, List<ActionResult>> attempts) {
        if (levelResults == null) {
            throw new IllegalArgumentException("levelResults cannot be null");
        }
        List<List<ActionResult>> levelsCopy = new ArrayList<>(levelResults.size());
        List<ActionResult> flat = new ArrayList<>();
        Map<ActionId, ActionResult> index = new LinkedHashMap<>();
        for (List<ActionResult> level : levelResults) {
            for (ActionResult result : level) {
                if (!result.isTerminal()) {
                    throw new IllegalArgumentException(
                        "authoritative result must be terminal (current: " + result.state() + ")");
                }
                if (index.putIfAbsent(result.actionId(), result) != null) {
                    throw new IllegalArgumentException("duplicate result for action " + result.actionId());
                }
                flat.add(result);
            }
            levelsCopy.add(List.copyOf(level));
        }
        Map<ActionId, List<ActionResult>> attemptsCopy = new LinkedHashMap<>();
        if (attempts != null) {
            attempts.forEach((id, list) -> attemptsCopy.put(id, List.copyOf(list)));
        }
        this.levelResults = Collections.unmodifiableList(levelsCopy);
        this.results = Collections.unmodifiableList(flat);
        this.byId = Collections.unmodifiableMap(index);
        this.attempts = Collections.unmodifiableMap(attemptsCopy);
    }

    /**
     * 레벨별 결과와 시도 이력으로 요약 생성.
     *
     * @param levelResults 레벨별 권위 있는 결과
     * @param attempts Action별 시도 이력 (null 가능)
     * @return ExecutionSummary
     */
    public static ExecutionSummary of(List<List<ActionResult>> levelResults,
                                      Map<ActionId, List<ActionResult>> attempts) {
        return new ExecutionSummary(levelResults, attempts);
    }

    public List<ActionResult> getResults() {
        return results;
    }

    public List<List<ActionResult>> getLevelResults() {
        return levelResults;
    }

    /**
     * Action의 권위 있는 결과 조회.
     *
     * @param actionId Action ID
     * @return 결과 (없으면 null)
     */
    public ActionResult getResult(ActionId actionId) {
        return byId.get(actionId);
    }

    /**
     * Action의 시도 이력 조회.
     *
     * @param actionId Action ID
     * @return 시도 순서대로 정렬된 결과 목록 (전송되지 않았으면 빈 목록)
     */
    public List<ActionResult> getAttempts(ActionId actionId) {
        return attempts.getOrDefault(actionId, List.of());
    }

    public int getTotal() {
        return results.size();
    }

    public int getSuccessful() {
        return (int) results.stream().filter(ActionResult::success).count();
    }

    public int getFailed() {
        return getTotal() - getSuccessful();
    }

    /**
     * 성공률.
     *
     * @return 성공 수 / 전체 수 (결과가 없으면 0.0)
     */
    public double getSuccessRate() {
        return results.isEmpty() ? 0.0 : (double) getSuccessful() / results.size();
    }

    public long getTotalLatencyMs() {
        return results.stream().mapToLong(ActionResult::latencyMs).sum();
    }

    public double getAverageLatencyMs() {
        return results.isEmpty() ? 0.0 : (double) getTotalLatencyMs() / results.size();
    }

    public double getTotalCostUsd() {
        return attempts.values().stream()
            .flatMap(List::stream)
            .mapToDouble(ActionResult::costUsd)
            .sum();
    }

    /**
     * 실패한 Action의 오류 목록 (결과 순서).
     *
     * @return 오류 목록
     */
    public List<ActionError> getErrors() {
        return results.stream()
            .filter(r -> !r.success())
            .map(ActionResult::error)
            .toList();
    }

    public boolean isAllSucceeded() {
        return getFailed() == 0;
    }

    @Override
    public String toString() {
        return "ExecutionSummary{total=" + getTotal()
            + ", successful=" + getSuccessful()
            + ", failed=" + getFailed()
            + ", successRate=" + String.format("%.2f", getSuccessRate())
            + ", averageLatencyMs=" + String.format("%.1f", getAverageLatencyMs())
            + "}";
    }
}
