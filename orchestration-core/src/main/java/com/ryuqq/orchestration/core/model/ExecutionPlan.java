package com.ryuqq.orchestration.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 레벨 단위로 정렬된 실행 계획.
 *
 * <p>각 레벨은 이전 레벨들만으로 의존성이 모두 충족되는 Action 집합이며,
 * 같은 레벨의 Action은 동시에 실행될 수 있습니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>모든 Action은 정확히 하나의 레벨에 속함</li>
 *   <li>Action의 레벨 인덱스는 모든 의존 Action의 레벨 인덱스보다 큼</li>
 *   <li>생성 후 변경 불가</li>
 * </ul>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public final class ExecutionPlan {

    private final List<List<Action>> levels;
    private final Map<ActionId, Integer> levelIndex;
    private final long estimatedTimeMs;

    private ExecutionPlan(List<List<Action>> levels, long estimatedTimeMs) {
        if (levels == null) {
            throw new IllegalArgumentException("levels cannot be null");
        }
        if (estimatedTimeMs < 0) {
            throw new IllegalArgumentException("estimatedTimeMs must be non-negative (current: " + estimatedTimeMs + ")");
        }
        List<List<Action>> copy = new ArrayList<>(levels.size());
        Map<ActionId, Integer> index = new HashMap<>();
        for (int i = 0; i < levels.size(); i++) {
            List<Action> level = levels.get(i);
            if (level == null || level.isEmpty()) {
                throw new IllegalArgumentException("level " + i + " cannot be null or empty");
            }
            for (Action action : level) {
                if (index.putIfAbsent(action.id(), i) != null) {
                    throw new IllegalArgumentException("action " + action.id() + " appears in more than one level");
                }
            }
            copy.add(List.copyOf(level));
        }
        this.levels = Collections.unmodifiableList(copy);
        this.levelIndex = Collections.unmodifiableMap(index);
        this.estimatedTimeMs = estimatedTimeMs;
    }

    /**
     * 실행 계획 생성.
     *
     * @param levels 레벨 목록 (각 레벨은 비어 있지 않아야 함)
     * @param estimatedTimeMs 예상 소요 시간 (밀리초)
     * @return ExecutionPlan
     * @throws IllegalArgumentException 레벨이 비어 있거나 Action이 중복된 경우
     */
    public static ExecutionPlan of(List<List<Action>> levels, long estimatedTimeMs) {
        return new ExecutionPlan(levels, estimatedTimeMs);
    }

    public List<List<Action>> getLevels() {
        return levels;
    }

    public int getLevelCount() {
        return levels.size();
    }

    public List<Action> getLevel(int index) {
        return levels.get(index);
    }

    /**
     * Action이 속한 레벨 인덱스 조회.
     *
     * @param actionId Action ID
     * @return 레벨 인덱스 (0부터 시작)
     * @throws IllegalArgumentException 계획에 없는 Action인 경우
     */
    public int levelOf(ActionId actionId) {
        Integer index = levelIndex.get(actionId);
        if (index == null) {
            throw new IllegalArgumentException("action " + actionId + " is not part of this plan");
        }
        return index;
    }

    public int getTotalActions() {
        return levelIndex.size();
    }

    public long getEstimatedTimeMs() {
        return estimatedTimeMs;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ExecutionPlan{");
        for (int i = 0; i < levels.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(levels.get(i).stream().map(a -> a.id().getValue()).toList());
        }
        return sb.append(", estimatedTimeMs=").append(estimatedTimeMs).append('}').toString();
    }
}
