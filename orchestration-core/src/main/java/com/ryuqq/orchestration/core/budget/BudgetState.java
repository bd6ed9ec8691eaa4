package com.ryuqq.orchestration.core.budget;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * 요청 체인 하나의 예산 상태.
 *
 * <p>불변 값이며, 갱신은 항상 새 인스턴스를 반환합니다.
 * 동시 갱신의 직렬화는 상태를 보유한 {@code BudgetLedger}가 담당합니다.</p>
 *
 * <p><strong>집계 항목:</strong></p>
 * <ul>
 *   <li>누적 입력/출력 토큰 및 비용</li>
 *   <li>모델별 비용/토큰</li>
 *   <li>노드(Action 유형)별 비용/토큰</li>
 *   <li>세션 시작/마지막 갱신 시각</li>
 *   <li>한도 초과 플래그 (누적 비용이 한도에 도달하면 설정되고 해제되지 않음)</li>
 * </ul>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record BudgetState(
    double limitUsd,
    double warningThreshold,
    long totalInputTokens,
    long totalOutputTokens,
    double totalCostUsd,
    Map<String, Double> modelCosts,
    Map<String, Long> modelTokens,
    Map<String, Double> nodeCosts,
    Map<String, Long> nodeTokens,
    Instant sessionStart,
    Instant lastUpdate,
    boolean exceeded,
    long maxContextTokens
) {

    /**
     * 컨텍스트 한도가 지정되지 않았을 때의 기본값.
     */
    public static final long DEFAULT_MAX_CONTEXT_TOKENS = 8_000L;

    public BudgetState {
        if (limitUsd <= 0) {
            throw new IllegalArgumentException("limitUsd must be positive (current: " + limitUsd + ")");
        }
        if (warningThreshold <= 0 || warningThreshold > 1.0) {
            throw new IllegalArgumentException(
                "warningThreshold must be in (0, 1] (current: " + warningThreshold + ")");
        }
        if (totalCostUsd < 0) {
            throw new IllegalArgumentException("totalCostUsd must be non-negative (current: " + totalCostUsd + ")");
        }
        if (maxContextTokens <= 0) {
            throw new IllegalArgumentException(
                "maxContextTokens must be positive (current: " + maxContextTokens + ")");
        }
        modelCosts = modelCosts == null ? Map.of() : Map.copyOf(modelCosts);
        modelTokens = modelTokens == null ? Map.of() : Map.copyOf(modelTokens);
        nodeCosts = nodeCosts == null ? Map.of() : Map.copyOf(nodeCosts);
        nodeTokens = nodeTokens == null ? Map.of() : Map.copyOf(nodeTokens);
    }

    /**
     * 비용이 없는 초기 상태 생성.
     *
     * @param limitUsd 예산 한도
     * @param warningThreshold 경고 임계값
     * @param now 세션 시작 시각
     * @return 초기 상태
     */
    public static BudgetState initial(double limitUsd, double warningThreshold, Instant now) {
        return new BudgetState(limitUsd, warningThreshold, 0, 0, 0.0, Map.of(), Map.of(), Map.of(), Map.of(),
            now, now, false, DEFAULT_MAX_CONTEXT_TOKENS);
    }

    /**
     * 누적 비용만 지정한 상태 생성.
     *
     * @param limitUsd 예산 한도
     * @param costUsd 누적 비용
     * @return 상태 (한도 도달 시 exceeded 설정)
     */
    public static BudgetState withCost(double limitUsd, double costUsd) {
        Instant now = Instant.now();
        return new BudgetState(limitUsd, 0.8, 0, 0, costUsd, Map.of(), Map.of(), Map.of(), Map.of(),
            now, now, costUsd >= limitUsd, DEFAULT_MAX_CONTEXT_TOKENS);
    }

    /**
     * 사용률 (누적 비용 / 한도).
     */
    public double usage() {
        return totalCostUsd / limitUsd;
    }

    public long totalTokens() {
        return totalInputTokens + totalOutputTokens;
    }

    /**
     * 호출 한 건의 비용과 토큰을 더한 새 상태.
     *
     * @param model 모델명
     * @param node 노드 이름
     * @param inputTokens 입력 토큰 수
     * @param outputTokens 출력 토큰 수
     * @param costUsd 호출 비용
     * @param now 갱신 시각
     * @return 갱신된 상태
     */
    public BudgetState plus(String model, String node, long inputTokens, long outputTokens, double costUsd,
                            Instant now) {
        long tokens = inputTokens + outputTokens;
        Map<String, Double> newModelCosts = new HashMap<>(modelCosts);
        newModelCosts.merge(model, costUsd, Double::sum);
        Map<String, Long> newModelTokens = new HashMap<>(modelTokens);
        newModelTokens.merge(model, tokens, Long::sum);
        Map<String, Double> newNodeCosts = new HashMap<>(nodeCosts);
        newNodeCosts.merge(node, costUsd, Double::sum);
        Map<String, Long> newNodeTokens = new HashMap<>(nodeTokens);
        newNodeTokens.merge(node, tokens, Long::sum);

        double newCost = totalCostUsd + costUsd;
        return new BudgetState(limitUsd, warningThreshold,
            totalInputTokens + inputTokens, totalOutputTokens + outputTokens, newCost,
            newModelCosts, newModelTokens, newNodeCosts, newNodeTokens,
            sessionStart == null ? now : sessionStart, now,
            exceeded || newCost >= limitUsd, maxContextTokens);
    }

    /**
     * 사전 검사용 가상 상태 (누적 비용에 예상 비용을 더함).
     *
     * <p>exceeded 플래그는 현재 값을 유지하며, 집계 맵은 변경하지 않습니다.</p>
     *
     * @param additionalCostUsd 추가 비용
     * @return 가상 상태
     */
    public BudgetState projected(double additionalCostUsd) {
        return new BudgetState(limitUsd, warningThreshold, totalInputTokens, totalOutputTokens,
            totalCostUsd + Math.max(0.0, additionalCostUsd), modelCosts, modelTokens, nodeCosts, nodeTokens,
            sessionStart, lastUpdate, exceeded, maxContextTokens);
    }

    public BudgetState withMaxContextTokens(long maxContextTokens) {
        return new BudgetState(limitUsd, warningThreshold, totalInputTokens, totalOutputTokens, totalCostUsd,
            modelCosts, modelTokens, nodeCosts, nodeTokens, sessionStart, lastUpdate, exceeded, maxContextTokens);
    }
}
