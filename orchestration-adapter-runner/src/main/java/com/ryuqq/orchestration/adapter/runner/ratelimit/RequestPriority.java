package com.ryuqq.orchestration.adapter.runner.ratelimit;

/**
 * 대기열 요청 우선순위.
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public enum RequestPriority {

    HIGH(3),

    MEDIUM(2),

    LOW(1);

    private final int weight;

    RequestPriority(int weight) {
        this.weight = weight;
    }

    /**
     * 우선순위 가중치 (클수록 먼저 처리).
     *
     * @return HIGH=3, MEDIUM=2, LOW=1
     */
    public int weight() {
        return weight;
    }
}
