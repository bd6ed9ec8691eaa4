package com.ryuqq.orchestration.adapter.runner.ratelimit;

/**
 * 대기열 정렬 방식.
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public enum QueueType {

    /** 도착 순서 */
    FIFO,

    /** 우선순위 순서, 같은 우선순위 안에서는 도착 순서 */
    PRIORITY
}
