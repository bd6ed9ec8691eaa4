package com.ryuqq.orchestration.core.model;

/**
 * 재시도 간격 증가 형태.
 *
 * <pre>
 * LINEAR:      delay = baseDelay * attempt
 * EXPONENTIAL: delay = baseDelay * 2^(attempt-1)
 * </pre>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public enum BackoffShape {

    /**
     * 선형 증가.
     */
    LINEAR,

    /**
     * 지수 증가.
     */
    EXPONENTIAL
}
