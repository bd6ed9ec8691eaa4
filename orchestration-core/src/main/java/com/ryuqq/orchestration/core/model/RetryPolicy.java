package com.ryuqq.orchestration.core.model;

/**
 * Action 단위 재시도 정책.
 *
 * <p>Coordinator는 일시적(transient) 실패가 발생하면 이 정책에 따라
 * 백오프 후 다음 후보 Provider로 Action을 재전송합니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 최초 시도를 포함한 최대 시도 횟수 (기본 3)</li>
 *   <li>shape: 백오프 형태 (기본 EXPONENTIAL)</li>
 *   <li>baseDelayMs: 기본 지연 시간 (기본 1000ms)</li>
 *   <li>maxDelayMs: 최대 지연 시간 (기본 30000ms)</li>
 * </ul>
 *
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param shape 백오프 형태
 * @param baseDelayMs 기본 지연 시간 (밀리초, 0 이상)
 * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상)
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record RetryPolicy(
    int maxAttempts,
    BackoffShape shape,
    long baseDelayMs,
    long maxDelayMs
) {

    /**
     * 기본 정책 생성자.
     *
     * <p>기본값: maxAttempts=3, shape=EXPONENTIAL, baseDelayMs=1000ms, maxDelayMs=30000ms</p>
     */
    public RetryPolicy() {
        this(3, BackoffShape.EXPONENTIAL, 1000, 30000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (shape == null) {
            throw new IllegalArgumentException("shape cannot be null");
        }
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be non-negative (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
    }

    /**
     * 재시도 없이 한 번만 시도하는 정책.
     *
     * @return maxAttempts=1 정책
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, BackoffShape.LINEAR, 0, 0);
    }

    /**
     * 남은 시도가 있는지 확인.
     *
     * @param attemptsSoFar 지금까지 수행한 시도 횟수
     * @return 추가 시도 가능 여부
     */
    public boolean hasAttemptsLeft(int attemptsSoFar) {
        return attemptsSoFar < maxAttempts;
    }

    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, shape, baseDelayMs, maxDelayMs);
    }

    public RetryPolicy withShape(BackoffShape shape) {
        return new RetryPolicy(maxAttempts, shape, baseDelayMs, maxDelayMs);
    }

    public RetryPolicy withBaseDelayMs(long baseDelayMs) {
        return new RetryPolicy(maxAttempts, shape, baseDelayMs, Math.max(baseDelayMs, maxDelayMs));
    }
}
