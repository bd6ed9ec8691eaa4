package com.ryuqq.orchestration.adapter.runner;

import com.ryuqq.orchestration.core.model.BackoffShape;
import com.ryuqq.orchestration.core.model.RetryPolicy;

/**
 * Backoff with Jitter 계산기.
 *
 * <p>재시도 간격을 {@link BackoffShape}에 따라 증가시키되, Jitter를 추가하여
 * 동시에 실패한 요청들이 같은 시각에 재시도하지 않도록 분산합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * LINEAR:      delay = min(baseDelay * attempt + jitter, maxDelay)
 * EXPONENTIAL: delay = min(baseDelay * 2^(attempt-1) + jitter, maxDelay)
 * jitter = random(0, delay * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (EXPONENTIAL, baseDelay=1000ms, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>attempt=1: 1000-1100ms</li>
 *   <li>attempt=2: 2000-2200ms</li>
 *   <li>attempt=3: 4000-4400ms</li>
 * </ul>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final double jitterFactor;

    /**
     * 기본 설정으로 생성 (jitterFactor=0.1).
     */
    public BackoffCalculator() {
        this(0.1);
    }

    /**
     * 커스텀 Jitter 비율로 생성.
     *
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0, 0이면 결정적)
     * @throws IllegalArgumentException 범위를 벗어난 경우
     */
    public BackoffCalculator(double jitterFactor) {
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        this.jitterFactor = jitterFactor;
    }

    /**
     * 재시도 정책 기준 지연 계산.
     *
     * @param policy 재시도 정책
     * @param attempt 현재 재시도 순번 (1부터 시작)
     * @return 재시도 전 대기 시간 (밀리초)
     */
    public long calculate(RetryPolicy policy, int attempt) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        return calculate(policy.shape(), policy.baseDelayMs(), policy.maxDelayMs(), attempt);
    }

    /**
     * 재시도 지연 계산.
     *
     * @param shape 증가 형태
     * @param baseDelayMs 기본 지연 (밀리초, 0 이상)
     * @param maxDelayMs 최대 지연 (밀리초)
     * @param attempt 현재 재시도 순번 (1부터 시작)
     * @return 재시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException attempt가 양수가 아닌 경우
     */
    public long calculate(BackoffShape shape, long baseDelayMs, long maxDelayMs, int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        if (shape == null) {
            throw new IllegalArgumentException("shape cannot be null");
        }
        if (baseDelayMs <= 0) {
            return 0L;
        }

        // overflow 방지: shift는 62까지만
        long raw = switch (shape) {
            case LINEAR -> saturatedMultiply(baseDelayMs, attempt);
            case EXPONENTIAL -> saturatedMultiply(baseDelayMs, 1L << Math.min(attempt - 1, 62));
        };
        long delay = Math.min(raw, maxDelayMs);
        long jitter = (long) (delay * jitterFactor * Math.random());
        return Math.min(delay + jitter, maxDelayMs);
    }

    public double getJitterFactor() {
        return jitterFactor;
    }

    private static long saturatedMultiply(long a, long b) {
        long high = Math.multiplyHigh(a, b);
        long low = a * b;
        if ((high == 0 && low >= 0) || (high == -1 && low < 0)) {
            return low;
        }
        return Long.MAX_VALUE;
    }
}
