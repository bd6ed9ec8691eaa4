package com.ryuqq.orchestration.core.provider;

/**
 * Provider 건강 판정 임계값.
 *
 * <p><strong>판정 규칙:</strong></p>
 * <ul>
 *   <li>UNHEALTHY: 연속 실패 &ge; maxConsecutiveFailures, 또는 오류율 &gt; maxErrorRate</li>
 *   <li>DEGRADED: 평균 지연 &gt; maxAverageLatencyMs, 또는 성공률 &lt; minSuccessRate</li>
 *   <li>HEALTHY: 그 외</li>
 * </ul>
 *
 * <p>비율 기반 규칙(오류율, 성공률)은 윈도우에 minimumRequests 이상의 요청이
 * 쌓인 뒤에만 적용됩니다. 연속 실패와 지연 규칙은 항상 적용됩니다.</p>
 *
 * @param maxConsecutiveFailures 최대 연속 실패 횟수 (기본 3)
 * @param maxErrorRate 최대 오류율 (기본 0.1)
 * @param maxAverageLatencyMs 최대 평균 지연 (기본 5000ms)
 * @param minSuccessRate 최소 성공률 (기본 0.9)
 * @param windowSize 롤링 윈도우 크기 (기본 100)
 * @param minimumRequests 비율 규칙 적용 최소 요청 수 (기본 10)
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record HealthThresholds(
    int maxConsecutiveFailures,
    double maxErrorRate,
    long maxAverageLatencyMs,
    double minSuccessRate,
    int windowSize,
    int minimumRequests
) {

    public HealthThresholds {
        if (maxConsecutiveFailures <= 0) {
            throw new IllegalArgumentException(
                "maxConsecutiveFailures must be positive (current: " + maxConsecutiveFailures + ")");
        }
        if (maxErrorRate < 0.0 || maxErrorRate > 1.0) {
            throw new IllegalArgumentException("maxErrorRate must be between 0 and 1 (current: " + maxErrorRate + ")");
        }
        if (maxAverageLatencyMs <= 0) {
            throw new IllegalArgumentException(
                "maxAverageLatencyMs must be positive (current: " + maxAverageLatencyMs + ")");
        }
        if (minSuccessRate < 0.0 || minSuccessRate > 1.0) {
            throw new IllegalArgumentException(
                "minSuccessRate must be between 0 and 1 (current: " + minSuccessRate + ")");
        }
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be positive (current: " + windowSize + ")");
        }
        if (minimumRequests < 1 || minimumRequests > windowSize) {
            throw new IllegalArgumentException(
                "minimumRequests must be between 1 and windowSize (current: " + minimumRequests + ")");
        }
    }

    /**
     * 기본 임계값.
     */
    public HealthThresholds() {
        this(3, 0.1, 5_000L, 0.9, 100, 10);
    }

    public HealthThresholds withMaxConsecutiveFailures(int maxConsecutiveFailures) {
        return new HealthThresholds(maxConsecutiveFailures, maxErrorRate, maxAverageLatencyMs,
            minSuccessRate, windowSize, minimumRequests);
    }

    public HealthThresholds withMaxErrorRate(double maxErrorRate) {
        return new HealthThresholds(maxConsecutiveFailures, maxErrorRate, maxAverageLatencyMs,
            minSuccessRate, windowSize, minimumRequests);
    }

    public HealthThresholds withMaxAverageLatencyMs(long maxAverageLatencyMs) {
        return new HealthThresholds(maxConsecutiveFailures, maxErrorRate, maxAverageLatencyMs,
            minSuccessRate, windowSize, minimumRequests);
    }

    public HealthThresholds withMinimumRequests(int minimumRequests) {
        return new HealthThresholds(maxConsecutiveFailures, maxErrorRate, maxAverageLatencyMs,
            minSuccessRate, windowSize, minimumRequests);
    }
}
