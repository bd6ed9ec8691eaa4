package com.ryuqq.orchestration.adapter.runner.routing;

/**
 * Router 설정 (불변 record).
 *
 * @param strategy Provider 선택 전략 (기본 HEALTH_BASED)
 * @param admissionTimeoutMs Rate Limit admission 최대 대기 (밀리초, 기본 1000)
 * @param retryBaseDelayMs Provider 내부 재시도 기본 지연 (밀리초, 기본 200)
 * @param retryMaxDelayMs Provider 내부 재시도 최대 지연 (밀리초, 기본 5000)
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record RouterConfig(
    LoadBalancingStrategy strategy,
    long admissionTimeoutMs,
    long retryBaseDelayMs,
    long retryMaxDelayMs
) {

    public RouterConfig() {
        this(LoadBalancingStrategy.HEALTH_BASED, 1_000, 200, 5_000);
    }

    public RouterConfig {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        if (admissionTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "admissionTimeoutMs must be non-negative (current: " + admissionTimeoutMs + ")");
        }
        if (retryBaseDelayMs < 0) {
            throw new IllegalArgumentException(
                "retryBaseDelayMs must be non-negative (current: " + retryBaseDelayMs + ")");
        }
        if (retryMaxDelayMs < retryBaseDelayMs) {
            throw new IllegalArgumentException(
                "retryMaxDelayMs must be >= retryBaseDelayMs (base: " + retryBaseDelayMs
                    + ", max: " + retryMaxDelayMs + ")");
        }
    }

    public RouterConfig withStrategy(LoadBalancingStrategy strategy) {
        return new RouterConfig(strategy, admissionTimeoutMs, retryBaseDelayMs, retryMaxDelayMs);
    }

    public RouterConfig withAdmissionTimeoutMs(long admissionTimeoutMs) {
        return new RouterConfig(strategy, admissionTimeoutMs, retryBaseDelayMs, retryMaxDelayMs);
    }

    public RouterConfig withRetryDelays(long retryBaseDelayMs, long retryMaxDelayMs) {
        return new RouterConfig(strategy, admissionTimeoutMs, retryBaseDelayMs, retryMaxDelayMs);
    }
}
