package com.ryuqq.orchestration.adapter.runner.health;

/**
 * 주기적 Health Check 설정 (불변 record).
 *
 * @param intervalMs 점검 주기 (밀리초, 기본 30000)
 * @param initialDelayMs 첫 점검까지 지연 (밀리초, 기본 intervalMs)
 * @param probeEnabled 합성 요청(ping) 전송 여부 (false면 지표 재평가만 수행)
 * @param probeTimeoutMs 합성 요청 1건의 최대 대기 시간 (밀리초, 기본 5000). 초과 시 실패로 기록
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record HealthCheckConfig(long intervalMs, long initialDelayMs, boolean probeEnabled, long probeTimeoutMs) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: intervalMs=30000ms, initialDelayMs=30000ms, probeEnabled=true, probeTimeoutMs=5000ms</p>
     */
    public HealthCheckConfig() {
        this(30_000, 30_000, true, 5_000);
    }

    public HealthCheckConfig {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive (current: " + intervalMs + ")");
        }
        if (initialDelayMs < 0) {
            throw new IllegalArgumentException("initialDelayMs must be non-negative (current: " + initialDelayMs + ")");
        }
        if (probeTimeoutMs <= 0) {
            throw new IllegalArgumentException("probeTimeoutMs must be positive (current: " + probeTimeoutMs + ")");
        }
    }

    public HealthCheckConfig withIntervalMs(long intervalMs) {
        return new HealthCheckConfig(intervalMs, initialDelayMs, probeEnabled, probeTimeoutMs);
    }

    public HealthCheckConfig withProbeEnabled(boolean probeEnabled) {
        return new HealthCheckConfig(intervalMs, initialDelayMs, probeEnabled, probeTimeoutMs);
    }

    public HealthCheckConfig withProbeTimeoutMs(long probeTimeoutMs) {
        return new HealthCheckConfig(intervalMs, initialDelayMs, probeEnabled, probeTimeoutMs);
    }
}
