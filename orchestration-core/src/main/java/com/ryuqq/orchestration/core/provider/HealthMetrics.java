package com.ryuqq.orchestration.core.provider;

import com.ryuqq.orchestration.core.model.ProviderId;

import java.time.Instant;

/**
 * Provider 건강 지표 스냅샷.
 *
 * <p>{@code ProviderHealthMonitor}가 잠금 하에 갱신하는 상태의 읽기 전용 사본입니다.
 * Router와 관측 도구는 이 스냅샷만 읽습니다.</p>
 *
 * @param providerId Provider ID
 * @param status 현재 건강 상태 (override 적용 후)
 * @param successRate 롤링 성공률 (요청이 없으면 1.0)
 * @param averageLatencyMs 롤링 평균 지연 (밀리초)
 * @param consecutiveFailures 연속 실패 횟수
 * @param totalRequests 누적 요청 수
 * @param totalErrors 누적 실패 수
 * @param windowRequests 윈도우 내 요청 수
 * @param lastCheck 마지막 평가 시각 (null 가능)
 * @param overridden 관리자 override 적용 여부
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record HealthMetrics(
    ProviderId providerId,
    HealthStatus status,
    double successRate,
    double averageLatencyMs,
    int consecutiveFailures,
    long totalRequests,
    long totalErrors,
    int windowRequests,
    Instant lastCheck,
    boolean overridden
) {

    public HealthMetrics {
        if (providerId == null) {
            throw new IllegalArgumentException("providerId cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
    }

    /**
     * 롤링 오류율.
     *
     * @return 1 - successRate
     */
    public double errorRate() {
        return 1.0 - successRate;
    }
}
