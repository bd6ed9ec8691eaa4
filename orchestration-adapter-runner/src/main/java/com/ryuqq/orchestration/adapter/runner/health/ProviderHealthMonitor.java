package com.ryuqq.orchestration.adapter.runner.health;

import com.ryuqq.orchestration.core.model.ProviderId;
import com.ryuqq.orchestration.core.provider.HealthMetrics;
import com.ryuqq.orchestration.core.provider.HealthStatus;
import com.ryuqq.orchestration.core.provider.HealthThresholds;
import com.ryuqq.orchestration.core.provider.ProviderConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Provider Health Monitor.
 *
 * <p>Provider별 성공/실패/지연을 롤링 윈도우로 추적하고 건강 상태를 도출합니다.
 * 상태는 요청이 기록될 때마다, 그리고 주기적 점검 시 재평가됩니다.</p>
 *
 * <p><strong>판정 규칙 ({@link HealthThresholds}):</strong></p>
 * <ol>
 *   <li>UNHEALTHY: 연속 실패 &ge; maxConsecutiveFailures, 또는 오류율 &gt; maxErrorRate</li>
 *   <li>DEGRADED: 평균 지연 &gt; maxAverageLatencyMs, 또는 성공률 &lt; minSuccessRate</li>
 *   <li>HEALTHY: 그 외</li>
 * </ol>
 *
 * <p>회복은 자동입니다. 이후 성공 요청으로 지표가 임계값 아래로 돌아오면 HEALTHY가 됩니다.
 * 관리자 override는 지표와 무관하게 보고 상태를 고정합니다.</p>
 *
 * <p>Provider마다 독립된 잠금으로 갱신하므로 서로 다른 Provider의 기록은 경합하지 않습니다.</p>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public final class ProviderHealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(ProviderHealthMonitor.class);

    private final Map<ProviderId, ProviderHealth> providers;
    private final Clock clock;

    public ProviderHealthMonitor(List<ProviderConfig> providers) {
        this(providers, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param providers Provider 설정 목록
     * @param clock 점검 시각 기록용 시계
     */
    public ProviderHealthMonitor(List<ProviderConfig> providers, Clock clock) {
        if (providers == null) {
            throw new IllegalArgumentException("providers cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        Map<ProviderId, ProviderHealth> map = new LinkedHashMap<>();
        providers.stream()
            .sorted(Comparator.comparingInt(ProviderConfig::priority))
            .forEach(p -> {
                if (map.putIfAbsent(p.id(), new ProviderHealth(p)) != null) {
                    throw new IllegalArgumentException("duplicate provider id: " + p.id());
                }
            });
        this.providers = map;
        this.clock = clock;
    }

    /**
     * 성공 요청 기록.
     *
     * @param providerId Provider ID
     * @param latencyMs 지연 (밀리초)
     */
    public void recordSuccess(ProviderId providerId, long latencyMs) {
        record(providerId, true, latencyMs);
    }

    /**
     * 실패 요청 기록.
     *
     * @param providerId Provider ID
     * @param latencyMs 지연 (밀리초)
     */
    public void recordFailure(ProviderId providerId, long latencyMs) {
        record(providerId, false, latencyMs);
    }

    /**
     * 현재 보고 상태 (override 우선).
     *
     * @param providerId Provider ID
     * @return 건강 상태 (알 수 없는 Provider는 UNHEALTHY)
     */
    public HealthStatus status(ProviderId providerId) {
        ProviderHealth health = providers.get(providerId);
        if (health == null) {
            return HealthStatus.UNHEALTHY;
        }
        synchronized (health) {
            return health.reportedStatus();
        }
    }

    /**
     * HEALTHY 상태 Provider 목록 (우선순위 오름차순).
     *
     * @return Provider ID 목록
     */
    public List<ProviderId> healthyProviders() {
        return providers.keySet().stream()
            .filter(id -> status(id) == HealthStatus.HEALTHY)
            .toList();
    }

    /**
     * UNHEALTHY가 아닌 Provider 목록 (우선순위 오름차순).
     *
     * @return Provider 설정 목록
     */
    public List<ProviderConfig> selectableProviders() {
        return providers.values().stream()
            .filter(h -> status(h.config.id()).isSelectable())
            .map(h -> h.config)
            .toList();
    }

    /**
     * 전체 Provider 설정 (우선순위 오름차순).
     *
     * @return Provider 설정 목록
     */
    public List<ProviderConfig> providers() {
        return providers.values().stream().map(h -> h.config).toList();
    }

    /**
     * Provider 지표 스냅샷.
     *
     * @param providerId Provider ID
     * @return 지표
     * @throws IllegalArgumentException 알 수 없는 Provider인 경우
     */
    public HealthMetrics metrics(ProviderId providerId) {
        ProviderHealth health = require(providerId);
        synchronized (health) {
            return health.snapshot();
        }
    }

    /**
     * 전체 Provider 지표 요약 (관측용).
     *
     * @return 우선순위 순서의 Provider별 지표
     */
    public Map<ProviderId, HealthMetrics> summary() {
        Map<ProviderId, HealthMetrics> summary = new LinkedHashMap<>();
        providers.keySet().forEach(id -> summary.put(id, metrics(id)));
        return summary;
    }

    /**
     * 모든 Provider 재평가 (주기적 점검).
     */
    public void evaluateAll() {
        for (ProviderHealth health : providers.values()) {
            synchronized (health) {
                health.evaluate(clock.instant());
            }
        }
    }

    /**
     * 관리자 override 설정.
     *
     * @param providerId Provider ID
     * @param status 고정할 상태
     */
    public void override(ProviderId providerId, HealthStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        ProviderHealth health = require(providerId);
        synchronized (health) {
            health.override = status;
        }
        log.info("Provider {} health overridden to {}", providerId, status);
    }

    /**
     * 관리자 override 해제.
     *
     * @param providerId Provider ID
     */
    public void clearOverride(ProviderId providerId) {
        ProviderHealth health = require(providerId);
        synchronized (health) {
            health.override = null;
        }
        log.info("Provider {} health override cleared", providerId);
    }

    /**
     * 지표 초기화 (관리자 조치).
     *
     * @param providerId Provider ID
     */
    public void reset(ProviderId providerId) {
        ProviderHealth health = require(providerId);
        synchronized (health) {
            health.reset();
        }
        log.info("Provider {} health metrics reset", providerId);
    }

    private void record(ProviderId providerId, boolean success, long latencyMs) {
        ProviderHealth health = require(providerId);
        HealthStatus before;
        HealthStatus after;
        synchronized (health) {
            before = health.status;
            health.add(success, Math.max(0L, latencyMs));
            after = health.evaluate(clock.instant());
        }
        if (before != after) {
            log.info("Provider {} health changed {} -> {}", providerId, before, after);
        }
    }

    private ProviderHealth require(ProviderId providerId) {
        ProviderHealth health = providers.get(providerId);
        if (health == null) {
            throw new IllegalArgumentException("unknown provider: " + providerId);
        }
        return health;
    }

    /**
     * Provider 하나의 가변 상태. 항상 인스턴스 모니터 하에서 접근합니다.
     */
    private static final class ProviderHealth {

        private final ProviderConfig config;
        private final HealthThresholds thresholds;
        private final Deque<Sample> window = new ArrayDeque<>();

        private int windowFailures;
        private long windowLatencySum;
        private int consecutiveFailures;
        private long totalRequests;
        private long totalErrors;
        private HealthStatus status = HealthStatus.HEALTHY;
        private HealthStatus override;
        private Instant lastCheck;

        private ProviderHealth(ProviderConfig config) {
            this.config = config;
            this.thresholds = config.thresholds();
        }

        private void add(boolean success, long latencyMs) {
            window.addLast(new Sample(success, latencyMs));
            windowLatencySum += latencyMs;
            if (!success) {
                windowFailures++;
            }
            if (window.size() > thresholds.windowSize()) {
                Sample evicted = window.removeFirst();
                windowLatencySum -= evicted.latencyMs();
                if (!evicted.success()) {
                    windowFailures--;
                }
            }
            totalRequests++;
            if (success) {
                consecutiveFailures = 0;
            } else {
                consecutiveFailures++;
                totalErrors++;
            }
        }

        private HealthStatus evaluate(Instant now) {
            lastCheck = now;
            int n = window.size();
            double successRate = successRate();
            boolean rateRulesApply = n >= thresholds.minimumRequests();

            if (consecutiveFailures >= thresholds.maxConsecutiveFailures()
                || (rateRulesApply && 1.0 - successRate > thresholds.maxErrorRate())) {
                status = HealthStatus.UNHEALTHY;
            } else if ((n > 0 && averageLatency() > thresholds.maxAverageLatencyMs())
                || (rateRulesApply && successRate < thresholds.minSuccessRate())) {
                status = HealthStatus.DEGRADED;
            } else {
                status = HealthStatus.HEALTHY;
            }
            return status;
        }

        private HealthStatus reportedStatus() {
            return override != null ? override : status;
        }

        private double successRate() {
            return window.isEmpty() ? 1.0 : (double) (window.size() - windowFailures) / window.size();
        }

        private double averageLatency() {
            return window.isEmpty() ? 0.0 : (double) windowLatencySum / window.size();
        }

        private void reset() {
            window.clear();
            windowFailures = 0;
            windowLatencySum = 0;
            consecutiveFailures = 0;
            totalRequests = 0;
            totalErrors = 0;
            status = HealthStatus.HEALTHY;
            lastCheck = null;
        }

        private HealthMetrics snapshot() {
            return new HealthMetrics(config.id(), reportedStatus(), successRate(), averageLatency(),
                consecutiveFailures, totalRequests, totalErrors, window.size(), lastCheck, override != null);
        }
    }

    private record Sample(boolean success, long latencyMs) {
    }
}
