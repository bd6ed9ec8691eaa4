package com.ryuqq.orchestration.adapter.runner.ratelimit;

import com.ryuqq.orchestration.core.provider.ProviderRequest;

import java.time.Instant;

/**
 * Rate Limiter 앞 대기열에 들어가는 요청.
 *
 * @param agentKey Rate Limit 키 (Agent)
 * @param request Provider 요청
 * @param priority 우선순위
 * @param enqueuedAt 최초 등록 시각
 * @param retryCount 지금까지 실패 후 재등록된 횟수
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record QueuedRequest(
    String agentKey,
    ProviderRequest request,
    RequestPriority priority,
    Instant enqueuedAt,
    int retryCount
) {

    public QueuedRequest {
        if (agentKey == null || agentKey.isBlank()) {
            throw new IllegalArgumentException("agentKey cannot be null or blank");
        }
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be non-negative (current: " + retryCount + ")");
        }
        priority = priority == null ? RequestPriority.MEDIUM : priority;
        enqueuedAt = enqueuedAt == null ? Instant.now() : enqueuedAt;
    }

    public static QueuedRequest of(String agentKey, ProviderRequest request, RequestPriority priority) {
        return new QueuedRequest(agentKey, request, priority, Instant.now(), 0);
    }

    /**
     * 재시도 횟수를 하나 늘린 사본.
     *
     * @return 새 QueuedRequest
     */
    public QueuedRequest nextRetry() {
        return new QueuedRequest(agentKey, request, priority, enqueuedAt, retryCount + 1);
    }

    public String requestId() {
        return request.requestId();
    }
}
