package com.ryuqq.orchestration.adapter.runner.ratelimit;

import com.ryuqq.orchestration.core.protection.RateLimiterConfig;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Agent별 Token Bucket 설정 (불변 record).
 *
 * <p>대기열 배출 시 Agent 키마다 버킷 하나를 사용합니다. {@code agents}에
 * 등록되지 않은 Agent는 {@code defaultLimit}으로 버킷이 생성됩니다.</p>
 *
 * @param defaultLimit 등록되지 않은 Agent의 기본 한도 (기본 초당 10건, 버스트 10)
 * @param agents Agent 키별 한도
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record AgentRateLimitConfig(RateLimiterConfig defaultLimit, Map<String, RateLimiterConfig> agents) {

    public AgentRateLimitConfig() {
        this(new RateLimiterConfig(), Map.of());
    }

    public AgentRateLimitConfig {
        defaultLimit = defaultLimit == null ? new RateLimiterConfig() : defaultLimit;
        if (agents == null) {
            agents = Map.of();
        } else {
            agents.forEach((key, limit) -> {
                if (key == null || key.isBlank()) {
                    throw new IllegalArgumentException("agent key cannot be null or blank");
                }
                if (limit == null) {
                    throw new IllegalArgumentException("rate limit for agent " + key + " cannot be null");
                }
            });
            agents = Map.copyOf(agents);
        }
    }

    public AgentRateLimitConfig withDefaultLimit(RateLimiterConfig defaultLimit) {
        return new AgentRateLimitConfig(defaultLimit, agents);
    }

    public AgentRateLimitConfig withAgent(String agentKey, RateLimiterConfig limit) {
        Map<String, RateLimiterConfig> updated = new LinkedHashMap<>(agents);
        updated.put(agentKey, limit);
        return new AgentRateLimitConfig(defaultLimit, updated);
    }

    /**
     * Agent에 적용될 한도.
     *
     * @param agentKey Agent 키
     * @return 등록된 한도, 없으면 기본 한도
     */
    public RateLimiterConfig limitFor(String agentKey) {
        return agents.getOrDefault(agentKey, defaultLimit);
    }

    /**
     * 이 설정을 반영한 Agent Rate Limiter 생성.
     *
     * @return 기본 한도와 Agent별 한도가 등록된 Rate Limiter
     */
    public TokenBucketRateLimiter newLimiter() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(defaultLimit);
        agents.forEach(limiter::register);
        return limiter;
    }
}
