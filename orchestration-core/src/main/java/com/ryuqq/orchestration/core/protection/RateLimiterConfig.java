package com.ryuqq.orchestration.core.protection;

/**
 * Token Bucket 설정.
 *
 * <p>버킷은 가득 찬 상태로 시작하며, 초당 refillRate만큼 비례 충전되고
 * capacity를 넘지 않습니다.</p>
 *
 * @param refillRate 초당 충전 토큰 수 (예: 10.0)
 * @param capacity 버킷 크기 (버스트 허용량)
 * @author Orchestration Team
 * @since 1.0.0
 */
public record RateLimiterConfig(double refillRate, int capacity) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if refillRate or capacity is not positive
     */
    public RateLimiterConfig {
        if (refillRate <= 0) {
            throw new IllegalArgumentException("refillRate must be positive (current: " + refillRate + ")");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
    }

    /**
     * 기본 설정 (초당 10건, 버스트 10).
     */
    public RateLimiterConfig() {
        this(10.0, 10);
    }
}
