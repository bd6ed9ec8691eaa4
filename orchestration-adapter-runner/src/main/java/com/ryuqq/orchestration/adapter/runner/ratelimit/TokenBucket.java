package com.ryuqq.orchestration.adapter.runner.ratelimit;

import com.ryuqq.orchestration.core.protection.Admission;
import com.ryuqq.orchestration.core.protection.RateLimiterConfig;

import java.util.function.LongSupplier;

/**
 * Token Bucket.
 *
 * <p>가득 찬 상태로 시작하며, 확인할 때마다 경과 시간 × refillRate만큼 비례 충전하고
 * capacity로 상한을 둡니다. 토큰이 1개 이상이면 하나를 소비합니다.</p>
 *
 * <p><strong>불변식:</strong> 임의의 구간 t초 동안 허용 횟수는
 * capacity + refillRate × t를 넘지 않습니다.</p>
 *
 * <p>모든 상태 변경은 이 인스턴스의 모니터 하에서 원자적으로 수행됩니다.</p>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public final class TokenBucket {

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final RateLimiterConfig config;
    private final LongSupplier nanoClock;

    private double tokens;
    private long lastRefillNanos;

    public TokenBucket(RateLimiterConfig config) {
        this(config, System::nanoTime);
    }

    /**
     * 시계 주입 생성자.
     *
     * @param config 버킷 설정
     * @param nanoClock 나노초 단조 시계
     */
    public TokenBucket(RateLimiterConfig config, LongSupplier nanoClock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (nanoClock == null) {
            throw new IllegalArgumentException("nanoClock cannot be null");
        }
        this.config = config;
        this.nanoClock = nanoClock;
        this.tokens = config.capacity();
        this.lastRefillNanos = nanoClock.getAsLong();
    }

    /**
     * 충전 후 토큰 하나 소비 시도.
     *
     * @return 허용 시 granted, 아니면 토큰 하나가 충전될 때까지의 대기 시간
     */
    public synchronized Admission tryConsume() {
        refill();
        if (tokens >= 1.0) {
            tokens -= 1.0;
            return Admission.granted();
        }
        return Admission.denied(waitMillis());
    }

    /**
     * 소비한 토큰 하나 반환 (capacity 상한).
     */
    public synchronized void refund() {
        tokens = Math.min(config.capacity(), tokens + 1.0);
    }

    /**
     * 충전 후 현재 토큰 수.
     *
     * @return 토큰 수 (소수 포함)
     */
    public synchronized double availableTokens() {
        refill();
        return tokens;
    }

    /**
     * 가득 찬 상태로 초기화 (관리자 조치).
     */
    public synchronized void reset() {
        tokens = config.capacity();
        lastRefillNanos = nanoClock.getAsLong();
    }

    public RateLimiterConfig getConfig() {
        return config;
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed > 0) {
            tokens = Math.min(config.capacity(), tokens + (elapsed / NANOS_PER_SECOND) * config.refillRate());
            lastRefillNanos = now;
        }
    }

    private long waitMillis() {
        double deficit = 1.0 - tokens;
        return (long) Math.ceil(deficit / config.refillRate() * 1000.0);
    }
}
