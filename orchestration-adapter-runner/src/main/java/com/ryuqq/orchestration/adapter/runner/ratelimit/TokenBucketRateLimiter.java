package com.ryuqq.orchestration.adapter.runner.ratelimit;

import com.ryuqq.orchestration.core.protection.Admission;
import com.ryuqq.orchestration.core.protection.RateLimiterConfig;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * 키별 Token Bucket Rate Limiter.
 *
 * <p>키(Agent 또는 Provider)마다 독립된 버킷을 가집니다. 키별 설정이 등록되어 있지 않으면
 * 기본 설정으로 버킷을 생성합니다. 버킷은 프로세스 수명 동안 유지되며
 * {@link #reset}으로만 초기화됩니다.</p>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public final class TokenBucketRateLimiter extends AbstractRateLimiter {

    private final RateLimiterConfig defaultConfig;
    private final Map<String, RateLimiterConfig> keyConfigs = new ConcurrentHashMap<>();
    private final Map<String, TokenBucket> buckets = new ConcurrentHashMap<>();
    private final LongSupplier nanoClock;

    public TokenBucketRateLimiter(RateLimiterConfig defaultConfig) {
        this(defaultConfig, System::nanoTime);
    }

    /**
     * 시계 주입 생성자.
     *
     * @param defaultConfig 등록되지 않은 키에 적용할 설정
     * @param nanoClock 나노초 단조 시계
     */
    public TokenBucketRateLimiter(RateLimiterConfig defaultConfig, LongSupplier nanoClock) {
        if (defaultConfig == null) {
            throw new IllegalArgumentException("defaultConfig cannot be null");
        }
        if (nanoClock == null) {
            throw new IllegalArgumentException("nanoClock cannot be null");
        }
        this.defaultConfig = defaultConfig;
        this.nanoClock = nanoClock;
    }

    /**
     * 키별 설정 등록.
     *
     * <p>이미 생성된 버킷은 새 설정으로 교체됩니다.</p>
     *
     * @param key 키
     * @param config 설정
     */
    public void register(String key, RateLimiterConfig config) {
        requireKey(key);
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        keyConfigs.put(key, config);
        buckets.put(key, new TokenBucket(config, nanoClock));
    }

    @Override
    public Admission canProceed(String key) {
        return bucket(key).tryConsume();
    }

    @Override
    public void refund(String key) {
        bucket(key).refund();
    }

    @Override
    public RateLimiterConfig getConfig(String key) {
        requireKey(key);
        return keyConfigs.getOrDefault(key, defaultConfig);
    }

    /**
     * 키의 현재 토큰 수.
     *
     * @param key 키
     * @return 토큰 수
     */
    public double availableTokens(String key) {
        return bucket(key).availableTokens();
    }

    /**
     * 키의 버킷을 가득 찬 상태로 초기화.
     *
     * @param key 키
     */
    public void reset(String key) {
        bucket(key).reset();
    }

    private TokenBucket bucket(String key) {
        requireKey(key);
        return buckets.computeIfAbsent(key, k -> new TokenBucket(getConfig(k), nanoClock));
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
    }
}
