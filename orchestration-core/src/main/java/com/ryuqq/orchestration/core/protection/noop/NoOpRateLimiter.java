package com.ryuqq.orchestration.core.protection.noop;

import com.ryuqq.orchestration.core.protection.Admission;
import com.ryuqq.orchestration.core.protection.RateLimiter;
import com.ryuqq.orchestration.core.protection.RateLimiterConfig;

/**
 * Rate Limiter NoOp 구현.
 *
 * <p>모든 요청을 항상 허용합니다. Rate Limit 없이 Router를 구성할 때 사용합니다.</p>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public final class NoOpRateLimiter implements RateLimiter {

    private static final RateLimiterConfig UNLIMITED_CONFIG =
        new RateLimiterConfig(Double.MAX_VALUE, Integer.MAX_VALUE);

    @Override
    public Admission canProceed(String key) {
        return Admission.granted();
    }

    @Override
    public boolean tryAcquire(String key, long timeoutMs) {
        return true;
    }

    @Override
    public void refund(String key) {
        // 소비하지 않으므로 반환할 토큰 없음
    }

    @Override
    public RateLimiterConfig getConfig(String key) {
        return UNLIMITED_CONFIG;
    }
}
