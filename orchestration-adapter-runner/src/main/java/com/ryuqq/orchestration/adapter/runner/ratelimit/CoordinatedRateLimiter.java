package com.ryuqq.orchestration.adapter.runner.ratelimit;

import com.ryuqq.orchestration.core.protection.Admission;
import com.ryuqq.orchestration.core.protection.RateLimiter;
import com.ryuqq.orchestration.core.protection.RateLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * 키별 버킷과 전역 버킷을 함께 적용하는 Rate Limiter.
 *
 * <p>요청이 진행되려면 두 버킷이 모두 허용해야 합니다. 키 버킷을 먼저 소비하고,
 * 전역 버킷이 거부하면 키 버킷의 토큰을 반환합니다.</p>
 *
 * <pre>
 * canProceed(key)
 *   ├─ key bucket 거부    → KEY_DENIED (대기 시간 = key bucket)
 *   ├─ global bucket 거부 → key 토큰 반환, GLOBAL_DENIED (대기 시간 = global bucket)
 *   └─ 둘 다 허용         → GRANTED
 * </pre>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public final class CoordinatedRateLimiter extends AbstractRateLimiter {

    /**
     * 전역 버킷 키.
     */
    public static final String GLOBAL_KEY = "__global__";

    private static final Logger log = LoggerFactory.getLogger(CoordinatedRateLimiter.class);

    private final RateLimiter keyLimiter;
    private final RateLimiter globalLimiter;

    /**
     * 생성자.
     *
     * @param keyLimiter 키별 Rate Limiter
     * @param globalLimiter 전역 Rate Limiter ({@link #GLOBAL_KEY}로 조회)
     */
    public CoordinatedRateLimiter(RateLimiter keyLimiter, RateLimiter globalLimiter) {
        if (keyLimiter == null) {
            throw new IllegalArgumentException("keyLimiter cannot be null");
        }
        if (globalLimiter == null) {
            throw new IllegalArgumentException("globalLimiter cannot be null");
        }
        this.keyLimiter = keyLimiter;
        this.globalLimiter = globalLimiter;
    }

    @Override
    public Admission canProceed(String key) {
        Admission keyAdmission = keyLimiter.canProceed(key);
        if (!keyAdmission.allowed()) {
            return keyAdmission;
        }
        Admission globalAdmission = globalLimiter.canProceed(GLOBAL_KEY);
        if (!globalAdmission.allowed()) {
            keyLimiter.refund(key);
            return globalAdmission;
        }
        return keyAdmission;
    }

    /**
     * 제한 시간 내 admission 획득 시도 후 거부 범위 보고.
     *
     * @param key 키
     * @param timeoutMs 최대 대기 시간 (밀리초)
     * @return GRANTED 또는 마지막으로 거부한 범위
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    public AdmissionScope acquire(String key, long timeoutMs) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(0L, timeoutMs));
        while (true) {
            Admission keyAdmission = keyLimiter.canProceed(key);
            AdmissionScope denied;
            long waitMs;
            if (!keyAdmission.allowed()) {
                denied = AdmissionScope.KEY_DENIED;
                waitMs = keyAdmission.waitMs();
            } else {
                Admission globalAdmission = globalLimiter.canProceed(GLOBAL_KEY);
                if (globalAdmission.allowed()) {
                    return AdmissionScope.GRANTED;
                }
                keyLimiter.refund(key);
                denied = AdmissionScope.GLOBAL_DENIED;
                waitMs = globalAdmission.waitMs();
            }

            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (waitMs > remainingMs) {
                log.debug("Admission denied for {} ({}), wait {}ms exceeds remaining {}ms",
                    key, denied, waitMs, remainingMs);
                return denied;
            }
            TimeUnit.MILLISECONDS.sleep(waitMs);
        }
    }

    @Override
    public void refund(String key) {
        keyLimiter.refund(key);
        globalLimiter.refund(GLOBAL_KEY);
    }

    @Override
    public RateLimiterConfig getConfig(String key) {
        return keyLimiter.getConfig(key);
    }

    public RateLimiterConfig getGlobalConfig() {
        return globalLimiter.getConfig(GLOBAL_KEY);
    }
}
