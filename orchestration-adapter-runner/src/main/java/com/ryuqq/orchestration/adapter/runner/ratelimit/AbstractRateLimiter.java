package com.ryuqq.orchestration.adapter.runner.ratelimit;

import com.ryuqq.orchestration.core.protection.Admission;
import com.ryuqq.orchestration.core.protection.RateLimiter;

import java.util.concurrent.TimeUnit;

/**
 * 대기형 admission 공통 구현.
 *
 * <p>{@link #canProceed}가 거부하면 반환된 대기 시간만큼 잠든 뒤 다시 시도합니다.
 * 대기 시간이 남은 제한 시간을 넘으면 잠들지 않고 즉시 실패합니다.</p>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public abstract class AbstractRateLimiter implements RateLimiter {

    @Override
    public boolean tryAcquire(String key, long timeoutMs) throws InterruptedException {
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs must be non-negative (current: " + timeoutMs + ")");
        }
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        while (true) {
            Admission admission = canProceed(key);
            if (admission.allowed()) {
                return true;
            }
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (admission.waitMs() > remainingMs) {
                return false;
            }
            TimeUnit.MILLISECONDS.sleep(admission.waitMs());
        }
    }
}
