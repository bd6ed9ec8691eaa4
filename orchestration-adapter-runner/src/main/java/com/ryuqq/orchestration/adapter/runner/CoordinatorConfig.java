package com.ryuqq.orchestration.adapter.runner;

import com.ryuqq.orchestration.core.model.Action;
import com.ryuqq.orchestration.core.model.RetryPolicy;

/**
 * Execution Coordinator 설정 (불변 record).
 *
 * <p><strong>필드:</strong></p>
 * <ul>
 *   <li><strong>maxConcurrency:</strong> 동시에 실행할 수 있는 최대 Action 수</li>
 *   <li><strong>providerMaxRetries:</strong> Router에 전달할 Provider당 transient 재시도 횟수</li>
 *   <li><strong>stopOnFailure:</strong> 실패 시 이후 레벨 건너뛰기 (기본 실행 옵션)</li>
 *   <li><strong>defaultRetryPolicy:</strong> Action 생성 시 기본 재시도 정책</li>
 *   <li><strong>defaultTimeoutMs:</strong> Action 생성 시 기본 타임아웃</li>
 *   <li><strong>defaultEstimatedTimeMs:</strong> estimated_time 파라미터가 없을 때 Action 예상 소요 시간</li>
 * </ul>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record CoordinatorConfig(
    int maxConcurrency,
    int providerMaxRetries,
    boolean stopOnFailure,
    RetryPolicy defaultRetryPolicy,
    long defaultTimeoutMs,
    long defaultEstimatedTimeMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxConcurrency=10, providerMaxRetries=2, stopOnFailure=false,
     * defaultRetryPolicy=RetryPolicy(), defaultTimeoutMs=30000ms, defaultEstimatedTimeMs=10000ms</p>
     */
    public CoordinatorConfig() {
        this(10, 2, false, new RetryPolicy(), Action.DEFAULT_TIMEOUT_MS, 10_000L);
    }

    public CoordinatorConfig {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be positive (current: " + maxConcurrency + ")");
        }
        if (providerMaxRetries < 0) {
            throw new IllegalArgumentException(
                "providerMaxRetries must be non-negative (current: " + providerMaxRetries + ")");
        }
        if (defaultRetryPolicy == null) {
            throw new IllegalArgumentException("defaultRetryPolicy cannot be null");
        }
        if (defaultTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "defaultTimeoutMs must be positive (current: " + defaultTimeoutMs + ")");
        }
        if (defaultEstimatedTimeMs < 0) {
            throw new IllegalArgumentException(
                "defaultEstimatedTimeMs must be non-negative (current: " + defaultEstimatedTimeMs + ")");
        }
    }

    public CoordinatorConfig withMaxConcurrency(int maxConcurrency) {
        return new CoordinatorConfig(maxConcurrency, providerMaxRetries, stopOnFailure, defaultRetryPolicy,
            defaultTimeoutMs, defaultEstimatedTimeMs);
    }

    public CoordinatorConfig withProviderMaxRetries(int providerMaxRetries) {
        return new CoordinatorConfig(maxConcurrency, providerMaxRetries, stopOnFailure, defaultRetryPolicy,
            defaultTimeoutMs, defaultEstimatedTimeMs);
    }

    public CoordinatorConfig withStopOnFailure(boolean stopOnFailure) {
        return new CoordinatorConfig(maxConcurrency, providerMaxRetries, stopOnFailure, defaultRetryPolicy,
            defaultTimeoutMs, defaultEstimatedTimeMs);
    }

    public CoordinatorConfig withDefaultRetryPolicy(RetryPolicy defaultRetryPolicy) {
        return new CoordinatorConfig(maxConcurrency, providerMaxRetries, stopOnFailure, defaultRetryPolicy,
            defaultTimeoutMs, defaultEstimatedTimeMs);
    }

    public CoordinatorConfig withDefaultTimeoutMs(long defaultTimeoutMs) {
        return new CoordinatorConfig(maxConcurrency, providerMaxRetries, stopOnFailure, defaultRetryPolicy,
            defaultTimeoutMs, defaultEstimatedTimeMs);
    }
}
