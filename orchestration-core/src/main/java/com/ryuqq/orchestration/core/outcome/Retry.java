package com.ryuqq.orchestration.core.outcome;

import com.ryuqq.orchestration.core.error.ErrorKind;

/**
 * 재시도 가능한 일시적 실패.
 *
 * <p>일시적인 오류로 인해 실패했으나, 재시도하면 성공할 가능성이 있는 경우를 나타냅니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>응답 타임아웃 (TIMEOUT)</li>
 *   <li>Rate Limit 초과 (429, 또는 admission 거부)</li>
 *   <li>외부 서비스 일시 장애 (502/503)</li>
 * </ul>
 *
 * @param kind 실패 분류 (transient 분류만 허용)
 * @param reason 재시도 사유
 * @param attemptCount 현재까지 시도 횟수 (1 이상)
 * @param nextRetryAfterMillis 다음 재시도까지 대기 시간 (밀리초, 0 이상)
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record Retry(
    ErrorKind kind,
    String reason,
    int attemptCount,
    long nextRetryAfterMillis
) implements CallOutcome {

    public Retry {
        if (kind == null || !kind.isTransient()) {
            throw new IllegalArgumentException("kind must be a transient error kind (current: " + kind + ")");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        if (attemptCount < 1) {
            throw new IllegalArgumentException("attemptCount must be positive (current: " + attemptCount + ")");
        }
        if (nextRetryAfterMillis < 0) {
            throw new IllegalArgumentException(
                "nextRetryAfterMillis must be non-negative (current: " + nextRetryAfterMillis + ")");
        }
    }
}
