package com.ryuqq.orchestration.core.outcome;

import com.ryuqq.orchestration.core.error.ErrorKind;

/**
 * 재시도 불가능한 영구적 실패.
 *
 * <p>같은 Provider로 재시도해도 성공할 가능성이 없는 경우를 나타냅니다.
 * Router는 이 결과를 받으면 다음 Provider로 failover합니다.</p>
 *
 * @param kind 실패 분류
 * @param message 실패 메시지
 * @param cause 원인 설명 (null 가능)
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record Fail(
    ErrorKind kind,
    String message,
    String cause
) implements CallOutcome {

    public Fail {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    public static Fail of(ErrorKind kind, String message) {
        return new Fail(kind, message, null);
    }
}
