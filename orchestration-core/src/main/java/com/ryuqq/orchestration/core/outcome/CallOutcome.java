package com.ryuqq.orchestration.core.outcome;

/**
 * Provider 호출 결과.
 *
 * <p>CallOutcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: Provider가 정상 응답함</li>
 *   <li>{@link Retry}: 일시적 실패 (timeout, 429, 5xx, 연결 리셋), 재시도 가능</li>
 *   <li>{@link Fail}: 영구적 실패 (인증, 잘못된 요청, 기타 4xx), 재시도 불가</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스가 컴파일 타임에 알려집니다.</p>
 *
 * <p><strong>처리 예시:</strong></p>
 * <pre>{@code
 * if (outcome instanceof Ok ok) {
 *     return ok.response();
 * } else if (outcome instanceof Retry retry) {
 *     sleep(retry.nextRetryAfterMillis());
 * } else if (outcome instanceof Fail fail) {
 *     failover(fail.kind());
 * }
 * }</pre>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public sealed interface CallOutcome permits Ok, Retry, Fail {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 재시도 가능한지 확인.
     *
     * @return 재시도 가능 여부
     */
    default boolean isRetry() {
        return this instanceof Retry;
    }

    /**
     * 결과가 영구 실패인지 확인.
     *
     * @return 영구 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
