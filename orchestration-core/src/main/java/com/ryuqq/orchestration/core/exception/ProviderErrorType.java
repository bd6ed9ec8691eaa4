package com.ryuqq.orchestration.core.exception;

/**
 * Provider 호출 실패 유형.
 *
 * <p>Provider 어댑터는 전송 계층에서 관찰한 실패를 이 유형으로 보고하고,
 * Router는 유형과 HTTP 상태 코드로 transient/permanent를 분류합니다.</p>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public enum ProviderErrorType {

    /** 응답 대기 시간 초과 */
    TIMEOUT,

    /** 연결 끊김/리셋 */
    CONNECTION_RESET,

    /** HTTP 상태 코드 기반 실패 (statusCode 참조) */
    HTTP_STATUS,

    /** 인증 실패 */
    AUTHENTICATION,

    /** 잘못된 요청 형식 */
    MALFORMED_REQUEST,

    /** 분류 불가 */
    UNKNOWN
}
