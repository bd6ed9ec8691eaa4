package com.ryuqq.orchestration.core.exception;

/**
 * Provider 호출 실패 예외.
 *
 * <p>{@link com.ryuqq.orchestration.core.spi.ProviderClient} 구현체가 발생시키며,
 * Router 밖으로 전파되지 않습니다. Router가 Retry/Fail Outcome으로 변환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * if (response.statusCode() == 429) {
 *     throw ProviderException.status(429, "Too Many Requests");
 * }
 * }</pre>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public class ProviderException extends RuntimeException {

    private final ProviderErrorType type;
    private final int statusCode;

    /**
     * 생성자.
     *
     * @param type 실패 유형
     * @param statusCode HTTP 상태 코드 (없으면 0)
     * @param message 메시지
     * @param cause 원인 (null 가능)
     */
    public ProviderException(ProviderErrorType type, int statusCode, String message, Throwable cause) {
        super(message, cause);
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        this.type = type;
        this.statusCode = statusCode;
    }

    public ProviderException(ProviderErrorType type, String message) {
        this(type, 0, message, null);
    }

    /**
     * HTTP 상태 코드 기반 예외 생성.
     *
     * @param statusCode HTTP 상태 코드
     * @param message 메시지
     * @return ProviderException
     */
    public static ProviderException status(int statusCode, String message) {
        return new ProviderException(ProviderErrorType.HTTP_STATUS, statusCode, message, null);
    }

    public static ProviderException timeout(String message) {
        return new ProviderException(ProviderErrorType.TIMEOUT, message);
    }

    public static ProviderException connectionReset(String message) {
        return new ProviderException(ProviderErrorType.CONNECTION_RESET, message);
    }

    public static ProviderException authentication(String message) {
        return new ProviderException(ProviderErrorType.AUTHENTICATION, 401, message, null);
    }

    public static ProviderException malformed(String message) {
        return new ProviderException(ProviderErrorType.MALFORMED_REQUEST, 400, message, null);
    }

    public ProviderErrorType getType() {
        return type;
    }

    /**
     * HTTP 상태 코드 조회.
     *
     * @return 상태 코드 (없으면 0)
     */
    public int getStatusCode() {
        return statusCode;
    }
}
