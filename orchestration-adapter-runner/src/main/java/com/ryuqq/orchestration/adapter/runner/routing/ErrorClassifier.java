package com.ryuqq.orchestration.adapter.runner.routing;

import com.ryuqq.orchestration.core.error.ErrorKind;
import com.ryuqq.orchestration.core.exception.ProviderException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Provider 호출 실패 분류기.
 *
 * <p><strong>분류 규칙:</strong></p>
 * <ul>
 *   <li>timeout, 408 → TIMEOUT (transient)</li>
 *   <li>429 → RATE_LIMITED (transient)</li>
 *   <li>500/502/503/504, 연결 리셋, I/O 오류 → TRANSIENT_PROVIDER_ERROR</li>
 *   <li>인증 실패, 잘못된 요청, 기타 상태 코드, 알 수 없는 오류 → PERMANENT_PROVIDER_ERROR</li>
 * </ul>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public class ErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 16;

    /**
     * 실패 분류.
     *
     * @param error Provider 호출 중 발생한 예외
     * @return 오류 유형
     */
    public ErrorKind classify(Throwable error) {
        if (error instanceof ProviderException providerException) {
            return classifyProviderException(providerException);
        }
        if (error instanceof TimeoutException) {
            return ErrorKind.TIMEOUT;
        }
        // initCause로 만든 순환 체인에서도 종료
        int depth = 0;
        for (Throwable t = error; t != null && depth < MAX_CAUSE_DEPTH; t = t.getCause(), depth++) {
            if (t instanceof IOException) {
                return ErrorKind.TRANSIENT_PROVIDER_ERROR;
            }
        }
        return ErrorKind.PERMANENT_PROVIDER_ERROR;
    }

    /**
     * HTTP 상태 코드 분류.
     *
     * @param statusCode 상태 코드
     * @return 오류 유형
     */
    public ErrorKind classifyStatus(int statusCode) {
        return switch (statusCode) {
            case 429 -> ErrorKind.RATE_LIMITED;
            case 408 -> ErrorKind.TIMEOUT;
            case 500, 502, 503, 504 -> ErrorKind.TRANSIENT_PROVIDER_ERROR;
            default -> ErrorKind.PERMANENT_PROVIDER_ERROR;
        };
    }

    private ErrorKind classifyProviderException(ProviderException e) {
        return switch (e.getType()) {
            case TIMEOUT -> ErrorKind.TIMEOUT;
            case CONNECTION_RESET -> ErrorKind.TRANSIENT_PROVIDER_ERROR;
            case HTTP_STATUS -> classifyStatus(e.getStatusCode());
            case AUTHENTICATION, MALFORMED_REQUEST, UNKNOWN -> ErrorKind.PERMANENT_PROVIDER_ERROR;
        };
    }
}
