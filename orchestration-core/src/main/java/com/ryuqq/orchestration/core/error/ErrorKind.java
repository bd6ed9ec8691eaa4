package com.ryuqq.orchestration.core.error;

/**
 * 실패 분류 체계.
 *
 * <p>각 분류는 재시도 가능 여부(transient)를 가집니다.
 * 재시도 가능한 실패는 재시도 정책이 허용하는 동안 로컬에서 재시도되고,
 * 소진되기 전까지는 호출자에게 노출되지 않습니다.</p>
 *
 * <pre>
 * 분류                              재시도   Provider에 전송됨
 * CYCLIC_DEPENDENCY                 X        X (배치 전체 거부)
 * TIMEOUT                           O        O
 * RATE_LIMITED                      O        X (admission 거부)
 * TRANSIENT_PROVIDER_ERROR          O        O
 * PERMANENT_PROVIDER_ERROR          X        O
 * ALL_PROVIDERS_FAILED              X        -
 * BUDGET_EXCEEDED                   X        X
 * SKIPPED_DUE_TO_UPSTREAM_FAILURE   X        X
 * CANCELLED                         X        X
 * </pre>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public enum ErrorKind {

    CYCLIC_DEPENDENCY(false),

    TIMEOUT(true),

    RATE_LIMITED(true),

    TRANSIENT_PROVIDER_ERROR(true),

    PERMANENT_PROVIDER_ERROR(false),

    ALL_PROVIDERS_FAILED(false),

    BUDGET_EXCEEDED(false),

    SKIPPED_DUE_TO_UPSTREAM_FAILURE(false),

    /**
     * 배치 취소로 인해 전송되지 않음.
     */
    CANCELLED(false);

    private final boolean transientFailure;

    ErrorKind(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    /**
     * 재시도 가능한 일시적 실패인지 확인.
     *
     * @return TIMEOUT, RATE_LIMITED, TRANSIENT_PROVIDER_ERROR인 경우 true
     */
    public boolean isTransient() {
        return transientFailure;
    }
}
