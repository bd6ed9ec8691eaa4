package com.ryuqq.orchestration.adapter.runner.ratelimit;

/**
 * 복합 admission 결과.
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public enum AdmissionScope {

    /** 키 버킷과 전역 버킷 모두 허용 */
    GRANTED,

    /** 키(Agent/Provider) 버킷이 거부 */
    KEY_DENIED,

    /** 전역 버킷이 거부 */
    GLOBAL_DENIED
}
