package com.ryuqq.orchestration.core.provider;

/**
 * Provider 건강 상태.
 *
 * <p>Router는 {@link #UNHEALTHY} 상태의 Provider를 선택 대상에서 제외합니다.</p>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public enum HealthStatus {

    /** 정상 */
    HEALTHY,

    /** 지연 증가 또는 성공률 저하 (선택 가능하나 후순위) */
    DEGRADED,

    /** 연속 실패 또는 오류율 초과 (선택 제외) */
    UNHEALTHY;

    /**
     * Router 선택 대상인지 확인.
     *
     * @return UNHEALTHY가 아니면 true
     */
    public boolean isSelectable() {
        return this != UNHEALTHY;
    }
}
