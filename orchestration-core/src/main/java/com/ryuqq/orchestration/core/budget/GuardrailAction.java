package com.ryuqq.orchestration.core.budget;

/**
 * 예산 임계값 도달 시 취할 조치.
 *
 * <p>usage(= 비용 / 한도)에 대한 단조 계단 함수의 결과입니다.</p>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public enum GuardrailAction {

    /** 정상 진행 */
    CONTINUE,

    /** 경고 로그 후 진행 */
    WARN,

    /** 저렴한 모델/축소된 컨텍스트로 전환 권고 (실행을 막지 않음) */
    DEGRADE,

    /** 즉시 중단, 호출하지 않음 */
    HALT;

    /**
     * 실행을 차단하는 조치인지 확인.
     *
     * @return HALT인 경우 true
     */
    public boolean blocksExecution() {
        return this == HALT;
    }
}
