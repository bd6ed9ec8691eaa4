package com.ryuqq.orchestration.core.budget;

import com.ryuqq.orchestration.core.model.CostEstimate;

/**
 * 요청 체인 하나의 예산 장부.
 *
 * <p>동일 체인 안에서 동시에 실행되는 호출들이 각자는 한도 이내이지만
 * 합쳐서 한도를 넘는 일을 막기 위해, 검사와 예약을 상호 배제 하에 수행합니다.
 * 서로 다른 체인의 장부는 잠금을 공유하지 않습니다.</p>
 *
 * <p><strong>호출 순서:</strong></p>
 * <pre>
 * reserve(estimate) ─┬─ HALT → 호출하지 않음
 *                    └─ 그 외 → Provider 호출 → updateAfterCall(...) 또는 release(...)
 * </pre>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public interface BudgetLedger {

    /**
     * 예상 비용을 포함한 가상 상태로 Guardrail을 검사하고, 통과하면 예약.
     *
     * @param estimate 예상 비용 (null이면 0으로 검사)
     * @return 예약 결과
     */
    BudgetReservation reserve(CostEstimate estimate);

    /**
     * 호출 완료 후 실제 사용량 반영 및 예약 해제.
     *
     * @param reservation 예약
     * @param model 사용한 모델
     * @param node 호출한 노드 이름
     * @param inputTokens 입력 토큰 수
     * @param outputTokens 출력 토큰 수
     * @return 갱신된 상태
     */
    BudgetState updateAfterCall(BudgetReservation reservation, String model, String node,
                                long inputTokens, long outputTokens);

    /**
     * 비용이 발생하지 않은 호출의 예약 해제.
     *
     * @param reservation 예약
     */
    void release(BudgetReservation reservation);

    /**
     * 현재 상태 스냅샷.
     *
     * @return 예산 상태
     */
    BudgetState snapshot();
}
