package com.ryuqq.orchestration.adapter.runner.budget;

import com.ryuqq.orchestration.core.budget.BudgetLedger;
import com.ryuqq.orchestration.core.budget.BudgetReservation;
import com.ryuqq.orchestration.core.budget.BudgetState;
import com.ryuqq.orchestration.core.budget.DegradationConfig;
import com.ryuqq.orchestration.core.budget.GuardrailAction;
import com.ryuqq.orchestration.core.model.CostEstimate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 요청 체인 하나의 예산 장부 구현.
 *
 * <p><strong>동시성:</strong> 검사와 예약은 체인별 잠금 하에 수행됩니다.
 * 가상 상태는 "현재 누적 비용 + 진행 중 예약 합계 + 이번 예상 비용"이므로,
 * 동시에 시작된 호출들이 각자 통과해 합계가 한도를 넘는 일은 없습니다.</p>
 *
 * <pre>
 * reserve(estimate)
 *   lock
 *     projected = state + pending + estimateCost
 *     HALT → halted reservation
 *     else → pending 등록, DEGRADE면 권고 첨부
 *   unlock
 * </pre>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public final class ChainBudgetLedger implements BudgetLedger {

    private static final Logger log = LoggerFactory.getLogger(ChainBudgetLedger.class);

    static final String UNKNOWN = "unknown";

    private final BudgetGuardrail guardrail;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Long, Double> pending = new HashMap<>();

    private BudgetState state;
    private long nextReservationId = 1L;

    public ChainBudgetLedger(BudgetGuardrail guardrail) {
        this(guardrail, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param guardrail Guardrail
     * @param clock 갱신 시각 기록용 시계
     */
    public ChainBudgetLedger(BudgetGuardrail guardrail, Clock clock) {
        if (guardrail == null) {
            throw new IllegalArgumentException("guardrail cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.guardrail = guardrail;
        this.clock = clock;
        this.state = guardrail.getCostTracker().newState(clock.instant());
    }

    @Override
    public BudgetReservation reserve(CostEstimate estimate) {
        double estimated = estimate == null ? 0.0
            : guardrail.getCostTracker().calculateCost(estimate.model(), estimate.inputTokens(),
                estimate.outputTokens());

        lock.lock();
        try {
            double pendingTotal = pending.values().stream().mapToDouble(Double::doubleValue).sum();
            BudgetState projected = state.projected(pendingTotal + estimated);
            GuardrailAction action = guardrail.check(projected);

            if (action == GuardrailAction.HALT) {
                log.warn("Budget halt: projected ${} of ${} limit", projected.totalCostUsd(), state.limitUsd());
                return BudgetReservation.halted(guardrail.budgetExceededError(state, projected.totalCostUsd()));
            }

            long id = nextReservationId++;
            pending.put(id, estimated);
            DegradationConfig degradation = null;
            if (action == GuardrailAction.DEGRADE) {
                degradation = guardrail.degradationConfig(projected);
                log.info("Budget degrade: usage {} (model={}, maxContextTokens={})", projected.usage(),
                    degradation.model(), degradation.maxContextTokens());
            } else if (action == GuardrailAction.WARN) {
                log.info("Budget warning: usage {} of ${} limit", projected.usage(), state.limitUsd());
            }
            return new BudgetReservation(id, estimated, action, degradation, null);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public BudgetState updateAfterCall(BudgetReservation reservation, String model, String node,
                                       long inputTokens, long outputTokens) {
        lock.lock();
        try {
            if (reservation != null) {
                pending.remove(reservation.id());
            }
            state = guardrail.getCostTracker().updateBudgetState(state,
                model == null ? UNKNOWN : model, node == null ? UNKNOWN : node,
                inputTokens, outputTokens, clock.instant());
            if (state.exceeded()) {
                log.warn("Budget exceeded: ${} of ${} limit", state.totalCostUsd(), state.limitUsd());
            }
            return state;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void release(BudgetReservation reservation) {
        if (reservation == null) {
            return;
        }
        lock.lock();
        try {
            pending.remove(reservation.id());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public BudgetState snapshot() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 진행 중 예약 합계.
     *
     * @return 예약 금액 합계 (USD)
     */
    public double pendingUsd() {
        lock.lock();
        try {
            return pending.values().stream().mapToDouble(Double::doubleValue).sum();
        } finally {
            lock.unlock();
        }
    }

    public BudgetGuardrail getGuardrail() {
        return guardrail;
    }
}
