package com.ryuqq.orchestration.adapter.runner.budget;

import com.ryuqq.orchestration.core.budget.BudgetReservation;
import com.ryuqq.orchestration.core.budget.BudgetState;
import com.ryuqq.orchestration.core.budget.GuardrailAction;
import com.ryuqq.orchestration.core.budget.GuardrailConfig;
import com.ryuqq.orchestration.core.budget.ModelPricing;
import com.ryuqq.orchestration.core.budget.PricingRegistry;
import com.ryuqq.orchestration.core.error.ErrorKind;
import com.ryuqq.orchestration.core.model.CostEstimate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * ChainBudgetLedger 유닛 테스트.
 *
 * <p>test-model 입력 1,000 토큰의 예상 비용은 $0.3125입니다 (한도 $1.00).</p>
 */
class ChainBudgetLedgerTest {

    private static final CostEstimate ESTIMATE = CostEstimate.of("test-model", 1_000, 0);

    private ChainBudgetLedger ledger;

    @BeforeEach
    void setUp() {
        PricingRegistry pricing = new PricingRegistry();
        pricing.register(new ModelPricing("test-model", 0.3125, 0.0, "test"));
        CostTracker tracker = new CostTracker(pricing, 1.0, 0.8);
        ledger = new ChainBudgetLedger(new BudgetGuardrail(tracker,
            new GuardrailConfig().withFallbackModel("gpt-3.5-turbo")));
    }

    @Test
    void 진행_중_예약을_포함한_가상_상태로_판정() {
        // when
        BudgetReservation first = ledger.reserve(ESTIMATE);
        BudgetReservation second = ledger.reserve(ESTIMATE);
        BudgetReservation third = ledger.reserve(ESTIMATE);
        BudgetReservation fourth = ledger.reserve(ESTIMATE);

        // then
        assertThat(first.action()).isEqualTo(GuardrailAction.CONTINUE);
        assertThat(second.action()).isEqualTo(GuardrailAction.CONTINUE);
        assertThat(third.reservedUsd()).isEqualTo(0.3125);
        assertThat(third.action()).isEqualTo(GuardrailAction.DEGRADE);
        assertThat(third.degradation().model()).isEqualTo("gpt-3.5-turbo");
        assertThat(fourth.isHalted()).isTrue();
        assertThat(fourth.error().kind()).isEqualTo(ErrorKind.BUDGET_EXCEEDED);
        assertThat(ledger.pendingUsd()).isCloseTo(0.9375, within(1e-9));
    }

    @Test
    void release하면_예약이_해제되어_다시_통과() {
        // given
        List<BudgetReservation> reservations = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            reservations.add(ledger.reserve(ESTIMATE));
        }
        assertThat(ledger.reserve(ESTIMATE).isHalted()).isTrue();

        // when
        ledger.release(reservations.get(0));

        // then
        assertThat(ledger.reserve(ESTIMATE).isHalted()).isFalse();
    }

    @Test
    void updateAfterCall은_실제_사용량을_반영하고_예약을_해제() {
        // given
        BudgetReservation reservation = ledger.reserve(ESTIMATE);

        // when
        BudgetState state = ledger.updateAfterCall(reservation, "test-model", "summarize", 500, 0);

        // then
        assertThat(state.totalCostUsd()).isCloseTo(0.15625, within(1e-9));
        assertThat(state.nodeCosts()).containsKey("summarize");
        assertThat(ledger.pendingUsd()).isZero();
        assertThat(ledger.snapshot()).isEqualTo(state);
    }

    @Test
    void 모델이나_노드가_없으면_unknown으로_집계() {
        // when
        BudgetState state = ledger.updateAfterCall(null, null, null, 1_000, 0);

        // then
        assertThat(state.modelCosts()).containsKey("unknown");
        assertThat(state.nodeCosts()).containsKey("unknown");
    }

    @Test
    void 예상_비용이_없으면_현재_상태만으로_판정() {
        assertThat(ledger.reserve(null).action()).isEqualTo(GuardrailAction.CONTINUE);
    }

    @Test
    void 동시_예약도_합계가_한도를_넘지_않음() throws Exception {
        // given
        ExecutorService pool = Executors.newFixedThreadPool(10);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<BudgetReservation>> futures = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return ledger.reserve(ESTIMATE);
            }));
        }

        // when
        start.countDown();
        int granted = 0;
        for (Future<BudgetReservation> future : futures) {
            if (!future.get(5, TimeUnit.SECONDS).isHalted()) {
                granted++;
            }
        }
        pool.shutdown();

        // then
        assertThat(granted).isEqualTo(3);
        assertThat(ledger.pendingUsd()).isLessThan(1.0);
    }
}
