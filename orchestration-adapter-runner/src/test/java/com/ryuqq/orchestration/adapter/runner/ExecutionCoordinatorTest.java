package com.ryuqq.orchestration.adapter.runner;

import com.ryuqq.orchestration.adapter.runner.budget.BudgetGuardrail;
import com.ryuqq.orchestration.adapter.runner.budget.ChainBudgetLedger;
import com.ryuqq.orchestration.adapter.runner.budget.CostTracker;
import com.ryuqq.orchestration.application.coordinator.CancellationSignal;
import com.ryuqq.orchestration.application.coordinator.ExecutionSummary;
import com.ryuqq.orchestration.application.coordinator.RunOptions;
import com.ryuqq.orchestration.application.routing.Router;
import com.ryuqq.orchestration.core.budget.DegradationConfig;
import com.ryuqq.orchestration.core.budget.GuardrailConfig;
import com.ryuqq.orchestration.core.budget.ModelPricing;
import com.ryuqq.orchestration.core.budget.PricingRegistry;
import com.ryuqq.orchestration.core.error.ActionError;
import com.ryuqq.orchestration.core.error.ErrorKind;
import com.ryuqq.orchestration.core.exception.CyclicDependencyException;
import com.ryuqq.orchestration.core.model.Action;
import com.ryuqq.orchestration.core.model.ActionId;
import com.ryuqq.orchestration.core.model.ActionResult;
import com.ryuqq.orchestration.core.model.BackoffShape;
import com.ryuqq.orchestration.core.model.CostEstimate;
import com.ryuqq.orchestration.core.model.ExecutionPlan;
import com.ryuqq.orchestration.core.model.ProviderId;
import com.ryuqq.orchestration.core.model.RetryPolicy;
import com.ryuqq.orchestration.core.outcome.Fail;
import com.ryuqq.orchestration.core.outcome.Ok;
import com.ryuqq.orchestration.core.outcome.Retry;
import com.ryuqq.orchestration.core.provider.ProviderRequest;
import com.ryuqq.orchestration.core.provider.ProviderRequestResult;
import com.ryuqq.orchestration.core.provider.ProviderResponse;
import com.ryuqq.orchestration.core.statemachine.ActionState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ExecutionCoordinator 유닛 테스트.
 *
 * <p>Router는 Mock으로 대체하고, 재시도 지연은 0으로 설정합니다.</p>
 */
@ExtendWith(MockitoExtension.class)
class ExecutionCoordinatorTest {

    private static final ProviderId P1 = ProviderId.of("provider-1");
    private static final ProviderId P2 = ProviderId.of("provider-2");
    private static final RetryPolicy FAST_RETRY = new RetryPolicy(3, BackoffShape.EXPONENTIAL, 0, 0);

    @Mock
    private Router router;

    private ExecutionCoordinator coordinator;

    @BeforeEach
    void setUp() {
        coordinator = new ExecutionCoordinator(router, new CoordinatorConfig().withMaxConcurrency(4),
            new BackoffCalculator(0.0));
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        coordinator.shutdown();
    }

    private static Action action(String id, String... dependencies) {
        List<ActionId> deps = new ArrayList<>();
        for (String dependency : dependencies) {
            deps.add(ActionId.of(dependency));
        }
        return Action.of(id, "llm.chat").withDependencies(deps).withRetryPolicy(FAST_RETRY);
    }

    private static ProviderRequestResult ok(ProviderId provider) {
        return new ProviderRequestResult(new Ok(provider, new ProviderResponse("out", "gpt-4", 100, 50)),
            10, 0.01, 1, List.of(provider));
    }

    private static ProviderRequestResult transientFailure(ProviderId provider) {
        return new ProviderRequestResult(new Retry(ErrorKind.TRANSIENT_PROVIDER_ERROR, "503", 1, 0),
            10, 0.0, 1, List.of(provider));
    }

    private static ProviderRequestResult permanentFailure() {
        return new ProviderRequestResult(Fail.of(ErrorKind.ALL_PROVIDERS_FAILED, "All providers failed"),
            10, 0.0, 2, List.of(P1, P2));
    }

    private static ChainBudgetLedger ledger(double limitUsd) {
        PricingRegistry pricing = new PricingRegistry();
        pricing.register(new ModelPricing("test-model", 0.3125, 0.0, "test"));
        GuardrailConfig guardrail = new GuardrailConfig().withFallbackModel("gpt-3.5-turbo");
        return new ChainBudgetLedger(new BudgetGuardrail(new CostTracker(pricing, limitUsd, 0.8), guardrail));
    }

    // ============================================================
    // plan
    // ============================================================

    @Test
    void 의존성에_따라_레벨을_나누고_레벨_내_입력_순서를_유지() {
        // when
        ExecutionPlan plan = coordinator.plan(List.of(
            action("d", "c"),
            action("b"),
            action("c", "a", "b"),
            action("a")
        ));

        // then
        assertThat(plan.getLevelCount()).isEqualTo(3);
        assertThat(plan.getLevel(0)).extracting(Action::id).containsExactly(ActionId.of("b"), ActionId.of("a"));
        assertThat(plan.getLevel(1)).extracting(Action::id).containsExactly(ActionId.of("c"));
        assertThat(plan.getLevel(2)).extracting(Action::id).containsExactly(ActionId.of("d"));
        assertThat(plan.levelOf(ActionId.of("d"))).isEqualTo(2);
    }

    @Test
    void 예상_소요_시간은_레벨별_최대값의_합() {
        // when
        ExecutionPlan plan = coordinator.plan(List.of(
            action("a").withParameters(Map.of("estimated_time", 5)),
            action("b").withParameters(Map.of("estimated_time", "20")),
            action("c", "a", "b")
        ));

        // then
        assertThat(plan.getEstimatedTimeMs()).isEqualTo(30_000L);
    }

    @Test
    void 음수_예상_시간은_0으로_보정되고_비유한값은_기본값_사용() {
        // when
        ExecutionPlan plan = coordinator.plan(List.of(
            action("a").withParameters(Map.of("estimated_time", -1)),
            action("b").withParameters(Map.of("estimated_time", "-5")),
            action("c", "a", "b").withParameters(Map.of("estimated_time", Double.NaN)),
            action("d", "c").withParameters(Map.of("estimated_time", "Infinity"))
        ));

        // then
        assertThat(plan.getLevelCount()).isEqualTo(3);
        assertThat(plan.getEstimatedTimeMs()).isEqualTo(20_000L);
    }

    @Test
    void 예상_시간_합계가_long_범위를_넘으면_최대값으로_포화() {
        // when
        ExecutionPlan plan = coordinator.plan(List.of(
            action("a").withParameters(Map.of("estimated_time", 1e18)),
            action("b", "a").withParameters(Map.of("estimated_time", 1e18))
        ));

        // then
        assertThat(plan.getLevelCount()).isEqualTo(2);
        assertThat(plan.getEstimatedTimeMs()).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void 순환_의존성은_CyclicDependencyException() {
        // when
        CyclicDependencyException exception = catchThrowableOfType(() -> coordinator.plan(List.of(
            action("root"),
            action("a", "b"),
            action("b", "a")
        )), CyclicDependencyException.class);

        // then
        assertThat(exception).isNotNull();
        assertThat(exception.getUnresolved()).containsExactlyInAnyOrder(ActionId.of("a"), ActionId.of("b"));
    }

    @Test
    void 알_수_없는_의존성과_중복_ID는_거부() {
        assertThatThrownBy(() -> coordinator.plan(List.of(action("a", "ghost"))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("unknown");
        assertThatThrownBy(() -> coordinator.plan(List.of(action("a"), action("a"))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("duplicate");
    }

    @Test
    void 빈_입력은_빈_계획() {
        assertThat(coordinator.plan(List.of()).getTotalActions()).isZero();
    }

    // ============================================================
    // run
    // ============================================================

    @Test
    void 모든_Action이_성공하면_레벨_순서대로_실행() {
        // given
        List<String> order = Collections.synchronizedList(new ArrayList<>());
        when(router.route(any(), anyInt(), any())).thenAnswer(invocation -> {
            ProviderRequest request = invocation.getArgument(0);
            order.add(request.requestId());
            return ok(P1);
        });
        ExecutionPlan plan = coordinator.plan(List.of(action("a"), action("b"), action("c", "a", "b")));

        // when
        ExecutionSummary summary = coordinator.run(plan);

        // then
        assertThat(summary.isAllSucceeded()).isTrue();
        assertThat(summary.getTotal()).isEqualTo(3);
        assertThat(summary.getTotalCostUsd()).isCloseTo(0.03, within(1e-9));
        assertThat(order).hasSize(3);
        assertThat(order.get(2)).isEqualTo("c");
        assertThat(summary.getResult(ActionId.of("c")).state()).isEqualTo(ActionState.SUCCEEDED);
    }

    @Test
    void stopOnFailure면_실패_이후_레벨은_SKIPPED() {
        // given
        when(router.route(any(), anyInt(), any())).thenReturn(permanentFailure());
        ExecutionPlan plan = coordinator.plan(List.of(action("a"), action("b", "a"), action("c", "b")));

        // when
        ExecutionSummary summary = coordinator.run(plan, RunOptions.defaults().withStopOnFailure(true));

        // then
        assertThat(summary.getResult(ActionId.of("a")).state()).isEqualTo(ActionState.FAILED);
        ActionResult skipped = summary.getResult(ActionId.of("b"));
        assertThat(skipped.state()).isEqualTo(ActionState.SKIPPED);
        assertThat(skipped.error().kind()).isEqualTo(ErrorKind.SKIPPED_DUE_TO_UPSTREAM_FAILURE);
        assertThat(summary.getResult(ActionId.of("c")).state()).isEqualTo(ActionState.SKIPPED);
        verify(router, times(1)).route(any(), anyInt(), any());
    }

    @Test
    void stopOnFailure가_아니면_실패해도_이후_레벨을_실행() {
        // given
        when(router.route(argThat(r -> r != null && r.requestId().equals("a")), anyInt(), any()))
            .thenReturn(permanentFailure());
        when(router.route(argThat(r -> r != null && r.requestId().equals("b")), anyInt(), any()))
            .thenReturn(ok(P1));
        ExecutionPlan plan = coordinator.plan(List.of(action("a"), action("b", "a")));

        // when
        ExecutionSummary summary = coordinator.run(plan);

        // then
        assertThat(summary.getSuccessful()).isEqualTo(1);
        assertThat(summary.getFailed()).isEqualTo(1);
        assertThat(summary.getErrors()).extracting(ActionError::kind).containsExactly(ErrorKind.ALL_PROVIDERS_FAILED);
    }

    @Test
    void transient_실패는_다음_후보_Provider부터_재전송() {
        // given
        when(router.route(any(), anyInt(), isNull())).thenReturn(transientFailure(P1));
        when(router.route(any(), anyInt(), eq(P1))).thenReturn(ok(P2));
        ExecutionPlan plan = coordinator.plan(List.of(action("a")));

        // when
        ExecutionSummary summary = coordinator.run(plan);

        // then
        ActionResult result = summary.getResult(ActionId.of("a"));
        assertThat(result.success()).isTrue();
        assertThat(result.attempt()).isEqualTo(2);
        assertThat(result.providerId()).isEqualTo(P2);
        assertThat(summary.getAttempts(ActionId.of("a")))
            .extracting(ActionResult::state)
            .containsExactly(ActionState.RETRYING, ActionState.SUCCEEDED);
    }

    @Test
    void 재시도_정책을_소진하면_FAILED() {
        // given
        when(router.route(any(), anyInt(), any())).thenReturn(transientFailure(P1));
        Action action = action("a").withRetryPolicy(FAST_RETRY.withMaxAttempts(2));

        // when
        ExecutionSummary summary = coordinator.run(coordinator.plan(List.of(action)));

        // then
        ActionResult result = summary.getResult(ActionId.of("a"));
        assertThat(result.state()).isEqualTo(ActionState.FAILED);
        assertThat(result.attempt()).isEqualTo(2);
        assertThat(result.error().kind()).isEqualTo(ErrorKind.TRANSIENT_PROVIDER_ERROR);
        assertThat(summary.getAttempts(ActionId.of("a"))).hasSize(2);
    }

    @Test
    void permanent_실패는_재시도하지_않음() {
        // given
        when(router.route(any(), anyInt(), any())).thenReturn(permanentFailure());

        // when
        ExecutionSummary summary = coordinator.run(coordinator.plan(List.of(action("a"))));

        // then
        assertThat(summary.getResult(ActionId.of("a")).attempt()).isEqualTo(1);
        verify(router, times(1)).route(any(), anyInt(), any());
    }

    @Test
    void 취소된_실행은_전송하지_않고_CANCELLED() {
        // given
        CancellationSignal cancellation = new CancellationSignal();
        cancellation.cancel();
        ExecutionPlan plan = coordinator.plan(List.of(action("a"), action("b", "a")));

        // when
        ExecutionSummary summary = coordinator.run(plan, RunOptions.defaults().withCancellation(cancellation));

        // then
        assertThat(summary.getResults()).extracting(ActionResult::state)
            .containsOnly(ActionState.CANCELLED);
        assertThat(summary.getErrors()).extracting(ActionError::kind).containsOnly(ErrorKind.CANCELLED);
        verify(router, never()).route(any(), anyInt(), any());
    }

    @Test
    void 실행_중_취소되면_진행_중_Action은_완료되고_다음_레벨은_CANCELLED() throws Exception {
        // given: a 호출은 해제될 때까지 대기
        CancellationSignal cancellation = new CancellationSignal();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return ok(P1);
        }).when(router).route(argThat(r -> r != null && r.requestId().equals("a")), anyInt(), any());
        ExecutionPlan plan = coordinator.plan(List.of(action("a"), action("b", "a"), action("c", "b")));

        CompletableFuture<ExecutionSummary> running = CompletableFuture.supplyAsync(
            () -> coordinator.run(plan, RunOptions.defaults().withCancellation(cancellation)));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        // when
        cancellation.cancel();
        release.countDown();
        ExecutionSummary summary = running.get(5, TimeUnit.SECONDS);

        // then
        assertThat(summary.getResult(ActionId.of("a")).state()).isEqualTo(ActionState.SUCCEEDED);
        assertThat(summary.getResult(ActionId.of("b")).state()).isEqualTo(ActionState.CANCELLED);
        assertThat(summary.getResult(ActionId.of("c")).state()).isEqualTo(ActionState.CANCELLED);
        assertThat(summary.getResult(ActionId.of("b")).error().kind()).isEqualTo(ErrorKind.CANCELLED);
        verify(router, times(1)).route(any(), anyInt(), any());
    }

    // ============================================================
    // budget
    // ============================================================

    @Test
    void 예상_비용이_한도를_넘으면_전송하지_않고_BUDGET_EXCEEDED() {
        // given
        Action expensive = action("a").withEstimate(CostEstimate.of("test-model", 4_000, 0));

        // when
        ExecutionSummary summary = coordinator.run(coordinator.plan(List.of(expensive)),
            RunOptions.defaults().withBudget(ledger(1.0)));

        // then
        ActionResult result = summary.getResult(ActionId.of("a"));
        assertThat(result.state()).isEqualTo(ActionState.FAILED);
        assertThat(result.error().kind()).isEqualTo(ErrorKind.BUDGET_EXCEEDED);
        assertThat(result.attempt()).isZero();
        verify(router, never()).route(any(), anyInt(), any());
    }

    @Test
    void 성공한_호출의_사용량은_예산_장부에_반영() {
        // given
        when(router.route(any(), anyInt(), any())).thenReturn(ok(P1));
        ChainBudgetLedger ledger = ledger(10.0);

        // when
        coordinator.run(coordinator.plan(List.of(action("a"))), RunOptions.defaults().withBudget(ledger));

        // then: gpt-4 입력 100, 출력 50
        assertThat(ledger.snapshot().totalCostUsd()).isCloseTo(0.006, within(1e-9));
        assertThat(ledger.snapshot().nodeCosts()).containsKey("llm.chat");
        assertThat(ledger.pendingUsd()).isZero();
    }

    @Test
    void DEGRADE_구간에서는_대체_모델과_축소된_컨텍스트로_전송() {
        // given: 누적 $0.90625 / 한도 $1.00
        ChainBudgetLedger ledger = ledger(1.0);
        ledger.updateAfterCall(null, "test-model", "seed", 2_900, 0);
        when(router.route(any(), anyInt(), any())).thenReturn(new ProviderRequestResult(
            new Ok(P1, new ProviderResponse("out", "gpt-3.5-turbo", 10, 10)), 5, 0.0, 1, List.of(P1)));

        // when
        coordinator.run(coordinator.plan(List.of(action("a"))), RunOptions.defaults().withBudget(ledger));

        // then
        ArgumentCaptor<ProviderRequest> captor = ArgumentCaptor.forClass(ProviderRequest.class);
        verify(router).route(captor.capture(), anyInt(), any());
        assertThat(captor.getValue().model()).isEqualTo("gpt-3.5-turbo");
        assertThat(captor.getValue().parameters())
            .containsEntry(DegradationConfig.MAX_CONTEXT_TOKENS_KEY, 4_000);
    }

    @Test
    void Router가_예외를_던지면_예약은_해제되고_Action은_FAILED() {
        // given
        when(router.route(any(), anyInt(), any())).thenThrow(new IllegalStateException("router closed"));
        ChainBudgetLedger ledger = ledger(10.0);
        Action action = action("a").withEstimate(CostEstimate.of("gpt-4", 1_000, 1_000));

        // when
        ExecutionSummary summary = coordinator.run(coordinator.plan(List.of(action)),
            RunOptions.defaults().withBudget(ledger));

        // then
        assertThat(summary.getResult(ActionId.of("a")).state()).isEqualTo(ActionState.FAILED);
        assertThat(ledger.pendingUsd()).isZero();
        assertThat(ledger.snapshot().totalCostUsd()).isZero();
    }
}
