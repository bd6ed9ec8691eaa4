package com.ryuqq.orchestration.testkit.contract;

import com.ryuqq.orchestration.adapter.inmemory.provider.InMemoryProviderClient;
import com.ryuqq.orchestration.adapter.runner.budget.ChainBudgetLedger;
import com.ryuqq.orchestration.adapter.runner.config.OrchestrationConfig;
import com.ryuqq.orchestration.adapter.runner.config.OrchestrationConfigLoader;
import com.ryuqq.orchestration.adapter.runner.ratelimit.QueueStats;
import com.ryuqq.orchestration.adapter.runner.ratelimit.QueuedRequest;
import com.ryuqq.orchestration.adapter.runner.ratelimit.RequestPriority;
import com.ryuqq.orchestration.application.coordinator.ExecutionSummary;
import com.ryuqq.orchestration.application.coordinator.RunOptions;
import com.ryuqq.orchestration.core.budget.BudgetState;
import com.ryuqq.orchestration.core.budget.DegradationConfig;
import com.ryuqq.orchestration.core.exception.ProviderException;
import com.ryuqq.orchestration.core.protection.RateLimiterConfig;
import com.ryuqq.orchestration.core.provider.ProviderRequest;
import com.ryuqq.orchestration.core.statemachine.ActionState;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for a runtime assembled from a JSON configuration.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>클래스패스 설정으로 조립한 Runtime이 계획/실행을 수행</li>
 *   <li>DEGRADE 구간에서는 대체 모델과 축소된 컨텍스트로 전송</li>
 *   <li>대기열 요청은 배출되고, 실패가 반복되면 dead-letter로 이동</li>
 *   <li>설정된 Agent별 한도가 대기열 배출에 적용</li>
 *   <li>기본 실행 옵션에는 설정 예산의 장부가 붙음</li>
 * </ul>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
class RuntimeConfigurationContractTest extends AbstractContractTest {

    private static final long AWAIT_TIMEOUT_MS = 5_000L;

    @Override
    protected OrchestrationConfig config() {
        try {
            return OrchestrationConfigLoader.loadFromClasspath("orchestration-contract.json");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static ProviderRequest request(String id) {
        return new ProviderRequest(id, "llm.chat", Map.of(), null, 1_000L);
    }

    private void awaitStats(int expectedProcessed, int expectedDeadLettered) throws InterruptedException {
        long deadline = System.currentTimeMillis() + AWAIT_TIMEOUT_MS;
        QueueStats stats = runtime.queueDrainer().stats();
        while (System.currentTimeMillis() < deadline
            && (stats.processed() < expectedProcessed || stats.deadLettered() < expectedDeadLettered)) {
            Thread.sleep(10);
            stats = runtime.queueDrainer().stats();
        }
    }

    private QueueStats awaitQueueSize(int expectedSize) throws InterruptedException {
        long deadline = System.currentTimeMillis() + AWAIT_TIMEOUT_MS;
        QueueStats stats = runtime.queueDrainer().stats();
        while (System.currentTimeMillis() < deadline && stats.queueSize() != expectedSize) {
            Thread.sleep(1);
            stats = runtime.queueDrainer().stats();
        }
        return stats;
    }

    @Test
    void testRuntime_LoadedFromClasspath_RunsPlan() {
        // When
        ExecutionSummary summary = run(action("fetch"), action("summarize", "fetch"));

        // Then
        assertTrue(summary.isAllSucceeded());
        assertEquals(2, runtime.config().providers().size());
        assertEquals(2, client.invocationCount(PRIMARY));
        assertEquals("gpt-4", client.invocations(PRIMARY).get(0).request().model());
    }

    @Test
    void testRuntime_DegradeZone_SendsFallbackModelAndReducedContext() {
        // Given: $0.90625 / $1.00 사용
        ChainBudgetLedger ledger = runtime.newBudgetLedger();
        ledger.updateAfterCall(null, "test-model", "seed", 2_900, 0);

        // When
        ExecutionSummary summary = runtime.coordinator().run(
            runtime.coordinator().plan(List.of(action("a"))), runtime.runOptions().withBudget(ledger));

        // Then
        assertActionState(summary, "a", ActionState.SUCCEEDED);
        List<InMemoryProviderClient.Invocation> calls = client.invocations(PRIMARY);
        assertEquals(1, calls.size());
        ProviderRequest sent = calls.get(0).request();
        assertEquals("gpt-3.5-turbo", sent.model());
        assertEquals(4_000, sent.parameters().get(DegradationConfig.MAX_CONTEXT_TOKENS_KEY));
    }

    @Test
    void testQueue_SubmittedRequests_DrainedThroughRouter() throws InterruptedException {
        // When
        assertTrue(runtime.submit(QueuedRequest.of("agent-1", request("q-1"), RequestPriority.LOW)));
        assertTrue(runtime.submit(QueuedRequest.of("agent-1", request("q-2"), RequestPriority.HIGH)));
        assertTrue(runtime.submit(QueuedRequest.of("agent-2", request("q-3"), RequestPriority.MEDIUM)));
        awaitStats(3, 0);

        // Then
        QueueStats stats = runtime.queueDrainer().stats();
        assertEquals(3L, stats.processed());
        assertEquals(0L, stats.deadLettered());
        assertEquals(3, client.invocationCount(PRIMARY));
    }

    @Test
    void testQueue_RepeatedFailure_DeadLettered() throws InterruptedException {
        // Given: 두 Provider 모두 영구 오류
        client.script(PRIMARY).alwaysFail(ProviderException.malformed("rejected"));
        client.script(SECONDARY).alwaysFail(ProviderException.malformed("rejected"));

        // When
        assertTrue(runtime.submit(QueuedRequest.of("agent-1", request("doomed"), RequestPriority.HIGH)));
        awaitStats(0, 1);

        // Then: 최초 + 재시도 1회 후 dead-letter
        QueueStats stats = runtime.queueDrainer().stats();
        assertEquals(1L, stats.deadLettered());
        assertEquals(2L, stats.failed());
        assertEquals("doomed", runtime.queueDrainer().getDeadLetters().get(0).requestId());
        assertEquals(1, runtime.queueDrainer().getDeadLetters().get(0).retryCount());
    }

    @Test
    void testQueue_ConfiguredAgentLimit_ThrottlesOnlyThatAgent() throws InterruptedException {
        // Given: throttled-agent 버킷은 용량 1, 사실상 충전 없음
        assertEquals(new RateLimiterConfig(0.001, 1), runtime.config().agentRateLimit().limitFor("throttled-agent"));

        // When
        assertTrue(runtime.submit(QueuedRequest.of("throttled-agent", request("t-1"), RequestPriority.HIGH)));
        assertTrue(runtime.submit(QueuedRequest.of("throttled-agent", request("t-2"), RequestPriority.HIGH)));
        awaitStats(1, 0);
        Thread.sleep(300);

        // Then: 첫 요청만 배출되고 두 번째는 admission 거부 후 대기열로 되돌아감
        QueueStats stats = awaitQueueSize(1);
        assertEquals(1L, stats.processed());
        assertEquals(1, stats.queueSize());
        assertEquals(0L, stats.failed());
        assertEquals(1, client.invocationCount(PRIMARY));
        assertEquals("t-1", client.invocations(PRIMARY).get(0).request().requestId());
    }

    @Test
    void testRunOptions_Default_ChargesConfiguredBudget() {
        // Given
        RunOptions options = runtime.runOptions();
        assertTrue(options.hasBudget());

        // When
        ExecutionSummary summary = runtime.coordinator().run(
            runtime.coordinator().plan(List.of(action("a"), action("b", "a"))), options);

        // Then: gpt-4 10/10 토큰 x 2회 = $0.0018 (한도 $1.00)
        assertTrue(summary.isAllSucceeded());
        BudgetState state = options.budget().snapshot();
        assertEquals(1.0, state.limitUsd(), 1e-9);
        assertEquals(40L, state.totalInputTokens() + state.totalOutputTokens());
        assertEquals(0.0018, state.totalCostUsd(), 1e-9);
        assertNotSame(options.budget(), runtime.runOptions().budget());
    }
}
