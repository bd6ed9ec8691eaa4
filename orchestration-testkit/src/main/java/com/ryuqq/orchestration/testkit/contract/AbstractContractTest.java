package com.ryuqq.orchestration.testkit.contract;

import com.ryuqq.orchestration.adapter.inmemory.provider.InMemoryProviderClient;
import com.ryuqq.orchestration.adapter.runner.CoordinatorConfig;
import com.ryuqq.orchestration.adapter.runner.OrchestrationRuntime;
import com.ryuqq.orchestration.adapter.runner.config.OrchestrationConfig;
import com.ryuqq.orchestration.adapter.runner.health.HealthCheckConfig;
import com.ryuqq.orchestration.adapter.runner.routing.RouterConfig;
import com.ryuqq.orchestration.application.coordinator.ExecutionSummary;
import com.ryuqq.orchestration.core.error.ErrorKind;
import com.ryuqq.orchestration.core.model.Action;
import com.ryuqq.orchestration.core.model.ActionId;
import com.ryuqq.orchestration.core.model.ActionResult;
import com.ryuqq.orchestration.core.model.BackoffShape;
import com.ryuqq.orchestration.core.model.ProviderId;
import com.ryuqq.orchestration.core.model.RetryPolicy;
import com.ryuqq.orchestration.core.protection.RateLimiterConfig;
import com.ryuqq.orchestration.core.provider.CostModel;
import com.ryuqq.orchestration.core.provider.ProviderConfig;
import com.ryuqq.orchestration.core.statemachine.ActionState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

/**
 * Abstract base class for Contract Tests.
 *
 * <p>실제 {@link OrchestrationRuntime}을 {@link InMemoryProviderClient} 위에서 구동하고,
 * 시나리오 작성에 필요한 헬퍼를 제공합니다.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>InMemoryProviderClient: Provider 응답/실패 시나리오</li>
 *   <li>OrchestrationRuntime: Coordinator, Router, Health Monitor, Rate Limiter 조립</li>
 *   <li>Provider 2개: {@link #PRIMARY} (priority 0), {@link #SECONDARY} (priority 1)</li>
 *   <li>재시도 지연 0ms, 주기적 probe 비활성화</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractContractTest {
 *     {@literal @}Test
 *     void scenario() {
 *         client.script(PRIMARY).alwaysFail(ProviderException.authentication("revoked"));
 *
 *         ExecutionSummary summary = run(action("a"), action("b", "a"));
 *
 *         assertActionState(summary, "b", ActionState.SUCCEEDED);
 *     }
 * }
 * </pre>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public abstract class AbstractContractTest {

    protected static final ProviderId PRIMARY = ProviderId.of("primary");
    protected static final ProviderId SECONDARY = ProviderId.of("secondary");

    /**
     * Health Check 요청 유형 ({@link com.ryuqq.orchestration.core.spi.ProviderClient#ping}).
     */
    protected static final String HEALTH_CHECK_TYPE = "health-check";

    protected InMemoryProviderClient client;
    protected OrchestrationRuntime runtime;

    /**
     * Sets up a fresh runtime before each test.
     */
    @BeforeEach
    void setUpRuntime() {
        client = new InMemoryProviderClient();
        runtime = OrchestrationRuntime.start(config(), client);
    }

    /**
     * Stops the runtime and clears recorded invocations after each test.
     */
    @AfterEach
    void tearDownRuntime() {
        if (runtime != null) {
            runtime.close();
        }
        if (client != null) {
            client.reset();
        }
    }

    /**
     * 테스트 Runtime 설정. 하위 클래스에서 재정의할 수 있습니다.
     *
     * @return 설정
     */
    protected OrchestrationConfig config() {
        RateLimiterConfig generous = new RateLimiterConfig(1_000.0, 1_000);
        List<ProviderConfig> providers = List.of(
            ProviderConfig.of(PRIMARY.getValue(), 0)
                .withModel("gpt-4")
                .withRateLimit(generous)
                .withCostModel(new CostModel(0.03, 0.06)),
            ProviderConfig.of(SECONDARY.getValue(), 1)
                .withModel("gpt-3.5-turbo")
                .withRateLimit(generous)
                .withCostModel(new CostModel(0.0005, 0.0015))
        );
        return OrchestrationConfig.of(providers)
            .withGlobalRateLimit(generous)
            .withCoordinator(new CoordinatorConfig()
                .withMaxConcurrency(4)
                .withDefaultRetryPolicy(new RetryPolicy(3, BackoffShape.EXPONENTIAL, 0, 0)))
            .withRouter(new RouterConfig().withRetryDelays(0, 0))
            .withHealthCheck(new HealthCheckConfig().withProbeEnabled(false));
    }

    /**
     * 기본 재시도 정책을 적용한 Action 생성.
     *
     * @param id Action ID
     * @param dependencies 의존 Action ID
     * @return Action
     */
    protected Action action(String id, String... dependencies) {
        return typedAction(id, "llm.chat", dependencies);
    }

    protected Action typedAction(String id, String type, String... dependencies) {
        List<ActionId> deps = new ArrayList<>();
        for (String dependency : dependencies) {
            deps.add(ActionId.of(dependency));
        }
        return runtime.action(id, type).withDependencies(deps);
    }

    /**
     * 계획 수립 후 기본 옵션으로 실행.
     *
     * @param actions Action 목록
     * @return 실행 요약
     */
    protected ExecutionSummary run(Action... actions) {
        return runtime.coordinator().run(runtime.coordinator().plan(List.of(actions)), runtime.runOptions());
    }

    /**
     * Health Check를 제외한 특정 요청 ID의 호출 수.
     *
     * @param requestId 요청 ID (= Action ID)
     * @return 호출 수
     */
    protected long dispatchCount(String requestId) {
        return client.invocations().stream()
            .filter(invocation -> invocation.request().requestId().equals(requestId))
            .count();
    }

    protected void assertActionState(ExecutionSummary summary, String actionId, ActionState expected) {
        ActionResult result = summary.getResult(ActionId.of(actionId));
        assertNotNull(result, "No result for action " + actionId);
        assertEquals(expected, result.state(), "Unexpected state for action " + actionId);
    }

    protected void assertErrorKind(ExecutionSummary summary, String actionId, ErrorKind expected) {
        ActionResult result = summary.getResult(ActionId.of(actionId));
        assertNotNull(result, "No result for action " + actionId);
        assertNotNull(result.error(), "Action " + actionId + " has no error");
        assertEquals(expected, result.error().kind(), "Unexpected error kind for action " + actionId);
    }
}
