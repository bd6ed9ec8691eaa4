package com.ryuqq.orchestration.adapter.runner;

import com.ryuqq.orchestration.adapter.runner.budget.BudgetGuardrail;
import com.ryuqq.orchestration.adapter.runner.budget.ChainBudgetLedger;
import com.ryuqq.orchestration.adapter.runner.config.OrchestrationConfig;
import com.ryuqq.orchestration.adapter.runner.health.HealthCheckScheduler;
import com.ryuqq.orchestration.adapter.runner.health.ProviderHealthMonitor;
import com.ryuqq.orchestration.adapter.runner.ratelimit.CoordinatedRateLimiter;
import com.ryuqq.orchestration.adapter.runner.ratelimit.QueueDrainer;
import com.ryuqq.orchestration.adapter.runner.ratelimit.QueuedRequest;
import com.ryuqq.orchestration.adapter.runner.ratelimit.QueuedRequestHandler;
import com.ryuqq.orchestration.adapter.runner.ratelimit.RequestQueue;
import com.ryuqq.orchestration.adapter.runner.ratelimit.TokenBucketRateLimiter;
import com.ryuqq.orchestration.adapter.runner.routing.MultiProviderRouter;
import com.ryuqq.orchestration.application.coordinator.RunOptions;
import com.ryuqq.orchestration.core.model.Action;
import com.ryuqq.orchestration.core.protection.RateLimiterConfig;
import com.ryuqq.orchestration.core.provider.ProviderConfig;
import com.ryuqq.orchestration.core.spi.ProviderClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 설정으로부터 구성 요소를 조립하고 수명 주기를 관리하는 Runtime.
 *
 * <p><strong>구성:</strong></p>
 * <pre>
 * ExecutionCoordinator
 *   └─ MultiProviderRouter
 *        ├─ ProviderHealthMonitor ← HealthCheckScheduler (주기적 probe)
 *        ├─ CoordinatedRateLimiter (Provider 버킷 + 전역 버킷)
 *        └─ ProviderClient
 * QueueDrainer (Agent별 버킷, agentRateLimit) → Router
 * ChainBudgetLedger (요청 체인마다 새로 생성)
 * </pre>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * try (OrchestrationRuntime runtime = OrchestrationRuntime.start(config, client)) {
 *     ExecutionPlan plan = runtime.coordinator().plan(actions);
 *     ExecutionSummary summary = runtime.coordinator().run(plan, runtime.runOptions());
 * }
 * }</pre>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public final class OrchestrationRuntime implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationRuntime.class);

    private final OrchestrationConfig config;
    private final ProviderHealthMonitor healthMonitor;
    private final MultiProviderRouter router;
    private final HealthCheckScheduler healthCheckScheduler;
    private final ExecutionCoordinator coordinator;
    private final QueueDrainer queueDrainer;

    private OrchestrationRuntime(OrchestrationConfig config, ProviderClient client) {
        this.config = config;

        TokenBucketRateLimiter providerLimiter = new TokenBucketRateLimiter(new RateLimiterConfig());
        for (ProviderConfig provider : config.providers()) {
            providerLimiter.register(provider.id().getValue(), provider.rateLimit());
        }
        TokenBucketRateLimiter globalLimiter = new TokenBucketRateLimiter(config.globalRateLimit());
        CoordinatedRateLimiter rateLimiter = new CoordinatedRateLimiter(providerLimiter, globalLimiter);

        this.healthMonitor = new ProviderHealthMonitor(config.providers());
        this.router = new MultiProviderRouter(healthMonitor, rateLimiter, client, config.router());
        this.healthCheckScheduler = new HealthCheckScheduler(healthMonitor, client, config.healthCheck());
        this.coordinator = new ExecutionCoordinator(router, config.coordinator());

        RequestQueue queue = new RequestQueue(config.queue().type(), config.queue().maxSize());
        TokenBucketRateLimiter agentLimiter = config.agentRateLimit().newLimiter();
        this.queueDrainer = new QueueDrainer(queue, agentLimiter,
            QueuedRequestHandler.routing(router, config.coordinator().providerMaxRetries()), config.queue());
    }

    /**
     * Runtime 생성 및 백그라운드 작업(Health Check, 대기열 배출) 시작.
     *
     * @param config 설정
     * @param client Provider 호출 클라이언트
     * @return 시작된 Runtime
     */
    public static OrchestrationRuntime start(OrchestrationConfig config, ProviderClient client) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        OrchestrationRuntime runtime = new OrchestrationRuntime(config, client);
        runtime.healthCheckScheduler.start();
        runtime.queueDrainer.start();
        log.info("Orchestration runtime started with {} providers", config.providers().size());
        return runtime;
    }

    /**
     * 요청 체인 하나에 사용할 새 예산 장부 생성.
     *
     * @return 예산 장부
     */
    public ChainBudgetLedger newBudgetLedger() {
        BudgetGuardrail guardrail = config.budget().newGuardrail();
        return new ChainBudgetLedger(guardrail);
    }

    /**
     * 설정 기본값을 반영한 실행 옵션.
     *
     * <p>호출마다 새 예산 장부({@link #newBudgetLedger()})가 붙습니다. 여러 실행이 한 요청 체인을
     * 이루면 같은 장부를 {@code withBudget}으로 전달합니다.</p>
     *
     * @return 실행 옵션 (설정의 stopOnFailure, 새 예산 장부)
     */
    public RunOptions runOptions() {
        return RunOptions.defaults()
            .withStopOnFailure(config.coordinator().stopOnFailure())
            .withBudget(newBudgetLedger());
    }

    /**
     * 설정의 기본 재시도 정책과 타임아웃을 적용한 Action 생성.
     *
     * @param id Action ID
     * @param type 작업 유형
     * @return Action
     */
    public Action action(String id, String type) {
        return Action.of(id, type)
            .withRetryPolicy(config.coordinator().defaultRetryPolicy())
            .withTimeoutMs(config.coordinator().defaultTimeoutMs());
    }

    /**
     * 대기열에 요청 등록.
     *
     * @param request 요청
     * @return 등록 성공 여부
     */
    public boolean submit(QueuedRequest request) {
        return queueDrainer.submit(request);
    }

    public ExecutionCoordinator coordinator() {
        return coordinator;
    }

    public MultiProviderRouter router() {
        return router;
    }

    public ProviderHealthMonitor healthMonitor() {
        return healthMonitor;
    }

    public HealthCheckScheduler healthCheckScheduler() {
        return healthCheckScheduler;
    }

    public QueueDrainer queueDrainer() {
        return queueDrainer;
    }

    public OrchestrationConfig config() {
        return config;
    }

    @Override
    public void close() {
        try {
            queueDrainer.shutdown();
            healthCheckScheduler.shutdown();
            coordinator.shutdown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while shutting down orchestration runtime");
        } finally {
            router.close();
        }
        log.info("Orchestration runtime stopped");
    }
}
