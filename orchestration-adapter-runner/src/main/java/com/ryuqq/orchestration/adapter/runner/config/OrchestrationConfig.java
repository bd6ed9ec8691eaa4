package com.ryuqq.orchestration.adapter.runner.config;

import com.ryuqq.orchestration.adapter.runner.CoordinatorConfig;
import com.ryuqq.orchestration.adapter.runner.budget.BudgetConfig;
import com.ryuqq.orchestration.adapter.runner.health.HealthCheckConfig;
import com.ryuqq.orchestration.adapter.runner.ratelimit.AgentRateLimitConfig;
import com.ryuqq.orchestration.adapter.runner.ratelimit.QueueDrainerConfig;
import com.ryuqq.orchestration.adapter.runner.routing.RouterConfig;
import com.ryuqq.orchestration.core.protection.RateLimiterConfig;
import com.ryuqq.orchestration.core.provider.ProviderConfig;

import java.util.List;

/**
 * Orchestration 전체 설정 (불변 record).
 *
 * <p>{@link OrchestrationConfigLoader}로 JSON에서 읽거나 코드로 직접 구성합니다.
 * 시작 시점에 한 번 로드되며 이후 변경되지 않습니다.</p>
 *
 * @param providers Provider 목록 (1개 이상)
 * @param globalRateLimit 전역 Rate Limit
 * @param budget 요청 체인 예산 설정
 * @param coordinator Coordinator 설정
 * @param router Router 설정
 * @param healthCheck 주기적 Health Check 설정
 * @param queue 요청 대기열 설정
 * @param agentRateLimit 대기열 배출 시 Agent별 Rate Limit
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record OrchestrationConfig(
    List<ProviderConfig> providers,
    RateLimiterConfig globalRateLimit,
    BudgetConfig budget,
    CoordinatorConfig coordinator,
    RouterConfig router,
    HealthCheckConfig healthCheck,
    QueueDrainerConfig queue,
    AgentRateLimitConfig agentRateLimit
) {

    public OrchestrationConfig {
        if (providers == null || providers.isEmpty()) {
            throw new IllegalArgumentException("providers cannot be null or empty");
        }
        providers = List.copyOf(providers);
        globalRateLimit = globalRateLimit == null ? new RateLimiterConfig(100.0, 100) : globalRateLimit;
        budget = budget == null ? new BudgetConfig() : budget;
        coordinator = coordinator == null ? new CoordinatorConfig() : coordinator;
        router = router == null ? new RouterConfig() : router;
        healthCheck = healthCheck == null ? new HealthCheckConfig() : healthCheck;
        queue = queue == null ? new QueueDrainerConfig() : queue;
        agentRateLimit = agentRateLimit == null ? new AgentRateLimitConfig() : agentRateLimit;
    }

    /**
     * Provider 목록만 지정하고 나머지는 기본값으로 생성.
     *
     * @param providers Provider 목록
     * @return 설정
     */
    public static OrchestrationConfig of(List<ProviderConfig> providers) {
        return new OrchestrationConfig(providers, null, null, null, null, null, null, null);
    }

    public OrchestrationConfig withBudget(BudgetConfig budget) {
        return new OrchestrationConfig(providers, globalRateLimit, budget, coordinator, router, healthCheck, queue,
            agentRateLimit);
    }

    public OrchestrationConfig withCoordinator(CoordinatorConfig coordinator) {
        return new OrchestrationConfig(providers, globalRateLimit, budget, coordinator, router, healthCheck, queue,
            agentRateLimit);
    }

    public OrchestrationConfig withRouter(RouterConfig router) {
        return new OrchestrationConfig(providers, globalRateLimit, budget, coordinator, router, healthCheck, queue,
            agentRateLimit);
    }

    public OrchestrationConfig withGlobalRateLimit(RateLimiterConfig globalRateLimit) {
        return new OrchestrationConfig(providers, globalRateLimit, budget, coordinator, router, healthCheck, queue,
            agentRateLimit);
    }

    public OrchestrationConfig withHealthCheck(HealthCheckConfig healthCheck) {
        return new OrchestrationConfig(providers, globalRateLimit, budget, coordinator, router, healthCheck, queue,
            agentRateLimit);
    }

    public OrchestrationConfig withQueue(QueueDrainerConfig queue) {
        return new OrchestrationConfig(providers, globalRateLimit, budget, coordinator, router, healthCheck, queue,
            agentRateLimit);
    }

    public OrchestrationConfig withAgentRateLimit(AgentRateLimitConfig agentRateLimit) {
        return new OrchestrationConfig(providers, globalRateLimit, budget, coordinator, router, healthCheck, queue,
            agentRateLimit);
    }
}
