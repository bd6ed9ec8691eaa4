package com.ryuqq.orchestration.adapter.runner.routing;

/**
 * Provider 선택 전략.
 *
 * <ul>
 *   <li>HEALTH_BASED: 우선순위 순서의 첫 HEALTHY Provider, 없으면 첫 DEGRADED Provider</li>
 *   <li>ROUND_ROBIN: 선택 가능한 Provider를 순환</li>
 *   <li>LEAST_CONNECTIONS: 진행 중 요청이 가장 적은 Provider (동률이면 우선순위)</li>
 * </ul>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public enum LoadBalancingStrategy {
    HEALTH_BASED,
    ROUND_ROBIN,
    LEAST_CONNECTIONS
}
