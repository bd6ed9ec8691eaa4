package com.ryuqq.orchestration.adapter.runner.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.orchestration.adapter.runner.CoordinatorConfig;
import com.ryuqq.orchestration.adapter.runner.budget.BudgetConfig;
import com.ryuqq.orchestration.adapter.runner.health.HealthCheckConfig;
import com.ryuqq.orchestration.adapter.runner.ratelimit.AgentRateLimitConfig;
import com.ryuqq.orchestration.adapter.runner.ratelimit.QueueDrainerConfig;
import com.ryuqq.orchestration.adapter.runner.ratelimit.QueueType;
import com.ryuqq.orchestration.adapter.runner.routing.LoadBalancingStrategy;
import com.ryuqq.orchestration.adapter.runner.routing.RouterConfig;
import com.ryuqq.orchestration.core.budget.GuardrailConfig;
import com.ryuqq.orchestration.core.budget.ModelPricing;
import com.ryuqq.orchestration.core.model.BackoffShape;
import com.ryuqq.orchestration.core.model.ProviderId;
import com.ryuqq.orchestration.core.model.RetryPolicy;
import com.ryuqq.orchestration.core.protection.RateLimiterConfig;
import com.ryuqq.orchestration.core.provider.CostModel;
import com.ryuqq.orchestration.core.provider.HealthThresholds;
import com.ryuqq.orchestration.core.provider.ProviderConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * JSON 문서에서 {@link OrchestrationConfig}를 읽는 로더.
 *
 * <p>필수 항목은 {@code providers[].id}와 {@code providers[].priority}뿐이며,
 * 생략된 선택 항목은 각 설정 record의 기본값을 따릅니다.</p>
 *
 * <pre>{@code
 * {
 *   "providers": [
 *     { "id": "provider-1", "priority": 0, "model": "gpt-4",
 *       "rateLimit": { "refillRate": 5, "capacity": 10 },
 *       "costModel": { "inputPricePer1k": 0.03, "outputPricePer1k": 0.06 },
 *       "health": { "maxConsecutiveFailures": 3 } }
 *   ],
 *   "globalRateLimit": { "refillRate": 50, "capacity": 100 },
 *   "budget": { "limitUsd": 10.0, "warningThreshold": 0.8, "fallbackModel": "gpt-3.5-turbo" },
 *   "coordinator": { "maxConcurrency": 8, "stopOnFailure": true },
 *   "router": { "strategy": "HEALTH_BASED" },
 *   "agentRateLimit": { "default": { "refillRate": 10, "capacity": 10 },
 *                       "agents": { "planner": { "refillRate": 2, "capacity": 4 } } }
 * }
 * }</pre>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public final class OrchestrationConfigLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private OrchestrationConfigLoader() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 파일에서 설정 로드.
     *
     * @param path JSON 파일 경로
     * @return 설정
     * @throws IOException 읽기 또는 JSON 파싱 실패 시
     * @throws IllegalArgumentException 설정 값이 유효하지 않은 경우
     */
    public static OrchestrationConfig loadFromFile(Path path) throws IOException {
        return parse(MAPPER.readTree(path.toFile()));
    }

    /**
     * 문자열에서 설정 로드.
     *
     * @param json JSON 문자열
     * @return 설정
     * @throws IOException JSON 파싱 실패 시
     */
    public static OrchestrationConfig loadFromString(String json) throws IOException {
        return parse(MAPPER.readTree(json));
    }

    /**
     * 클래스패스 리소스에서 설정 로드.
     *
     * @param resource 리소스 이름 (예: "orchestration.json")
     * @return 설정
     * @throws IOException 리소스가 없거나 파싱 실패 시
     */
    public static OrchestrationConfig loadFromClasspath(String resource) throws IOException {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = OrchestrationConfigLoader.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Configuration resource not found: " + resource);
            }
            return parse(MAPPER.readTree(in));
        }
    }

    private static OrchestrationConfig parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("configuration root must be a JSON object");
        }
        JsonNode providersNode = root.get("providers");
        if (providersNode == null || !providersNode.isArray()) {
            throw new IllegalArgumentException("providers must be a JSON array");
        }
        List<ProviderConfig> providers = new ArrayList<>();
        providersNode.forEach(node -> providers.add(parseProvider(node)));

        return new OrchestrationConfig(
            providers,
            root.has("globalRateLimit") ? parseRateLimit(root.get("globalRateLimit"), 100.0, 100) : null,
            parseBudget(root.get("budget")),
            parseCoordinator(root.get("coordinator"), root.get("router")),
            parseRouter(root.get("router")),
            parseHealthCheck(root.get("healthCheck")),
            parseQueue(root.get("queue")),
            parseAgentRateLimit(root.get("agentRateLimit"))
        );
    }

    private static ProviderConfig parseProvider(JsonNode node) {
        if (!node.has("id")) {
            throw new IllegalArgumentException("provider id is required: " + node);
        }
        if (!node.has("priority")) {
            throw new IllegalArgumentException("provider priority is required: " + node);
        }
        String id = node.get("id").asText();
        return new ProviderConfig(
            ProviderId.of(id),
            text(node, "name", id),
            node.get("priority").asInt(),
            text(node, "endpoint", null),
            node.has("rateLimit") ? parseRateLimit(node.get("rateLimit"), 10.0, 10) : new RateLimiterConfig(),
            parseCostModel(node.get("costModel")),
            text(node, "model", null),
            parseThresholds(node.get("health"))
        );
    }

    private static RateLimiterConfig parseRateLimit(JsonNode node, double defaultRate, int defaultCapacity) {
        double refillRate = node.has("refillRate") ? node.get("refillRate").asDouble() : defaultRate;
        int capacity = node.has("capacity") ? node.get("capacity").asInt() : defaultCapacity;
        return new RateLimiterConfig(refillRate, capacity);
    }

    private static AgentRateLimitConfig parseAgentRateLimit(JsonNode node) {
        AgentRateLimitConfig defaults = new AgentRateLimitConfig();
        if (node == null) {
            return defaults;
        }
        RateLimiterConfig base = defaults.defaultLimit();
        RateLimiterConfig defaultLimit = node.has("default")
            ? parseRateLimit(node.get("default"), base.refillRate(), base.capacity()) : base;
        Map<String, RateLimiterConfig> agents = new LinkedHashMap<>();
        JsonNode agentsNode = node.get("agents");
        if (agentsNode != null) {
            if (!agentsNode.isObject()) {
                throw new IllegalArgumentException("agentRateLimit.agents must be a JSON object");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = agentsNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                agents.put(field.getKey(),
                    parseRateLimit(field.getValue(), defaultLimit.refillRate(), defaultLimit.capacity()));
            }
        }
        return new AgentRateLimitConfig(defaultLimit, agents);
    }

    private static CostModel parseCostModel(JsonNode node) {
        if (node == null) {
            return CostModel.FREE;
        }
        return new CostModel(
            node.has("inputPricePer1k") ? node.get("inputPricePer1k").asDouble() : 0.0,
            node.has("outputPricePer1k") ? node.get("outputPricePer1k").asDouble() : 0.0
        );
    }

    private static HealthThresholds parseThresholds(JsonNode node) {
        HealthThresholds defaults = new HealthThresholds();
        if (node == null) {
            return defaults;
        }
        return new HealthThresholds(
            node.has("maxConsecutiveFailures")
                ? node.get("maxConsecutiveFailures").asInt() : defaults.maxConsecutiveFailures(),
            node.has("maxErrorRate") ? node.get("maxErrorRate").asDouble() : defaults.maxErrorRate(),
            node.has("maxAverageLatencyMs")
                ? node.get("maxAverageLatencyMs").asLong() : defaults.maxAverageLatencyMs(),
            node.has("minSuccessRate") ? node.get("minSuccessRate").asDouble() : defaults.minSuccessRate(),
            node.has("windowSize") ? node.get("windowSize").asInt() : defaults.windowSize(),
            node.has("minimumRequests") ? node.get("minimumRequests").asInt() : defaults.minimumRequests()
        );
    }

    private static BudgetConfig parseBudget(JsonNode node) {
        BudgetConfig defaults = new BudgetConfig();
        if (node == null) {
            return defaults;
        }
        GuardrailConfig guardrailDefaults = new GuardrailConfig();
        GuardrailConfig guardrail = new GuardrailConfig(
            node.has("warningThreshold")
                ? node.get("warningThreshold").asDouble() : guardrailDefaults.warningThreshold(),
            node.has("softLimitThreshold")
                ? node.get("softLimitThreshold").asDouble() : guardrailDefaults.softLimitThreshold(),
            node.has("hardLimitThreshold")
                ? node.get("hardLimitThreshold").asDouble() : guardrailDefaults.hardLimitThreshold(),
            node.has("enableGracefulDegradation")
                ? node.get("enableGracefulDegradation").asBoolean() : guardrailDefaults.enableGracefulDegradation(),
            text(node, "fallbackModel", null),
            node.has("reduceContextOnDegradation")
                ? node.get("reduceContextOnDegradation").asBoolean()
                : guardrailDefaults.reduceContextOnDegradation(),
            node.has("contextReductionFactor")
                ? node.get("contextReductionFactor").asDouble() : guardrailDefaults.contextReductionFactor()
        );

        List<ModelPricing> pricing = new ArrayList<>();
        if (node.has("pricing")) {
            node.get("pricing").forEach(p -> pricing.add(new ModelPricing(
                p.get("model").asText(),
                p.has("inputPricePer1k") ? p.get("inputPricePer1k").asDouble() : 0.0,
                p.has("outputPricePer1k") ? p.get("outputPricePer1k").asDouble() : 0.0,
                text(p, "provider", null)
            )));
        }
        double limitUsd = node.has("limitUsd") ? node.get("limitUsd").asDouble() : defaults.limitUsd();
        return new BudgetConfig(limitUsd, guardrail, pricing);
    }

    private static CoordinatorConfig parseCoordinator(JsonNode node, JsonNode routerNode) {
        CoordinatorConfig defaults = new CoordinatorConfig();
        int providerMaxRetries = defaults.providerMaxRetries();
        if (routerNode != null && routerNode.has("maxRetries")) {
            providerMaxRetries = routerNode.get("maxRetries").asInt();
        }
        if (node == null) {
            return defaults.withProviderMaxRetries(providerMaxRetries);
        }
        if (node.has("providerMaxRetries")) {
            providerMaxRetries = node.get("providerMaxRetries").asInt();
        }
        return new CoordinatorConfig(
            node.has("maxConcurrency") ? node.get("maxConcurrency").asInt() : defaults.maxConcurrency(),
            providerMaxRetries,
            node.has("stopOnFailure") ? node.get("stopOnFailure").asBoolean() : defaults.stopOnFailure(),
            parseRetryPolicy(node.get("retryPolicy")),
            node.has("defaultTimeoutMs") ? node.get("defaultTimeoutMs").asLong() : defaults.defaultTimeoutMs(),
            node.has("defaultEstimatedTimeMs")
                ? node.get("defaultEstimatedTimeMs").asLong() : defaults.defaultEstimatedTimeMs()
        );
    }

    private static RetryPolicy parseRetryPolicy(JsonNode node) {
        RetryPolicy defaults = new RetryPolicy();
        if (node == null) {
            return defaults;
        }
        return new RetryPolicy(
            node.has("maxAttempts") ? node.get("maxAttempts").asInt() : defaults.maxAttempts(),
            node.has("backoff") ? enumValue(BackoffShape.class, node.get("backoff").asText()) : defaults.shape(),
            node.has("baseDelayMs") ? node.get("baseDelayMs").asLong() : defaults.baseDelayMs(),
            node.has("maxDelayMs") ? node.get("maxDelayMs").asLong() : defaults.maxDelayMs()
        );
    }

    private static RouterConfig parseRouter(JsonNode node) {
        RouterConfig defaults = new RouterConfig();
        if (node == null) {
            return defaults;
        }
        return new RouterConfig(
            node.has("strategy")
                ? enumValue(LoadBalancingStrategy.class, node.get("strategy").asText()) : defaults.strategy(),
            node.has("admissionTimeoutMs")
                ? node.get("admissionTimeoutMs").asLong() : defaults.admissionTimeoutMs(),
            node.has("retryBaseDelayMs") ? node.get("retryBaseDelayMs").asLong() : defaults.retryBaseDelayMs(),
            node.has("retryMaxDelayMs") ? node.get("retryMaxDelayMs").asLong() : defaults.retryMaxDelayMs()
        );
    }

    private static HealthCheckConfig parseHealthCheck(JsonNode node) {
        HealthCheckConfig defaults = new HealthCheckConfig();
        if (node == null) {
            return defaults;
        }
        long intervalMs = node.has("intervalMs") ? node.get("intervalMs").asLong() : defaults.intervalMs();
        return new HealthCheckConfig(
            intervalMs,
            node.has("initialDelayMs") ? node.get("initialDelayMs").asLong() : intervalMs,
            node.has("probeEnabled") ? node.get("probeEnabled").asBoolean() : defaults.probeEnabled(),
            node.has("probeTimeoutMs") ? node.get("probeTimeoutMs").asLong() : defaults.probeTimeoutMs()
        );
    }

    private static QueueDrainerConfig parseQueue(JsonNode node) {
        QueueDrainerConfig defaults = new QueueDrainerConfig();
        if (node == null) {
            return defaults;
        }
        return new QueueDrainerConfig(
            node.has("type") ? enumValue(QueueType.class, node.get("type").asText()) : defaults.type(),
            node.has("maxSize") ? node.get("maxSize").asInt() : defaults.maxSize(),
            node.has("pollingIntervalMs")
                ? node.get("pollingIntervalMs").asLong() : defaults.pollingIntervalMs(),
            node.has("batchSize") ? node.get("batchSize").asInt() : defaults.batchSize(),
            node.has("maxRetries") ? node.get("maxRetries").asInt() : defaults.maxRetries(),
            node.has("admissionTimeoutMs")
                ? node.get("admissionTimeoutMs").asLong() : defaults.admissionTimeoutMs()
        );
    }

    private static String text(JsonNode node, String field, String defaultValue) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? defaultValue : value.asText();
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, String value) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown " + type.getSimpleName() + ": " + value, e);
        }
    }
}
