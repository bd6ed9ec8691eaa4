package com.ryuqq.orchestration.adapter.runner.routing;

import com.ryuqq.orchestration.adapter.runner.BackoffCalculator;
import com.ryuqq.orchestration.adapter.runner.health.ProviderHealthMonitor;
import com.ryuqq.orchestration.adapter.runner.ratelimit.AdmissionScope;
import com.ryuqq.orchestration.adapter.runner.ratelimit.CoordinatedRateLimiter;
import com.ryuqq.orchestration.application.routing.Router;
import com.ryuqq.orchestration.core.error.ErrorKind;
import com.ryuqq.orchestration.core.model.BackoffShape;
import com.ryuqq.orchestration.core.model.ProviderId;
import com.ryuqq.orchestration.core.outcome.CallOutcome;
import com.ryuqq.orchestration.core.outcome.Fail;
import com.ryuqq.orchestration.core.outcome.Ok;
import com.ryuqq.orchestration.core.outcome.Retry;
import com.ryuqq.orchestration.core.provider.HealthStatus;
import com.ryuqq.orchestration.core.provider.ProviderConfig;
import com.ryuqq.orchestration.core.provider.ProviderRequest;
import com.ryuqq.orchestration.core.provider.ProviderRequestResult;
import com.ryuqq.orchestration.core.provider.ProviderResponse;
import com.ryuqq.orchestration.core.spi.ProviderClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * 우선순위/건강 상태 기반 Multi-Provider Router.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * route(request)
 *   loop:
 *     1. 후보 선택 (UNHEALTHY, 이미 시도한 Provider 제외)
 *        - 없음 → 종료
 *     2. Rate Limit admission (Provider 버킷 + 전역 버킷)
 *        - Provider 버킷 소진 → 다음 후보로 failover
 *        - 전역 버킷 소진 → Retry(RATE_LIMITED)
 *     3. 타임아웃을 걸고 호출 → Health Monitor에 결과 기록
 *        - 성공 → Ok (비용 집계)
 *        - permanent 실패 → 다음 후보로 failover
 *        - transient 실패 → 같은 Provider로 maxRetries까지 backoff 재시도,
 *          소진 시 Retry 반환
 *   종료: Fail(ALL_PROVIDERS_FAILED) 또는 Retry(RATE_LIMITED)
 * </pre>
 *
 * <p>타임아웃이 난 호출은 취소하지 않고 버려둡니다. 진행 중 요청 수는
 * 호출이 실제로 끝날 때 감소합니다.</p>
 *
 * <p>Provider 예외는 이 클래스 밖으로 전파되지 않습니다.</p>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public final class MultiProviderRouter implements Router, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MultiProviderRouter.class);

    private final List<ProviderConfig> providers;
    private final Map<ProviderId, ProviderConfig> byId;
    private final ProviderHealthMonitor healthMonitor;
    private final CoordinatedRateLimiter rateLimiter;
    private final ProviderClient client;
    private final RouterConfig config;
    private final ErrorClassifier classifier;
    private final BackoffCalculator backoff;
    private final ExecutorService callExecutor;

    private final AtomicInteger roundRobin = new AtomicInteger();
    private final Map<ProviderId, AtomicInteger> inFlight = new ConcurrentHashMap<>();
    private final Map<ProviderId, DoubleAdder> costs = new ConcurrentHashMap<>();
    private final Map<ProviderId, AtomicLong> requestCounts = new ConcurrentHashMap<>();

    public MultiProviderRouter(ProviderHealthMonitor healthMonitor, CoordinatedRateLimiter rateLimiter,
                               ProviderClient client, RouterConfig config) {
        this(healthMonitor, rateLimiter, client, config, new ErrorClassifier(), new BackoffCalculator());
    }

    /**
     * 생성자.
     *
     * <p>Provider 목록은 Health Monitor에 등록된 Provider를 그대로 사용합니다.</p>
     *
     * @param healthMonitor Health Monitor
     * @param rateLimiter Provider ID를 키로 쓰는 조정 Rate Limiter
     * @param client Provider 호출 클라이언트
     * @param config Router 설정
     * @param classifier 실패 분류기
     * @param backoff Provider 내부 재시도 지연 계산기
     */
    public MultiProviderRouter(ProviderHealthMonitor healthMonitor, CoordinatedRateLimiter rateLimiter,
                               ProviderClient client, RouterConfig config,
                               ErrorClassifier classifier, BackoffCalculator backoff) {
        if (healthMonitor == null) {
            throw new IllegalArgumentException("healthMonitor cannot be null");
        }
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
        if (backoff == null) {
            throw new IllegalArgumentException("backoff cannot be null");
        }
        this.healthMonitor = healthMonitor;
        this.rateLimiter = rateLimiter;
        this.client = client;
        this.config = config;
        this.classifier = classifier;
        this.backoff = backoff;
        this.providers = healthMonitor.providers().stream()
            .sorted(Comparator.comparingInt(ProviderConfig::priority))
            .toList();
        Map<ProviderId, ProviderConfig> map = new LinkedHashMap<>();
        for (ProviderConfig provider : providers) {
            map.put(provider.id(), provider);
            inFlight.put(provider.id(), new AtomicInteger());
            costs.put(provider.id(), new DoubleAdder());
            requestCounts.put(provider.id(), new AtomicLong());
        }
        this.byId = map;
        this.callExecutor = Executors.newCachedThreadPool();
    }

    @Override
    public ProviderRequestResult route(ProviderRequest request, int maxRetries, ProviderId startAfter) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative (current: " + maxRetries + ")");
        }

        List<ProviderId> tried = new ArrayList<>();
        int attempts = 0;
        long lastLatency = 0;
        boolean onlyRateLimited = true;
        String lastError = null;

        ProviderConfig provider = select(tried, startAfter);
        while (provider != null) {
            tried.add(provider.id());
            ProviderRequest effective = withDefaultModel(request, provider);

            for (int retry = 0; ; retry++) {
                AdmissionScope admission;
                try {
                    admission = rateLimiter.acquire(provider.id().getValue(), config.admissionTimeoutMs());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return result(Fail.of(ErrorKind.CANCELLED, "Interrupted while waiting for rate limit"),
                        lastLatency, 0.0, attempts, tried);
                }
                if (admission == AdmissionScope.GLOBAL_DENIED) {
                    log.debug("Global rate limit exhausted for request {}", request.requestId());
                    return result(new Retry(ErrorKind.RATE_LIMITED, "Global rate limit exhausted",
                        Math.max(1, attempts), config.admissionTimeoutMs()), lastLatency, 0.0, attempts, tried);
                }
                if (admission == AdmissionScope.KEY_DENIED) {
                    log.debug("Provider {} rate limit exhausted, failing over", provider.id());
                    lastError = "Rate limit exhausted on " + provider.id();
                    break;
                }

                attempts++;
                CallResult call;
                try {
                    call = invoke(provider, effective);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return result(Fail.of(ErrorKind.CANCELLED, "Interrupted while calling " + provider.id()),
                        lastLatency, 0.0, attempts, tried);
                }
                lastLatency = call.latencyMs();

                if (call.response() != null) {
                    healthMonitor.recordSuccess(provider.id(), call.latencyMs());
                    double cost = provider.costModel().cost(call.response().inputTokens(),
                        call.response().outputTokens());
                    costs.get(provider.id()).add(cost);
                    return result(new Ok(provider.id(), call.response()), call.latencyMs(), cost, attempts, tried);
                }

                healthMonitor.recordFailure(provider.id(), call.latencyMs());
                onlyRateLimited = false;
                ErrorKind kind = classifier.classify(call.error());
                lastError = describe(provider.id(), call.error());

                if (!kind.isTransient()) {
                    log.info("Permanent failure from {}: {}, failing over", provider.id(), lastError);
                    break;
                }
                if (retry >= maxRetries) {
                    log.info("Transient failure from {} after {} retries: {}", provider.id(), retry, lastError);
                    return result(new Retry(kind, lastError, attempts, 0L), lastLatency, 0.0, attempts, tried);
                }

                long delay = backoff.calculate(BackoffShape.EXPONENTIAL, config.retryBaseDelayMs(),
                    config.retryMaxDelayMs(), retry + 1);
                log.debug("Transient failure from {} ({}), retrying in {}ms", provider.id(), kind, delay);
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return result(Fail.of(ErrorKind.CANCELLED, "Interrupted during retry backoff"),
                        lastLatency, 0.0, attempts, tried);
                }
            }
            provider = select(tried, null);
        }

        if (tried.isEmpty()) {
            log.warn("No healthy provider available for request {}", request.requestId());
            return result(Fail.of(ErrorKind.ALL_PROVIDERS_FAILED, "No healthy provider available"),
                0L, 0.0, attempts, tried);
        }
        if (onlyRateLimited) {
            return result(new Retry(ErrorKind.RATE_LIMITED, "All providers rate limited",
                Math.max(1, attempts), config.admissionTimeoutMs()), lastLatency, 0.0, attempts, tried);
        }
        log.warn("All providers failed for request {} (tried={})", request.requestId(), tried);
        return result(new Fail(ErrorKind.ALL_PROVIDERS_FAILED, "All providers failed", lastError),
            lastLatency, 0.0, attempts, tried);
    }

    /**
     * Provider별 누적 비용 (성공 호출 기준).
     *
     * @return 우선순위 순서의 Provider별 비용 (USD)
     */
    public Map<ProviderId, Double> costSummary() {
        Map<ProviderId, Double> summary = new LinkedHashMap<>();
        byId.keySet().forEach(id -> summary.put(id, costs.get(id).sum()));
        return summary;
    }

    public double totalCost() {
        return costs.values().stream().mapToDouble(DoubleAdder::sum).sum();
    }

    public int inFlight(ProviderId providerId) {
        AtomicInteger count = inFlight.get(providerId);
        return count == null ? 0 : count.get();
    }

    public long requestCount(ProviderId providerId) {
        AtomicLong count = requestCounts.get(providerId);
        return count == null ? 0L : count.get();
    }

    public List<ProviderConfig> getProviders() {
        return providers;
    }

    /**
     * 호출 스레드 풀 종료. 진행 중 호출은 기다리지 않습니다.
     */
    @Override
    public void close() {
        callExecutor.shutdownNow();
    }

    private ProviderConfig select(List<ProviderId> tried, ProviderId startAfter) {
        List<ProviderConfig> candidates = healthMonitor.selectableProviders().stream()
            .filter(p -> byId.containsKey(p.id()))
            .filter(p -> !tried.contains(p.id()))
            .toList();
        if (candidates.isEmpty()) {
            return null;
        }

        int anchor = startAfter == null ? -1 : indexOf(startAfter);
        if (anchor >= 0) {
            for (int i = 1; i <= providers.size(); i++) {
                ProviderConfig next = providers.get((anchor + i) % providers.size());
                if (candidates.contains(next)) {
                    return next;
                }
            }
        }

        return switch (config.strategy()) {
            case HEALTH_BASED -> candidates.stream()
                .filter(p -> healthMonitor.status(p.id()) == HealthStatus.HEALTHY)
                .findFirst()
                .orElse(candidates.get(0));
            case ROUND_ROBIN -> candidates.get(Math.floorMod(roundRobin.getAndIncrement(), candidates.size()));
            case LEAST_CONNECTIONS -> candidates.stream()
                .min(Comparator.comparingInt(p -> inFlight(p.id())))
                .orElse(candidates.get(0));
        };
    }

    private int indexOf(ProviderId providerId) {
        for (int i = 0; i < providers.size(); i++) {
            if (providers.get(i).id().equals(providerId)) {
                return i;
            }
        }
        return -1;
    }

    private CallResult invoke(ProviderConfig provider, ProviderRequest request) throws InterruptedException {
        ProviderId id = provider.id();
        AtomicInteger counter = inFlight.get(id);
        requestCounts.get(id).incrementAndGet();
        counter.incrementAndGet();

        long start = System.nanoTime();
        Future<ProviderResponse> future;
        try {
            future = callExecutor.submit(() -> {
                try {
                    return client.invoke(id, request);
                } finally {
                    counter.decrementAndGet();
                }
            });
        } catch (RuntimeException e) {
            counter.decrementAndGet();
            return CallResult.failure(e, elapsedMs(start));
        }

        try {
            ProviderResponse response = future.get(request.timeoutMs(), TimeUnit.MILLISECONDS);
            if (response == null) {
                return CallResult.failure(new IllegalStateException("Provider returned no response"),
                    elapsedMs(start));
            }
            return CallResult.success(response, elapsedMs(start));
        } catch (TimeoutException e) {
            return CallResult.failure(new TimeoutException("Call to " + id + " timed out after "
                + request.timeoutMs() + "ms"), elapsedMs(start));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return CallResult.failure(cause, elapsedMs(start));
        }
    }

    private static ProviderRequest withDefaultModel(ProviderRequest request, ProviderConfig provider) {
        if (request.model() != null || provider.model() == null) {
            return request;
        }
        return new ProviderRequest(request.requestId(), request.type(), request.parameters(),
            provider.model(), request.timeoutMs());
    }

    private static ProviderRequestResult result(CallOutcome outcome, long latencyMs, double cost,
                                                int attempts, List<ProviderId> tried) {
        return new ProviderRequestResult(outcome, latencyMs, cost, attempts, tried);
    }

    private static String describe(ProviderId providerId, Throwable error) {
        String message = error.getMessage();
        return providerId + ": " + (message == null ? error.getClass().getSimpleName() : message);
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private record CallResult(ProviderResponse response, Throwable error, long latencyMs) {

        static CallResult success(ProviderResponse response, long latencyMs) {
            return new CallResult(response, null, latencyMs);
        }

        static CallResult failure(Throwable error, long latencyMs) {
            return new CallResult(null, error, latencyMs);
        }
    }
}
