package com.ryuqq.orchestration.adapter.runner.routing;

import com.ryuqq.orchestration.adapter.runner.BackoffCalculator;
import com.ryuqq.orchestration.adapter.runner.health.ProviderHealthMonitor;
import com.ryuqq.orchestration.adapter.runner.ratelimit.CoordinatedRateLimiter;
import com.ryuqq.orchestration.adapter.runner.ratelimit.TokenBucketRateLimiter;
import com.ryuqq.orchestration.core.error.ErrorKind;
import com.ryuqq.orchestration.core.exception.ProviderException;
import com.ryuqq.orchestration.core.model.ProviderId;
import com.ryuqq.orchestration.core.outcome.Fail;
import com.ryuqq.orchestration.core.outcome.Retry;
import com.ryuqq.orchestration.core.protection.RateLimiterConfig;
import com.ryuqq.orchestration.core.provider.CostModel;
import com.ryuqq.orchestration.core.provider.HealthStatus;
import com.ryuqq.orchestration.core.provider.ProviderConfig;
import com.ryuqq.orchestration.core.provider.ProviderRequest;
import com.ryuqq.orchestration.core.provider.ProviderRequestResult;
import com.ryuqq.orchestration.core.provider.ProviderResponse;
import com.ryuqq.orchestration.core.spi.ProviderClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * MultiProviderRouter 유닛 테스트.
 *
 * <p>Provider 클라이언트는 Mock으로 대체하고, 재시도 지연은 0으로 설정합니다.</p>
 */
@ExtendWith(MockitoExtension.class)
class MultiProviderRouterTest {

    private static final ProviderId P1 = ProviderId.of("provider-1");
    private static final ProviderId P2 = ProviderId.of("provider-2");
    private static final ProviderId P3 = ProviderId.of("provider-3");

    @Mock
    private ProviderClient client;

    private ProviderHealthMonitor monitor;
    private MultiProviderRouter router;

    @AfterEach
    void tearDown() {
        if (router != null) {
            router.close();
        }
    }

    private void createRouter(RateLimiterConfig p1Limit, RateLimiterConfig globalLimit) {
        List<ProviderConfig> providers = List.of(
            ProviderConfig.of("provider-1", 0)
                .withRateLimit(p1Limit)
                .withCostModel(new CostModel(0.03, 0.06)),
            ProviderConfig.of("provider-2", 1)
                .withRateLimit(new RateLimiterConfig(100.0, 100))
        );
        TokenBucketRateLimiter keyLimiter = new TokenBucketRateLimiter(new RateLimiterConfig(100.0, 100));
        providers.forEach(p -> keyLimiter.register(p.id().getValue(), p.rateLimit()));
        CoordinatedRateLimiter limiter = new CoordinatedRateLimiter(keyLimiter, new TokenBucketRateLimiter(globalLimit));
        monitor = new ProviderHealthMonitor(providers);
        RouterConfig config = new RouterConfig(LoadBalancingStrategy.HEALTH_BASED, 0, 0, 0);
        router = new MultiProviderRouter(monitor, limiter, client, config, new ErrorClassifier(),
            new BackoffCalculator(0.0));
    }

    private void createRouter() {
        createRouter(new RateLimiterConfig(100.0, 100), new RateLimiterConfig(100.0, 100));
    }

    private void createRouter(LoadBalancingStrategy strategy) {
        List<ProviderConfig> providers = List.of(
            ProviderConfig.of("provider-1", 0),
            ProviderConfig.of("provider-2", 1),
            ProviderConfig.of("provider-3", 2)
        );
        TokenBucketRateLimiter keyLimiter = new TokenBucketRateLimiter(new RateLimiterConfig(100.0, 100));
        CoordinatedRateLimiter limiter = new CoordinatedRateLimiter(keyLimiter,
            new TokenBucketRateLimiter(new RateLimiterConfig(100.0, 100)));
        monitor = new ProviderHealthMonitor(providers);
        router = new MultiProviderRouter(monitor, limiter, client, new RouterConfig(strategy, 1_000, 0, 0),
            new ErrorClassifier(), new BackoffCalculator(0.0));
    }

    private static ProviderRequest request(long timeoutMs) {
        return new ProviderRequest("req-1", "llm.chat", Map.of("prompt", "hi"), "gpt-4", timeoutMs);
    }

    private static ProviderRequest request() {
        return request(1_000);
    }

    @Test
    void 가장_높은_우선순위의_HEALTHY_Provider로_전송() {
        // given
        createRouter();
        when(client.invoke(eq(P1), any())).thenReturn(new ProviderResponse("ok", "gpt-4", 1000, 500));

        // when
        ProviderRequestResult result = router.route(request(), 2);

        // then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.lastProvider()).isEqualTo(P1);
        assertThat(result.providersTried()).containsExactly(P1);
        assertThat(result.costUsd()).isCloseTo(0.06, within(1e-9));
        assertThat(router.costSummary().get(P1)).isCloseTo(0.06, within(1e-9));
        assertThat(router.requestCount(P1)).isEqualTo(1);
        assertThat(monitor.metrics(P1).totalRequests()).isEqualTo(1);
    }

    @Test
    void permanent_실패는_다음_Provider로_failover() {
        // given
        createRouter();
        when(client.invoke(eq(P1), any())).thenThrow(ProviderException.authentication("invalid api key"));
        when(client.invoke(eq(P2), any())).thenReturn(ProviderResponse.of("fallback"));

        // when
        ProviderRequestResult result = router.route(request(), 2);

        // then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.lastProvider()).isEqualTo(P2);
        assertThat(result.providersTried()).containsExactly(P1, P2);
        assertThat(result.attempts()).isEqualTo(2);
        verify(client, times(1)).invoke(eq(P1), any());
        assertThat(monitor.metrics(P1).totalErrors()).isEqualTo(1);
    }

    @Test
    void UNHEALTHY_Provider는_선택되지_않음() {
        // given
        createRouter();
        monitor.override(P1, HealthStatus.UNHEALTHY);
        when(client.invoke(eq(P2), any())).thenReturn(ProviderResponse.of("ok"));

        // when
        ProviderRequestResult result = router.route(request(), 2);

        // then
        assertThat(result.lastProvider()).isEqualTo(P2);
        verify(client, never()).invoke(eq(P1), any());
    }

    @Test
    void DEGRADED_Provider는_HEALTHY_Provider가_없을_때만_선택() {
        // given
        createRouter();
        monitor.override(P1, HealthStatus.DEGRADED);
        when(client.invoke(eq(P2), any())).thenReturn(ProviderResponse.of("ok"));

        // when
        ProviderRequestResult result = router.route(request(), 0);

        // then
        assertThat(result.lastProvider()).isEqualTo(P2);
    }

    @Test
    void transient_실패는_같은_Provider로_maxRetries까지_재시도_후_Retry_반환() {
        // given
        createRouter();
        when(client.invoke(eq(P1), any())).thenThrow(ProviderException.status(503, "unavailable"));

        // when
        ProviderRequestResult result = router.route(request(), 2);

        // then
        assertThat(result.outcome()).isInstanceOf(Retry.class);
        assertThat(((Retry) result.outcome()).kind()).isEqualTo(ErrorKind.TRANSIENT_PROVIDER_ERROR);
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(result.providersTried()).containsExactly(P1);
        verify(client, never()).invoke(eq(P2), any());
    }

    @Test
    void transient_실패_후_재시도가_성공하면_Ok() {
        // given
        createRouter();
        when(client.invoke(eq(P1), any()))
            .thenThrow(ProviderException.status(429, "slow down"))
            .thenReturn(ProviderResponse.of("ok"));

        // when
        ProviderRequestResult result = router.route(request(), 2);

        // then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.attempts()).isEqualTo(2);
    }

    @Test
    void 응답이_타임아웃을_넘으면_TIMEOUT으로_분류() {
        // given
        createRouter();
        doAnswer(invocation -> {
            Thread.sleep(500);
            return ProviderResponse.of("late");
        }).when(client).invoke(eq(P1), any());

        // when
        ProviderRequestResult result = router.route(request(50), 0);

        // then
        assertThat(result.outcome()).isInstanceOf(Retry.class);
        assertThat(((Retry) result.outcome()).kind()).isEqualTo(ErrorKind.TIMEOUT);
        assertThat(result.latencyMs()).isLessThan(500);
        assertThat(monitor.metrics(P1).totalErrors()).isEqualTo(1);
    }

    @Test
    void 모든_Provider가_permanent_실패하면_ALL_PROVIDERS_FAILED() {
        // given
        createRouter();
        when(client.invoke(any(), any())).thenThrow(ProviderException.malformed("bad request"));

        // when
        ProviderRequestResult result = router.route(request(), 2);

        // then
        assertThat(result.outcome()).isInstanceOf(Fail.class);
        assertThat(((Fail) result.outcome()).kind()).isEqualTo(ErrorKind.ALL_PROVIDERS_FAILED);
        assertThat(result.providersTried()).containsExactly(P1, P2);
    }

    @Test
    void 선택_가능한_Provider가_없으면_호출_없이_실패() {
        // given
        createRouter();
        monitor.override(P1, HealthStatus.UNHEALTHY);
        monitor.override(P2, HealthStatus.UNHEALTHY);

        // when
        ProviderRequestResult result = router.route(request(), 2);

        // then
        assertThat(result.outcome()).isInstanceOf(Fail.class);
        assertThat(((Fail) result.outcome()).message()).isEqualTo("No healthy provider available");
        assertThat(result.attempts()).isZero();
        verify(client, never()).invoke(any(), any());
    }

    @Test
    void Provider_Rate_Limit_소진_시_다음_Provider로_failover() {
        // given
        createRouter(new RateLimiterConfig(0.001, 1), new RateLimiterConfig(100.0, 100));
        when(client.invoke(eq(P1), any())).thenReturn(ProviderResponse.of("first"));
        when(client.invoke(eq(P2), any())).thenReturn(ProviderResponse.of("second"));
        router.route(request(), 0);

        // when
        ProviderRequestResult result = router.route(request(), 0);

        // then
        assertThat(result.lastProvider()).isEqualTo(P2);
        assertThat(result.providersTried()).containsExactly(P1, P2);
    }

    @Test
    void 전역_Rate_Limit_소진_시_RATE_LIMITED_Retry() {
        // given
        createRouter(new RateLimiterConfig(100.0, 100), new RateLimiterConfig(0.001, 1));
        when(client.invoke(eq(P1), any())).thenReturn(ProviderResponse.of("first"));
        router.route(request(), 0);

        // when
        ProviderRequestResult result = router.route(request(), 0);

        // then
        assertThat(result.outcome()).isInstanceOf(Retry.class);
        assertThat(((Retry) result.outcome()).kind()).isEqualTo(ErrorKind.RATE_LIMITED);
        verify(client, times(1)).invoke(any(), any());
    }

    @Test
    void startAfter가_지정되면_다음_후보부터_시작() {
        // given
        createRouter();
        when(client.invoke(eq(P2), any())).thenReturn(ProviderResponse.of("ok"));

        // when
        ProviderRequestResult result = router.route(request(), 0, P1);

        // then
        assertThat(result.lastProvider()).isEqualTo(P2);
        verify(client, never()).invoke(eq(P1), any());
    }

    @Test
    void 요청에_모델이_없으면_Provider_기본_모델을_사용() {
        // given
        List<ProviderConfig> providers = List.of(ProviderConfig.of("provider-1", 0).withModel("claude-haiku"));
        CoordinatedRateLimiter limiter = new CoordinatedRateLimiter(
            new TokenBucketRateLimiter(new RateLimiterConfig()), new TokenBucketRateLimiter(new RateLimiterConfig()));
        router = new MultiProviderRouter(new ProviderHealthMonitor(providers), limiter, client, new RouterConfig());
        when(client.invoke(eq(P1), any())).thenReturn(ProviderResponse.of("ok"));

        // when
        router.route(new ProviderRequest("req-2", "llm.chat", Map.of(), null, 1_000), 0);

        // then
        verify(client).invoke(eq(P1), argThat(r -> "claude-haiku".equals(r.model())));
    }

    @Test
    void ROUND_ROBIN은_선택_가능한_Provider를_순환() {
        // given
        createRouter(LoadBalancingStrategy.ROUND_ROBIN);
        when(client.invoke(any(), any())).thenReturn(ProviderResponse.of("ok"));

        // when
        List<ProviderId> served = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            served.add(router.route(request(), 0).lastProvider());
        }

        // then
        assertThat(served).containsExactly(P1, P2, P3, P1, P2, P3);
    }

    @Test
    void ROUND_ROBIN은_UNHEALTHY_Provider를_건너뜀() {
        // given
        createRouter(LoadBalancingStrategy.ROUND_ROBIN);
        monitor.override(P2, HealthStatus.UNHEALTHY);
        when(client.invoke(any(), any())).thenReturn(ProviderResponse.of("ok"));

        // when
        List<ProviderId> served = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            served.add(router.route(request(), 0).lastProvider());
        }

        // then
        assertThat(served).containsExactly(P1, P3, P1, P3);
        verify(client, never()).invoke(eq(P2), any());
    }

    @Test
    void LEAST_CONNECTIONS는_진행_중_호출이_가장_적은_Provider를_선택() throws Exception {
        // given: provider-1 호출은 해제될 때까지 대기
        createRouter(LoadBalancingStrategy.LEAST_CONNECTIONS);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return ProviderResponse.of("slow");
        }).when(client).invoke(eq(P1), any());
        when(client.invoke(eq(P2), any())).thenReturn(ProviderResponse.of("fast"));

        CompletableFuture<ProviderRequestResult> first =
            CompletableFuture.supplyAsync(() -> router.route(request(5_000), 0));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(router.inFlight(P1)).isEqualTo(1);

        // when
        ProviderRequestResult second = router.route(request(), 0);
        release.countDown();

        // then
        assertThat(second.lastProvider()).isEqualTo(P2);
        assertThat(first.get(5, TimeUnit.SECONDS).lastProvider()).isEqualTo(P1);
        assertThat(router.inFlight(P2)).isZero();
    }
}
