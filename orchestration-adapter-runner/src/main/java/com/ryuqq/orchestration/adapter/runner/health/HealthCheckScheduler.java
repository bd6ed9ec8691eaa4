package com.ryuqq.orchestration.adapter.runner.health;

import com.ryuqq.orchestration.core.model.ProviderId;
import com.ryuqq.orchestration.core.provider.HealthStatus;
import com.ryuqq.orchestration.core.provider.ProviderConfig;
import com.ryuqq.orchestration.core.spi.ProviderClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 주기적 Health Check 실행기.
 *
 * <p>트래픽과 독립적으로 각 Provider에 경량 합성 요청을 보내고, 결과를
 * {@link ProviderHealthMonitor}에 기록한 뒤 전체 상태를 재평가합니다.
 * 트래픽이 없는 장애 Provider도 결국 UNHEALTHY로 감지됩니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * runChecks()
 *   for each provider:
 *     probeEnabled → client.ping(id) (probeTimeoutMs 내 대기) → recordSuccess / recordFailure
 *   monitor.evaluateAll()
 * </pre>
 *
 * <p>ping은 별도 probe 스레드에서 실행됩니다. 응답하지 않는 Provider는
 * probeTimeoutMs 후 실패로 기록되며 다음 Provider 점검을 막지 않습니다.</p>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public final class HealthCheckScheduler {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckScheduler.class);

    private final ProviderHealthMonitor monitor;
    private final ProviderClient client;
    private final HealthCheckConfig config;
    private final ExecutorService probeExecutor;

    private ScheduledExecutorService scheduler;

    /**
     * 생성자.
     *
     * @param monitor Health Monitor
     * @param client 합성 요청을 보낼 Provider 클라이언트
     * @param config 설정
     */
    public HealthCheckScheduler(ProviderHealthMonitor monitor, ProviderClient client, HealthCheckConfig config) {
        if (monitor == null) {
            throw new IllegalArgumentException("monitor cannot be null");
        }
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.monitor = monitor;
        this.client = client;
        this.config = config;
        this.probeExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "health-probe");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * 주기 실행 시작.
     */
    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor();
        scheduler.scheduleAtFixedRate(this::runChecksSafely, config.initialDelayMs(), config.intervalMs(),
            TimeUnit.MILLISECONDS);
        log.info("Health check scheduler started (intervalMs={}, probeEnabled={})",
            config.intervalMs(), config.probeEnabled());
    }

    /**
     * 주기 실행 종료.
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public synchronized void shutdown() throws InterruptedException {
        probeExecutor.shutdownNow();
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        if (!scheduler.awaitTermination(60, TimeUnit.SECONDS)) {
            scheduler.shutdownNow();
        }
        scheduler = null;
        log.info("Health check scheduler stopped");
    }

    /**
     * 전체 Provider 점검 1회 수행.
     */
    public void runChecks() {
        if (config.probeEnabled()) {
            for (ProviderConfig provider : monitor.providers()) {
                checkProvider(provider.id());
            }
        }
        monitor.evaluateAll();
    }

    /**
     * Provider 하나에 합성 요청을 보내고 결과 기록.
     *
     * @param providerId Provider ID
     * @return 기록 후 상태
     */
    public HealthStatus checkProvider(ProviderId providerId) {
        long start = System.nanoTime();
        Future<?> future;
        try {
            future = probeExecutor.submit(() -> client.ping(providerId));
        } catch (RejectedExecutionException e) {
            log.debug("Health probe skipped for {}: scheduler is shut down", providerId);
            return monitor.status(providerId);
        }

        try {
            future.get(config.probeTimeoutMs(), TimeUnit.MILLISECONDS);
            monitor.recordSuccess(providerId, elapsedMs(start));
        } catch (TimeoutException e) {
            future.cancel(true);
            monitor.recordFailure(providerId, elapsedMs(start));
            log.warn("Health probe timed out for {} after {}ms", providerId, config.probeTimeoutMs());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            monitor.recordFailure(providerId, elapsedMs(start));
            log.warn("Health probe failed for {}: {}", providerId, cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.debug("Health probe interrupted for {}", providerId);
        }
        return monitor.status(providerId);
    }

    private void runChecksSafely() {
        try {
            runChecks();
        } catch (RuntimeException e) {
            log.error("Health check cycle failed", e);
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
