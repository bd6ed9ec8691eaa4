package com.ryuqq.orchestration.adapter.runner.ratelimit;

import com.ryuqq.orchestration.core.protection.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 대기열 배출기.
 *
 * <p>Rate Limiter가 허용하는 속도로만 대기열을 비웁니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * pump() 호출
 *   ↓
 * 최대 batchSize개 반복:
 *   1. dequeue → 비어 있으면 종료
 *   2. limiter.tryAcquire(agentKey, admissionTimeoutMs)
 *      - 거부 → 요청을 원래 자리로 되돌리고 이번 pump 종료
 *   3. handler.handle(request)
 *      - 성공 → processed++
 *      - 실패 → retryCount &lt; maxRetries 이면 재등록, 아니면 dead-letter
 * </pre>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public final class QueueDrainer {

    private static final Logger log = LoggerFactory.getLogger(QueueDrainer.class);

    private final RequestQueue queue;
    private final RateLimiter limiter;
    private final QueuedRequestHandler handler;
    private final QueueDrainerConfig config;

    private final List<QueuedRequest> deadLetters = Collections.synchronizedList(new ArrayList<>());
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final Object pumpLock = new Object();

    private ScheduledExecutorService scheduler;

    /**
     * 생성자.
     *
     * @param queue 대기열
     * @param limiter Rate Limiter
     * @param handler 요청 처리기
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public QueueDrainer(RequestQueue queue, RateLimiter limiter, QueuedRequestHandler handler,
                        QueueDrainerConfig config) {
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (limiter == null) {
            throw new IllegalArgumentException("limiter cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.queue = queue;
        this.limiter = limiter;
        this.handler = handler;
        this.config = config;
    }

    /**
     * 요청 등록.
     *
     * @param request 요청
     * @return 등록 성공 여부 (대기열이 가득 찬 경우 false)
     */
    public boolean submit(QueuedRequest request) {
        boolean accepted = queue.enqueue(request);
        if (!accepted) {
            log.warn("Request queue full ({}), rejected {}", queue.getMaxSize(), request.requestId());
        }
        return accepted;
    }

    /**
     * 배출 1회 수행.
     *
     * @return 처리기에 전달된 요청 수
     * @throws InterruptedException admission 대기 중 인터럽트 발생
     */
    public int pump() throws InterruptedException {
        synchronized (pumpLock) {
            int dispatched = 0;
            while (dispatched < config.batchSize()) {
                QueuedRequest request = queue.dequeue();
                if (request == null) {
                    break;
                }
                if (!limiter.tryAcquire(request.agentKey(), config.admissionTimeoutMs())) {
                    queue.pushFront(request);
                    log.debug("Admission denied for {}, request {} re-queued", request.agentKey(), request.requestId());
                    break;
                }
                dispatched++;
                process(request);
            }
            return dispatched;
        }
    }

    /**
     * 대기열이 빌 때까지 반복 배출.
     *
     * @param timeoutMs 최대 대기 시간 (밀리초)
     * @return 제한 시간 내에 비웠으면 true
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    public boolean drain(long timeoutMs) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        while (!queue.isEmpty()) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            if (pump() == 0) {
                TimeUnit.MILLISECONDS.sleep(config.pollingIntervalMs());
            }
        }
        return true;
    }

    /**
     * 백그라운드 배출 시작.
     */
    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor();
        scheduler.scheduleWithFixedDelay(this::pumpSafely, 0, config.pollingIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("Queue drainer started (type={}, pollingIntervalMs={})", queue.getType(), config.pollingIntervalMs());
    }

    /**
     * 백그라운드 배출 종료.
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public synchronized void shutdown() throws InterruptedException {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        if (!scheduler.awaitTermination(60, TimeUnit.SECONDS)) {
            scheduler.shutdownNow();
        }
        scheduler = null;
        log.info("Queue drainer stopped");
    }

    public QueueStats stats() {
        return new QueueStats(queue.size(), processed.get(), failed.get(), deadLetters.size());
    }

    /**
     * 재시도 소진으로 폐기된 요청 목록.
     *
     * @return 폐기 순서대로 정렬된 사본
     */
    public List<QueuedRequest> getDeadLetters() {
        synchronized (deadLetters) {
            return List.copyOf(deadLetters);
        }
    }

    private void process(QueuedRequest request) {
        boolean succeeded;
        try {
            succeeded = handler.handle(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            succeeded = false;
        } catch (Exception e) {
            log.warn("Handler failed for request {}: {}", request.requestId(), e.getMessage());
            succeeded = false;
        }

        if (succeeded) {
            processed.incrementAndGet();
            return;
        }
        failed.incrementAndGet();
        if (request.retryCount() < config.maxRetries() && queue.enqueue(request.nextRetry())) {
            log.debug("Request {} re-queued (retry {})", request.requestId(), request.retryCount() + 1);
        } else {
            deadLetters.add(request);
            log.warn("Request {} dead-lettered after {} retries", request.requestId(), request.retryCount());
        }
    }

    private void pumpSafely() {
        try {
            pump();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("Queue drainer pump failed", e);
        }
    }
}
