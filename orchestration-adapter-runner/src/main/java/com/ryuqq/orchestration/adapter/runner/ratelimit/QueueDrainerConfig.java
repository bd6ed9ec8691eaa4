package com.ryuqq.orchestration.adapter.runner.ratelimit;

/**
 * QueueDrainer 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>type: 대기열 정렬 방식 (기본 PRIORITY)</li>
 *   <li>maxSize: 대기열 최대 크기 (기본 1000)</li>
 *   <li>pollingIntervalMs: 백그라운드 배출 간격 (기본 100ms)</li>
 *   <li>batchSize: 한 번의 pump에서 처리할 최대 요청 수 (기본 10)</li>
 *   <li>maxRetries: 실패 시 재등록 최대 횟수 (기본 3)</li>
 *   <li>admissionTimeoutMs: 요청당 admission 최대 대기 (기본 1000ms)</li>
 * </ul>
 *
 * @param type 대기열 정렬 방식
 * @param maxSize 대기열 최대 크기 (1 이상)
 * @param pollingIntervalMs 배출 간격 (밀리초, 양수)
 * @param batchSize 배치 크기 (1 이상)
 * @param maxRetries 최대 재등록 횟수 (0 이상)
 * @param admissionTimeoutMs admission 최대 대기 (밀리초, 0 이상)
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record QueueDrainerConfig(
    QueueType type,
    int maxSize,
    long pollingIntervalMs,
    int batchSize,
    int maxRetries,
    long admissionTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     */
    public QueueDrainerConfig() {
        this(QueueType.PRIORITY, RequestQueue.DEFAULT_MAX_SIZE, 100, 10, 3, 1000);
    }

    public QueueDrainerConfig {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive (current: " + maxSize + ")");
        }
        if (pollingIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollingIntervalMs must be positive (current: " + pollingIntervalMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative (current: " + maxRetries + ")");
        }
        if (admissionTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "admissionTimeoutMs must be non-negative (current: " + admissionTimeoutMs + ")"
            );
        }
    }

    public QueueDrainerConfig withType(QueueType type) {
        return new QueueDrainerConfig(type, maxSize, pollingIntervalMs, batchSize, maxRetries, admissionTimeoutMs);
    }

    public QueueDrainerConfig withMaxRetries(int maxRetries) {
        return new QueueDrainerConfig(type, maxSize, pollingIntervalMs, batchSize, maxRetries, admissionTimeoutMs);
    }

    public QueueDrainerConfig withBatchSize(int batchSize) {
        return new QueueDrainerConfig(type, maxSize, pollingIntervalMs, batchSize, maxRetries, admissionTimeoutMs);
    }

    public QueueDrainerConfig withAdmissionTimeoutMs(long admissionTimeoutMs) {
        return new QueueDrainerConfig(type, maxSize, pollingIntervalMs, batchSize, maxRetries, admissionTimeoutMs);
    }
}
