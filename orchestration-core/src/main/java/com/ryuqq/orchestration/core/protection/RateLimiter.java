package com.ryuqq.orchestration.core.protection;

/**
 * Rate Limiter SPI.
 *
 * <p>키(Agent 또는 Provider)별 요청 속도를 제한합니다.
 * 토큰 소비는 원자적으로 수행되어야 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Admission admission = limiter.canProceed("provider-1");
 * if (!admission.allowed()) {
 *     Thread.sleep(admission.waitMs());
 * }
 * }</pre>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public interface RateLimiter {

    /**
     * Admission 확인 (비블로킹).
     *
     * <p>허용되면 토큰 하나를 소비합니다. 거부되면 토큰이 생길 때까지의
     * 대기 시간을 함께 반환합니다.</p>
     *
     * @param key Agent 또는 Provider 키
     * @return Admission 결과
     */
    Admission canProceed(String key);

    /**
     * Admission 확인 (타임아웃 대기).
     *
     * <p>거부되면 계산된 대기 시간만큼 잠든 뒤 다시 시도합니다 (busy-poll 하지 않음).</p>
     *
     * @param key Agent 또는 Provider 키
     * @param timeoutMs 최대 대기 시간 (밀리초)
     * @return true: 허용, false: 타임아웃
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    boolean tryAcquire(String key, long timeoutMs) throws InterruptedException;

    /**
     * 소비한 토큰 반환.
     *
     * <p>복합 admission에서 후속 버킷이 거부한 경우 앞서 소비한 토큰을 돌려줍니다.</p>
     *
     * @param key Agent 또는 Provider 키
     */
    void refund(String key);

    /**
     * 키에 적용되는 설정 조회.
     *
     * @param key Agent 또는 Provider 키
     * @return Rate Limiter 설정
     */
    RateLimiterConfig getConfig(String key);
}
