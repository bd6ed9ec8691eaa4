package com.ryuqq.orchestration.core.spi;

import com.ryuqq.orchestration.core.exception.ProviderException;
import com.ryuqq.orchestration.core.model.ProviderId;
import com.ryuqq.orchestration.core.provider.ProviderRequest;
import com.ryuqq.orchestration.core.provider.ProviderResponse;

import java.util.Map;

/**
 * Provider 호출 SPI.
 *
 * <p>전송 계층(HTTP 클라이언트, SDK 등)을 감싸는 어댑터가 구현합니다.
 * 요청/응답의 wire 형식은 구현체의 책임이며, Orchestration은 해석하지 않습니다.</p>
 *
 * <p><strong>구현 규칙:</strong></p>
 * <ul>
 *   <li>실패는 {@link ProviderException}으로 보고 (상태 코드와 유형 포함)</li>
 *   <li>여러 스레드에서 동시에 호출될 수 있음 (thread-safe 필수)</li>
 *   <li>타임아웃은 Router(invoke)와 HealthCheckScheduler(ping)가 강제하므로 구현체가 별도로 처리하지 않아도 됨</li>
 * </ul>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public interface ProviderClient {

    /**
     * Provider 호출.
     *
     * @param providerId 호출 대상 Provider
     * @param request 요청
     * @return 응답 (null 불가)
     * @throws ProviderException Provider 호출 실패 시
     */
    ProviderResponse invoke(ProviderId providerId, ProviderRequest request);

    /**
     * 경량 합성 요청으로 Provider 상태 확인.
     *
     * <p>주기적 Health Check에서 사용합니다. 기본 구현은 "health-check" 유형의
     * 요청을 {@link #invoke}로 전송합니다.</p>
     *
     * @param providerId 확인 대상 Provider
     * @throws ProviderException Provider가 응답하지 않는 경우
     */
    default void ping(ProviderId providerId) {
        invoke(providerId, new ProviderRequest("ping-" + providerId.getValue(), "health-check",
            Map.of(), null, 5_000L));
    }
}
