package com.ryuqq.orchestration.adapter.inmemory.provider;

import com.ryuqq.orchestration.core.exception.ProviderErrorType;
import com.ryuqq.orchestration.core.exception.ProviderException;
import com.ryuqq.orchestration.core.model.ProviderId;
import com.ryuqq.orchestration.core.provider.ProviderRequest;
import com.ryuqq.orchestration.core.provider.ProviderResponse;
import com.ryuqq.orchestration.core.spi.ProviderClient;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link ProviderClient} SPI for testing and local runs.
 *
 * <p>Provider별 {@link ProviderScript}에 따라 응답, 실패, 지연을 재현하고
 * 모든 호출을 순서대로 기록합니다.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>scripts:</strong> ConcurrentHashMap&lt;ProviderId, ProviderScript&gt; - Provider별 시나리오</li>
 *   <li><strong>invocations:</strong> CopyOnWriteArrayList&lt;Invocation&gt; - 호출 기록 (도착 순서)</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>실제 네트워크 호출 없음</li>
 *   <li>지연은 호출 스레드의 sleep으로 재현</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryProviderClient client = new InMemoryProviderClient();
 * client.script(ProviderId.of("primary")).thenFail(ProviderException.status(503, "busy"));
 *
 * try (OrchestrationRuntime runtime = OrchestrationRuntime.start(config, client)) {
 *     ...
 * }
 * assertThat(client.invocationCount(ProviderId.of("primary"))).isEqualTo(1);
 * </pre>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public class InMemoryProviderClient implements ProviderClient {

    private final ConcurrentHashMap<ProviderId, ProviderScript> scripts = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Invocation> invocations = new CopyOnWriteArrayList<>();

    /**
     * Provider 시나리오 조회 (없으면 echo 시나리오 생성).
     *
     * @param providerId Provider ID
     * @return 시나리오
     */
    public ProviderScript script(ProviderId providerId) {
        if (providerId == null) {
            throw new IllegalArgumentException("providerId cannot be null");
        }
        return scripts.computeIfAbsent(providerId, ProviderScript::new);
    }

    @Override
    public ProviderResponse invoke(ProviderId providerId, ProviderRequest request) {
        if (providerId == null) {
            throw new IllegalArgumentException("providerId cannot be null");
        }
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        invocations.add(new Invocation(providerId, request, System.currentTimeMillis()));

        ScriptedStep step = script(providerId).next(request);
        if (step.delayMs() > 0) {
            try {
                Thread.sleep(step.delayMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProviderException(ProviderErrorType.TIMEOUT, 0,
                    "Interrupted while waiting on " + providerId, e);
            }
        }
        if (step.isFailure()) {
            throw step.failure();
        }
        return step.response();
    }

    /**
     * 전체 호출 기록 (도착 순서).
     *
     * @return 호출 기록 (불변 복사본)
     */
    public List<Invocation> invocations() {
        return List.copyOf(invocations);
    }

    public List<Invocation> invocations(ProviderId providerId) {
        return invocations.stream()
            .filter(invocation -> invocation.providerId().equals(providerId))
            .toList();
    }

    public int invocationCount(ProviderId providerId) {
        return invocations(providerId).size();
    }

    /**
     * 특정 유형을 제외한 호출 수 (예: Health Check 요청 제외).
     *
     * @param providerId Provider ID
     * @param excludedType 제외할 요청 유형
     * @return 호출 수
     */
    public int invocationCount(ProviderId providerId, String excludedType) {
        return (int) invocations(providerId).stream()
            .filter(invocation -> !invocation.request().type().equals(excludedType))
            .count();
    }

    /**
     * 시나리오와 호출 기록 모두 초기화.
     */
    public void reset() {
        scripts.clear();
        invocations.clear();
    }

    /**
     * 호출 기록 한 건.
     *
     * @param providerId 호출 대상
     * @param request 요청
     * @param invokedAtMillis 호출 시각 (epoch millis)
     */
    public record Invocation(ProviderId providerId, ProviderRequest request, long invokedAtMillis) {
    }
}
