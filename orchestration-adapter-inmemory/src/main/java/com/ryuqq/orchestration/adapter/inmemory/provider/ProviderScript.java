package com.ryuqq.orchestration.adapter.inmemory.provider;

import com.ryuqq.orchestration.core.model.ProviderId;
import com.ryuqq.orchestration.core.provider.ProviderRequest;
import com.ryuqq.orchestration.core.provider.ProviderResponse;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Provider 하나의 응답 시나리오.
 *
 * <p>{@code then*} 메서드로 등록한 단계는 호출 순서대로 한 번씩 소비되고,
 * 모두 소비되면 {@code always*}로 지정한 기본 단계가 반복됩니다.
 * 기본 단계를 지정하지 않으면 요청을 그대로 되돌려주는 echo 응답을 사용합니다.
 * {@link #failOnType}으로 지정한 요청 유형은 순차 단계보다 먼저 적용됩니다.</p>
 *
 * <pre>{@code
 * client.script(P1)
 *     .thenFail(ProviderException.status(503, "overloaded"))
 *     .thenRespond(new ProviderResponse("ok", "gpt-4", 100, 50))
 *     .alwaysFail(ProviderException.authentication("revoked"));
 * }</pre>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public final class ProviderScript {

    /**
     * echo 응답의 입력/출력 토큰 수.
     */
    public static final long ECHO_TOKENS = 10L;

    private final ProviderId providerId;
    private final Deque<ScriptedStep> steps = new ArrayDeque<>();
    private final Map<String, RuntimeException> failuresByType = new HashMap<>();
    private ScriptedStep fallback;
    private long latencyMs;

    ProviderScript(ProviderId providerId) {
        this.providerId = providerId;
    }

    public synchronized ProviderScript thenRespond(ProviderResponse response) {
        steps.addLast(ScriptedStep.respond(response));
        return this;
    }

    public synchronized ProviderScript thenFail(RuntimeException failure) {
        steps.addLast(ScriptedStep.fail(failure));
        return this;
    }

    public synchronized ProviderScript then(ScriptedStep step) {
        if (step == null) {
            throw new IllegalArgumentException("step cannot be null");
        }
        steps.addLast(step);
        return this;
    }

    public synchronized ProviderScript alwaysRespond(ProviderResponse response) {
        fallback = ScriptedStep.respond(response);
        return this;
    }

    public synchronized ProviderScript alwaysFail(RuntimeException failure) {
        fallback = ScriptedStep.fail(failure);
        return this;
    }

    /**
     * 특정 요청 유형은 항상 실패하도록 지정.
     *
     * @param type 요청 유형
     * @param failure 던질 예외
     * @return this
     */
    public synchronized ProviderScript failOnType(String type, RuntimeException failure) {
        if (type == null || failure == null) {
            throw new IllegalArgumentException("type and failure cannot be null");
        }
        failuresByType.put(type, failure);
        return this;
    }

    /**
     * 모든 단계에 더해지는 기본 지연 설정.
     *
     * @param latencyMs 지연 (밀리초, 0 이상)
     * @return this
     */
    public synchronized ProviderScript withLatency(long latencyMs) {
        if (latencyMs < 0) {
            throw new IllegalArgumentException("latencyMs must be non-negative (current: " + latencyMs + ")");
        }
        this.latencyMs = latencyMs;
        return this;
    }

    public synchronized int pendingSteps() {
        return steps.size();
    }

    public synchronized void clear() {
        steps.clear();
        failuresByType.clear();
        fallback = null;
        latencyMs = 0L;
    }

    synchronized ScriptedStep next(ProviderRequest request) {
        RuntimeException typeFailure = failuresByType.get(request.type());
        ScriptedStep step = typeFailure != null ? ScriptedStep.fail(typeFailure) : steps.pollFirst();
        if (step == null) {
            step = fallback != null ? fallback : echo(request);
        }
        return latencyMs == 0L ? step : step.withDelayMs(step.delayMs() + latencyMs);
    }

    private ScriptedStep echo(ProviderRequest request) {
        return ScriptedStep.respond(new ProviderResponse(
            providerId.getValue() + ":" + request.requestId(), request.model(), ECHO_TOKENS, ECHO_TOKENS));
    }
}
