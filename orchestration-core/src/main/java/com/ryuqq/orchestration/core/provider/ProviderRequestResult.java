package com.ryuqq.orchestration.core.provider;

import com.ryuqq.orchestration.core.error.ActionError;
import com.ryuqq.orchestration.core.model.ProviderId;
import com.ryuqq.orchestration.core.outcome.CallOutcome;
import com.ryuqq.orchestration.core.outcome.Fail;
import com.ryuqq.orchestration.core.outcome.Ok;
import com.ryuqq.orchestration.core.outcome.Retry;

import java.util.List;

/**
 * Router의 라우팅 결과.
 *
 * <p>Outcome 해석:</p>
 * <ul>
 *   <li>{@link Ok}: 성공. 응답한 Provider와 응답 포함</li>
 *   <li>{@link Retry}: 일시적 실패로 Router 내부 재시도 소진. 호출자가 다른 Provider로 재시도 가능</li>
 *   <li>{@link Fail}: 영구 실패 또는 모든 Provider 실패</li>
 * </ul>
 *
 * @param outcome 최종 Outcome
 * @param latencyMs 마지막 호출의 지연 (밀리초)
 * @param costUsd 발생 비용 (성공 시에만 0보다 큼)
 * @param attempts Router 내부 총 호출 시도 수
 * @param providersTried 시도한 Provider 목록 (시도 순서)
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record ProviderRequestResult(
    CallOutcome outcome,
    long latencyMs,
    double costUsd,
    int attempts,
    List<ProviderId> providersTried
) {

    public ProviderRequestResult {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        providersTried = providersTried == null ? List.of() : List.copyOf(providersTried);
    }

    public boolean isSuccess() {
        return outcome.isOk();
    }

    /**
     * 마지막으로 호출된 Provider.
     *
     * @return 성공 시 응답 Provider, 실패 시 마지막 시도 Provider (시도가 없으면 null)
     */
    public ProviderId lastProvider() {
        if (outcome instanceof Ok ok) {
            return ok.providerId();
        }
        return providersTried.isEmpty() ? null : providersTried.get(providersTried.size() - 1);
    }

    /**
     * 성공 응답 조회.
     *
     * @return 응답 (실패 시 null)
     */
    public ProviderResponse response() {
        return outcome instanceof Ok ok ? ok.response() : null;
    }

    /**
     * 실패 정보를 ActionError로 변환.
     *
     * @return ActionError (성공 시 null)
     */
    public ActionError toError() {
        if (outcome instanceof Retry retry) {
            return ActionError.of(retry.kind(), retry.reason());
        }
        if (outcome instanceof Fail fail) {
            return ActionError.of(fail.kind(), fail.message());
        }
        return null;
    }
}
