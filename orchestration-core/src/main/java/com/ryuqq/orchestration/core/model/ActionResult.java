package com.ryuqq.orchestration.core.model;

import com.ryuqq.orchestration.core.error.ActionError;
import com.ryuqq.orchestration.core.provider.ProviderResponse;
import com.ryuqq.orchestration.core.statemachine.ActionState;

/**
 * Action 한 번의 시도 결과.
 *
 * <p>재시도된 Action은 시도마다 하나의 ActionResult를 생성하며,
 * 마지막 결과만 권위 있는(authoritative) 결과로 기록됩니다.</p>
 *
 * @param actionId Action ID
 * @param success 성공 여부
 * @param payload 성공 시 응답 (실패 시 null)
 * @param error 실패 시 오류 (성공 시 null)
 * @param latencyMs 측정된 지연 (밀리초)
 * @param providerId 사용된 Provider (전송되지 않았으면 null)
 * @param costUsd 발생 비용 (USD)
 * @param attempt 시도 번호 (1부터, 전송되지 않았으면 0)
 * @param state 이 결과 기록 시점의 상태
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record ActionResult(
    ActionId actionId,
    boolean success,
    ProviderResponse payload,
    ActionError error,
    long latencyMs,
    ProviderId providerId,
    double costUsd,
    int attempt,
    ActionState state
) {

    public ActionResult {
        if (actionId == null) {
            throw new IllegalArgumentException("actionId cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (success && error != null) {
            throw new IllegalArgumentException("successful result cannot carry an error");
        }
        if (!success && error == null) {
            throw new IllegalArgumentException("failed result must carry an error");
        }
        if (latencyMs < 0) {
            throw new IllegalArgumentException("latencyMs must be non-negative (current: " + latencyMs + ")");
        }
    }

    /**
     * 성공 결과 생성.
     */
    public static ActionResult success(ActionId actionId, ProviderResponse payload, long latencyMs,
                                       ProviderId providerId, double costUsd, int attempt) {
        return new ActionResult(actionId, true, payload, null, latencyMs, providerId, costUsd, attempt,
            ActionState.SUCCEEDED);
    }

    /**
     * 전송 후 실패한 시도의 결과 생성.
     *
     * @param state RETRYING(재시도 예정) 또는 FAILED(종료)
     */
    public static ActionResult failure(ActionId actionId, ActionError error, long latencyMs,
                                       ProviderId providerId, int attempt, ActionState state) {
        return new ActionResult(actionId, false, null, error, latencyMs, providerId, 0.0, attempt, state);
    }

    /**
     * 전송되지 않은 Action의 결과 생성 (예산 초과, 건너뜀, 취소).
     */
    public static ActionResult notDispatched(ActionId actionId, ActionError error, ActionState state) {
        return new ActionResult(actionId, false, null, error, 0L, null, 0.0, 0, state);
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }
}
