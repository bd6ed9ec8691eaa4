package com.ryuqq.orchestration.core.outcome;

import com.ryuqq.orchestration.core.model.ProviderId;
import com.ryuqq.orchestration.core.provider.ProviderResponse;

/**
 * 성공적인 Provider 응답.
 *
 * @param providerId 응답한 Provider
 * @param response 응답
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record Ok(ProviderId providerId, ProviderResponse response) implements CallOutcome {

    public Ok {
        if (providerId == null) {
            throw new IllegalArgumentException("providerId cannot be null");
        }
        if (response == null) {
            throw new IllegalArgumentException("response cannot be null");
        }
    }
}
