package com.ryuqq.orchestration.application.routing;

import com.ryuqq.orchestration.core.model.ProviderId;
import com.ryuqq.orchestration.core.provider.ProviderRequest;
import com.ryuqq.orchestration.core.provider.ProviderRequestResult;

/**
 * Multi-Provider Router.
 *
 * <p>우선순위와 건강 상태에 따라 Provider를 선택하고, Rate Limit admission을 얻은 뒤
 * 요청을 전송합니다. Provider 예외는 Router 밖으로 전파되지 않습니다.</p>
 *
 * <p><strong>재시도/Failover 규칙:</strong></p>
 * <ul>
 *   <li>transient 실패 (timeout, 429, 502/503, 연결 리셋): 같은 Provider로 maxRetries까지 재시도</li>
 *   <li>permanent 실패 (인증, 잘못된 요청, 기타 4xx) 또는 Provider 소진: 다음 후보로 failover</li>
 *   <li>남은 Provider가 없으면 ALL_PROVIDERS_FAILED</li>
 * </ul>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public interface Router {

    /**
     * 요청 라우팅.
     *
     * @param request Provider 요청
     * @param maxRetries Provider당 transient 재시도 횟수 (0 이상)
     * @return 라우팅 결과
     */
    default ProviderRequestResult route(ProviderRequest request, int maxRetries) {
        return route(request, maxRetries, null);
    }

    /**
     * 특정 Provider 다음 후보부터 라우팅.
     *
     * <p>Coordinator가 transient 실패 후 재전송할 때, 직전 Provider의 다음 후보부터
     * 시도하도록 지정합니다. 우선순위 체인의 끝에 도달하면 처음으로 돌아갑니다.</p>
     *
     * @param request Provider 요청
     * @param maxRetries Provider당 transient 재시도 횟수 (0 이상)
     * @param startAfter 이 Provider의 다음 후보부터 시작 (null이면 전략에 따라 선택)
     * @return 라우팅 결과
     */
    ProviderRequestResult route(ProviderRequest request, int maxRetries, ProviderId startAfter);
}
