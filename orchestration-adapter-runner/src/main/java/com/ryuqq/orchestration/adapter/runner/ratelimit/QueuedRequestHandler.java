package com.ryuqq.orchestration.adapter.runner.ratelimit;

import com.ryuqq.orchestration.application.routing.Router;

/**
 * 대기열에서 꺼낸 요청의 처리기.
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface QueuedRequestHandler {

    /**
     * 요청 처리.
     *
     * @param request 요청
     * @return 성공 여부 (false면 재등록 대상)
     * @throws Exception 처리 실패 (재등록 대상)
     */
    boolean handle(QueuedRequest request) throws Exception;

    /**
     * Router로 요청을 전송하는 처리기.
     *
     * @param router Router
     * @param maxRetries Provider당 transient 재시도 횟수
     * @return 처리기
     */
    static QueuedRequestHandler routing(Router router, int maxRetries) {
        if (router == null) {
            throw new IllegalArgumentException("router cannot be null");
        }
        return queued -> router.route(queued.request(), maxRetries).isSuccess();
    }
}
