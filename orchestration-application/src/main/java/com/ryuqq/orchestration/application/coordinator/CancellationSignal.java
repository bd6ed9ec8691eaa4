package com.ryuqq.orchestration.application.coordinator;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 배치 단위 취소 신호.
 *
 * <p>취소되면 Coordinator는 새로운 Action 전송을 즉시 멈춥니다.
 * 이미 진행 중인 Provider 호출은 강제로 중단하지 않고 완료 또는 타임아웃까지 기다립니다.</p>
 *
 * <p>Thread-safe 합니다.</p>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * 취소 요청.
     *
     * @return 이번 호출로 처음 취소된 경우 true
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public String toString() {
        return "CancellationSignal{cancelled=" + cancelled.get() + "}";
    }
}
