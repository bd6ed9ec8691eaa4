package com.ryuqq.orchestration.core.protection;

/**
 * Admission 판정 결과.
 *
 * @param allowed 허용 여부
 * @param waitMs 거부된 경우 재시도 전 대기 시간 (밀리초, 허용 시 0)
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record Admission(boolean allowed, long waitMs) {

    private static final Admission GRANTED = new Admission(true, 0L);

    public Admission {
        if (waitMs < 0) {
            throw new IllegalArgumentException("waitMs must be non-negative (current: " + waitMs + ")");
        }
    }

    public static Admission granted() {
        return GRANTED;
    }

    public static Admission denied(long waitMs) {
        return new Admission(false, Math.max(1L, waitMs));
    }
}
