package com.ryuqq.orchestration.core.statemachine;

/**
 * Action 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → DISPATCHED, FAILED, SKIPPED, CANCELLED</li>
 *   <li>DISPATCHED → SUCCEEDED, FAILED, RETRYING</li>
 *   <li>RETRYING → DISPATCHED, FAILED, CANCELLED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태에서는 어떤 상태로도 전이 불가</li>
 *   <li>한 번 전송된 Action은 SKIPPED가 될 수 없음</li>
 * </ul>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public final class ActionTransition {

    private ActionTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(ActionState from, ActionState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case PENDING -> to == ActionState.DISPATCHED || to == ActionState.FAILED
                || to == ActionState.SKIPPED || to == ActionState.CANCELLED;
            case DISPATCHED -> to == ActionState.SUCCEEDED || to == ActionState.FAILED
                || to == ActionState.RETRYING;
            case RETRYING -> to == ActionState.DISPATCHED || to == ActionState.FAILED
                || to == ActionState.CANCELLED;
            default -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static ActionState transition(ActionState current, ActionState next) {
        validate(current, next);
        return next;
    }
}
