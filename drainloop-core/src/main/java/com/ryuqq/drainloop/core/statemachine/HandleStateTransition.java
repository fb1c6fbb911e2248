package com.ryuqq.drainloop.core.statemachine;

/**
 * Handle 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>CREATED → HELD, CREATED → FINALIZED (한 번도 acquire되지 않은 Handle의 등록 해제)</li>
 *   <li>HELD → DRAINING, HELD → FINALIZED</li>
 *   <li>DRAINING → HELD, DRAINING → FINALIZED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 종료 상태(FINALIZED)에서는 어떤 상태로도 전이 불가.</p>
 *
 * @author Drainloop Team
 * @since 1.0.0
 */
public final class HandleStateTransition {

    private HandleStateTransition() {
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
    public static void validate(HandleState from, HandleState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case CREATED -> to == HandleState.HELD || to == HandleState.FINALIZED;
            case HELD -> to == HandleState.DRAINING || to == HandleState.FINALIZED;
            case DRAINING -> to == HandleState.HELD || to == HandleState.FINALIZED;
            case FINALIZED -> false;
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
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static HandleState transition(HandleState current, HandleState next) {
        validate(current, next);
        return next;
    }

    /**
     * 전이 가능 여부 확인 (예외 없이).
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 전이 가능하면 true
     */
    public static boolean canTransition(HandleState from, HandleState to) {
        try {
            validate(from, to);
            return true;
        } catch (IllegalArgumentException | IllegalStateException e) {
            return false;
        }
    }
}
