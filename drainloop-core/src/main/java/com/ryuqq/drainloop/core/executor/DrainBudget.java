package com.ryuqq.drainloop.core.executor;

import java.time.Duration;

/**
 * drain 한 번에 허용되는 시간/실행 횟수 예산 (불변 record).
 *
 * <p>두 예산 중 하나라도 소진되면 drain은 멈추고 남은 태스크를 보고합니다.
 * 예산은 태스크를 꺼내기 전에 검사하므로 {@code (0, 0)}은 아무것도 실행하지 않습니다.</p>
 *
 * @param timeBudget 벽시계 시간 예산 (0 이상)
 * @param opBudget 실행 태스크 수 예산 (0 이상)
 *
 * @author Drainloop Team
 * @since 1.0.0
 */
public record DrainBudget(Duration timeBudget, int opBudget) {

    private static final Duration UNLIMITED_TIME = Duration.ofSeconds(Long.MAX_VALUE);
    private static final DrainBudget UNLIMITED = new DrainBudget(UNLIMITED_TIME, Integer.MAX_VALUE);

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public DrainBudget {
        if (timeBudget == null) {
            throw new IllegalArgumentException("timeBudget cannot be null");
        }
        if (timeBudget.isNegative()) {
            throw new IllegalArgumentException(
                "timeBudget cannot be negative (current: " + timeBudget + ")"
            );
        }
        if (opBudget < 0) {
            throw new IllegalArgumentException(
                "opBudget cannot be negative (current: " + opBudget + ")"
            );
        }
    }

    /**
     * @param timeBudget 시간 예산
     * @param opBudget 실행 횟수 예산
     * @return DrainBudget 인스턴스
     */
    public static DrainBudget of(Duration timeBudget, int opBudget) {
        return new DrainBudget(timeBudget, opBudget);
    }

    /**
     * 큐가 빌 때까지 실행하는 예산.
     *
     * @return 무제한 예산
     */
    public static DrainBudget unlimited() {
        return UNLIMITED;
    }

    /**
     * 시간 예산을 나노초로 변환. {@code long} 범위를 넘으면 {@link Long#MAX_VALUE}.
     *
     * @return 나노초 단위 시간 예산
     */
    public long timeBudgetNanos() {
        try {
            return timeBudget.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    /**
     * timeBudget만 변경한 새 인스턴스 생성.
     */
    public DrainBudget withTimeBudget(Duration timeBudget) {
        return new DrainBudget(timeBudget, opBudget);
    }

    /**
     * opBudget만 변경한 새 인스턴스 생성.
     */
    public DrainBudget withOpBudget(int opBudget) {
        return new DrainBudget(timeBudget, opBudget);
    }
}
