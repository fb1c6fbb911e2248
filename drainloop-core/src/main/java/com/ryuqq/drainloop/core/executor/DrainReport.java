package com.ryuqq.drainloop.core.executor;

import java.time.Duration;

/**
 * drain 한 번의 결과 (불변 record).
 *
 * <p>예산 소진으로 태스크가 남는 것은 오류가 아니라 정상적인 결과입니다.
 * {@link #isBacklogged()}로 확인합니다.</p>
 *
 * @param tasksExecuted 이번 drain에서 실행한 태스크 수
 * @param tasksRemaining drain 종료 시점에 큐에 남은 태스크 수
 * @param elapsed drain에 걸린 시간
 * @param liveCount drain 종료 시점의 레지스트리 멤버 수
 * @param pendingChangesRemaining 큐에 남은 PENDING_CHANGES 태스크 수
 * @param releasesExecuted 실행한 태스크 중 release 의무가 있던 태스크 수
 * @param actionFailures action이 예외를 던진 태스크 수
 * @param stop 멈춘 이유
 *
 * @author Drainloop Team
 * @since 1.0.0
 */
public record DrainReport(
    int tasksExecuted,
    int tasksRemaining,
    Duration elapsed,
    int liveCount,
    int pendingChangesRemaining,
    int releasesExecuted,
    int actionFailures,
    DrainStop stop
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 음수 카운트 또는 null 값인 경우
     */
    public DrainReport {
        if (tasksExecuted < 0 || tasksRemaining < 0 || liveCount < 0
            || pendingChangesRemaining < 0 || releasesExecuted < 0 || actionFailures < 0) {
            throw new IllegalArgumentException("counts cannot be negative");
        }
        if (elapsed == null) {
            throw new IllegalArgumentException("elapsed cannot be null");
        }
        if (stop == null) {
            throw new IllegalArgumentException("stop cannot be null");
        }
    }

    /**
     * 아무것도 실행하지 않은 보고서.
     *
     * @param tasksRemaining 큐에 남은 태스크 수
     * @param liveCount 레지스트리 멤버 수
     * @param pendingChangesRemaining 남은 PENDING_CHANGES 수
     * @param stop 멈춘 이유
     * @return DrainReport 인스턴스
     */
    public static DrainReport idle(int tasksRemaining, int liveCount, int pendingChangesRemaining, DrainStop stop) {
        return new DrainReport(0, tasksRemaining, Duration.ZERO, liveCount, pendingChangesRemaining, 0, 0, stop);
    }

    /**
     * 예산이 끝났는데 태스크가 남았는지 여부 (backlog exhaustion).
     *
     * @return tasksRemaining &gt; 0이면 true
     */
    public boolean isBacklogged() {
        return tasksRemaining > 0;
    }

    /**
     * 이어서 실행된 drain 결과와 합칩니다.
     *
     * <p>카운트와 경과 시간은 더하고, 남은 수와 멈춘 이유는 나중 결과를 따릅니다.</p>
     *
     * @param later 이 drain 이후에 실행된 drain 결과
     * @return 합쳐진 보고서
     */
    public DrainReport merge(DrainReport later) {
        if (later == null) {
            throw new IllegalArgumentException("later cannot be null");
        }
        return new DrainReport(
            tasksExecuted + later.tasksExecuted,
            later.tasksRemaining,
            elapsed.plus(later.elapsed),
            later.liveCount,
            later.pendingChangesRemaining,
            releasesExecuted + later.releasesExecuted,
            actionFailures + later.actionFailures,
            later.stop
        );
    }
}
