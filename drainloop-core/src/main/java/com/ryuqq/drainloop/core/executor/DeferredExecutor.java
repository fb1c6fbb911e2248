package com.ryuqq.drainloop.core.executor;

import com.ryuqq.drainloop.core.model.Handle;
import com.ryuqq.drainloop.core.registry.HandleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.LongSupplier;

/**
 * 단일 스레드 협조형 작업 큐 (deferred release executor).
 *
 * <p>acquire는 Handle의 보유 카운트를 즉시 올리고, 그 보유를 풀어줄 release는
 * 큐에 넣어 둡니다. 큐는 {@link #drain(DrainBudget)}이 호출될 때만 비워지므로,
 * drain 없이 acquire가 계속되면 Handle과 태스크가 함께 쌓입니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * acquire(handle, action)
 *   1. registry.register(handle)
 *   2. handle.retain()            → holdCount + 1 (즉시)
 *   3. queue.add(ACQUIRED_ACTION) → action은 아직 실행 안 됨
 *
 * noteStateChange(handle)
 *   1. queue.add(PENDING_CHANGES)
 *   2. pendingChangesCount + 1
 *
 * drain(budget)
 *   while (큐가 비지 않음 AND 예산 남음):
 *     task = queue.poll()
 *     ACQUIRED_ACTION → action 실행 → handle.release() → holdCount == 0이면 registry.unregister()
 *     PENDING_CHANGES → action 실행 → pendingChangesCount - 1
 * </pre>
 *
 * <p><strong>보장:</strong></p>
 * <ul>
 *   <li>엄격한 FIFO: 예산이 부족해도 건너뛰거나 재정렬하지 않음 (부분 drain은 앞쪽 prefix만 실행)</li>
 *   <li>꺼낸 태스크는 항상 끝까지 실행</li>
 *   <li>drain은 예외를 던지지 않음. action 예외는 로그 후 집계되고 release는 그대로 수행</li>
 *   <li>pendingChangesCount는 drain에서만 감소</li>
 * </ul>
 *
 * <p><strong>스레드 안전성:</strong> 없음. 여러 스레드에서 쓰려면 모든 진입점을
 * 하나의 전용 스레드로 직렬화해야 합니다 ({@code SerialDrainLoop}).</p>
 *
 * @author Drainloop Team
 * @since 1.0.0
 */
public final class DeferredExecutor {

    private static final Logger log = LoggerFactory.getLogger(DeferredExecutor.class);

    private final HandleRegistry registry;
    private final LongSupplier nanoClock;
    private final Deque<Task> queue = new ArrayDeque<>();

    private long nextSequence;
    private int pendingChangesCount;
    private boolean draining;

    /**
     * 생성자 (시스템 시계 사용).
     *
     * @param registry Handle 레지스트리
     * @throws IllegalArgumentException registry가 null인 경우
     */
    public DeferredExecutor(HandleRegistry registry) {
        this(registry, System::nanoTime);
    }

    /**
     * 생성자 (커스텀 시계 주입).
     *
     * @param registry Handle 레지스트리
     * @param nanoClock 나노초 단위 단조 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DeferredExecutor(HandleRegistry registry, LongSupplier nanoClock) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (nanoClock == null) {
            throw new IllegalArgumentException("nanoClock cannot be null");
        }
        this.registry = registry;
        this.nanoClock = nanoClock;
    }

    /**
     * Handle을 보유하고 action과 release를 큐에 넣습니다.
     *
     * <p>holdCount 증가는 즉시 일어나고, action과 감소는 drain까지 지연됩니다.</p>
     *
     * @param handle 대상 Handle (처음 보는 Handle이면 레지스트리에 등록)
     * @param action drain 때 실행할 작업
     * @throws IllegalArgumentException handle 또는 action이 null인 경우
     * @throws IllegalStateException handle이 이미 FINALIZED이거나, 같은 식별자의 다른 Handle이 등록된 경우
     */
    public void acquire(Handle handle, Runnable action) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (handle.isFinalized()) {
            throw new IllegalStateException("Cannot acquire finalized handle: " + handle.getId());
        }

        log.trace("about to be retained: {}", handle.getLabel());
        registry.register(handle);
        int holds = handle.retain();
        enqueue(TaskKind.ACQUIRED_ACTION, handle, action);
        log.trace("hold count went up: {} (holdCount={}, backlog={})", handle.getLabel(), holds, queue.size());
    }

    /**
     * Handle 외부에서 변경/저장이 일어났음을 알립니다.
     *
     * <p>PENDING_CHANGES 태스크를 하나 추가합니다. holdCount는 바뀌지 않습니다.</p>
     *
     * @param handle 변경된 Handle
     * @throws IllegalArgumentException handle이 null인 경우
     */
    public void noteStateChange(Handle handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        noteStateChange(handle, () -> log.debug("{} processed pending changes", handle.getLabel()));
    }

    /**
     * PENDING_CHANGES 태스크를 커스텀 본문과 함께 추가합니다.
     *
     * @param handle 변경된 Handle
     * @param onProcess drain 때 실행할 "process pending changes" 본문
     * @throws IllegalArgumentException handle 또는 onProcess가 null인 경우
     */
    public void noteStateChange(Handle handle, Runnable onProcess) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        if (onProcess == null) {
            throw new IllegalArgumentException("onProcess cannot be null");
        }
        enqueue(TaskKind.PENDING_CHANGES, handle, onProcess);
        pendingChangesCount++;
    }

    /**
     * 시간/횟수 예산 안에서 큐를 비웁니다.
     *
     * @param timeBudget 시간 예산
     * @param opBudget 실행 태스크 수 예산
     * @return drain 결과
     * @throws IllegalArgumentException 예산이 음수이거나 null인 경우
     */
    public DrainReport drain(Duration timeBudget, int opBudget) {
        return drain(DrainBudget.of(timeBudget, opBudget));
    }

    /**
     * 시간/횟수 예산 안에서 큐를 비웁니다.
     *
     * <p>예산은 태스크를 꺼내기 전에 검사합니다. 예산이 끝나 태스크가 남는 것은
     * 오류가 아니며 {@link DrainReport#isBacklogged()}로 보고됩니다.</p>
     *
     * @param budget drain 예산
     * @return drain 결과
     * @throws IllegalArgumentException budget이 null인 경우
     */
    public DrainReport drain(DrainBudget budget) {
        if (budget == null) {
            throw new IllegalArgumentException("budget cannot be null");
        }
        if (draining) {
            log.warn("drain called from inside a running task, ignoring (backlog={})", queue.size());
            return DrainReport.idle(queue.size(), registry.count(), pendingChangesCount, DrainStop.REENTRANT);
        }

        long timeBudgetNanos = budget.timeBudgetNanos();
        int opBudget = budget.opBudget();
        long startNanos = nanoClock.getAsLong();

        int executed = 0;
        int releases = 0;
        int failures = 0;
        DrainStop stop;

        draining = true;
        try {
            while (true) {
                if (queue.isEmpty()) {
                    stop = DrainStop.QUEUE_EMPTY;
                    break;
                }
                if (executed >= opBudget) {
                    stop = DrainStop.OP_BUDGET;
                    break;
                }
                if (nanoClock.getAsLong() - startNanos >= timeBudgetNanos) {
                    stop = DrainStop.TIME_BUDGET;
                    break;
                }

                Task task = queue.poll();
                if (!runTask(task)) {
                    failures++;
                }
                if (task.kind().carriesRelease()) {
                    releases++;
                }
                executed++;
            }
        } finally {
            draining = false;
        }

        Duration elapsed = Duration.ofNanos(Math.max(0L, nanoClock.getAsLong() - startNanos));
        DrainReport report = new DrainReport(
            executed, queue.size(), elapsed, registry.count(), pendingChangesCount, releases, failures, stop
        );
        logReport(report);
        return report;
    }

    /**
     * 큐에 남은 태스크 수.
     *
     * @return backlog 크기
     */
    public int backlog() {
        return queue.size();
    }

    /**
     * 큐에 남은 PENDING_CHANGES 태스크 수.
     *
     * @return pendingChangesCount
     */
    public int pendingChangesCount() {
        return pendingChangesCount;
    }

    /**
     * 레지스트리 멤버 수.
     *
     * @return live handle 수
     */
    public int liveCount() {
        return registry.count();
    }

    public HandleRegistry registry() {
        return registry;
    }

    private void enqueue(TaskKind kind, Handle handle, Runnable action) {
        queue.add(new Task(nextSequence++, kind, handle, action));
    }

    /**
     * 태스크 하나 실행. action 예외는 로그로 남기고, release와 카운터 감소는 finally에서 항상 수행합니다.
     *
     * <p>{@link Error}는 잡지 않고 전파되지만, 그 전에 bookkeeping은 끝납니다.</p>
     *
     * @return action과 release가 모두 예외 없이 끝났으면 true
     */
    private boolean runTask(Task task) {
        Handle handle = task.handle();
        boolean succeeded = true;

        try {
            task.action().run();
        } catch (RuntimeException e) {
            succeeded = false;
            log.warn("task #{} ({}) failed for {}", task.sequence(), task.kind(), handle.getLabel(), e);
        } finally {
            if (task.kind().carriesRelease()) {
                succeeded &= completeRelease(handle);
            } else {
                pendingChangesCount--;
            }
        }
        return succeeded;
    }

    private boolean completeRelease(Handle handle) {
        try {
            releaseHold(handle);
            return true;
        } catch (RuntimeException e) {
            log.warn("release continuation failed for {}", handle.getLabel(), e);
            return false;
        }
    }

    private void releaseHold(Handle handle) {
        log.trace("in callback: {}", handle.getLabel());
        if (!handle.release()) {
            // 이미 0이거나 종료된 Handle
            return;
        }
        if (handle.getHoldCount() == 0) {
            registry.unregister(handle);
        }
    }

    private void logReport(DrainReport report) {
        if (report.stop().isBudgetExhausted() && report.isBacklogged()) {
            log.info("drain stopped by {}: {} executed, {} remaining ({} pending changes), {} live, {}ms",
                report.stop(), report.tasksExecuted(), report.tasksRemaining(),
                report.pendingChangesRemaining(), report.liveCount(), report.elapsed().toMillis());
        } else {
            log.debug("drain finished ({}): {} executed, {} live, {}ms",
                report.stop(), report.tasksExecuted(), report.liveCount(), report.elapsed().toMillis());
        }
    }
}
