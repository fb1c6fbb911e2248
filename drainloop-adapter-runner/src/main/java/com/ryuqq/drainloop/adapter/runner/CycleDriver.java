package com.ryuqq.drainloop.adapter.runner;

import com.ryuqq.drainloop.core.executor.DeferredExecutor;
import com.ryuqq.drainloop.core.executor.DrainReport;
import com.ryuqq.drainloop.core.executor.DrainStop;
import com.ryuqq.drainloop.core.model.Handle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * acquire-use 사이클을 반복해 backlog를 쌓는 하네스.
 *
 * <p>테스트 하나가 컨텍스트를 만들고, 보유하고, 저장하고, 끝나는 흐름을 사이클 하나로 봅니다.
 * 사이클 사이에는 drain하지 않으며, 누적 사이클 수가 임계값을 넘은 뒤에야
 * 짧은 drain 기회가 주어집니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * runCycle(n, withSave)
 *   for i in 1..n:
 *     1. Handle 생성 (labelPrefix-순번)
 *     2. executor.acquire(handle, no-op)   → holdCount 1, release 대기
 *     3. withSave면 noteStateChange() × savesPerCycle
 *     4. cycleCount + 1                    → drain 없음
 *
 * maybeDrain()
 *   cycleCount &gt; drainThreshold 이면 drainWindow() 실행
 *
 * drainWindow()
 *   drainWindow 시간 동안 sliceBudget 단위로 drain 반복 (큐가 비면 조기 종료)
 * </pre>
 *
 * @author Drainloop Team
 * @since 1.0.0
 */
public final class CycleDriver {

    private static final Logger log = LoggerFactory.getLogger(CycleDriver.class);
    private static final Runnable NO_OP = () -> { };

    private final DeferredExecutor executor;
    private final CycleDriverConfig config;
    private final LongSupplier nanoClock;

    private long handleSequence;
    private int cycleCount;

    /**
     * 생성자 (시스템 시계 사용).
     *
     * @param executor deferred executor
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public CycleDriver(DeferredExecutor executor, CycleDriverConfig config) {
        this(executor, config, System::nanoTime);
    }

    /**
     * 생성자 (커스텀 시계 주입).
     *
     * @param executor deferred executor
     * @param config 설정
     * @param nanoClock 나노초 단위 단조 시계 (drain 시간 창 측정용)
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public CycleDriver(DeferredExecutor executor, CycleDriverConfig config, LongSupplier nanoClock) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (nanoClock == null) {
            throw new IllegalArgumentException("nanoClock cannot be null");
        }
        this.executor = executor;
        this.config = config;
        this.nanoClock = nanoClock;
    }

    /**
     * 사이클 n번 실행. drain은 하지 않습니다.
     *
     * @param n 사이클 수 (0 이상)
     * @param withSave true면 사이클마다 savesPerCycle번 noteStateChange 호출
     * @return 이번에 만든 Handle 목록 (호출자가 소유)
     * @throws IllegalArgumentException n이 음수인 경우
     */
    public List<Handle> runCycle(int n, boolean withSave) {
        if (n < 0) {
            throw new IllegalArgumentException("n cannot be negative (current: " + n + ")");
        }

        List<Handle> created = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Handle handle = newHandle();
            executor.acquire(handle, NO_OP);
            if (withSave) {
                for (int s = 0; s < config.savesPerCycle(); s++) {
                    executor.noteStateChange(handle);
                }
            }
            created.add(handle);
            cycleCount++;
        }

        log.debug("ran {} cycles (withSave={}): total={}, live={}, backlog={}",
            n, withSave, cycleCount, executor.liveCount(), executor.backlog());
        return Collections.unmodifiableList(created);
    }

    /**
     * 누적 사이클 수가 임계값을 넘었으면 drain 기회를 한 번 줍니다.
     *
     * @return drain을 실행했으면 그 결과
     */
    public Optional<DrainReport> maybeDrain() {
        if (cycleCount <= config.drainThreshold()) {
            return Optional.empty();
        }
        return Optional.of(drainWindow());
    }

    /**
     * drainWindow 동안 sliceBudget 단위로 drain을 반복합니다.
     *
     * <p>큐가 비거나 시간 창이 끝나면 멈춥니다. 조각별 결과는 하나로 합쳐집니다.</p>
     *
     * @return 합쳐진 drain 결과
     */
    public DrainReport drainWindow() {
        log.info("spinning drain window of {}ms after {} cycles (backlog={}, live={}, pendingChanges={})",
            config.drainWindow().toMillis(), cycleCount, executor.backlog(),
            executor.liveCount(), executor.pendingChangesCount());

        long windowNanos = config.drainWindow().toNanos();
        long startNanos = nanoClock.getAsLong();
        DrainReport total = null;
        int slices = 0;

        do {
            DrainReport slice = executor.drain(config.sliceBudget());
            total = total == null ? slice : total.merge(slice);
            slices++;
            if (slice.stop() == DrainStop.QUEUE_EMPTY || slice.stop() == DrainStop.REENTRANT) {
                break;
            }
        } while (nanoClock.getAsLong() - startNanos < windowNanos);

        if (total.isBacklogged()) {
            log.warn("drain window closed with backlog: {} executed in {} slices, {} remaining, {} live",
                total.tasksExecuted(), slices, total.tasksRemaining(), total.liveCount());
        } else {
            log.info("drain window cleared backlog: {} executed in {} slices, {} live",
                total.tasksExecuted(), slices, total.liveCount());
        }
        return total;
    }

    /**
     * 지금까지 실행한 사이클 수.
     *
     * @return cycleCount
     */
    public int cycleCount() {
        return cycleCount;
    }

    public CycleDriverConfig config() {
        return config;
    }

    private Handle newHandle() {
        String name = config.labelPrefix() + "-" + (++handleSequence);
        return Handle.create(name);
    }
}
