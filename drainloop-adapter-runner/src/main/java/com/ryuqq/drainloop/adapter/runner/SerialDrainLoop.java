package com.ryuqq.drainloop.adapter.runner;

import com.ryuqq.drainloop.core.executor.DeferredExecutor;
import com.ryuqq.drainloop.core.executor.DrainBudget;
import com.ryuqq.drainloop.core.executor.DrainReport;
import com.ryuqq.drainloop.core.model.Handle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * 여러 스레드의 호출을 하나의 전용 워커 스레드로 직렬화하는 루프.
 *
 * <p>{@link DeferredExecutor}는 스레드 안전하지 않으므로, 멀티 스레드 호출자는
 * 모든 진입점(acquire, noteStateChange, drain, 조회)을 이 루프를 통해 제출합니다.
 * 제출 순서가 곧 실행 순서입니다.</p>
 *
 * <p>이 워커 스레드가 병목이 되는 상황이 바로 backlog가 쌓이는 지점입니다.</p>
 *
 * <p><strong>종료 후 제출:</strong> 반환된 future가 {@link RejectedExecutionException}으로 실패합니다.</p>
 *
 * @author Drainloop Team
 * @since 1.0.0
 */
public final class SerialDrainLoop implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SerialDrainLoop.class);

    private final DeferredExecutor executor;
    private final SerialDrainLoopConfig config;
    private final ExecutorService worker;

    /**
     * 생성자.
     *
     * @param executor 직렬화할 executor (이후 이 루프를 통해서만 접근해야 함)
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SerialDrainLoop(DeferredExecutor executor, SerialDrainLoopConfig config) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.executor = executor;
        this.config = config;
        this.worker = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, config.threadName());
            thread.setDaemon(true);
            return thread;
        });
    }

    public CompletableFuture<Void> acquire(Handle handle, Runnable action) {
        return submit(e -> {
            e.acquire(handle, action);
            return null;
        });
    }

    public CompletableFuture<Void> noteStateChange(Handle handle) {
        return submit(e -> {
            e.noteStateChange(handle);
            return null;
        });
    }

    public CompletableFuture<DrainReport> drain(DrainBudget budget) {
        return submit(e -> e.drain(budget));
    }

    public CompletableFuture<Integer> liveCount() {
        return submit(DeferredExecutor::liveCount);
    }

    public CompletableFuture<Integer> backlog() {
        return submit(DeferredExecutor::backlog);
    }

    /**
     * 워커 스레드에서 executor에 대한 임의 작업을 실행합니다.
     *
     * @param work executor를 받아 결과를 돌려주는 작업
     * @param <T> 결과 타입
     * @return 작업 결과 future
     */
    public <T> CompletableFuture<T> submit(Function<DeferredExecutor, T> work) {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        try {
            return CompletableFuture.supplyAsync(() -> work.apply(executor), worker);
        } catch (RejectedExecutionException e) {
            log.warn("{} rejected a submission after shutdown", config.threadName());
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * 루프 종료 (리소스 정리).
     *
     * <p>이미 제출된 작업이 끝나기를 shutdownTimeout만큼 기다리고,
     * 넘으면 남은 작업을 버립니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        worker.shutdown();
        if (!worker.awaitTermination(config.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
            int dropped = worker.shutdownNow().size();
            log.warn("{} did not terminate within {}ms, dropped {} submissions",
                config.threadName(), config.shutdownTimeout().toMillis(), dropped);
        }
    }

    public boolean isShutdown() {
        return worker.isShutdown();
    }

    /**
     * {@link #shutdown()}과 같지만 인터럽트를 예외 대신 플래그로 복원합니다.
     */
    @Override
    public void close() {
        try {
            shutdown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.shutdownNow();
        }
    }
}
