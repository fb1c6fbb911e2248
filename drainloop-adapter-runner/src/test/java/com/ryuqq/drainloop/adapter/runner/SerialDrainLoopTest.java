package com.ryuqq.drainloop.adapter.runner;

import com.ryuqq.drainloop.core.executor.DeferredExecutor;
import com.ryuqq.drainloop.core.executor.DrainBudget;
import com.ryuqq.drainloop.core.executor.DrainReport;
import com.ryuqq.drainloop.core.model.Handle;
import com.ryuqq.drainloop.core.registry.HandleRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SerialDrainLoop 동시성 테스트.
 *
 * <ul>
 *   <li>여러 스레드의 acquire가 모두 단일 워커 스레드에서 실행됨</li>
 *   <li>제출 순서대로 실행됨</li>
 *   <li>shutdown 이후 제출은 future 실패</li>
 * </ul>
 *
 * @author Drainloop Team
 * @since 1.0.0
 */
class SerialDrainLoopTest {

    private DeferredExecutor executor;
    private SerialDrainLoop loop;

    @BeforeEach
    void setUp() {
        executor = new DeferredExecutor(new HandleRegistry());
        loop = new SerialDrainLoop(executor, new SerialDrainLoopConfig()
            .withThreadName("test-drain-worker")
            .withShutdownTimeout(Duration.ofSeconds(5)));
    }

    @AfterEach
    void tearDown() {
        loop.close();
    }

    @Test
    void 여러_스레드의_acquire가_모두_워커_스레드에서_실행됨() throws Exception {
        // given
        int threads = 8;
        int perThread = 100;
        ExecutorService callers = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        Set<String> actionThreads = ConcurrentHashMap.newKeySet();
        List<CompletableFuture<Void>> submissions = new ArrayList<>();
        List<Future<?>> callerTasks = new ArrayList<>();

        // when
        for (int t = 0; t < threads; t++) {
            int threadIndex = t;
            callerTasks.add(callers.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    Handle handle = Handle.create("ctx-" + threadIndex + "-" + i);
                    CompletableFuture<Void> f = loop.acquire(handle,
                        () -> actionThreads.add(Thread.currentThread().getName()));
                    synchronized (submissions) {
                        submissions.add(f);
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> task : callerTasks) {
            task.get(10, TimeUnit.SECONDS);
        }
        callers.shutdown();
        CompletableFuture.allOf(submissions.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);

        // then
        assertThat(loop.liveCount().get(5, TimeUnit.SECONDS)).isEqualTo(threads * perThread);
        assertThat(loop.backlog().get(5, TimeUnit.SECONDS)).isEqualTo(threads * perThread);

        DrainReport report = loop.drain(DrainBudget.unlimited()).get(10, TimeUnit.SECONDS);
        assertThat(report.tasksExecuted()).isEqualTo(threads * perThread);
        assertThat(report.liveCount()).isZero();
        assertThat(actionThreads).containsExactly("test-drain-worker");
    }

    @Test
    void 제출_순서대로_실행됨() throws Exception {
        // given
        List<String> order = new ArrayList<>();
        Handle a = Handle.create("ctx-a");
        Handle b = Handle.create("ctx-b");

        // when
        loop.acquire(a, () -> order.add("a"));
        loop.noteStateChange(a);
        loop.acquire(b, () -> order.add("b"));
        DrainReport report = loop.drain(DrainBudget.unlimited()).get(5, TimeUnit.SECONDS);

        // then
        assertThat(order).containsExactly("a", "b");
        assertThat(report.tasksExecuted()).isEqualTo(3);
        assertThat(loop.submit(DeferredExecutor::pendingChangesCount).get(5, TimeUnit.SECONDS)).isZero();
    }

    @Test
    void 작업_예외는_future로_전달됨() {
        // when
        CompletableFuture<Void> future = loop.acquire(null, () -> { });

        // then
        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shutdown_이후_제출은_RejectedExecutionException으로_실패() throws Exception {
        // given
        loop.shutdown();

        // when
        CompletableFuture<Integer> future = loop.liveCount();

        // then
        assertThat(loop.isShutdown()).isTrue();
        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(RejectedExecutionException.class);
    }
}
