/**
 * Deferred-release executor.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.drainloop.core.executor.DeferredExecutor} - 단일 스레드 FIFO 작업 큐</li>
 *   <li>{@link com.ryuqq.drainloop.core.executor.Task} - 큐에 쌓이는 불변 작업 단위</li>
 *   <li>{@link com.ryuqq.drainloop.core.executor.DrainBudget} - drain 시간/횟수 예산</li>
 *   <li>{@link com.ryuqq.drainloop.core.executor.DrainReport} - drain 결과 (backlog 포함)</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (CycleDriver, SerialDrainLoop)
 *   ↓ depends on
 * core/executor (DeferredExecutor)
 *   ↓ depends on
 * core/registry (HandleRegistry) → core/model (Handle)
 * </pre>
 *
 * @author Drainloop Team
 * @since 1.0.0
 */
package com.ryuqq.drainloop.core.executor;
