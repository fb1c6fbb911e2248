/**
 * Runner Adapter Layer - 하네스와 직렬화 루프.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.drainloop.adapter.runner.CycleDriver} - drain 없이 사이클을 반복한 뒤 제한된 drain 기회를 주는 하네스</li>
 *   <li>{@link com.ryuqq.drainloop.adapter.runner.SerialDrainLoop} - 멀티 스레드 호출을 단일 워커 스레드로 직렬화</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (CycleDriver, SerialDrainLoop)
 *   ↓ depends on
 * core (DeferredExecutor, HandleRegistry, Handle)
 * </pre>
 *
 * @author Drainloop Team
 * @since 1.0.0
 */
package com.ryuqq.drainloop.adapter.runner;
