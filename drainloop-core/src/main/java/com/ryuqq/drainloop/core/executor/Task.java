package com.ryuqq.drainloop.core.executor;

import com.ryuqq.drainloop.core.model.Handle;

/**
 * 큐에 쌓인 작업 단위 (불변 record).
 *
 * <p>enqueue 이후 변경되지 않으며, sequence 순서대로만 실행됩니다.</p>
 *
 * @param sequence enqueue 순번 (executor 내에서 단조 증가)
 * @param kind 태스크 종류
 * @param handle 대상 Handle
 * @param action 실행할 본문
 *
 * @author Drainloop Team
 * @since 1.0.0
 */
public record Task(
    long sequence,
    TaskKind kind,
    Handle handle,
    Runnable action
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 null이거나 sequence가 음수인 경우
     */
    public Task {
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence cannot be negative (current: " + sequence + ")");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
    }
}
