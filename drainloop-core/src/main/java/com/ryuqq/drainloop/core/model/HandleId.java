package com.ryuqq.drainloop.core.model;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Handle의 고유 식별자 (생성 순번).
 *
 * <p>{@link #next()}가 프로세스 전역 카운터에서 순번을 발급하므로, 발급된 식별자는
 * 서로 겹치지 않습니다. 사람이 읽는 이름은 {@link Handle#getLabel()}이 따로 가집니다.</p>
 *
 * @author Drainloop Team
 * @since 1.0.0
 * @param sequence 발급 순번 (1 이상)
 */
public record HandleId(long sequence) {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException sequence가 1 미만인 경우
     */
    public HandleId {
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be positive (current: " + sequence + ")");
        }
    }

    /**
     * 새 순번 발급.
     *
     * @return 아직 쓰이지 않은 HandleId
     */
    public static HandleId next() {
        return new HandleId(SEQUENCE.incrementAndGet());
    }

    @Override
    public String toString() {
        return "#" + sequence;
    }
}
