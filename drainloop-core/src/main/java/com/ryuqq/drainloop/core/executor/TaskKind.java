package com.ryuqq.drainloop.core.executor;

/**
 * 큐에 쌓이는 태스크 종류.
 *
 * @author Drainloop Team
 * @since 1.0.0
 */
public enum TaskKind {

    /**
     * acquire()가 넣은 태스크. 호출자 action 실행 후 release continuation 수행.
     */
    ACQUIRED_ACTION,

    /**
     * noteStateChange()가 넣은 "process pending changes" 태스크. holdCount와 무관.
     */
    PENDING_CHANGES;

    /**
     * release 의무가 있는지 여부.
     *
     * @return ACQUIRED_ACTION이면 true
     */
    public boolean carriesRelease() {
        return this == ACQUIRED_ACTION;
    }
}
