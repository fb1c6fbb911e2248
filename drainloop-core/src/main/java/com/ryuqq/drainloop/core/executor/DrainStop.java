package com.ryuqq.drainloop.core.executor;

/**
 * drain이 멈춘 이유.
 *
 * @author Drainloop Team
 * @since 1.0.0
 */
public enum DrainStop {

    /**
     * 큐가 비었음.
     */
    QUEUE_EMPTY,

    /**
     * 실행 횟수 예산 소진.
     */
    OP_BUDGET,

    /**
     * 시간 예산 소진.
     */
    TIME_BUDGET,

    /**
     * 실행 중인 태스크 안에서 drain이 다시 호출됨. 아무것도 실행하지 않음.
     */
    REENTRANT;

    /**
     * 예산 때문에 멈췄는지 여부.
     *
     * @return OP_BUDGET 또는 TIME_BUDGET이면 true
     */
    public boolean isBudgetExhausted() {
        return this == OP_BUDGET || this == TIME_BUDGET;
    }
}
