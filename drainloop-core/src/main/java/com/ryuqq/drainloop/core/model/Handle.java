package com.ryuqq.drainloop.core.model;

import com.ryuqq.drainloop.core.statemachine.HandleState;
import com.ryuqq.drainloop.core.statemachine.HandleStateTransition;

/**
 * 보유 카운트(hold count)로 종료 시점이 결정되는 장수명 리소스.
 *
 * <p>영속성 컨텍스트 하나를 추상화한 것으로, {@code DeferredExecutor.acquire()}가
 * 보유 카운트를 즉시 올리고, 큐에 쌓인 release 태스크가 실행될 때에만 내려갑니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>holdCount &gt;= 0</li>
 *   <li>holdCount가 0일 때만 레지스트리에서 제거 가능</li>
 *   <li>FINALIZED 이후에는 retain 불가, release는 no-op</li>
 * </ul>
 *
 * <p><strong>스레드 안전성:</strong> 없음. executor의 단일 스레드에서만 접근합니다.</p>
 *
 * @author Drainloop Team
 * @since 1.0.0
 */
public final class Handle {

    private final HandleId id;
    private final String label;
    private int holdCount;
    private HandleState state;

    private Handle(HandleId id, String label) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (label == null) {
            throw new IllegalArgumentException("label cannot be null");
        }
        this.id = id;
        this.label = label;
        this.holdCount = 0;
        this.state = HandleState.CREATED;
    }

    /**
     * 새 식별자를 발급받아 Handle 생성 (CREATED, holdCount=0).
     *
     * @param label 로그용 이름 (자유 형식)
     * @return Handle 인스턴스
     * @throws IllegalArgumentException label이 null인 경우
     */
    public static Handle create(String label) {
        return new Handle(HandleId.next(), label);
    }

    /**
     * 지정한 식별자로 Handle 생성.
     *
     * @param id 식별자
     * @param label 로그용 이름
     * @return Handle 인스턴스
     * @throws IllegalArgumentException id 또는 label이 null인 경우
     */
    public static Handle create(HandleId id, String label) {
        return new Handle(id, label);
    }

    /**
     * 보유 카운트를 1 증가시킵니다.
     *
     * @return 증가 후 holdCount
     * @throws IllegalStateException 이미 FINALIZED인 경우
     */
    public int retain() {
        if (state != HandleState.HELD) {
            state = HandleStateTransition.transition(state, HandleState.HELD);
        }
        return ++holdCount;
    }

    /**
     * 보유 카운트를 1 감소시킵니다.
     *
     * <p>이미 0이거나 FINALIZED인 경우 아무것도 바꾸지 않고 false를 반환합니다 (이중 release 방지).</p>
     *
     * @return 실제로 감소했으면 true
     */
    public boolean release() {
        if (holdCount == 0 || state.isTerminal()) {
            return false;
        }
        holdCount--;
        if (holdCount > 0 && state != HandleState.DRAINING) {
            state = HandleStateTransition.transition(state, HandleState.DRAINING);
        }
        return true;
    }

    /**
     * 종료 상태로 전이합니다. HandleRegistry만 호출합니다.
     *
     * @throws IllegalStateException holdCount가 0이 아니거나 이미 종료된 경우
     */
    public void markFinalized() {
        if (holdCount != 0) {
            throw new IllegalStateException(
                "Cannot finalize " + id + " while holdCount=" + holdCount
            );
        }
        state = HandleStateTransition.transition(state, HandleState.FINALIZED);
    }

    /**
     * 레지스트리에서 제거 가능한지 여부.
     *
     * @return holdCount가 0이고 아직 종료되지 않았으면 true
     */
    public boolean isRemovable() {
        return holdCount == 0 && !state.isTerminal();
    }

    public HandleId getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public int getHoldCount() {
        return holdCount;
    }

    public HandleState getState() {
        return state;
    }

    public boolean isFinalized() {
        return state.isTerminal();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Handle other = (Handle) o;
        return id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Handle{" + id + ", label=" + label + ", holdCount=" + holdCount + ", state=" + state + '}';
    }
}
