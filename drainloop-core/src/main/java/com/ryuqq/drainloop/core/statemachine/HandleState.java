package com.ryuqq.drainloop.core.statemachine;

/**
 * Handle의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>CREATED → HELD (첫 acquire)</li>
 *   <li>CREATED → FINALIZED (acquire 없이 소유자가 해제)</li>
 *   <li>HELD → DRAINING (release 태스크 실행, holdCount &gt; 0 유지)</li>
 *   <li>DRAINING → HELD (drain 도중 재 acquire)</li>
 *   <li>HELD, DRAINING → FINALIZED (holdCount가 0이 되어 레지스트리에서 제거)</li>
 *   <li><strong>FINALIZED에서는 어떤 전이도 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * CREATED
 *    │
 *    ▼ (acquire)
 * HELD ◄──────────┐
 *    │            │ (acquire)
 *    ▼ (release)  │
 * DRAINING ───────┘
 *    │
 *    ▼ (holdCount == 0)
 * FINALIZED
 * </pre>
 *
 * <p>drain이 호출되지 않거나 해당 release 태스크에 닿기 전에 예산이 소진되면
 * Handle은 HELD에 무기한 머무를 수 있습니다.</p>
 *
 * @author Drainloop Team
 * @since 1.0.0
 */
public enum HandleState {

    /**
     * 등록됨, 아직 보유 없음.
     */
    CREATED,

    /**
     * 보유 중 (release 태스크가 큐에서 대기).
     */
    HELD,

    /**
     * release 태스크 일부 실행됨, holdCount는 아직 양수.
     */
    DRAINING,

    /**
     * 종료 (레지스트리에서 제거됨).
     */
    FINALIZED;

    /**
     * 종료 상태인지 확인.
     *
     * @return FINALIZED인 경우 true
     */
    public boolean isTerminal() {
        return this == FINALIZED;
    }
}
