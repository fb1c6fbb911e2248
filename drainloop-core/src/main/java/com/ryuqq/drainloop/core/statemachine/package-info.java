/**
 * Handle 생명주기 상태 머신.
 *
 * <p>CREATED → HELD → DRAINING → FINALIZED. FINALIZED는 종료 상태입니다.</p>
 *
 * @author Drainloop Team
 * @since 1.0.0
 */
package com.ryuqq.drainloop.core.statemachine;
