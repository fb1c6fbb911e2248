package com.ryuqq.drainloop.adapter.runner;

import java.time.Duration;

/**
 * SerialDrainLoop 설정 (불변 record).
 *
 * <ul>
 *   <li>threadName: 전용 워커 스레드 이름 (기본 "drainloop-worker")</li>
 *   <li>shutdownTimeout: graceful shutdown 대기 시간 (기본 60초)</li>
 * </ul>
 *
 * @author Drainloop Team
 * @since 1.0.0
 * @param threadName 워커 스레드 이름 (비어 있으면 안 됨)
 * @param shutdownTimeout shutdown 대기 시간 (양수)
 */
public record SerialDrainLoopConfig(String threadName, Duration shutdownTimeout) {

    /**
     * 기본 설정 생성자.
     */
    public SerialDrainLoopConfig() {
        this("drainloop-worker", Duration.ofSeconds(60));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SerialDrainLoopConfig {
        if (threadName == null || threadName.isBlank()) {
            throw new IllegalArgumentException("threadName cannot be null or blank");
        }
        if (shutdownTimeout == null || shutdownTimeout.isZero() || shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException(
                "shutdownTimeout must be positive (current: " + shutdownTimeout + ")"
            );
        }
    }

    /**
     * threadName만 변경한 새 인스턴스 생성.
     */
    public SerialDrainLoopConfig withThreadName(String threadName) {
        return new SerialDrainLoopConfig(threadName, shutdownTimeout);
    }

    /**
     * shutdownTimeout만 변경한 새 인스턴스 생성.
     */
    public SerialDrainLoopConfig withShutdownTimeout(Duration shutdownTimeout) {
        return new SerialDrainLoopConfig(threadName, shutdownTimeout);
    }
}
