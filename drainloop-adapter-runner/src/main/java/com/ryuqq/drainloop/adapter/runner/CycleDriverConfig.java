package com.ryuqq.drainloop.adapter.runner;

import com.ryuqq.drainloop.core.executor.DrainBudget;

import java.time.Duration;

/**
 * CycleDriver 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>labelPrefix: Handle 식별자/label 접두사 (기본 "context")</li>
 *   <li>drainThreshold: 이 사이클 수를 넘어야 drain 기회가 생김 (기본 250)</li>
 *   <li>savesPerCycle: withSave 사이클마다 noteStateChange 호출 수 (기본 1)</li>
 *   <li>drainWindow: drain 기회 한 번의 전체 시간 창 (기본 100ms)</li>
 *   <li>sliceBudget: 시간 창 안에서 반복하는 drain 한 조각의 예산 (기본 1ms, 횟수 무제한)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>backlog 재현: drainThreshold 증가 (250 → 1800), savesPerCycle 증가</li>
 *   <li>빠른 회수: drainWindow 증가, sliceBudget의 opBudget 증가</li>
 * </ul>
 *
 * @author Drainloop Team
 * @since 1.0.0
 * @param labelPrefix Handle 접두사 (영숫자, 하이픈, 언더스코어)
 * @param drainThreshold drain 시작 임계 사이클 수 (0 이상)
 * @param savesPerCycle 사이클당 저장 횟수 (0 이상)
 * @param drainWindow drain 시간 창 (양수)
 * @param sliceBudget drain 조각 예산 (시간, 횟수 모두 양수)
 */
public record CycleDriverConfig(
    String labelPrefix,
    int drainThreshold,
    int savesPerCycle,
    Duration drainWindow,
    DrainBudget sliceBudget
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: labelPrefix="context", drainThreshold=250, savesPerCycle=1,
     * drainWindow=100ms, sliceBudget=(1ms, 무제한)</p>
     */
    public CycleDriverConfig() {
        this("context", 250, 1, Duration.ofMillis(100), DrainBudget.of(Duration.ofMillis(1), Integer.MAX_VALUE));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CycleDriverConfig {
        if (labelPrefix == null || !labelPrefix.matches("^[a-zA-Z0-9\\-_]{1,200}$")) {
            throw new IllegalArgumentException(
                "labelPrefix must be 1-200 alphanumeric, hyphen or underscore characters (current: " + labelPrefix + ")"
            );
        }
        if (drainThreshold < 0) {
            throw new IllegalArgumentException(
                "drainThreshold cannot be negative (current: " + drainThreshold + ")"
            );
        }
        if (savesPerCycle < 0) {
            throw new IllegalArgumentException(
                "savesPerCycle cannot be negative (current: " + savesPerCycle + ")"
            );
        }
        if (drainWindow == null || drainWindow.isZero() || drainWindow.isNegative()) {
            throw new IllegalArgumentException(
                "drainWindow must be positive (current: " + drainWindow + ")"
            );
        }
        if (sliceBudget == null) {
            throw new IllegalArgumentException("sliceBudget cannot be null");
        }
        if (sliceBudget.opBudget() <= 0 || sliceBudget.timeBudget().isZero()) {
            throw new IllegalArgumentException(
                "sliceBudget must allow progress (current: " + sliceBudget + ")"
            );
        }
    }

    /**
     * labelPrefix만 변경한 새 인스턴스 생성.
     */
    public CycleDriverConfig withLabelPrefix(String labelPrefix) {
        return new CycleDriverConfig(labelPrefix, drainThreshold, savesPerCycle, drainWindow, sliceBudget);
    }

    /**
     * drainThreshold만 변경한 새 인스턴스 생성.
     */
    public CycleDriverConfig withDrainThreshold(int drainThreshold) {
        return new CycleDriverConfig(labelPrefix, drainThreshold, savesPerCycle, drainWindow, sliceBudget);
    }

    /**
     * savesPerCycle만 변경한 새 인스턴스 생성.
     */
    public CycleDriverConfig withSavesPerCycle(int savesPerCycle) {
        return new CycleDriverConfig(labelPrefix, drainThreshold, savesPerCycle, drainWindow, sliceBudget);
    }

    /**
     * drainWindow만 변경한 새 인스턴스 생성.
     */
    public CycleDriverConfig withDrainWindow(Duration drainWindow) {
        return new CycleDriverConfig(labelPrefix, drainThreshold, savesPerCycle, drainWindow, sliceBudget);
    }

    /**
     * sliceBudget만 변경한 새 인스턴스 생성.
     */
    public CycleDriverConfig withSliceBudget(DrainBudget sliceBudget) {
        return new CycleDriverConfig(labelPrefix, drainThreshold, savesPerCycle, drainWindow, sliceBudget);
    }
}
