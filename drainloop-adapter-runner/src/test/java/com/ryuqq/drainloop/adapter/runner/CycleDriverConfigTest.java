package com.ryuqq.drainloop.adapter.runner;

import com.ryuqq.drainloop.core.executor.DrainBudget;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CycleDriverConfig / SerialDrainLoopConfig 검증 테스트.
 *
 * @author Drainloop Team
 * @since 1.0.0
 */
class CycleDriverConfigTest {

    @Test
    void 기본값() {
        CycleDriverConfig config = new CycleDriverConfig();

        assertThat(config.labelPrefix()).isEqualTo("context");
        assertThat(config.drainThreshold()).isEqualTo(250);
        assertThat(config.savesPerCycle()).isEqualTo(1);
        assertThat(config.drainWindow()).isEqualTo(Duration.ofMillis(100));
        assertThat(config.sliceBudget().timeBudget()).isEqualTo(Duration.ofMillis(1));
    }

    @Test
    void 잘못된_값은_거부됨() {
        CycleDriverConfig config = new CycleDriverConfig();

        assertThatThrownBy(() -> config.withLabelPrefix("has space"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("labelPrefix");
        assertThatThrownBy(() -> config.withDrainThreshold(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("drainThreshold cannot be negative (current: -1)");
        assertThatThrownBy(() -> config.withSavesPerCycle(-1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.withDrainWindow(Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("drainWindow must be positive");
        assertThatThrownBy(() -> config.withSliceBudget(DrainBudget.of(Duration.ofMillis(1), 0)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("sliceBudget must allow progress");
    }

    @Test
    void with_메서드는_한_필드만_변경() {
        CycleDriverConfig config = new CycleDriverConfig().withDrainThreshold(1800);

        assertThat(config.drainThreshold()).isEqualTo(1800);
        assertThat(config.labelPrefix()).isEqualTo("context");
    }

    @Test
    void SerialDrainLoopConfig_검증() {
        assertThat(new SerialDrainLoopConfig().threadName()).isEqualTo("drainloop-worker");
        assertThatThrownBy(() -> new SerialDrainLoopConfig().withThreadName(" "))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SerialDrainLoopConfig().withShutdownTimeout(Duration.ofSeconds(-1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("shutdownTimeout must be positive");
    }
}
