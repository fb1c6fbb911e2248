package com.ryuqq.drainloop.testkit.scenario;

import com.ryuqq.drainloop.adapter.runner.CycleDriverConfig;
import com.ryuqq.drainloop.core.executor.DrainReport;
import com.ryuqq.drainloop.core.model.Handle;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Scenario: holds accumulate while the queue never gets a chance to drain.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>N acquires with no intervening drain → registry count is exactly N</li>
 *   <li>Saves add backlog without adding holds</li>
 *   <li>The driver offers no drain until the cycle threshold is exceeded</li>
 * </ul>
 *
 * @author Drainloop Team
 * @since 1.0.0
 */
class AccumulationScenarioTest extends AbstractScenarioTest {

    private static final int THRESHOLD = 250;

    @Override
    protected CycleDriverConfig driverConfig() {
        return new CycleDriverConfig()
                .withDrainThreshold(THRESHOLD)
                .withSavesPerCycle(2)
                .withDrainWindow(Duration.ofSeconds(5));
    }

    @Test
    void testAccumulation_NAcquiresWithoutDrain_NoImplicitReclamation() {
        for (int n : new int[] {0, 1, 17, 500}) {
            // Given
            int before = registry.count();

            // When
            acquireAll(n);

            // Then
            assertEquals(before + n, registry.count(),
                    "Every acquire without a drain must keep its handle alive");
        }
        assertEquals(0, finalizations.count());
    }

    @Test
    void testAccumulation_SavesAddBacklogNotHolds() {
        // When
        List<Handle> handles = driver.runCycle(10, true);

        // Then
        assertEquals(10, registry.count());
        assertEquals(30, executor.backlog());
        assertEquals(20, executor.pendingChangesCount());
        handles.forEach(handle -> assertHeld(handle, 1));
    }

    @Test
    void testAccumulation_NoDrainUntilThresholdExceeded() {
        // Given
        driver.runCycle(THRESHOLD, true);

        // When
        Optional<DrainReport> atThreshold = driver.maybeDrain();

        // Then
        assertTrue(atThreshold.isEmpty());
        assertEquals(THRESHOLD, registry.count());
        assertEquals(THRESHOLD * 3, executor.backlog());

        // When: one more cycle finally gets the loop to spin
        driver.runCycle(1, true);
        Optional<DrainReport> afterThreshold = driver.maybeDrain();

        // Then
        assertTrue(afterThreshold.isPresent());
        assertEquals((THRESHOLD + 1) * 3, afterThreshold.get().tasksExecuted());
        assertEquals(0, registry.count());
        assertEquals(THRESHOLD + 1, finalizations.count());
    }
}
