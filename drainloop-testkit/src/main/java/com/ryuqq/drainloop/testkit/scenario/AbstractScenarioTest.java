package com.ryuqq.drainloop.testkit.scenario;

import com.ryuqq.drainloop.adapter.runner.CycleDriver;
import com.ryuqq.drainloop.adapter.runner.CycleDriverConfig;
import com.ryuqq.drainloop.core.executor.DeferredExecutor;
import com.ryuqq.drainloop.core.model.Handle;
import com.ryuqq.drainloop.core.registry.HandleRegistry;
import com.ryuqq.drainloop.core.statemachine.HandleState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for scenario tests.
 *
 * <p>Provides a fresh registry, executor and driver per test, plus helpers
 * that build handles and assert on their lifecycle.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>HandleRegistry wired to a {@link RecordingFinalizationListener}</li>
 *   <li>DeferredExecutor on the system clock</li>
 *   <li>CycleDriver configured by {@link #driverConfig()}</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyScenarioTest extends AbstractScenarioTest {
 *     {@literal @}Test
 *     void testScenario() {
 *         List&lt;Handle&gt; handles = acquireAll(3);
 *         executor.drain(DrainBudget.unlimited());
 *         handles.forEach(this::assertFinalized);
 *     }
 * }
 * </pre>
 *
 * @author Drainloop Team
 * @since 1.0.0
 */
public abstract class AbstractScenarioTest {

    protected RecordingFinalizationListener finalizations;
    protected HandleRegistry registry;
    protected DeferredExecutor executor;
    protected CycleDriver driver;

    private int handleSequence;

    /**
     * Creates fresh instances before each test.
     */
    @BeforeEach
    void setUpScenario() {
        finalizations = new RecordingFinalizationListener();
        registry = new HandleRegistry(finalizations);
        executor = new DeferredExecutor(registry);
        driver = new CycleDriver(executor, driverConfig());
        handleSequence = 0;
    }

    /**
     * Clears recorded state after each test.
     */
    @AfterEach
    void tearDownScenario() {
        if (finalizations != null) {
            finalizations.clear();
        }
    }

    /**
     * Driver configuration for this test class. Override to tune the threshold.
     *
     * @return driver configuration
     */
    protected CycleDriverConfig driverConfig() {
        return new CycleDriverConfig();
    }

    /**
     * Creates a new, unregistered handle with a unique id.
     *
     * @return a new handle in CREATED state
     */
    protected Handle newHandle() {
        return Handle.create("scenario-" + (++handleSequence));
    }

    /**
     * Acquires {@code n} fresh handles with no-op actions.
     *
     * @param n number of handles
     * @return the acquired handles, in acquisition order
     */
    protected List<Handle> acquireAll(int n) {
        List<Handle> handles = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Handle handle = newHandle();
            executor.acquire(handle, () -> { });
            handles.add(handle);
        }
        return handles;
    }

    /**
     * Asserts the handle was released to zero and removed from the registry.
     *
     * @param handle the handle
     */
    protected void assertFinalized(Handle handle) {
        assertEquals(0, handle.getHoldCount(),
                String.format("Expected holdCount 0 for %s", handle));
        assertEquals(HandleState.FINALIZED, handle.getState(),
                String.format("Expected FINALIZED for %s", handle));
        assertFalse(registry.contains(handle),
                String.format("Expected %s to be absent from the registry", handle));
    }

    /**
     * Asserts the handle is still held and registered.
     *
     * @param handle the handle
     * @param expectedHoldCount expected hold count
     */
    protected void assertHeld(Handle handle, int expectedHoldCount) {
        assertEquals(expectedHoldCount, handle.getHoldCount(),
                String.format("Expected holdCount %d for %s", expectedHoldCount, handle));
        assertFalse(handle.isFinalized(),
                String.format("Expected %s not to be finalized", handle));
        assertTrue(registry.contains(handle),
                String.format("Expected %s to be registered", handle));
    }
}
