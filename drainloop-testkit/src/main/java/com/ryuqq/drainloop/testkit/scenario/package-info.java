/**
 * Reusable scenario-test fixtures.
 *
 * <p>{@link com.ryuqq.drainloop.testkit.scenario.AbstractScenarioTest} wires a registry,
 * executor and driver per test. Scenario tests that reproduce the backlog failure mode
 * live under {@code src/test/java} in this module.</p>
 *
 * @author Drainloop Team
 * @since 1.0.0
 */
package com.ryuqq.drainloop.testkit.scenario;
