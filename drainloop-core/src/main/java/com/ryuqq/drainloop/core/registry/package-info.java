/**
 * Live handle membership.
 *
 * <p>{@link com.ryuqq.drainloop.core.registry.HandleRegistry} is an explicitly owned
 * instance, never a process-wide singleton. Handles leave it only when their hold
 * count reaches zero inside a release continuation.</p>
 *
 * @author Drainloop Team
 * @since 1.0.0
 */
package com.ryuqq.drainloop.core.registry;
