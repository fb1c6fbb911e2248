/**
 * Core model: the handle and its identifier.
 *
 * <ul>
 *   <li>{@link com.ryuqq.drainloop.core.model.HandleId} - Handle identity, issued from a sequence</li>
 *   <li>{@link com.ryuqq.drainloop.core.model.Handle} - Hold-counted resource whose finalization is gated by a queued release</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Drainloop Team
 */
package com.ryuqq.drainloop.core.model;
