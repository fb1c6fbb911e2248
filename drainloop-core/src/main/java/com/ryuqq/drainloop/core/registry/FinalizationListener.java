package com.ryuqq.drainloop.core.registry;

import com.ryuqq.drainloop.core.model.Handle;

/**
 * Callback fired synchronously when a handle leaves the {@link HandleRegistry}.
 *
 * <p>Invoked on the executor's own thread, from inside
 * {@link HandleRegistry#unregister(Handle)}, after the handle has been marked
 * FINALIZED and removed from the membership set.</p>
 *
 * @author Drainloop Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface FinalizationListener {

    /**
     * Listener that does nothing.
     */
    FinalizationListener NONE = (handle, remaining) -> { };

    /**
     * Called once per finalized handle.
     *
     * @param handle the handle that was just finalized
     * @param remaining live handle count after removal
     */
    void onHandleFinalized(Handle handle, int remaining);
}
