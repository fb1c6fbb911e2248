package com.ryuqq.drainloop.core.registry;

import com.ryuqq.drainloop.core.model.Handle;
import com.ryuqq.drainloop.core.model.HandleId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tracks live handles.
 *
 * <p>Membership is a lookup relation, never ownership: the registry never
 * keeps a handle alive once its hold count has reached zero, and it does no
 * work of its own to bring a hold count down. A handle leaves only through
 * {@link #unregister(Handle)}, which the executor calls from a release
 * continuation.</p>
 *
 * <p><strong>Removal rule:</strong> a handle with {@code holdCount > 0} is
 * never removed, even when asked to be.</p>
 *
 * <p><strong>Thread safety:</strong> none. The registry is owned by one
 * {@code DeferredExecutor} and touched only from that executor's thread.</p>
 *
 * @author Drainloop Team
 * @since 1.0.0
 */
public final class HandleRegistry {

    private static final Logger log = LoggerFactory.getLogger(HandleRegistry.class);

    private final Map<HandleId, Handle> members = new LinkedHashMap<>();
    private final FinalizationListener listener;

    /**
     * Creates a registry without a finalization listener.
     */
    public HandleRegistry() {
        this(FinalizationListener.NONE);
    }

    /**
     * Creates a registry that reports removals to the given listener.
     *
     * @param listener finalization callback
     * @throws IllegalArgumentException if listener is null
     */
    public HandleRegistry(FinalizationListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        this.listener = listener;
    }

    /**
     * Adds the handle to the membership set. Registering a member again is a no-op.
     *
     * @param handle handle to track
     * @return true if the handle was not a member before
     * @throws IllegalArgumentException if handle is null
     * @throws IllegalStateException if the handle is already finalized, or
     *         another handle with the same id is a member
     */
    public boolean register(Handle handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        if (handle.isFinalized()) {
            throw new IllegalStateException("Cannot register finalized handle: " + handle.getId());
        }
        Handle previous = members.putIfAbsent(handle.getId(), handle);
        if (previous == null) {
            log.trace("registered {}: {} instances live", handle.getLabel(), members.size());
            return true;
        }
        if (previous != handle) {
            throw new IllegalStateException(
                "Handle id " + handle.getId() + " already in use by " + previous.getLabel()
                    + " (rejected: " + handle.getLabel() + ")"
            );
        }
        return false;
    }

    /**
     * Removes the handle and fires the finalization callback.
     *
     * <p>Idempotent: an absent handle is ignored. A handle still held
     * ({@code holdCount > 0}) stays registered.</p>
     *
     * @param handle handle to remove
     * @return true if the handle was removed by this call
     */
    public boolean unregister(Handle handle) {
        if (!contains(handle)) {
            return false;
        }
        if (!handle.isRemovable()) {
            log.debug("refusing to unregister {}: holdCount={}", handle.getLabel(), handle.getHoldCount());
            return false;
        }

        members.remove(handle.getId());
        handle.markFinalized();
        int remaining = members.size();
        log.debug("finalized {}: {} instances remain", handle.getLabel(), remaining);
        listener.onHandleFinalized(handle, remaining);
        return true;
    }

    /**
     * Current number of members. Side-effect free.
     *
     * @return live handle count
     */
    public int count() {
        return members.size();
    }

    /**
     * @param handle handle to look up
     * @return true if the handle is a member
     */
    public boolean contains(Handle handle) {
        return handle != null && members.get(handle.getId()) == handle;
    }

    /**
     * Members in registration order.
     *
     * @return unmodifiable copy of the membership set
     */
    public List<Handle> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(members.values()));
    }
}
