package com.ryuqq.drainloop.testkit.scenario;

import com.ryuqq.drainloop.core.model.Handle;
import com.ryuqq.drainloop.core.model.HandleId;
import com.ryuqq.drainloop.core.registry.FinalizationListener;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link FinalizationListener} that records every finalization in order.
 *
 * <p>Used by scenario tests to observe how many handles a drain actually
 * reclaimed and in which order. Not thread-safe, like the registry it listens to.</p>
 *
 * @author Drainloop Team
 * @since 1.0.0
 */
public class RecordingFinalizationListener implements FinalizationListener {

    private final List<HandleId> finalized = new ArrayList<>();
    private final List<Integer> remainingCounts = new ArrayList<>();

    @Override
    public void onHandleFinalized(Handle handle, int remaining) {
        finalized.add(handle.getId());
        remainingCounts.add(remaining);
    }

    /**
     * @return finalized handle ids, in finalization order
     */
    public List<HandleId> finalizedIds() {
        return Collections.unmodifiableList(finalized);
    }

    /**
     * @return live count reported with each finalization
     */
    public List<Integer> remainingCounts() {
        return Collections.unmodifiableList(remainingCounts);
    }

    public int count() {
        return finalized.size();
    }

    /**
     * Clears all recorded state.
     */
    public void clear() {
        finalized.clear();
        remainingCounts.clear();
    }
}
