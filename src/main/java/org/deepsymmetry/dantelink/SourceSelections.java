package org.deepsymmetry.dantelink;

import org.apiguardian.api.API;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * <p>Remembers which AES67 source has been chosen for each device receive channel, as a label of the form
 * {@code [AES67] Stream - Channel}.</p>
 *
 * <p>Dante devices report AES67 subscriptions without saying which stream they belong to, so this is the only
 * place that knowledge lives. Entries are written when a subscription is made at runtime, and recovered on a
 * best-effort basis by the {@link Reconciler} after a restart. Reconciliation only fills in missing entries, so
 * a runtime selection is never replaced by a guess.</p>
 */
@API(status = API.Status.STABLE)
public class SourceSelections {

    private final Map<SelectionKey, String> selections = new ConcurrentHashMap<>();

    /**
     * Look up the source selected for a receive channel.
     *
     * @param key the device and receive channel
     *
     * @return the selected source label, or {@code null} if none is recorded
     */
    @API(status = API.Status.STABLE)
    public String get(SelectionKey key) {
        return selections.get(key);
    }

    /**
     * Record a selection made at runtime, replacing anything previously recorded for the channel.
     *
     * @param key the device and receive channel
     * @param label the source label
     */
    @API(status = API.Status.STABLE)
    public void set(SelectionKey key, String label) {
        selections.put(key, label);
    }

    /**
     * Record a recovered selection, but only if nothing is recorded for the channel yet.
     *
     * @param key the device and receive channel
     * @param label the source label
     *
     * @return {@code true} if the label was stored
     */
    @API(status = API.Status.STABLE)
    public boolean putIfAbsent(SelectionKey key, String label) {
        return selections.putIfAbsent(key, label) == null;
    }

    /**
     * Forget the selection for a receive channel.
     *
     * @param key the device and receive channel
     *
     * @return the label that was recorded, or {@code null} if there was none
     */
    @API(status = API.Status.STABLE)
    public String clear(SelectionKey key) {
        return selections.remove(key);
    }

    /**
     * Get all recorded selections.
     *
     * @return an immutable copy of the selections at this moment
     */
    @API(status = API.Status.STABLE)
    public Map<SelectionKey, String> snapshot() {
        return Map.copyOf(selections);
    }

    /**
     * Check how many selections are recorded.
     *
     * @return the number of receive channels with a recorded selection
     */
    @API(status = API.Status.STABLE)
    public int size() {
        return selections.size();
    }

    @Override
    public String toString() {
        return "SourceSelections[size:" + selections.size() + "]";
    }
}
