package org.deepsymmetry.dantelink;

import org.apiguardian.api.API;
import org.slf4j.Logger;

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Provides the abstract skeleton for the dante-link components that can be started and stopped, and which other
 * code may need to watch so it knows when the data they publish stops being refreshed.
 */
@API(status = API.Status.STABLE)
public abstract class LifecycleParticipant {

    /**
     * Keeps track of the registered lifecycle listeners.
     */
    private final Set<LifecycleListener> lifecycleListeners = Collections.newSetFromMap(new ConcurrentHashMap<>());

    /**
     * <p>Adds the specified life cycle listener to receive announcements when the component starts and stops.
     * If {@code listener} is {@code null} or already present in the set of registered listeners, no exception
     * is thrown and no action is performed.</p>
     *
     * <p>Lifecycle announcements are delivered on their own thread, so that listeners can safely call back into the
     * component without worrying about the locks held by {@code start()} and {@code stop()}.</p>
     *
     * @param listener the lifecycle listener to add
     */
    @API(status = API.Status.STABLE)
    public void addLifecycleListener(LifecycleListener listener) {
        if (listener != null) {
            lifecycleListeners.add(listener);
        }
    }

    /**
     * Removes the specified life cycle listener so that it no longer receives announcements. If {@code listener}
     * is {@code null} or not registered, no exception is thrown and no action is performed.
     *
     * @param listener the life cycle listener to remove
     */
    @API(status = API.Status.STABLE)
    public void removeLifecycleListener(LifecycleListener listener) {
        if (listener != null) {
            lifecycleListeners.remove(listener);
        }
    }

    /**
     * Get the set of lifecycle listeners that are currently registered.
     *
     * @return an immutable snapshot of the currently registered lifecycle listeners
     */
    @API(status = API.Status.STABLE)
    public Set<LifecycleListener> getLifecycleListeners() {
        return Set.copyOf(lifecycleListeners);
    }

    /**
     * Tell all registered listeners that we have started or stopped.
     *
     * @param logger the logger of the subclass, so problems are reported as belonging to it
     * @param starting {@code true} when announcing a start, {@code false} for a stop
     */
    protected void deliverLifecycleAnnouncement(final Logger logger, final boolean starting) {
        final Set<LifecycleListener> listeners = getLifecycleListeners();
        if (listeners.isEmpty()) {
            return;
        }
        final Thread delivery = new Thread(() -> {
            for (final LifecycleListener listener : listeners) {
                try {
                    if (starting) {
                        listener.started(this);
                    } else {
                        listener.stopped(this);
                    }
                } catch (Throwable t) {
                    logger.warn("Problem delivering {} announcement to lifecycle listener", starting? "start" : "stop", t);
                }
            }
        }, "dante-link lifecycle delivery");
        delivery.setDaemon(true);
        delivery.start();
    }

    /**
     * Check whether this component has been started.
     *
     * @return {@code true} if the component is running and keeping its published state current
     */
    @API(status = API.Status.STABLE)
    abstract public boolean isRunning();
}
