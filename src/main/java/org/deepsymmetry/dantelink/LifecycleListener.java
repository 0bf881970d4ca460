package org.deepsymmetry.dantelink;

import org.apiguardian.api.API;

/**
 * <p>The listener interface for receiving updates when a dante-link component is started or stopped.</p>
 *
 * <p>Classes that depend on the periodic refresh of a {@link DanteNetwork} can implement this interface so they
 * know to shut themselves down when it has stopped.</p>
 */
@API(status = API.Status.STABLE)
public interface LifecycleListener {

    /**
     * Called when the component has started up.
     *
     * @param sender the component reporting this event, in case you want to use a single listener to hear from all
     *               the components you depend on
     */
    @API(status = API.Status.STABLE)
    void started(LifecycleParticipant sender);

    /**
     * Called when the component has shut down.
     *
     * @param sender the component reporting this event, in case you want to use a single listener to hear from all
     *               the components you depend on
     */
    @API(status = API.Status.STABLE)
    void stopped(LifecycleParticipant sender);
}
