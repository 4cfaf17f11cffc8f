package io.stagedconf.object.event;

import io.stagedconf.cluster.MessageOrigin;
import io.stagedconf.object.model.ConfigObject;

/**
 * Receives object lifecycle signals. A listener that throws fails the activation or
 * deactivation that triggered it.
 */
public interface ObjectListener {

    default void onActivated(final ConfigObject object, final boolean runtimeCreated, final MessageOrigin origin) {
    }

    default void onDeactivated(final ConfigObject object, final boolean runtimeRemoved, final MessageOrigin origin) {
    }
}
