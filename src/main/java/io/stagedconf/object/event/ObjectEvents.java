package io.stagedconf.object.event;

import io.stagedconf.cluster.MessageOrigin;
import io.stagedconf.object.model.ConfigObject;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public final class ObjectEvents {
    private final List<ObjectListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(final ObjectListener listener) {
        listeners.add(listener);
    }

    public void removeListener(final ObjectListener listener) {
        listeners.remove(listener);
    }

    public void fireActivated(final ConfigObject object, final boolean runtimeCreated, final MessageOrigin origin) {
        for (final ObjectListener l : listeners) {
            l.onActivated(object, runtimeCreated, origin);
        }
    }

    public void fireDeactivated(final ConfigObject object, final boolean runtimeRemoved, final MessageOrigin origin) {
        for (final ObjectListener l : listeners) {
            l.onDeactivated(object, runtimeRemoved, origin);
        }
    }
}
