package io.stagedconf.object.model;

import io.stagedconf.cluster.MessageOrigin;
import io.stagedconf.error.ConfigObjectException;
import io.stagedconf.error.ErrorKind;
import io.stagedconf.object.ObjectRuntime;
import io.stagedconf.object.type.ObjectType;
import io.stagedconf.object.type.Registrable;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live, registered instance of an {@link ObjectType}.
 */
public final class ConfigObject {
    /**
     * Extension set on objects that are being deleted, read by replication listeners.
     */
    public static final String DELETED_EXTENSION = "ConfigObjectDeleted";

    private final ObjectRuntime runtime;
    @Getter
    private final ObjectType type;
    /* Full name, e.g. host!service */
    @Getter
    private final String name;
    @Getter
    private final String shortName;
    @Getter
    private final String packageName;
    @Getter
    private final DebugInfo debugInfo;
    private final Map<String, Object> attributes;
    private final Map<String, Object> extensions = new ConcurrentHashMap<>();
    private volatile boolean active;

    public ConfigObject(final ObjectRuntime runtime,
                        final ObjectType type,
                        final String name,
                        final String shortName,
                        final String packageName,
                        final DebugInfo debugInfo,
                        final Map<String, Object> attributes) {
        this.runtime = runtime;
        this.type = type;
        this.name = name;
        this.shortName = shortName;
        this.packageName = packageName;
        this.debugInfo = debugInfo;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public Object getAttribute(final String key) {
        return attributes.get(key);
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    /**
     * Config sync version in seconds, 0 if unset.
     */
    public double getVersion() {
        final Object v = attributes.get("version");
        return v instanceof Number n ? n.doubleValue() : 0d;
    }

    public String getZone() {
        final Object zone = attributes.get("zone");
        return zone == null ? null : zone.toString();
    }

    public void setExtension(final String key, final Object value) {
        extensions.put(key, value);
    }

    public Object getExtension(final String key) {
        return extensions.get(key);
    }

    public boolean isActive() {
        return active;
    }

    /**
     * Marks the object active and notifies listeners, forwarding {@code origin}.
     * <p>
     * If a listener fails the object stays active: listeners notified before it have seen the
     * activation, and {@link #deactivate} is what tells them it is gone again.
     */
    public void activate(final boolean runtimeCreated, final MessageOrigin origin) throws ConfigObjectException {
        synchronized (this) {
            if (active) {
                throw new ConfigObjectException(ErrorKind.ACTIVATION, "Object '" + name + "' of type '"
                        + type.getName() + "' is already active.");
            }
            active = true;
        }

        try {
            runtime.getEvents().fireActivated(this, runtimeCreated, origin);
        } catch (final RuntimeException e) {
            throw new ConfigObjectException(ErrorKind.ACTIVATION, "Activation of object '" + name + "' of type '"
                    + type.getName() + "' failed: " + e.getMessage(), e);
        }
    }

    /**
     * Marks the object inactive and notifies listeners, forwarding {@code origin}.
     * No-op for inactive objects.
     */
    public void deactivate(final boolean runtimeRemoved, final MessageOrigin origin) throws ConfigObjectException {
        synchronized (this) {
            if (!active) return;
            active = false;
        }

        try {
            runtime.getEvents().fireDeactivated(this, runtimeRemoved, origin);
        } catch (final RuntimeException e) {
            throw new ConfigObjectException(ErrorKind.ACTIVATION, "Deactivation of object '" + name + "' of type '"
                    + type.getName() + "' failed: " + e.getMessage(), e);
        }
    }

    /**
     * Removes the object from its type registry and from the dependency graph.
     */
    public void unregister() {
        active = false;
        if (type instanceof Registrable registrable) {
            registrable.unregisterObject(this);
        }
        runtime.getDependencyGraph().removeObject(this);
    }

    @Override
    public String toString() {
        return type.getName() + " '" + name + "'";
    }
}
