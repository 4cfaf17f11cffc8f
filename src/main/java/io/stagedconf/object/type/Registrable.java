package io.stagedconf.object.type;

import io.stagedconf.error.ConfigObjectException;
import io.stagedconf.object.model.ConfigObject;

import java.util.Collection;
import java.util.Optional;

/**
 * Capability of types that keep a registry of their live objects.
 */
public interface Registrable {

    Optional<ConfigObject> getObject(String fullName);

    Collection<ConfigObject> getObjects();

    /**
     * Registers the object unless another object with the same name is already registered.
     *
     * @throws ConfigObjectException with kind COMMIT on a name conflict
     */
    void registerObject(ConfigObject object) throws ConfigObjectException;

    /**
     * Removes exactly this instance; a different object registered under the same name stays.
     */
    void unregisterObject(ConfigObject object);

    /**
     * Puts {@code replacement} under the name of {@code current}.
     *
     * @return false if {@code current} is no longer the registered object
     */
    boolean replaceObject(ConfigObject current, ConfigObject replacement);
}
