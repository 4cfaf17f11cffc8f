package io.stagedconf.object.type;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of known object types by name.
 */
public final class TypeRegistry {
    private final Map<String, ObjectType> types = new ConcurrentHashMap<>();

    public TypeRegistry register(final ObjectType type) {
        if (types.putIfAbsent(type.getName(), type) != null) {
            throw new IllegalArgumentException("Type '" + type.getName() + "' is already registered");
        }
        return this;
    }

    public Optional<ObjectType> getByName(final String name) {
        return Optional.ofNullable(types.get(name));
    }

    public Collection<ObjectType> getTypes() {
        return Collections.unmodifiableCollection(types.values());
    }
}
