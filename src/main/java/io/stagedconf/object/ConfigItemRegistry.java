package io.stagedconf.object;

import io.stagedconf.error.ConfigObjectException;
import io.stagedconf.object.model.ConfigItem;
import io.stagedconf.object.type.ObjectType;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Committed config items by type and full name.
 */
public final class ConfigItemRegistry {
    private final ConcurrentMap<String, ConcurrentMap<String, ConfigItem>> byType = new ConcurrentHashMap<>();

    void register(final ConfigItem item) throws ConfigObjectException {
        final ConfigItem existing = itemsOf(item.getType()).putIfAbsent(item.getFullName(), item);
        if (existing != null && existing != item) {
            throw ConfigObjectException.commit("An object with type '" + item.getType().getName()
                    + "' and name '" + item.getFullName() + "' already exists (" + existing.getDebugInfo() + ").");
        }
    }

    void unregister(final ConfigItem item) {
        final String fullName = item.getFullName();
        if (fullName == null) return;
        itemsOf(item.getType()).remove(fullName, item);
    }

    /**
     * Swaps {@code expected} for {@code replacement} under {@code fullName}; either may be null.
     *
     * @return false if the registered item is not {@code expected}
     */
    boolean replace(final ObjectType type,
                    final String fullName,
                    final ConfigItem expected,
                    final ConfigItem replacement) {
        final ConcurrentMap<String, ConfigItem> items = itemsOf(type);
        if (expected == null && replacement == null) return true;
        if (expected == null) return items.putIfAbsent(fullName, replacement) == null;
        if (replacement == null) return items.remove(fullName, expected);
        return items.replace(fullName, expected, replacement);
    }

    public Optional<ConfigItem> getByTypeAndName(final ObjectType type, final String fullName) {
        final ConcurrentMap<String, ConfigItem> items = byType.get(type.getName());
        return items == null ? Optional.empty() : Optional.ofNullable(items.get(fullName));
    }

    private ConcurrentMap<String, ConfigItem> itemsOf(final ObjectType type) {
        return byType.computeIfAbsent(type.getName(), t -> new ConcurrentHashMap<>());
    }
}
