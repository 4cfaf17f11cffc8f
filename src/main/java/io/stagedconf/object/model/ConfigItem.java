package io.stagedconf.object.model;

import io.stagedconf.object.type.ObjectType;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiled representation of one object definition. Becomes a {@link ConfigObject} once
 * committed.
 */
@Getter
public final class ConfigItem {
    private final ObjectType type;
    private final String name;
    private final List<String> templates;
    private final Map<String, Object> attributes;
    private final String packageName;
    private final String zone;
    private final DebugInfo debugInfo;
    private final boolean ignoreOnError;

    private volatile String fullName;
    private volatile ConfigObject object;

    public ConfigItem(final ObjectType type,
                      final String name,
                      final List<String> templates,
                      final Map<String, Object> attributes,
                      final String packageName,
                      final String zone,
                      final DebugInfo debugInfo,
                      final boolean ignoreOnError) {
        this.type = type;
        this.name = name;
        this.templates = List.copyOf(templates);
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.packageName = packageName;
        this.zone = zone;
        this.debugInfo = debugInfo;
        this.ignoreOnError = ignoreOnError;
    }

    public void setFullName(final String fullName) {
        this.fullName = fullName;
    }

    public void setObject(final ConfigObject object) {
        this.object = object;
    }

    @Override
    public String toString() {
        return "object " + type.getName() + " '" + (fullName != null ? fullName : name) + "' (" + debugInfo + ")";
    }
}
