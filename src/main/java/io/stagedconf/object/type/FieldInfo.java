package io.stagedconf.object.type;

import java.util.Objects;

/**
 * Field metadata of an {@link ObjectType}.
 *
 * @param name          attribute name
 * @param config        settable from external configuration
 * @param required      must be present once templates are applied
 * @param referenceType name of the type this attribute points to by object name, or {@code null}
 */
public record FieldInfo(String name, boolean config, boolean required, String referenceType) {
    public FieldInfo {
        Objects.requireNonNull(name, "name");
        if (required && !config) {
            throw new IllegalArgumentException("required field '" + name + "' must be a config field");
        }
    }

    public boolean isReference() {
        return referenceType != null;
    }
}
