package io.stagedconf.cluster;

import java.util.Objects;

/**
 * Runtime object created on the sending endpoint.
 *
 * @param config serialized object, including its {@code version}
 */
public record ObjectUpdate(String typeName, String fullName, double version, String config) {
    public ObjectUpdate {
        Objects.requireNonNull(typeName, "typeName");
        Objects.requireNonNull(fullName, "fullName");
        Objects.requireNonNull(config, "config");
    }
}
