package io.stagedconf.cluster;

import java.util.Objects;

/**
 * Runtime object deleted on the sending endpoint.
 */
public record ObjectDeletion(String typeName, String fullName, double version) {
    public ObjectDeletion {
        Objects.requireNonNull(typeName, "typeName");
        Objects.requireNonNull(fullName, "fullName");
    }
}
