package io.stagedconf.cluster;

import java.util.Objects;

/**
 * Origin of a change. A change that arrived from a peer endpoint carries that endpoint so the
 * change is never sent back to it; locally originated changes carry {@link #local()}.
 * <p>
 * Opaque to the storage pipeline: it is forwarded, never interpreted.
 */
public final class MessageOrigin {
    private static final MessageOrigin LOCAL = new MessageOrigin(null);

    private final String endpoint;

    private MessageOrigin(final String endpoint) {
        this.endpoint = endpoint;
    }

    public static MessageOrigin local() {
        return LOCAL;
    }

    public static MessageOrigin fromEndpoint(final String endpoint) {
        Objects.requireNonNull(endpoint, "endpoint");
        return new MessageOrigin(endpoint);
    }

    public boolean isLocal() {
        return endpoint == null;
    }

    /**
     * True if the change came from {@code endpointName}.
     */
    public boolean isFrom(final String endpointName) {
        return endpoint != null && endpoint.equals(endpointName);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof MessageOrigin other)) return false;
        return Objects.equals(endpoint, other.endpoint);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(endpoint);
    }

    @Override
    public String toString() {
        return endpoint == null ? "local" : "endpoint:" + endpoint;
    }
}
