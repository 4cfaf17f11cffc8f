package io.stagedconf.cluster;

import io.stagedconf.compiler.ConfigWriter;
import io.stagedconf.error.Diagnostics;
import io.stagedconf.error.ErrorKind;
import io.stagedconf.object.event.ObjectListener;
import io.stagedconf.object.model.ConfigObject;
import io.stagedconf.object.type.ObjectType;
import io.stagedconf.runtime.RuntimeObjectManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;

import static io.stagedconf.storage.RuntimeObjectStorage.API_PACKAGE;

/**
 * Sends runtime object creations and deletions to peer endpoints and applies the ones
 * received from peers.
 * <p>
 * A change is never sent to the local endpoint nor back to the endpoint it originated from.
 * Received changes are applied with their sender as origin, so applying them does not echo.
 * For updates the highest {@code version} wins.
 */
@Slf4j
@RequiredArgsConstructor
public final class ClusterObjectReplicator implements ObjectListener {
    private static final long SEND_TIMEOUT_SECONDS = 5;

    private final String localEndpoint;
    private final Map<String, PeerClient> peers;
    private final Supplier<Collection<String>> clusterView;
    private final RuntimeObjectManager manager;

    @Override
    public void onActivated(final ConfigObject object, final boolean runtimeCreated, final MessageOrigin origin) {
        if (!runtimeCreated || !API_PACKAGE.equals(object.getPackageName())) return;

        final ObjectUpdate update = new ObjectUpdate(object.getType().getName(), object.getName(),
                object.getVersion(), serialize(object));
        broadcast(origin, "update of " + object, peer -> peer.sendUpdate(update));
    }

    @Override
    public void onDeactivated(final ConfigObject object, final boolean runtimeRemoved, final MessageOrigin origin) {
        if (!runtimeRemoved || !Boolean.TRUE.equals(object.getExtension(ConfigObject.DELETED_EXTENSION))) return;

        final ObjectDeletion deletion = new ObjectDeletion(object.getType().getName(), object.getName(),
                object.getVersion());
        broadcast(origin, "deletion of " + object, peer -> peer.sendDeletion(deletion));
    }

    /**
     * Creates the object sent by a peer unless an object with the same or a newer version exists.
     * An older runtime object is replaced in place, keeping the objects that depend on it; a
     * rejected update leaves it untouched.
     */
    public boolean applyRemoteUpdate(final ObjectUpdate update, final MessageOrigin origin, final Diagnostics diagnostics) {
        final Optional<ObjectType> type = manager.getRuntime().getTypes().getByName(update.typeName());
        if (type.isEmpty()) {
            diagnostics.addError(ErrorKind.VALIDATION, "Unknown type '" + update.typeName() + "' in update from " + origin);
            return false;
        }

        final Optional<ConfigObject> existing = manager.getRuntime().getObject(type.get(), update.fullName());
        if (existing.isPresent()) {
            final ConfigObject current = existing.get();
            if (current.getVersion() >= update.version()) {
                log.debug("Ignoring update of {} from {}: local version {} >= {}",
                        current, origin, current.getVersion(), update.version());
                return true;
            }

            return manager.replaceObject(current, update.config(), diagnostics, origin);
        }

        return manager.createObject(type.get(), update.fullName(), update.config(), diagnostics, origin);
    }

    /**
     * Deletes the object a peer deleted, together with everything depending on it.
     */
    public boolean applyRemoteDeletion(final ObjectDeletion deletion, final MessageOrigin origin, final Diagnostics diagnostics) {
        final Optional<ObjectType> type = manager.getRuntime().getTypes().getByName(deletion.typeName());
        if (type.isEmpty()) {
            diagnostics.addError(ErrorKind.VALIDATION, "Unknown type '" + deletion.typeName() + "' in deletion from " + origin);
            return false;
        }

        final Optional<ConfigObject> existing = manager.getRuntime().getObject(type.get(), deletion.fullName());
        if (existing.isEmpty()) {
            log.debug("Ignoring deletion of unknown {} '{}' from {}", deletion.typeName(), deletion.fullName(), origin);
            return true;
        }

        return manager.deleteObject(existing.get(), true, diagnostics, origin);
    }

    private void broadcast(final MessageOrigin origin,
                           final String what,
                           final Function<PeerClient, CompletableFuture<Void>> send) {
        for (final String endpoint : clusterView.get()) {
            if (endpoint.equals(localEndpoint)) continue;

            if (origin.isFrom(endpoint)) {
                log.debug("Not sending {} back to its origin {}", what, endpoint);
                continue;
            }

            final PeerClient client = peers.get(endpoint);
            if (client == null) continue;

            try {
                send.apply(client)
                        .orTimeout(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                        .exceptionally(ex -> {
                            log.debug("Sending {} to {} failed: {}", what, endpoint, ex.toString());
                            return null;
                        });
            } catch (final RuntimeException e) {
                log.debug("Sending {} to {} failed: {}", what, endpoint, e.toString());
            }
        }
    }

    private static String serialize(final ConfigObject object) {
        final StringBuilder sb = new StringBuilder();
        ConfigWriter.emitConfigItem(sb, object.getType().getName(), object.getShortName(), false, List.of(),
                object.getAttributes());
        sb.append('\n');
        return sb.toString();
    }
}
