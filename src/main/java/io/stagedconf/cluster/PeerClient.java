package io.stagedconf.cluster;

import java.util.concurrent.CompletableFuture;

/**
 * Connection to one peer endpoint.
 */
public interface PeerClient {

    CompletableFuture<Void> sendUpdate(ObjectUpdate update);

    CompletableFuture<Void> sendDeletion(ObjectDeletion deletion);
}
