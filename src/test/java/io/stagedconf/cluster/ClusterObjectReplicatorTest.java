package io.stagedconf.cluster;

import io.stagedconf.error.Diagnostics;
import io.stagedconf.error.ErrorKind;
import io.stagedconf.object.model.ConfigObject;
import io.stagedconf.runtime.NodeFixture;
import io.stagedconf.runtime.ObjectConfigSerializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;

import static org.junit.jupiter.api.Assertions.*;

final class ClusterObjectReplicatorTest {

    private static final String LOCAL = "master-1";
    private static final String PEER_A = "master-2";
    private static final String PEER_B = "satellite-1";

    private static final class CapturingClient implements PeerClient {
        final ConcurrentLinkedQueue<ObjectUpdate> updates = new ConcurrentLinkedQueue<>();
        final ConcurrentLinkedQueue<ObjectDeletion> deletions = new ConcurrentLinkedQueue<>();

        @Override
        public CompletableFuture<Void> sendUpdate(final ObjectUpdate update) {
            updates.add(update);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletableFuture<Void> sendDeletion(final ObjectDeletion deletion) {
            deletions.add(deletion);
            return CompletableFuture.completedFuture(null);
        }
    }

    private static final class FailingClient implements PeerClient {
        @Override
        public CompletableFuture<Void> sendUpdate(final ObjectUpdate update) {
            throw new IllegalStateException("connection refused");
        }

        @Override
        public CompletableFuture<Void> sendDeletion(final ObjectDeletion deletion) {
            return CompletableFuture.failedFuture(new IllegalStateException("connection reset"));
        }
    }

    @TempDir
    Path packagesDir;

    private NodeFixture node;
    private CapturingClient local;
    private CapturingClient peerA;
    private CapturingClient peerB;
    private ClusterObjectReplicator replicator;

    @BeforeEach
    void setUp() {
        node = new NodeFixture(packagesDir, Clock.fixed(Instant.ofEpochSecond(1_000), ZoneOffset.UTC));
        local = new CapturingClient();
        peerA = new CapturingClient();
        peerB = new CapturingClient();
        replicator = new ClusterObjectReplicator(LOCAL, Map.of(LOCAL, local, PEER_A, peerA, PEER_B, peerB),
                () -> List.of(LOCAL, PEER_A, PEER_B), node.manager);
        node.runtime.getEvents().addListener(replicator);
    }

    @AfterEach
    void tearDown() {
        node.close();
    }

    private static String remoteConfig(final NodeFixture node, final long epochSeconds, final Map<String, Object> attrs)
            throws Exception {
        return new ObjectConfigSerializer(Clock.fixed(Instant.ofEpochSecond(epochSeconds), ZoneOffset.UTC))
                .createObjectConfig(node.type("Host"), "web01", false, List.of(), attrs);
    }

    @Test
    void localCreateIsSentToEveryPeer() throws Exception {
        assertTrue(node.create("Host", "web01", Map.of("address", "10.0.0.1"), new Diagnostics()));

        assertTrue(local.updates.isEmpty());
        assertEquals(1, peerA.updates.size());
        assertEquals(1, peerB.updates.size());

        final ObjectUpdate update = peerA.updates.peek();
        assertEquals("Host", update.typeName());
        assertEquals("web01", update.fullName());
        assertEquals(1000d, update.version());
        assertTrue(update.config().contains("address = \"10.0.0.1\""));
    }

    @Test
    void changeIsNotEchoedToItsOrigin() throws Exception {
        final String config = node.config("Host", "web01", Map.of());

        assertTrue(node.manager.createObject(node.type("Host"), "web01", config, new Diagnostics(),
                MessageOrigin.fromEndpoint(PEER_A)));

        assertTrue(peerA.updates.isEmpty());
        assertEquals(1, peerB.updates.size());

        final ConfigObject host = node.object("Host", "web01").orElseThrow();
        assertTrue(node.manager.deleteObject(host, false, new Diagnostics(), MessageOrigin.fromEndpoint(PEER_B)));

        assertEquals(1, peerA.deletions.size());
        assertTrue(peerB.deletions.isEmpty());
        assertTrue(local.deletions.isEmpty());
    }

    @Test
    void updateReceivedFromPeerIsApplied() throws Exception {
        final Diagnostics diagnostics = new Diagnostics();
        final ObjectUpdate update = new ObjectUpdate("Host", "web01", 2000d,
                remoteConfig(node, 2000, Map.of("address", "10.0.0.9")));

        assertTrue(replicator.applyRemoteUpdate(update, MessageOrigin.fromEndpoint(PEER_A), diagnostics),
                diagnostics::toString);

        final ConfigObject host = node.object("Host", "web01").orElseThrow();
        assertEquals("10.0.0.9", host.getAttribute("address"));
        assertEquals(2000d, host.getVersion());
        assertTrue(Files.exists(node.configPath("Host", "web01")));
        assertTrue(peerA.updates.isEmpty());
        assertEquals(1, peerB.updates.size());
    }

    @Test
    void olderUpdateIsIgnored() throws Exception {
        assertTrue(node.create("Host", "web01", Map.of("address", "10.0.0.1"), new Diagnostics()));
        final ConfigObject before = node.object("Host", "web01").orElseThrow();

        final ObjectUpdate stale = new ObjectUpdate("Host", "web01", 500d,
                remoteConfig(node, 500, Map.of("address", "10.0.0.9")));

        assertTrue(replicator.applyRemoteUpdate(stale, MessageOrigin.fromEndpoint(PEER_A), new Diagnostics()));
        assertSame(before, node.object("Host", "web01").orElseThrow());
        assertEquals("10.0.0.1", before.getAttribute("address"));
    }

    @Test
    void newerUpdateReplacesObject() throws Exception {
        assertTrue(node.create("Host", "web01", Map.of("address", "10.0.0.1"), new Diagnostics()));

        final Diagnostics diagnostics = new Diagnostics();
        final ObjectUpdate newer = new ObjectUpdate("Host", "web01", 3000d,
                remoteConfig(node, 3000, Map.of("address", "10.0.0.9")));

        assertTrue(replicator.applyRemoteUpdate(newer, MessageOrigin.fromEndpoint(PEER_A), diagnostics),
                diagnostics::toString);

        final ConfigObject host = node.object("Host", "web01").orElseThrow();
        assertEquals("10.0.0.9", host.getAttribute("address"));
        assertEquals(3000d, host.getVersion());
    }

    @Test
    void rejectedUpdateKeepsCurrentObjectAndFile() throws Exception {
        assertTrue(node.create("Host", "web01", Map.of("address", "10.0.0.1"), new Diagnostics()));
        final ConfigObject before = node.object("Host", "web01").orElseThrow();
        final Path file = node.configPath("Host", "web01");
        final String content = Files.readString(file);

        final Diagnostics diagnostics = new Diagnostics();
        final ObjectUpdate invalid = new ObjectUpdate("Host", "web01", 3000d,
                "object Host \"web01\" {\n\tstate = 1\n\tversion = 3000\n}\n");

        assertFalse(replicator.applyRemoteUpdate(invalid, MessageOrigin.fromEndpoint(PEER_A), diagnostics));

        assertTrue(diagnostics.has(ErrorKind.VALIDATION));
        assertSame(before, node.object("Host", "web01").orElseThrow());
        assertTrue(before.isActive());
        assertEquals(content, Files.readString(file));
        assertTrue(peerA.deletions.isEmpty());
        assertTrue(peerB.deletions.isEmpty());
        assertEquals(1, peerB.updates.size());
    }

    @Test
    void updateDeclaringAnotherObjectIsRejected() throws Exception {
        assertTrue(node.create("Host", "web01", Map.of(), new Diagnostics()));
        final ConfigObject before = node.object("Host", "web01").orElseThrow();

        final Diagnostics diagnostics = new Diagnostics();
        final ObjectUpdate renamed = new ObjectUpdate("Host", "web01", 3000d,
                "object Host \"web02\" {\n\tversion = 3000\n}\n");

        assertFalse(replicator.applyRemoteUpdate(renamed, MessageOrigin.fromEndpoint(PEER_A), diagnostics));

        assertTrue(diagnostics.has(ErrorKind.COMMIT));
        assertSame(before, node.object("Host", "web01").orElseThrow());
        assertTrue(node.object("Host", "web02").isEmpty());
    }

    @Test
    void newerUpdateKeepsDependents() throws Exception {
        final Diagnostics created = new Diagnostics();
        assertTrue(node.create("Host", "web01", Map.of("address", "10.0.0.1"), created));
        assertTrue(node.create("Service", "web01!http", Map.of("check_command", "http"), created), created::toString);
        final ConfigObject service = node.object("Service", "web01!http").orElseThrow();

        final Diagnostics diagnostics = new Diagnostics();
        final ObjectUpdate newer = new ObjectUpdate("Host", "web01", 3000d,
                remoteConfig(node, 3000, Map.of("address", "10.0.0.9")));

        assertTrue(replicator.applyRemoteUpdate(newer, MessageOrigin.fromEndpoint(PEER_A), diagnostics),
                diagnostics::toString);

        final ConfigObject host = node.object("Host", "web01").orElseThrow();
        assertEquals("10.0.0.9", host.getAttribute("address"));
        assertTrue(host.isActive());
        assertSame(service, node.object("Service", "web01!http").orElseThrow());
        assertTrue(service.isActive());
        assertEquals(List.of(service), node.runtime.getDependencyGraph().getParents(host));
        assertTrue(Files.readString(node.configPath("Host", "web01")).contains("10.0.0.9"));
        assertTrue(Files.exists(node.configPath("Service", "web01!http")));
        assertTrue(peerA.deletions.isEmpty());
        assertTrue(peerB.deletions.isEmpty());
        assertEquals(3, peerB.updates.size());
        assertEquals(2, peerA.updates.size());

        final Diagnostics blocked = new Diagnostics();
        assertFalse(node.manager.deleteObject(host, false, blocked, MessageOrigin.local()));
        assertTrue(blocked.has(ErrorKind.POLICY));
    }

    @Test
    void rolledBackCreateIsWithdrawnFromPeers() throws Exception {
        try (final NodeFixture failing = new NodeFixture(packagesDir.resolve("failing"), Clock.systemUTC(), () -> {
            throw new IllegalStateException("authority unavailable");
        })) {
            final CapturingClient peer = new CapturingClient();
            failing.runtime.getEvents().addListener(new ClusterObjectReplicator(LOCAL, Map.of(PEER_A, peer),
                    () -> List.of(LOCAL, PEER_A), failing.manager));

            final Diagnostics diagnostics = new Diagnostics();
            assertFalse(failing.create("Host", "web01", Map.of(), diagnostics));

            assertTrue(failing.object("Host", "web01").isEmpty());
            assertFalse(Files.exists(failing.configPath("Host", "web01")));
            assertEquals(1, peer.updates.size());
            assertEquals(1, peer.deletions.size());
            assertEquals("web01", peer.deletions.peek().fullName());
        }
    }

    @Test
    void updateForUnknownTypeIsRejected() {
        final Diagnostics diagnostics = new Diagnostics();

        assertFalse(replicator.applyRemoteUpdate(new ObjectUpdate("Satellite", "x", 1d, "object Satellite \"x\" {}"),
                MessageOrigin.fromEndpoint(PEER_A), diagnostics));
        assertTrue(diagnostics.has(ErrorKind.VALIDATION));
    }

    @Test
    void deletionReceivedFromPeerCascades() throws Exception {
        final Diagnostics created = new Diagnostics();
        assertTrue(node.create("Host", "web01", Map.of(), created));
        assertTrue(node.create("Service", "web01!http", Map.of("check_command", "http"), created));

        final Diagnostics diagnostics = new Diagnostics();
        assertTrue(replicator.applyRemoteDeletion(new ObjectDeletion("Host", "web01", 1000d),
                MessageOrigin.fromEndpoint(PEER_B), diagnostics), diagnostics::toString);

        assertTrue(node.object("Host", "web01").isEmpty());
        assertTrue(node.object("Service", "web01!http").isEmpty());
        assertEquals(2, peerA.deletions.size());
        assertTrue(peerB.deletions.isEmpty());
    }

    @Test
    void deletionOfUnknownObjectIsANoOp() {
        assertTrue(replicator.applyRemoteDeletion(new ObjectDeletion("Host", "ghost", 1d),
                MessageOrigin.fromEndpoint(PEER_A), new Diagnostics()));
    }

    @Test
    void failingPeerDoesNotFailTheChange() throws Exception {
        final ClusterObjectReplicator flaky = new ClusterObjectReplicator(LOCAL, Map.of(PEER_A, new FailingClient()),
                () -> List.of(LOCAL, PEER_A), node.manager);
        node.runtime.getEvents().removeListener(replicator);
        node.runtime.getEvents().addListener(flaky);

        final Diagnostics diagnostics = new Diagnostics();
        assertTrue(node.create("Host", "web01", Map.of(), diagnostics), diagnostics::toString);
        assertTrue(node.manager.deleteObject(node.object("Host", "web01").orElseThrow(), false, diagnostics,
                MessageOrigin.local()), diagnostics::toString);
    }
}
