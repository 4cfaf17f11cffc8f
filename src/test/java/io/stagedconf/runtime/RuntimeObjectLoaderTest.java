package io.stagedconf.runtime;

import io.stagedconf.cluster.MessageOrigin;
import io.stagedconf.error.Diagnostics;
import io.stagedconf.object.event.ObjectListener;
import io.stagedconf.object.model.ConfigObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static io.stagedconf.storage.RuntimeObjectStorage.API_PACKAGE;
import static org.junit.jupiter.api.Assertions.*;

final class RuntimeObjectLoaderTest {

    @TempDir
    Path packagesDir;

    @Test
    void reloadsPersistedObjects() throws Exception {
        try (final NodeFixture first = new NodeFixture(packagesDir)) {
            final Diagnostics diagnostics = new Diagnostics();
            assertTrue(first.create("Host", "web01", Map.of("address", "10.0.0.1"), diagnostics));
            assertTrue(first.create("Service", "web01!http", Map.of("check_command", "http"), diagnostics));
            assertTrue(first.create("Comment", "web01!http!c1", Map.of("author", "ops", "text", "hi"), diagnostics),
                    diagnostics::toString);
        }

        try (final NodeFixture restarted = new NodeFixture(packagesDir)) {
            final AtomicInteger runtimeCreated = new AtomicInteger();
            restarted.runtime.getEvents().addListener(new ObjectListener() {
                @Override
                public void onActivated(final ConfigObject object, final boolean created, final MessageOrigin origin) {
                    if (created) runtimeCreated.incrementAndGet();
                }
            });

            final Diagnostics diagnostics = new Diagnostics();
            final RuntimeObjectLoader loader = new RuntimeObjectLoader(restarted.storage, restarted.compiler,
                    restarted.runtime, restarted.workQueue);

            assertEquals(3, loader.loadAll(diagnostics));
            assertTrue(diagnostics.isEmpty(), diagnostics::toString);
            assertEquals(0, runtimeCreated.get());

            final ConfigObject service = restarted.object("Service", "web01!http").orElseThrow();
            assertTrue(service.isActive());
            assertEquals(API_PACKAGE, service.getPackageName());
            assertEquals(restarted.configPath("Service", "web01!http"),
                    RuntimeObjectManager.getExistingObjectConfigPath(service));
            assertEquals(2, restarted.runtime.getDependencyGraph()
                    .getParents(restarted.object("Host", "web01").orElseThrow()).size());

            final Diagnostics deleted = new Diagnostics();
            assertTrue(restarted.manager.deleteObject(restarted.object("Host", "web01").orElseThrow(), true, deleted,
                    MessageOrigin.local()), deleted::toString);
            assertFalse(Files.exists(restarted.configPath("Host", "web01")));
            assertTrue(restarted.object("Comment", "web01!http!c1").isEmpty());
        }
    }

    @Test
    void brokenFilesDoNotStopTheRest() throws Exception {
        try (final NodeFixture first = new NodeFixture(packagesDir)) {
            assertTrue(first.create("Host", "web01", Map.of(), new Diagnostics()));
            Files.writeString(first.configPath("Host", "broken"), "object Host \"broken\" {\n");
        }

        try (final NodeFixture restarted = new NodeFixture(packagesDir)) {
            final Diagnostics diagnostics = new Diagnostics();
            final RuntimeObjectLoader loader = new RuntimeObjectLoader(restarted.storage, restarted.compiler,
                    restarted.runtime, restarted.workQueue);

            assertEquals(1, loader.loadAll(diagnostics));
            assertFalse(diagnostics.isEmpty());
            assertTrue(restarted.object("Host", "web01").isPresent());
        }
    }

    @Test
    void nothingToLoadWithoutPackage() {
        try (final NodeFixture node = new NodeFixture(packagesDir)) {
            final RuntimeObjectLoader loader = new RuntimeObjectLoader(node.storage, node.compiler, node.runtime,
                    node.workQueue);

            assertEquals(0, loader.loadAll(new Diagnostics()));
        }
    }
}
