package io.stagedconf.storage.pkg.impl;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class FileConfigPackageStoreTest {

    @TempDir
    Path packagesDir;

    private FileConfigPackageStore store() {
        return new FileConfigPackageStore(packagesDir, "node-1",
                Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC));
    }

    @Test
    void createAndActivateStage() throws Exception {
        final FileConfigPackageStore store = store();
        assertFalse(store.packageExists("_api"));

        store.createPackage("_api");
        assertTrue(store.packageExists("_api"));
        assertEquals(Optional.empty(), store.getActiveStage("_api"));

        final String stage = store.createStage("_api");
        assertTrue(stage.startsWith("node-1-1700000000-"));
        assertTrue(Files.isDirectory(packagesDir.resolve("_api").resolve(stage).resolve(FileConfigPackageStore.CONF_DIR)));

        store.activateStage("_api", stage);
        assertEquals(Optional.of(stage), store.getActiveStage("_api"));
        assertEquals(stage + "\n", Files.readString(packagesDir.resolve("_api").resolve(FileConfigPackageStore.ACTIVE_STAGE_FILE)));
    }

    @Test
    void stagesAreUnique() throws Exception {
        final FileConfigPackageStore store = store();
        store.createPackage("_api");

        final String a = store.createStage("_api");
        final String b = store.createStage("_api");

        assertNotEquals(a, b);
        assertEquals(List.of(a, b).stream().sorted().toList(), store.listStages("_api"));
    }

    @Test
    void activatingMissingStageFails() throws Exception {
        final FileConfigPackageStore store = store();
        store.createPackage("_api");

        assertThrows(IOException.class, () -> store.activateStage("_api", "nope"));
        assertEquals(Optional.empty(), store.getActiveStage("_api"));
    }

    @Test
    void rejectsPathLikeNames() {
        final FileConfigPackageStore store = store();

        assertThrows(IllegalArgumentException.class, () -> store.createPackage("../outside"));
        assertThrows(IllegalArgumentException.class, () -> store.activateStage("_api", ".."));
    }

    @Test
    void listsPackages() throws Exception {
        final FileConfigPackageStore store = store();
        store.createPackage("b");
        store.createPackage("a");
        Files.writeString(packagesDir.resolve("not-a-package"), "x");

        assertEquals(List.of("a", "b"), store.listPackages());
    }
}
