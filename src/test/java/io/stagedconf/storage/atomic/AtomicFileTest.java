package io.stagedconf.storage.atomic;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

final class AtomicFileTest {

    @TempDir
    Path dir;

    @Test
    void targetOnlyAppearsOnCommit() throws Exception {
        final Path target = dir.resolve("host.conf");

        try (final AtomicFile fp = new AtomicFile(target)) {
            fp.write("object Host \"a\" {\n").write("}\n");
            fp.flush();

            assertFalse(Files.exists(target));
            assertTrue(Files.exists(fp.getTempFile()));

            fp.commit();
            assertTrue(fp.isCommitted());
            assertFalse(Files.exists(fp.getTempFile()));
        }

        assertEquals("object Host \"a\" {\n}\n", Files.readString(target, StandardCharsets.UTF_8));
    }

    @Test
    void closeWithoutCommitLeavesNothingBehind() throws Exception {
        final Path target = dir.resolve("host.conf");

        try (final AtomicFile fp = new AtomicFile(target)) {
            fp.write("partial");
            fp.flush();
        }

        assertFalse(Files.exists(target));
        try (final Stream<Path> files = Files.list(dir)) {
            assertEquals(0, files.count());
        }
    }

    @Test
    void commitReplacesExistingTarget() throws Exception {
        final Path target = dir.resolve("host.conf");
        Files.writeString(target, "old");

        try (final AtomicFile fp = new AtomicFile(target)) {
            fp.write("new");
            fp.commit();
        }

        assertEquals("new", Files.readString(target));
    }

    @Test
    void concurrentWritersUseDistinctTempFiles() throws Exception {
        final Path target = dir.resolve("host.conf");

        try (final AtomicFile a = new AtomicFile(target);
             final AtomicFile b = new AtomicFile(target)) {
            assertNotEquals(a.getTempFile(), b.getTempFile());

            a.write("a");
            b.write("b");
            b.commit();
        }

        assertEquals("b", Files.readString(target));
        try (final Stream<Path> files = Files.list(dir)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void writeAfterCommitFails() throws Exception {
        try (final AtomicFile fp = new AtomicFile(dir.resolve("x.conf"))) {
            fp.commit();
            assertThrows(IOException.class, () -> fp.write("late"));
        }
    }
}
