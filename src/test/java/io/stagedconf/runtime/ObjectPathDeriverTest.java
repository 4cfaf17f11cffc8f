package io.stagedconf.runtime;

import io.stagedconf.error.ConfigObjectException;
import io.stagedconf.error.ErrorKind;
import io.stagedconf.object.type.MonitoringTypes;
import io.stagedconf.object.type.ObjectType;
import io.stagedconf.object.type.TypeRegistry;
import io.stagedconf.storage.RuntimeObjectStorage;
import io.stagedconf.storage.pkg.impl.FileConfigPackageStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

final class ObjectPathDeriverTest {

    @TempDir
    Path packagesDir;

    private RuntimeObjectStorage storage;
    private ObjectPathDeriver deriver;
    private TypeRegistry types;

    @BeforeEach
    void setUp() throws Exception {
        storage = new RuntimeObjectStorage(new FileConfigPackageStore(packagesDir, "node-1"));
        storage.ensureStorage();
        deriver = new ObjectPathDeriver(storage);
        types = MonitoringTypes.createRegistry();
    }

    private ObjectType type(final String name) {
        return types.getByName(name).orElseThrow();
    }

    @Test
    void pathFollowsPackageLayout() throws Exception {
        final Path path = deriver.computeNewObjectConfigPath(type("Host"), "web01");

        assertEquals(storage.getConfigDir().resolve("conf.d").resolve("hosts").resolve("web01.conf"), path);
    }

    @Test
    void compositeNamesKeepSeparator() throws Exception {
        final Path path = deriver.computeNewObjectConfigPath(type("Service"), "web01!http");

        assertEquals("web01!http.conf", path.getFileName().toString());
        assertEquals("services", path.getParent().getFileName().toString());
    }

    @Test
    void illegalCharactersAreEscapedReversibly() {
        final String name = "a/b:c%d<e>\"f\\g|h?i*j";
        final String escaped = ObjectPathDeriver.escapeName(name);

        assertEquals("a%2Fb%3Ac%25d%3Ce%3E%22f%5Cg%7Ch%3Fi%2Aj", escaped);
        assertEquals(name, ObjectPathDeriver.unescapeName(escaped));
    }

    @Test
    void escapedNameDoesNotCollideWithLiteralPercent() {
        assertNotEquals(ObjectPathDeriver.escapeName("a/b"), ObjectPathDeriver.escapeName("a%2Fb"));
        assertEquals("a%2Fb", ObjectPathDeriver.unescapeName(ObjectPathDeriver.escapeName("a%2Fb")));
    }

    @Test
    void longCommentNamesAreHashed() throws Exception {
        final String name = "web01!" + "c".repeat(200);

        final Path first = deriver.computeNewObjectConfigPath(type("Comment"), name);
        final Path second = deriver.computeNewObjectConfigPath(type("Comment"), name);

        final String fileName = first.getFileName().toString();
        assertEquals(first, second);
        assertEquals(80 + 3 + 40 + ".conf".length(), fileName.length());
        assertTrue(fileName.startsWith(name.substring(0, 80) + "..."));
        assertEquals("comments", first.getParent().getFileName().toString());
    }

    @Test
    void differentLongDowntimeNamesDoNotCollide() throws Exception {
        final String prefix = "web01!" + "d".repeat(150);

        final Path a = deriver.computeNewObjectConfigPath(type("Downtime"), prefix + "a");
        final Path b = deriver.computeNewObjectConfigPath(type("Downtime"), prefix + "b");

        assertNotEquals(a, b);
    }

    @Test
    void shortCommentNamesAreUnchanged() throws Exception {
        final Path path = deriver.computeNewObjectConfigPath(type("Comment"), "web01!c1");

        assertEquals("web01!c1.conf", path.getFileName().toString());
    }

    @Test
    void hashedPrefixNeverSplitsCharacters() {
        final String name = "a" + "é".repeat(100);

        final String hashed = ObjectPathDeriver.truncateUsingHash(name);
        final String prefix = hashed.substring(0, hashed.indexOf("..."));

        assertEquals(40, prefix.length());
        assertEquals(79, prefix.getBytes(StandardCharsets.UTF_8).length);
    }

    @Test
    void overlongNamesOfOtherTypesFail() throws Exception {
        assertNotNull(deriver.computeNewObjectConfigPath(type("Host"), "h".repeat(250)));

        final ConfigObjectException e = assertThrows(ConfigObjectException.class,
                () -> deriver.computeNewObjectConfigPath(type("Host"), "h".repeat(251)));
        assertEquals(ErrorKind.PATH, e.getKind());
    }

    @Test
    void escapingCountsTowardsTheLimit() {
        final ConfigObjectException e = assertThrows(ConfigObjectException.class,
                () -> deriver.computeNewObjectConfigPath(type("Host"), "/".repeat(84)));
        assertEquals(ErrorKind.PATH, e.getKind());
    }
}
