package io.stagedconf.storage.pkg.impl;

import io.stagedconf.storage.atomic.AtomicFile;
import io.stagedconf.storage.pkg.ConfigPackageStore;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Directory-backed package store.
 * <pre>
 * &lt;packagesDir&gt;/&lt;package&gt;/active-stage      pointer file, one line
 * &lt;packagesDir&gt;/&lt;package&gt;/&lt;stage&gt;/conf.d/ object files
 * </pre>
 */
@Slf4j
public final class FileConfigPackageStore implements ConfigPackageStore {
    public static final String ACTIVE_STAGE_FILE = "active-stage";
    public static final String CONF_DIR = "conf.d";

    @Getter
    private final Path packagesDir;
    private final String nodeName;
    private final Clock clock;

    public FileConfigPackageStore(final Path packagesDir, final String nodeName) {
        this(packagesDir, nodeName, Clock.systemUTC());
    }

    public FileConfigPackageStore(final Path packagesDir, final String nodeName, final Clock clock) {
        this.packagesDir = packagesDir;
        this.nodeName = nodeName;
        this.clock = clock;
    }

    @Override
    public boolean packageExists(final String packageName) {
        return Files.isDirectory(getPackageDir(packageName));
    }

    @Override
    public Optional<String> getActiveStage(final String packageName) {
        final Path pointer = getPackageDir(packageName).resolve(ACTIVE_STAGE_FILE);
        if (!Files.isRegularFile(pointer)) return Optional.empty();

        try {
            final String stage = Files.readString(pointer, StandardCharsets.UTF_8).trim();
            return stage.isEmpty() ? Optional.empty() : Optional.of(stage);
        } catch (final IOException e) {
            log.warn("Failed to read active stage of package '{}': {}", packageName, e.toString());
            return Optional.empty();
        }
    }

    @Override
    public void createPackage(final String packageName) throws IOException {
        validateName(packageName);
        Files.createDirectories(getPackageDir(packageName));
    }

    @Override
    public String createStage(final String packageName) throws IOException {
        final String stage = nodeName + "-" + clock.instant().getEpochSecond() + "-" + UUID.randomUUID();
        Files.createDirectories(getPackageDir(packageName).resolve(stage).resolve(CONF_DIR));
        return stage;
    }

    @Override
    public void activateStage(final String packageName, final String stageName) throws IOException {
        validateName(stageName);
        final Path packageDir = getPackageDir(packageName);
        if (!Files.isDirectory(packageDir.resolve(stageName))) {
            throw new IOException("Stage '" + stageName + "' does not exist in package '" + packageName + "'");
        }

        try (final AtomicFile fp = new AtomicFile(packageDir.resolve(ACTIVE_STAGE_FILE))) {
            fp.write(stageName + "\n");
            fp.commit();
        }
    }

    @Override
    public List<String> listPackages() throws IOException {
        return listDirectories(packagesDir);
    }

    @Override
    public List<String> listStages(final String packageName) throws IOException {
        return listDirectories(getPackageDir(packageName));
    }

    private static List<String> listDirectories(final Path dir) throws IOException {
        if (!Files.isDirectory(dir)) return Collections.emptyList();

        final List<String> names = new ArrayList<>();
        try (final Stream<Path> children = Files.list(dir)) {
            children.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .sorted()
                    .forEach(names::add);
        }
        return names;
    }

    private static void validateName(final String name) {
        if (name == null || name.isEmpty() || name.contains("/") || name.contains("\\") || name.equals("..") || name.equals(".")) {
            throw new IllegalArgumentException("Invalid package or stage name: '" + name + "'");
        }
    }
}
