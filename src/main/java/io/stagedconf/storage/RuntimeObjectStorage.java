package io.stagedconf.storage;

import io.stagedconf.storage.pkg.ConfigPackageStore;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Storage of runtime-created objects inside the reserved {@value #API_PACKAGE} package.
 * <p>
 * Owns the bootstrap lock: the existence check and the package/stage creation in
 * {@link #ensureStorage()} are the only place where concurrent first-time callers race.
 */
@Slf4j
public final class RuntimeObjectStorage {
    public static final String API_PACKAGE = "_api";

    @Getter
    private final ConfigPackageStore packageStore;
    private final ReentrantLock bootstrapLock = new ReentrantLock();

    public RuntimeObjectStorage(final ConfigPackageStore packageStore) {
        this.packageStore = packageStore;
    }

    /**
     * Creates and activates the reserved package and its first stage unless the package exists.
     */
    public void ensureStorage() throws IOException {
        bootstrapLock.lock();
        try {
            if (packageStore.packageExists(API_PACKAGE)) return;

            log.info("Package {} doesn't exist yet, creating it.", API_PACKAGE);

            packageStore.createPackage(API_PACKAGE);
            final String stage = packageStore.createStage(API_PACKAGE);
            packageStore.activateStage(API_PACKAGE, stage);
        } finally {
            bootstrapLock.unlock();
        }
    }

    /**
     * Directory of the active stage of the reserved package, repairing the package first if no
     * stage is recorded as active.
     *
     * @throws PackageRepairException if the package has no stage to activate
     */
    public Path getConfigDir() {
        final Optional<String> active = packageStore.getActiveStage(API_PACKAGE);
        final String stage = active.isPresent() ? active.get() : repairPackage(API_PACKAGE);
        return packageStore.getPackageDir(API_PACKAGE).resolve(stage);
    }

    /**
     * Activates the first directory found in the package. The choice follows directory listing
     * order and is not a "latest stage" lookup.
     *
     * @return the activated stage
     * @throws PackageRepairException if the package contains no directory at all
     */
    public String repairPackage(final String packageName) {
        final Path dir = packageStore.getPackageDir(packageName);

        String found = null;
        if (Files.isDirectory(dir)) {
            try (final DirectoryStream<Path> entries = Files.newDirectoryStream(dir, Files::isDirectory)) {
                for (final Path entry : entries) {
                    found = entry.getFileName().toString();
                    break;
                }
            } catch (final IOException e) {
                throw new PackageRepairException(packageName,
                        "Cannot repair package '" + packageName + "', please check the troubleshooting docs.", e);
            }
        }

        if (found == null) {
            throw new PackageRepairException(packageName,
                    "Cannot repair package '" + packageName + "', please check the troubleshooting docs.");
        }

        log.info("Repairing config package '{}' with stage '{}'.", packageName, found);

        try {
            packageStore.activateStage(packageName, found);
        } catch (final IOException e) {
            throw new PackageRepairException(packageName,
                    "Cannot activate stage '" + found + "' while repairing package '" + packageName + "'", e);
        }
        return found;
    }
}
