package io.stagedconf.storage.pkg;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * On-disk layout of named configuration packages, each holding versioned stages with exactly
 * one stage marked active. The active-stage pointer is only ever changed through
 * {@link #activateStage(String, String)}.
 */
public interface ConfigPackageStore {

    /**
     * Root directory that contains one sub-directory per package.
     */
    Path getPackagesDir();

    default Path getPackageDir(final String packageName) {
        return getPackagesDir().resolve(packageName);
    }

    boolean packageExists(String packageName);

    /**
     * Returns the stage recorded as active, or empty when the pointer is missing or blank.
     */
    Optional<String> getActiveStage(String packageName);

    void createPackage(String packageName) throws IOException;

    /**
     * Creates a new, empty stage inside the package.
     *
     * @return the generated stage name
     */
    String createStage(String packageName) throws IOException;

    /**
     * Persists {@code stageName} as the active stage of the package.
     */
    void activateStage(String packageName, String stageName) throws IOException;

    List<String> listPackages() throws IOException;

    List<String> listStages(String packageName) throws IOException;
}
