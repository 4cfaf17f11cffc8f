package io.stagedconf.storage;

/**
 * A package has no active stage and no stage directory to recover one from.
 * Not recoverable without operator intervention.
 */
public final class PackageRepairException extends RuntimeException {
    private final String packageName;

    public PackageRepairException(final String packageName, final String message) {
        super(message);
        this.packageName = packageName;
    }

    public PackageRepairException(final String packageName, final String message, final Throwable cause) {
        super(message, cause);
        this.packageName = packageName;
    }

    public String packageName() {
        return packageName;
    }
}
