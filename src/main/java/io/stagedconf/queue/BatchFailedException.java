package io.stagedconf.queue;

import io.stagedconf.error.ConfigObjectException;
import io.stagedconf.error.ErrorKind;

import java.util.List;

/**
 * A work-queue batch finished with failures; carries every failure drained from it.
 */
public final class BatchFailedException extends ConfigObjectException {
    private final List<Throwable> failures;

    public BatchFailedException(final ErrorKind kind, final String message, final List<Throwable> failures) {
        super(kind, message);
        this.failures = List.copyOf(failures);
    }

    public List<Throwable> getFailures() {
        return failures;
    }
}
