package io.stagedconf.error;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Accumulates the outcome of a create/delete call: short messages for the caller plus full
 * diagnostic text (with stack traces) for troubleshooting.
 * <p>
 * Thread-safe; work-queue tasks may record into the same instance.
 */
public final class Diagnostics {
    private final List<String> errors = new ArrayList<>();
    private final List<String> diagnosticInformation = new ArrayList<>();
    private final Set<ErrorKind> kinds = EnumSet.noneOf(ErrorKind.class);

    public synchronized void addError(final ErrorKind kind, final String message) {
        errors.add(message);
        kinds.add(kind);
    }

    /**
     * Records {@code t} in both lists. Pipeline failures keep their own kind, anything else is
     * recorded as {@code fallback}.
     */
    public synchronized void record(final Throwable t, final ErrorKind fallback) {
        errors.add(describe(t));
        diagnosticInformation.add(stackTrace(t));
        kinds.add(ConfigObjectException.kindOf(t, fallback));
    }

    public synchronized List<String> errors() {
        return Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public synchronized List<String> diagnosticInformation() {
        return Collections.unmodifiableList(new ArrayList<>(diagnosticInformation));
    }

    public synchronized boolean has(final ErrorKind kind) {
        return kinds.contains(kind);
    }

    public synchronized boolean isEmpty() {
        return errors.isEmpty();
    }

    static String describe(final Throwable t) {
        final String msg = t.getMessage();
        return msg == null || msg.isEmpty() ? t.getClass().getSimpleName() : msg;
    }

    static String stackTrace(final Throwable t) {
        final StringWriter sw = new StringWriter();
        try (final PrintWriter pw = new PrintWriter(sw)) {
            t.printStackTrace(pw);
        }
        return sw.toString();
    }

    @Override
    public synchronized String toString() {
        return "Diagnostics" + errors;
    }
}
