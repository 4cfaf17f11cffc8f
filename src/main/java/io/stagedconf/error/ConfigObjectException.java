package io.stagedconf.error;

import lombok.Getter;

/**
 * Recoverable pipeline failure. Always caught at the pipeline boundary and folded into
 * {@link Diagnostics}.
 */
@Getter
public class ConfigObjectException extends Exception {
    private final ErrorKind kind;

    public ConfigObjectException(final ErrorKind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    public ConfigObjectException(final ErrorKind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static ConfigObjectException validation(final String message) {
        return new ConfigObjectException(ErrorKind.VALIDATION, message);
    }

    public static ConfigObjectException commit(final String message) {
        return new ConfigObjectException(ErrorKind.COMMIT, message);
    }

    /**
     * Returns the kind carried by {@code t} if it is a pipeline failure, else {@code fallback}.
     */
    public static ErrorKind kindOf(final Throwable t, final ErrorKind fallback) {
        return t instanceof ConfigObjectException ce ? ce.getKind() : fallback;
    }
}
