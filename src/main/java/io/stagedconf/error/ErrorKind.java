package io.stagedconf.error;

/**
 * Failure categories reported by the runtime object pipeline.
 */
public enum ErrorKind {
    /** Request refused by policy, e.g. deleting an object not created at runtime. */
    POLICY,
    /** Unknown, internal or reserved attribute, malformed name. */
    VALIDATION,
    /** Object path could not be derived. */
    PATH,
    /** Serialized configuration could not be compiled or evaluated. */
    COMPILE,
    /** Registration of a compiled item was rejected. */
    COMMIT,
    /** Activation or deactivation failed. */
    ACTIVATION,
    IO
}
