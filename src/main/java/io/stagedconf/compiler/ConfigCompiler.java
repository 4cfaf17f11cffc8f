package io.stagedconf.compiler;

import io.stagedconf.error.ConfigObjectException;

import java.nio.file.Path;

/**
 * Compiles configuration text into an {@link Expression}.
 */
public interface ConfigCompiler {

    /**
     * @param path        file the text was (or will be) read from, recorded as debug info
     * @param text        source text
     * @param zone        zone the resulting objects belong to, may be empty
     * @param packageName package label of the resulting objects
     * @throws ConfigObjectException with kind COMPILE on syntax or type errors
     */
    Expression compileText(Path path, String text, String zone, String packageName) throws ConfigObjectException;
}
