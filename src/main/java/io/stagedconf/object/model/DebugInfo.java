package io.stagedconf.object.model;

import java.nio.file.Path;

/**
 * Source location an object was compiled from.
 */
public record DebugInfo(Path path, int firstLine) {
    @Override
    public String toString() {
        return path + ":" + firstLine;
    }
}
