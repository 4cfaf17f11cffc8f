package io.stagedconf.runtime;

import io.stagedconf.object.type.ObjectType;
import lombok.experimental.UtilityClass;

import java.util.Set;

/**
 * Comments and downtimes: created in large numbers with long composite names. They get
 * hashed file names and do not trigger an object authority update.
 */
@UtilityClass
public class HighChurnTypes {
    private static final Set<String> NAMES = Set.of("Comment", "Downtime");

    public static boolean contains(final ObjectType type) {
        return NAMES.contains(type.getName());
    }
}
