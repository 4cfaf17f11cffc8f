package io.stagedconf.runtime;

import io.stagedconf.compiler.ConfigWriter;
import io.stagedconf.error.ConfigObjectException;
import io.stagedconf.object.type.NameDecomposer;
import io.stagedconf.object.type.ObjectType;
import lombok.RequiredArgsConstructor;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a create request into the configuration text of one object.
 */
@RequiredArgsConstructor
public final class ObjectConfigSerializer {
    private final Clock clock;

    /**
     * Validates every attribute key against {@code type} before emitting anything. The prefix
     * up to the first dot must be a config field; {@code name} is derived from
     * {@code fullName} and may not be set.
     *
     * @throws ConfigObjectException with kind VALIDATION naming the offending key
     */
    public String createObjectConfig(final ObjectType type,
                                     final String fullName,
                                     final boolean ignoreOnError,
                                     final List<String> templates,
                                     final Map<String, Object> attrs) throws ConfigObjectException {
        Map<String, Object> nameParts = null;
        final String name;

        if (type instanceof NameDecomposer nd) {
            nameParts = nd.parseName(fullName);
            name = String.valueOf(nameParts.get("name"));
        } else {
            name = fullName;
        }

        final Map<String, Object> allAttrs = new LinkedHashMap<>();

        if (attrs != null) {
            for (final String key : attrs.keySet()) {
                final int dot = key.indexOf('.');
                final int fid = type.getFieldId(dot < 0 ? key : key.substring(0, dot));

                if (fid < 0) {
                    throw ConfigObjectException.validation("Invalid attribute specified: " + key);
                }

                if (!type.getFieldInfo(fid).config() || key.equals("name")) {
                    throw ConfigObjectException.validation("Attribute is marked for internal use only and may not be set: " + key);
                }
            }
            allAttrs.putAll(attrs);
        }

        if (nameParts != null) {
            allAttrs.putAll(nameParts);
        }

        allAttrs.remove("name");

        /* config sync version */
        allAttrs.put("version", currentTime());

        final StringBuilder config = new StringBuilder();
        try {
            ConfigWriter.emitConfigItem(config, type.getName(), name, ignoreOnError, templates, allAttrs);
        } catch (final IllegalArgumentException e) {
            throw ConfigObjectException.validation("Cannot serialize object '" + fullName + "': " + e.getMessage());
        }
        config.append('\n');

        return config.toString();
    }

    private double currentTime() {
        final Instant now = clock.instant();
        return now.getEpochSecond() + now.getNano() / 1_000_000_000d;
    }
}
