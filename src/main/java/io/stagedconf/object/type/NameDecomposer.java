package io.stagedconf.object.type;

import io.stagedconf.error.ConfigObjectException;

import java.util.Map;

/**
 * Capability of types whose full names are composed of several attributes,
 * e.g. {@code host!service}.
 */
public interface NameDecomposer {

    /**
     * Splits a full name into the attributes it is made of. The result always contains
     * {@code name}.
     */
    Map<String, Object> parseName(String fullName) throws ConfigObjectException;

    /**
     * Builds the full name from the short object name and its attributes.
     */
    String makeName(String shortName, Map<String, Object> attributes) throws ConfigObjectException;
}
