package io.stagedconf.compiler.impl;

import java.util.List;
import java.util.Map;

/**
 * One parsed {@code object} block.
 */
record ObjectDefinition(String typeName,
                        String name,
                        boolean ignoreOnError,
                        List<String> imports,
                        Map<String, Object> attributes,
                        int line) {
}
