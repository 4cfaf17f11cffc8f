package io.stagedconf.compiler;

import lombok.experimental.UtilityClass;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Emits values and object definitions in the configuration language read by
 * {@link io.stagedconf.compiler.impl.ObjectDefinitionCompiler}.
 */
@UtilityClass
public class ConfigWriter {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    static final Set<String> KEYWORDS = Set.of(
            "object", "template", "include", "include_recursive", "include_zones", "library", "null",
            "true", "false", "const", "var", "this", "globals", "locals", "use", "default", "ignore_on_error",
            "current_filename", "current_line", "apply", "to", "where", "import", "assign", "ignore",
            "function", "return", "break", "continue", "for", "if", "else", "while", "throw", "try",
            "except", "in", "using", "namespace"
    );

    /**
     * Writes {@code object <type> "<name>" [ignore_on_error] { ... }} followed by a blank line.
     * Attribute keys containing dots are written as indexer chains, {@code vars.os} becomes
     * {@code vars["os"]}.
     */
    public static void emitConfigItem(final StringBuilder out,
                                      final String type,
                                      final String name,
                                      final boolean ignoreOnError,
                                      final List<String> imports,
                                      final Map<String, Object> attrs) {
        out.append("object ");
        emitIdentifier(out, type);
        out.append(' ');
        emitString(out, name);
        if (ignoreOnError) {
            out.append(" ignore_on_error");
        }
        out.append(" {\n");

        if (imports != null && !imports.isEmpty()) {
            for (final String imp : imports) {
                out.append("\timport ");
                emitString(out, imp);
                out.append('\n');
            }
            out.append('\n');
        }

        for (final Map.Entry<String, Object> kv : new TreeMap<>(attrs).entrySet()) {
            out.append('\t');
            emitAttributePath(out, kv.getKey());
            out.append(" = ");
            emitValue(out, 1, kv.getValue());
            out.append('\n');
        }

        out.append("}\n");
    }

    public static void emitValue(final StringBuilder out, final int indent, final Object value) {
        if (value == null) {
            out.append("null");
        } else if (value instanceof Boolean b) {
            out.append(b ? "true" : "false");
        } else if (value instanceof Number n) {
            emitNumber(out, n);
        } else if (value instanceof CharSequence s) {
            emitString(out, s.toString());
        } else if (value instanceof Map<?, ?> m) {
            emitDictionary(out, indent, m);
        } else if (value instanceof Collection<?> c) {
            emitArray(out, indent, c);
        } else {
            throw new IllegalArgumentException("Cannot emit value of type " + value.getClass().getName());
        }
    }

    public static void emitString(final StringBuilder out, final String s) {
        out.append('"');
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '\b' -> out.append("\\b");
                case '\f' -> out.append("\\f");
                default -> out.append(c);
            }
        }
        out.append('"');
    }

    public static void emitIdentifier(final StringBuilder out, final String identifier) {
        if (!IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Invalid identifier: '" + identifier + "'");
        }
        if (KEYWORDS.contains(identifier)) {
            out.append('@');
        }
        out.append(identifier);
    }

    public static boolean isIdentifier(final String s) {
        return IDENTIFIER.matcher(s).matches();
    }

    private static void emitAttributePath(final StringBuilder out, final String key) {
        final String[] tokens = key.split("\\.", -1);
        emitIdentifier(out, tokens[0]);
        for (int i = 1; i < tokens.length; i++) {
            out.append('[');
            emitString(out, tokens[i]);
            out.append(']');
        }
    }

    private static void emitNumber(final StringBuilder out, final Number n) {
        if (n instanceof Double || n instanceof Float) {
            final double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("Cannot emit non-finite number " + d);
            }
            out.append(BigDecimal.valueOf(d).stripTrailingZeros().toPlainString());
        } else if (n instanceof BigDecimal bd) {
            out.append(bd.stripTrailingZeros().toPlainString());
        } else {
            out.append(n.longValue());
        }
    }

    private static void emitDictionary(final StringBuilder out, final int indent, final Map<?, ?> m) {
        if (m.isEmpty()) {
            out.append("{}");
            return;
        }

        out.append("{\n");
        final Map<String, Object> sorted = new TreeMap<>();
        m.forEach((k, v) -> sorted.put(String.valueOf(k), v));

        for (final Map.Entry<String, Object> kv : sorted.entrySet()) {
            out.append("\t".repeat(indent + 1));
            if (isIdentifier(kv.getKey()) && !KEYWORDS.contains(kv.getKey())) {
                out.append(kv.getKey());
            } else {
                emitString(out, kv.getKey());
            }
            out.append(" = ");
            emitValue(out, indent + 1, kv.getValue());
            out.append('\n');
        }
        out.append("\t".repeat(indent)).append('}');
    }

    private static void emitArray(final StringBuilder out, final int indent, final Collection<?> c) {
        out.append("[ ");
        boolean first = true;
        for (final Object v : c) {
            if (!first) out.append(", ");
            first = false;
            emitValue(out, indent, v);
        }
        out.append(first ? "]" : " ]");
    }
}
