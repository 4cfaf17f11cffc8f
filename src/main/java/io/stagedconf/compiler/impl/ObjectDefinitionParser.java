package io.stagedconf.compiler.impl;

import io.stagedconf.error.ConfigObjectException;
import io.stagedconf.error.ErrorKind;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive-descent parser for object definitions:
 * <pre>
 * object Host "web01" ignore_on_error {
 *     import "generic-host"
 *     address = "10.0.0.1"
 *     vars["os"] = "Linux"
 * }
 * </pre>
 * Values are strings, numbers, booleans, {@code null}, arrays and dictionaries.
 * Line comments ({@code //}, {@code #}) and block comments are skipped.
 */
final class ObjectDefinitionParser {
    private final Path path;
    private final String text;
    private int pos;
    private int line = 1;

    ObjectDefinitionParser(final Path path, final String text) {
        this.path = path;
        this.text = text;
    }

    List<ObjectDefinition> parse() throws ConfigObjectException {
        final List<ObjectDefinition> defs = new ArrayList<>();
        skipTrivia();
        while (!eof()) {
            defs.add(parseObject());
            skipTrivia();
        }
        return defs;
    }

    private ObjectDefinition parseObject() throws ConfigObjectException {
        final int startLine = line;
        final String keyword = parseIdentifier();
        if (!keyword.equals("object")) {
            throw error("unexpected '" + keyword + "', expecting 'object'");
        }

        final String type = parseIdentifier();
        final String name = parseString();

        boolean ignoreOnError = false;
        skipTrivia();
        if (peekWord("ignore_on_error")) {
            pos += "ignore_on_error".length();
            ignoreOnError = true;
        }

        expect('{');

        final List<String> imports = new ArrayList<>();
        final Map<String, Object> attrs = new LinkedHashMap<>();

        while (true) {
            skipTrivia();
            if (eof()) throw error("unexpected end of file, expecting '}'");
            if (peek() == '}') {
                pos++;
                break;
            }
            if (peek() == ';') {
                pos++;
                continue;
            }

            if (peekWord("import")) {
                pos += "import".length();
                imports.add(parseString());
            } else {
                parseAssignment(attrs);
            }
        }

        return new ObjectDefinition(type, name, ignoreOnError, imports, attrs, startLine);
    }

    private void parseAssignment(final Map<String, Object> attrs) throws ConfigObjectException {
        final String key = parseIdentifier();
        final List<String> indexers = new ArrayList<>();

        skipTrivia();
        while (!eof() && peek() == '[') {
            pos++;
            indexers.add(parseString());
            expect(']');
            skipTrivia();
        }

        expect('=');
        final Object value = parseValue();

        if (indexers.isEmpty()) {
            attrs.put(key, value);
            return;
        }

        Map<String, Object> current = dictionaryAt(attrs, key);
        for (int i = 0; i < indexers.size() - 1; i++) {
            current = dictionaryAt(current, indexers.get(i));
        }
        current.put(indexers.get(indexers.size() - 1), value);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> dictionaryAt(final Map<String, Object> parent, final String key) throws ConfigObjectException {
        final Object existing = parent.get(key);
        if (existing == null) {
            final Map<String, Object> created = new LinkedHashMap<>();
            parent.put(key, created);
            return created;
        }
        if (existing instanceof Map<?, ?>) {
            return (Map<String, Object>) existing;
        }
        throw error("cannot index into non-dictionary '" + key + "'");
    }

    private Object parseValue() throws ConfigObjectException {
        skipTrivia();
        if (eof()) throw error("unexpected end of file, expecting a value");

        final char c = peek();
        if (c == '"') return parseString();
        if (c == '[') return parseArray();
        if (c == '{') return parseDictionary();
        if (c == '-' || Character.isDigit(c)) return parseNumber();

        final String word = parseIdentifier();
        switch (word) {
            case "true":
                return Boolean.TRUE;
            case "false":
                return Boolean.FALSE;
            case "null":
                return null;
            default:
                throw error("unexpected '" + word + "', expecting a value");
        }
    }

    private List<Object> parseArray() throws ConfigObjectException {
        expect('[');
        final List<Object> values = new ArrayList<>();
        while (true) {
            skipTrivia();
            if (eof()) throw error("unexpected end of file, expecting ']'");
            if (peek() == ']') {
                pos++;
                return values;
            }
            values.add(parseValue());
            skipTrivia();
            if (!eof() && peek() == ',') {
                pos++;
            } else if (eof() || peek() != ']') {
                throw error("expecting ',' or ']'");
            }
        }
    }

    private Map<String, Object> parseDictionary() throws ConfigObjectException {
        expect('{');
        final Map<String, Object> values = new LinkedHashMap<>();
        while (true) {
            skipTrivia();
            if (eof()) throw error("unexpected end of file, expecting '}'");
            final char c = peek();
            if (c == '}') {
                pos++;
                return values;
            }
            if (c == ',' || c == ';') {
                pos++;
                continue;
            }

            final String key = c == '"' ? parseString() : parseIdentifier();
            expect('=');
            values.put(key, parseValue());
        }
    }

    private Number parseNumber() throws ConfigObjectException {
        final int start = pos;
        if (peek() == '-') pos++;
        boolean decimal = false;

        while (!eof()) {
            final char c = peek();
            if (Character.isDigit(c)) {
                pos++;
            } else if (c == '.' || c == 'e' || c == 'E') {
                decimal = true;
                pos++;
            } else if ((c == '+' || c == '-') && (text.charAt(pos - 1) == 'e' || text.charAt(pos - 1) == 'E')) {
                pos++;
            } else {
                break;
            }
        }

        final String literal = text.substring(start, pos);
        try {
            if (!decimal) {
                try {
                    return Long.parseLong(literal);
                } catch (final NumberFormatException overflow) {
                    return Double.parseDouble(literal);
                }
            }
            return Double.parseDouble(literal);
        } catch (final NumberFormatException e) {
            throw error("invalid number '" + literal + "'");
        }
    }

    private String parseIdentifier() throws ConfigObjectException {
        skipTrivia();
        if (!eof() && peek() == '@') pos++;

        final int start = pos;
        while (!eof()) {
            final char c = peek();
            if (c == '_' || Character.isLetter(c) || (pos > start && Character.isDigit(c))) {
                pos++;
            } else {
                break;
            }
        }

        if (start == pos) {
            throw error(eof() ? "unexpected end of file, expecting identifier"
                    : "unexpected '" + peek() + "', expecting identifier");
        }
        return text.substring(start, pos);
    }

    private String parseString() throws ConfigObjectException {
        skipTrivia();
        expect('"');

        final StringBuilder sb = new StringBuilder();
        while (true) {
            if (eof()) throw error("unterminated string");
            final char c = text.charAt(pos++);
            if (c == '"') return sb.toString();
            if (c == '\n') throw error("unterminated string");
            if (c != '\\') {
                sb.append(c);
                continue;
            }

            if (eof()) throw error("unterminated string");
            final char esc = text.charAt(pos++);
            switch (esc) {
                case '"' -> sb.append('"');
                case '\\' -> sb.append('\\');
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                default -> throw error("invalid escape sequence '\\" + esc + "'");
            }
        }
    }

    private void expect(final char c) throws ConfigObjectException {
        skipTrivia();
        if (eof() || peek() != c) {
            throw error(eof() ? "unexpected end of file, expecting '" + c + "'"
                    : "unexpected '" + peek() + "', expecting '" + c + "'");
        }
        pos++;
    }

    private boolean peekWord(final String word) {
        if (!text.startsWith(word, pos)) return false;
        final int end = pos + word.length();
        return end >= text.length() || !(Character.isLetterOrDigit(text.charAt(end)) || text.charAt(end) == '_');
    }

    private void skipTrivia() {
        while (!eof()) {
            final char c = peek();
            if (c == '\n') {
                line++;
                pos++;
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '#' || text.startsWith("//", pos)) {
                while (!eof() && peek() != '\n') pos++;
            } else if (text.startsWith("/*", pos)) {
                final int end = text.indexOf("*/", pos + 2);
                final int stop = end < 0 ? text.length() : end + 2;
                for (int i = pos; i < stop; i++) {
                    if (text.charAt(i) == '\n') line++;
                }
                pos = stop;
            } else {
                return;
            }
        }
    }

    private char peek() {
        return text.charAt(pos);
    }

    private boolean eof() {
        return pos >= text.length();
    }

    private ConfigObjectException error(final String message) {
        return new ConfigObjectException(ErrorKind.COMPILE, "syntax error, " + message + " in " + path + ":" + line);
    }
}
