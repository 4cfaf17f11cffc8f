package io.stagedconf.object.type;

import io.stagedconf.error.ConfigObjectException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Type whose full name joins the values of some attributes and the short name with
 * {@value #SEPARATOR}, e.g. a service {@code web01!http} with {@code host_name = "web01"}.
 * <p>
 * Trailing name parts may be optional: a downtime is either {@code host!name} or
 * {@code host!service!name}.
 */
public final class CompositeNameType extends ReflectionType implements NameDecomposer {
    public static final String SEPARATOR = "!";

    private final List<String> nameParts;
    private final int mandatoryParts;

    private CompositeNameType(final String name,
                              final String pluralName,
                              final List<FieldInfo> ownFields,
                              final List<String> nameParts,
                              final int mandatoryParts) {
        super(name, pluralName, ownFields);
        this.nameParts = List.copyOf(nameParts);
        this.mandatoryParts = mandatoryParts;
    }

    public static CompositeBuilder compositeBuilder(final String name, final String pluralName) {
        return new CompositeBuilder(name, pluralName);
    }

    @Override
    public Map<String, Object> parseName(final String fullName) throws ConfigObjectException {
        final String[] tokens = fullName.split(SEPARATOR, -1);
        final int prefixCount = tokens.length - 1;

        if (prefixCount < mandatoryParts || prefixCount > nameParts.size()) {
            throw ConfigObjectException.validation("Invalid " + getName() + " name '" + fullName
                    + "': expected " + expectedFormat() + ".");
        }

        final Map<String, Object> parts = new LinkedHashMap<>();
        for (int i = 0; i < prefixCount; i++) {
            if (tokens[i].isEmpty()) {
                throw ConfigObjectException.validation("Invalid " + getName() + " name '" + fullName
                        + "': empty '" + nameParts.get(i) + "'.");
            }
            parts.put(nameParts.get(i), tokens[i]);
        }
        parts.put("name", tokens[prefixCount]);
        return parts;
    }

    @Override
    public String makeName(final String shortName, final Map<String, Object> attributes) throws ConfigObjectException {
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < nameParts.size(); i++) {
            final Object value = attributes.get(nameParts.get(i));
            if (value == null || value.toString().isEmpty()) {
                if (i < mandatoryParts) {
                    throw ConfigObjectException.validation("Attribute '" + nameParts.get(i) + "' of "
                            + getName() + " '" + shortName + "' must be set.");
                }
                break;
            }
            sb.append(value).append(SEPARATOR);
        }
        return sb.append(shortName).toString();
    }

    private String expectedFormat() {
        final List<String> format = new ArrayList<>(nameParts.subList(0, mandatoryParts));
        format.add("name");
        return String.join(SEPARATOR, format);
    }

    public static final class CompositeBuilder extends Builder {
        private final List<String> nameParts = new ArrayList<>();
        private int mandatoryParts;

        private CompositeBuilder(final String name, final String pluralName) {
            super(name, pluralName);
        }

        /**
         * Adds the next name part. Mandatory parts must precede optional ones.
         */
        public CompositeBuilder namePart(final String field, final String targetType, final boolean mandatory) {
            if (mandatory && mandatoryParts != nameParts.size()) {
                throw new IllegalStateException("mandatory name parts must precede optional ones");
            }
            referenceField(field, targetType, mandatory);
            nameParts.add(field);
            if (mandatory) mandatoryParts++;
            return this;
        }

        @Override
        public CompositeBuilder configField(final String field) {
            super.configField(field);
            return this;
        }

        @Override
        public CompositeBuilder requiredField(final String field) {
            super.requiredField(field);
            return this;
        }

        @Override
        public CompositeBuilder stateField(final String field) {
            super.stateField(field);
            return this;
        }

        @Override
        public CompositeNameType build() {
            return new CompositeNameType(name, pluralName, fields, nameParts, mandatoryParts);
        }
    }
}
