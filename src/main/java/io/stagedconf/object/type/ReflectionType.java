package io.stagedconf.object.type;

import io.stagedconf.error.ConfigObjectException;
import io.stagedconf.object.model.ConfigObject;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Field table plus live-object registry for one object type.
 * Every type carries the base fields {@code name}, {@code zone}, {@code version} and the
 * internal {@code package} field.
 */
public class ReflectionType implements ObjectType, Registrable {
    private static final List<FieldInfo> BASE_FIELDS = List.of(
            new FieldInfo("name", true, false, null),
            new FieldInfo("zone", true, false, null),
            new FieldInfo("version", true, false, null),
            new FieldInfo("package", false, false, null)
    );

    @Getter
    private final String name;
    @Getter
    private final String pluralName;
    private final List<FieldInfo> fields;
    private final Map<String, Integer> fieldIds;
    private final ConcurrentMap<String, ConfigObject> objects = new ConcurrentHashMap<>();

    protected ReflectionType(final String name, final String pluralName, final List<FieldInfo> ownFields) {
        this.name = name;
        this.pluralName = pluralName;

        final List<FieldInfo> all = new ArrayList<>(BASE_FIELDS);
        all.addAll(ownFields);
        this.fields = List.copyOf(all);

        final Map<String, Integer> ids = new HashMap<>();
        for (int i = 0; i < fields.size(); i++) {
            if (ids.putIfAbsent(fields.get(i).name(), i) != null) {
                throw new IllegalArgumentException("Duplicate field '" + fields.get(i).name() + "' on type " + name);
            }
        }
        this.fieldIds = Collections.unmodifiableMap(ids);
    }

    public static Builder builder(final String name, final String pluralName) {
        return new Builder(name, pluralName);
    }

    @Override
    public int getFieldId(final String fieldName) {
        return fieldIds.getOrDefault(fieldName, -1);
    }

    @Override
    public FieldInfo getFieldInfo(final int fieldId) {
        return fields.get(fieldId);
    }

    @Override
    public int getFieldCount() {
        return fields.size();
    }

    @Override
    public Optional<ConfigObject> getObject(final String fullName) {
        return Optional.ofNullable(objects.get(fullName));
    }

    @Override
    public Collection<ConfigObject> getObjects() {
        return Collections.unmodifiableCollection(objects.values());
    }

    @Override
    public void registerObject(final ConfigObject object) throws ConfigObjectException {
        final ConfigObject existing = objects.putIfAbsent(object.getName(), object);
        if (existing != null && existing != object) {
            throw ConfigObjectException.commit("An object with type '" + name + "' and name '"
                    + object.getName() + "' already exists.");
        }
    }

    @Override
    public void unregisterObject(final ConfigObject object) {
        objects.remove(object.getName(), object);
    }

    @Override
    public boolean replaceObject(final ConfigObject current, final ConfigObject replacement) {
        if (!current.getName().equals(replacement.getName())) {
            throw new IllegalArgumentException("Cannot replace '" + current.getName() + "' with '"
                    + replacement.getName() + "'");
        }
        return objects.replace(current.getName(), current, replacement);
    }

    @Override
    public String toString() {
        return name;
    }

    public static class Builder {
        protected final String name;
        protected final String pluralName;
        protected final List<FieldInfo> fields = new ArrayList<>();

        protected Builder(final String name, final String pluralName) {
            this.name = name;
            this.pluralName = pluralName;
        }

        public Builder configField(final String field) {
            fields.add(new FieldInfo(field, true, false, null));
            return this;
        }

        public Builder requiredField(final String field) {
            fields.add(new FieldInfo(field, true, true, null));
            return this;
        }

        /**
         * Config field holding the name of an object of {@code targetType}. The referencing
         * object depends on the referenced one.
         */
        public Builder referenceField(final String field, final String targetType, final boolean required) {
            fields.add(new FieldInfo(field, true, required, targetType));
            return this;
        }

        /**
         * Field maintained at runtime only; rejected in external configuration.
         */
        public Builder stateField(final String field) {
            fields.add(new FieldInfo(field, false, false, null));
            return this;
        }

        public ReflectionType build() {
            return new ReflectionType(name, pluralName, fields);
        }
    }
}
