package io.stagedconf.object;

import io.stagedconf.cluster.MessageOrigin;
import io.stagedconf.error.ConfigObjectException;
import io.stagedconf.error.ErrorKind;
import io.stagedconf.object.event.ObjectEvents;
import io.stagedconf.object.graph.DependencyGraph;
import io.stagedconf.object.model.ActivationContext;
import io.stagedconf.object.model.ConfigItem;
import io.stagedconf.object.model.ConfigObject;
import io.stagedconf.object.type.FieldInfo;
import io.stagedconf.object.type.NameDecomposer;
import io.stagedconf.object.type.ObjectType;
import io.stagedconf.object.type.Registrable;
import io.stagedconf.object.type.TypeRegistry;
import io.stagedconf.queue.WorkQueue;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory object world of a node: types, committed items, live objects, their dependency
 * edges and lifecycle listeners. Turns evaluated items into registered, active objects.
 */
@Slf4j
@Getter
public final class ObjectRuntime {
    private final TypeRegistry types;
    private final ConfigItemRegistry items = new ConfigItemRegistry();
    private final DependencyGraph dependencyGraph = new DependencyGraph();
    private final ObjectEvents events = new ObjectEvents();
    @Getter(lombok.AccessLevel.NONE)
    private final ConcurrentMap<String, Map<String, Object>> templates = new ConcurrentHashMap<>();

    public ObjectRuntime(final TypeRegistry types) {
        this.types = types;
    }

    /**
     * Makes a template available to {@code import} statements of objects of {@code type}.
     */
    public void registerTemplate(final ObjectType type, final String templateName, final Map<String, Object> attributes) {
        templates.put(templateKey(type, templateName), Collections.unmodifiableMap(new LinkedHashMap<>(attributes)));
    }

    /**
     * Registers every pending item of {@code context} through {@code batch}. Committed items are
     * added to {@code newItems}; items dropped because of {@code ignore_on_error} are not.
     *
     * @return false if any item failed, the failures stay drainable from {@code batch}
     */
    public boolean commitItems(final ActivationContext context,
                               final WorkQueue.Batch batch,
                               final List<ConfigItem> newItems) {
        final List<ConfigItem> committed = Collections.synchronizedList(new ArrayList<>());

        for (final ConfigItem item : context.drainItems()) {
            batch.submit(() -> {
                if (commitItem(item)) {
                    committed.add(item);
                }
            });
        }

        final boolean ok = batch.join();
        if (!ok) {
            /* Keep the registry free of half-committed siblings. */
            synchronized (committed) {
                committed.forEach(this::unregisterItem);
            }
            return false;
        }

        newItems.addAll(committed);
        return true;
    }

    /**
     * Activates the objects of {@code newItems} through {@code batch}, forwarding {@code origin}
     * to every listener.
     */
    public boolean activateItems(final List<ConfigItem> newItems,
                                 final WorkQueue.Batch batch,
                                 final boolean runtimeCreated,
                                 final MessageOrigin origin) {
        for (final ConfigItem item : newItems) {
            final ConfigObject object = item.getObject();
            if (object == null) continue;
            batch.submit(() -> object.activate(runtimeCreated, origin));
        }
        return batch.join();
    }

    /**
     * Removes the item and its object from every registry.
     */
    public void unregisterItem(final ConfigItem item) {
        items.unregister(item);
        final ConfigObject object = item.getObject();
        if (object != null) {
            object.unregister();
            item.setObject(null);
        }
    }

    /**
     * Validates {@code item} as the new state of an already registered object without
     * registering anything.
     */
    public Replacement prepareReplacement(final ConfigItem item) throws ConfigObjectException {
        final ObjectType type = item.getType();
        if (!(type instanceof Registrable)) {
            throw ConfigObjectException.commit("Objects of type '" + type.getName() + "' cannot be registered.");
        }

        final Map<String, Object> attrs = resolveAttributes(item);
        final String fullName = type instanceof NameDecomposer nd
                ? nd.makeName(item.getName(), attrs)
                : item.getName();
        item.setFullName(fullName);

        final ConfigObject object = new ConfigObject(this, type, fullName, item.getName(),
                item.getPackageName(), item.getDebugInfo(), attrs);
        return new Replacement(item, object, validate(object));
    }

    /**
     * Puts {@code replacement} in place of {@code current} in the object and item registries.
     * Objects depending on {@code current} depend on the replacement afterwards.
     *
     * @return the previous state, which can be swapped back in the same way
     */
    public Replacement swap(final ConfigObject current, final Replacement replacement) throws ConfigObjectException {
        final ObjectType type = current.getType();
        if (!(type instanceof Registrable registrable)) {
            throw ConfigObjectException.commit("Objects of type '" + type.getName() + "' cannot be registered.");
        }

        final ConfigItem currentItem = items.getByTypeAndName(type, current.getName())
                .filter(i -> i.getObject() == current)
                .orElse(null);
        final Replacement previous = new Replacement(currentItem, current, dependencyGraph.getChildren(current));

        if (!registrable.replaceObject(current, replacement.object())) {
            throw ConfigObjectException.commit("Object '" + current.getName() + "' of type '" + type.getName()
                    + "' was changed concurrently.");
        }
        if (!items.replace(type, current.getName(), currentItem, replacement.item())) {
            registrable.replaceObject(replacement.object(), current);
            throw ConfigObjectException.commit("Config item of object '" + current.getName() + "' of type '"
                    + type.getName() + "' was changed concurrently.");
        }

        if (replacement.item() != null) {
            replacement.item().setObject(replacement.object());
        }
        dependencyGraph.replaceObject(current, replacement.object(), replacement.children());
        return previous;
    }

    public Optional<ConfigItem> getItem(final ObjectType type, final String fullName) {
        return items.getByTypeAndName(type, fullName);
    }

    public Optional<ConfigObject> getObject(final ObjectType type, final String fullName) {
        return type instanceof Registrable registrable ? registrable.getObject(fullName) : Optional.empty();
    }

    private boolean commitItem(final ConfigItem item) throws ConfigObjectException {
        final ObjectType type = item.getType();
        if (!(type instanceof Registrable registrable)) {
            throw ConfigObjectException.commit("Objects of type '" + type.getName() + "' cannot be registered.");
        }

        final Map<String, Object> attrs = resolveAttributes(item);
        final String fullName = type instanceof NameDecomposer nd
                ? nd.makeName(item.getName(), attrs)
                : item.getName();
        item.setFullName(fullName);

        items.register(item);

        try {
            final ConfigObject object = new ConfigObject(this, type, fullName, item.getName(),
                    item.getPackageName(), item.getDebugInfo(), attrs);

            final List<ConfigObject> references;
            try {
                references = validate(object);
            } catch (final ConfigObjectException e) {
                if (!item.isIgnoreOnError()) throw e;

                log.info("Ignoring config object '{}' of type '{}' due to errors: {}",
                        fullName, type.getName(), e.getMessage());
                items.unregister(item);
                return false;
            }

            registrable.registerObject(object);
            item.setObject(object);
            for (final ConfigObject child : references) {
                dependencyGraph.addDependency(object, child);
            }
            return true;
        } catch (final ConfigObjectException | RuntimeException e) {
            items.unregister(item);
            throw e;
        }
    }

    private Map<String, Object> resolveAttributes(final ConfigItem item) throws ConfigObjectException {
        final Map<String, Object> attrs = new LinkedHashMap<>();
        for (final String template : item.getTemplates()) {
            final Map<String, Object> tpl = templates.get(templateKey(item.getType(), template));
            if (tpl == null) {
                throw ConfigObjectException.commit("Import references unknown template: '" + template
                        + "' of type '" + item.getType().getName() + "' (" + item.getDebugInfo() + ")");
            }
            attrs.putAll(tpl);
        }
        attrs.putAll(item.getAttributes());
        if (item.getZone() != null && !item.getZone().isEmpty()) {
            attrs.putIfAbsent("zone", item.getZone());
        }
        return attrs;
    }

    private List<ConfigObject> validate(final ConfigObject object) throws ConfigObjectException {
        final ObjectType type = object.getType();
        final List<ConfigObject> references = new ArrayList<>();

        for (final Map.Entry<String, Object> kv : object.getAttributes().entrySet()) {
            final int fid = type.getFieldId(kv.getKey());
            if (fid < 0) {
                throw validationFailure(object, kv.getKey(), "Attribute does not exist.");
            }
            if (!type.getFieldInfo(fid).config()) {
                throw validationFailure(object, kv.getKey(), "Attribute is marked for internal use only.");
            }
        }

        for (int fid = 0; fid < type.getFieldCount(); fid++) {
            final FieldInfo field = type.getFieldInfo(fid);
            final Object value = object.getAttribute(field.name());

            if (value == null) {
                if (field.required()) {
                    throw validationFailure(object, field.name(), "Attribute must not be empty.");
                }
                continue;
            }

            if (field.isReference()) {
                references.add(resolveReference(object, field, value));
            }
        }
        return references;
    }

    private ConfigObject resolveReference(final ConfigObject object,
                                          final FieldInfo field,
                                          final Object value) throws ConfigObjectException {
        final Optional<ObjectType> target = types.getByName(field.referenceType());
        if (target.isEmpty()) {
            throw validationFailure(object, field.name(), "Unknown type '" + field.referenceType() + "'.");
        }

        Optional<ConfigObject> ref = getObject(target.get(), value.toString());

        /* service_name = "http" on a comment of host web01 means web01!http */
        if (ref.isEmpty() && target.get() instanceof NameDecomposer nd) {
            ref = getObject(target.get(), nd.makeName(value.toString(), object.getAttributes()));
        }

        if (ref.isEmpty()) {
            throw validationFailure(object, field.name(), "Object '" + value + "' of type '"
                    + field.referenceType() + "' does not exist.");
        }
        return ref.get();
    }

    private static ConfigObjectException validationFailure(final ConfigObject object,
                                                           final String attribute,
                                                           final String reason) {
        return new ConfigObjectException(ErrorKind.VALIDATION, "Validation failed for object '" + object.getName()
                + "' of type '" + object.getType().getName() + "'; Attribute '" + attribute + "': " + reason);
    }

    /**
     * An object together with the item it was committed from and the objects it references.
     */
    public record Replacement(ConfigItem item, ConfigObject object, List<ConfigObject> children) {
    }

    private static String templateKey(final ObjectType type, final String templateName) {
        return type.getName() + "\0" + templateName;
    }
}
