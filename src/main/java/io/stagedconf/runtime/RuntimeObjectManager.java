package io.stagedconf.runtime;

import io.stagedconf.cluster.MessageOrigin;
import io.stagedconf.cluster.ObjectAuthorityNotifier;
import io.stagedconf.compiler.ConfigCompiler;
import io.stagedconf.compiler.Expression;
import io.stagedconf.error.ConfigObjectException;
import io.stagedconf.error.Diagnostics;
import io.stagedconf.error.ErrorKind;
import io.stagedconf.error.Result;
import io.stagedconf.object.ObjectRuntime;
import io.stagedconf.object.model.ActivationContext;
import io.stagedconf.object.model.ConfigItem;
import io.stagedconf.object.model.ConfigObject;
import io.stagedconf.object.type.ObjectType;
import io.stagedconf.object.type.Registrable;
import io.stagedconf.queue.BatchFailedException;
import io.stagedconf.queue.WorkQueue;
import io.stagedconf.storage.RuntimeObjectStorage;
import io.stagedconf.storage.atomic.AtomicFile;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static io.stagedconf.storage.RuntimeObjectStorage.API_PACKAGE;

/**
 * Creates and deletes objects at runtime.
 * <p>
 * Every call leaves the backing files and the registered objects consistent with each other:
 * the file of a new object is only renamed into place once the object is registered and
 * active, and the file of a deleted object is only removed once it is deactivated and
 * unregistered. Failures are reported through {@link Diagnostics}; the only exception that
 * escapes is {@link io.stagedconf.storage.PackageRepairException}.
 */
@Slf4j
public final class RuntimeObjectManager {
    @Getter
    private final RuntimeObjectStorage storage;
    private final ObjectPathDeriver pathDeriver;
    private final ConfigCompiler compiler;
    @Getter
    private final ObjectRuntime runtime;
    private final WorkQueue workQueue;
    private final ObjectAuthorityNotifier authority;

    public RuntimeObjectManager(final RuntimeObjectStorage storage,
                                final ConfigCompiler compiler,
                                final ObjectRuntime runtime,
                                final WorkQueue workQueue,
                                final ObjectAuthorityNotifier authority) {
        this.storage = storage;
        this.pathDeriver = new ObjectPathDeriver(storage);
        this.compiler = compiler;
        this.runtime = runtime;
        this.workQueue = workQueue;
        this.authority = authority;
    }

    /**
     * Writes, compiles, registers and activates a new object in the {@value RuntimeObjectStorage#API_PACKAGE}
     * package.
     *
     * @param config serialized object, see {@link ObjectConfigSerializer}
     * @param origin forwarded to activation so the change is not sent back to where it came from
     * @return true if the object was created, or ignored because of {@code ignore_on_error}
     */
    public boolean createObject(final ObjectType type,
                                final String fullName,
                                final String config,
                                final Diagnostics diagnostics,
                                final MessageOrigin origin) {
        try {
            storage.ensureStorage();
        } catch (final IOException e) {
            diagnostics.addError(ErrorKind.IO, "Cannot create config package '" + API_PACKAGE + "': " + e.getMessage());
            return false;
        }

        if (!(type instanceof Registrable)) {
            diagnostics.addError(ErrorKind.POLICY, "Objects of type '" + type.getName() + "' cannot be created at runtime.");
            return false;
        }

        if (runtime.getObject(type, fullName).isPresent()) {
            diagnostics.addError(ErrorKind.COMMIT, "Object '" + fullName + "' already exists.");
            return false;
        }

        final Path path;
        try {
            path = pathDeriver.computeNewObjectConfigPath(type, fullName);
        } catch (final ConfigObjectException e) {
            diagnostics.addError(e.getKind(), "Config package broken: " + e.getMessage());
            return false;
        }

        try {
            Files.createDirectories(path.getParent());
        } catch (final IOException e) {
            diagnostics.record(e, ErrorKind.IO);
            return false;
        }

        /*
         * The config lives in a unique temp file until commit. A caller that fails validation
         * only discards its own temp file and never touches a concurrent caller's file.
         */
        try (final AtomicFile fp = new AtomicFile(path)) {
            fp.write(config);
            fp.flush();

            final List<ConfigItem> newItems = new ArrayList<>();
            try {
                final Result<Optional<ConfigObject>> outcome = Result
                        .of(() -> compiler.compileText(path, config, "", API_PACKAGE))
                        .flatMap(expr -> commit(expr, type, fullName, newItems))
                        .flatMap(items -> activate(items, fullName, origin))
                        .flatMap(items -> {
                            if (!HighChurnTypes.contains(type)) {
                                authority.updateObjectAuthority();
                            }
                            return ownObject(type, fullName, items);
                        });

                if (outcome instanceof Result.Err<Optional<ConfigObject>> err) {
                    rollback(newItems, origin, diagnostics);
                    report(err.failure(), diagnostics);
                    return false;
                }

                final Optional<ConfigObject> created = outcome.orElseThrow();
                if (created.isEmpty()) {
                    log.info("Object '{}' was not created but ignored due to errors.", fullName);
                    return true;
                }

                /* Registered and active, the file may become durable now. */
                fp.commit();

                log.info("Created and activated object '{}' of type '{}'.", fullName, type.getName());
                return true;
            } catch (final ConfigObjectException | IOException | RuntimeException e) {
                rollback(newItems, origin, diagnostics);
                diagnostics.record(e, ErrorKind.IO);
                return false;
            }
        } catch (final IOException e) {
            diagnostics.record(e, ErrorKind.IO);
            return false;
        }
    }

    /**
     * Deactivates, unregisters and removes an object created at runtime. With {@code cascade},
     * every object depending on it is deleted first.
     *
     * @param origin forwarded to deactivation so the delete is not sent back to where it came from
     */
    public boolean deleteObject(final ConfigObject object,
                                final boolean cascade,
                                final Diagnostics diagnostics,
                                final MessageOrigin origin) {
        if (!API_PACKAGE.equals(object.getPackageName())) {
            diagnostics.addError(ErrorKind.POLICY, "Object cannot be deleted because it was not created using the API.");
            return false;
        }

        return deleteObjectHelper(object, cascade, diagnostics, origin,
                Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    /**
     * Replaces a runtime object with the object declared by {@code config} while keeping the
     * objects that depend on it. The new config is compiled and validated before anything
     * changes; if activating the new object or writing its file fails, the previous object and
     * file are restored.
     *
     * @param config serialized object with the same type and name as {@code current}
     * @param origin forwarded to activation so the change is not sent back to where it came from
     */
    public boolean replaceObject(final ConfigObject current,
                                 final String config,
                                 final Diagnostics diagnostics,
                                 final MessageOrigin origin) {
        if (!API_PACKAGE.equals(current.getPackageName())) {
            diagnostics.addError(ErrorKind.POLICY, "Object cannot be replaced because it was not created using the API.");
            return false;
        }

        final ObjectType type = current.getType();
        final String name = current.getName();
        final Path path = getExistingObjectConfigPath(current);
        if (path == null) {
            diagnostics.addError(ErrorKind.IO, "Object '" + name + "' of type '" + type.getName() + "' has no config file.");
            return false;
        }

        try (final AtomicFile fp = new AtomicFile(path)) {
            fp.write(config);
            fp.flush();

            final ObjectRuntime.Replacement replacement = compileReplacement(type, name, path, config);
            final ObjectRuntime.Replacement previous = runtime.swap(current, replacement);

            try {
                current.deactivate(false, origin);
                replacement.object().activate(true, origin);
                if (!HighChurnTypes.contains(type)) {
                    authority.updateObjectAuthority();
                }
                fp.commit();
            } catch (final ConfigObjectException | IOException | RuntimeException e) {
                log.info("Failed to replace object '{}' of type '{}', restoring it.", name, type.getName());
                diagnostics.record(e, ErrorKind.ACTIVATION);
                restore(replacement, previous, origin, diagnostics);
                return false;
            }

            log.info("Replaced object '{}' of type '{}'.", name, type.getName());
            return true;
        } catch (final ConfigObjectException | RuntimeException e) {
            diagnostics.record(e, ErrorKind.COMMIT);
            return false;
        } catch (final IOException e) {
            diagnostics.record(e, ErrorKind.IO);
            return false;
        }
    }

    /**
     * Backing file of an existing object.
     */
    public static Path getExistingObjectConfigPath(final ConfigObject object) {
        return object.getDebugInfo() == null ? null : object.getDebugInfo().path();
    }

    private boolean deleteObjectHelper(final ConfigObject object,
                                       final boolean cascade,
                                       final Diagnostics diagnostics,
                                       final MessageOrigin origin,
                                       final Set<ConfigObject> visited) {
        /* a dependency cycle leads back to an object whose deletion is already under way */
        if (!visited.add(object)) return true;

        final List<ConfigObject> parents = runtime.getDependencyGraph().getParents(object);
        final ObjectType type = object.getType();
        final String name = object.getName();

        if (!parents.isEmpty() && !cascade) {
            diagnostics.addError(ErrorKind.POLICY, "Object '" + name + "' of type '" + type.getName()
                    + "' cannot be deleted because other objects depend on it. "
                    + "Use cascading delete to delete it anyway.");
            return false;
        }

        for (final ConfigObject parent : parents) {
            if (!isRegistered(parent)) continue;

            if (!deleteObjectHelper(parent, cascade, diagnostics, origin, visited)) {
                return false;
            }
        }

        final Optional<ConfigItem> item = runtime.getItem(type, name)
                .filter(i -> i.getObject() == object);

        try {
            /* replication listeners only forward deletions of objects carrying this mark */
            object.setExtension(ConfigObject.DELETED_EXTENSION, true);

            object.deactivate(true, origin);

            if (item.isPresent()) {
                runtime.unregisterItem(item.get());
            } else {
                object.unregister();
            }
        } catch (final ConfigObjectException | RuntimeException e) {
            diagnostics.record(e, ErrorKind.ACTIVATION);
            return false;
        }

        if (API_PACKAGE.equals(object.getPackageName())) {
            final Path path = getExistingObjectConfigPath(object);
            if (path != null) {
                try {
                    Files.deleteIfExists(path);
                } catch (final IOException e) {
                    log.warn("Object '{}' of type '{}' was deleted but its file {} could not be removed",
                            name, type.getName(), path, e);
                    diagnostics.record(e, ErrorKind.IO);
                    return false;
                }
            }
        }

        log.info("Deleted object '{}' of type '{}'.", name, type.getName());
        return true;
    }

    private List<ConfigItem> commit(final Expression expr,
                                    final ObjectType type,
                                    final String fullName,
                                    final List<ConfigItem> newItems) throws ConfigObjectException {
        final WorkQueue.Batch batch = workQueue.newBatch("CreateObject " + fullName);

        try (final ActivationContext context = new ActivationContext()) {
            expr.evaluate(context);

            if (!runtime.commitItems(context, batch, newItems)) {
                log.info("Failed to commit config item '{}'.", fullName);
                throw new BatchFailedException(ErrorKind.COMMIT, "Failed to commit config item '" + fullName + "'.",
                        batch.drainExceptions());
            }
        }

        for (final ConfigItem item : newItems) {
            checkDeclares(item, type, fullName);
        }
        return newItems;
    }

    private ObjectRuntime.Replacement compileReplacement(final ObjectType type,
                                                         final String fullName,
                                                         final Path path,
                                                         final String config) throws ConfigObjectException {
        final List<ConfigItem> items;
        try (final ActivationContext context = new ActivationContext()) {
            compiler.compileText(path, config, "", API_PACKAGE).evaluate(context);
            items = context.drainItems();
        }

        if (items.size() != 1) {
            throw ConfigObjectException.commit("Config for object '" + fullName + "' of type '" + type.getName()
                    + "' must declare exactly one object, found " + items.size() + ".");
        }

        final ObjectRuntime.Replacement replacement = runtime.prepareReplacement(items.get(0));
        checkDeclares(replacement.item(), type, fullName);
        return replacement;
    }

    private void restore(final ObjectRuntime.Replacement failed,
                         final ObjectRuntime.Replacement previous,
                         final MessageOrigin origin,
                         final Diagnostics diagnostics) {
        try {
            failed.object().deactivate(false, origin);
            runtime.swap(failed.object(), previous);
            if (!previous.object().isActive()) {
                previous.object().activate(false, origin);
            }
        } catch (final ConfigObjectException | RuntimeException e) {
            log.warn("Could not restore {} after a failed replacement", previous.object(), e);
            diagnostics.record(e, ErrorKind.ACTIVATION);
        }
    }

    private static void checkDeclares(final ConfigItem item,
                                      final ObjectType type,
                                      final String fullName) throws ConfigObjectException {
        if (!type.getName().equals(item.getType().getName()) || !fullName.equals(item.getFullName())) {
            throw ConfigObjectException.commit("Config for object '" + fullName + "' of type '" + type.getName()
                    + "' declares object '" + item.getFullName() + "' of type '" + item.getType().getName() + "'.");
        }
    }

    private List<ConfigItem> activate(final List<ConfigItem> items,
                                      final String fullName,
                                      final MessageOrigin origin) throws ConfigObjectException {
        final WorkQueue.Batch batch = workQueue.newBatch("ActivateObject " + fullName);

        if (!runtime.activateItems(items, batch, true, origin)) {
            log.info("Failed to activate config object '{}'.", fullName);
            throw new BatchFailedException(ErrorKind.ACTIVATION, "Failed to activate config object '" + fullName + "'.",
                    batch.drainExceptions());
        }
        return items;
    }

    /**
     * The object registered under {@code fullName}, if it was produced by this call.
     */
    private Optional<ConfigObject> ownObject(final ObjectType type,
                                             final String fullName,
                                             final List<ConfigItem> items) {
        return runtime.getObject(type, fullName)
                .filter(obj -> items.stream().anyMatch(i -> i.getObject() == obj));
    }

    /**
     * Unregisters {@code newItems}. Objects that were activated are deactivated as deleted
     * first, so listeners that saw the activation see the removal too.
     */
    private void rollback(final List<ConfigItem> newItems,
                          final MessageOrigin origin,
                          final Diagnostics diagnostics) {
        for (final ConfigItem item : newItems) {
            log.debug("Rolling back {}", item);

            final ConfigObject object = item.getObject();
            if (object != null && object.isActive()) {
                object.setExtension(ConfigObject.DELETED_EXTENSION, true);
                try {
                    object.deactivate(true, origin);
                } catch (final ConfigObjectException e) {
                    log.warn("Failed to deactivate {} during rollback", object, e);
                    diagnostics.record(e, ErrorKind.ACTIVATION);
                }
            }
            runtime.unregisterItem(item);
        }
    }

    private static void report(final ConfigObjectException failure, final Diagnostics diagnostics) {
        if (failure instanceof BatchFailedException batch && !batch.getFailures().isEmpty()) {
            for (final Throwable t : batch.getFailures()) {
                diagnostics.record(t, batch.getKind());
            }
            return;
        }
        diagnostics.record(failure, failure.getKind());
    }

    private boolean isRegistered(final ConfigObject object) {
        return runtime.getObject(object.getType(), object.getName())
                .filter(o -> o == object)
                .isPresent();
    }
}
