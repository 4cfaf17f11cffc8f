package io.stagedconf.runtime;

import io.stagedconf.cluster.MessageOrigin;
import io.stagedconf.compiler.ConfigCompiler;
import io.stagedconf.error.ConfigObjectException;
import io.stagedconf.error.Diagnostics;
import io.stagedconf.error.ErrorKind;
import io.stagedconf.object.ObjectRuntime;
import io.stagedconf.object.model.ActivationContext;
import io.stagedconf.object.model.ConfigItem;
import io.stagedconf.object.type.FieldInfo;
import io.stagedconf.object.type.ObjectType;
import io.stagedconf.queue.WorkQueue;
import io.stagedconf.storage.RuntimeObjectStorage;
import io.stagedconf.storage.pkg.impl.FileConfigPackageStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static io.stagedconf.storage.RuntimeObjectStorage.API_PACKAGE;

/**
 * Loads the runtime objects persisted in the active stage of the reserved package at node
 * start. Objects are committed in reference order (hosts before their services) and each
 * object is committed on its own, so one broken file does not keep the others from loading.
 */
@Slf4j
@RequiredArgsConstructor
public final class RuntimeObjectLoader {
    private final RuntimeObjectStorage storage;
    private final ConfigCompiler compiler;
    private final ObjectRuntime runtime;
    private final WorkQueue workQueue;

    /**
     * @return number of objects activated
     */
    public int loadAll(final Diagnostics diagnostics) {
        if (!storage.getPackageStore().packageExists(API_PACKAGE)) {
            log.info("Package {} does not exist, no runtime objects to load.", API_PACKAGE);
            return 0;
        }

        final Path confDir = storage.getConfigDir().resolve(FileConfigPackageStore.CONF_DIR);
        final List<ConfigItem> pending = new ArrayList<>();

        for (final Path file : listConfigFiles(confDir, diagnostics)) {
            try (final ActivationContext context = new ActivationContext()) {
                final String text = Files.readString(file, StandardCharsets.UTF_8);
                compiler.compileText(file, text, "", API_PACKAGE).evaluate(context);
                pending.addAll(context.drainItems());
            } catch (final ConfigObjectException | IOException e) {
                log.warn("Skipping runtime object file {}: {}", file, e.getMessage());
                diagnostics.record(e, ErrorKind.IO);
            }
        }

        final Map<String, Integer> ranks = new HashMap<>();
        pending.sort(Comparator.comparingInt(item -> rank(item.getType(), ranks, new HashSet<>())));

        final List<ConfigItem> committed = new ArrayList<>();
        for (final ConfigItem item : pending) {
            final WorkQueue.Batch batch = workQueue.newBatch("LoadObject " + item.getName());
            try (final ActivationContext context = new ActivationContext()) {
                context.addItem(item);
                if (!runtime.commitItems(context, batch, committed)) {
                    batch.drainExceptions().forEach(t -> {
                        log.warn("Cannot load {}: {}", item, t.getMessage());
                        diagnostics.record(t, ErrorKind.COMMIT);
                    });
                }
            }
        }

        final WorkQueue.Batch activation = workQueue.newBatch("ActivateLoadedObjects");
        if (!runtime.activateItems(committed, activation, false, MessageOrigin.local())) {
            activation.drainExceptions().forEach(t -> diagnostics.record(t, ErrorKind.ACTIVATION));
        }

        final int active = (int) committed.stream()
                .filter(i -> i.getObject() != null && i.getObject().isActive())
                .count();
        log.info("Loaded {} runtime objects from package {}.", active, API_PACKAGE);
        return active;
    }

    private static List<Path> listConfigFiles(final Path confDir, final Diagnostics diagnostics) {
        if (!Files.isDirectory(confDir)) return List.of();

        try (final Stream<Path> walk = Files.walk(confDir)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(ObjectPathDeriver.FILE_SUFFIX))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (final IOException e) {
            diagnostics.record(e, ErrorKind.IO);
            return List.of();
        }
    }

    /**
     * 0 for types without references, otherwise one more than the highest referenced type.
     */
    private int rank(final ObjectType type, final Map<String, Integer> ranks, final Set<String> visiting) {
        final Integer known = ranks.get(type.getName());
        if (known != null) return known;
        if (!visiting.add(type.getName())) return 0;

        int rank = 0;
        for (int fid = 0; fid < type.getFieldCount(); fid++) {
            final FieldInfo field = type.getFieldInfo(fid);
            if (!field.isReference() || field.referenceType().equals(type.getName())) continue;

            final int target = runtime.getTypes().getByName(field.referenceType())
                    .map(t -> rank(t, ranks, visiting))
                    .orElse(0);
            rank = Math.max(rank, target + 1);
        }

        ranks.put(type.getName(), rank);
        return rank;
    }
}
