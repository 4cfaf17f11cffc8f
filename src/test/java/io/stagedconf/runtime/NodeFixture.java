package io.stagedconf.runtime;

import io.stagedconf.cluster.MessageOrigin;
import io.stagedconf.cluster.ObjectAuthorityNotifier;
import io.stagedconf.compiler.impl.ObjectDefinitionCompiler;
import io.stagedconf.error.ConfigObjectException;
import io.stagedconf.error.Diagnostics;
import io.stagedconf.object.ObjectRuntime;
import io.stagedconf.object.model.ConfigObject;
import io.stagedconf.object.type.MonitoringTypes;
import io.stagedconf.object.type.ObjectType;
import io.stagedconf.queue.WorkQueue;
import io.stagedconf.storage.RuntimeObjectStorage;
import io.stagedconf.storage.pkg.impl.FileConfigPackageStore;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One node wired the way {@code Application} wires it, on top of a temp directory.
 */
public final class NodeFixture implements AutoCloseable {
    public final ObjectRuntime runtime = new ObjectRuntime(MonitoringTypes.createRegistry());
    public final ObjectDefinitionCompiler compiler = new ObjectDefinitionCompiler(runtime.getTypes());
    public final WorkQueue workQueue = new WorkQueue("test-objects", 4);
    public final AtomicInteger authorityUpdates = new AtomicInteger();
    public final RuntimeObjectStorage storage;
    public final RuntimeObjectManager manager;
    public final ObjectConfigSerializer serializer;

    public NodeFixture(final Path packagesDir) {
        this(packagesDir, Clock.systemUTC());
    }

    public NodeFixture(final Path packagesDir, final Clock clock) {
        this(packagesDir, clock, null);
    }

    /**
     * @param authority notified instead of counting {@link #authorityUpdates}, if not null
     */
    public NodeFixture(final Path packagesDir, final Clock clock, final ObjectAuthorityNotifier authority) {
        this.storage = new RuntimeObjectStorage(new FileConfigPackageStore(packagesDir, "node-1"));
        this.manager = new RuntimeObjectManager(storage, compiler, runtime, workQueue,
                authority != null ? authority : authorityUpdates::incrementAndGet);
        this.serializer = new ObjectConfigSerializer(clock);
    }

    public ObjectType type(final String name) {
        return runtime.getTypes().getByName(name).orElseThrow();
    }

    public String config(final String type, final String fullName, final Map<String, Object> attrs)
            throws ConfigObjectException {
        return serializer.createObjectConfig(type(type), fullName, false, List.of(), attrs);
    }

    public boolean create(final String type, final String fullName, final Map<String, Object> attrs,
                          final Diagnostics diagnostics) throws ConfigObjectException {
        return manager.createObject(type(type), fullName, config(type, fullName, attrs), diagnostics,
                MessageOrigin.local());
    }

    public Optional<ConfigObject> object(final String type, final String fullName) {
        return runtime.getObject(type(type), fullName);
    }

    public Path configPath(final String type, final String fullName) throws ConfigObjectException {
        return new ObjectPathDeriver(storage).computeNewObjectConfigPath(type(type), fullName);
    }

    @Override
    public void close() {
        workQueue.close();
    }
}
