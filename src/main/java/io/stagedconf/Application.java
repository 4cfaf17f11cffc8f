package io.stagedconf;

import io.stagedconf.cluster.ClusterObjectReplicator;
import io.stagedconf.compiler.impl.ObjectDefinitionCompiler;
import io.stagedconf.config.impl.NodeConfig;
import io.stagedconf.config.type.ConfigLoader;
import io.stagedconf.error.Diagnostics;
import io.stagedconf.object.ObjectRuntime;
import io.stagedconf.object.type.MonitoringTypes;
import io.stagedconf.object.type.TypeRegistry;
import io.stagedconf.queue.WorkQueue;
import io.stagedconf.runtime.RuntimeObjectLoader;
import io.stagedconf.runtime.RuntimeObjectManager;
import io.stagedconf.storage.RuntimeObjectStorage;
import io.stagedconf.storage.pkg.impl.FileConfigPackageStore;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Main class to start a StagedConf node.
 */
@Slf4j
public class Application {
    public static void main(final String[] args) throws Exception {
        if (args.length < 1) {
            System.err.println("Usage: java -jar stagedconf.jar <node-config.yaml>");
            System.exit(1);
        }

        final NodeConfig cfg = ConfigLoader.load(args[0]);
        Files.createDirectories(cfg.getPackagesDir());

        final TypeRegistry types = MonitoringTypes.createRegistry();
        final ObjectRuntime runtime = new ObjectRuntime(types);
        final ObjectDefinitionCompiler compiler = new ObjectDefinitionCompiler(types);
        final RuntimeObjectStorage storage = new RuntimeObjectStorage(
                new FileConfigPackageStore(cfg.getPackagesDir(), cfg.getNodeName()));
        final WorkQueue workQueue = new WorkQueue("objects", cfg.getWorkQueueThreads());

        final RuntimeObjectManager manager = new RuntimeObjectManager(storage, compiler, runtime, workQueue,
                () -> log.debug("Object authority of zone '{}' needs to be recalculated", cfg.getZone()));

        /* No peer transport is wired in, updates only reach endpoints with a registered client. */
        final List<String> members = new ArrayList<>(cfg.getPeers());
        members.add(cfg.getNodeName());
        final ClusterObjectReplicator replicator = new ClusterObjectReplicator(
                cfg.getNodeName(), Map.of(), () -> members, manager);
        runtime.getEvents().addListener(replicator);

        final Diagnostics diagnostics = new Diagnostics();
        final int loaded = new RuntimeObjectLoader(storage, compiler, runtime, workQueue).loadAll(diagnostics);
        if (!diagnostics.isEmpty()) {
            log.warn("Some runtime objects could not be loaded:\n{}", String.join("\n", diagnostics.errors()));
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down node {}...", cfg.getNodeName());
            workQueue.close();
        }));

        log.info("Node {} started with {} runtime objects in {}", cfg.getNodeName(), loaded, cfg.getPackagesDir());
        Thread.currentThread().join();
    }
}
