package io.stagedconf.config.impl;

import lombok.Getter;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable config holder loaded from node.yaml
 */
@Getter
public final class NodeConfig {
    private static final int DEFAULT_WORK_QUEUE_THREADS = 4;

    private String nodeName;
    private Path dataDir;
    private Path packagesDir;
    private int workQueueThreads;
    private String zone;
    private List<String> peers;

    public static NodeConfig load(final String path) throws IOException {
        final Yaml yaml = new Yaml();

        try (final InputStream in = Files.newInputStream(Paths.get(path))) {
            final Map<String, Object> m = yaml.load(in);
            if (m == null) {
                throw new IOException("Empty node configuration: " + path);
            }
            return fromMap(m);
        }
    }

    @SuppressWarnings("unchecked")
    static NodeConfig fromMap(final Map<String, Object> m) throws IOException {
        final NodeConfig cfg = new NodeConfig();

        cfg.nodeName = (String) m.get("nodeName");
        if (cfg.nodeName == null || cfg.nodeName.isBlank()) {
            throw new IOException("nodeName is required");
        }

        cfg.dataDir = Paths.get((String) Objects.requireNonNullElse(m.get("dataDir"), "data"));

        final String packages = (String) m.get("packagesDir");
        cfg.packagesDir = packages != null
                ? Paths.get(packages)
                : cfg.dataDir.resolve("api").resolve("packages");

        cfg.workQueueThreads = (Integer) m.getOrDefault("workQueueThreads", DEFAULT_WORK_QUEUE_THREADS);
        if (cfg.workQueueThreads <= 0) {
            throw new IOException("workQueueThreads must be positive, got " + cfg.workQueueThreads);
        }

        cfg.zone = (String) m.getOrDefault("zone", "");
        cfg.peers = List.copyOf((List<String>) m.getOrDefault("peers", List.of()));
        return cfg;
    }
}
