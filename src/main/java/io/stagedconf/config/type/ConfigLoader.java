package io.stagedconf.config.type;

import io.stagedconf.config.impl.NodeConfig;
import lombok.experimental.UtilityClass;

import java.io.IOException;

@UtilityClass
public class ConfigLoader {

    /**
     * Loads node configuration from a YAML file by delegating to {@link NodeConfig#load(String)}.
     *
     * @param path the path to the node YAML configuration file
     * @return a populated {@link NodeConfig} instance
     * @throws IOException if the file cannot be read or a required key is missing
     */
    public static NodeConfig load(final String path) throws IOException {
        return NodeConfig.load(path);
    }
}
