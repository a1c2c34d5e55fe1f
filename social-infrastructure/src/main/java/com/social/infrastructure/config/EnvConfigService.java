package com.social.infrastructure.config;

import com.social.application.ports.ConfigPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Environment-variable configuration.
 *
 * Load order (low -> high priority):
 *  1) .env in the working directory (optional)
 *  2) OS environment variables
 */
public final class EnvConfigService implements ConfigPort {

    private static final Logger log = LoggerFactory.getLogger(EnvConfigService.class);

    private final Map<String, String> values;

    public EnvConfigService(Map<String, String> environment, Map<String, String> dotEnv) {
        Map<String, String> merged = new LinkedHashMap<>(dotEnv);
        merged.putAll(environment);
        this.values = Map.copyOf(merged);
    }

    public static EnvConfigService fromProcess() throws IOException {
        return fromProcess(Path.of(System.getProperty("user.dir")).resolve(".env"));
    }

    public static EnvConfigService fromProcess(Path envFile) throws IOException {
        Map<String, String> dotEnv = DotEnv.loadIfExists(envFile);
        if (!dotEnv.isEmpty()) {
            log.info("Read {} entries from {}", dotEnv.size(), envFile);
        }
        return new EnvConfigService(System.getenv(), dotEnv);
    }

    @Override
    public String get(String key) {
        return values.get(key);
    }
}
