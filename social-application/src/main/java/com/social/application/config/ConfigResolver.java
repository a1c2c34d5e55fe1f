package com.social.application.config;

import com.social.application.ports.ConfigPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Resolves {@link AppConfig} from a {@link ConfigPort}.
 *
 * Required keys that are absent or blank fail resolution with a {@link ConfigurationException}
 * listing every missing key. Optional keys fall back to their default when absent, and also
 * when present but not convertible to the key's type or outside its bounds; the latter is
 * logged at WARN.
 *
 * The resolver never exits the process. Entry points decide what to do with the exception.
 */
public final class ConfigResolver {

    private static final Logger log = LoggerFactory.getLogger(ConfigResolver.class);

    public AppConfig resolve(ConfigPort source) {
        Objects.requireNonNull(source, "source");

        ConfigValidationResult res = new ConfigValidationResult();
        for (ConfigKey k : ConfigKey.values()) {
            if (k.isRequired() && raw(source, k) == null) {
                res.addError("Missing required " + (k.isSecret() ? "secret" : "config") + ": " + k.key());
            }
        }
        if (!res.isValid()) {
            throw new ConfigurationException(res.errors());
        }

        AppConfig cfg = new AppConfig(
                string(source, ConfigKey.SERVICE_NAME),
                string(source, ConfigKey.ENV_NAME),
                integer(source, ConfigKey.SERVER_PORT),
                duration(source, ConfigKey.REQUEST_TIMEOUT),
                integer(source, ConfigKey.SERVER_WORKER_THREADS),
                new DatabaseConfig(
                        string(source, ConfigKey.DB_ADDR),
                        integer(source, ConfigKey.DB_MAX_OPEN_CONNS),
                        integer(source, ConfigKey.DB_MAX_IDLE_CONNS),
                        duration(source, ConfigKey.DB_MAX_IDLE_TIME)
                )
        );

        log.info("Loaded environment config: {}", cfg.summary());
        return cfg;
    }

    /**
     * SERVER_PORT alone, with the same fallback as {@link #resolve}. For listeners that must
     * bind before the rest of the configuration is resolved.
     */
    public int serverPort(ConfigPort source) {
        return integer(Objects.requireNonNull(source, "source"), ConfigKey.SERVER_PORT);
    }

    private static String raw(ConfigPort source, ConfigKey k) {
        String v = source.get(k.key());
        if (v == null) return null;
        String t = v.trim();
        return t.isEmpty() ? null : t;
    }

    private static String string(ConfigPort source, ConfigKey k) {
        String v = raw(source, k);
        return v == null ? k.defaultValue() : v;
    }

    private static int integer(ConfigPort source, ConfigKey k) {
        int def = Integer.parseInt(k.defaultValue());
        String v = raw(source, k);
        if (v == null) return def;

        int n;
        try {
            n = Integer.parseInt(v);
        } catch (NumberFormatException e) {
            return fallback(k, v, "not an integer", def);
        }
        if (n < k.min() || n > k.max()) {
            return fallback(k, v, "outside [" + k.min() + ", " + k.max() + "]", def);
        }
        return n;
    }

    private static Duration duration(ConfigPort source, ConfigKey k) {
        Duration def = DurationStrings.parse(k.defaultValue());
        String v = raw(source, k);
        if (v == null) return def;

        Duration d;
        try {
            d = DurationStrings.parse(v);
        } catch (IllegalArgumentException e) {
            return fallback(k, v, "not a duration", def);
        }
        if (d.isZero() || d.isNegative()) {
            return fallback(k, v, "not positive", def);
        }
        return d;
    }

    private static <T> T fallback(ConfigKey k, String value, String problem, T def) {
        log.warn("Ignoring {}={} ({}); using default {}",
                k.key(), k.isSecret() ? ConfigRedactor.MASK : value, problem, def);
        return def;
    }
}
