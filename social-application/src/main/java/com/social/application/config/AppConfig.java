package com.social.application.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Process-wide configuration. Built once at startup by {@link ConfigResolver} and handed to
 * every component that needs it; never reloaded.
 */
public record AppConfig(
        String serviceName,
        String envName,
        int serverPort,
        Duration requestTimeout,
        int serverWorkerThreads,
        DatabaseConfig database
) {
    public static final String VERSION = "0.0.1";

    public AppConfig {
        Objects.requireNonNull(serviceName, "serviceName");
        Objects.requireNonNull(envName, "envName");
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        Objects.requireNonNull(database, "database");
    }

    /** Log-safe one-line rendering; credentials are masked. */
    public String summary() {
        return "service=" + serviceName
                + " env=" + envName
                + " version=" + VERSION
                + " port=" + serverPort
                + " requestTimeout=" + requestTimeout
                + " workerThreads=" + serverWorkerThreads
                + " db=" + database;
    }

    @Override
    public String toString() {
        return "AppConfig[" + summary() + "]";
    }
}
