package com.social.application.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection string and pool sizing for the relational store.
 */
public record DatabaseConfig(
        String addr,
        int maxOpenConns,
        int maxIdleConns,
        Duration maxIdleTime
) {
    public DatabaseConfig {
        Objects.requireNonNull(addr, "addr");
        Objects.requireNonNull(maxIdleTime, "maxIdleTime");
    }

    @Override
    public String toString() {
        return "DatabaseConfig[addr=" + ConfigRedactor.maskUrl(addr)
                + ", maxOpenConns=" + maxOpenConns
                + ", maxIdleConns=" + maxIdleConns
                + ", maxIdleTime=" + maxIdleTime + "]";
    }
}
