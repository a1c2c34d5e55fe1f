package com.social.infrastructure.db;

import com.social.application.config.DatabaseConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Builds the shared HikariCP pool from {@link DatabaseConfig}.
 *
 * DB_MAX_OPEN_CONNS caps the pool, DB_MAX_IDLE_CONNS is the idle floor (never above the cap)
 * and DB_MAX_IDLE_TIME retires idle connections above that floor. The pool starts lazily:
 * an unreachable database surfaces per request as an unavailable store, not as a boot failure.
 */
public final class DataSourceFactory {

    private static final Logger log = LoggerFactory.getLogger(DataSourceFactory.class);

    // HikariCP ignores idle timeouts below 10s
    static final Duration MIN_IDLE_TIMEOUT = Duration.ofSeconds(10);
    // HikariCP's default; raised when the idle timeout would reach it
    static final Duration DEFAULT_MAX_LIFETIME = Duration.ofMinutes(30);
    // HikariCP disables idleTimeout unless it stays at least 1s below maxLifetime
    static final Duration LIFETIME_HEADROOM = Duration.ofMinutes(1);

    private DataSourceFactory() {}

    public static HikariDataSource create(DatabaseConfig cfg, String poolName) {
        DatabaseUrl url = DatabaseUrl.parse(cfg.addr());

        HikariConfig hc = new HikariConfig();
        hc.setPoolName(poolName);
        hc.setJdbcUrl(url.jdbcUrl());
        if (url.username() != null) hc.setUsername(url.username());
        if (url.password() != null) hc.setPassword(url.password());

        hc.setMaximumPoolSize(cfg.maxOpenConns());
        hc.setMinimumIdle(Math.min(cfg.maxIdleConns(), cfg.maxOpenConns()));
        Duration idle = cfg.maxIdleTime().compareTo(MIN_IDLE_TIMEOUT) < 0 ? MIN_IDLE_TIMEOUT : cfg.maxIdleTime();
        hc.setIdleTimeout(idle.toMillis());
        Duration lifetime = maxLifetimeFor(idle);
        hc.setMaxLifetime(lifetime.toMillis());
        hc.setInitializationFailTimeout(-1);

        log.info("Creating connection pool {} for {} (maxOpen={}, minIdle={}, idleTimeout={}, maxLifetime={})",
                poolName, url, hc.getMaximumPoolSize(), hc.getMinimumIdle(), idle, lifetime);
        return new HikariDataSource(hc);
    }

    static Duration maxLifetimeFor(Duration idleTimeout) {
        Duration needed = idleTimeout.plus(LIFETIME_HEADROOM);
        return needed.compareTo(DEFAULT_MAX_LIFETIME) > 0 ? needed : DEFAULT_MAX_LIFETIME;
    }
}
