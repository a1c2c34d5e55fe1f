package com.social.infrastructure.db;

import com.social.application.http.RequestContext;
import com.social.application.ports.UserStore;
import com.social.domain.error.InternalException;
import com.social.domain.error.UnavailableException;
import com.social.domain.user.User;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Objects;

/**
 * {@link UserStore} over the {@code users} table.
 *
 * The database generates {@code id} and {@code created_at}; they come back through generated
 * keys. The request deadline becomes the statement's query timeout.
 */
public final class JdbcUserStore implements UserStore {

    static final String INSERT_SQL = "INSERT INTO users (username, password, email) VALUES (?, ?, ?)";
    private static final String[] GENERATED_COLUMNS = {"id", "created_at"};

    private final JdbcTemplate jdbc;
    private final JdbcErrorClassifier errors;

    public JdbcUserStore(JdbcTemplate jdbc) {
        this(jdbc, new JdbcErrorClassifier());
    }

    public JdbcUserStore(JdbcTemplate jdbc, JdbcErrorClassifier errors) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
        this.errors = Objects.requireNonNull(errors, "errors");
    }

    @Override
    public User create(User user, RequestContext ctx) {
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(ctx, "ctx");
        if (user.isPersisted()) {
            throw new IllegalArgumentException("user " + user.id() + " is already persisted");
        }
        int timeoutSeconds = queryTimeoutSeconds(ctx);

        KeyHolder keys = new GeneratedKeyHolder();
        try {
            jdbc.update(con -> {
                PreparedStatement ps = con.prepareStatement(INSERT_SQL, GENERATED_COLUMNS);
                ps.setString(1, user.username());
                ps.setString(2, user.password());
                ps.setString(3, user.email());
                if (timeoutSeconds > 0) ps.setQueryTimeout(timeoutSeconds);
                return ps;
            }, keys);
        } catch (DataAccessException e) {
            throw errors.classify(e, "insert user");
        }

        Map<String, Object> row = keys.getKeys();
        if (row == null || !(row.get("id") instanceof Number id) || row.get("created_at") == null) {
            throw new InternalException("insert user returned no generated keys: " + row, null);
        }
        return user.withStoreAssigned(id.longValue(), toInstant(row.get("created_at")));
    }

    /**
     * Whole seconds left on the request, rounded up; 0 means no limit.
     * An expired request never reaches the pool.
     */
    static int queryTimeoutSeconds(RequestContext ctx) {
        if (ctx.isExpired()) {
            throw new UnavailableException("request deadline exceeded before insert (requestId=" + ctx.requestId() + ")");
        }
        return ctx.remaining()
                .map(JdbcUserStore::ceilSeconds)
                .orElse(0);
    }

    private static int ceilSeconds(Duration d) {
        long millis = Math.max(1, d.toMillis());
        return (int) Math.min(Integer.MAX_VALUE, (millis + 999) / 1000);
    }

    static Instant toInstant(Object value) {
        if (value instanceof Timestamp ts) return ts.toInstant();
        if (value instanceof OffsetDateTime odt) return odt.toInstant();
        if (value instanceof Instant i) return i;
        // TIMESTAMP without zone is stored in UTC
        if (value instanceof LocalDateTime ldt) return ldt.toInstant(ZoneOffset.UTC);
        throw new InternalException("unexpected created_at type: " + value.getClass().getName(), null);
    }
}
