package com.social.infrastructure.db;

import com.social.domain.DomainException;
import com.social.domain.error.ConflictException;
import com.social.domain.error.InternalException;
import com.social.domain.error.UnavailableException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcErrorClassifierTest {

    private final JdbcErrorClassifier classifier = new JdbcErrorClassifier();

    @Test
    void duplicateKeyIsConflictNamingTheField() {
        DomainException username = classifier.classify(new DuplicateKeyException("insert",
                new SQLException("duplicate key value violates unique constraint \"uk_users_username\"", "23505")), "insert user");
        DomainException email = classifier.classify(new DuplicateKeyException("insert",
                new SQLException("duplicate key value violates unique constraint \"uk_users_email\"", "23505")), "insert user");
        DomainException unknown = classifier.classify(new DuplicateKeyException("duplicate"), "insert user");

        assertThat(username).isInstanceOf(ConflictException.class);
        assertThat(((ConflictException) username).field()).isEqualTo("username");
        assertThat(((ConflictException) email).field()).isEqualTo("email");
        assertThat(((ConflictException) unknown).field()).isNull();
    }

    @Test
    void connectionAndTimeoutFailuresAreUnavailable() {
        assertThat(classifier.classify(new CannotGetJdbcConnectionException("pool",
                new SQLTransientConnectionException("Connection is not available, request timed out after 30000ms")), "insert user"))
                .isInstanceOf(UnavailableException.class);
        assertThat(classifier.classify(new QueryTimeoutException("canceling statement due to statement timeout"), "insert user"))
                .isInstanceOf(UnavailableException.class);
    }

    @Test
    void everythingElseIsInternal() {
        DomainException e = classifier.classify(new BadSqlGrammarException("insert user", "INSERT ...",
                new SQLException("relation \"users\" does not exist", "42P01")), "insert user");

        assertThat(e).isInstanceOf(InternalException.class).hasMessage("insert user failed");
        assertThat(e.getCause()).isInstanceOf(BadSqlGrammarException.class);
    }
}
