package com.social.infrastructure.db;

import com.social.domain.DomainException;
import com.social.domain.error.ConflictException;
import com.social.domain.error.InternalException;
import com.social.domain.error.UnavailableException;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

import java.util.Locale;

/**
 * Maps Spring's translated {@link DataAccessException}s onto the domain error taxonomy.
 * Nothing backend-specific leaves the store unwrapped.
 */
public final class JdbcErrorClassifier {

    static final String USERNAME_CONSTRAINT = "uk_users_username";
    static final String EMAIL_CONSTRAINT = "uk_users_email";

    public DomainException classify(DataAccessException e, String operation) {
        if (e instanceof DuplicateKeyException) {
            return new ConflictException(conflictField(e), e);
        }
        if (e instanceof TransientDataAccessException
                || e instanceof RecoverableDataAccessException
                || e instanceof DataAccessResourceFailureException) {
            return new UnavailableException(operation + " failed: store unavailable", e);
        }
        return new InternalException(operation + " failed", e);
    }

    static String conflictField(DataAccessException e) {
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(e);
        String text = ((cause.getMessage() == null ? "" : cause.getMessage()) + " "
                + (e.getMessage() == null ? "" : e.getMessage())).toLowerCase(Locale.ROOT);
        if (text.contains(USERNAME_CONSTRAINT)) return "username";
        if (text.contains(EMAIL_CONSTRAINT)) return "email";
        return null;
    }
}
