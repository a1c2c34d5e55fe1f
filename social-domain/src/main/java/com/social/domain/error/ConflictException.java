package com.social.domain.error;

import com.social.domain.DomainException;

/**
 * A uniqueness rule of the store was violated (duplicate username or email).
 */
public final class ConflictException extends DomainException {

    private final String field;

    public ConflictException(String field, Throwable cause) {
        super(field == null ? "record already exists" : field + " already exists", cause);
        this.field = field;
    }

    /** Conflicting field name, or {@code null} when the store could not tell. */
    public String field() {
        return field;
    }
}
