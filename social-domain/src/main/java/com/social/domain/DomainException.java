package com.social.domain;

/**
 * Base type for classified, backend-agnostic failures that cross component boundaries.
 */
public class DomainException extends RuntimeException {

    public DomainException(String message) {
        super(message);
    }

    public DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
