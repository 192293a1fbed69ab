package com.tessera.domain;

/**
 * Raised when an event was produced for a different entity, or a different state of it.
 */
public class MismatchedOriginatorException extends ConsistencyException {

    public MismatchedOriginatorException(String message) {
        super(message);
    }
}
