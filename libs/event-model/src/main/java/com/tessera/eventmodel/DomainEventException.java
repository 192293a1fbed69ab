package com.tessera.eventmodel;

/**
 * Base type for every failure raised by the Tessera event model, domain model and event bus.
 *
 * <p>Unchecked: callers decide at the command level whether a failure is worth a retry.
 */
public class DomainEventException extends RuntimeException {

    public DomainEventException(String message) {
        super(message);
    }

    public DomainEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
