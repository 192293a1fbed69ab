package com.tessera.domain;

/**
 * Capability of entities that count the events applied to them.
 * <p>
 * A newly created entity is at version 0; each further event increments the version by one.
 */
public interface Versioned {

    long version();
}
