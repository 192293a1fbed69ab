package com.tessera.eventmodel;

import java.util.Map;

/**
 * Deterministic encoding of event state, used for content hashing only (never for transport).
 *
 * <p>Implementations must produce the same bytes for the same logical value on every call and on
 * every JVM: map keys and object properties are emitted in a stable (sorted) order.
 */
public interface CanonicalEncoder {

    /**
     * Returns the named fields of the given event, keys sorted, nested values converted to plain
     * maps, lists, strings, numbers and booleans.
     *
     * @throws EventEncodingException if the event cannot be converted
     */
    Map<String, Object> fieldsOf(DomainEvent event);

    /**
     * Encodes an arbitrary value (typically the output of {@link #fieldsOf}) to bytes.
     *
     * @throws EventEncodingException if the value cannot be encoded
     */
    byte[] encode(Object value);
}
