package com.tessera.eventmodel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Computes the SHA-256 content digest that defines {@link DomainEvent} equality.
 * <p>
 * The hashed value is the canonical encoding of {@code [fields, salt]}, where {@code fields} is
 * the event's field map plus an {@value #TOPIC_FIELD} entry holding the event topic. Including
 * the topic keeps two event kinds with identical field values apart.
 * <p>
 * A process-wide hasher backs {@link DomainEvent#equals(Object)}. It is created lazily from
 * {@link HashingSettings#fromEnvironment()} and can be replaced with {@link #install(EventHasher)}.
 */
public final class EventHasher {

    /** Key under which the event topic is mixed into the hashed field map. */
    public static final String TOPIC_FIELD = "__event_topic__";

    private static final Logger log = LoggerFactory.getLogger(EventHasher.class);

    private static final AtomicReference<EventHasher> DEFAULT = new AtomicReference<>();

    private final CanonicalEncoder encoder;
    private final String salt;

    /**
     * Creates a hasher.
     *
     * @param encoder canonical encoder for event fields
     * @param settings hashing settings (salt)
     */
    public EventHasher(CanonicalEncoder encoder, HashingSettings settings) {
        if (encoder == null) {
            throw new IllegalArgumentException("encoder must not be null");
        }
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        this.encoder = encoder;
        this.salt = settings.salt();
    }

    /** Returns the process-wide hasher, creating it from the environment on first use. */
    public static EventHasher defaultHasher() {
        EventHasher hasher = DEFAULT.get();
        if (hasher == null) {
            DEFAULT.compareAndSet(
                    null,
                    new EventHasher(new JacksonCanonicalEncoder(), HashingSettings.fromEnvironment()));
            hasher = DEFAULT.get();
        }
        return hasher;
    }

    /** Replaces the process-wide hasher. */
    public static void install(EventHasher hasher) {
        if (hasher == null) {
            throw new IllegalArgumentException("hasher must not be null");
        }
        DEFAULT.set(hasher);
        log.debug("Installed event hasher (salted={})", !hasher.salt.isEmpty());
    }

    /** Drops the process-wide hasher; the next use re-reads the environment. */
    public static void reset() {
        DEFAULT.set(null);
    }

    /**
     * Returns the hex-encoded SHA-256 digest of the event's topic, fields and salt.
     *
     * @throws EventEncodingException if the encoder cannot encode the event
     */
    public String digest(DomainEvent event) {
        Map<String, Object> attrs = new TreeMap<>(encoder.fieldsOf(event));
        attrs.put(TOPIC_FIELD, event.topic());
        byte[] encoded = encoder.encode(List.of(attrs, salt));
        return HexFormat.of().formatHex(sha256().digest(encoded));
    }

    /** Returns the field map of the event, as seen by the encoder. */
    public Map<String, Object> fieldsOf(DomainEvent event) {
        return encoder.fieldsOf(event);
    }

    /** Returns the encoder used by this hasher. */
    public CanonicalEncoder encoder() {
        return encoder;
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available on this JVM", e);
        }
    }
}
