package com.tessera.spring;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized configuration of the event model and bus, bound from {@code tessera.*}.
 *
 * <pre>
 * tessera:
 *   hashing:
 *     salt: ${SALT_FOR_DATA_INTEGRITY:}
 *   bus:
 *     name: orders
 *     handler-timeout: 5s
 *     metrics-enabled: true
 *     install-global: true
 * </pre>
 *
 * @param hashing event hashing settings
 * @param bus     event bus settings
 */
@ConfigurationProperties(prefix = "tessera")
@Validated
public record TesseraProperties(@Valid Hashing hashing, @Valid Bus bus) {

    public TesseraProperties {
        if (hashing == null) {
            hashing = new Hashing(null);
        }
        if (bus == null) {
            bus = new Bus(null, null, null, null);
        }
    }

    /**
     * @param salt salt mixed into every event digest; when unset, the salt is read from the
     *             environment as {@link com.tessera.eventmodel.HashingSettings#fromEnvironment()} does
     */
    public record Hashing(String salt) {
    }

    /**
     * @param name           value of the {@code bus} metric tag (default "default")
     * @param handlerTimeout upper bound for each handler invocation; unbounded when unset
     * @param metricsEnabled record bus metrics when a {@code MeterRegistry} bean exists (default true)
     * @param installGlobal  make the bus the one entities publish to (default true)
     */
    public record Bus(
            @NotBlank String name,
            @DurationMin(millis = 1) Duration handlerTimeout,
            Boolean metricsEnabled,
            Boolean installGlobal) {

        public Bus {
            if (name == null || name.isBlank()) {
                name = "default";
            }
            if (metricsEnabled == null) {
                metricsEnabled = Boolean.TRUE;
            }
            if (installGlobal == null) {
                installGlobal = Boolean.TRUE;
            }
        }
    }
}
