package com.tessera.eventbus;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide holder of the {@link EventBus} that entities publish to.
 * <p>
 * Starts out with an empty {@link DefaultEventBus}. Applications replace it with {@link #set}
 * (the Spring auto-configuration does so); tests restore a fresh bus with {@link #reset()}.
 */
public final class EventBusHolder {

    private static final AtomicReference<EventBus> BUS = new AtomicReference<>(new DefaultEventBus());

    private EventBusHolder() {
        // Utility class
    }

    /** Returns the current process-wide bus. */
    public static EventBus get() {
        return BUS.get();
    }

    /**
     * Replaces the process-wide bus.
     *
     * @param bus the bus to install (must not be null)
     * @throws IllegalArgumentException if bus is null
     */
    public static void set(EventBus bus) {
        if (bus == null) {
            throw new IllegalArgumentException("bus must not be null");
        }
        BUS.set(bus);
    }

    /** Installs a fresh, empty {@link DefaultEventBus} and returns it. */
    public static EventBus reset() {
        EventBus fresh = new DefaultEventBus();
        BUS.set(fresh);
        return fresh;
    }
}
