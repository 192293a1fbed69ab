package com.tessera.domain;

import com.tessera.eventbus.EventBusHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Root entity of an aggregate. Triggered events are queued and published together by
 * {@link #save()}.
 * <p>
 * {@code save()} drains the whole queue into a single batch and publishes it with one call. If
 * that publish fails the drained events are not put back: the aggregate's state already reflects
 * them, so the caller must repeat the commands that produced them rather than the save.
 */
public abstract class AggregateRoot extends TimestampedVersionedEntity {

    private static final Logger log = LoggerFactory.getLogger(AggregateRoot.class);

    private final Deque<EntityEvent<?>> pendingEvents = new ArrayDeque<>();

    protected AggregateRoot(EntityCreated<?> created) {
        super(created);
    }

    protected AggregateRoot(UUID id, boolean discarded, long version, EntityTimestamps timestamps) {
        super(id, discarded, version, timestamps);
    }

    /** Queues the events; the returned future is already complete. */
    @Override
    protected CompletableFuture<Void> publish(List<? extends EntityEvent<?>> events) {
        pendingEvents.addAll(events);
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Publishes every pending event as one batch, in the order they were triggered. Does nothing
     * when no event is pending.
     *
     * @return a future completing when the batch has been published
     */
    public CompletableFuture<Void> save() {
        List<EntityEvent<?>> batch = drainPendingEvents();
        if (batch.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        log.debug("Saving {} pending event(s) of {}", batch.size(), id());
        return EventBusHolder.get().publish(batch);
    }

    /** Snapshot of the events not yet saved. */
    public List<EntityEvent<?>> pendingEvents() {
        return List.copyOf(pendingEvents);
    }

    public int pendingEventCount() {
        return pendingEvents.size();
    }

    private List<EntityEvent<?>> drainPendingEvents() {
        List<EntityEvent<?>> batch = new ArrayList<>(pendingEvents.size());
        EntityEvent<?> event;
        while ((event = pendingEvents.pollFirst()) != null) {
            batch.add(event);
        }
        return batch;
    }
}
