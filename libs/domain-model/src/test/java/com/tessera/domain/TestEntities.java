package com.tessera.domain;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/** Small entities used by the domain tests. */
final class TestEntities {

    static final Instant FIXED_NOW = Instant.parse("2024-05-01T12:00:00Z");

    static final Instant CREATED_AT = Instant.parse("2024-05-01T11:00:00Z");

    private TestEntities() {
        // fixtures only
    }

    /** Versioned entity with a balance changed by deposits. */
    static class Ledger extends VersionedEntity {

        static final EntityType<Ledger> TYPE = new EntityType<>("test.ledger", Ledger.class, Ledger::new);

        private long balance;
        private String owner;

        Ledger(EntityCreated<Ledger> created) {
            super(created);
            this.owner = created.attribute("owner", String.class);
        }

        Ledger(UUID id, boolean discarded, long version) {
            super(id, discarded, version);
        }

        static Ledger open(String owner) {
            return TYPE.create(Map.of("owner", owner)).join();
        }

        CompletableFuture<Void> deposit(long amount) {
            return triggerEvent(header -> new Deposited(header, amount));
        }

        long balance() {
            return balance;
        }

        String owner() {
            return owner;
        }

        @Override
        protected void applyAttribute(String name, Object value) {
            if ("owner".equals(name)) {
                owner = (String) value;
            } else {
                super.applyAttribute(name, value);
            }
        }
    }

    static final class Deposited extends EntityEvent<Ledger> {
        private final long amount;

        Deposited(EventHeader header, long amount) {
            super(header);
            this.amount = amount;
        }

        @Override
        protected void mutate(Ledger ledger) {
            ledger.balance += amount;
        }
    }

    /** Plain entity: neither versioned nor timestamped. */
    static class Memo extends DomainEntity {

        static final EntityType<Memo> TYPE = EntityType.of(Memo.class, Memo::new);

        private String text;

        Memo(EntityCreated<Memo> created) {
            super(created);
            this.text = created.attribute("text", String.class);
        }

        String text() {
            return text;
        }

        @Override
        protected void applyAttribute(String name, Object value) {
            if ("text".equals(name)) {
                text = (String) value;
            } else {
                super.applyAttribute(name, value);
            }
        }
    }

    /** Timestamped entity whose events are stamped with {@link #FIXED_NOW}. */
    static class Stamp extends TimestampedEntity {

        static final EntityType<Stamp> TYPE = EntityType.of(Stamp.class, Stamp::new)
                .withClock(Clock.fixed(CREATED_AT, ZoneOffset.UTC));

        private String label;

        Stamp(EntityCreated<Stamp> created) {
            super(created);
            this.label = created.attribute("label", String.class);
        }

        Stamp(UUID id, boolean discarded, EntityTimestamps timestamps) {
            super(id, discarded, timestamps);
        }

        String label() {
            return label;
        }

        @Override
        protected Clock clock() {
            return Clock.fixed(FIXED_NOW, ZoneOffset.UTC);
        }

        @Override
        protected void applyAttribute(String name, Object value) {
            if ("label".equals(name)) {
                label = (String) value;
            } else {
                super.applyAttribute(name, value);
            }
        }
    }

    /** Aggregate whose commands each trigger one attribute change. */
    static class Basket extends AggregateRoot {

        static final EntityType<Basket> TYPE = EntityType.of(Basket.class, Basket::new);

        private int items;

        Basket(EntityCreated<Basket> created) {
            super(created);
        }

        Basket(UUID id, long version, EntityTimestamps timestamps) {
            super(id, false, version, timestamps);
        }

        CompletableFuture<Void> addItem() {
            return changeAttribute("items", items + 1);
        }

        int items() {
            return items;
        }

        @Override
        protected void applyAttribute(String name, Object value) {
            if ("items".equals(name)) {
                items = (Integer) value;
            } else {
                super.applyAttribute(name, value);
            }
        }
    }

    /** Entity whose registered factory never builds anything. */
    static class Ghost extends DomainEntity {

        Ghost(EntityCreated<Ghost> created) {
            super(created);
        }
    }

    /** Entity whose factory ignores the id carried by its created event. */
    static class Impostor extends DomainEntity {

        static final EntityType<Impostor> TYPE =
                new EntityType<>("test.impostor", Impostor.class, created -> new Impostor(UUID.randomUUID()));

        Impostor(UUID id) {
            super(id, false);
        }
    }

    /** Versioned entity whose factory starts it past version 0. */
    static class Drifter extends VersionedEntity {

        static final EntityType<Drifter> TYPE =
                new EntityType<>("test.drifter", Drifter.class, created -> new Drifter(created.originatorId(), 3));

        Drifter(UUID id, long version) {
            super(id, false, version);
        }
    }
}
