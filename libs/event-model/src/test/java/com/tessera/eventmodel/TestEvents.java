package com.tessera.eventmodel;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Event fixtures shared by the event-model tests. */
final class TestEvents {

    private TestEvents() {
        // fixtures only
    }

    static final class PriceChanged extends DomainEvent {
        private final String instrument;
        private final long amount;

        PriceChanged(String instrument, long amount) {
            this.instrument = instrument;
            this.amount = amount;
        }

        String instrument() {
            return instrument;
        }

        long amount() {
            return amount;
        }
    }

    /** Same fields as {@link PriceChanged}, different event kind. */
    static final class PriceCorrected extends DomainEvent {
        private final String instrument;
        private final long amount;

        PriceCorrected(String instrument, long amount) {
            this.instrument = instrument;
            this.amount = amount;
        }
    }

    static final class Tagged extends DomainEvent {
        private final Map<String, Object> tags;
        private final List<String> labels;
        private final Instant at;

        Tagged(Map<String, Object> tags, List<String> labels, Instant at) {
            this.tags = tags;
            this.labels = labels;
            this.at = at;
        }
    }

    static final class CustomTopic extends DomainEvent {
        private final String value;

        CustomTopic(String value) {
            this.value = value;
        }

        @Override
        public String topic() {
            return "custom.topic";
        }
    }

    /** An event whose state cannot be read by the encoder. */
    static final class Unreadable extends DomainEvent {
        public String getBroken() {
            throw new IllegalStateException("cannot read");
        }
    }
}
