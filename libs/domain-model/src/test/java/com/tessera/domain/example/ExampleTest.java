package com.tessera.domain.example;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tessera.domain.EntityCreated;
import com.tessera.domain.EntityDiscardedException;
import com.tessera.domain.EventHeader;
import com.tessera.domain.OriginatorIdMismatchException;
import com.tessera.domain.OriginatorVersionMismatchException;
import com.tessera.domain.example.Example.ExampleInternalAdded;
import com.tessera.eventbus.EventBusHolder;
import com.tessera.eventbus.testing.RecordingEventHandler;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * End-to-end walk through the sample aggregate: plain entity events are published at once while
 * the aggregate's own events wait for {@link Example#save()}.
 */
@DisplayName("Example aggregate")
class ExampleTest {

    private RecordingEventHandler received;

    @BeforeEach
    void setUp() {
        received = new RecordingEventHandler("received");
        EventBusHolder.reset().subscribe(received);
    }

    @Test
    @DisplayName("should track internals, versions and publication across its life cycle")
    void lifecycle() {
        Example example = Example.create("Ada", "Lovelace", 36).join();

        assertThat(example.version()).isZero();
        assertThat(example.firstName()).isEqualTo("Ada");
        assertThat(example.age()).isEqualTo(36);

        example.add(1).join();
        example.add(2).join();
        example.add(3).join();

        assertThat(example.version()).isEqualTo(3);
        assertThat(example.sum()).isEqualTo(6);
        assertThat(example.internals()).extracting(ExampleInternal::value).containsExactly(1, 2, 3);
        assertThat(received.events()).hasSize(3).allMatch(EntityCreated.class::isInstance);

        example.changeAttribute("age", 37).join();

        assertThat(example.version()).isEqualTo(4);
        assertThat(example.age()).isEqualTo(37);
        assertThat(example.pendingEventCount()).isEqualTo(5);

        example.save().join();

        assertThat(example.pendingEventCount()).isZero();
        assertThat(received.events()).hasSize(8);
        assertThat(received.batches()).hasSize(4);
        assertThat(received.batches().get(3)).hasSize(5);
        assertThat(received.batches().get(3).get(1)).isInstanceOf(ExampleInternalAdded.class);
    }

    @Test
    @DisplayName("should reject commands once discarded")
    void discarded() {
        Example example = Example.create("Ada", "Lovelace", 36).join();

        example.discard().join();

        assertThat(example.isDiscarded()).isTrue();
        assertThatThrownBy(() -> example.changeAttribute("age", 40)).isInstanceOf(EntityDiscardedException.class);
        assertThatThrownBy(example::discard).isInstanceOf(EntityDiscardedException.class);
    }

    @Test
    @DisplayName("should reject events for another version or another entity")
    void consistency() {
        Example example = Example.create("Ada", "Lovelace", 36).join();
        ExampleInternal internal = ExampleInternal.create(5).join();

        var wrongVersion = new ExampleInternalAdded(new EventHeader(example.id(), 7L, null), internal);
        var wrongId = new ExampleInternalAdded(new EventHeader(UUID.randomUUID(), 1L, null), internal);

        assertThatThrownBy(() -> example.mutate(wrongVersion)).isInstanceOf(OriginatorVersionMismatchException.class);
        assertThatThrownBy(() -> example.mutate(wrongId)).isInstanceOf(OriginatorIdMismatchException.class);
        assertThat(example.internals()).isEmpty();
    }
}
