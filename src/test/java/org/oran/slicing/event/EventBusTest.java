package org.oran.slicing.event;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.oran.slicing.model.SliceId;
import org.oran.slicing.model.SliceType;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EventBusTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private Consumer<Event.SliceDeletedEvent> deletedHandler;

    @Mock
    private Consumer<Event> wildcardHandler;

    @Test
    void shouldDeliverOnlyMatchingTypeToTypedSubscriber() {
        EventBus bus = new EventBus();
        bus.subscribe(Event.SliceDeletedEvent.class, deletedHandler);

        Event.SliceCreatedEvent created = new Event.SliceCreatedEvent(T0, SliceId.of(1), SliceType.EMBB);
        Event.SliceDeletedEvent deleted = new Event.SliceDeletedEvent(T0, SliceId.of(1));
        bus.publish(created);
        bus.publish(deleted);

        verify(deletedHandler).accept(deleted);
        verifyNoMoreInteractions(deletedHandler);
    }

    @Test
    void shouldDeliverTypedSubscribersBeforeWildcards() {
        EventBus bus = new EventBus();
        bus.subscribe(Event.SliceDeletedEvent.class, deletedHandler);
        bus.subscribeAll(wildcardHandler);

        Event.SliceDeletedEvent deleted = new Event.SliceDeletedEvent(T0, SliceId.of(3));
        bus.publish(deleted);

        InOrder order = inOrder(deletedHandler, wildcardHandler);
        order.verify(deletedHandler).accept(deleted);
        order.verify(wildcardHandler).accept(deleted);
    }

    @Test
    void shouldKeepDeliveringWhenAHandlerFails() {
        EventBus bus = new EventBus();
        bus.subscribeAll(e -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribeAll(wildcardHandler);

        Event.SliceDeletedEvent deleted = new Event.SliceDeletedEvent(T0, SliceId.of(3));
        bus.publish(deleted);

        verify(wildcardHandler).accept(deleted);
    }

    @Test
    void shouldRecordHistoryInPublicationOrder() {
        EventBus bus = new EventBus(true);
        bus.publish(new Event.SliceCreatedEvent(T0, SliceId.of(1), SliceType.URLLC));
        bus.publish(new Event.ResourceAllocationEvent(T0, SliceId.of(1), 10));
        bus.publish(new Event.SliceCreatedEvent(T0, SliceId.of(2), SliceType.EMBB));

        List<String> types = new ArrayList<>();
        for (Event e : bus.getHistory()) {
            types.add(e.eventType());
        }
        assertEquals(List.of("SLICE_CREATED", "RESOURCE_ALLOCATION", "SLICE_CREATED"), types);
        assertEquals(2, bus.getEventCount(Event.SliceCreatedEvent.class));
        assertEquals(SliceId.of(2), bus.getHistory(Event.SliceCreatedEvent.class).get(1).sliceId());

        bus.clearHistory();
        assertTrue(bus.getHistory().isEmpty());
    }

    @Test
    void shouldNotRecordWhenHistoryDisabled() {
        EventBus bus = new EventBus(false);
        bus.publish(new Event.SliceDeletedEvent(T0, SliceId.of(1)));

        assertTrue(bus.getHistory().isEmpty());
    }

    @Test
    void shouldDropOldestEventsBeyondHistoryLimit() {
        EventBus bus = new EventBus(3, Clock.fixed(T0, ZoneOffset.UTC));
        for (long id = 1; id <= 5; id++) {
            bus.publish(new Event.SliceDeletedEvent(T0, SliceId.of(id)));
        }

        List<SliceId> kept = new ArrayList<>();
        for (Event.SliceDeletedEvent e : bus.getHistory(Event.SliceDeletedEvent.class)) {
            kept.add(e.sliceId());
        }
        assertEquals(List.of(SliceId.of(3), SliceId.of(4), SliceId.of(5)), kept);
        assertEquals(3, bus.getHistoryLimit());
    }

    @Test
    void shouldRejectNegativeHistoryLimit() {
        assertThrows(IllegalArgumentException.class, () -> new EventBus(-1, Clock.systemUTC()));
    }
}
