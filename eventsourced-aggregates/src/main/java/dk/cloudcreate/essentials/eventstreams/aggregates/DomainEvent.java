package dk.cloudcreate.essentials.eventstreams.aggregates;

import dk.cloudcreate.essentials.eventstreams.eventstore.types.EventId;

/**
 * An event produced by an {@link EventSourcedAggregate}.<br>
 * The {@link #eventId()} identifies the event both in the aggregate's queue of uncommitted events and in the event stream
 */
public interface DomainEvent {
    EventId eventId();
}
