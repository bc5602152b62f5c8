package dk.cloudcreate.essentials.eventstreams.eventstore;

import dk.cloudcreate.essentials.eventstreams.eventstore.types.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Typed wrapper around a single (deserialized) event.<br>
 * An envelope created by the application for appending carries the {@link EventId} and the {@link EventMetaData} that will be
 * stored together with the event. An envelope returned from an {@link EventStore} read additionally carries the
 * {@link StreamEventMetadata} with the {@link EventNumber}, {@link GlobalEventPosition} and timestamp assigned when the event was appended.
 *
 * @param <E> the type of event
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public final class StreamEventEnvelope<E> {
    private final EventId                       eventId;
    private final E                             event;
    private final EventMetaData                 metaData;
    private final Optional<StreamEventMetadata> streamMetadata;

    private StreamEventEnvelope(EventId eventId, E event, EventMetaData metaData, Optional<StreamEventMetadata> streamMetadata) {
        this.eventId = requireNonNull(eventId, "No eventId provided");
        this.event = requireNonNull(event, "No event provided");
        this.metaData = requireNonNull(metaData, "No metaData provided");
        this.streamMetadata = requireNonNull(streamMetadata, "No streamMetadata option provided");
    }

    /**
     * Wrap an event that is going to be appended, using a random {@link EventId} and empty {@link EventMetaData}
     */
    public static <E> StreamEventEnvelope<E> of(E event) {
        return new StreamEventEnvelope<>(EventId.random(), event, EventMetaData.empty(), Optional.empty());
    }

    /**
     * Wrap an event that is going to be appended
     */
    public static <E> StreamEventEnvelope<E> of(EventId eventId, E event) {
        return new StreamEventEnvelope<>(eventId, event, EventMetaData.empty(), Optional.empty());
    }

    /**
     * Wrap an event that is going to be appended
     */
    public static <E> StreamEventEnvelope<E> of(EventId eventId, E event, EventMetaData metaData) {
        return new StreamEventEnvelope<>(eventId, event, metaData, Optional.empty());
    }

    /**
     * Wrap an event that has been read from an {@link EventStore}
     */
    public static <E> StreamEventEnvelope<E> persisted(E event, EventMetaData metaData, StreamEventMetadata streamMetadata) {
        requireNonNull(streamMetadata, "No streamMetadata provided");
        return new StreamEventEnvelope<>(streamMetadata.eventId(), event, metaData, Optional.of(streamMetadata));
    }

    public EventId eventId() {
        return eventId;
    }

    public E event() {
        return event;
    }

    public EventMetaData metaData() {
        return metaData;
    }

    /**
     * The storage details. Only present for envelopes read from an {@link EventStore}
     */
    public Optional<StreamEventMetadata> streamMetadata() {
        return streamMetadata;
    }

    public boolean isPersisted() {
        return streamMetadata.isPresent();
    }

    /**
     * Cast the envelope to a specific event type
     *
     * @throws ClassCastException if the event isn't an instance of <code>eventType</code>
     */
    @SuppressWarnings("unchecked")
    public <T> StreamEventEnvelope<T> as(Class<T> eventType) {
        requireNonNull(eventType, "No eventType provided");
        eventType.cast(event);
        return (StreamEventEnvelope<T>) this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StreamEventEnvelope<?> that = (StreamEventEnvelope<?>) o;
        return eventId.equals(that.eventId) && streamMetadata.equals(that.streamMetadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, streamMetadata);
    }

    @Override
    public String toString() {
        return "StreamEventEnvelope{" +
                "eventId=" + eventId +
                ", event=" + event.getClass().getName() +
                ", streamMetadata=" + streamMetadata +
                '}';
    }
}
