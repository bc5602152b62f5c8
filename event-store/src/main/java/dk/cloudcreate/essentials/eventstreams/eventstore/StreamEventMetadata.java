package dk.cloudcreate.essentials.eventstreams.eventstore;

import dk.cloudcreate.essentials.eventstreams.eventstore.types.*;

import java.time.OffsetDateTime;
import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The storage details of an event that has been read back from an {@link EventStore}
 */
public final class StreamEventMetadata {
    private final StreamId            streamId;
    private final EventId             eventId;
    private final EventTypeName       eventType;
    private final EventNumber         eventNumber;
    private final GlobalEventPosition globalEventPosition;
    private final OffsetDateTime      timestamp;

    public StreamEventMetadata(StreamId streamId,
                               EventId eventId,
                               EventTypeName eventType,
                               EventNumber eventNumber,
                               GlobalEventPosition globalEventPosition,
                               OffsetDateTime timestamp) {
        this.streamId = requireNonNull(streamId, "No streamId provided");
        this.eventId = requireNonNull(eventId, "No eventId provided");
        this.eventType = requireNonNull(eventType, "No eventType provided");
        this.eventNumber = requireNonNull(eventNumber, "No eventNumber provided");
        this.globalEventPosition = requireNonNull(globalEventPosition, "No globalEventPosition provided");
        this.timestamp = requireNonNull(timestamp, "No timestamp provided");
    }

    public static StreamEventMetadata from(StreamEventData eventData) {
        requireNonNull(eventData, "No eventData provided");
        return new StreamEventMetadata(eventData.streamId(),
                                       eventData.eventId(),
                                       eventData.eventType(),
                                       eventData.eventNumber(),
                                       eventData.globalEventPosition(),
                                       eventData.timestamp());
    }

    public StreamId streamId() {
        return streamId;
    }

    public EventId eventId() {
        return eventId;
    }

    public EventTypeName eventType() {
        return eventType;
    }

    public EventNumber eventNumber() {
        return eventNumber;
    }

    public GlobalEventPosition globalEventPosition() {
        return globalEventPosition;
    }

    public OffsetDateTime timestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StreamEventMetadata that = (StreamEventMetadata) o;
        return eventId.equals(that.eventId) && globalEventPosition.equals(that.globalEventPosition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, globalEventPosition);
    }

    @Override
    public String toString() {
        return "StreamEventMetadata{" +
                "streamId=" + streamId +
                ", eventId=" + eventId +
                ", eventType=" + eventType +
                ", eventNumber=" + eventNumber +
                ", globalEventPosition=" + globalEventPosition +
                ", timestamp=" + timestamp +
                '}';
    }
}
