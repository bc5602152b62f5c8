package dk.cloudcreate.essentials.eventstreams.eventstore;

import dk.cloudcreate.essentials.eventstreams.eventstore.serializer.EventSerializer;
import dk.cloudcreate.essentials.eventstreams.eventstore.types.*;

import java.time.OffsetDateTime;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A single event exactly as it's physically stored: the serialized payload and metadata (see {@link EventSerializer})
 * together with the ordering information assigned when the event was appended to its stream.<br>
 * Instances are immutable.
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public final class StreamEventData {
    private final EventId             eventId;
    private final EventTypeName       eventType;
    private final byte[]              data;
    private final Optional<byte[]>    metadata;
    private final StreamId            streamId;
    private final EventNumber         eventNumber;
    private final GlobalEventPosition globalEventPosition;
    private final OffsetDateTime      timestamp;

    public StreamEventData(EventId eventId,
                           EventTypeName eventType,
                           byte[] data,
                           Optional<byte[]> metadata,
                           StreamId streamId,
                           EventNumber eventNumber,
                           GlobalEventPosition globalEventPosition,
                           OffsetDateTime timestamp) {
        this.eventId = requireNonNull(eventId, "No eventId provided");
        this.eventType = requireNonNull(eventType, "No eventType provided");
        this.data = requireNonNull(data, "No data provided").clone();
        this.metadata = requireNonNull(metadata, "No metadata option provided").map(byte[]::clone);
        this.streamId = requireNonNull(streamId, "No streamId provided");
        this.eventNumber = requireNonNull(eventNumber, "No eventNumber provided");
        this.globalEventPosition = requireNonNull(globalEventPosition, "No globalEventPosition provided");
        this.timestamp = requireNonNull(timestamp, "No timestamp provided");
    }

    public EventId eventId() {
        return eventId;
    }

    public EventTypeName eventType() {
        return eventType;
    }

    /**
     * @return a copy of the serialized event payload
     */
    public byte[] data() {
        return data.clone();
    }

    /**
     * @return a copy of the serialized event metadata (if any)
     */
    public Optional<byte[]> metadata() {
        return metadata.map(byte[]::clone);
    }

    public StreamId streamId() {
        return streamId;
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
        StreamEventData that = (StreamEventData) o;
        return eventId.equals(that.eventId) &&
                eventType.equals(that.eventType) &&
                Arrays.equals(data, that.data) &&
                Arrays.equals(metadata.orElse(null), that.metadata.orElse(null)) &&
                streamId.equals(that.streamId) &&
                eventNumber.equals(that.eventNumber) &&
                globalEventPosition.equals(that.globalEventPosition) &&
                timestamp.isEqual(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, streamId, eventNumber, globalEventPosition);
    }

    @Override
    public String toString() {
        return "StreamEventData{" +
                "eventId=" + eventId +
                ", eventType=" + eventType +
                ", streamId=" + streamId +
                ", eventNumber=" + eventNumber +
                ", globalEventPosition=" + globalEventPosition +
                ", timestamp=" + timestamp +
                '}';
    }
}
