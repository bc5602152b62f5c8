package dk.cloudcreate.essentials.eventstreams.eventstore.serializer;

import dk.cloudcreate.essentials.eventstreams.eventstore.types.EventTypeName;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The result of {@link EventSerializer#serialize(Object)}
 */
public final class SerializedEvent {
    private final EventTypeName eventType;
    private final byte[]        data;

    public SerializedEvent(EventTypeName eventType, byte[] data) {
        this.eventType = requireNonNull(eventType, "No eventType provided");
        this.data = requireNonNull(data, "No data provided").clone();
    }

    public EventTypeName eventType() {
        return eventType;
    }

    public byte[] data() {
        return data.clone();
    }

    @Override
    public String toString() {
        return "SerializedEvent{" +
                "eventType=" + eventType +
                ", bytes=" + data.length +
                '}';
    }
}
