package dk.cloudcreate.essentials.eventstreams.eventstore.serializer;

import dk.cloudcreate.essentials.eventstreams.eventstore.*;
import dk.cloudcreate.essentials.eventstreams.eventstore.types.EventTypeName;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Converts events and {@link EventMetaData} to and from the opaque bytes stored by an {@link EventStore}
 *
 * @see dk.cloudcreate.essentials.eventstreams.eventstore.serializer.json.JacksonEventSerializer
 */
public interface EventSerializer {
    /**
     * Serialize an event
     *
     * @param event the event to serialize
     * @return the serialized event together with the event's {@link EventTypeName}
     * @throws UnknownEventTypeException   in case the event's type hasn't been registered
     * @throws EventSerializationException in case the event couldn't be serialized
     */
    SerializedEvent serialize(Object event);

    /**
     * Deserialize an event payload
     *
     * @param eventType the logical name of the event type the payload was serialized from
     * @param data      the serialized payload
     * @return the deserialized event
     * @throws UnknownEventTypeException     in case <code>eventType</code> can't be resolved to a Java type
     * @throws EventDeserializationException in case the payload couldn't be deserialized
     */
    Object deserialize(EventTypeName eventType, byte[] data);

    /**
     * @throws EventSerializationException in case the metadata couldn't be serialized
     */
    byte[] serializeMetaData(EventMetaData metaData);

    /**
     * @throws EventDeserializationException in case the metadata couldn't be deserialized
     */
    EventMetaData deserializeMetaData(byte[] metaData);

    /**
     * Decode a stored event into a {@link StreamEventEnvelope} with its {@link StreamEventMetadata}
     *
     * @param eventData the stored event
     * @return the envelope containing the deserialized event
     * @throws UnknownEventTypeException     in case the event type can't be resolved
     * @throws EventDeserializationException in case the event or its metadata couldn't be deserialized
     */
    default StreamEventEnvelope<?> toEnvelope(StreamEventData eventData) {
        requireNonNull(eventData, "No eventData provided");
        var event    = deserialize(eventData.eventType(), eventData.data());
        var metaData = eventData.metadata().map(this::deserializeMetaData).orElseGet(EventMetaData::empty);
        return StreamEventEnvelope.persisted(event, metaData, StreamEventMetadata.from(eventData));
    }
}
