package dk.cloudcreate.essentials.eventstreams.eventstore.types;

import dk.cloudcreate.essentials.eventstreams.eventstore.serializer.*;
import dk.cloudcreate.essentials.types.CharSequenceType;

/**
 * The logical name of an event type, e.g. <code>OrderAdded</code>.<br>
 * The name is stored together with the serialized payload and is used by the {@link EventSerializer}
 * to resolve the Java type (see {@link EventTypeRegistry}) the payload must be deserialized into.
 */
public class EventTypeName extends CharSequenceType<EventTypeName> {
    public EventTypeName(CharSequence value) {
        super(value);
    }

    public static EventTypeName of(CharSequence value) {
        return new EventTypeName(value);
    }

    /**
     * Uses the {@link Class#getSimpleName()} as event type name
     */
    public static EventTypeName of(Class<?> eventType) {
        return new EventTypeName(eventType.getSimpleName());
    }
}
