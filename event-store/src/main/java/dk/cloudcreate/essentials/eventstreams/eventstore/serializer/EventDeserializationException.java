package dk.cloudcreate.essentials.eventstreams.eventstore.serializer;

import dk.cloudcreate.essentials.eventstreams.eventstore.EventStoreException;

public class EventDeserializationException extends EventStoreException {
    public EventDeserializationException(String message) {
        super(message);
    }

    public EventDeserializationException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
