package dk.cloudcreate.essentials.eventstreams.eventstore.serializer;

import dk.cloudcreate.essentials.eventstreams.eventstore.EventStoreException;

public class EventSerializationException extends EventStoreException {
    public EventSerializationException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
