package dk.cloudcreate.essentials.eventstreams.eventstore.serializer;

import dk.cloudcreate.essentials.eventstreams.eventstore.EventStoreException;

public class UnknownEventTypeException extends EventStoreException {
    public UnknownEventTypeException(String message) {
        super(message);
    }
}
