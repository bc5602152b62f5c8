package dk.cloudcreate.essentials.eventstreams.eventstore.types;

import dk.cloudcreate.essentials.types.*;

import java.util.*;

/**
 * Unique id of an individual event
 */
public class EventId extends CharSequenceType<EventId> implements Identifier {
    public EventId(CharSequence value) {
        super(value);
    }

    public static EventId of(CharSequence value) {
        return new EventId(value);
    }

    public static EventId random() {
        return new EventId(UUID.randomUUID().toString());
    }

    public static Optional<EventId> optionalFrom(CharSequence value) {
        return Optional.ofNullable(value).map(EventId::new);
    }
}
