package dk.cloudcreate.essentials.eventstreams.eventstore.types;

import dk.cloudcreate.essentials.types.*;

/**
 * Identifies a durable subscriber, e.g. a read model that follows all events committed to an EventStore.<br>
 * The checkpoint of the subscriber is stored under this id, so it must stay the same across restarts
 */
public class SubscriberId extends CharSequenceType<SubscriberId> implements Identifier {
    public SubscriberId(CharSequence value) {
        super(value);
    }

    public static SubscriberId of(CharSequence value) {
        return new SubscriberId(value);
    }
}
