package dk.cloudcreate.essentials.eventstreams.eventstore.types;

import dk.cloudcreate.essentials.types.*;

/**
 * Identifies a single event stream, i.e. the ordered history of one aggregate instance or one logical entity.<br>
 * Stream id's are compared by value.<br>
 * Example: the events of the Order with id <code>1234</code> are typically stored in the stream <code>Order-1234</code>
 */
public class StreamId extends CharSequenceType<StreamId> implements Identifier {
    public StreamId(CharSequence value) {
        super(value);
    }

    public static StreamId of(CharSequence value) {
        return new StreamId(value);
    }
}
