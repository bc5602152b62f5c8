package dk.cloudcreate.essentials.eventstreams.eventstore.types;

import dk.cloudcreate.essentials.types.LongType;

import static dk.cloudcreate.essentials.shared.FailFast.requireTrue;

/**
 * Stream relative read cursor. Reads starting at a given {@link StreamReadPosition} include the event
 * whose {@link EventNumber} is equal to the position.
 */
public class StreamReadPosition extends LongType<StreamReadPosition> {
    /**
     * Read from the first event in the stream
     */
    public static final StreamReadPosition START = StreamReadPosition.of(0);

    public StreamReadPosition(Long value) {
        super(value);
        requireTrue(value >= 0, "A StreamReadPosition cannot be negative");
    }

    public static StreamReadPosition of(long value) {
        return new StreamReadPosition(value);
    }

    public static StreamReadPosition of(EventNumber eventNumber) {
        return new StreamReadPosition(eventNumber.longValue());
    }
}
