package dk.cloudcreate.essentials.eventstreams.eventstore.types;

import dk.cloudcreate.essentials.types.LongType;

/**
 * Each event has its own unique, zero based, position within its stream, aka. the event number.<br>
 * Event numbers within a stream are contiguous: the first event has {@link #FIRST_EVENT_NUMBER} and every
 * following event has the number of the previous event + 1.<br>
 * The highest event number of a stream is also called the stream version.
 * (as opposed to the {@link GlobalEventPosition} which orders ALL events in the store)
 */
public class EventNumber extends LongType<EventNumber> {
    /**
     * Special value that signifies that no events have been persisted in the stream (i.e. the stream doesn't exist)
     */
    public static final EventNumber NO_STREAM          = EventNumber.of(-1);
    /**
     * The {@link EventNumber} of the FIRST event persisted in a stream
     */
    public static final EventNumber FIRST_EVENT_NUMBER = EventNumber.of(0);

    public EventNumber(Long value) {
        super(value);
    }

    public static EventNumber of(long value) {
        return new EventNumber(value);
    }

    public EventNumber increaseAndGet() {
        return new EventNumber(value() + 1);
    }
}
