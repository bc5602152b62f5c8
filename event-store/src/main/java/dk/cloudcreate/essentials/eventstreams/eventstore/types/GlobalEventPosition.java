package dk.cloudcreate.essentials.eventstreams.eventstore.types;

import dk.cloudcreate.essentials.types.LongType;

/**
 * The global position is a sequential ever-growing number that tracks the order in which events have been committed
 * to the EventStore across ALL streams.<br>
 * The first global position has value 1, which is also the initial value of a Postgresql BIGINT IDENTITY column.
 */
public class GlobalEventPosition extends LongType<GlobalEventPosition> {
    /**
     * The {@link GlobalEventPosition} of the FIRST event committed to an EventStore
     */
    public static final GlobalEventPosition FIRST_GLOBAL_EVENT_POSITION = GlobalEventPosition.of(1);

    public GlobalEventPosition(Long value) {
        super(value);
    }

    public static GlobalEventPosition of(long value) {
        return new GlobalEventPosition(value);
    }

    public GlobalEventPosition increment() {
        return new GlobalEventPosition(value + 1);
    }
}
