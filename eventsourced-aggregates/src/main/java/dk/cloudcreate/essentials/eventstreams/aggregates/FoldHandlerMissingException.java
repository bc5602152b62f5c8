package dk.cloudcreate.essentials.eventstreams.aggregates;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * An {@link EventSourcedAggregate} was asked to apply or replay an event it doesn't know how to handle.<br>
 * This means the aggregate and the events stored in its stream are out of sync.
 */
public class FoldHandlerMissingException extends AggregateException {
    public final Class<?> aggregateType;
    public final Class<?> eventType;

    public FoldHandlerMissingException(Class<?> aggregateType, Class<?> eventType) {
        super(msg("Aggregate '{}' has no handler for event '{}'",
                  aggregateType.getName(),
                  eventType.getName()));
        this.aggregateType = aggregateType;
        this.eventType = eventType;
    }
}
