package dk.cloudcreate.essentials.eventstreams.aggregates;

import dk.cloudcreate.essentials.eventstreams.eventstore.types.StreamId;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class AggregateNotFoundException extends AggregateException {
    public final Object   aggregateId;
    public final Class<?> aggregateImplementationType;
    public final StreamId streamId;

    public AggregateNotFoundException(Object aggregateId, Class<?> aggregateImplementationType, StreamId streamId) {
        super(msg("Couldn't find a '{}' aggregate with Id '{}' in stream '{}'",
                  requireNonNull(aggregateImplementationType, "You must supply an aggregateImplementationType").getName(),
                  aggregateId,
                  streamId));
        this.aggregateId = requireNonNull(aggregateId, "You must supply an aggregateId");
        this.aggregateImplementationType = aggregateImplementationType;
        this.streamId = requireNonNull(streamId, "You must supply a streamId");
    }
}
