package dk.cloudcreate.essentials.eventstreams.aggregates;

/**
 * Factory that helps the {@link AggregateStore} create the fresh (version -1) aggregate instance that an event stream is replayed into
 *
 * @param <ID>        the aggregate id type
 * @param <AGGREGATE> the concrete aggregate type
 */
@FunctionalInterface
public interface AggregateInstanceFactory<ID, AGGREGATE extends EventSourcedAggregate<ID, ?>> {
    AGGREGATE create(ID aggregateId);
}
