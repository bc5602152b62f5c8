package dk.cloudcreate.essentials.eventstreams.aggregates;

import dk.cloudcreate.essentials.eventstreams.eventstore.*;
import dk.cloudcreate.essentials.eventstreams.eventstore.types.*;
import org.slf4j.*;

import java.util.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Loads and saves a specific {@link EventSourcedAggregate} type using an {@link EventStore}.<br>
 * Each aggregate instance has its own event stream, named <code>{AggregateSimpleName}-{aggregateId}</code> (see {@link #streamIdFor(Object)}).<br>
 * Use {@link #from(EventStore, AggregateInstanceFactory, Class, Class)} to create a default instance, or extend {@link DefaultAggregateStore}
 * to add your own methods.
 * <p>
 * A {@link ConcurrencyConflictException} from {@link #save(EventSourcedAggregate)} is never retried by the store. The caller must reload the aggregate
 * and reapply its command.
 *
 * @param <ID>        the aggregate id type
 * @param <EVENT>     the base type of the aggregate's events
 * @param <AGGREGATE> the concrete aggregate type
 * @see DefaultAggregateStore
 */
public interface AggregateStore<ID, EVENT extends DomainEvent, AGGREGATE extends EventSourcedAggregate<ID, EVENT>> {
    /**
     * Create an {@link AggregateStore} that supports loading and saving the given aggregate type
     *
     * @param eventStore                  the {@link EventStore} instance to use
     * @param aggregateInstanceFactory    the factory that creates the fresh aggregate instance a stream is replayed into
     * @param eventType                   the base type of the aggregate's events
     * @param aggregateImplementationType the concrete aggregate type
     * @return the aggregate store
     */
    static <ID, EVENT extends DomainEvent, AGGREGATE extends EventSourcedAggregate<ID, EVENT>> AggregateStore<ID, EVENT, AGGREGATE> from(EventStore eventStore,
                                                                                                                                         AggregateInstanceFactory<ID, AGGREGATE> aggregateInstanceFactory,
                                                                                                                                         Class<EVENT> eventType,
                                                                                                                                         Class<AGGREGATE> aggregateImplementationType) {
        return new DefaultAggregateStore<>(eventStore, aggregateInstanceFactory, eventType, aggregateImplementationType);
    }

    /**
     * Try to load the aggregate instance with the specified <code>aggregateId</code> by replaying its event stream into a fresh instance
     *
     * @param aggregateId the id of the aggregate
     * @return an {@link Optional} with the aggregate, or {@link Optional#empty()} if its stream was never created
     * @throws FoldHandlerMissingException in case the stream contains an event the aggregate can't handle
     */
    Optional<AGGREGATE> tryLoad(ID aggregateId);

    /**
     * Load the aggregate instance with the specified <code>aggregateId</code>
     *
     * @param aggregateId the id of the aggregate
     * @return the aggregate
     * @throws AggregateNotFoundException in case the aggregate's stream was never created
     */
    default AGGREGATE load(ID aggregateId) {
        return tryLoad(aggregateId).orElseThrow(() -> new AggregateNotFoundException(aggregateId, aggregateImplementationType(), streamIdFor(aggregateId)));
    }

    /**
     * Does the aggregate's event stream exist
     */
    boolean exists(ID aggregateId);

    /**
     * Append the aggregate's uncommitted events to its stream, using the aggregate's {@link EventSourcedAggregate#originalVersion()}
     * as the expected stream version. The uncommitted events are only marked as committed after a successful append.
     *
     * @param aggregate the aggregate to save
     * @return the {@link AppendResult} or {@link Optional#empty()} if the aggregate didn't have any uncommitted events
     * @throws ConcurrencyConflictException in case the stream was changed since the aggregate was loaded. The aggregate is left untouched
     */
    Optional<AppendResult> save(AGGREGATE aggregate);

    StreamId streamIdFor(ID aggregateId);

    EventStore eventStore();

    Class<EVENT> eventType();

    Class<AGGREGATE> aggregateImplementationType();

    // -------------------------------------------------------------------------------------------------------------------------------------------------

    /**
     * Default {@link AggregateStore} implementation
     *
     * @param <ID>        the aggregate id type
     * @param <EVENT>     the base type of the aggregate's events
     * @param <AGGREGATE> the concrete aggregate type
     */
    class DefaultAggregateStore<ID, EVENT extends DomainEvent, AGGREGATE extends EventSourcedAggregate<ID, EVENT>> implements AggregateStore<ID, EVENT, AGGREGATE> {
        private static final Logger log = LoggerFactory.getLogger(AggregateStore.class);

        private final EventStore                              eventStore;
        private final AggregateInstanceFactory<ID, AGGREGATE> aggregateInstanceFactory;
        private final Class<EVENT>                            eventType;
        private final Class<AGGREGATE>                        aggregateImplementationType;

        public DefaultAggregateStore(EventStore eventStore,
                                     AggregateInstanceFactory<ID, AGGREGATE> aggregateInstanceFactory,
                                     Class<EVENT> eventType,
                                     Class<AGGREGATE> aggregateImplementationType) {
            this.eventStore = requireNonNull(eventStore, "You must supply an EventStore instance");
            this.aggregateInstanceFactory = requireNonNull(aggregateInstanceFactory, "You must supply an aggregateInstanceFactory");
            this.eventType = requireNonNull(eventType, "You must supply an eventType");
            this.aggregateImplementationType = requireNonNull(aggregateImplementationType, "You must supply an aggregateImplementationType");
        }

        @Override
        public Optional<AGGREGATE> tryLoad(ID aggregateId) {
            requireNonNull(aggregateId, "No aggregateId provided");
            var streamId = streamIdFor(aggregateId);
            log.trace("Trying to load {} with id '{}' from stream '{}'", aggregateImplementationType.getName(), aggregateId, streamId);
            var aggregate = requireNonNull(aggregateInstanceFactory.create(aggregateId),
                                           "The aggregateInstanceFactory didn't create an aggregate instance");
            var loadedAggregate = eventStore.aggregateStream(streamId,
                                                             StreamReadPosition.START,
                                                             aggregate,
                                                             (state, envelope) -> {
                                                                 state.fold(toAggregateEvent(envelope));
                                                                 return state;
                                                             });
            if (loadedAggregate.isEmpty()) {
                log.trace("Didn't find a {} with id '{}'", aggregateImplementationType.getName(), aggregateId);
            } else {
                log.debug("Loaded {} with id '{}' at version {}", aggregateImplementationType.getName(), aggregateId, loadedAggregate.get().currentVersion());
            }
            return loadedAggregate;
        }

        private EVENT toAggregateEvent(StreamEventEnvelope<?> envelope) {
            var event = envelope.event();
            if (!eventType.isInstance(event)) {
                throw new FoldHandlerMissingException(aggregateImplementationType, event.getClass());
            }
            return eventType.cast(event);
        }

        @Override
        public boolean exists(ID aggregateId) {
            requireNonNull(aggregateId, "No aggregateId provided");
            return eventStore.streamExists(streamIdFor(aggregateId));
        }

        @Override
        public Optional<AppendResult> save(AGGREGATE aggregate) {
            requireNonNull(aggregate, "No aggregate provided");
            var uncommittedEvents = aggregate.getUncommittedEvents();
            if (uncommittedEvents.isEmpty()) {
                log.trace("{} with id '{}' doesn't have any uncommitted events", aggregateImplementationType.getName(), aggregate.aggregateId());
                return Optional.empty();
            }

            var streamId        = streamIdFor(aggregate.aggregateId());
            var expectedVersion = ExpectedStreamVersion.fromAggregateVersion(aggregate.originalVersion());
            log.debug("Saving {} uncommitted event(s) for {} with id '{}' to stream '{}' with expectedVersion {}",
                      uncommittedEvents.size(),
                      aggregateImplementationType.getName(),
                      aggregate.aggregateId(),
                      streamId,
                      expectedVersion);
            var envelopes = uncommittedEvents.stream()
                                             .map(event -> StreamEventEnvelope.of(event.eventId(), event))
                                             .collect(Collectors.toList());
            var appendResult = eventStore.appendEvents(streamId, envelopes, expectedVersion);
            aggregate.markUncommittedAsCommitted();
            eventStore.commit();
            return Optional.of(appendResult);
        }

        @Override
        public StreamId streamIdFor(ID aggregateId) {
            requireNonNull(aggregateId, "No aggregateId provided");
            return StreamId.of(aggregateImplementationType.getSimpleName() + "-" + aggregateId);
        }

        @Override
        public EventStore eventStore() {
            return eventStore;
        }

        @Override
        public Class<EVENT> eventType() {
            return eventType;
        }

        @Override
        public Class<AGGREGATE> aggregateImplementationType() {
            return aggregateImplementationType;
        }

        @Override
        public String toString() {
            return "AggregateStore{" +
                    "aggregateImplementationType=" + aggregateImplementationType.getName() +
                    ", eventType=" + eventType.getName() +
                    ", eventStore=" + eventStore +
                    '}';
        }
    }
}
