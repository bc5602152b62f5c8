package dk.cloudcreate.essentials.eventstreams.eventstore;

import dk.cloudcreate.essentials.eventstreams.eventstore.projection.*;
import dk.cloudcreate.essentials.eventstreams.eventstore.serializer.*;
import dk.cloudcreate.essentials.eventstreams.eventstore.types.*;
import dk.cloudcreate.essentials.types.LongRange;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiFunction;
import java.util.stream.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Append-only store of event streams.<br>
 * Every stream, identified by a {@link StreamId}, is an ordered list of events where the first event has {@link EventNumber} 0 and every
 * following event has the previous {@link EventNumber} + 1. The {@link EventNumber} of the last event is the <b>stream version</b>.<br>
 * Appends are protected by optimistic concurrency: every append specifies an {@link ExpectedStreamVersion}, which is checked
 * atomically together with the append. If the check fails a {@link ConcurrencyConflictException} is thrown and nothing is written.<br>
 * Besides the per stream {@link EventNumber}, every committed event is assigned a store-wide {@link GlobalEventPosition}, which
 * orders all events across all streams in the order they were committed.<br>
 * <br>
 * Reads never throw for a stream that doesn't exist, instead an {@link Optional#empty()} is returned.
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public interface EventStore {
    /**
     * The default number of events {@link #pollEvents(long, Optional, Optional)} loads per poll
     */
    int DEFAULT_POLLING_BATCH_SIZE = 100;

    /**
     * Check if the stream exists, i.e. if at least one event has been appended to it
     *
     * @param streamId the stream identifier
     * @return true if the stream exists, otherwise false
     */
    boolean streamExists(StreamId streamId);

    /**
     * Get the current version of the stream
     *
     * @param streamId the stream identifier
     * @return the {@link EventNumber} of the last event appended to the stream or {@link Optional#empty()} if the stream doesn't exist
     */
    Optional<EventNumber> streamVersion(StreamId streamId);

    /**
     * Read all events in a stream
     *
     * @param streamId the stream identifier
     * @return the events in {@link EventNumber} order or {@link Optional#empty()} if the stream doesn't exist
     * @throws UnknownEventTypeException     in case an event type can't be resolved
     * @throws EventDeserializationException in case an event couldn't be deserialized
     */
    default Optional<List<StreamEventEnvelope<?>>> getStreamEvents(StreamId streamId) {
        return getStreamEvents(streamId, StreamReadPosition.START, Integer.MAX_VALUE);
    }

    /**
     * Read the events in a stream starting at <code>fromPosition</code>
     *
     * @param streamId     the stream identifier
     * @param fromPosition the {@link EventNumber} of the first event to include
     * @return the events in {@link EventNumber} order or {@link Optional#empty()} if the stream doesn't exist
     */
    default Optional<List<StreamEventEnvelope<?>>> getStreamEvents(StreamId streamId, StreamReadPosition fromPosition) {
        return getStreamEvents(streamId, fromPosition, Integer.MAX_VALUE);
    }

    /**
     * Read a window of events in a stream<br>
     * Example: in a stream with 10 events reading with <code>fromPosition</code> 5 and <code>maxCount</code> 3 returns the events
     * with {@link EventNumber} 5, 6 and 7
     *
     * @param streamId     the stream identifier
     * @param fromPosition the {@link EventNumber} of the first event to include
     * @param maxCount     the maximum number of events returned
     * @return the events in {@link EventNumber} order or {@link Optional#empty()} if the stream doesn't exist.
     * If <code>fromPosition</code> is beyond the end of an existing stream an empty list is returned
     * @throws UnknownEventTypeException     in case an event type can't be resolved
     * @throws EventDeserializationException in case an event couldn't be deserialized
     */
    Optional<List<StreamEventEnvelope<?>>> getStreamEvents(StreamId streamId, StreamReadPosition fromPosition, int maxCount);

    /**
     * Read the newest events in a stream
     *
     * @param streamId the stream identifier
     * @param count    the maximum number of events returned
     * @return the newest events with the last appended event first or {@link Optional#empty()} if the stream doesn't exist
     * @throws UnknownEventTypeException     in case an event type can't be resolved
     * @throws EventDeserializationException in case an event couldn't be deserialized
     */
    Optional<List<StreamEventEnvelope<?>>> getLastStreamEvents(StreamId streamId, int count);

    /**
     * Append a single event to a stream that must not exist yet
     *
     * @see #appendEvents(StreamId, List, ExpectedStreamVersion)
     */
    default AppendResult appendEvent(StreamId streamId, StreamEventEnvelope<?> event) {
        return appendEvent(streamId, event, ExpectedStreamVersion.noStream());
    }

    /**
     * Append a single event to a stream
     *
     * @see #appendEvents(StreamId, List, ExpectedStreamVersion)
     */
    default AppendResult appendEvent(StreamId streamId, StreamEventEnvelope<?> event, ExpectedStreamVersion expectedVersion) {
        requireNonNull(event, "No event provided");
        return appendEvents(streamId, List.of(event), expectedVersion);
    }

    /**
     * Atomically append the events to the stream. Either all events are committed or none are.<br>
     * The events are assigned contiguous {@link EventNumber}'s starting at the current stream version + 1 and increasing
     * {@link GlobalEventPosition}'s. After the commit the events are published to the {@link #readProjectionPublisher()}
     *
     * @param streamId        the stream identifier
     * @param events          the events to append (must not be empty)
     * @param expectedVersion the optimistic concurrency precondition
     * @return the {@link GlobalEventPosition} of the last appended event and the new stream version
     * @throws ConcurrencyConflictException in case <code>expectedVersion</code> doesn't match the actual stream version
     * @throws AppendCancelledException     in case the calling thread was interrupted before the events were committed
     * @throws EventSerializationException  in case an event couldn't be serialized
     * @throws AppendToStreamException      in case the events couldn't be stored
     * @throws IllegalArgumentException     in case <code>events</code> is empty
     */
    AppendResult appendEvents(StreamId streamId, List<? extends StreamEventEnvelope<?>> events, ExpectedStreamVersion expectedVersion);

    /**
     * Fold all the events in a stream, starting at <code>fromPosition</code>, into a state
     *
     * @param streamId     the stream identifier
     * @param fromPosition the {@link EventNumber} of the first event to fold
     * @param seedState    the initial state
     * @param fold         function that applies a single event to the state and returns the resulting state
     * @param <STATE>      the state type
     * @return the folded state or {@link Optional#empty()} if the stream doesn't exist
     */
    default <STATE> Optional<STATE> aggregateStream(StreamId streamId,
                                                    StreamReadPosition fromPosition,
                                                    STATE seedState,
                                                    BiFunction<STATE, StreamEventEnvelope<?>, STATE> fold) {
        requireNonNull(seedState, "No seedState provided");
        requireNonNull(fold, "No fold function provided");
        return getStreamEvents(streamId, fromPosition).map(events -> {
            var state = seedState;
            for (var event : events) {
                state = fold.apply(state, event);
            }
            return state;
        });
    }

    /**
     * Flush pending work for backends that batch appends. Both the in-memory and the Postgresql backend
     * commit every append immediately, so for them this is a no-op
     */
    default void commit() {
    }

    /**
     * Load the stored events, across all streams, in {@link GlobalEventPosition} order
     *
     * @param globalPositionRange the range of {@link GlobalEventPosition}'s to load, e.g. <code>LongRange.from(1)</code>
     *                            or <code>LongRange.between(10, 20)</code>
     * @return the stored events in commit order
     */
    Stream<StreamEventData> loadEventsByGlobalPosition(LongRange globalPositionRange);

    /**
     * Polling based subscription to all events committed to the store, starting at <code>fromInclusiveGlobalPosition</code>
     *
     * @param fromInclusiveGlobalPosition the first {@link GlobalEventPosition} to include
     * @param loadEventsBatchSize         how many events to load per poll (default {@value #DEFAULT_POLLING_BATCH_SIZE})
     * @param pollingInterval             how long to wait between polls (default 500 ms)
     * @return a {@link Flux} of the stored events in commit order
     */
    default Flux<StreamEventData> pollEvents(long fromInclusiveGlobalPosition,
                                             Optional<Integer> loadEventsBatchSize,
                                             Optional<Duration> pollingInterval) {
        requireNonNull(loadEventsBatchSize, "You must supply a loadEventsBatchSize option");
        requireNonNull(pollingInterval, "You must supply a pollingInterval option");

        var eventStreamLogName = "EventStore:" + UUID.randomUUID();
        var pollingLog         = LoggerFactory.getLogger(EventStore.class.getName() + ".PollingEventStream");

        long batchFetchSize = loadEventsBatchSize.orElse(DEFAULT_POLLING_BATCH_SIZE);
        pollingLog.debug("[{}] Creating polling EventStream with fromInclusiveGlobalPosition {} and batch size {}",
                         eventStreamLogName,
                         fromInclusiveGlobalPosition,
                         batchFetchSize);
        var nextFromInclusiveGlobalPosition = new AtomicLong(fromInclusiveGlobalPosition);
        var eventsFlux = Flux.defer(() -> {
            try {
                var events = loadEventsByGlobalPosition(LongRange.from(nextFromInclusiveGlobalPosition.get(), batchFetchSize)).collect(Collectors.toList());
                if (events.size() > 0) {
                    pollingLog.debug("[{}] loadEventsByGlobalPosition using fromInclusiveGlobalPosition {} returned {} events",
                                     eventStreamLogName,
                                     nextFromInclusiveGlobalPosition.get(),
                                     events.size());
                } else {
                    pollingLog.trace("[{}] loadEventsByGlobalPosition using fromInclusiveGlobalPosition {} returned no events",
                                     eventStreamLogName,
                                     nextFromInclusiveGlobalPosition.get());
                }
                return Flux.fromIterable(events);
            } catch (RuntimeException e) {
                pollingLog.error(msg("[{}] Polling failed with nextFromInclusiveGlobalPosition {}",
                                     eventStreamLogName,
                                     nextFromInclusiveGlobalPosition.get()),
                                 e);
                return Flux.error(e);
            }
        }).doOnNext(event -> {
            var nextGlobalPosition = event.globalEventPosition().longValue() + 1L;
            pollingLog.trace("[{}] Updating nextFromInclusiveGlobalPosition from {} to {}",
                             eventStreamLogName,
                             nextFromInclusiveGlobalPosition.get(),
                             nextGlobalPosition);
            nextFromInclusiveGlobalPosition.set(nextGlobalPosition);
        });

        return eventsFlux.repeatWhen(longFlux -> Flux.interval(pollingInterval.orElse(Duration.ofMillis(500))));
    }

    /**
     * The publisher that delivers committed events to the registered {@link ReadProjection}'s
     */
    ReadProjectionPublisher readProjectionPublisher();

    /**
     * The serializer used to convert events to and from their stored representation
     */
    EventSerializer eventSerializer();
}
