package dk.cloudcreate.essentials.eventstreams.eventstore.inmemory;

import dk.cloudcreate.essentials.eventstreams.eventstore.*;
import dk.cloudcreate.essentials.eventstreams.eventstore.projection.ReadProjectionPublisher;
import dk.cloudcreate.essentials.eventstreams.eventstore.serializer.EventSerializer;
import dk.cloudcreate.essentials.eventstreams.eventstore.types.*;
import dk.cloudcreate.essentials.types.LongRange;
import org.slf4j.*;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.stream.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link EventStore} that keeps all streams in memory. Intended for tests and as a reference for the semantics
 * every {@link EventStore} backend must provide.<br>
 * Appends to the same stream are serialized using a per stream lock, while appends to different streams only
 * share a short commit section in which the {@link GlobalEventPosition}'s are assigned. This ensures that the global
 * order is equal to the commit order and contains no gaps.<br>
 * Stream reads don't take any lock, and {@link ReadProjectionPublisher} delivery happens after both locks have been released,
 * so a projection may read or append to any stream.<br>
 * Events are serialized using the {@link EventSerializer} on append and deserialized on read, exactly like a durable backend would.
 */
public class InMemoryEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final EventSerializer                                eventSerializer;
    private final ReadProjectionPublisher                        readProjectionPublisher;
    private final ConcurrentMap<StreamId, InMemoryEventStream>   streams;
    /**
     * All committed events in commit order. Index = {@link GlobalEventPosition} - 1
     */
    private final List<StreamEventData>                          globalEvents;
    private final Set<EventId>                                   eventIds;
    private final Object                                         commitLock = new Object();

    public InMemoryEventStore(EventSerializer eventSerializer) {
        this(eventSerializer, new ReadProjectionPublisher());
    }

    public InMemoryEventStore(EventSerializer eventSerializer, ReadProjectionPublisher readProjectionPublisher) {
        this.eventSerializer = requireNonNull(eventSerializer, "No eventSerializer provided");
        this.readProjectionPublisher = requireNonNull(readProjectionPublisher, "No readProjectionPublisher provided");
        streams = new ConcurrentHashMap<>();
        globalEvents = new ArrayList<>();
        eventIds = new HashSet<>();
    }

    @Override
    public boolean streamExists(StreamId streamId) {
        requireNonNull(streamId, "No streamId provided");
        var stream = streams.get(streamId);
        return stream != null && stream.hasEvents();
    }

    @Override
    public Optional<EventNumber> streamVersion(StreamId streamId) {
        requireNonNull(streamId, "No streamId provided");
        return findStream(streamId).map(InMemoryEventStream::version);
    }

    @Override
    public Optional<List<StreamEventEnvelope<?>>> getStreamEvents(StreamId streamId, StreamReadPosition fromPosition, int maxCount) {
        requireNonNull(streamId, "No streamId provided");
        requireNonNull(fromPosition, "No fromPosition provided");
        requireTrue(maxCount >= 0, "maxCount must be >= 0");
        log.trace("Reading stream '{}' from position {} with maxCount {}", streamId, fromPosition, maxCount);
        return findStream(streamId).map(stream -> decode(stream.getEvents(fromPosition, maxCount)));
    }

    @Override
    public Optional<List<StreamEventEnvelope<?>>> getLastStreamEvents(StreamId streamId, int count) {
        requireNonNull(streamId, "No streamId provided");
        requireTrue(count >= 0, "count must be >= 0");
        return findStream(streamId).map(stream -> decode(stream.getEventsBackwards(count)));
    }

    @Override
    public AppendResult appendEvents(StreamId streamId, List<? extends StreamEventEnvelope<?>> events, ExpectedStreamVersion expectedVersion) {
        requireNonNull(streamId, "No streamId provided");
        requireNonNull(events, "No events provided");
        requireNonNull(expectedVersion, "No expectedVersion provided");
        if (events.isEmpty()) {
            throw new IllegalArgumentException(msg("Cannot append an empty list of events to stream '{}'", streamId));
        }

        var pendingEvents = events.stream()
                                  .map(this::serialize)
                                  .collect(Collectors.toList());

        var          stream = streams.computeIfAbsent(streamId, InMemoryEventStream::new);
        AppendResult appendResult;
        try {
            stream.lock().lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AppendCancelledException(msg("Append of {} event(s) to stream '{}' was cancelled", events.size(), streamId), e);
        }
        try {
            stream.checkVersion(expectedVersion);
            if (Thread.currentThread().isInterrupted()) {
                throw new AppendCancelledException(msg("Append of {} event(s) to stream '{}' was cancelled", events.size(), streamId));
            }

            List<StreamEventData> appendedEvents;
            synchronized (commitLock) {
                ensureEventIdsAreUnique(streamId, pendingEvents);
                appendedEvents = stream.appendEvents(expectedVersion,
                                                     globalEvents.size(),
                                                     pendingEvents,
                                                     OffsetDateTime.now(Clock.systemUTC()));
                globalEvents.addAll(appendedEvents);
                appendedEvents.forEach(eventData -> eventIds.add(eventData.eventId()));
                readProjectionPublisher.enqueue(toCommittedEnvelopes(pendingEvents, appendedEvents));
            }

            var lastEvent = appendedEvents.get(appendedEvents.size() - 1);
            log.debug("Appended {} event(s) to stream '{}' with expectedVersion {}. New version {} and last globalEventPosition {}",
                      appendedEvents.size(),
                      streamId,
                      expectedVersion,
                      lastEvent.eventNumber(),
                      lastEvent.globalEventPosition());
            appendResult = new AppendResult(lastEvent.globalEventPosition(), lastEvent.eventNumber());
        } finally {
            stream.lock().unlock();
        }
        readProjectionPublisher.deliverEnqueued();
        return appendResult;
    }

    @Override
    public Stream<StreamEventData> loadEventsByGlobalPosition(LongRange globalPositionRange) {
        requireNonNull(globalPositionRange, "No globalPositionRange provided");
        synchronized (commitLock) {
            var fromIndex = (int) Math.min(Math.max(globalPositionRange.fromInclusive - 1, 0), globalEvents.size());
            var toIndex   = globalEvents.size();
            if (globalPositionRange.isClosedRange()) {
                toIndex = (int) Math.max(fromIndex, Math.min(globalPositionRange.toInclusive, globalEvents.size()));
            }
            return new ArrayList<>(globalEvents.subList(fromIndex, toIndex)).stream();
        }
    }

    @Override
    public ReadProjectionPublisher readProjectionPublisher() {
        return readProjectionPublisher;
    }

    @Override
    public EventSerializer eventSerializer() {
        return eventSerializer;
    }

    private Optional<InMemoryEventStream> findStream(StreamId streamId) {
        return Optional.ofNullable(streams.get(streamId))
                       .filter(InMemoryEventStream::hasEvents);
    }

    private PendingEvent serialize(StreamEventEnvelope<?> envelope) {
        requireNonNull(envelope, "The list of events contains a null envelope");
        return new PendingEvent(envelope,
                                eventSerializer.serialize(envelope.event()),
                                envelope.metaData().isEmpty() ? Optional.empty() : Optional.of(eventSerializer.serializeMetaData(envelope.metaData())));
    }

    private void ensureEventIdsAreUnique(StreamId streamId, List<PendingEvent> pendingEvents) {
        var idsInAppend = new HashSet<EventId>();
        for (var pendingEvent : pendingEvents) {
            var eventId = pendingEvent.envelope.eventId();
            if (eventIds.contains(eventId) || !idsInAppend.add(eventId)) {
                throw new AppendToStreamException(msg("Failed to append {} event(s) to stream '{}'",
                                                      pendingEvents.size(),
                                                      streamId),
                                                  new IllegalArgumentException(msg("An event with eventId '{}' has already been appended", eventId)));
            }
        }
    }

    private List<StreamEventEnvelope<?>> toCommittedEnvelopes(List<PendingEvent> pendingEvents, List<StreamEventData> appendedEvents) {
        var committed = new ArrayList<StreamEventEnvelope<?>>(appendedEvents.size());
        for (int index = 0; index < appendedEvents.size(); index++) {
            var envelope = pendingEvents.get(index).envelope;
            committed.add(StreamEventEnvelope.persisted(envelope.event(),
                                                        envelope.metaData(),
                                                        StreamEventMetadata.from(appendedEvents.get(index))));
        }
        return committed;
    }

    private List<StreamEventEnvelope<?>> decode(List<StreamEventData> events) {
        return events.stream()
                     .<StreamEventEnvelope<?>>map(eventSerializer::toEnvelope)
                     .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "InMemoryEventStore{" +
                "numberOfStreams=" + streams.size() +
                '}';
    }
}
