package dk.cloudcreate.essentials.eventstreams.eventstore.inmemory;

import dk.cloudcreate.essentials.eventstreams.eventstore.*;
import dk.cloudcreate.essentials.eventstreams.eventstore.types.*;

import java.time.OffsetDateTime;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * The state of a single stream inside the {@link InMemoryEventStore}.<br>
 * Appends must be performed while holding {@link #lock()}. Reads never take the lock: they work on a snapshot
 * of the events that is capped to the {@link #version()} observed when the read started.
 */
public class InMemoryEventStream {
    private final StreamId              streamId;
    private final List<StreamEventData> events;
    private final ReentrantLock         lock;
    private volatile long               version;

    public InMemoryEventStream(StreamId streamId) {
        this.streamId = requireNonNull(streamId, "No streamId provided");
        events = new CopyOnWriteArrayList<>();
        lock = new ReentrantLock();
        version = EventNumber.NO_STREAM.longValue();
    }

    public StreamId streamId() {
        return streamId;
    }

    /**
     * The {@link EventNumber} of the last event or {@link EventNumber#NO_STREAM} if no events have been appended
     */
    public EventNumber version() {
        return EventNumber.of(version);
    }

    public boolean hasEvents() {
        return version != EventNumber.NO_STREAM.longValue();
    }

    ReentrantLock lock() {
        return lock;
    }

    /**
     * @throws ConcurrencyConflictException if <code>expectedVersion</code> isn't satisfied by the current version
     */
    public void checkVersion(ExpectedStreamVersion expectedVersion) {
        requireNonNull(expectedVersion, "No expectedVersion provided");
        var currentVersion = version();
        if (!expectedVersion.isSatisfiedBy(currentVersion)) {
            throw new ConcurrencyConflictException(streamId, expectedVersion, currentVersion);
        }
    }

    /**
     * Check the version and append the events. The caller must hold {@link #lock()}
     *
     * @param expectedVersion    the optimistic concurrency precondition
     * @param lastGlobalPosition the {@link GlobalEventPosition} of the last event committed to the store before this append (0 if none)
     * @param pendingEvents      the serialized events
     * @param timestamp          the commit timestamp
     * @return the stored events
     */
    List<StreamEventData> appendEvents(ExpectedStreamVersion expectedVersion,
                                       long lastGlobalPosition,
                                       List<PendingEvent> pendingEvents,
                                       OffsetDateTime timestamp) {
        requireTrue(lock.isHeldByCurrentThread(), "The stream lock must be held when appending");
        checkVersion(expectedVersion);
        var appended   = new ArrayList<StreamEventData>(pendingEvents.size());
        var newVersion = version;
        var offset     = 0;
        for (var pendingEvent : pendingEvents) {
            appended.add(new StreamEventData(pendingEvent.envelope.eventId(),
                                             pendingEvent.serializedEvent.eventType(),
                                             pendingEvent.serializedEvent.data(),
                                             pendingEvent.serializedMetaData,
                                             streamId,
                                             EventNumber.of(++newVersion),
                                             GlobalEventPosition.of(lastGlobalPosition + 1 + offset++),
                                             timestamp));
        }
        events.addAll(appended);
        version = newVersion;
        return appended;
    }

    /**
     * Get the events with an {@link EventNumber} &gt;= <code>fromPosition</code>, capped to <code>count</code> events
     */
    public List<StreamEventData> getEvents(StreamReadPosition fromPosition, int count) {
        requireNonNull(fromPosition, "No fromPosition provided");
        requireTrue(count >= 0, "count must be >= 0");
        var visibleVersion = version;
        return events.stream()
                     .takeWhile(event -> event.eventNumber().longValue() <= visibleVersion)
                     .dropWhile(event -> event.eventNumber().longValue() < fromPosition.longValue())
                     .limit(count)
                     .collect(Collectors.toList());
    }

    /**
     * Get the newest <code>count</code> events, with the last appended event first
     */
    public List<StreamEventData> getEventsBackwards(int count) {
        requireTrue(count >= 0, "count must be >= 0");
        var visibleVersion = version;
        var snapshot       = List.copyOf(events);
        var lastIndex      = (int) Math.min(visibleVersion, snapshot.size() - 1);
        var result         = new ArrayList<StreamEventData>(Math.min(count, lastIndex + 1));
        for (int index = lastIndex; index >= 0 && result.size() < count; index--) {
            result.add(snapshot.get(index));
        }
        return result;
    }

    @Override
    public String toString() {
        return "InMemoryEventStream{" +
                "streamId=" + streamId +
                ", version=" + version +
                '}';
    }
}
