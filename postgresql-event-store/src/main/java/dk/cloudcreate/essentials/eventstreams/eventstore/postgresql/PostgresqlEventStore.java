package dk.cloudcreate.essentials.eventstreams.eventstore.postgresql;

import dk.cloudcreate.essentials.eventstreams.eventstore.*;
import dk.cloudcreate.essentials.eventstreams.eventstore.projection.ReadProjectionPublisher;
import dk.cloudcreate.essentials.eventstreams.eventstore.serializer.*;
import dk.cloudcreate.essentials.eventstreams.eventstore.types.*;
import dk.cloudcreate.essentials.types.LongRange;
import org.jdbi.v3.core.*;
import org.postgresql.util.PSQLException;
import org.slf4j.*;

import java.sql.SQLException;
import java.time.*;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.NamedArgumentBinding.arg;

/**
 * {@link EventStore} that stores the events of all streams in a single append-only Postgresql table
 * (see {@link PostgresqlEventStoreConfiguration#eventStreamTableName}):
 * <pre>
 * global_position  bigint GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY
 * stream_id        text NOT NULL
 * event_number     bigint NOT NULL
 * event_id         text NOT NULL
 * event_type       text NOT NULL
 * data             bytea NOT NULL
 * metadata         bytea
 * timestamp        TIMESTAMP WITH TIME ZONE NOT NULL
 * CONSTRAINT {table}_stream_version_uq UNIQUE (stream_id, event_number)
 * CONSTRAINT {table}_event_id_uq UNIQUE (event_id)
 * </pre>
 * Every append runs in its own transaction. Appends to the same stream are serialized using a transaction scoped advisory lock
 * and the <code>UNIQUE (stream_id, event_number)</code> constraint guarantees that a stream version can only be written once.
 * A violation of that constraint is reported as a {@link ConcurrencyConflictException}.<br>
 * Within one {@link PostgresqlEventStore} instance appends are committed one at a time and the committed events are handed to the
 * {@link ReadProjectionPublisher} in the same order, so projections see the events in {@link GlobalEventPosition} order.
 * Use {@link #pollEvents(long, Optional, Optional)} or a
 * {@link dk.cloudcreate.essentials.eventstreams.eventstore.subscription.CheckpointedSubscription} to follow events appended by other processes.
 */
public class PostgresqlEventStore implements EventStore {
    private static final Logger log              = LoggerFactory.getLogger(PostgresqlEventStore.class);
    private static final String UNIQUE_VIOLATION = "23505";

    private final Jdbi                              jdbi;
    private final PostgresqlEventStoreConfiguration configuration;
    private final ReadProjectionPublisher           readProjectionPublisher;
    private final StreamEventDataRowMapper          rowMapper;
    /**
     * Held while an append commits and hands its events to the {@link #readProjectionPublisher}
     */
    private final ReentrantLock                     commitLock = new ReentrantLock();

    public PostgresqlEventStore(Jdbi jdbi, PostgresqlEventStoreConfiguration configuration) {
        this(jdbi, configuration, new ReadProjectionPublisher());
    }

    public PostgresqlEventStore(Jdbi jdbi,
                                PostgresqlEventStoreConfiguration configuration,
                                ReadProjectionPublisher readProjectionPublisher) {
        this.jdbi = requireNonNull(jdbi, "No jdbi instance provided");
        this.configuration = requireNonNull(configuration, "No configuration provided");
        this.readProjectionPublisher = requireNonNull(readProjectionPublisher, "No readProjectionPublisher provided");
        rowMapper = new StreamEventDataRowMapper();
        initializeEventStorage();
    }

    public PostgresqlEventStoreConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Create the event stream table and indexes if they don't exist
     */
    protected void initializeEventStorage() {
        log.info("Initializing EventStream storage in table '{}'", configuration.eventStreamTableName);
        jdbi.useTransaction(handle -> {
            Optional<String> eventTable = handle.select("SELECT to_regclass(?)", configuration.eventStreamTableName)
                                                .mapTo(String.class)
                                                .findOne();
            if (eventTable.isEmpty()) {
                createEventStreamTable(handle);
            }
            ensureIndexes(handle);
        });
    }

    /**
     * Drop the event stream table (and all events) and recreate it. Intended for tests
     */
    public void resetEventStorage() {
        log.info("Resetting EventStream storage in table '{}'", configuration.eventStreamTableName);
        jdbi.useTransaction(handle -> {
            var changes = handle.execute("DROP TABLE IF EXISTS " + configuration.eventStreamTableName);
            if (changes == 1) {
                log.debug("Dropped table '{}'", configuration.eventStreamTableName);
            }
        });
        initializeEventStorage();
    }

    private void createEventStreamTable(Handle handle) {
        log.info("Creating event-stream table '{}'", configuration.eventStreamTableName);
        handle.execute(bind("CREATE TABLE {:tableName} (\n" +
                                    "            global_position bigint GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,\n" +
                                    "            stream_id text NOT NULL,\n" +
                                    "            event_number bigint NOT NULL,\n" +
                                    "            event_id text NOT NULL,\n" +
                                    "            event_type text NOT NULL,\n" +
                                    "            data bytea NOT NULL,\n" +
                                    "            metadata bytea,\n" +
                                    "            timestamp TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                                    "          CONSTRAINT {:streamVersionConstraint} UNIQUE (stream_id, event_number),\n" +
                                    "          CONSTRAINT {:eventIdConstraint} UNIQUE (event_id)\n" +
                                    "        )",
                            arg("tableName", configuration.eventStreamTableName),
                            arg("streamVersionConstraint", configuration.streamVersionConstraintName()),
                            arg("eventIdConstraint", configuration.eventIdConstraintName())));
    }

    private void ensureIndexes(Handle handle) {
        var numberOfChanges = handle.execute(bind("CREATE INDEX IF NOT EXISTS {:indexName} ON {:tableName} (event_type)",
                                                  arg("indexName", configuration.eventTypeIndexName()),
                                                  arg("tableName", configuration.eventStreamTableName)));
        log.info("'{}' index on 'event_type' {}",
                 configuration.eventStreamTableName,
                 numberOfChanges == 1 ? "created" : "already existed");
    }

    @Override
    public boolean streamExists(StreamId streamId) {
        return streamVersion(streamId).isPresent();
    }

    @Override
    public Optional<EventNumber> streamVersion(StreamId streamId) {
        requireNonNull(streamId, "No streamId provided");
        return jdbi.withHandle(handle -> loadStreamVersion(handle, streamId));
    }

    private Optional<EventNumber> loadStreamVersion(Handle handle, StreamId streamId) {
        return handle.createQuery(bind("SELECT event_number FROM {:tableName} WHERE stream_id = :streamId ORDER BY event_number DESC LIMIT 1",
                                       arg("tableName", configuration.eventStreamTableName)))
                     .bind("streamId", streamId.toString())
                     .mapTo(Long.class)
                     .findOne()
                     .map(EventNumber::of);
    }

    @Override
    public Optional<List<StreamEventEnvelope<?>>> getStreamEvents(StreamId streamId, StreamReadPosition fromPosition, int maxCount) {
        requireNonNull(streamId, "No streamId provided");
        requireNonNull(fromPosition, "No fromPosition provided");
        requireTrue(maxCount >= 0, "maxCount must be >= 0");
        log.trace("Reading stream '{}' from position {} with maxCount {}", streamId, fromPosition, maxCount);
        return jdbi.withHandle(handle -> {
            if (loadStreamVersion(handle, streamId).isEmpty()) {
                return Optional.<List<StreamEventData>>empty();
            }
            return Optional.of(handle.createQuery(bind("SELECT * FROM {:tableName} WHERE stream_id = :streamId AND event_number >= :fromPosition ORDER BY event_number ASC LIMIT :maxCount",
                                                       arg("tableName", configuration.eventStreamTableName)))
                                     .bind("streamId", streamId.toString())
                                     .bind("fromPosition", fromPosition.longValue())
                                     .bind("maxCount", maxCount)
                                     .setFetchSize(configuration.queryFetchSize)
                                     .map(rowMapper)
                                     .list());
        }).map(this::decode);
    }

    @Override
    public Optional<List<StreamEventEnvelope<?>>> getLastStreamEvents(StreamId streamId, int count) {
        requireNonNull(streamId, "No streamId provided");
        requireTrue(count >= 0, "count must be >= 0");
        return jdbi.withHandle(handle -> {
            if (loadStreamVersion(handle, streamId).isEmpty()) {
                return Optional.<List<StreamEventData>>empty();
            }
            return Optional.of(handle.createQuery(bind("SELECT * FROM {:tableName} WHERE stream_id = :streamId ORDER BY event_number DESC LIMIT :count",
                                                       arg("tableName", configuration.eventStreamTableName)))
                                     .bind("streamId", streamId.toString())
                                     .bind("count", count)
                                     .map(rowMapper)
                                     .list());
        }).map(this::decode);
    }

    @Override
    public AppendResult appendEvents(StreamId streamId, List<? extends StreamEventEnvelope<?>> events, ExpectedStreamVersion expectedVersion) {
        requireNonNull(streamId, "No streamId provided");
        requireNonNull(events, "No events provided");
        requireNonNull(expectedVersion, "No expectedVersion provided");
        if (events.isEmpty()) {
            throw new IllegalArgumentException(msg("Cannot append an empty list of events to stream '{}'", streamId));
        }

        var serializer = configuration.eventSerializer;
        var serializedEvents = events.stream()
                                     .map(envelope -> serializer.serialize(requireNonNull(envelope, "The list of events contains a null envelope").event()))
                                     .collect(Collectors.toList());
        var serializedMetaData = events.stream()
                                       .map(envelope -> envelope.metaData().isEmpty() ? null : serializer.serializeMetaData(envelope.metaData()))
                                       .collect(Collectors.toList());

        try {
            commitLock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AppendCancelledException(msg("Append of {} event(s) to stream '{}' was cancelled", events.size(), streamId), e);
        }
        List<StreamEventData> appendedEvents;
        try {
            appendedEvents = appendInTransaction(streamId, events, expectedVersion, serializedEvents, serializedMetaData);
            readProjectionPublisher.enqueue(toCommittedEnvelopes(events, appendedEvents));
        } finally {
            commitLock.unlock();
        }

        var lastEvent = appendedEvents.get(appendedEvents.size() - 1);
        log.debug("Appended {} event(s) to stream '{}' with expectedVersion {}. New version {} and last globalEventPosition {}",
                  appendedEvents.size(),
                  streamId,
                  expectedVersion,
                  lastEvent.eventNumber(),
                  lastEvent.globalEventPosition());
        readProjectionPublisher.deliverEnqueued();
        return new AppendResult(lastEvent.globalEventPosition(), lastEvent.eventNumber());
    }

    private List<StreamEventData> appendInTransaction(StreamId streamId,
                                                      List<? extends StreamEventEnvelope<?>> events,
                                                      ExpectedStreamVersion expectedVersion,
                                                      List<SerializedEvent> serializedEvents,
                                                      List<byte[]> serializedMetaData) {
        try {
            return jdbi.inTransaction(handle -> {
                handle.createQuery("SELECT true FROM pg_advisory_xact_lock(hashtext(:streamId))")
                      .bind("streamId", streamId.toString())
                      .mapTo(Boolean.class)
                      .one();
                var currentVersion = loadStreamVersion(handle, streamId).orElse(EventNumber.NO_STREAM);
                if (!expectedVersion.isSatisfiedBy(currentVersion)) {
                    throw new ConcurrencyConflictException(streamId, expectedVersion, currentVersion);
                }
                if (Thread.currentThread().isInterrupted()) {
                    throw new AppendCancelledException(msg("Append of {} event(s) to stream '{}' was cancelled", events.size(), streamId));
                }
                return insertEvents(handle, streamId, currentVersion, events, serializedEvents, serializedMetaData);
            });
        } catch (EventStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            if (isUniqueViolationOf(e, configuration.streamVersionConstraintName())) {
                throw new ConcurrencyConflictException(streamId,
                                                       expectedVersion,
                                                       streamVersion(streamId).orElse(EventNumber.NO_STREAM),
                                                       e);
            }
            throw new AppendToStreamException(msg("Failed to append {} event(s) to stream '{}'",
                                                  events.size(),
                                                  streamId), e);
        }
    }

    private List<StreamEventData> insertEvents(Handle handle,
                                               StreamId streamId,
                                               EventNumber currentVersion,
                                               List<? extends StreamEventEnvelope<?>> events,
                                               List<SerializedEvent> serializedEvents,
                                               List<byte[]> serializedMetaData) {
        var timestamp = OffsetDateTime.now(Clock.systemUTC());
        var batch = handle.prepareBatch(bind("INSERT INTO {:tableName} (stream_id, event_number, event_id, event_type, data, metadata, timestamp) " +
                                                     "VALUES (:streamId, :eventNumber, :eventId, :eventType, :data, :metadata, :timestamp)",
                                             arg("tableName", configuration.eventStreamTableName)));
        var eventNumber = currentVersion;
        var eventNumbers = new ArrayList<EventNumber>(events.size());
        for (int index = 0; index < events.size(); index++) {
            eventNumber = eventNumber.increaseAndGet();
            eventNumbers.add(eventNumber);
            batch.bind("streamId", streamId.toString())
                 .bind("eventNumber", eventNumber.longValue())
                 .bind("eventId", events.get(index).eventId().toString())
                 .bind("eventType", serializedEvents.get(index).eventType().toString())
                 .bind("data", serializedEvents.get(index).data())
                 .bind("metadata", serializedMetaData.get(index))
                 .bind("timestamp", timestamp)
                 .add();
        }

        var globalPositions = batch.executeAndReturnGeneratedKeys("global_position")
                                   .mapTo(Long.class)
                                   .list();

        var appendedEvents = new ArrayList<StreamEventData>(events.size());
        for (int index = 0; index < events.size(); index++) {
            appendedEvents.add(new StreamEventData(events.get(index).eventId(),
                                                   serializedEvents.get(index).eventType(),
                                                   serializedEvents.get(index).data(),
                                                   Optional.ofNullable(serializedMetaData.get(index)),
                                                   streamId,
                                                   eventNumbers.get(index),
                                                   GlobalEventPosition.of(globalPositions.get(index)),
                                                   timestamp));
        }
        return appendedEvents;
    }

    /**
     * Search the cause chain, and the {@link SQLException#getNextException()} chain of a batch, for a
     * unique violation (SQLState 23505) of the constraint named <code>constraintName</code>
     */
    static boolean isUniqueViolationOf(Throwable exception, String constraintName) {
        var visited = Collections.newSetFromMap(new IdentityHashMap<Throwable, Boolean>());
        var pending = new ArrayDeque<Throwable>();
        pending.add(exception);
        while (!pending.isEmpty()) {
            var current = pending.poll();
            if (!visited.add(current)) {
                continue;
            }
            if (current instanceof PSQLException) {
                var psqlException = (PSQLException) current;
                var serverError   = psqlException.getServerErrorMessage();
                if (UNIQUE_VIOLATION.equals(psqlException.getSQLState()) &&
                        serverError != null &&
                        constraintName.equals(serverError.getConstraint())) {
                    return true;
                }
            }
            if (current instanceof SQLException && ((SQLException) current).getNextException() != null) {
                pending.add(((SQLException) current).getNextException());
            }
            if (current.getCause() != null) {
                pending.add(current.getCause());
            }
        }
        return false;
    }

    private List<StreamEventEnvelope<?>> toCommittedEnvelopes(List<? extends StreamEventEnvelope<?>> events, List<StreamEventData> appendedEvents) {
        var committed = new ArrayList<StreamEventEnvelope<?>>(appendedEvents.size());
        for (int index = 0; index < appendedEvents.size(); index++) {
            var envelope = events.get(index);
            committed.add(StreamEventEnvelope.persisted(envelope.event(),
                                                        envelope.metaData(),
                                                        StreamEventMetadata.from(appendedEvents.get(index))));
        }
        return committed;
    }

    @Override
    public Stream<StreamEventData> loadEventsByGlobalPosition(LongRange globalPositionRange) {
        requireNonNull(globalPositionRange, "No globalPositionRange provided");
        String sql = "SELECT * FROM {:tableName} WHERE \n";
        if (globalPositionRange.isClosedRange()) {
            sql += "   global_position BETWEEN :globalPositionFrom AND :globalPositionTo";
        } else {
            sql += "   global_position >= :globalPositionFrom";
        }
        sql += " ORDER BY global_position ASC";

        var querySql = bind(sql, arg("tableName", configuration.eventStreamTableName));
        return jdbi.withHandle(handle -> {
            var query = handle.createQuery(querySql);
            query.bind("globalPositionFrom", globalPositionRange.fromInclusive);
            if (globalPositionRange.isClosedRange()) {
                query.bind("globalPositionTo", globalPositionRange.toInclusive);
            }
            query.setFetchSize(configuration.queryFetchSize);
            return query.map(rowMapper)
                        .list();
        }).stream();
    }

    @Override
    public ReadProjectionPublisher readProjectionPublisher() {
        return readProjectionPublisher;
    }

    @Override
    public EventSerializer eventSerializer() {
        return configuration.eventSerializer;
    }

    private List<StreamEventEnvelope<?>> decode(List<StreamEventData> events) {
        return events.stream()
                     .<StreamEventEnvelope<?>>map(configuration.eventSerializer::toEnvelope)
                     .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "PostgresqlEventStore{" +
                "eventStreamTableName='" + configuration.eventStreamTableName + '\'' +
                '}';
    }
}
