package dk.cloudcreate.essentials.eventstreams.eventstore.postgresql;

import dk.cloudcreate.essentials.eventstreams.eventstore.serializer.EventSerializer;

import java.util.regex.Pattern;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Configuration of the {@link PostgresqlEventStore}
 */
public class PostgresqlEventStoreConfiguration {
    public static final String DEFAULT_EVENT_STREAM_TABLE_NAME = "stream_events";
    public static final int    DEFAULT_QUERY_FETCH_SIZE        = 100;

    /**
     * Postgresql truncates identifiers that are longer than this
     */
    public static final int MAX_IDENTIFIER_LENGTH = 63;

    private static final Pattern VALID_TABLE_NAME = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]{0,62}");

    /**
     * The name of the append-only table that contains the events of all streams
     */
    public final String          eventStreamTableName;
    /**
     * SQL fetch size for queries that read events
     */
    public final int             queryFetchSize;
    /**
     * The serializer used to convert events and metadata to and from the <code>bytea</code> columns
     */
    public final EventSerializer eventSerializer;

    /**
     * @param eventStreamTableName the name of the table that contains the events (letters, digits and underscore)
     * @param queryFetchSize       SQL fetch size for queries that read events
     * @param eventSerializer      the serializer used to convert events and metadata
     */
    public PostgresqlEventStoreConfiguration(String eventStreamTableName,
                                             int queryFetchSize,
                                             EventSerializer eventSerializer) {
        this.eventStreamTableName = requireNonNull(eventStreamTableName, "No eventStreamTableName provided").toLowerCase();
        requireTrue(VALID_TABLE_NAME.matcher(eventStreamTableName).matches(),
                    msg("Invalid eventStreamTableName '{}'", eventStreamTableName));
        requireTrue(queryFetchSize > 0, "queryFetchSize must be > 0");
        this.queryFetchSize = queryFetchSize;
        this.eventSerializer = requireNonNull(eventSerializer, "No eventSerializer provided");
    }

    /**
     * Configuration that stores all events in the {@value #DEFAULT_EVENT_STREAM_TABLE_NAME} table
     *
     * @param eventSerializer the serializer used to convert events and metadata
     */
    public static PostgresqlEventStoreConfiguration standardConfiguration(EventSerializer eventSerializer) {
        return new PostgresqlEventStoreConfiguration(DEFAULT_EVENT_STREAM_TABLE_NAME,
                                                     DEFAULT_QUERY_FETCH_SIZE,
                                                     eventSerializer);
    }

    /**
     * The name of the <code>UNIQUE (stream_id, event_number)</code> constraint
     */
    public String streamVersionConstraintName() {
        return identifierFor("_stream_version_uq");
    }

    /**
     * The name of the <code>UNIQUE (event_id)</code> constraint
     */
    public String eventIdConstraintName() {
        return identifierFor("_event_id_uq");
    }

    /**
     * The name of the index on the <code>event_type</code> column
     */
    public String eventTypeIndexName() {
        return identifierFor("_event_type");
    }

    /**
     * <code>eventStreamTableName + suffix</code>, with the table name part shortened so the result never exceeds {@link #MAX_IDENTIFIER_LENGTH}
     */
    private String identifierFor(String suffix) {
        var tableNamePart = eventStreamTableName.substring(0, Math.min(eventStreamTableName.length(), MAX_IDENTIFIER_LENGTH - suffix.length()));
        return tableNamePart + suffix;
    }

    @Override
    public String toString() {
        return "PostgresqlEventStoreConfiguration{" +
                "eventStreamTableName='" + eventStreamTableName + '\'' +
                ", queryFetchSize=" + queryFetchSize +
                '}';
    }
}
