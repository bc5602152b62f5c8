package dk.cloudcreate.essentials.eventstreams.eventstore;

import dk.cloudcreate.essentials.eventstreams.eventstore.types.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when an append's {@link ExpectedStreamVersion} doesn't match the actual version of the stream.<br>
 * Nothing has been written to the stream when this exception is thrown. The typical recovery is to reload
 * the aggregate/stream and retry the command.
 */
public class ConcurrencyConflictException extends EventStoreException {
    public final StreamId              streamId;
    public final ExpectedStreamVersion expectedVersion;
    public final EventNumber           actualVersion;

    public ConcurrencyConflictException(StreamId streamId, ExpectedStreamVersion expectedVersion, EventNumber actualVersion) {
        super(generateMessage(streamId, expectedVersion, actualVersion));
        this.streamId = requireNonNull(streamId, "No streamId provided");
        this.expectedVersion = requireNonNull(expectedVersion, "No expectedVersion provided");
        this.actualVersion = requireNonNull(actualVersion, "No actualVersion provided");
    }

    public ConcurrencyConflictException(StreamId streamId, ExpectedStreamVersion expectedVersion, EventNumber actualVersion, Throwable cause) {
        super(generateMessage(streamId, expectedVersion, actualVersion), cause);
        this.streamId = requireNonNull(streamId, "No streamId provided");
        this.expectedVersion = requireNonNull(expectedVersion, "No expectedVersion provided");
        this.actualVersion = requireNonNull(actualVersion, "No actualVersion provided");
    }

    private static String generateMessage(StreamId streamId, ExpectedStreamVersion expectedVersion, EventNumber actualVersion) {
        return msg("Wrong version for stream '{}'. Expected {}, actual {}",
                   streamId,
                   expectedVersion,
                   actualVersion);
    }
}
