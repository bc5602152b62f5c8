package dk.cloudcreate.essentials.eventstreams.eventstore;

import dk.cloudcreate.essentials.eventstreams.eventstore.types.EventNumber;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The optimistic concurrency precondition of an append to a stream:
 * <ul>
 *     <li>{@link #noStream()} - the append only succeeds if the stream doesn't contain any events</li>
 *     <li>{@link #any()} - the append always succeeds</li>
 *     <li>{@link #exactly(long)} - the append only succeeds if the current stream version (the {@link EventNumber}
 *     of the last event in the stream) is exactly the given version</li>
 * </ul>
 */
public final class ExpectedStreamVersion {
    public enum Kind {
        NO_STREAM,
        ANY,
        EXACT
    }

    private static final ExpectedStreamVersion NO_STREAM = new ExpectedStreamVersion(Kind.NO_STREAM, EventNumber.NO_STREAM.longValue());
    private static final ExpectedStreamVersion ANY       = new ExpectedStreamVersion(Kind.ANY, -2);

    private final Kind kind;
    private final long version;

    private ExpectedStreamVersion(Kind kind, long version) {
        this.kind = requireNonNull(kind, "No kind provided");
        this.version = version;
    }

    public static ExpectedStreamVersion noStream() {
        return NO_STREAM;
    }

    public static ExpectedStreamVersion any() {
        return ANY;
    }

    public static ExpectedStreamVersion exactly(long version) {
        requireTrue(version >= 0, msg("An exact expected stream version must be >= 0, but was {}", version));
        return new ExpectedStreamVersion(Kind.EXACT, version);
    }

    public static ExpectedStreamVersion exactly(EventNumber version) {
        requireNonNull(version, "No version provided");
        return exactly(version.longValue());
    }

    /**
     * Convert the version an aggregate was loaded with into the precondition used when appending its new events
     *
     * @param aggregateVersion the aggregate's original version, where {@link EventNumber#NO_STREAM} (-1) means that
     *                         the aggregate has never been persisted
     * @return {@link #noStream()} if <code>aggregateVersion</code> is -1, otherwise {@link #exactly(long)}
     */
    public static ExpectedStreamVersion fromAggregateVersion(long aggregateVersion) {
        if (aggregateVersion == EventNumber.NO_STREAM.longValue()) {
            return NO_STREAM;
        }
        return exactly(aggregateVersion);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * The expected version. -1 for {@link Kind#NO_STREAM} and -2 for {@link Kind#ANY}
     */
    public long version() {
        return version;
    }

    /**
     * Check if the precondition is satisfied by a stream with the given current version
     *
     * @param currentStreamVersion the current stream version ({@link EventNumber#NO_STREAM} if the stream has no events)
     * @return true if an append with this precondition is allowed
     */
    public boolean isSatisfiedBy(EventNumber currentStreamVersion) {
        requireNonNull(currentStreamVersion, "No currentStreamVersion provided");
        switch (kind) {
            case ANY:
                return true;
            case NO_STREAM:
                return currentStreamVersion.longValue() == EventNumber.NO_STREAM.longValue();
            default:
                return currentStreamVersion.longValue() == version;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExpectedStreamVersion that = (ExpectedStreamVersion) o;
        return version == that.version && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, version);
    }

    @Override
    public String toString() {
        switch (kind) {
            case ANY:
                return "Any";
            case NO_STREAM:
                return "NoStream";
            default:
                return String.valueOf(version);
        }
    }
}
