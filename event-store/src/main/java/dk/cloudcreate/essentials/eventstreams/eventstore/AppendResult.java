package dk.cloudcreate.essentials.eventstreams.eventstore;

import dk.cloudcreate.essentials.eventstreams.eventstore.types.*;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The result of a successful append to a stream
 */
public final class AppendResult {
    private final GlobalEventPosition globalPosition;
    private final EventNumber         nextExpectedVersion;

    public AppendResult(GlobalEventPosition globalPosition, EventNumber nextExpectedVersion) {
        this.globalPosition = requireNonNull(globalPosition, "No globalPosition provided");
        this.nextExpectedVersion = requireNonNull(nextExpectedVersion, "No nextExpectedVersion provided");
    }

    /**
     * The global position of the last event committed by the append
     */
    public GlobalEventPosition globalPosition() {
        return globalPosition;
    }

    /**
     * The stream version after the append, i.e. the version a follow-up append should expect
     */
    public EventNumber nextExpectedVersion() {
        return nextExpectedVersion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AppendResult that = (AppendResult) o;
        return globalPosition.equals(that.globalPosition) && nextExpectedVersion.equals(that.nextExpectedVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(globalPosition, nextExpectedVersion);
    }

    @Override
    public String toString() {
        return "AppendResult{" +
                "globalPosition=" + globalPosition +
                ", nextExpectedVersion=" + nextExpectedVersion +
                '}';
    }
}
