package dk.cloudcreate.essentials.eventstreams.aggregates;

/**
 * Base exception for all aggregate related problems
 */
public class AggregateException extends RuntimeException {
    public AggregateException(String message) {
        super(message);
    }

    public AggregateException(String message, Throwable cause) {
        super(message, cause);
    }
}
