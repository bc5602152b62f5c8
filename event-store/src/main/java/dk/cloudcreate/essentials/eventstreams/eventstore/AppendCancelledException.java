package dk.cloudcreate.essentials.eventstreams.eventstore;

/**
 * Thrown when the thread performing an append was interrupted before the events were committed.
 * The stream is left untouched.
 */
public class AppendCancelledException extends EventStoreException {
    public AppendCancelledException(String message) {
        super(message);
    }

    public AppendCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
