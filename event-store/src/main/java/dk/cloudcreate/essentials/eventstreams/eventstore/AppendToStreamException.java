package dk.cloudcreate.essentials.eventstreams.eventstore;

public class AppendToStreamException extends EventStoreException {
    public AppendToStreamException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
