package dk.cloudcreate.essentials.eventstreams.eventstore.projection;

import dk.cloudcreate.essentials.eventstreams.eventstore.StreamEventEnvelope;

/**
 * A read model that's kept up to date with the events committed to an EventStore.<br>
 * Register it with the store's {@link ReadProjectionPublisher}
 */
@FunctionalInterface
public interface ReadProjection {
    /**
     * Called once for every committed event, in commit order
     *
     * @param event the committed event, including its stream metadata
     */
    void project(StreamEventEnvelope<?> event);
}
