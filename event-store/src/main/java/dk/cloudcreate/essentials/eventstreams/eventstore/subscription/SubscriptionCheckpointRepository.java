package dk.cloudcreate.essentials.eventstreams.eventstore.subscription;

import dk.cloudcreate.essentials.eventstreams.eventstore.types.*;

import java.util.Optional;

/**
 * Stores how far each {@link SubscriberId} has come, expressed as the {@link GlobalEventPosition} of the last event
 * the subscriber has handled
 *
 * @see InMemorySubscriptionCheckpointRepository
 * @see CheckpointedSubscription
 */
public interface SubscriptionCheckpointRepository {
    /**
     * @param subscriberId the subscriber
     * @return the {@link GlobalEventPosition} of the last event the subscriber handled or {@link Optional#empty()} if it hasn't handled any events
     */
    Optional<GlobalEventPosition> loadCheckpoint(SubscriberId subscriberId);

    /**
     * Create or update the checkpoint of the subscriber
     *
     * @param subscriberId     the subscriber
     * @param lastHandledEvent the {@link GlobalEventPosition} of the last event the subscriber handled
     */
    void storeCheckpoint(SubscriberId subscriberId, GlobalEventPosition lastHandledEvent);

    /**
     * Remove the checkpoint, so the subscriber starts from {@link GlobalEventPosition#FIRST_GLOBAL_EVENT_POSITION} next time
     *
     * @param subscriberId the subscriber
     */
    void deleteCheckpoint(SubscriberId subscriberId);
}
