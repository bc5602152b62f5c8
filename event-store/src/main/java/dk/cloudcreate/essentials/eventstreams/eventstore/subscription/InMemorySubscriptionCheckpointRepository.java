package dk.cloudcreate.essentials.eventstreams.eventstore.subscription;

import dk.cloudcreate.essentials.eventstreams.eventstore.types.*;

import java.util.Optional;
import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * {@link SubscriptionCheckpointRepository} that keeps the checkpoints in memory
 */
public class InMemorySubscriptionCheckpointRepository implements SubscriptionCheckpointRepository {
    private final ConcurrentMap<SubscriberId, GlobalEventPosition> checkpoints = new ConcurrentHashMap<>();

    @Override
    public Optional<GlobalEventPosition> loadCheckpoint(SubscriberId subscriberId) {
        requireNonNull(subscriberId, "No subscriberId provided");
        return Optional.ofNullable(checkpoints.get(subscriberId));
    }

    @Override
    public void storeCheckpoint(SubscriberId subscriberId, GlobalEventPosition lastHandledEvent) {
        requireNonNull(subscriberId, "No subscriberId provided");
        requireNonNull(lastHandledEvent, "No lastHandledEvent provided");
        checkpoints.put(subscriberId, lastHandledEvent);
    }

    @Override
    public void deleteCheckpoint(SubscriberId subscriberId) {
        requireNonNull(subscriberId, "No subscriberId provided");
        checkpoints.remove(subscriberId);
    }

    @Override
    public String toString() {
        return "InMemorySubscriptionCheckpointRepository{" +
                "checkpoints=" + checkpoints +
                '}';
    }
}
