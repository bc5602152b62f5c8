package dk.cloudcreate.essentials.eventstreams.eventstore.projection;

import dk.cloudcreate.essentials.eventstreams.eventstore.StreamEventEnvelope;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.locks.ReentrantLock;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Registry of {@link ReadProjection}'s that are notified after events have been committed.<br>
 * An {@link dk.cloudcreate.essentials.eventstreams.eventstore.EventStore} {@link #enqueue(List)}'s the committed events
 * in commit order while it still holds its commit lock, and calls {@link #deliverEnqueued()} after releasing its locks.
 * Only one thread delivers at a time, so projections see the events one by one and in commit order.
 * If another thread is already delivering, that thread also delivers the newly enqueued events.<br>
 * A projection that throws an exception is logged and skipped for that event; it doesn't affect the commit
 * or any of the other projections.
 */
public class ReadProjectionPublisher {
    private static final Logger log = LoggerFactory.getLogger(ReadProjectionPublisher.class);

    private final List<ReadProjection>          projections  = new CopyOnWriteArrayList<>();
    private final Queue<StreamEventEnvelope<?>> pending      = new ConcurrentLinkedQueue<>();
    private final ReentrantLock                 deliveryLock = new ReentrantLock();

    public ReadProjectionPublisher addProjection(ReadProjection projection) {
        projections.add(requireNonNull(projection, "No projection provided"));
        return this;
    }

    public ReadProjectionPublisher removeProjection(ReadProjection projection) {
        projections.remove(requireNonNull(projection, "No projection provided"));
        return this;
    }

    public List<ReadProjection> projections() {
        return Collections.unmodifiableList(projections);
    }

    /**
     * Queue the committed events for delivery. Callers must enqueue in commit order
     *
     * @param committedEvents the events that were just committed
     */
    public void enqueue(List<? extends StreamEventEnvelope<?>> committedEvents) {
        requireNonNull(committedEvents, "No committedEvents provided");
        pending.addAll(committedEvents);
    }

    /**
     * Deliver the queued events to every registered projection, unless another thread is already delivering.
     * A projection that appends events from within {@link ReadProjection#project(StreamEventEnvelope)} gets its events
     * delivered by the outer call once the current event has been projected
     */
    public void deliverEnqueued() {
        if (deliveryLock.isHeldByCurrentThread()) {
            return;
        }
        do {
            if (!deliveryLock.tryLock()) {
                return;
            }
            try {
                StreamEventEnvelope<?> event;
                while ((event = pending.poll()) != null) {
                    deliver(event);
                }
            } finally {
                deliveryLock.unlock();
            }
        } while (!pending.isEmpty());
    }

    /**
     * @return the number of committed events that haven't been delivered yet
     */
    public int pendingDeliveries() {
        return pending.size();
    }

    private void deliver(StreamEventEnvelope<?> event) {
        for (var projection : projections) {
            try {
                projection.project(event);
            } catch (RuntimeException e) {
                log.error(msg("ReadProjection '{}' failed to project event '{}' with eventId '{}'",
                              projection,
                              event.event().getClass().getSimpleName(),
                              event.eventId()),
                          e);
            }
        }
    }
}
