package dk.cloudcreate.essentials.eventstreams.eventstore.subscription;

import dk.cloudcreate.essentials.eventstreams.eventstore.*;
import dk.cloudcreate.essentials.eventstreams.eventstore.projection.ReadProjection;
import dk.cloudcreate.essentials.eventstreams.eventstore.types.*;
import org.slf4j.*;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Durable subscription to all events committed to an {@link EventStore}, across all streams, in {@link GlobalEventPosition} order.<br>
 * On {@link #start()} the subscription loads the subscriber's checkpoint from the {@link SubscriptionCheckpointRepository} and uses
 * {@link EventStore#pollEvents(long, Optional, Optional)} to follow the events committed after it. Every event is decoded, handed to the
 * {@link ReadProjection} and then stored as the new checkpoint, so a restarted subscriber (in the same or another process) resumes
 * right after the last event it handled.<br>
 * If the {@link ReadProjection} throws, the checkpoint isn't advanced and the subscription resubscribes from the checkpoint after
 * <code>retryDelay</code>, i.e. the failed event is redelivered.
 * <p>
 * Example:
 * <pre>{@code
 * var subscription = new CheckpointedSubscription(SubscriberId.of("OrderSummaries"),
 *                                                 eventStore,
 *                                                 checkpointRepository,
 *                                                 orderSummaryProjection);
 * subscription.start();
 * }</pre>
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public class CheckpointedSubscription {
    private static final Logger   log                 = LoggerFactory.getLogger(CheckpointedSubscription.class);
    public static final  Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);

    private final SubscriberId                     subscriberId;
    private final EventStore                       eventStore;
    private final SubscriptionCheckpointRepository checkpointRepository;
    private final ReadProjection                   projection;
    private final Optional<Integer>                loadEventsBatchSize;
    private final Optional<Duration>               pollingInterval;
    private final Duration                         retryDelay;

    private volatile Disposable subscription;

    public CheckpointedSubscription(SubscriberId subscriberId,
                                    EventStore eventStore,
                                    SubscriptionCheckpointRepository checkpointRepository,
                                    ReadProjection projection) {
        this(subscriberId, eventStore, checkpointRepository, projection, Optional.empty(), Optional.empty(), DEFAULT_RETRY_DELAY);
    }

    /**
     * @param subscriberId         the subscriber the checkpoint is stored under
     * @param eventStore           the event store to follow
     * @param checkpointRepository where the checkpoint is loaded from and stored
     * @param projection           receives every event after the checkpoint, in {@link GlobalEventPosition} order
     * @param loadEventsBatchSize  how many events to load per poll (see {@link EventStore#pollEvents(long, Optional, Optional)})
     * @param pollingInterval      how long to wait between polls (see {@link EventStore#pollEvents(long, Optional, Optional)})
     * @param retryDelay           how long to wait before resubscribing after the projection failed
     */
    public CheckpointedSubscription(SubscriberId subscriberId,
                                    EventStore eventStore,
                                    SubscriptionCheckpointRepository checkpointRepository,
                                    ReadProjection projection,
                                    Optional<Integer> loadEventsBatchSize,
                                    Optional<Duration> pollingInterval,
                                    Duration retryDelay) {
        this.subscriberId = requireNonNull(subscriberId, "No subscriberId provided");
        this.eventStore = requireNonNull(eventStore, "No eventStore provided");
        this.checkpointRepository = requireNonNull(checkpointRepository, "No checkpointRepository provided");
        this.projection = requireNonNull(projection, "No projection provided");
        this.loadEventsBatchSize = requireNonNull(loadEventsBatchSize, "No loadEventsBatchSize option provided");
        this.pollingInterval = requireNonNull(pollingInterval, "No pollingInterval option provided");
        this.retryDelay = requireNonNull(retryDelay, "No retryDelay provided");
    }

    public SubscriberId subscriberId() {
        return subscriberId;
    }

    /**
     * Start following the events after the subscriber's checkpoint. Calling start on an active subscription does nothing
     */
    public synchronized void start() {
        if (isActive()) {
            log.debug("[{}] Subscription is already active", subscriberId);
            return;
        }
        log.info("[{}] Starting subscription from {}", subscriberId, currentResumePoint());
        subscription = Flux.defer(() -> eventStore.pollEvents(currentResumePoint().longValue(), loadEventsBatchSize, pollingInterval))
                           .doOnNext(this::handle)
                           .retryWhen(Retry.fixedDelay(Long.MAX_VALUE, retryDelay)
                                           .doBeforeRetry(signal -> log.info("[{}] Resubscribing from {} after failure #{}",
                                                                             subscriberId,
                                                                             currentResumePoint(),
                                                                             signal.totalRetries() + 1)))
                           .subscribe(eventData -> { },
                                      e -> log.error(msg("[{}] Subscription stopped", subscriberId), e));
    }

    /**
     * Stop following events. The checkpoint is kept, so a later {@link #start()} resumes where this subscription stopped
     */
    public synchronized void stop() {
        var current = subscription;
        if (current != null && !current.isDisposed()) {
            log.info("[{}] Stopping subscription at {}", subscriberId, currentResumePoint());
            current.dispose();
        }
        subscription = null;
    }

    public boolean isActive() {
        var current = subscription;
        return current != null && !current.isDisposed();
    }

    /**
     * @return the {@link GlobalEventPosition} of the next event this subscriber will handle
     */
    public GlobalEventPosition currentResumePoint() {
        return checkpointRepository.loadCheckpoint(subscriberId)
                                   .map(GlobalEventPosition::increment)
                                   .orElse(GlobalEventPosition.FIRST_GLOBAL_EVENT_POSITION);
    }

    /**
     * Make the subscriber handle the events again starting with (and including) <code>resumeFrom</code>.
     * An active subscription is restarted
     *
     * @param resumeFrom the {@link GlobalEventPosition} of the next event to handle
     */
    public synchronized void resetFrom(GlobalEventPosition resumeFrom) {
        requireNonNull(resumeFrom, "No resumeFrom provided");
        requireTrue(resumeFrom.longValue() >= GlobalEventPosition.FIRST_GLOBAL_EVENT_POSITION.longValue(),
                    msg("resumeFrom must be >= {}", GlobalEventPosition.FIRST_GLOBAL_EVENT_POSITION));
        var wasActive = isActive();
        stop();
        log.info("[{}] Resetting subscription to resume from {}", subscriberId, resumeFrom);
        if (resumeFrom.equals(GlobalEventPosition.FIRST_GLOBAL_EVENT_POSITION)) {
            checkpointRepository.deleteCheckpoint(subscriberId);
        } else {
            checkpointRepository.storeCheckpoint(subscriberId, GlobalEventPosition.of(resumeFrom.longValue() - 1));
        }
        if (wasActive) {
            start();
        }
    }

    private void handle(StreamEventData eventData) {
        try {
            projection.project(eventStore.eventSerializer().toEnvelope(eventData));
        } catch (RuntimeException e) {
            log.error(msg("[{}] ReadProjection '{}' failed to handle event with eventId '{}' at globalEventPosition {}",
                          subscriberId,
                          projection,
                          eventData.eventId(),
                          eventData.globalEventPosition()),
                      e);
            throw e;
        }
        checkpointRepository.storeCheckpoint(subscriberId, eventData.globalEventPosition());
        log.trace("[{}] Stored checkpoint {}", subscriberId, eventData.globalEventPosition());
    }

    @Override
    public String toString() {
        return "CheckpointedSubscription{" +
                "subscriberId=" + subscriberId +
                ", projection=" + projection +
                ", active=" + isActive() +
                '}';
    }
}
