package dk.cloudcreate.essentials.eventstreams.aggregates;

import dk.cloudcreate.essentials.eventstreams.eventstore.types.EventId;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Base class for aggregates whose state is derived entirely from their own event stream.<br>
 * The aggregate tracks two versions:
 * <ul>
 *     <li>{@link #originalVersion()} - the version of the aggregate as it was last loaded from or committed to the event stream</li>
 *     <li>{@link #currentVersion()} - the version after applying the uncommitted events of the current in-memory session</li>
 * </ul>
 * Both start at {@link #NO_EVENTS_HAVE_BEEN_APPLIED}.<br>
 * Business logic calls {@link #applyEvent(DomainEvent)}, which folds the event into the aggregate state and queues it as uncommitted.
 * Replaying history uses {@link #fold(DomainEvent)}/{@link #loadFromHistory(List)}, which advances both versions.<br>
 * <br>
 * Concrete aggregates implement {@link #when(DomainEvent)} and must handle every event type they can be asked to apply.
 * Instances are not thread-safe.
 *
 * @param <ID>    the aggregate id type
 * @param <EVENT> the base type of the events the aggregate produces
 */
public abstract class EventSourcedAggregate<ID, EVENT extends DomainEvent> {
    public static final long NO_EVENTS_HAVE_BEEN_APPLIED = -1;

    private final ID                            aggregateId;
    private final LinkedHashMap<EventId, EVENT> uncommittedEvents = new LinkedHashMap<>();
    private       long                          originalVersion   = NO_EVENTS_HAVE_BEEN_APPLIED;
    private       long                          currentVersion    = NO_EVENTS_HAVE_BEEN_APPLIED;

    protected EventSourcedAggregate(ID aggregateId) {
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
    }

    public ID aggregateId() {
        return aggregateId;
    }

    /**
     * The version of the aggregate as it was last loaded from or committed to the event stream.
     * {@link #NO_EVENTS_HAVE_BEEN_APPLIED} for a new aggregate
     */
    public long originalVersion() {
        return originalVersion;
    }

    /**
     * The version of the aggregate including the uncommitted events
     */
    public long currentVersion() {
        return currentVersion;
    }

    /**
     * Apply a new event: the event is folded into the aggregate state using {@link #when(DomainEvent)} and queued as uncommitted
     *
     * @param event the event to apply
     */
    protected void applyEvent(EVENT event) {
        applyEvent(event, true);
    }

    /**
     * Apply an event to the aggregate state using {@link #when(DomainEvent)}.<br>
     * If <code>isNew</code> is true the event is queued as uncommitted. Queueing is deduplicated by {@link DomainEvent#eventId()},
     * so applying an already queued event again folds it again but leaves the queue and {@link #currentVersion()} unchanged.
     *
     * @param event the event to apply
     * @param isNew is the event a new (uncommitted) event
     */
    protected void applyEvent(EVENT event, boolean isNew) {
        requireNonNull(event, "No event provided");
        if (isNew) {
            requireNonNull(event.eventId(), "The event doesn't have an eventId");
            var alreadyQueued = uncommittedEvents.containsKey(event.eventId());
            when(event);
            if (!alreadyQueued) {
                uncommittedEvents.put(event.eventId(), event);
                currentVersion++;
            }
        } else {
            when(event);
            currentVersion++;
        }
    }

    /**
     * Replay a historic (already committed) event. Advances both {@link #originalVersion()} and {@link #currentVersion()}
     *
     * @param event the historic event
     */
    public void fold(EVENT event) {
        requireNonNull(event, "No event provided");
        when(event);
        originalVersion++;
        currentVersion++;
    }

    /**
     * {@link #fold(DomainEvent)} each of the historic events in stream order
     *
     * @param history the historic events
     */
    public void loadFromHistory(List<? extends EVENT> history) {
        requireNonNull(history, "No history provided");
        history.forEach(this::fold);
    }

    /**
     * @return a snapshot of the events that have been applied but not yet committed, in the order they were applied
     */
    public List<EVENT> getUncommittedEvents() {
        return List.copyOf(uncommittedEvents.values());
    }

    public boolean hasUncommittedEvents() {
        return !uncommittedEvents.isEmpty();
    }

    /**
     * Get the uncommitted events and then {@link #markUncommittedAsCommitted()}
     *
     * @return the events that were uncommitted
     */
    public List<EVENT> dequeueUncommittedEvents() {
        var events = getUncommittedEvents();
        markUncommittedAsCommitted();
        return events;
    }

    /**
     * Clear the uncommitted events and set {@link #originalVersion()} to {@link #currentVersion()}.<br>
     * Only call this after the uncommitted events have been appended to the event stream
     */
    public void markUncommittedAsCommitted() {
        uncommittedEvents.clear();
        originalVersion = currentVersion;
    }

    /**
     * Check a business rule before applying a state changing event
     *
     * @param rule the rule to check
     * @throws BusinessRuleValidationException if the rule is broken
     */
    protected void checkRule(BusinessRule rule) {
        requireNonNull(rule, "No rule provided");
        if (rule.isBroken()) {
            throw new BusinessRuleValidationException(rule);
        }
    }

    /**
     * Mutate the aggregate state to reflect the event. Must not fail for a well-formed event and must not ignore events:
     * an event the aggregate can't handle must result in {@link #foldHandlerMissing(DomainEvent)} being thrown
     *
     * @param event the event to apply
     */
    protected abstract void when(EVENT event);

    protected final FoldHandlerMissingException foldHandlerMissing(EVENT event) {
        return new FoldHandlerMissingException(getClass(), event.getClass());
    }
}
