package dk.cloudcreate.essentials.eventstreams.eventstore.serializer;

import dk.cloudcreate.essentials.eventstreams.eventstore.types.EventTypeName;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Explicit mapping between logical {@link EventTypeName}'s and the Java types they are serialized from and deserialized into.<br>
 * The registry is normally populated during application startup, before any events are read or appended:
 * <pre>{@code
 * var registry = new EventTypeRegistry().register(OrderAdded.class)
 *                                       .register(EventTypeName.of("ProductAdded"), ProductAddedToOrder.class);
 * }</pre>
 * Keeping the logical name separate from the Java class name allows event classes to be renamed or moved between
 * packages without breaking already persisted events.
 */
public class EventTypeRegistry {
    private static final Logger log = LoggerFactory.getLogger(EventTypeRegistry.class);

    private final ConcurrentMap<EventTypeName, Class<?>> javaTypePerEventTypeName;
    private final ConcurrentMap<Class<?>, EventTypeName> eventTypeNamePerJavaType;

    public EventTypeRegistry() {
        javaTypePerEventTypeName = new ConcurrentHashMap<>();
        eventTypeNamePerJavaType = new ConcurrentHashMap<>();
    }

    /**
     * Register the event type using its {@link Class#getSimpleName()} as {@link EventTypeName}
     *
     * @param eventType the Java type of the event
     * @return this registry instance
     */
    public EventTypeRegistry register(Class<?> eventType) {
        requireNonNull(eventType, "No eventType provided");
        return register(EventTypeName.of(eventType), eventType);
    }

    /**
     * Register the event type using the given {@link EventTypeName}
     *
     * @param eventTypeName the logical name stored together with the event
     * @param eventType     the Java type of the event
     * @return this registry instance
     * @throws IllegalArgumentException in case the <code>eventTypeName</code> is already registered to another Java type
     */
    public synchronized EventTypeRegistry register(EventTypeName eventTypeName, Class<?> eventType) {
        requireNonNull(eventTypeName, "No eventTypeName provided");
        requireNonNull(eventType, "No eventType provided");
        var existingType = javaTypePerEventTypeName.get(eventTypeName);
        if (existingType != null && !existingType.equals(eventType)) {
            throw new IllegalArgumentException(msg("EventTypeName '{}' is already registered to '{}' and cannot be registered to '{}'",
                                                   eventTypeName,
                                                   existingType.getName(),
                                                   eventType.getName()));
        }
        log.debug("Registering EventTypeName '{}' for '{}'", eventTypeName, eventType.getName());
        javaTypePerEventTypeName.put(eventTypeName, eventType);
        eventTypeNamePerJavaType.put(eventType, eventTypeName);
        return this;
    }

    public boolean isRegistered(EventTypeName eventTypeName) {
        requireNonNull(eventTypeName, "No eventTypeName provided");
        return javaTypePerEventTypeName.containsKey(eventTypeName);
    }

    /**
     * @throws UnknownEventTypeException in case the <code>eventTypeName</code> hasn't been registered
     */
    public Class<?> resolveJavaType(EventTypeName eventTypeName) {
        requireNonNull(eventTypeName, "No eventTypeName provided");
        var javaType = javaTypePerEventTypeName.get(eventTypeName);
        if (javaType == null) {
            throw new UnknownEventTypeException(msg("EventTypeName '{}' hasn't been registered", eventTypeName));
        }
        return javaType;
    }

    /**
     * @throws UnknownEventTypeException in case the <code>eventType</code> hasn't been registered
     */
    public EventTypeName resolveEventTypeName(Class<?> eventType) {
        requireNonNull(eventType, "No eventType provided");
        var eventTypeName = eventTypeNamePerJavaType.get(eventType);
        if (eventTypeName == null) {
            throw new UnknownEventTypeException(msg("Event type '{}' hasn't been registered", eventType.getName()));
        }
        return eventTypeName;
    }

    public Set<EventTypeName> registeredEventTypeNames() {
        return Collections.unmodifiableSet(javaTypePerEventTypeName.keySet());
    }
}
