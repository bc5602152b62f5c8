package dk.cloudcreate.essentials.eventstreams.eventstore.serializer.json;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dk.cloudcreate.essentials.eventstreams.eventstore.EventMetaData;
import dk.cloudcreate.essentials.eventstreams.eventstore.serializer.*;
import dk.cloudcreate.essentials.eventstreams.eventstore.types.EventTypeName;
import dk.cloudcreate.essentials.jackson.immutable.EssentialsImmutableJacksonModule;
import dk.cloudcreate.essentials.jackson.types.EssentialTypesJacksonModule;

import java.io.IOException;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Jackson based {@link EventSerializer} that stores events and {@link EventMetaData} as UTF-8 encoded JSON.<br>
 * The {@link EventTypeName} stored with each event is resolved using the {@link EventTypeRegistry}.
 */
public class JacksonEventSerializer implements EventSerializer {
    private final ObjectMapper      objectMapper;
    private final EventTypeRegistry eventTypeRegistry;

    /**
     * Create a serializer using {@link #createDefaultObjectMapper()}
     *
     * @param eventTypeRegistry the registry used to resolve event types
     */
    public JacksonEventSerializer(EventTypeRegistry eventTypeRegistry) {
        this(createDefaultObjectMapper(), eventTypeRegistry);
    }

    public JacksonEventSerializer(ObjectMapper objectMapper, EventTypeRegistry eventTypeRegistry) {
        this.objectMapper = requireNonNull(objectMapper, "No objectMapper provided");
        this.eventTypeRegistry = requireNonNull(eventTypeRegistry, "No eventTypeRegistry provided");
    }

    /**
     * The default {@link ObjectMapper}: field based (getters and setters are ignored), tolerant to unknown properties and
     * with support for {@link java.util.Optional}, <code>java.time</code>, essentials types (e.g. {@link dk.cloudcreate.essentials.types.CharSequenceType})
     * and immutable classes without a default constructor.
     */
    public static ObjectMapper createDefaultObjectMapper() {
        var objectMapper = JsonMapper.builder()
                                     .disable(MapperFeature.AUTO_DETECT_GETTERS)
                                     .disable(MapperFeature.AUTO_DETECT_IS_GETTERS)
                                     .disable(MapperFeature.AUTO_DETECT_SETTERS)
                                     .disable(MapperFeature.DEFAULT_VIEW_INCLUSION)
                                     .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                                     .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                                     .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                                     .enable(MapperFeature.AUTO_DETECT_CREATORS)
                                     .enable(MapperFeature.AUTO_DETECT_FIELDS)
                                     .enable(MapperFeature.PROPAGATE_TRANSIENT_MARKER)
                                     .addModule(new Jdk8Module())
                                     .addModule(new JavaTimeModule())
                                     .addModule(new EssentialTypesJacksonModule())
                                     .addModule(new EssentialsImmutableJacksonModule())
                                     .build();

        objectMapper.setVisibility(objectMapper.getSerializationConfig().getDefaultVisibilityChecker()
                                               .withGetterVisibility(JsonAutoDetect.Visibility.NONE)
                                               .withSetterVisibility(JsonAutoDetect.Visibility.NONE)
                                               .withFieldVisibility(JsonAutoDetect.Visibility.ANY)
                                               .withCreatorVisibility(JsonAutoDetect.Visibility.ANY));
        return objectMapper;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public EventTypeRegistry getEventTypeRegistry() {
        return eventTypeRegistry;
    }

    @Override
    public SerializedEvent serialize(Object event) {
        requireNonNull(event, "No event provided");
        var eventTypeName = eventTypeRegistry.resolveEventTypeName(event.getClass());
        try {
            return new SerializedEvent(eventTypeName, objectMapper.writeValueAsBytes(event));
        } catch (JsonProcessingException e) {
            throw new EventSerializationException(msg("Failed to serialize event '{}' of type '{}'", eventTypeName, event.getClass().getName()), e);
        }
    }

    @Override
    public Object deserialize(EventTypeName eventType, byte[] data) {
        requireNonNull(eventType, "No eventType provided");
        requireNonNull(data, "No data provided");
        var javaType = eventTypeRegistry.resolveJavaType(eventType);
        try {
            return objectMapper.readValue(data, javaType);
        } catch (IOException e) {
            throw new EventDeserializationException(msg("Failed to deserialize event '{}' into '{}'", eventType, javaType.getName()), e);
        }
    }

    @Override
    public byte[] serializeMetaData(EventMetaData metaData) {
        requireNonNull(metaData, "No metaData provided");
        try {
            return objectMapper.writeValueAsBytes(metaData);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize EventMetaData", e);
        }
    }

    @Override
    public EventMetaData deserializeMetaData(byte[] metaData) {
        requireNonNull(metaData, "No metaData provided");
        try {
            return objectMapper.readValue(metaData, EventMetaData.class);
        } catch (IOException e) {
            throw new EventDeserializationException("Failed to deserialize EventMetaData", e);
        }
    }
}
