package dk.cloudcreate.essentials.eventstreams.eventstore.inmemory;

import dk.cloudcreate.essentials.eventstreams.eventstore.StreamEventEnvelope;
import dk.cloudcreate.essentials.eventstreams.eventstore.serializer.SerializedEvent;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * An event that has been serialized but not yet assigned a position in its stream
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
final class PendingEvent {
    final StreamEventEnvelope<?> envelope;
    final SerializedEvent        serializedEvent;
    final Optional<byte[]>       serializedMetaData;

    PendingEvent(StreamEventEnvelope<?> envelope, SerializedEvent serializedEvent, Optional<byte[]> serializedMetaData) {
        this.envelope = requireNonNull(envelope, "No envelope provided");
        this.serializedEvent = requireNonNull(serializedEvent, "No serializedEvent provided");
        this.serializedMetaData = requireNonNull(serializedMetaData, "No serializedMetaData option provided");
    }
}
