package dk.cloudcreate.essentials.eventstreams.eventstore;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Side channel information stored together with an event, e.g. correlation id, user id or the command that caused the event
 */
public class EventMetaData extends HashMap<String, String> {
    public EventMetaData() {
    }

    public EventMetaData(Map<String, String> metaData) {
        super(requireNonNull(metaData, "No metaData provided"));
    }

    public static EventMetaData empty() {
        return new EventMetaData();
    }

    /**
     * Create an {@link EventMetaData} instance from key/value pairs
     *
     * @param keyValuePairs key1, value1, key2, value2, ...
     * @return the new {@link EventMetaData} instance
     */
    public static EventMetaData of(String... keyValuePairs) {
        requireNonNull(keyValuePairs, "No keyValuePairs provided");
        requireTrue(keyValuePairs.length % 2 == 0, "You must provide an equal number of keys and values");
        var metaData = new EventMetaData();
        for (int index = 0; index < keyValuePairs.length; index += 2) {
            metaData.put(keyValuePairs[index], keyValuePairs[index + 1]);
        }
        return metaData;
    }
}
