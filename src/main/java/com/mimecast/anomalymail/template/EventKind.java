package com.mimecast.anomalymail.template;

import java.util.Arrays;
import java.util.Optional;

/**
 * Anomaly lifecycle event kinds.
 */
public enum EventKind {
    ANOMALY_START("anomaly_start"),
    ANOMALY_END("anomaly_end");

    private final String key;

    EventKind(String key) {
        this.key = key;
    }

    /**
     * Gets configuration key.
     *
     * @return Key string.
     */
    public String getKey() {
        return key;
    }

    /**
     * Finds kind by configuration key.
     *
     * @param key Key string.
     * @return Optional of EventKind.
     */
    public static Optional<EventKind> fromKey(String key) {
        return Arrays.stream(values()).filter(kind -> kind.key.equals(key)).findFirst();
    }
}
