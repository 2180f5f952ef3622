package com.mimecast.anomalymail.template;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Effective message templates for every event kind.
 *
 * <p>Always holds a pair for each {@link EventKind}.
 * <br>User overrides are laid over the built-in defaults one field at a time.
 *
 * <p>Default anomaly start subject:
 * <pre>[ALERT] anomaly detected! (model={model}, score={score})</pre>
 *
 * <p>Default anomaly end subject:
 * <pre>[ALERT] anomaly end (model={model}, score={score})</pre>
 */
public final class TemplateSet {

    /**
     * Built-in anomaly start templates.
     */
    public static final TemplatePair DEFAULT_ANOMALY_START = new TemplatePair(
            "\n[ALERT] anomaly detected! (model={model}, score={score})\n",
            "\nAnomaly detected!\n" +
                    "\n" +
                    "date={date}\n" +
                    "model={model}\n" +
                    "score={score}\n" +
                    "predicted={predicted}\n" +
                    "observed={observed}\n" +
                    "\n" +
                    "reason:\n" +
                    "{reason}\n"
    );

    /**
     * Built-in anomaly end templates.
     */
    public static final TemplatePair DEFAULT_ANOMALY_END = new TemplatePair(
            "\n[ALERT] anomaly end (model={model}, score={score})\n",
            "\nAnomaly end\n" +
                    "\n" +
                    "date={date}\n" +
                    "model={model}\n" +
                    "score={score}\n"
    );

    private static final TemplateSet DEFAULTS = builder().build();

    private final Map<EventKind, TemplatePair> pairs;

    private TemplateSet(Map<EventKind, TemplatePair> pairs) {
        this.pairs = Collections.unmodifiableMap(new EnumMap<>(pairs));
    }

    /**
     * Gets built-in default set.
     *
     * @return TemplateSet instance.
     */
    public static TemplateSet defaults() {
        return DEFAULTS;
    }

    /**
     * Gets a builder seeded with the defaults.
     *
     * @return Builder instance.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Gets pair for kind.
     *
     * @param kind EventKind.
     * @return TemplatePair instance or null if kind is null.
     */
    public TemplatePair get(EventKind kind) {
        return kind != null ? pairs.get(kind) : null;
    }

    /**
     * Gets all pairs.
     *
     * @return Unmodifiable map.
     */
    public Map<EventKind, TemplatePair> asMap() {
        return pairs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return pairs.equals(((TemplateSet) o).pairs);
    }

    @Override
    public int hashCode() {
        return pairs.hashCode();
    }

    /**
     * TemplateSet builder.
     * <p>Unset fields keep their default.
     */
    public static final class Builder {
        private final EnumMap<EventKind, TemplatePair> pairs = new EnumMap<>(EventKind.class);

        private Builder() {
            pairs.put(EventKind.ANOMALY_START, DEFAULT_ANOMALY_START);
            pairs.put(EventKind.ANOMALY_END, DEFAULT_ANOMALY_END);
        }

        /**
         * Overrides subject for kind.
         *
         * @param kind    EventKind.
         * @param subject Subject template.
         * @return Self.
         */
        public Builder subject(EventKind kind, String subject) {
            pairs.put(kind, pairs.get(kind).withSubject(subject));
            return this;
        }

        /**
         * Overrides content for kind.
         *
         * @param kind    EventKind.
         * @param content Content template.
         * @return Self.
         */
        public Builder content(EventKind kind, String content) {
            pairs.put(kind, pairs.get(kind).withContent(content));
            return this;
        }

        /**
         * Builds TemplateSet.
         *
         * @return TemplateSet instance.
         */
        public TemplateSet build() {
            return new TemplateSet(pairs);
        }
    }
}
