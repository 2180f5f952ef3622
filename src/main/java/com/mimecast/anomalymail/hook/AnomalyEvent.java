package com.mimecast.anomalymail.hook;

import com.mimecast.anomalymail.render.TemplateValue;
import com.mimecast.anomalymail.template.EventKind;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Anomaly lifecycle event.
 *
 * <p>Built by the detection engine for a single hook invocation.
 * <br>Anomalies and extra parameters keep their insertion order.
 * <br>Extra parameters are forwarded to the templates unchanged and may not reuse a built-in name.
 *
 * <pre>
 * AnomalyEvent event = AnomalyEvent.start("cpu", Instant.now(), 0.91)
 *         .predicted(Map.of("x", 1))
 *         .observed(Map.of("x", 5))
 *         .anomaly("x", "high", 0.91)
 *         .parameter("host", TemplateValue.text("web-1"))
 *         .build();
 * </pre>
 */
public final class AnomalyEvent {

    /**
     * Parameter names filled in by the hook.
     */
    public static final Set<String> RESERVED_PARAMETERS = Set.of("model", "date", "score", "predicted", "observed", "reason");

    private final EventKind kind;
    private final String model;
    private final Instant timestamp;
    private final double score;
    private final Object predicted;
    private final Object observed;
    private final Map<String, FeatureAnomaly> anomalies;
    private final Map<String, TemplateValue> parameters;

    private AnomalyEvent(Builder builder) {
        this.kind = builder.kind;
        this.model = builder.model;
        this.timestamp = builder.timestamp;
        this.score = builder.score;
        this.predicted = builder.predicted;
        this.observed = builder.observed;
        this.anomalies = Collections.unmodifiableMap(new LinkedHashMap<>(builder.anomalies));
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
    }

    /**
     * Starts building an anomaly start event.
     *
     * @param model     Model name.
     * @param timestamp Detection time.
     * @param score     Anomaly score.
     * @return Builder instance.
     */
    public static Builder start(String model, Instant timestamp, double score) {
        return new Builder(EventKind.ANOMALY_START, model, timestamp, score);
    }

    /**
     * Starts building an anomaly end event.
     *
     * @param model     Model name.
     * @param timestamp Detection time.
     * @param score     Anomaly score.
     * @return Builder instance.
     */
    public static Builder end(String model, Instant timestamp, double score) {
        return new Builder(EventKind.ANOMALY_END, model, timestamp, score);
    }

    public EventKind getKind() {
        return kind;
    }

    public String getModel() {
        return model;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getScore() {
        return score;
    }

    /**
     * Gets predicted values.
     *
     * @return Optional of structured value.
     */
    public Optional<Object> getPredicted() {
        return Optional.ofNullable(predicted);
    }

    /**
     * Gets observed values.
     *
     * @return Optional of structured value.
     */
    public Optional<Object> getObserved() {
        return Optional.ofNullable(observed);
    }

    /**
     * Gets per-feature anomalies in insertion order.
     *
     * @return Unmodifiable map of feature name to FeatureAnomaly.
     */
    public Map<String, FeatureAnomaly> getAnomalies() {
        return anomalies;
    }

    /**
     * Gets extra template parameters in insertion order.
     *
     * @return Unmodifiable map.
     */
    public Map<String, TemplateValue> getParameters() {
        return parameters;
    }

    @Override
    public String toString() {
        return "AnomalyEvent{" + kind.getKey() + ", model=" + model + ", score=" + score + "}";
    }

    /**
     * AnomalyEvent builder.
     */
    public static final class Builder {
        private final EventKind kind;
        private final String model;
        private final Instant timestamp;
        private final double score;
        private Object predicted;
        private Object observed;
        private final Map<String, FeatureAnomaly> anomalies = new LinkedHashMap<>();
        private final Map<String, TemplateValue> parameters = new LinkedHashMap<>();

        private Builder(EventKind kind, String model, Instant timestamp, double score) {
            this.kind = kind;
            this.model = Objects.requireNonNull(model, "model");
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
            this.score = score;
        }

        /**
         * Sets predicted values.
         *
         * @param predicted Structured value.
         * @return Self.
         */
        public Builder predicted(Object predicted) {
            this.predicted = predicted;
            return this;
        }

        /**
         * Sets observed values.
         *
         * @param observed Structured value.
         * @return Self.
         */
        public Builder observed(Object observed) {
            this.observed = observed;
            return this;
        }

        /**
         * Adds feature anomaly.
         *
         * @param feature Feature name.
         * @param type    Anomaly type.
         * @param score   Feature score.
         * @return Self.
         */
        public Builder anomaly(String feature, String type, double score) {
            anomalies.put(Objects.requireNonNull(feature, "feature"), new FeatureAnomaly(type, score));
            return this;
        }

        /**
         * Adds feature anomalies.
         *
         * @param map Feature name to FeatureAnomaly map, iterated in its own order.
         * @return Self.
         */
        public Builder anomalies(Map<String, FeatureAnomaly> map) {
            map.forEach((feature, anomaly) -> anomalies.put(
                    Objects.requireNonNull(feature, "feature"),
                    Objects.requireNonNull(anomaly, "anomaly")));
            return this;
        }

        /**
         * Adds extra template parameter.
         *
         * @param name  Parameter name.
         * @param value TemplateValue instance.
         * @return Self.
         * @throws IllegalArgumentException Name is reserved.
         */
        public Builder parameter(String name, TemplateValue value) {
            Objects.requireNonNull(name, "name");
            if (RESERVED_PARAMETERS.contains(name)) {
                throw new IllegalArgumentException("Parameter name is reserved: " + name);
            }
            parameters.put(name, Objects.requireNonNull(value, "value"));
            return this;
        }

        /**
         * Builds AnomalyEvent.
         *
         * @return AnomalyEvent instance.
         */
        public AnomalyEvent build() {
            return new AnomalyEvent(this);
        }
    }
}
