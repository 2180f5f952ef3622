package com.mimecast.anomalymail.hook;

import java.util.Objects;

/**
 * Per-feature anomaly descriptor.
 *
 * <p>Type is the direction the feature deviated in, like <i>high</i> or <i>low</i>.
 */
public final class FeatureAnomaly {
    private final String type;
    private final double score;

    /**
     * Constructs a new FeatureAnomaly instance.
     *
     * @param type  Anomaly type.
     * @param score Feature score.
     */
    public FeatureAnomaly(String type, double score) {
        this.type = Objects.requireNonNull(type, "type");
        this.score = score;
    }

    /**
     * Gets type.
     *
     * @return Type string.
     */
    public String getType() {
        return type;
    }

    /**
     * Gets score.
     *
     * @return Score.
     */
    public double getScore() {
        return score;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FeatureAnomaly that = (FeatureAnomaly) o;
        return Double.compare(that.score, score) == 0 && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, score);
    }

    @Override
    public String toString() {
        return type + "(" + score + ")";
    }
}
