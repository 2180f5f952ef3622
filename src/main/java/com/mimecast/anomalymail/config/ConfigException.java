package com.mimecast.anomalymail.config;

/**
 * Configuration exception.
 *
 * <p>Thrown when a configuration block fails validation or cannot be loaded.
 * <p>Carries the dotted path of the offending field and the violated constraint.
 */
public class ConfigException extends Exception {

    private final String field;
    private final String constraint;

    /**
     * Constructs a new ConfigException instance.
     *
     * @param field      Dotted field path.
     * @param constraint Violated constraint.
     */
    public ConfigException(String field, String constraint) {
        super(field + ": " + constraint);
        this.field = field;
        this.constraint = constraint;
    }

    /**
     * Constructs a new ConfigException instance with cause.
     *
     * @param field      Dotted field path.
     * @param constraint Violated constraint.
     * @param cause      Underlying cause.
     */
    public ConfigException(String field, String constraint, Throwable cause) {
        super(field + ": " + constraint, cause);
        this.field = field;
        this.constraint = constraint;
    }

    /**
     * Gets field path.
     *
     * @return Field path string.
     */
    public String getField() {
        return field;
    }

    /**
     * Gets constraint.
     *
     * @return Constraint string.
     */
    public String getConstraint() {
        return constraint;
    }
}
