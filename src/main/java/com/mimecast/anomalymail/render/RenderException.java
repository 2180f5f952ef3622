package com.mimecast.anomalymail.render;

/**
 * Template rendering exception.
 *
 * <p>Thrown when a template and its parameters do not line up.
 * <br>This is a configuration defect, never a transient fault.
 */
public class RenderException extends Exception {

    private final String placeholder;

    /**
     * Constructs a new RenderException instance.
     *
     * @param placeholder Offending placeholder name, null for template syntax errors.
     * @param message     Error message.
     */
    public RenderException(String placeholder, String message) {
        super(message);
        this.placeholder = placeholder;
    }

    /**
     * Gets offending placeholder name.
     *
     * @return Placeholder name or null.
     */
    public String getPlaceholder() {
        return placeholder;
    }
}
