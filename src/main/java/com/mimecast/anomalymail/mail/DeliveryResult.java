package com.mimecast.anomalymail.mail;

import java.util.Objects;

/**
 * Data class to hold the outcome of a delivery attempt.
 * <p>A failed result carries the failure kind, a message and the underlying cause if any.
 */
public final class DeliveryResult {
    private static final DeliveryResult SUCCESS = new DeliveryResult(null, "delivered", null);

    private final DeliveryFailure failure;
    private final String message;
    private final Throwable cause;

    private DeliveryResult(DeliveryFailure failure, String message, Throwable cause) {
        this.failure = failure;
        this.message = message;
        this.cause = cause;
    }

    /**
     * Successful delivery.
     *
     * @return DeliveryResult instance.
     */
    public static DeliveryResult success() {
        return SUCCESS;
    }

    /**
     * Failed delivery.
     *
     * @param failure DeliveryFailure kind.
     * @param message Error message.
     * @param cause   Underlying cause, may be null.
     * @return DeliveryResult instance.
     */
    public static DeliveryResult failed(DeliveryFailure failure, String message, Throwable cause) {
        return new DeliveryResult(Objects.requireNonNull(failure, "failure"), message, cause);
    }

    /**
     * Was the message delivered.
     *
     * @return Boolean.
     */
    public boolean isSuccess() {
        return failure == null;
    }

    /**
     * Gets failure kind.
     *
     * @return DeliveryFailure or null on success.
     */
    public DeliveryFailure getFailure() {
        return failure;
    }

    /**
     * Gets message.
     *
     * @return Message string.
     */
    public String getMessage() {
        return message;
    }

    /**
     * Gets underlying cause.
     *
     * @return Throwable or null.
     */
    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return isSuccess() ? "DeliveryResult{success}" : "DeliveryResult{" + failure + ": " + message + "}";
    }
}
