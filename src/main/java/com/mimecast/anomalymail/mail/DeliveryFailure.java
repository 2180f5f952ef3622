package com.mimecast.anomalymail.mail;

/**
 * Delivery failure kinds.
 */
public enum DeliveryFailure {
    /**
     * No transport configured, nothing was attempted.
     */
    UNCONFIGURED,

    /**
     * Message could not be composed.
     */
    MESSAGE,

    /**
     * Connection could not be established or was lost.
     */
    CONNECTION,

    /**
     * TLS negotiation failed.
     */
    TLS,

    /**
     * Server rejected the credentials.
     */
    AUTHENTICATION,

    /**
     * Server rejected a protocol command.
     */
    PROTOCOL
}
