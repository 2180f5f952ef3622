package com.mimecast.anomalymail.config;

import java.util.Objects;
import java.util.Optional;

/**
 * SMTP transport configuration.
 *
 * <p>Immutable snapshot of the validated <code>smtp</code> plugin block.
 * <p>Instances are created by {@link ConfigValidator} only.
 *
 * @see ConfigValidator#validateTransport(java.util.Map)
 */
public final class TransportConfig {

    /**
     * Port value meaning the protocol default port.
     */
    public static final int DEFAULT_PORT = 0;

    private final String host;
    private final int port;
    private final boolean tls;
    private final String user;
    private final String password;

    TransportConfig(String host, int port, boolean tls, String user, String password) {
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.tls = tls;
        this.user = user;
        this.password = password != null ? password : "";
    }

    /**
     * Gets host.
     *
     * @return Hostname string.
     */
    public String getHost() {
        return host;
    }

    /**
     * Gets port.
     * <p>Zero means the protocol default.
     *
     * @return Port number.
     */
    public int getPort() {
        return port;
    }

    /**
     * Is implicit TLS enabled.
     *
     * @return Boolean.
     */
    public boolean isTls() {
        return tls;
    }

    /**
     * Gets user if any.
     *
     * @return Optional of String.
     */
    public Optional<String> getUser() {
        return Optional.ofNullable(user);
    }

    /**
     * Gets password.
     *
     * @return Password string, empty if not configured.
     */
    public String getPassword() {
        return password;
    }

    /**
     * Should the sender authenticate.
     *
     * @return True if a non-empty user is configured.
     */
    public boolean hasCredentials() {
        return user != null && !user.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TransportConfig that = (TransportConfig) o;
        return port == that.port && tls == that.tls && host.equals(that.host)
                && Objects.equals(user, that.user) && password.equals(that.password);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port, tls, user, password);
    }

    @Override
    public String toString() {
        return "TransportConfig{host=" + host +
                ", port=" + port +
                ", tls=" + tls +
                ", user=" + user +
                ", password=" + (password.isEmpty() ? "" : "****") +
                "}";
    }
}
