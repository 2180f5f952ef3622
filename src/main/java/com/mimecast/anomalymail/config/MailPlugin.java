package com.mimecast.anomalymail.config;

import java.util.Map;
import java.util.Optional;

/**
 * Mail plugin configuration.
 *
 * <p>Process-wide holder of the SMTP transport settings shared by every mail hook.
 * <br>An unconfigured plugin has no transport and every hook using it skips sending.
 *
 * @see com.mimecast.anomalymail.main.Config
 */
public final class MailPlugin {
    private static final MailPlugin UNCONFIGURED = new MailPlugin(null);

    private final TransportConfig transport;

    private MailPlugin(TransportConfig transport) {
        this.transport = transport;
    }

    /**
     * Gets an unconfigured plugin.
     *
     * @return MailPlugin instance.
     */
    public static MailPlugin unconfigured() {
        return UNCONFIGURED;
    }

    /**
     * Constructs plugin from a validated transport.
     *
     * @param transport TransportConfig instance.
     * @return MailPlugin instance.
     */
    public static MailPlugin of(TransportConfig transport) {
        return transport != null ? new MailPlugin(transport) : UNCONFIGURED;
    }

    /**
     * Constructs plugin from a raw configuration map.
     *
     * @param raw Plugin configuration map.
     * @return MailPlugin instance.
     * @throws ConfigException Invalid configuration.
     */
    public static MailPlugin fromConfig(Map<String, ?> raw) throws ConfigException {
        return new MailPlugin(ConfigValidator.validatePlugin(raw));
    }

    /**
     * Is transport configured.
     *
     * @return Boolean.
     */
    public boolean isConfigured() {
        return transport != null;
    }

    /**
     * Gets transport if configured.
     *
     * @return Optional of TransportConfig.
     */
    public Optional<TransportConfig> getTransport() {
        return Optional.ofNullable(transport);
    }

    @Override
    public String toString() {
        return "MailPlugin{smtp=" + transport + "}";
    }
}
