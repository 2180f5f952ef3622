package com.mimecast.anomalymail.config;

import com.mimecast.anomalymail.template.EventKind;
import com.mimecast.anomalymail.template.TemplateSet;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import org.apache.commons.lang3.StringUtils;

import java.util.Map;
import java.util.Set;

/**
 * Configuration schema validator.
 *
 * <p>Turns raw configuration maps into immutable configuration values.
 * <br>Missing optional fields get their defaults, anything else that does not match the schema
 * is rejected with a {@link ConfigException} naming the field and the constraint.
 *
 * <p>Plugin schema:
 * <pre>
 * {
 *   smtp: {
 *     host: "smtp.example.com", // Required.
 *     port: 587,                // Default: 0 (protocol default), range 0-65535.
 *     tls: false,               // Default: false.
 *     user: "robot",            // Optional.
 *     password: "secret"        // Default: "".
 *   }
 * }
 * </pre>
 *
 * <p>Hook schema:
 * <pre>
 * {
 *   from: { name: "Monitoring", address: "monitoring@example.com" },
 *   to: { address: "oncall@example.com" },
 *   templates: {
 *     anomaly_start: { subject: "...", content: "..." },
 *     anomaly_end: { subject: "..." }
 *   }
 * }
 * </pre>
 */
public final class ConfigValidator {

    private static final int MAX_PORT = 65535;

    private static final Set<String> PLUGIN_KEYS = Set.of("smtp");
    private static final Set<String> TRANSPORT_KEYS = Set.of("host", "port", "tls", "user", "password");
    private static final Set<String> HOOK_KEYS = Set.of("from", "to", "templates");
    private static final Set<String> PARTY_KEYS = Set.of("name", "address");
    private static final Set<String> TEMPLATE_KEYS = Set.of("subject", "content");

    /**
     * Private constructor.
     */
    private ConfigValidator() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Validates plugin configuration.
     *
     * @param raw Plugin configuration map.
     * @return TransportConfig instance.
     * @throws ConfigException Invalid configuration.
     */
    public static TransportConfig validatePlugin(Map<String, ?> raw) throws ConfigException {
        if (raw == null) {
            throw new ConfigException("smtp", "required key not provided");
        }
        checkKeys(raw, "", PLUGIN_KEYS);
        return transport(requireMap(raw, "", "smtp"), "smtp.");
    }

    /**
     * Validates transport configuration.
     *
     * @param raw Transport configuration map.
     * @return TransportConfig instance.
     * @throws ConfigException Invalid configuration.
     */
    public static TransportConfig validateTransport(Map<String, ?> raw) throws ConfigException {
        if (raw == null) {
            throw new ConfigException("host", "required key not provided");
        }
        return transport(raw, "");
    }

    /**
     * Validates hook configuration.
     *
     * @param raw Hook configuration map.
     * @return HookConfig instance.
     * @throws ConfigException Invalid configuration.
     */
    public static HookConfig validateHook(Map<String, ?> raw) throws ConfigException {
        if (raw == null) {
            throw new ConfigException("from", "required key not provided");
        }
        checkKeys(raw, "", HOOK_KEYS);

        Party from = party(requireMap(raw, "", "from"), "from.");
        Party to = party(requireMap(raw, "", "to"), "to.");
        TemplateSet templates = templates(optionalMap(raw, "", "templates"));

        return new HookConfig(from, to, templates);
    }

    /**
     * Validates party configuration.
     *
     * @param raw    Party configuration map.
     * @param prefix Field path prefix, like <i>from.</i>.
     * @return Party instance.
     * @throws ConfigException Invalid configuration.
     */
    static Party party(Map<String, ?> raw, String prefix) throws ConfigException {
        checkKeys(raw, prefix, PARTY_KEYS);

        String name = optionalString(raw, prefix, "name", "");
        String address = requireString(raw, prefix, "address");
        if (!isValidAddress(address)) {
            throw new ConfigException(prefix + "address", "expected an email address");
        }

        return new Party(name, address);
    }

    /**
     * Checks email address syntax.
     * <p>Requires exactly one <i>@</i> separating a local part and a domain.
     * <br>The domain is checked for syntax only, so internal names like <i>ops@monitoring.corp</i> pass.
     *
     * @param address Address string.
     * @return Boolean.
     */
    public static boolean isValidAddress(String address) {
        if (StringUtils.isBlank(address) || StringUtils.countMatches(address, '@') != 1) {
            return false;
        }

        try {
            InternetAddress parsed = new InternetAddress(address, true);
            // Bare address only, no display name or group.
            return parsed.getPersonal() == null && !parsed.isGroup() && address.equals(parsed.getAddress());
        } catch (AddressException e) {
            return false;
        }
    }

    private static TransportConfig transport(Map<String, ?> raw, String prefix) throws ConfigException {
        checkKeys(raw, prefix, TRANSPORT_KEYS);

        String host = requireString(raw, prefix, "host");
        int port = optionalPort(raw, prefix);
        boolean tls = optionalBoolean(raw, prefix, "tls", false);
        String user = optionalString(raw, prefix, "user", null);
        String password = optionalString(raw, prefix, "password", "");

        return new TransportConfig(host, port, tls, user, password);
    }

    private static TemplateSet templates(Map<String, ?> raw) throws ConfigException {
        TemplateSet.Builder builder = TemplateSet.builder();
        if (raw == null) {
            return builder.build();
        }

        for (String key : raw.keySet()) {
            if (EventKind.fromKey(key).isEmpty()) {
                throw new ConfigException("templates." + key, "extra keys not allowed");
            }
        }

        for (EventKind kind : EventKind.values()) {
            String prefix = "templates." + kind.getKey() + ".";
            Map<String, ?> overrides = optionalMap(raw, "templates.", kind.getKey());
            if (overrides == null) {
                continue;
            }
            checkKeys(overrides, prefix, TEMPLATE_KEYS);

            String subject = optionalString(overrides, prefix, "subject", null);
            if (subject != null) {
                builder.subject(kind, subject);
            }
            String content = optionalString(overrides, prefix, "content", null);
            if (content != null) {
                builder.content(kind, content);
            }
        }

        return builder.build();
    }

    private static void checkKeys(Map<String, ?> raw, String prefix, Set<String> allowed) throws ConfigException {
        for (Object key : raw.keySet()) {
            if (!(key instanceof String) || !allowed.contains(key)) {
                throw new ConfigException(prefix + key, "extra keys not allowed");
            }
        }
    }

    private static String requireString(Map<String, ?> raw, String prefix, String key) throws ConfigException {
        if (raw.get(key) == null) {
            throw new ConfigException(prefix + key, "required key not provided");
        }
        return optionalString(raw, prefix, key, null);
    }

    private static String optionalString(Map<String, ?> raw, String prefix, String key, String defaultValue) throws ConfigException {
        Object value = raw.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof String)) {
            throw new ConfigException(prefix + key, "expected str");
        }
        return (String) value;
    }

    private static boolean optionalBoolean(Map<String, ?> raw, String prefix, String key, boolean defaultValue) throws ConfigException {
        Object value = raw.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Boolean)) {
            throw new ConfigException(prefix + key, "expected bool");
        }
        return (Boolean) value;
    }

    private static int optionalPort(Map<String, ?> raw, String prefix) throws ConfigException {
        Object value = raw.get("port");
        if (value == null) {
            return TransportConfig.DEFAULT_PORT;
        }
        if (!(value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte)) {
            throw new ConfigException(prefix + "port", "expected int");
        }

        long port = ((Number) value).longValue();
        if (port < 0) {
            throw new ConfigException(prefix + "port", "value must be at least 0");
        }
        if (port > MAX_PORT) {
            throw new ConfigException(prefix + "port", "value must be at most " + MAX_PORT);
        }
        return (int) port;
    }

    private static Map<String, ?> requireMap(Map<String, ?> raw, String prefix, String key) throws ConfigException {
        Map<String, ?> map = optionalMap(raw, prefix, key);
        if (map == null) {
            throw new ConfigException(prefix + key, "required key not provided");
        }
        return map;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ?> optionalMap(Map<String, ?> raw, String prefix, String key) throws ConfigException {
        Object value = raw.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new ConfigException(prefix + key, "expected a dictionary");
        }
        return (Map<String, ?>) value;
    }
}
