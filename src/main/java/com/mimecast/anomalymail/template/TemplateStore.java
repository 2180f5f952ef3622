package com.mimecast.anomalymail.template;

import com.mimecast.anomalymail.config.ConfigException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Template lookup for a configured hook.
 *
 * <p>Resolves the effective subject and content pair of an event kind.
 */
public class TemplateStore {
    private static final Logger log = LogManager.getLogger(TemplateStore.class);

    private final TemplateSet templates;

    /**
     * Constructs a new TemplateStore instance.
     *
     * @param templates TemplateSet instance.
     */
    public TemplateStore(TemplateSet templates) {
        this.templates = Objects.requireNonNull(templates, "templates");
    }

    /**
     * Resolves templates by kind.
     *
     * @param kind EventKind.
     * @return TemplatePair instance.
     * @throws ConfigException Kind is null or has no templates.
     */
    public TemplatePair resolve(EventKind kind) throws ConfigException {
        TemplatePair pair = templates.get(kind);
        if (pair == null) {
            throw new ConfigException("templates", "unknown event kind " + kind);
        }

        log.debug("Resolved {} templates", kind.getKey());
        return pair;
    }

    /**
     * Resolves templates by configuration key.
     *
     * @param key Kind key, like <i>anomaly_start</i>.
     * @return TemplatePair instance.
     * @throws ConfigException Key is not a known kind.
     */
    public TemplatePair resolve(String key) throws ConfigException {
        EventKind kind = EventKind.fromKey(key)
                .orElseThrow(() -> new ConfigException("templates." + key, "unknown event kind"));
        return resolve(kind);
    }
}
