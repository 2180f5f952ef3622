package com.mimecast.anomalymail.config;

import com.mimecast.anomalymail.template.TemplateSet;

import java.util.Objects;

/**
 * Mail hook configuration.
 *
 * <p>Immutable result of validating one hook block.
 *
 * @see ConfigValidator#validateHook(java.util.Map)
 */
public final class HookConfig {
    private final Party from;
    private final Party to;
    private final TemplateSet templates;

    HookConfig(Party from, Party to, TemplateSet templates) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
        this.templates = Objects.requireNonNull(templates, "templates");
    }

    /**
     * Gets sender.
     *
     * @return Party instance.
     */
    public Party getFrom() {
        return from;
    }

    /**
     * Gets recipient.
     *
     * @return Party instance.
     */
    public Party getTo() {
        return to;
    }

    /**
     * Gets effective templates.
     *
     * @return TemplateSet instance.
     */
    public TemplateSet getTemplates() {
        return templates;
    }

    @Override
    public String toString() {
        return "HookConfig{from=" + from + ", to=" + to + "}";
    }
}
