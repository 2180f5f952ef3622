package com.mimecast.anomalymail.template;

import java.util.Objects;

/**
 * Subject and content template pair.
 */
public final class TemplatePair {
    private final String subject;
    private final String content;

    /**
     * Constructs a new TemplatePair instance.
     *
     * @param subject Subject template.
     * @param content Content template.
     */
    public TemplatePair(String subject, String content) {
        this.subject = Objects.requireNonNull(subject, "subject");
        this.content = Objects.requireNonNull(content, "content");
    }

    /**
     * Gets subject template.
     *
     * @return Subject string.
     */
    public String getSubject() {
        return subject;
    }

    /**
     * Gets content template.
     *
     * @return Content string.
     */
    public String getContent() {
        return content;
    }

    /**
     * Copy with subject replaced.
     *
     * @param subject Subject template.
     * @return New TemplatePair.
     */
    public TemplatePair withSubject(String subject) {
        return new TemplatePair(subject, content);
    }

    /**
     * Copy with content replaced.
     *
     * @param content Content template.
     * @return New TemplatePair.
     */
    public TemplatePair withContent(String content) {
        return new TemplatePair(subject, content);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TemplatePair that = (TemplatePair) o;
        return subject.equals(that.subject) && content.equals(that.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subject, content);
    }
}
