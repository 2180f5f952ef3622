package com.mimecast.anomalymail.render;

import java.util.Objects;

/**
 * Rendered alert message.
 */
public final class RenderedMessage {
    private final String subject;
    private final String body;

    /**
     * Constructs a new RenderedMessage instance.
     *
     * @param subject Subject string.
     * @param body    Body string.
     */
    public RenderedMessage(String subject, String body) {
        this.subject = Objects.requireNonNull(subject, "subject");
        this.body = Objects.requireNonNull(body, "body");
    }

    /**
     * Gets subject.
     *
     * @return Subject string.
     */
    public String getSubject() {
        return subject;
    }

    /**
     * Gets body.
     *
     * @return Body string.
     */
    public String getBody() {
        return body;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RenderedMessage that = (RenderedMessage) o;
        return subject.equals(that.subject) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subject, body);
    }

    @Override
    public String toString() {
        return "RenderedMessage{subject=" + subject + "}";
    }
}
