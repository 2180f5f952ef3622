package com.mimecast.anomalymail.render;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.util.Objects;

/**
 * Template parameter value.
 *
 * <p>Tagged value passed to {@link MessageRenderer}: plain text, a number or a structured value.
 * <br>Structured values are serialized to compact JSON once, when the value is created.
 */
public final class TemplateValue {
    private static final Gson gson = new GsonBuilder()
            .serializeNulls()
            .serializeSpecialFloatingPointValues()
            .disableHtmlEscaping()
            .create();

    /**
     * Value types.
     */
    public enum Type {
        TEXT,
        NUMBER,
        STRUCTURED
    }

    private final Type type;
    private final String text;
    private final Number number;

    private TemplateValue(Type type, String text, Number number) {
        this.type = type;
        this.text = text;
        this.number = number;
    }

    /**
     * Text value.
     *
     * @param text String.
     * @return TemplateValue instance.
     */
    public static TemplateValue text(String text) {
        return new TemplateValue(Type.TEXT, Objects.requireNonNull(text, "text"), null);
    }

    /**
     * Numeric value.
     *
     * @param number Number.
     * @return TemplateValue instance.
     */
    public static TemplateValue number(Number number) {
        Objects.requireNonNull(number, "number");
        return new TemplateValue(Type.NUMBER, number.toString(), number);
    }

    /**
     * Structured value serialized as JSON.
     * <p>NaN and infinities are written as <i>NaN</i>, <i>Infinity</i> and <i>-Infinity</i>.
     *
     * @param value Map, list, primitive or bean; null is serialized as <i>null</i>.
     * @return TemplateValue instance.
     */
    public static TemplateValue json(Object value) {
        return new TemplateValue(Type.STRUCTURED, gson.toJson(value), null);
    }

    /**
     * Gets type.
     *
     * @return Type.
     */
    public Type getType() {
        return type;
    }

    /**
     * Gets text representation.
     *
     * @return String.
     */
    public String getText() {
        return text;
    }

    /**
     * Gets number.
     *
     * @return Number or null if not numeric.
     */
    public Number getNumber() {
        return number;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TemplateValue that = (TemplateValue) o;
        return type == that.type && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text);
    }

    @Override
    public String toString() {
        return text;
    }
}
