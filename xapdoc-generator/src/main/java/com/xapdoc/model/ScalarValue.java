package com.xapdoc.model;

import java.util.Objects;

/**
 * A leaf value: string, number, boolean or null.
 *
 * @param value wrapped scalar, may be null
 */
public record ScalarValue(Object value) implements DefinitionValue {

    /**
     * Create a scalar holding a string.
     *
     * @param text text
     * @return scalar
     */
    public static ScalarValue text(String text) {
        return new ScalarValue(text);
    }

    /**
     * Returns the scalar rendered as text; null renders as an empty string.
     *
     * @return text form
     */
    public String asText() {
        return value == null ? "" : String.valueOf(value);
    }

    /**
     * Check whether this scalar is the given token.
     *
     * @param token token to compare against
     * @return true if the scalar is a string equal to the token
     */
    public boolean isToken(String token) {
        return value instanceof String s && Objects.equals(s, token);
    }

    @Override
    public Object toPlain() {
        return value;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
