package com.xapdoc.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * An ordered, immutable sequence of definition values.
 *
 * @param items elements in document order
 */
public record SequenceValue(List<DefinitionValue> items) implements DefinitionValue {

    public SequenceValue {
        items = items != null ? List.copyOf(items) : List.of();
    }

    /**
     * Create a sequence from parsed document nodes.
     *
     * @param raw parsed elements
     * @return sequence
     */
    public static SequenceValue fromCollection(Collection<?> raw) {
        List<DefinitionValue> items = new ArrayList<>(raw.size());
        for (Object element : raw) {
            items.add(DefinitionValue.of(element));
        }
        return new SequenceValue(items);
    }

    /**
     * Create a sequence from the given elements, converting each one.
     *
     * @param elements elements
     * @return sequence
     */
    public static SequenceValue of(Object... elements) {
        return fromCollection(List.of(elements));
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public int size() {
        return items.size();
    }

    /**
     * First element, if any.
     *
     * @return first element or empty for an empty sequence
     */
    public Optional<DefinitionValue> first() {
        return items.isEmpty() ? Optional.empty() : Optional.of(items.get(0));
    }

    /**
     * Check whether the first element is the given scalar token. An empty sequence never starts with a token.
     *
     * @param token token
     * @return true if the sequence starts with the token
     */
    public boolean startsWithToken(String token) {
        return first()
                .filter(ScalarValue.class::isInstance)
                .map(v -> ((ScalarValue) v).isToken(token))
                .orElse(false);
    }

    /**
     * Returns this sequence without its first element.
     *
     * @return remaining elements
     */
    public SequenceValue dropFirst() {
        if (items.isEmpty()) {
            return this;
        }
        return new SequenceValue(items.subList(1, items.size()));
    }

    /**
     * Returns a new sequence holding this sequence's elements followed by {@code other}'s.
     *
     * @param other elements to append
     * @return concatenated sequence
     */
    public SequenceValue concat(SequenceValue other) {
        List<DefinitionValue> joined = new ArrayList<>(items.size() + other.items.size());
        joined.addAll(items);
        joined.addAll(other.items);
        return new SequenceValue(joined);
    }

    @Override
    public Object toPlain() {
        List<Object> plain = new ArrayList<>(items.size());
        for (DefinitionValue item : items) {
            plain.add(item.toPlain());
        }
        return plain;
    }

    @Override
    public String toString() {
        return items.toString();
    }
}
