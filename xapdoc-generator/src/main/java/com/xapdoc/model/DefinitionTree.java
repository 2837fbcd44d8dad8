package com.xapdoc.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * An immutable, insertion-ordered mapping from string keys to definition values.
 *
 * <p>Updates ({@link #with(String, DefinitionValue)}, {@link #without(String)}) return new trees and never
 * change the receiver, so a tree handed to a merge or render step is never observed to change afterwards.
 */
public final class DefinitionTree implements DefinitionValue {

    private static final DefinitionTree EMPTY = new DefinitionTree(new LinkedHashMap<>());

    private final Map<String, DefinitionValue> entries;

    private DefinitionTree(LinkedHashMap<String, DefinitionValue> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    /**
     * Returns the empty tree.
     *
     * @return empty tree
     */
    public static DefinitionTree empty() {
        return EMPTY;
    }

    /**
     * Create a tree from a parsed mapping. Keys are converted with {@link String#valueOf(Object)} and values
     * recursively with {@link DefinitionValue#of(Object)}.
     *
     * @param raw parsed mapping
     * @return tree
     */
    public static DefinitionTree fromMap(Map<?, ?> raw) {
        Builder builder = builder();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            builder.put(String.valueOf(entry.getKey()), DefinitionValue.of(entry.getValue()));
        }
        return builder.build();
    }

    /**
     * Create a builder.
     *
     * @return empty builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Create a builder seeded with this tree's entries.
     *
     * @return builder
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.entries.putAll(entries);
        return builder;
    }

    public DefinitionValue get(String key) {
        return entries.get(key);
    }

    public Optional<DefinitionValue> find(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * Look up a nested tree.
     *
     * @param key key
     * @return the nested tree, or empty when the key is absent or holds another kind of value
     */
    public Optional<DefinitionTree> findTree(String key) {
        return entries.get(key) instanceof DefinitionTree tree ? Optional.of(tree) : Optional.empty();
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public Set<String> keySet() {
        return entries.keySet();
    }

    public Set<Map.Entry<String, DefinitionValue>> entrySet() {
        return entries.entrySet();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Returns a tree with {@code key} set to {@code value}. An existing key keeps its position.
     *
     * @param key key
     * @param value value
     * @return updated tree
     */
    public DefinitionTree with(String key, DefinitionValue value) {
        return toBuilder().put(key, value).build();
    }

    /**
     * Returns a tree without {@code key}; the receiver itself when the key is absent.
     *
     * @param key key
     * @return updated tree
     */
    public DefinitionTree without(String key) {
        if (!entries.containsKey(key)) {
            return this;
        }
        return toBuilder().remove(key).build();
    }

    @Override
    public Object toPlain() {
        Map<String, Object> plain = new LinkedHashMap<>();
        entries.forEach((k, v) -> plain.put(k, v.toPlain()));
        return plain;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof DefinitionTree other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }

    /**
     * Mutable staging area for building a tree; insertion order is preserved.
     */
    public static final class Builder {
        private final LinkedHashMap<String, DefinitionValue> entries = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String key, DefinitionValue value) {
            entries.put(key, value != null ? value : new ScalarValue(null));
            return this;
        }

        public Builder put(String key, Object raw) {
            return put(key, DefinitionValue.of(raw));
        }

        public Builder remove(String key) {
            entries.remove(key);
            return this;
        }

        public boolean containsKey(String key) {
            return entries.containsKey(key);
        }

        public DefinitionValue get(String key) {
            return entries.get(key);
        }

        public DefinitionTree build() {
            return new DefinitionTree(new LinkedHashMap<>(entries));
        }
    }
}
