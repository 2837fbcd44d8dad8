package com.xapdoc.model;

import java.util.Collection;
import java.util.Map;

/**
 * A node of a definition document.
 *
 * <p>Every value is exactly one of {@link ScalarValue}, {@link SequenceValue} or {@link DefinitionTree}.
 * Instances are immutable; updates produce new values.
 */
public sealed interface DefinitionValue permits ScalarValue, SequenceValue, DefinitionTree {

    /**
     * Converts this value back into plain {@code Map}/{@code List}/scalar objects, e.g. for serialization.
     *
     * @return plain representation
     */
    Object toPlain();

    /**
     * Wraps a parsed document node (as produced by YAML or JSON readers) into a definition value.
     *
     * <p>Maps become trees with their keys converted to strings, collections become sequences and
     * everything else becomes a scalar. Nested structures are converted recursively.
     *
     * @param raw parsed node, may be null
     * @return definition value
     */
    static DefinitionValue of(Object raw) {
        if (raw instanceof DefinitionValue value) {
            return value;
        }
        if (raw instanceof Map<?, ?> map) {
            return DefinitionTree.fromMap(map);
        }
        if (raw instanceof Collection<?> collection) {
            return SequenceValue.fromCollection(collection);
        }
        return new ScalarValue(raw);
    }
}
