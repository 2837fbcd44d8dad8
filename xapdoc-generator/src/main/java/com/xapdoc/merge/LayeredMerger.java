package com.xapdoc.merge;

import com.xapdoc.config.XapDocProperties;
import com.xapdoc.model.DefinitionTree;
import com.xapdoc.model.DefinitionValue;
import com.xapdoc.model.ScalarValue;
import com.xapdoc.model.SequenceValue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Combines partial definition trees, one layer at a time, into a cumulative tree.
 *
 * <p>For a key present on both sides, the kind of the incoming value decides the outcome:
 * <ul>
 *     <li>mapping: merged key by key with the same rules; if the incoming mapping holds the reset token
 *     as a key, it replaces the existing mapping instead (token key removed)</li>
 *     <li>sequence: appended to the existing sequence; if its first element is the reset token, the
 *     remaining elements replace the existing sequence</li>
 *     <li>anything else: replaces the existing value</li>
 * </ul>
 * A key absent from the existing tree takes the incoming value as is. Only the first element of a
 * sequence is checked for the reset token; a token further along is ordinary data.
 *
 * <p>Neither argument is modified; the result is a new tree.
 */
@Slf4j
@Component
public class LayeredMerger {

    private final String resetToken;

    /**
     * Create a merger.
     *
     * @param properties generator settings providing the reset token
     */
    public LayeredMerger(XapDocProperties properties) {
        this.resetToken = Objects.requireNonNull(properties.getResetToken(), "resetToken must not be null");
    }

    /**
     * Merges {@code incoming} on top of {@code existing}.
     *
     * @param existing cumulative tree so far, or null for the first layer
     * @param incoming the next layer
     * @return merged tree; {@code incoming} itself when {@code existing} is null
     */
    public DefinitionTree merge(DefinitionTree existing, DefinitionTree incoming) {
        Objects.requireNonNull(incoming, "incoming must not be null");
        if (existing == null) {
            return incoming;
        }

        DefinitionTree.Builder result = existing.toBuilder();
        for (Map.Entry<String, DefinitionValue> entry : incoming.entrySet()) {
            String key = entry.getKey();
            DefinitionValue value = entry.getValue();
            if (!result.containsKey(key)) {
                result.put(key, value);
                continue;
            }

            DefinitionValue current = result.get(key);
            if (value instanceof DefinitionTree tree) {
                result.put(key, mergeTree(key, current, tree));
            } else if (value instanceof SequenceValue sequence) {
                result.put(key, mergeSequence(key, current, sequence));
            } else {
                if (value instanceof ScalarValue scalar && scalar.isToken(resetToken)) {
                    log.warn("Reset token used as a plain value for key '{}'; treating it as ordinary data", key);
                }
                result.put(key, value);
            }
        }
        return result.build();
    }

    /**
     * Folds all layers left to right: {@code merge(merge(merge(null, l1), l2), l3)...}.
     *
     * @param layers layers in order
     * @return cumulative tree; the empty tree when there are no layers
     */
    public DefinitionTree mergeAll(List<DefinitionTree> layers) {
        DefinitionTree cumulative = null;
        for (DefinitionTree layer : layers) {
            cumulative = merge(cumulative, layer);
        }
        return cumulative != null ? cumulative : DefinitionTree.empty();
    }

    private DefinitionValue mergeTree(String key, DefinitionValue current, DefinitionTree incoming) {
        if (incoming.containsKey(resetToken)) {
            log.debug("Resetting mapping '{}'", key);
            return incoming.without(resetToken);
        }
        if (current instanceof DefinitionTree existingTree) {
            return merge(existingTree, incoming).without(resetToken);
        }
        log.warn("Mapping for key '{}' replaces a value of another kind", key);
        return incoming;
    }

    private DefinitionValue mergeSequence(String key, DefinitionValue current, SequenceValue incoming) {
        boolean reset = incoming.startsWithToken(resetToken);
        if (current instanceof SequenceValue existingSequence) {
            if (reset) {
                log.debug("Resetting sequence '{}'", key);
                return incoming.dropFirst();
            }
            return existingSequence.concat(incoming);
        }
        log.warn("Sequence for key '{}' replaces a value of another kind", key);
        return reset ? incoming.dropFirst() : incoming;
    }
}
