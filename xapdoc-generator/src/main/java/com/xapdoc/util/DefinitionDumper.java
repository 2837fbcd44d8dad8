package com.xapdoc.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xapdoc.model.DefinitionTree;
import org.springframework.stereotype.Component;

/**
 * Serializes definition trees as indented JSON for diagnostics and for the merged definitions export.
 */
@Component
public class DefinitionDumper {

    private final ObjectMapper objectMapper;

    public DefinitionDumper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Render a tree as indented JSON, keys in tree order.
     *
     * @param tree tree, may be null
     * @return JSON text; {@code null} for a null tree
     */
    public String toJson(DefinitionTree tree) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(tree != null ? tree.toPlain() : null);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize definitions", e);
        }
    }
}
