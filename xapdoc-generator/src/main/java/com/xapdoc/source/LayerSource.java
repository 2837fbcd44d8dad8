package com.xapdoc.source;

import com.xapdoc.model.DefinitionTree;

/**
 * One input document holding a layer's definitions.
 */
public interface LayerSource {

    /**
     * Source name without extension; names the layer's output document.
     *
     * @return stem
     */
    String stem();

    /**
     * Parses the source.
     *
     * @return definitions in document key order
     * @throws DefinitionParseException if the source is not valid structured data
     */
    DefinitionTree read();
}
