package com.xapdoc.source;

import java.util.List;

/**
 * Supplies layer sources in merge order. The order must be the same on every run for the same inputs.
 */
public interface LayerSourceProvider {

    /**
     * Lists the layer sources.
     *
     * @return sources in merge order
     * @throws DefinitionSourceException if sources cannot be listed
     */
    List<LayerSource> discover();
}
