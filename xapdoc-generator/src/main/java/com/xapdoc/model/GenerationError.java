package com.xapdoc.model;

import lombok.Builder;
import lombok.Data;

/**
 * Describes the failure that stopped a generation run.
 */
@Data
@Builder
public class GenerationError {

    /**
     * Failure category.
     */
    public enum Kind {
        INPUT_DISCOVERY,
        INPUT_PARSE,
        RENDER,
        MISSING_SECTION,
        ASSEMBLY,
        OUTPUT
    }

    private Kind kind;
    /**
     * Stem of the layer being processed, or null when the failure is not tied to one layer.
     */
    private String layer;
    private String message;
    /**
     * Cumulative definitions at the time of failure, for diagnosis. May be null.
     */
    private DefinitionTree state;
}
