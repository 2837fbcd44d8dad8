package com.xapdoc.model;

import lombok.Builder;
import lombok.Data;

/**
 * A document assembled for one layer.
 */
@Data
@Builder
public class LayerDocument {
    private String stem;
    private String fileName;
    private String displayVersion;
    private String content;
}
