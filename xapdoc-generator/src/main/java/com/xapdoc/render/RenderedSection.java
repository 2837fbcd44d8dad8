package com.xapdoc.render;

import com.xapdoc.model.DefinitionValue;

/**
 * Result of rendering one section.
 *
 * @param source source value to store back under the renderer's source key
 * @param text rendered section text
 */
public record RenderedSection(DefinitionValue source, String text) {
}
