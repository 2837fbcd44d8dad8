package com.xapdoc.render;

import com.xapdoc.model.DefinitionValue;

/**
 * Derives the text of one reserved documentation section from a top-level definitions key.
 *
 * <p>Implementations are pure: the same source value always renders the same text.
 */
public interface SectionRenderer {

    /**
     * Top-level key the section is derived from, e.g. {@code type_docs}.
     *
     * @return source key
     */
    String sourceKey();

    /**
     * Documentation key receiving the rendered text, e.g. {@code !type_docs!}.
     *
     * @return reserved section key
     */
    String sectionKey();

    /**
     * Renders the section.
     *
     * @param source value currently stored under {@link #sourceKey()}
     * @return rendered text together with the (possibly normalized) source value
     * @throws SectionRenderException if the source value does not have the expected shape
     */
    RenderedSection render(DefinitionValue source);
}
