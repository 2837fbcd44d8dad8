package com.xapdoc.render;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Term glossary: {@code term_definitions} rendered into {@code !term_definitions!}.
 */
@Component
@Order(2)
public class TermDefinitionsRenderer extends DefinitionTableRenderer {

    public static final String SOURCE_KEY = "term_definitions";
    public static final String SECTION_KEY = "!term_definitions!";

    @Override
    public String sourceKey() {
        return SOURCE_KEY;
    }

    @Override
    public String sectionKey() {
        return SECTION_KEY;
    }
}
