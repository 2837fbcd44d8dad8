package com.xapdoc.render;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Type catalog: {@code type_docs} rendered into {@code !type_docs!}.
 */
@Component
@Order(1)
public class TypeDocsRenderer extends DefinitionTableRenderer {

    public static final String SOURCE_KEY = "type_docs";
    public static final String SECTION_KEY = "!type_docs!";

    @Override
    public String sourceKey() {
        return SOURCE_KEY;
    }

    @Override
    public String sectionKey() {
        return SECTION_KEY;
    }
}
