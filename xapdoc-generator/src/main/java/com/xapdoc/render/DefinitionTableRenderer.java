package com.xapdoc.render;

import com.xapdoc.model.DefinitionTree;
import com.xapdoc.model.DefinitionValue;
import com.xapdoc.model.ScalarValue;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders a name to description mapping as a two column Markdown table, rows sorted by name.
 */
public abstract class DefinitionTableRenderer implements SectionRenderer {

    static final String TABLE_HEADER = "| Name | Definition |\n| -- | -- |\n";

    @Override
    public RenderedSection render(DefinitionValue source) {
        if (!(source instanceof DefinitionTree definitions)) {
            throw new SectionRenderException("'" + sourceKey() + "' must be a mapping of name to definition");
        }

        String rows = definitions.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> "| _" + e.getKey() + "_ | " + describe(e.getValue()) + " |")
                .collect(Collectors.joining("\n"));

        return new RenderedSection(source, TABLE_HEADER + rows + "\n");
    }

    private static String describe(DefinitionValue value) {
        if (value instanceof ScalarValue scalar) {
            return scalar.asText();
        }
        return String.valueOf(value.toPlain());
    }
}
