package com.xapdoc.source;

import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.resolver.Resolver;

import java.util.regex.Pattern;

/**
 * Resolves plain scalars the way JSON reads them: {@code null}, {@code true}, {@code false} and decimal numbers
 * keep their type, every other plain scalar stays a string.
 *
 * <p>The YAML 1.1 forms SnakeYAML recognizes by default ({@code on}/{@code off}, {@code yes}/{@code no}, hex,
 * octal and sexagesimal numbers, timestamps) are read as text, so keys such as {@code on} and values such as
 * {@code 0x10} reach the documents unchanged.
 */
class DefinitionScalarResolver extends Resolver {

    static final Pattern JSON_BOOL = Pattern.compile("^(?:true|false)$");
    static final Pattern JSON_INT = Pattern.compile("^-?(?:0|[1-9][0-9]*)$");
    static final Pattern JSON_FLOAT = Pattern.compile("^-?(?:0|[1-9][0-9]*)(?:\\.[0-9]+)?(?:[eE][-+]?[0-9]+)?$");
    static final Pattern JSON_NULL = Pattern.compile("^(?:~|null)$");

    @Override
    protected void addImplicitResolvers() {
        addImplicitResolver(Tag.BOOL, JSON_BOOL, "tf");
        // int before float: the float pattern also matches plain integers
        addImplicitResolver(Tag.INT, JSON_INT, "-0123456789");
        addImplicitResolver(Tag.FLOAT, JSON_FLOAT, "-0123456789");
        addImplicitResolver(Tag.NULL, JSON_NULL, "~n");
        addImplicitResolver(Tag.NULL, EMPTY, null);
    }
}
