package com.xapdoc.source;

import com.xapdoc.model.DefinitionTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.representer.Representer;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads definition documents written in YAML (JSON documents are accepted as well).
 *
 * <p>Mapping order is preserved. Reserved tokens such as {@code !reset!} must be quoted in YAML, since an
 * unquoted leading {@code !} starts a tag. Plain scalars other than {@code null}, {@code true}, {@code false} and
 * decimal numbers are read as text (see {@link DefinitionScalarResolver}).
 */
@Component
public class YamlDefinitionLoader {
    private static final Logger log = LoggerFactory.getLogger(YamlDefinitionLoader.class);

    /**
     * Loads one definition file.
     *
     * @param file file to read
     * @return definitions
     * @throws DefinitionParseException if the file cannot be read or parsed
     */
    public DefinitionTree load(Path file) {
        try (InputStream in = Files.newInputStream(file);
             Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return load(reader, String.valueOf(file.getFileName()));
        } catch (IOException e) {
            throw new DefinitionParseException("Failed to read definitions: " + file, e);
        }
    }

    /**
     * Loads definitions from a reader.
     *
     * @param reader document text
     * @param sourceName name used in messages
     * @return definitions; the empty tree for an empty document
     * @throws DefinitionParseException if the document is malformed or its root is not a mapping
     */
    public DefinitionTree load(Reader reader, String sourceName) {
        Object document;
        try {
            document = newYaml().load(reader);
        } catch (YAMLException e) {
            throw new DefinitionParseException("Invalid definitions in " + sourceName + ": " + e.getMessage(), e);
        }

        if (document == null) {
            log.warn("Definitions file is empty: {}", sourceName);
            return DefinitionTree.empty();
        }
        if (!(document instanceof Map<?, ?> root)) {
            throw new DefinitionParseException("Definitions root must be a mapping in " + sourceName);
        }
        return DefinitionTree.fromMap(root);
    }

    private static Yaml newYaml() {
        LoaderOptions loaderOptions = new LoaderOptions();
        DumperOptions dumperOptions = new DumperOptions();
        return new Yaml(
                new SafeConstructor(loaderOptions),
                new Representer(dumperOptions),
                dumperOptions,
                loaderOptions,
                new DefinitionScalarResolver());
    }
}
