package com.xapdoc.source;

import com.xapdoc.model.DefinitionTree;
import com.xapdoc.model.ScalarValue;
import com.xapdoc.model.SequenceValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlDefinitionLoaderTest {

    private final YamlDefinitionLoader loader = new YamlDefinitionLoader();

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("keeps mapping order and converts integer keys to strings")
    void keepsOrder() {
        DefinitionTree tree = loader.load(new StringReader("""
                version: 0.1.0
                documentation:
                  order: ['!reset!', intro]
                response_flags:
                  bits:
                    7: {name: UNLOCKED, description: unlocked}
                    0: {name: SUCCESS, description: ok}
                """), "test");

        assertThat(tree.keySet()).containsExactly("version", "documentation", "response_flags");
        assertThat(tree.findTree("response_flags").orElseThrow().findTree("bits").orElseThrow().keySet())
                .containsExactly("7", "0");
        assertThat(tree.findTree("documentation").orElseThrow().get("order"))
                .isEqualTo(SequenceValue.of("!reset!", "intro"));
        assertThat(tree.get("version")).isEqualTo(ScalarValue.text("0.1.0"));
    }

    @Test
    @DisplayName("accepts JSON documents")
    void readsJson() throws IOException {
        Path file = Files.writeString(tempDir.resolve("xap_0.0.1.json"), "{\"b\": [1, 2], \"a\": {\"x\": true}}");

        DefinitionTree tree = loader.load(file);

        assertThat(tree.keySet()).containsExactly("b", "a");
        assertThat(tree.get("b")).isEqualTo(SequenceValue.of(1, 2));
    }

    @Test
    @DisplayName("YAML 1.1 booleans, hex and octal forms stay text")
    void plainScalarsStayText() {
        DefinitionTree tree = loader.load(new StringReader("t: {on: enabled, Mask: 0x10, Mode: 010, Flag: yes, Off: off}"), "test");

        DefinitionTree terms = tree.findTree("t").orElseThrow();
        assertThat(terms.keySet()).containsExactly("on", "Mask", "Mode", "Flag", "Off");
        assertThat(terms.get("on")).isEqualTo(ScalarValue.text("enabled"));
        assertThat(terms.get("Mask")).isEqualTo(ScalarValue.text("0x10"));
        assertThat(terms.get("Mode")).isEqualTo(ScalarValue.text("010"));
        assertThat(terms.get("Flag")).isEqualTo(ScalarValue.text("yes"));
        assertThat(terms.get("Off")).isEqualTo(ScalarValue.text("off"));
    }

    @Test
    @DisplayName("null, true, false and decimal numbers keep their JSON types")
    void jsonScalarsKeepTypes() {
        DefinitionTree tree = loader.load(new StringReader("{n: null, b: true, i: -12, f: 1.5, v: 0.1.0, d: 2024-01-01}"), "test");

        assertThat(tree.get("n")).isEqualTo(new ScalarValue(null));
        assertThat(tree.get("b")).isEqualTo(new ScalarValue(true));
        assertThat(tree.get("i")).isEqualTo(new ScalarValue(-12));
        assertThat(tree.get("f")).isEqualTo(new ScalarValue(1.5));
        assertThat(tree.get("v")).isEqualTo(ScalarValue.text("0.1.0"));
        assertThat(tree.get("d")).isEqualTo(ScalarValue.text("2024-01-01"));
    }

    @Test
    @DisplayName("an empty document is an empty tree")
    void emptyDocument() {
        assertThat(loader.load(new StringReader(""), "empty")).isEqualTo(DefinitionTree.empty());
    }

    @Test
    @DisplayName("malformed documents are parse errors")
    void malformed() {
        assertThatThrownBy(() -> loader.load(new StringReader("a: [1, 2"), "broken.yaml"))
                .isInstanceOf(DefinitionParseException.class)
                .hasMessageContaining("broken.yaml");
    }

    @Test
    @DisplayName("a root that is not a mapping is a parse error")
    void rootMustBeMapping() {
        assertThatThrownBy(() -> loader.load(new StringReader("- a\n- b\n"), "list.yaml"))
                .isInstanceOf(DefinitionParseException.class)
                .hasMessageContaining("mapping");
    }

    @Test
    @DisplayName("unreadable files are parse errors")
    void missingFile() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("absent.yaml")))
                .isInstanceOf(DefinitionParseException.class)
                .hasCauseInstanceOf(IOException.class);
    }
}
