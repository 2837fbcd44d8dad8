package com.xapdoc.sink;

import com.xapdoc.config.XapDocProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSystemDocumentSinkTest {

    @TempDir
    Path tempDir;

    private FileSystemDocumentSink sinkFor(Path outputDir) {
        XapDocProperties properties = new XapDocProperties();
        properties.setOutputDir(outputDir.toString());
        return new FileSystemDocumentSink(properties);
    }

    @Test
    @DisplayName("creates the output directory and writes UTF-8 text")
    void writesFile() throws IOException {
        Path outputDir = tempDir.resolve("docs");

        sinkFor(outputDir).write("xap_0.1.0.md", "# Heading – ü\n");

        assertThat(Files.readString(outputDir.resolve("xap_0.1.0.md"), StandardCharsets.UTF_8))
                .isEqualTo("# Heading – ü\n");
    }

    @Test
    @DisplayName("overwrites existing content")
    void overwrites() throws IOException {
        FileSystemDocumentSink sink = sinkFor(tempDir);
        sink.write("index.md", "a much longer first version\n");

        sink.write("index.md", "short\n");

        assertThat(Files.readString(tempDir.resolve("index.md"))).isEqualTo("short\n");
    }

    @Test
    @DisplayName("write failures are reported as DocumentWriteException")
    void reportsFailures() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("not-a-dir"), "x");

        assertThatThrownBy(() -> sinkFor(blocker).write("a.md", "text"))
                .isInstanceOf(DocumentWriteException.class)
                .hasCauseInstanceOf(IOException.class);
    }
}
