package com.xapdoc.sink;

import com.xapdoc.config.XapDocProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Writes documents as UTF-8 files into the configured output directory.
 */
@Slf4j
@Component
public class FileSystemDocumentSink implements DocumentSink {

    private final Path outputDir;

    public FileSystemDocumentSink(XapDocProperties properties) {
        this.outputDir = Paths.get(properties.getOutputDir());
    }

    @Override
    public void write(String fileName, String content) {
        Path target = outputDir.resolve(fileName);
        try {
            Files.createDirectories(outputDir);
            Files.writeString(target, content, StandardCharsets.UTF_8);
            log.info("Wrote {}", target);
        } catch (IOException e) {
            throw new DocumentWriteException("Failed to write document: " + target, e);
        }
    }
}
