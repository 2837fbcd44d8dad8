package com.xapdoc.source;

import com.xapdoc.config.XapDocProperties;
import com.xapdoc.model.DefinitionTree;
import com.xapdoc.model.Layer;
import com.xapdoc.util.VersionComparator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Finds the per-version definition files in the definitions directory, oldest version first.
 */
@Component
public class DefinitionFileDiscovery implements LayerSourceProvider {
    private static final Logger log = LoggerFactory.getLogger(DefinitionFileDiscovery.class);

    private final XapDocProperties properties;
    private final YamlDefinitionLoader loader;

    public DefinitionFileDiscovery(XapDocProperties properties, YamlDefinitionLoader loader) {
        this.properties = properties;
        this.loader = loader;
    }

    @Override
    public List<LayerSource> discover() {
        Path definitionsDir = Paths.get(properties.getDefinitionsDir());
        if (!Files.isDirectory(definitionsDir)) {
            throw new DefinitionSourceException("Definitions directory not found: " + definitionsDir.toAbsolutePath());
        }

        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + properties.getDefinitionsGlob());
        List<LayerSource> sources;
        try (Stream<Path> files = Files.list(definitionsDir)) {
            sources = files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName() != null && matcher.matches(p.getFileName()))
                    .map(p -> (LayerSource) new FileLayerSource(p, loader))
                    .sorted(Comparator.comparing(
                            (LayerSource s) -> Layer.displayVersionOf(s.stem(), properties.getVersionPrefix()),
                            VersionComparator.INSTANCE))
                    .toList();
        } catch (IOException e) {
            throw new DefinitionSourceException("Failed to list definitions directory: " + definitionsDir, e);
        }

        if (sources.isEmpty()) {
            throw new DefinitionSourceException(
                    "No definition files matching '" + properties.getDefinitionsGlob() + "' in " + definitionsDir);
        }
        log.info("Found {} definition files in {}", sources.size(), definitionsDir);
        return sources;
    }

    /**
     * A definition file on disk.
     */
    static final class FileLayerSource implements LayerSource {
        private final Path file;
        private final YamlDefinitionLoader loader;

        FileLayerSource(Path file, YamlDefinitionLoader loader) {
            this.file = file;
            this.loader = loader;
        }

        @Override
        public String stem() {
            String name = file.getFileName().toString();
            int dot = name.lastIndexOf('.');
            return dot > 0 ? name.substring(0, dot) : name;
        }

        @Override
        public DefinitionTree read() {
            return loader.load(file);
        }

        @Override
        public String toString() {
            return file.toString();
        }
    }
}
