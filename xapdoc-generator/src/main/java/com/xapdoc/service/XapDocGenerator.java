package com.xapdoc.service;

import com.xapdoc.config.XapDocProperties;
import com.xapdoc.merge.LayeredMerger;
import com.xapdoc.model.DefinitionTree;
import com.xapdoc.model.GenerationError;
import com.xapdoc.model.GenerationResult;
import com.xapdoc.model.Layer;
import com.xapdoc.model.LayerDocument;
import com.xapdoc.render.SectionRenderException;
import com.xapdoc.render.SectionRenderingService;
import com.xapdoc.sink.DocumentSink;
import com.xapdoc.sink.DocumentWriteException;
import com.xapdoc.source.DefinitionParseException;
import com.xapdoc.source.DefinitionSourceException;
import com.xapdoc.source.LayerSource;
import com.xapdoc.source.LayerSourceProvider;
import com.xapdoc.util.DefinitionDumper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs one documentation build: every layer is merged into the cumulative definitions, its derived sections
 * are rendered and its document is written; the index document is written last.
 *
 * <p>Processing stops at the first failure. Documents written for earlier layers are left in place.
 */
@Slf4j
@Service
public class XapDocGenerator {

    private static final String MDC_LAYER = "layer";

    private final LayerSourceProvider sourceProvider;
    private final LayeredMerger merger;
    private final SectionRenderingService renderingService;
    private final DocumentAssembler assembler;
    private final DocumentSink sink;
    private final DefinitionDumper dumper;
    private final XapDocProperties properties;

    public XapDocGenerator(
            LayerSourceProvider sourceProvider,
            LayeredMerger merger,
            SectionRenderingService renderingService,
            DocumentAssembler assembler,
            DocumentSink sink,
            DefinitionDumper dumper,
            XapDocProperties properties
    ) {
        this.sourceProvider = sourceProvider;
        this.merger = merger;
        this.renderingService = renderingService;
        this.assembler = assembler;
        this.sink = sink;
        this.dumper = dumper;
        this.properties = properties;
    }

    /**
     * Builds all documents.
     *
     * @return the documents written and, on failure, the error with the cumulative definitions at that point
     */
    public GenerationResult generate() {
        List<LayerDocument> documents = new ArrayList<>();

        List<LayerSource> sources;
        try {
            sources = sourceProvider.discover();
        } catch (DefinitionSourceException e) {
            return GenerationResult.failure(documents, GenerationError.builder()
                    .kind(GenerationError.Kind.INPUT_DISCOVERY)
                    .message(e.getMessage())
                    .build());
        }

        DefinitionTree cumulative = null;
        for (LayerSource source : sources) {
            String stem = source.stem();
            MDC.put(MDC_LAYER, stem);
            try {
                Layer layer = new Layer(stem, Layer.displayVersionOf(stem, properties.getVersionPrefix()), source.read());
                log.info("Merging layer {} (version {})", layer.stem(), layer.displayVersion());

                cumulative = merger.merge(cumulative, layer.definitions());
                cumulative = renderingService.refresh(cumulative);

                LayerDocument document = LayerDocument.builder()
                        .stem(layer.stem())
                        .fileName(layer.documentFileName())
                        .displayVersion(layer.displayVersion())
                        .content(assembler.assemble(cumulative))
                        .build();
                sink.write(document.getFileName(), document.getContent());
                documents.add(document);
            } catch (DefinitionSourceException | SectionRenderException | DocumentAssemblyException | DocumentWriteException e) {
                return GenerationResult.failure(documents, GenerationError.builder()
                        .kind(kindOf(e))
                        .layer(stem)
                        .message(e.getMessage())
                        .state(cumulative)
                        .build());
            } finally {
                MDC.remove(MDC_LAYER);
            }
        }

        try {
            String latestFile = properties.getLatestDefinitionsFile();
            if (latestFile != null && !latestFile.isBlank()) {
                sink.write(latestFile, dumper.toJson(cumulative));
            }
            sink.write(properties.getIndexFileName(), assembler.assembleIndex(documents));
        } catch (DocumentWriteException e) {
            return GenerationResult.failure(documents, GenerationError.builder()
                    .kind(GenerationError.Kind.OUTPUT)
                    .message(e.getMessage())
                    .state(cumulative)
                    .build());
        }

        log.info("Generated {} layer documents and index {}", documents.size(), properties.getIndexFileName());
        return GenerationResult.success(documents, properties.getIndexFileName());
    }

    private static GenerationError.Kind kindOf(RuntimeException e) {
        if (e instanceof DefinitionParseException) {
            return GenerationError.Kind.INPUT_PARSE;
        }
        if (e instanceof DefinitionSourceException) {
            return GenerationError.Kind.INPUT_DISCOVERY;
        }
        if (e instanceof SectionRenderException) {
            return GenerationError.Kind.RENDER;
        }
        if (e instanceof MissingSectionException) {
            return GenerationError.Kind.MISSING_SECTION;
        }
        if (e instanceof DocumentAssemblyException) {
            return GenerationError.Kind.ASSEMBLY;
        }
        return GenerationError.Kind.OUTPUT;
    }
}
