package com.xapdoc.render;

import com.xapdoc.config.XapDocProperties;
import com.xapdoc.model.DefinitionTree;
import com.xapdoc.model.DefinitionValue;
import com.xapdoc.model.ScalarValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Refreshes the derived documentation sections of a cumulative tree.
 *
 * <p>Each renderer runs only when its source key is present. Rendering is repeated after every layer, so a
 * section reflects the definitions merged so far.
 */
@Service
public class SectionRenderingService {
    private static final Logger log = LoggerFactory.getLogger(SectionRenderingService.class);

    private final List<SectionRenderer> renderers;
    private final String documentationKey;

    /**
     * Create the service.
     *
     * @param renderers section renderers, applied in order
     * @param properties generator settings providing the documentation key
     */
    public SectionRenderingService(List<SectionRenderer> renderers, XapDocProperties properties) {
        this.renderers = List.copyOf(renderers);
        this.documentationKey = properties.getDocumentationKey();
    }

    /**
     * Renders every section whose source key is present.
     *
     * @param cumulative cumulative definitions
     * @return a tree with refreshed sections and normalized source values
     * @throws SectionRenderException if a source value is malformed
     */
    public DefinitionTree refresh(DefinitionTree cumulative) {
        DefinitionTree result = cumulative;
        for (SectionRenderer renderer : renderers) {
            DefinitionValue source = result.get(renderer.sourceKey());
            if (source == null) {
                continue;
            }
            RenderedSection rendered = renderer.render(source);
            result = result.with(renderer.sourceKey(), rendered.source());
            result = result.with(documentationKey, documentation(result).with(renderer.sectionKey(), ScalarValue.text(rendered.text())));
            log.debug("Rendered section {} from '{}'", renderer.sectionKey(), renderer.sourceKey());
        }
        return result;
    }

    private DefinitionTree documentation(DefinitionTree cumulative) {
        DefinitionValue documentation = cumulative.get(documentationKey);
        if (documentation == null) {
            return DefinitionTree.empty();
        }
        if (documentation instanceof DefinitionTree tree) {
            return tree;
        }
        throw new SectionRenderException("'" + documentationKey + "' must be a mapping");
    }
}
