package com.xapdoc.service;

import com.xapdoc.config.XapDocProperties;
import com.xapdoc.model.DefinitionTree;
import com.xapdoc.model.DefinitionValue;
import com.xapdoc.model.LayerDocument;
import com.xapdoc.model.ScalarValue;
import com.xapdoc.model.SequenceValue;
import com.xapdoc.util.VersionComparator;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Builds document text from a cumulative tree and the index over all produced documents.
 */
@Component
public class DocumentAssembler {

    private static final String SECTION_SEPARATOR = "\n\n";

    private final XapDocProperties properties;

    public DocumentAssembler(XapDocProperties properties) {
        this.properties = properties;
    }

    /**
     * Concatenates the documentation sections in the order given by the documentation order list. Each
     * section is trimmed and followed by a blank line.
     *
     * @param cumulative cumulative definitions with rendered sections
     * @return document text
     * @throws MissingSectionException if the order names an undefined section
     * @throws DocumentAssemblyException if the documentation subtree or its order list is malformed
     */
    public String assemble(DefinitionTree cumulative) {
        String documentationKey = properties.getDocumentationKey();
        String orderKey = properties.getOrderKey();

        DefinitionTree documentation = cumulative.findTree(documentationKey)
                .orElseThrow(() -> new DocumentAssemblyException("Definitions have no '" + documentationKey + "' mapping"));
        if (!(documentation.get(orderKey) instanceof SequenceValue order)) {
            throw new DocumentAssemblyException("'" + documentationKey + "." + orderKey + "' must be a list of section names");
        }

        StringBuilder out = new StringBuilder();
        for (DefinitionValue entry : order.items()) {
            if (!(entry instanceof ScalarValue name)) {
                throw new DocumentAssemblyException("Section order entries must be names, found: " + entry);
            }
            String sectionKey = name.asText();
            DefinitionValue section = documentation.get(sectionKey);
            if (section == null) {
                throw new MissingSectionException(sectionKey);
            }
            if (!(section instanceof ScalarValue text)) {
                throw new DocumentAssemblyException("Documentation section '" + sectionKey + "' must be text");
            }
            out.append(text.asText().strip()).append(SECTION_SEPARATOR);
        }
        return out.toString();
    }

    /**
     * Builds the index document: a title, then one link per document, newest version first.
     *
     * @param documents produced layer documents, in any order
     * @return index text
     */
    public String assembleIndex(List<LayerDocument> documents) {
        StringBuilder out = new StringBuilder();
        out.append("# ").append(properties.getIndexTitle()).append(SECTION_SEPARATOR);

        documents.stream()
                .sorted(Comparator.comparing(LayerDocument::getDisplayVersion, VersionComparator.INSTANCE).reversed())
                .forEach(doc -> out.append("* [")
                        .append(properties.getIndexEntryLabel()).append(' ').append(doc.getDisplayVersion())
                        .append("](").append(doc.getFileName()).append(")\n"));
        return out.toString();
    }
}
