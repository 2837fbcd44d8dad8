package com.xapdoc.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for the documentation generator, bound from {@code xapdoc.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "xapdoc")
public class XapDocProperties {

    /**
     * Directory holding the per-version definition files.
     */
    @NotBlank
    private String definitionsDir = "data/xap";

    /**
     * Glob selecting definition files inside {@link #definitionsDir}.
     */
    @NotBlank
    private String definitionsGlob = "xap_*.{yaml,yml,json}";

    /**
     * Directory receiving the generated documents.
     */
    @NotBlank
    private String outputDir = "docs";

    /**
     * Token that clears earlier content of a mapping or sequence during a merge.
     */
    @NotBlank
    private String resetToken = "!reset!";

    @NotBlank
    private String documentationKey = "documentation";

    @NotBlank
    private String orderKey = "order";

    /**
     * Prefix stripped from a file stem to obtain its display version.
     */
    private String versionPrefix = "xap_";

    @NotBlank
    private String indexFileName = "xap_protocol.md";

    @NotBlank
    private String indexTitle = "XAP Protocol Reference";

    /**
     * Text placed before the version in each index entry.
     */
    @NotBlank
    private String indexEntryLabel = "XAP Version";

    /**
     * When set, the fully merged definitions are also written as JSON under this name in {@link #outputDir}.
     */
    private String latestDefinitionsFile;
}
