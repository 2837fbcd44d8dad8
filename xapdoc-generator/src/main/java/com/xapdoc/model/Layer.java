package com.xapdoc.model;

import java.util.Objects;

/**
 * One version's partial definitions, read from a single source.
 *
 * @param stem source name without extension, e.g. {@code xap_0.1.0}
 * @param displayVersion version label derived from the stem, e.g. {@code 0.1.0}
 * @param definitions parsed definitions
 */
public record Layer(String stem, String displayVersion, DefinitionTree definitions) {

    public Layer {
        Objects.requireNonNull(stem, "stem must not be null");
        Objects.requireNonNull(definitions, "definitions must not be null");
        displayVersion = displayVersion != null ? displayVersion : stem;
    }

    /**
     * Name of the document produced for this layer.
     *
     * @return output file name
     */
    public String documentFileName() {
        return stem + ".md";
    }

    /**
     * Derives the display version of a stem by removing the version prefix, e.g. {@code xap_0.1.0} to
     * {@code 0.1.0}. A stem without the prefix is its own display version.
     *
     * @param stem source stem
     * @param versionPrefix prefix to remove, may be null or empty
     * @return display version
     */
    public static String displayVersionOf(String stem, String versionPrefix) {
        if (versionPrefix != null && !versionPrefix.isEmpty() && stem.startsWith(versionPrefix)) {
            return stem.substring(versionPrefix.length());
        }
        return stem;
    }
}
