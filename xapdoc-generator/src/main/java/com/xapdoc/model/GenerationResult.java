package com.xapdoc.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a generation run: the documents written, and the error that stopped the run if any.
 *
 * @param documents layer documents written before the run finished or failed
 * @param indexFileName index document name, null when the run failed before writing it
 * @param error failure, null on success
 */
public record GenerationResult(List<LayerDocument> documents, String indexFileName, GenerationError error) {

    public GenerationResult {
        documents = documents != null ? List.copyOf(documents) : List.of();
    }

    public static GenerationResult success(List<LayerDocument> documents, String indexFileName) {
        return new GenerationResult(documents, Objects.requireNonNull(indexFileName), null);
    }

    public static GenerationResult failure(List<LayerDocument> documents, GenerationError error) {
        return new GenerationResult(documents, null, Objects.requireNonNull(error));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<GenerationError> findError() {
        return Optional.ofNullable(error);
    }
}
