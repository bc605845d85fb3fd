package org.mediarenamer.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of consolidating one group of two or more directories.
 */
public record ConsolidationResult(
    String showTitle,
    Path unifiedDirectory,
    String externalId,
    List<ConsolidationOperation> operations
) {

    public ConsolidationResult {
        operations = List.copyOf(operations);
    }

    public long successCount() {
        return operations.stream().filter(ConsolidationOperation::success).count();
    }
}
