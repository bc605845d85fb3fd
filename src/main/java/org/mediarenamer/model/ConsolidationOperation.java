package org.mediarenamer.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * What happened (or, in a dry run, would happen) to one member directory of a group.
 * A failed operation never has a destination.
 */
public record ConsolidationOperation(
    Path source,
    Path destination,
    Integer season,
    boolean success,
    String error
) {

    public ConsolidationOperation {
        Objects.requireNonNull(source, "source");
        if (!success && destination != null) {
            throw new IllegalArgumentException(
                "failed operation for " + source + " cannot have a destination"
            );
        }
    }

    public static ConsolidationOperation succeeded(
        final Path source,
        final Path destination,
        final int season
    ) {
        return new ConsolidationOperation(
            source,
            Objects.requireNonNull(destination, "destination"),
            season,
            true,
            null
        );
    }

    public static ConsolidationOperation failed(
        final Path source,
        final String error
    ) {
        return new ConsolidationOperation(source, null, null, false, error);
    }
}
