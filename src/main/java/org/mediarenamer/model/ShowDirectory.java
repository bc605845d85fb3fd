package org.mediarenamer.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A directory that looks like it holds (part of) one TV show.
 *
 * @param path           the directory itself
 * @param rawTitle       the show title cleaned out of the directory name
 * @param season         explicit or file-inferred season; null if unknown
 * @param year           a plausible year found in the directory name; null if none
 * @param normalizedTitle the comparison key produced by TitleNormalizer
 * @param confidence     reserved; currently always 0
 */
public record ShowDirectory(
    Path path,
    String rawTitle,
    Integer season,
    Integer year,
    String normalizedTitle,
    double confidence
) {

    public ShowDirectory {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(rawTitle, "rawTitle");
        Objects.requireNonNull(normalizedTitle, "normalizedTitle");
        if (season != null && season < 1) {
            throw new IllegalArgumentException(
                "season must be positive, was " + season
            );
        }
    }

    public ShowDirectory(
        final Path path,
        final String rawTitle,
        final Integer season,
        final Integer year,
        final String normalizedTitle
    ) {
        this(path, rawTitle, season, year, normalizedTitle, 0.0);
    }
}
