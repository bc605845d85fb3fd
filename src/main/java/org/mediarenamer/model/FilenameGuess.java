package org.mediarenamer.model;

/**
 * Best-effort structured fields guessed from a bare filename.  Any field may be null.
 */
public record FilenameGuess(
    String title,
    Integer year,
    Integer season,
    Integer episode,
    String episodeTitle,
    MediaKind kind
) {

    public static final FilenameGuess NOTHING =
        new FilenameGuess(null, null, null, null, null, MediaKind.UNKNOWN);
}
