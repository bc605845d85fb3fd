package org.mediarenamer.controller;

import java.nio.file.Path;
import java.util.Optional;
import org.mediarenamer.model.TrackSummary;

/**
 * Inspects a media container's tracks directly.  Any failure is reported as an
 * empty result, never as an exception.
 */
public interface TechnicalProbe {

    TechnicalProbe UNAVAILABLE = new TechnicalProbe() {
        @Override
        public Optional<TrackSummary> probe(final Path file) {
            return Optional.empty();
        }

        @Override
        public boolean isAvailable() {
            return false;
        }
    };

    Optional<TrackSummary> probe(Path file);

    /**
     * @return false if the underlying tool is missing, so probing is pointless
     */
    default boolean isAvailable() {
        return true;
    }
}
