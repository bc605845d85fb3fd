package org.mediarenamer.controller;

import java.util.Optional;
import org.mediarenamer.model.MediaKind;
import org.mediarenamer.model.ShowIdentity;

/**
 * Confirms the identity of a show or movie from its title and, optionally, a year.
 * A miss, and any error, is reported as an empty result; implementations never
 * throw to the caller.
 */
@FunctionalInterface
public interface IdentityLookup {

    IdentityLookup NONE = (title, year, kind) -> Optional.empty();

    /**
     * @param title the title as discovered
     * @param year  a year hint; may be null
     * @param kind  whether a show ({@link MediaKind#EPISODE}) or a movie is wanted
     * @return the confirmed identity, or empty if not found
     */
    Optional<ShowIdentity> lookup(String title, Integer year, MediaKind kind);
}
