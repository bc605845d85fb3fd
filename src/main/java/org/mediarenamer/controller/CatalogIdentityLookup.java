package org.mediarenamer.controller;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import org.mediarenamer.model.IdentityCatalog;
import org.mediarenamer.model.MediaKind;
import org.mediarenamer.model.ShowIdentity;

/**
 * {@link IdentityLookup} backed by a locally maintained {@link IdentityCatalog}.
 *
 * <p>Titles are compared after {@link TitleNormalizer}, so "WWE SmackDown",
 * "SmackDown Live" and "smackdown" all find the same entry.  When the caller
 * supplies a year, an entry with that year is preferred over other matches.
 */
public class CatalogIdentityLookup implements IdentityLookup {

    private static final Logger logger = Logger.getLogger(
        CatalogIdentityLookup.class.getName()
    );

    private final IdentityCatalog catalog;
    private final TitleNormalizer normalizer;

    public CatalogIdentityLookup(
        final IdentityCatalog catalog,
        final TitleNormalizer normalizer
    ) {
        this.catalog = (catalog == null) ? new IdentityCatalog() : catalog;
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    }

    /**
     * Read the catalog at the given path.  A missing or unreadable file gives a
     * lookup that never finds anything.
     *
     * @param catalogFile the catalog file
     * @return the lookup
     */
    public static CatalogIdentityLookup fromFile(final Path catalogFile) {
        IdentityCatalog catalog = IdentityCatalogPersistence.retrieve(catalogFile);
        if (catalog == null) {
            logger.info("No identity catalog at " + catalogFile + "; identities will not be confirmed");
        } else {
            logger.fine("Loaded " + catalog.getEntries().size() + " identities from " + catalogFile);
        }
        return new CatalogIdentityLookup(catalog, new TitleNormalizer());
    }

    @Override
    public Optional<ShowIdentity> lookup(
        final String title,
        final Integer year,
        final MediaKind kind
    ) {
        if (title == null || title.isBlank()) {
            return Optional.empty();
        }
        String wanted = normalizer.normalize(title);

        List<IdentityCatalog.Entry> matches = new ArrayList<>();
        for (IdentityCatalog.Entry entry : catalog.getEntries()) {
            if (kindMatches(entry, kind) && titleMatches(entry, wanted)) {
                matches.add(entry);
            }
        }
        if (matches.isEmpty()) {
            logger.fine("no catalog entry for '" + title + "'");
            return Optional.empty();
        }

        if (year != null) {
            for (IdentityCatalog.Entry entry : matches) {
                if (year.equals(entry.getYear())) {
                    return Optional.of(entry.toIdentity());
                }
            }
        }
        return Optional.of(matches.get(0).toIdentity());
    }

    private static boolean kindMatches(
        final IdentityCatalog.Entry entry,
        final MediaKind kind
    ) {
        return kind == null
            || kind == MediaKind.UNKNOWN
            || entry.getKind() == MediaKind.UNKNOWN
            || entry.getKind() == kind;
    }

    private boolean titleMatches(final IdentityCatalog.Entry entry, final String wanted) {
        if (entry.getTitle() != null && normalizer.normalize(entry.getTitle()).equals(wanted)) {
            return true;
        }
        for (String alias : entry.getAliases()) {
            if (normalizer.normalize(alias).equals(wanted)) {
                return true;
            }
        }
        return false;
    }
}
