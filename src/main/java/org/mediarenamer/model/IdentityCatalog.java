package org.mediarenamer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Locally maintained list of known shows and movies, persisted as XML.
 */
public class IdentityCatalog {

    public static class Entry {

        private String title;
        private List<String> aliases;
        private Integer year;
        private String externalId;
        private MediaKind kind;

        public Entry() {
            aliases = new ArrayList<>();
            kind = MediaKind.EPISODE;
        }

        public Entry(
            final String title,
            final Integer year,
            final String externalId,
            final MediaKind kind,
            final List<String> aliases
        ) {
            this.title = title;
            this.year = year;
            this.externalId = externalId;
            this.kind = kind;
            this.aliases = new ArrayList<>(aliases);
        }

        public String getTitle() {
            return title;
        }

        public List<String> getAliases() {
            return (aliases == null) ? List.of() : Collections.unmodifiableList(aliases);
        }

        public Integer getYear() {
            return year;
        }

        public String getExternalId() {
            return externalId;
        }

        public MediaKind getKind() {
            return (kind == null) ? MediaKind.UNKNOWN : kind;
        }

        public ShowIdentity toIdentity() {
            return new ShowIdentity(title, year, externalId);
        }
    }

    private final List<Entry> entries;

    public IdentityCatalog() {
        entries = new ArrayList<>();
    }

    public void add(final Entry entry) {
        entries.add(entry);
    }

    public List<Entry> getEntries() {
        return Collections.unmodifiableList(entries);
    }
}
