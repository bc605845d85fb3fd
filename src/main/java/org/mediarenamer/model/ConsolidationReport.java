package org.mediarenamer.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Written record of one run, saved as XML when the user asks for a report.
 * Paths are held as strings so the file reads the same on every platform.
 */
public class ConsolidationReport {

    public static class Member {

        private String source;
        private String destination;
        private Integer season;
        private boolean success;
        private String error;

        public Member() {
        }

        Member(final ConsolidationOperation operation) {
            source = operation.source().toString();
            destination = (operation.destination() == null)
                ? null
                : operation.destination().toString();
            season = operation.season();
            success = operation.success();
            error = operation.error();
        }

        public String getSource() {
            return source;
        }

        public String getDestination() {
            return destination;
        }

        public Integer getSeason() {
            return season;
        }

        public boolean isSuccess() {
            return success;
        }

        public String getError() {
            return error;
        }
    }

    public static class Show {

        private String title;
        private String unifiedDirectory;
        private String externalId;
        private List<Member> members = new ArrayList<>();

        public Show() {
        }

        Show(final ConsolidationResult result) {
            title = result.showTitle();
            unifiedDirectory = result.unifiedDirectory().toString();
            externalId = result.externalId();
            for (ConsolidationOperation operation : result.operations()) {
                members.add(new Member(operation));
            }
        }

        public String getTitle() {
            return title;
        }

        public String getUnifiedDirectory() {
            return unifiedDirectory;
        }

        public String getExternalId() {
            return externalId;
        }

        public List<Member> getMembers() {
            return (members == null) ? List.of() : Collections.unmodifiableList(members);
        }
    }

    private String root;
    private boolean dryRun;
    private String version;
    private List<Show> shows = new ArrayList<>();

    public ConsolidationReport() {
    }

    public ConsolidationReport(
        final Path root,
        final boolean dryRun,
        final String version,
        final List<ConsolidationResult> results
    ) {
        this.root = root.toString();
        this.dryRun = dryRun;
        this.version = version;
        for (ConsolidationResult result : results) {
            shows.add(new Show(result));
        }
    }

    public String getRoot() {
        return root;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public String getVersion() {
        return version;
    }

    public List<Show> getShows() {
        return (shows == null) ? List.of() : Collections.unmodifiableList(shows);
    }
}
