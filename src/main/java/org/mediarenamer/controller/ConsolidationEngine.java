package org.mediarenamer.controller;

import static org.mediarenamer.model.util.Constants.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.mediarenamer.controller.util.FileUtilities;
import org.mediarenamer.controller.util.StringUtils;
import org.mediarenamer.model.ConsolidationOperation;
import org.mediarenamer.model.ConsolidationResult;
import org.mediarenamer.model.MediaKind;
import org.mediarenamer.model.ShowDirectory;
import org.mediarenamer.model.ShowGroup;
import org.mediarenamer.model.ShowIdentity;

/**
 * Gathers the directories of a show that are scattered across a root directory
 * into one directory per show, with one "Season NN" folder per member.
 *
 * <p>A run goes through four stages, once each: discover the candidate show
 * directories directly under the root, group them by show, confirm each
 * group's identity with the lookup, and merge every group of two or more
 * directories into its unified directory.  Per-directory problems become
 * failed {@link ConsolidationOperation}s; nothing is thrown and nothing is
 * rolled back.
 *
 * <p>In a dry run every decision is made and reported exactly as in a real run,
 * but the file system is not touched.
 */
public class ConsolidationEngine {

    private static final Logger logger = Logger.getLogger(
        ConsolidationEngine.class.getName()
    );

    static final String UNIFIED_IS_MEMBER_REASON =
        "Directory is the unified directory itself";
    static final String CREATE_FAILED_REASON = "Could not create season directory";

    private final ShowDirectoryAnalyzer analyzer;
    private final ShowGrouper grouper;
    private final SeasonResolver seasonResolver;
    private final IdentityLookup identityLookup;
    private final DirectoryMerger merger;

    public ConsolidationEngine(
        final ShowDirectoryAnalyzer analyzer,
        final ShowGrouper grouper,
        final SeasonResolver seasonResolver,
        final IdentityLookup identityLookup,
        final DirectoryMerger merger
    ) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.grouper = Objects.requireNonNull(grouper, "grouper");
        this.seasonResolver = Objects.requireNonNull(seasonResolver, "seasonResolver");
        this.identityLookup = Objects.requireNonNull(identityLookup, "identityLookup");
        this.merger = Objects.requireNonNull(merger, "merger");
    }

    /**
     * Wire an engine with the standard grouping, season and merge behaviour.
     *
     * @param guesser         consulted when a directory name has no season
     * @param identityLookup  confirms group identities
     * @param videoExtensions extensions that mark a directory as holding video
     * @return the engine
     */
    public static ConsolidationEngine create(
        final FilenameGuesser guesser,
        final IdentityLookup identityLookup,
        final Collection<String> videoExtensions
    ) {
        return new ConsolidationEngine(
            new ShowDirectoryAnalyzer(new TitleNormalizer(), guesser, videoExtensions),
            new ShowGrouper(),
            new SeasonResolver(),
            identityLookup,
            new DirectoryMerger()
        );
    }

    /**
     * Run all four stages over the given root.
     *
     * @param root   the directory whose immediate subdirectories are examined
     * @param dryRun if true, decide and report but do not touch the file system
     * @return one result per consolidated group, in grouping order; empty if the
     *   root is missing or not a directory
     */
    public List<ConsolidationResult> consolidate(final Path root, final boolean dryRun) {
        if (root == null || !Files.isDirectory(root)) {
            logger.warning("not a directory, nothing to consolidate: " + root);
            return List.of();
        }
        logger.info("Scanning directory: " + root + (dryRun ? " (dry run)" : ""));

        List<ShowDirectory> discovered = discover(root);
        if (discovered.isEmpty()) {
            logger.info("No TV show directories found");
            return List.of();
        }

        List<ShowGroup> groups = grouper.group(discovered);
        enhance(groups);

        List<ConsolidationResult> results = new ArrayList<>();
        for (ShowGroup group : groups) {
            if (group.size() < 2) {
                logger.fine("single directory for " + group.getCanonicalTitle() + "; leaving it");
                continue;
            }
            results.add(consolidateGroup(group, root, dryRun));
        }
        return results;
    }

    List<ShowDirectory> discover(final Path root) {
        List<ShowDirectory> found = new ArrayList<>();
        for (Path dir : FileUtilities.listSubdirectories(root)) {
            analyzer.analyze(dir).ifPresent(found::add);
        }
        logger.info("Found " + found.size() + " potential TV show directories");
        return found;
    }

    void enhance(final List<ShowGroup> groups) {
        for (ShowGroup group : groups) {
            ShowDirectory representative = group.getSeed();
            Optional<ShowIdentity> identity;
            try {
                identity = identityLookup.lookup(
                    representative.rawTitle(),
                    representative.year(),
                    MediaKind.EPISODE
                );
            } catch (RuntimeException re) {
                logger.log(
                    Level.WARNING,
                    "identity lookup failed for " + representative.rawTitle(),
                    re
                );
                identity = Optional.empty();
            }

            if (identity.isPresent()) {
                group.enhance(identity.get());
                logger.info(
                    "Enhanced group: " + group.getCanonicalTitle() + " (" +
                        group.getYear() + ") [id-" + group.getExternalId() + "]"
                );
            } else {
                logger.info(
                    "No identity found for " + representative.rawTitle() +
                        "; keeping discovered title"
                );
            }
        }
    }

    private ConsolidationResult consolidateGroup(
        final ShowGroup group,
        final Path root,
        final boolean dryRun
    ) {
        Path unifiedPath = root.resolve(unifiedDirectoryName(group));
        logger.info(
            "Consolidating " + group.size() + " directories into: " +
                unifiedPath.getFileName()
        );

        if (dryRun) {
            logger.info("DRY RUN: Would create directory: " + unifiedPath);
        }

        List<ConsolidationOperation> operations = new ArrayList<>();
        for (ShowDirectory member : group.getMembers()) {
            operations.add(consolidateMember(member, group, unifiedPath, dryRun));
        }

        return new ConsolidationResult(
            group.getCanonicalTitle(),
            unifiedPath,
            group.getExternalId(),
            operations
        );
    }

    private ConsolidationOperation consolidateMember(
        final ShowDirectory member,
        final ShowGroup group,
        final Path unifiedPath,
        final boolean dryRun
    ) {
        Path source = member.path();
        if (unifiedPath.startsWith(source)) {
            logger.warning(source + " is, or contains, the unified directory; leaving it");
            return ConsolidationOperation.failed(source, UNIFIED_IS_MEMBER_REASON);
        }

        OptionalInt season = seasonResolver.resolve(member, group);
        if (season.isEmpty()) {
            logger.warning("Could not determine season for " + source);
            return ConsolidationOperation.failed(source, UNRESOLVED_SEASON_REASON);
        }

        Path seasonDir = unifiedPath.resolve(seasonFolderName(season.getAsInt()));
        if (dryRun) {
            logger.info("DRY RUN: Would create season directory: " + seasonDir);
            logger.info("DRY RUN: Would move contents from " + source + " to " + seasonDir);
            return ConsolidationOperation.succeeded(source, seasonDir, season.getAsInt());
        }

        if (!FileUtilities.ensureDirectory(seasonDir)) {
            return ConsolidationOperation.failed(source, CREATE_FAILED_REASON);
        }
        DirectoryMerger.Summary summary = merger.merge(source, seasonDir);
        logger.info(
            "Merged " + source + " into " + seasonDir + ": " + summary.moved() +
                " moved, " + summary.skipped() + " skipped"
        );
        return ConsolidationOperation.succeeded(source, seasonDir, season.getAsInt());
    }

    /**
     * @param group a group whose identity is settled
     * @return "{Title}[ (Year)][ [id-{ExternalId}]]", where a title with nothing
     *   left after sanitising is replaced by the seed directory's name
     */
    static String unifiedDirectoryName(final ShowGroup group) {
        String title = StringUtils.sanitiseDirectoryName(group.getCanonicalTitle());
        if (title.isEmpty()) {
            title = group.getSeed().path().getFileName().toString();
            logger.warning(
                "title \"" + group.getCanonicalTitle() + "\" is not usable as a directory name; using " +
                    title
            );
        }
        StringBuilder name = new StringBuilder(title);
        if (group.getYear() != null) {
            name.append(" (").append(group.getYear()).append(')');
        }
        if (group.getExternalId() != null && !group.getExternalId().isBlank()) {
            name.append(" [id-").append(group.getExternalId()).append(']');
        }
        return name.toString();
    }

    static String seasonFolderName(final int season) {
        return DEFAULT_SEASON_PREFIX + StringUtils.zeroPadTwoDigits(season);
    }
}
