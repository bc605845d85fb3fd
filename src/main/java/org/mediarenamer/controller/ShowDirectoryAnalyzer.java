package org.mediarenamer.controller;

import static org.mediarenamer.model.util.Constants.*;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.mediarenamer.controller.util.FileUtilities;
import org.mediarenamer.controller.util.StringUtils;
import org.mediarenamer.model.FilenameGuess;
import org.mediarenamer.model.ShowDirectory;

/**
 * Looks at one directory and decides whether it holds a show, and if so which
 * show, which season and which year its name suggests.
 */
public class ShowDirectoryAnalyzer {

    private static final Logger logger = Logger.getLogger(
        ShowDirectoryAnalyzer.class.getName()
    );

    // Stripped from directory names, in this order, to leave the show title.
    private static final Pattern YEAR_TOKEN = Pattern.compile("\\b(?:19|20)\\d{2}\\b");
    private static final Pattern SEASON_WORD_TOKEN = Pattern.compile(
        "season\\s*\\d+",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern SEASON_SHORT_TOKEN = Pattern.compile("\\b[Ss]\\d+");
    private static final Pattern QUALITY_TOKEN = Pattern.compile(
        "\\b(?:2160p|1080p|720p|480p|4K|WEB-DL|WEBDL|WEBRip|WEB|BluRay|HDTV|DVD|" +
            "h264|x264|h265|x265|HEVC)\\b",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern RELEASE_GROUP_SUFFIX = Pattern.compile("-[A-Z0-9]+$");
    private static final Pattern PACK_WORD = Pattern.compile(
        "\\bPack\\b",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern SEPARATOR_RUN = Pattern.compile("[.\\-_]+");

    // Tried in order; the first that yields a positive number is the season.
    // The bare-number rule only accepts a name that is nothing but one or two
    // digits, so a year can never be read as a season.
    private static final List<Pattern> SEASON_PATTERNS = List.of(
        Pattern.compile("season\\s*(\\d{1,2})(?!\\d)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\b[sS](\\d{1,2})(?!\\d)"),
        Pattern.compile("Season\\s*(\\d{1,2})(?!\\d)"),
        Pattern.compile("^\\s*(\\d{1,2})\\s*$")
    );

    private static final Pattern FOUR_DIGITS = Pattern.compile("(?<!\\d)(\\d{4})(?!\\d)");

    private final TitleNormalizer normalizer;
    private final FilenameGuesser guesser;
    private final Set<String> videoExtensions;

    public ShowDirectoryAnalyzer(
        final TitleNormalizer normalizer,
        final FilenameGuesser guesser,
        final Collection<String> videoExtensions
    ) {
        this.normalizer = normalizer;
        this.guesser = guesser;
        this.videoExtensions = new TreeSet<>();
        for (String ext : videoExtensions) {
            this.videoExtensions.add(StringUtils.toLower(ext));
        }
    }

    /**
     * @param directory the directory to analyze
     * @return the show directory record, or empty if the directory holds no
     *   video file at any depth
     */
    public Optional<ShowDirectory> analyze(final Path directory) {
        List<Path> videoFiles = FileUtilities.findVideoFiles(directory, videoExtensions);
        if (videoFiles.isEmpty()) {
            logger.fine("no video files beneath " + directory + "; not a show");
            return Optional.empty();
        }

        String dirName = directory.getFileName().toString();
        String rawTitle = extractTitle(dirName);
        Integer season = extractSeason(dirName);
        Integer year = extractYear(dirName);

        if (season == null) {
            season = inferSeasonFromFiles(videoFiles);
        }

        ShowDirectory showDir = new ShowDirectory(
            directory,
            rawTitle,
            season,
            year,
            normalizer.normalize(rawTitle)
        );
        logger.fine("show directory: " + showDir);
        return Optional.of(showDir);
    }

    static String extractTitle(final String dirName) {
        String cleaned = YEAR_TOKEN.matcher(dirName).replaceAll("");
        cleaned = SEASON_WORD_TOKEN.matcher(cleaned).replaceAll("");
        cleaned = SEASON_SHORT_TOKEN.matcher(cleaned).replaceAll("");
        cleaned = QUALITY_TOKEN.matcher(cleaned).replaceAll("");
        cleaned = RELEASE_GROUP_SUFFIX.matcher(cleaned).replaceAll("");
        cleaned = PACK_WORD.matcher(cleaned).replaceAll("");
        cleaned = SEPARATOR_RUN.matcher(cleaned).replaceAll(" ");
        cleaned = StringUtils.collapseWhitespace(cleaned);
        return cleaned.isEmpty() ? dirName : cleaned;
    }

    static Integer extractSeason(final String dirName) {
        for (Pattern pattern : SEASON_PATTERNS) {
            Matcher matcher = pattern.matcher(dirName);
            if (matcher.find()) {
                int season = Integer.parseInt(matcher.group(1));
                if (season >= 1) {
                    return season;
                }
            }
        }
        return null;
    }

    static Integer extractYear(final String dirName) {
        Matcher matcher = FOUR_DIGITS.matcher(dirName);
        while (matcher.find()) {
            int year = Integer.parseInt(matcher.group(1));
            if (year >= MIN_PLAUSIBLE_YEAR && year <= MAX_PLAUSIBLE_YEAR) {
                return year;
            }
        }
        return null;
    }

    /**
     * Ask the guesser about every video file; adopt a season only if every file
     * that names a season names the same one.
     */
    private Integer inferSeasonFromFiles(final List<Path> videoFiles) {
        Set<Integer> seasons = new TreeSet<>();
        for (Path file : videoFiles) {
            FilenameGuess guess;
            try {
                guess = guesser.guess(file.getFileName().toString());
            } catch (RuntimeException re) {
                logger.log(Level.WARNING, "filename guesser failed on " + file, re);
                continue;
            }
            if (guess != null && guess.season() != null && guess.season() >= 1) {
                seasons.add(guess.season());
            }
        }
        if (seasons.size() == 1) {
            return seasons.iterator().next();
        }
        if (seasons.size() > 1) {
            logger.fine("files disagree on season: " + seasons);
        }
        return null;
    }
}
