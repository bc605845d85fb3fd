package org.mediarenamer.controller;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.mediarenamer.controller.util.StringUtils;
import org.mediarenamer.model.FilenameGuess;
import org.mediarenamer.model.MediaKind;

/**
 * Default {@link FilenameGuesser}: an ordered list of the patterns episode
 * filenames commonly follow, plus a year pattern for movies.
 *
 * <p>The show title is whatever precedes the season/episode token (or, for a
 * movie, the year); the episode title is whatever follows the token, up to the
 * first quality token.
 */
public class FilenameParser implements FilenameGuesser {

    private static final Logger logger = Logger.getLogger(
        FilenameParser.class.getName()
    );

    // Each pattern captures season (1) and episode (2).  Order matters: the
    // first one found anywhere in the name wins.
    private static final List<Pattern> SEASON_EPISODE_PATTERNS = List.of(
        // S01E02, s1e2, S01.E02, S01 E02
        Pattern.compile("\\b[sS](\\d{1,2})[ ._-]?[eE](\\d{1,3})"),
        // Season 1 Episode 2, Season.01.Episode.02
        Pattern.compile(
            "\\bSeason[ ._-]?(\\d{1,2})[ ._-]*Episode[ ._-]?(\\d{1,3})",
            Pattern.CASE_INSENSITIVE
        ),
        // 1x02
        Pattern.compile("\\b(\\d{1,2})[xX](\\d{2,3})\\b")
    );

    private static final Pattern YEAR = Pattern.compile(
        "\\b((?:19|20)\\d{2})\\b"
    );
    private static final Pattern PARENTHESISED_YEAR = Pattern.compile(
        "[(\\[]?\\b(?:19|20)\\d{2}\\b[)\\]]?"
    );

    private static final Pattern EXTENSION = Pattern.compile(
        "\\.[A-Za-z0-9]{2,4}$"
    );
    private static final Pattern BRACKETED = Pattern.compile("\\[[^\\]]*\\]");
    private static final Pattern SEPARATORS = Pattern.compile("[._]+");
    private static final Pattern EDGE_JUNK = Pattern.compile(
        "^[\\s\\-–(]+|[\\s\\-–(]+$"
    );

    // Where an episode title stops.
    private static final Pattern QUALITY_START = Pattern.compile(
        "\\[|\\b(?:2160p|1080p|720p|480p|4K|WEB|WEBDL|WEB-DL|WEBRip|BluRay|HDTV|DVDRip|" +
            "x264|h264|x265|h265|HEVC|PROPER|REPACK)\\b",
        Pattern.CASE_INSENSITIVE
    );

    @Override
    public FilenameGuess guess(final String filename) {
        if (filename == null || filename.isBlank()) {
            return FilenameGuess.NOTHING;
        }
        try {
            return parse(filename);
        } catch (RuntimeException re) {
            logger.log(Level.FINE, "could not parse filename " + filename, re);
            return FilenameGuess.NOTHING;
        }
    }

    private FilenameGuess parse(final String filename) {
        String stem = EXTENSION.matcher(filename).replaceFirst("");

        Integer year = null;
        Matcher yearMatcher = YEAR.matcher(stem);
        if (yearMatcher.find()) {
            year = Integer.valueOf(yearMatcher.group(1));
        }

        for (Pattern pattern : SEASON_EPISODE_PATTERNS) {
            Matcher matcher = pattern.matcher(stem);
            if (matcher.find()) {
                int season = Integer.parseInt(matcher.group(1));
                int episode = Integer.parseInt(matcher.group(2));
                String title = cleanTitle(stem.substring(0, matcher.start()));
                String episodeTitle = extractEpisodeTitle(
                    stem.substring(matcher.end())
                );
                logger.fine(
                    "parsed '" + filename + "' as " + title + " S" + season + "E" + episode
                );
                return new FilenameGuess(
                    title,
                    year,
                    season,
                    episode,
                    episodeTitle,
                    MediaKind.EPISODE
                );
            }
        }

        if (year != null) {
            String title = cleanTitle(stem.substring(0, yearMatcher.start()));
            if (title == null) {
                title = cleanTitle(stem.substring(yearMatcher.end()));
            }
            return new FilenameGuess(title, year, null, null, null, MediaKind.MOVIE);
        }

        return new FilenameGuess(
            cleanTitle(stem),
            null,
            null,
            null,
            null,
            MediaKind.UNKNOWN
        );
    }

    private static String extractEpisodeTitle(final String rest) {
        Matcher quality = QUALITY_START.matcher(rest);
        String candidate = quality.find() ? rest.substring(0, quality.start()) : rest;
        return cleanTitle(candidate);
    }

    private static String cleanTitle(final String raw) {
        String title = BRACKETED.matcher(raw).replaceAll(" ");
        title = SEPARATORS.matcher(title).replaceAll(" ");
        String withoutYear = PARENTHESISED_YEAR.matcher(title).replaceAll(" ");
        if (!withoutYear.isBlank()) {
            title = withoutYear;
        }
        title = StringUtils.collapseWhitespace(title);
        title = EDGE_JUNK.matcher(title).replaceAll("");
        return title.isEmpty() ? null : title;
    }
}
