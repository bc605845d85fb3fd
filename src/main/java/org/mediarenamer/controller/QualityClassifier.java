package org.mediarenamer.controller;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.mediarenamer.controller.util.StringUtils;
import org.mediarenamer.model.QualityProfile;
import org.mediarenamer.model.TrackSummary;

/**
 * Works out the technical quality of a media file, mostly from its name.
 *
 * <p>Each attribute has an ordered list of rules: a case-insensitive pattern
 * whose first group is the captured value, and a normalizer applied to that
 * value.  For single-valued attributes the first rule that matches anywhere in
 * the name wins; quality tags collect every match of every rule, in rule order.
 *
 * <p>When the name yields fewer than two of resolution, video codec and source,
 * the file itself is probed and the probe fills the gaps.
 */
public class QualityClassifier {

    private static final Logger logger = Logger.getLogger(
        QualityClassifier.class.getName()
    );

    private record Rule(Pattern pattern, UnaryOperator<String> normalizer) {

        static Rule of(final String regex) {
            return of(regex, UnaryOperator.identity());
        }

        static Rule of(final String regex, final UnaryOperator<String> normalizer) {
            return new Rule(
                Pattern.compile(regex, Pattern.CASE_INSENSITIVE),
                normalizer
            );
        }

        String firstMatch(final String text) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return normalizer.apply(matcher.group(1));
            }
            return null;
        }
    }

    private static final List<Rule> RESOLUTION_RULES = List.of(
        Rule.of("\\b(2160p|4K)\\b", value -> "4K"),
        Rule.of("\\b(1080p)\\b"),
        Rule.of("\\b(720p)\\b"),
        Rule.of("\\b(480p)\\b"),
        Rule.of("\\b(360p)\\b")
    );

    private static final List<Rule> VIDEO_CODEC_RULES = List.of(
        Rule.of("\\b(h264|x264|AVC)\\b", QualityClassifier::normalizeVideoCodec),
        Rule.of("\\b(h265|x265|HEVC)\\b", QualityClassifier::normalizeVideoCodec),
        Rule.of("\\b(XviD)\\b"),
        Rule.of("\\b(DivX)\\b")
    );

    // "DDP" and "DD" come last; "DD" must not fire inside "DDP" or "DD5.1",
    // which belong to the channel rules.
    private static final List<Rule> AUDIO_CODEC_RULES = List.of(
        Rule.of("\\b(DTS-HD|DTS-X|DTS)\\b"),
        Rule.of("\\b(TrueHD|Atmos)\\b"),
        Rule.of("\\b(EAC3|E-AC-3)\\b"),
        Rule.of("\\b(AC3|AC-3)\\b"),
        Rule.of("\\b(AAC)\\b"),
        Rule.of("\\b(MP3)\\b"),
        Rule.of("\\b(FLAC)\\b"),
        Rule.of("\\b(DDP)(?=\\d|\\b)"),
        Rule.of("\\b(DD)(?![0-9P])\\b")
    );

    private static final List<Rule> AUDIO_CHANNEL_RULES = List.of(
        Rule.of("\\b(7\\.1|7\\.0)\\b"),
        Rule.of("\\b(5\\.1|5\\.0)\\b"),
        Rule.of("\\b(2\\.1|2\\.0)\\b"),
        Rule.of("\\b(Stereo)\\b"),
        Rule.of("\\b(Mono)\\b"),
        Rule.of("\\bDDP(5\\.1|7\\.1|2\\.0)(?!\\d)"),
        Rule.of("\\bDD(5\\.1|7\\.1|2\\.0)(?!\\d)")
    );

    private static final List<Rule> SOURCE_RULES = List.of(
        Rule.of("\\b(WEBDL|WEB-DL|WEB\\.DL)\\b", QualityClassifier::normalizeSource),
        Rule.of("\\b(WEBRip|WEB-Rip|WEB\\.Rip)\\b", QualityClassifier::normalizeSource),
        Rule.of("\\b(WEB)\\b", QualityClassifier::normalizeSource),
        Rule.of("\\b(BluRay|Blu-Ray|BDRip|BD)\\b", QualityClassifier::normalizeSource),
        Rule.of("\\b(HDTV|HDTVRip)\\b", QualityClassifier::normalizeSource),
        Rule.of("\\b(DVDRip|DVD)\\b", QualityClassifier::normalizeSource),
        Rule.of("\\b(CAM|TS|TC)\\b", QualityClassifier::normalizeSource),
        Rule.of("\\b(HDRIP)\\b", QualityClassifier::normalizeSource)
    );

    private static final List<Rule> QUALITY_TAG_RULES = List.of(
        Rule.of("\\b(Proper)\\b"),
        Rule.of("\\b(Repack)\\b"),
        Rule.of("\\b(Extended)\\b"),
        Rule.of("\\b(Director'?s?[ .]?Cut)\\b"),
        Rule.of("\\b(Uncut)\\b"),
        Rule.of("\\b(Internal)\\b"),
        Rule.of("\\b(HDR10|HDR|DV|Dolby[ .]?Vision)\\b"),
        Rule.of("\\b(Atmos)\\b"),
        Rule.of("\\b(IMAX)\\b")
    );

    private static final List<Rule> PLATFORM_RULES = List.of(
        Rule.of("\\b(AMZN|Amazon)\\b"),
        Rule.of("\\b(NF|Netflix)\\b"),
        Rule.of("\\b(HULU)\\b"),
        Rule.of("\\b(HBO|Max)\\b"),
        Rule.of("\\b(DSNP|Disney)\\b"),
        Rule.of("\\b(ATVP|AppleTV)\\b")
    );

    // "-Group" right before the extension (or at the very end).
    private static final Pattern TRAILING_GROUP = Pattern.compile(
        "(\\w*)-([A-Za-z0-9]+)(?:\\.[A-Za-z0-9]+)?$"
    );
    private static final Pattern BRACKETED_GROUP = Pattern.compile(
        "\\[([A-Za-z][A-Za-z0-9]*)\\]"
    );

    // Container extensions are stripped before matching so that ".ts" is not
    // taken for a telesync source.
    private static final Pattern MEDIA_EXTENSION = Pattern.compile(
        "\\.(mkv|mp4|avi|mov|wmv|flv|webm|m4v|ts|m2ts|mpg|mpeg|vob|srt|sub)$",
        Pattern.CASE_INSENSITIVE
    );

    private final TechnicalProbe probe;

    public QualityClassifier(final TechnicalProbe probe) {
        this.probe = (probe == null) ? TechnicalProbe.UNAVAILABLE : probe;
    }

    /**
     * Classify a file: from its name if the name is informative enough,
     * otherwise from its name merged with a probe of its contents.
     *
     * @param file the media file
     * @return the profile; never null
     */
    public QualityProfile classify(final Path file) {
        Path name = file.getFileName();
        QualityProfile fromText = classifyFromText(
            (name == null) ? "" : name.toString()
        );
        if (fromText.hasEssentials()) {
            return fromText;
        }
        logger.fine("filename of " + file + " is not informative; probing");
        return fromText.mergedWith(classifyFromProbe(file));
    }

    /**
     * Classify purely from a name.
     *
     * @param name a bare filename (or any release-style string)
     * @return the profile; never null
     */
    public QualityProfile classifyFromText(final String name) {
        if (name == null || name.isBlank()) {
            return QualityProfile.EMPTY;
        }
        String text = MEDIA_EXTENSION.matcher(name).replaceFirst("");

        String source = firstMatch(text, SOURCE_RULES);
        String platform = firstMatch(text, PLATFORM_RULES);
        if (platform != null) {
            source = (source == null) ? platform : platform + " " + source;
        }

        QualityProfile profile = new QualityProfile.Builder()
            .resolution(firstMatch(text, RESOLUTION_RULES))
            .videoCodec(firstMatch(text, VIDEO_CODEC_RULES))
            .audioCodec(firstMatch(text, AUDIO_CODEC_RULES))
            .audioChannels(firstMatch(text, AUDIO_CHANNEL_RULES))
            .source(source)
            .qualityTags(allMatches(text, QUALITY_TAG_RULES))
            .releaseGroup(findReleaseGroup(name))
            .build();

        logger.fine("classified '" + name + "' as " + profile);
        return profile;
    }

    /**
     * Classify from the container's tracks.  Never throws: a missing file, an
     * unavailable probe or a probe failure all give an empty profile.
     *
     * @param file the media file
     * @return the profile; never null
     */
    public QualityProfile classifyFromProbe(final Path file) {
        if (!probe.isAvailable()) {
            logger.fine("technical probe not available, cannot analyze " + file);
            return QualityProfile.EMPTY;
        }
        if (file == null || Files.notExists(file)) {
            logger.warning("File does not exist: " + file);
            return QualityProfile.EMPTY;
        }

        Optional<TrackSummary> summary;
        try {
            summary = probe.probe(file);
        } catch (RuntimeException re) {
            logger.log(Level.WARNING, "Error probing " + file, re);
            return QualityProfile.EMPTY;
        }
        if (summary.isEmpty()) {
            return QualityProfile.EMPTY;
        }

        TrackSummary tracks = summary.get();
        QualityProfile profile = new QualityProfile.Builder()
            .resolution(resolutionForHeight(tracks.videoHeight()))
            .videoCodec(
                (tracks.videoCodec() == null)
                    ? null
                    : normalizeVideoCodec(tracks.videoCodec())
            )
            .audioCodec(tracks.audioCodec())
            .audioChannels(channelLayout(tracks.audioChannels()))
            .build();

        logger.fine("probe of " + file + " gave " + profile);
        return profile;
    }

    /**
     * Render a profile as the bracketed quality suffix used in file names,
     * e.g. {@code [BluRay-1080p][DTS 5.1][h264]-GROUP}.
     *
     * @param profile the profile to render
     * @return the rendering; empty if nothing is set
     */
    public static String format(final QualityProfile profile) {
        StringBuilder out = new StringBuilder();

        String source = profile.getSource();
        String resolution = profile.getResolution();
        if (source != null && resolution != null) {
            out.append('[').append(source).append('-').append(resolution);
            if (!profile.getQualityTags().isEmpty()) {
                out.append(' ').append(String.join(" ", profile.getQualityTags()));
            }
            out.append(']');
        } else if (source != null) {
            out.append('[').append(source).append(']');
        } else if (resolution != null) {
            out.append('[').append(resolution).append(']');
        }

        String audioCodec = profile.getAudioCodec();
        String channels = profile.getAudioChannels();
        boolean isAtmos = "atmos".equalsIgnoreCase(audioCodec);
        boolean atmosTagged = profile
            .getQualityTags()
            .stream()
            .anyMatch("atmos"::equalsIgnoreCase);
        if (audioCodec != null && channels != null) {
            if (isAtmos && atmosTagged) {
                out.append('[').append(channels).append(']');
            } else {
                out.append('[').append(audioCodec).append(' ').append(channels).append(']');
            }
        } else if (audioCodec != null && !isAtmos) {
            out.append('[').append(audioCodec).append(']');
        } else if ("Atmos".equals(audioCodec) && !atmosTagged) {
            out.append('[').append(audioCodec).append(']');
        }

        if (profile.getVideoCodec() != null) {
            out.append('[').append(profile.getVideoCodec()).append(']');
        }

        if (profile.getReleaseGroup() != null) {
            out.append('-').append(profile.getReleaseGroup());
        }

        return out.toString();
    }

    static String normalizeVideoCodec(final String codec) {
        switch (StringUtils.toLower(codec)) {
            case "h264":
            case "x264":
            case "avc":
                return "h264";
            case "h265":
            case "x265":
            case "hevc":
                return "h265";
            default:
                return codec;
        }
    }

    static String normalizeSource(final String source) {
        String lower = StringUtils.toLower(source);
        if (lower.contains("webdl") || lower.contains("web-dl") || lower.contains("web.dl")) {
            return "WEBDL";
        }
        if (lower.contains("webrip") || lower.contains("web-rip") || lower.contains("web.rip")) {
            return "WEBRip";
        }
        if (lower.contains("bluray") || lower.contains("blu-ray")) {
            return "BluRay";
        }
        if (lower.contains("hdtv")) {
            return "HDTV";
        }
        if (lower.contains("dvd")) {
            return "DVD";
        }
        return source.toUpperCase(Locale.ROOT);
    }

    static String resolutionForHeight(final Integer height) {
        if (height == null) {
            return null;
        }
        if (height >= 2160) {
            return "4K";
        }
        if (height >= 1080) {
            return "1080p";
        }
        if (height >= 720) {
            return "720p";
        }
        if (height >= 480) {
            return "480p";
        }
        return null;
    }

    static String channelLayout(final Integer channels) {
        if (channels == null) {
            return null;
        }
        switch (channels) {
            case 8:
                return "7.1";
            case 6:
                return "5.1";
            case 2:
                return "2.0";
            case 1:
                return "Mono";
            default:
                return null;
        }
    }

    private static String firstMatch(final String text, final List<Rule> rules) {
        for (Rule rule : rules) {
            String value = rule.firstMatch(text);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static List<String> allMatches(final String text, final List<Rule> rules) {
        List<String> found = new ArrayList<>();
        for (Rule rule : rules) {
            Matcher matcher = rule.pattern().matcher(text);
            while (matcher.find()) {
                found.add(rule.normalizer().apply(matcher.group(1)));
            }
        }
        return found;
    }

    /**
     * True if the token is itself one of the quality, resolution, codec,
     * audio, source, tag or platform tokens, and so cannot be a group name.
     */
    private static boolean isQualityToken(final String token) {
        for (List<Rule> rules : List.of(
            RESOLUTION_RULES,
            VIDEO_CODEC_RULES,
            AUDIO_CODEC_RULES,
            AUDIO_CHANNEL_RULES,
            SOURCE_RULES,
            QUALITY_TAG_RULES,
            PLATFORM_RULES
        )) {
            for (Rule rule : rules) {
                Matcher matcher = rule.pattern().matcher(token);
                if (matcher.find() && matcher.start() == 0 && matcher.end() == token.length()) {
                    return true;
                }
            }
        }
        return false;
    }

    private static String findReleaseGroup(final String name) {
        Matcher trailing = TRAILING_GROUP.matcher(name);
        if (trailing.find()) {
            String group = trailing.group(2);
            // "WEB-DL", "DTS-HD" and friends end in something that looks like a group.
            String hyphenated = trailing.group(1) + "-" + group;
            if (!isQualityToken(group) && !isQualityToken(hyphenated)) {
                return group;
            }
        }

        Matcher bracketed = BRACKETED_GROUP.matcher(name);
        while (bracketed.find()) {
            String group = bracketed.group(1);
            if (!isQualityToken(group)) {
                return group;
            }
        }
        return null;
    }
}
