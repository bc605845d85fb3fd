package org.mediarenamer.controller.metadata;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.xml.xpath.XPathExpressionException;
import org.mediarenamer.controller.TechnicalProbe;
import org.mediarenamer.controller.util.ExternalToolDetector;
import org.mediarenamer.controller.util.ExternalToolDetector.ToolLocations;
import org.mediarenamer.controller.util.ProcessRunner;
import org.mediarenamer.controller.util.XPathUtilities;
import org.mediarenamer.model.TrackSummary;
import org.w3c.dom.Document;

/**
 * Reads track information from a media container using the MediaInfo CLI.
 *
 * <p>If mediainfo is not installed, every probe comes back empty and
 * {@link #isAvailable()} is false.
 */
public class MediaInfoProbe implements TechnicalProbe {

    private static final Logger logger = Logger.getLogger(MediaInfoProbe.class.getName());

    static final ToolLocations MEDIAINFO_LOCATIONS = new ToolLocations(
        List.of("mediainfo"),
        List.of(
            "C:\\Program Files\\MediaInfo\\MediaInfo.exe",
            "C:\\Program Files (x86)\\MediaInfo\\MediaInfo.exe"
        ),
        List.of("/opt/homebrew/bin/mediainfo", "/usr/local/bin/mediainfo"),
        List.of("/usr/bin/mediainfo", "/usr/local/bin/mediainfo", "/snap/bin/mediainfo")
    );

    private static final String VIDEO_TRACK = "(//track[@type='Video'])[1]";
    private static final String AUDIO_TRACK = "(//track[@type='Audio'])[1]";

    private static final Pattern LEADING_DIGITS = Pattern.compile("^\\s*(\\d{1,9})");

    private final String executable;
    private final int timeoutSeconds;

    /**
     * @param executable     the mediainfo executable; empty means not installed
     * @param timeoutSeconds how long one probe may run
     */
    public MediaInfoProbe(final String executable, final int timeoutSeconds) {
        this.executable = (executable == null) ? "" : executable;
        this.timeoutSeconds = timeoutSeconds;
    }

    /**
     * Use the configured executable, or look for mediainfo if none is configured.
     *
     * @param configured     the executable from the preferences; may be empty
     * @param timeoutSeconds how long one probe may run
     * @return the probe
     */
    public static MediaInfoProbe detect(final String configured, final int timeoutSeconds) {
        String exe = configured;
        if (exe == null || exe.isBlank()) {
            exe = ExternalToolDetector.detect(MEDIAINFO_LOCATIONS);
        }
        if (exe.isEmpty()) {
            logger.info("mediainfo not found; quality will be read from filenames only");
        } else {
            logger.fine("using mediainfo at " + exe);
        }
        return new MediaInfoProbe(exe, timeoutSeconds);
    }

    @Override
    public boolean isAvailable() {
        return !executable.isEmpty();
    }

    @Override
    public Optional<TrackSummary> probe(final Path file) {
        if (!isAvailable()) {
            return Optional.empty();
        }
        if (file == null || !Files.isRegularFile(file)) {
            logger.fine("nothing to probe at " + file);
            return Optional.empty();
        }

        ProcessRunner.Result result = ProcessRunner.runForOutput(
            List.of(executable, "--Output=XML", file.toString()),
            timeoutSeconds
        );
        if (!result.success()) {
            logger.fine("mediainfo failed on " + file + " (exit " + result.exitCode() + ")");
            return Optional.empty();
        }
        return parseReport(result.output());
    }

    /**
     * Pull the first video and first audio track out of a mediainfo XML report.
     *
     * @param xml the report
     * @return the track facts, or empty if the report is malformed or lists no tracks
     */
    static Optional<TrackSummary> parseReport(final String xml) {
        if (xml == null || xml.isBlank()) {
            return Optional.empty();
        }
        try {
            Document doc = XPathUtilities.parse(xml);
            Integer height = leadingNumber(
                XPathUtilities.nodeTextValue(VIDEO_TRACK + "/Height", doc)
            );
            String videoFormat = trimmed(
                XPathUtilities.nodeTextValue(VIDEO_TRACK + "/Format", doc)
            );
            String audioFormat = trimmed(
                XPathUtilities.nodeTextValue(AUDIO_TRACK + "/Format", doc)
            );
            String channels = XPathUtilities.nodeTextValue(AUDIO_TRACK + "/Channels", doc);
            if (channels == null) {
                // Older releases name the element after the "Channel(s)" label.
                channels = XPathUtilities.nodeTextValue(AUDIO_TRACK + "/Channel_s_", doc);
            }

            if (height == null && videoFormat == null && audioFormat == null && channels == null) {
                return Optional.empty();
            }
            return Optional.of(
                new TrackSummary(height, videoFormat, audioFormat, leadingNumber(channels))
            );
        } catch (IOException | XPathExpressionException e) {
            logger.log(Level.FINE, "could not read mediainfo report", e);
            return Optional.empty();
        }
    }

    private static String trimmed(final String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static Integer leadingNumber(final String value) {
        if (value == null) {
            return null;
        }
        // "1 080 pixels" in the text report; the XML report has plain digits.
        Matcher matcher = LEADING_DIGITS.matcher(value.replace(" ", ""));
        if (matcher.find()) {
            return Integer.valueOf(matcher.group(1));
        }
        return null;
    }
}
