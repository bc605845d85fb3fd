package org.mediarenamer.controller;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mediarenamer.model.QualityProfile;
import org.mediarenamer.model.TrackSummary;

public class QualityClassifierTest {

    private final QualityClassifier textOnly = new QualityClassifier(TechnicalProbe.UNAVAILABLE);

    @TempDir
    Path tempFolder;

    /** Probe that always reports the same tracks, and counts its calls. */
    private static class FixedProbe implements TechnicalProbe {

        private final TrackSummary tracks;
        final AtomicInteger calls = new AtomicInteger();

        FixedProbe(TrackSummary tracks) {
            this.tracks = tracks;
        }

        @Override
        public Optional<TrackSummary> probe(Path file) {
            calls.incrementAndGet();
            return Optional.ofNullable(tracks);
        }
    }

    @Test
    @DisplayName("Every attribute of a fully tagged episode name")
    public void testSupernaturalRelease() {
        QualityProfile profile = textOnly.classifyFromText(
            "Supernatural (2005) - S01E01 - Pilot [AMZN WEBDL-1080p Proper][EAC3 2.0][h264]-Kitsune.mkv"
        );
        assertEquals("1080p", profile.getResolution());
        assertEquals("h264", profile.getVideoCodec());
        assertEquals("EAC3", profile.getAudioCodec());
        assertEquals("2.0", profile.getAudioChannels());
        assertEquals("AMZN WEBDL", profile.getSource());
        assertTrue(profile.getQualityTags().contains("Proper"));
        assertEquals("Kitsune", profile.getReleaseGroup());
    }

    @Test
    public void testDottedScene() {
        QualityProfile profile = textOnly.classifyFromText(
            "The.Expanse.S02E05.720p.HDTV.x265-GRP.mkv"
        );
        assertEquals("720p", profile.getResolution());
        assertEquals("h265", profile.getVideoCodec());
        assertEquals("HDTV", profile.getSource());
        assertEquals("GRP", profile.getReleaseGroup());
        assertTrue(profile.getQualityTags().isEmpty());
    }

    @Test
    public void testUltraHdIsReportedAs4K() {
        assertEquals(
            "4K",
            textOnly.classifyFromText("Movie.2019.2160p.BluRay.HEVC-X.mkv").getResolution()
        );
        assertEquals(
            "4K",
            textOnly.classifyFromText("Movie 2019 4K BluRay").getResolution()
        );
    }

    @Test
    @DisplayName("DD5.1 gives channels but no DD codec; DDP7.1 gives DDP and 7.1")
    public void testDolbyDigitalTokensDoNotCollide() {
        QualityProfile dd51 = textOnly.classifyFromText(
            "Show.S01E01.1080p.WEB-DL.DD5.1.H.264-GRP.mkv"
        );
        assertNotEquals("DD", dd51.getAudioCodec());
        assertEquals("5.1", dd51.getAudioChannels());
        assertEquals("WEBDL", dd51.getSource());
        assertEquals("GRP", dd51.getReleaseGroup());

        QualityProfile ddp71 = textOnly.classifyFromText(
            "Show.S01E01.1080p.WEB.DDP7.1.x264-GRP.mkv"
        );
        assertEquals("DDP", ddp71.getAudioCodec());
        assertEquals("7.1", ddp71.getAudioChannels());

        QualityProfile plainDd = textOnly.classifyFromText(
            "Show.S01E01.720p.HDTV.DD.2.0.x264-GRP.mkv"
        );
        assertEquals("DD", plainDd.getAudioCodec());
        assertEquals("2.0", plainDd.getAudioChannels());
    }

    @Test
    @DisplayName("A name carrying both DD5.1 and DDP7.1 agrees on DDP 7.1, in either order")
    public void testBothDolbyDigitalTokensInOneName() {
        for (String name : List.of(
            "Show.S01E01.DDP7.1.DD5.1.x264-GRP.mkv",
            "Show.S01E01.DD5.1.DDP7.1.x264-GRP.mkv"
        )) {
            QualityProfile profile = textOnly.classifyFromText(name);
            assertEquals("DDP", profile.getAudioCodec(), name);
            assertEquals("7.1", profile.getAudioChannels(), name);
        }
    }

    @Test
    public void testPlatformAloneBecomesSource() {
        QualityProfile profile = textOnly.classifyFromText("Show.S01E01.1080p.NF.x264-GRP.mkv");
        assertEquals("NF", profile.getSource());
        assertEquals("1080p", profile.getResolution());
        assertEquals("GRP", profile.getReleaseGroup());
    }

    @Test
    public void testQualityTagsAreCumulative() {
        QualityProfile profile = textOnly.classifyFromText(
            "Film.2010.Extended.REPACK.PROPER.1080p.BluRay.x264-GRP.mkv"
        );
        assertEquals(List.of("PROPER", "REPACK", "Extended"), profile.getQualityTags());
    }

    @Test
    public void testTransportStreamExtensionIsNotASource() {
        QualityProfile profile = textOnly.classifyFromText("recording.ts");
        assertNull(profile.getSource());
    }

    @Test
    public void testHyphenatedSourceIsNotAReleaseGroup() {
        QualityProfile profile = textOnly.classifyFromText("Show S01E01 1080p WEB-DL");
        assertEquals("WEBDL", profile.getSource());
        assertNull(profile.getReleaseGroup());
    }

    @Test
    public void testBracketedReleaseGroup() {
        QualityProfile profile = textOnly.classifyFromText(
            "[SubGroup] Anime Show - 01 [1080p][HEVC].mkv"
        );
        assertEquals("SubGroup", profile.getReleaseGroup());
        assertEquals("h265", profile.getVideoCodec());
    }

    @Test
    public void testNothingRecognised() {
        assertTrue(textOnly.classifyFromText("holiday video.mkv").isEmpty());
        assertTrue(textOnly.classifyFromText("").isEmpty());
        assertTrue(textOnly.classifyFromText(null).isEmpty());
    }

    @Test
    public void testFormatSourceResolutionCodecGroup() {
        QualityProfile profile = new QualityProfile.Builder()
            .source("BluRay")
            .resolution("1080p")
            .videoCodec("h264")
            .releaseGroup("GROUP")
            .build();
        assertEquals("[BluRay-1080p][h264]-GROUP", QualityClassifier.format(profile));
    }

    @Test
    public void testFormatWithTagsAndAudio() {
        QualityProfile profile = new QualityProfile.Builder()
            .source("WEBDL")
            .resolution("720p")
            .qualityTags(List.of("Proper"))
            .audioCodec("AAC")
            .audioChannels("2.0")
            .build();
        assertEquals("[WEBDL-720p Proper][AAC 2.0]", QualityClassifier.format(profile));
    }

    @Test
    public void testFormatPartialProfiles() {
        assertEquals(
            "[HDTV]",
            QualityClassifier.format(new QualityProfile.Builder().source("HDTV").build())
        );
        assertEquals(
            "[720p]",
            QualityClassifier.format(new QualityProfile.Builder().resolution("720p").build())
        );
        assertEquals(
            "[DTS]",
            QualityClassifier.format(new QualityProfile.Builder().audioCodec("DTS").build())
        );
        assertEquals("", QualityClassifier.format(QualityProfile.EMPTY));
    }

    @Test
    public void testFormatAtmos() {
        QualityProfile taggedAtmos = new QualityProfile.Builder()
            .audioCodec("Atmos")
            .audioChannels("7.1")
            .qualityTags(List.of("Atmos"))
            .build();
        assertEquals("[7.1]", QualityClassifier.format(taggedAtmos));

        QualityProfile untaggedAtmos = new QualityProfile.Builder()
            .audioCodec("Atmos")
            .audioChannels("7.1")
            .build();
        assertEquals("[Atmos 7.1]", QualityClassifier.format(untaggedAtmos));

        QualityProfile atmosNoChannels = new QualityProfile.Builder()
            .audioCodec("Atmos")
            .build();
        assertEquals("[Atmos]", QualityClassifier.format(atmosNoChannels));

        QualityProfile atmosTaggedNoChannels = new QualityProfile.Builder()
            .audioCodec("Atmos")
            .qualityTags(List.of("Atmos"))
            .build();
        assertEquals("", QualityClassifier.format(atmosTaggedNoChannels));
    }

    @Test
    public void testInformativeNameIsNotProbed() throws IOException {
        Path file = Files.writeString(tempFolder.resolve("Show.S01E01.1080p.BluRay.x264-GRP.mkv"), "x");
        FixedProbe probe = new FixedProbe(new TrackSummary(720, "HEVC", "AAC", 2));

        QualityProfile profile = new QualityClassifier(probe).classify(file);
        assertEquals(0, probe.calls.get());
        assertEquals("1080p", profile.getResolution());
        assertEquals("h264", profile.getVideoCodec());
    }

    @Test
    public void testUninformativeNameFallsBackToProbe() throws IOException {
        Path file = Files.writeString(tempFolder.resolve("episode one [720p].mkv"), "x");
        FixedProbe probe = new FixedProbe(new TrackSummary(1080, "AVC", "AC-3", 6));

        QualityProfile profile = new QualityClassifier(probe).classify(file);
        assertEquals(1, probe.calls.get());
        // The name's own values win over the probe's.
        assertEquals("720p", profile.getResolution());
        assertEquals("h264", profile.getVideoCodec());
        assertEquals("AC-3", profile.getAudioCodec());
        assertEquals("5.1", profile.getAudioChannels());
    }

    @Test
    public void testClassifyFromProbe() throws IOException {
        Path file = Files.writeString(tempFolder.resolve("a.mkv"), "x");
        QualityClassifier classifier = new QualityClassifier(
            new FixedProbe(new TrackSummary(2160, "HEVC", "TrueHD", 8))
        );
        QualityProfile profile = classifier.classifyFromProbe(file);
        assertEquals("4K", profile.getResolution());
        assertEquals("h265", profile.getVideoCodec());
        assertEquals("TrueHD", profile.getAudioCodec());
        assertEquals("7.1", profile.getAudioChannels());
        assertNull(profile.getSource());
    }

    @Test
    public void testClassifyFromProbeSoftFailures() throws IOException {
        Path file = Files.writeString(tempFolder.resolve("a.mkv"), "x");

        assertTrue(textOnly.classifyFromProbe(file).isEmpty(), "unavailable probe");

        QualityClassifier silent = new QualityClassifier(new FixedProbe(null));
        assertTrue(silent.classifyFromProbe(file).isEmpty(), "probe reporting nothing");

        FixedProbe probe = new FixedProbe(new TrackSummary(1080, "AVC", null, null));
        assertTrue(
            new QualityClassifier(probe).classifyFromProbe(tempFolder.resolve("missing.mkv")).isEmpty(),
            "missing file"
        );
        assertEquals(0, probe.calls.get());

        QualityClassifier throwing = new QualityClassifier(f -> {
            throw new IllegalStateException("boom");
        });
        assertTrue(throwing.classifyFromProbe(file).isEmpty(), "throwing probe");
    }

    @Test
    public void testHelpers() {
        assertEquals("h264", QualityClassifier.normalizeVideoCodec("x264"));
        assertEquals("h265", QualityClassifier.normalizeVideoCodec("HEVC"));
        assertEquals("VP9", QualityClassifier.normalizeVideoCodec("VP9"));

        assertEquals("BluRay", QualityClassifier.normalizeSource("Blu-Ray"));
        assertEquals("BDRIP", QualityClassifier.normalizeSource("BDRip"));
        assertEquals("WEBDL", QualityClassifier.normalizeSource("web.dl"));

        assertEquals("480p", QualityClassifier.resolutionForHeight(576));
        assertNull(QualityClassifier.resolutionForHeight(360));
        assertEquals("Mono", QualityClassifier.channelLayout(1));
        assertNull(QualityClassifier.channelLayout(3));
    }
}
