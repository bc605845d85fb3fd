package org.mediarenamer.controller.metadata;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mediarenamer.model.TrackSummary;

public class MediaInfoProbeTest {

    private static final String REPORT =
        "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n" +
        "<MediaInfo xmlns=\"https://mediaarea.net/mediainfo\" version=\"2.0\">\n" +
        "<media ref=\"/tv/Show.S01E01.mkv\">\n" +
        "<track type=\"General\"><Format>Matroska</Format></track>\n" +
        "<track type=\"Video\"><Format>AVC</Format><Width>1920</Width><Height>1080</Height></track>\n" +
        "<track type=\"Audio\" typeorder=\"1\"><Format>E-AC-3</Format><Channels>6</Channels></track>\n" +
        "<track type=\"Audio\" typeorder=\"2\"><Format>AAC</Format><Channels>2</Channels></track>\n" +
        "</media>\n" +
        "</MediaInfo>\n";

    @TempDir
    Path tempFolder;

    @Test
    public void testParseReportTakesFirstTracks() {
        Optional<TrackSummary> tracks = MediaInfoProbe.parseReport(REPORT);
        assertEquals(Optional.of(new TrackSummary(1080, "AVC", "E-AC-3", 6)), tracks);
    }

    @Test
    public void testParseOldStyleReport() {
        String old =
            "<Mediainfo version=\"0.7.99\"><File>\n" +
            "<track type=\"Video\"><Format>HEVC</Format><Height>2 160 pixels</Height></track>\n" +
            "<track type=\"Audio\"><Format>DTS</Format><Channel_s_>8 channels</Channel_s_></track>\n" +
            "</File></Mediainfo>";
        assertEquals(
            Optional.of(new TrackSummary(2160, "HEVC", "DTS", 8)),
            MediaInfoProbe.parseReport(old)
        );
    }

    @Test
    public void testAudioOnly() {
        String audio =
            "<MediaInfo><media><track type=\"Audio\"><Format>FLAC</Format><Channels>2</Channels></track></media></MediaInfo>";
        assertEquals(
            Optional.of(new TrackSummary(null, null, "FLAC", 2)),
            MediaInfoProbe.parseReport(audio)
        );
    }

    @Test
    public void testUnusableReports() {
        assertTrue(MediaInfoProbe.parseReport("").isEmpty());
        assertTrue(MediaInfoProbe.parseReport(null).isEmpty());
        assertTrue(MediaInfoProbe.parseReport("not xml at all").isEmpty());
        assertTrue(MediaInfoProbe.parseReport("<MediaInfo><media/></MediaInfo>").isEmpty());
    }

    @Test
    public void testUnavailableProbe() throws IOException {
        MediaInfoProbe probe = new MediaInfoProbe("", 5);
        assertFalse(probe.isAvailable());
        Path file = Files.writeString(tempFolder.resolve("a.mkv"), "x");
        assertTrue(probe.probe(file).isEmpty());
    }

    @Test
    public void testMissingExecutable() throws IOException {
        MediaInfoProbe probe = new MediaInfoProbe("/no/such/dir/mediainfo", 5);
        assertTrue(probe.isAvailable());
        Path file = Files.writeString(tempFolder.resolve("a.mkv"), "x");
        assertTrue(probe.probe(file).isEmpty());
        assertTrue(probe.probe(tempFolder.resolve("missing.mkv")).isEmpty());
    }

    @Test
    public void testConfiguredExecutableSkipsDetection() {
        assertTrue(MediaInfoProbe.detect("/opt/mediainfo", 5).isAvailable());
    }
}
