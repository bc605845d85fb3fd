package org.mediarenamer.controller;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mediarenamer.model.ConsolidationOperation;
import org.mediarenamer.model.ConsolidationReport;
import org.mediarenamer.model.ConsolidationResult;

public class ConsolidationReportPersistenceTest {

    @TempDir
    Path tempFolder;

    private ConsolidationReport sampleReport() {
        Path root = tempFolder.resolve("tv");
        Path unified = root.resolve("WWE SmackDown (1999) [id-73255]");
        ConsolidationResult result = new ConsolidationResult(
            "WWE SmackDown",
            unified,
            "73255",
            List.of(
                ConsolidationOperation.succeeded(
                    root.resolve("SmackDown 2018"),
                    unified.resolve("Season 20"),
                    20
                ),
                ConsolidationOperation.failed(root.resolve("SmackDown Extras"), "Could not determine season")
            )
        );
        return new ConsolidationReport(root, true, "1.3.4", List.of(result));
    }

    @Test
    public void testWriteAndReadBack() throws IOException {
        Path file = tempFolder.resolve("reports").resolve("run.xml");
        assertTrue(ConsolidationReportPersistence.persist(sampleReport(), file));

        String xml = Files.readString(file);
        assertTrue(xml.startsWith("<consolidation"), xml);
        assertTrue(xml.contains("dryRun=\"true\""), xml);
        assertTrue(xml.contains("<show>"), xml);

        ConsolidationReport read = ConsolidationReportPersistence.retrieve(file);
        assertNotNull(read);
        assertTrue(read.isDryRun());
        assertEquals("1.3.4", read.getVersion());
        assertEquals(1, read.getShows().size());

        ConsolidationReport.Show show = read.getShows().get(0);
        assertEquals("WWE SmackDown", show.getTitle());
        assertEquals("73255", show.getExternalId());
        assertEquals(2, show.getMembers().size());

        ConsolidationReport.Member moved = show.getMembers().get(0);
        assertTrue(moved.isSuccess());
        assertEquals(20, moved.getSeason());
        assertTrue(moved.getDestination().endsWith("Season 20"));

        ConsolidationReport.Member failed = show.getMembers().get(1);
        assertFalse(failed.isSuccess());
        assertNull(failed.getDestination());
        assertNull(failed.getSeason());
        assertEquals("Could not determine season", failed.getError());
    }

    @Test
    public void testEmptyRun() {
        Path file = tempFolder.resolve("empty.xml");
        ConsolidationReport empty = new ConsolidationReport(tempFolder, false, "1.3.4", List.of());
        assertTrue(ConsolidationReportPersistence.persist(empty, file));

        ConsolidationReport read = ConsolidationReportPersistence.retrieve(file);
        assertNotNull(read);
        assertTrue(read.getShows().isEmpty());
    }

    @Test
    public void testUnwritableTarget() throws IOException {
        Path blocker = Files.writeString(tempFolder.resolve("blocker"), "x");
        assertFalse(ConsolidationReportPersistence.persist(sampleReport(), blocker.resolve("run.xml")));
    }
}
