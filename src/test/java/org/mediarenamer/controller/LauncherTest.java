package org.mediarenamer.controller;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Paths;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mediarenamer.model.ConsolidatorPreferences;

public class LauncherTest {

    @Test
    public void testRootOnly() {
        Launcher.Arguments args = Launcher.parseArguments(new String[] { "/tv" });
        assertNotNull(args);
        assertEquals(Paths.get("/tv"), args.root());
        assertFalse(args.dryRun());
        assertNull(args.report());
        assertFalse(args.isClassify());
    }

    @Test
    public void testOptionsInAnyOrder() {
        Launcher.Arguments args = Launcher.parseArguments(
            new String[] { "--report", "out.xml", "--dry-run", "/tv" }
        );
        assertNotNull(args);
        assertEquals(Paths.get("/tv"), args.root());
        assertTrue(args.dryRun());
        assertEquals(Paths.get("out.xml"), args.report());
    }

    @Test
    public void testClassifyMode() {
        Launcher.Arguments args = Launcher.parseArguments(
            new String[] { "--classify", "a.mkv", "b.mp4" }
        );
        assertNotNull(args);
        assertTrue(args.isClassify());
        assertEquals(List.of(Paths.get("a.mkv"), Paths.get("b.mp4")), args.classifyFiles());
        assertNull(args.root());
    }

    @Test
    public void testUsageErrors() {
        assertNull(Launcher.parseArguments(new String[] {}));
        assertNull(Launcher.parseArguments(null));
        assertNull(Launcher.parseArguments(new String[] { "--dry-run" }));
        assertNull(Launcher.parseArguments(new String[] { "/tv", "--report" }));
        assertNull(Launcher.parseArguments(new String[] { "/tv", "/other" }));
        assertNull(Launcher.parseArguments(new String[] { "/tv", "--verbose" }));
        assertNull(Launcher.parseArguments(new String[] { "--classify" }));
    }

    @Test
    public void testUsageErrorExitStatus() {
        assertEquals(Launcher.EXIT_USAGE, Launcher.run(new String[] {}));
    }

    @Test
    public void testDryRunPrecedence() {
        ConsolidatorPreferences saysReal = new ConsolidatorPreferences();
        ConsolidatorPreferences saysDry = new ConsolidatorPreferences();
        saysDry.setDryRun(true);

        assertTrue(Launcher.resolveDryRun(true, "false", saysReal));
        assertTrue(Launcher.resolveDryRun(false, "true", saysReal));
        assertFalse(Launcher.resolveDryRun(false, "false", saysDry));
        assertTrue(Launcher.resolveDryRun(false, null, saysDry));
        assertFalse(Launcher.resolveDryRun(false, "  ", saysReal));
    }
}
