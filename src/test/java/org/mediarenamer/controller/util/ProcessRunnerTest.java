package org.mediarenamer.controller.util;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ProcessRunner}.
 */
public class ProcessRunnerTest {

    @Test
    public void testSuccessfulCommand() {
        // "java -version" should succeed on any system with JDK installed.
        ProcessRunner.Result result = ProcessRunner.run(
            List.of("java", "-version"), 10
        );
        assertTrue(result.success(), "java -version should succeed");
        assertEquals(0, result.exitCode());
    }

    @Test
    public void testFailedCommand() {
        ProcessRunner.Result result = ProcessRunner.run(
            List.of("nonexistent_command_12345"), 5
        );
        assertFalse(result.success(), "nonexistent command should fail");
        assertEquals(-1, result.exitCode());
    }

    @Test
    public void testMergedOutputCapturesStderr() {
        // "java -version" writes to stderr, which run() merges in.
        ProcessRunner.Result result = ProcessRunner.run(
            List.of("java", "-version"), 10
        );
        assertTrue(result.success());
        assertFalse(result.output().isBlank(), "should capture version output");
    }

    @Test
    public void testStdoutOnlyDiscardsStderr() {
        // Same command, but runForOutput() keeps stdout only, and -version prints nothing there.
        ProcessRunner.Result result = ProcessRunner.runForOutput(
            List.of("java", "-version"), 10
        );
        assertTrue(result.success());
        assertTrue(result.output().isBlank(), "stderr should not be captured");
    }

    @Test
    public void testFailureResult() {
        ProcessRunner.Result failure = ProcessRunner.Result.failure();
        assertFalse(failure.success());
        assertEquals(-1, failure.exitCode());
        assertEquals("", failure.output());
    }

    @Test
    public void testNonZeroExitCode() {
        ProcessRunner.Result result = ProcessRunner.run(
            List.of("java", "--invalid-flag-xyz"), 10
        );
        assertFalse(result.success());
        assertNotEquals(0, result.exitCode());
    }
}
