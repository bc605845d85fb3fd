package org.mediarenamer.controller.util;

import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import org.mediarenamer.model.util.Environment;

/**
 * Finds an installed command-line tool.
 *
 * <p>Checks PATH first (by running the tool with {@code --version}), then the
 * well-known install locations for the current platform.
 */
public final class ExternalToolDetector {

    /**
     * Where a tool may be found.
     *
     * @param pathNames    names to try via PATH
     * @param windowsPaths absolute paths to check on Windows
     * @param macPaths     absolute paths to check on macOS
     * @param unixPaths    absolute paths to check on other systems
     */
    public record ToolLocations(
        List<String> pathNames,
        List<String> windowsPaths,
        List<String> macPaths,
        List<String> unixPaths
    ) {
    }

    private ExternalToolDetector() {
        // utility class
    }

    /**
     * Check if an executable is available in PATH by running {@code name --version}.
     *
     * @param executable the executable name to probe
     * @return true if it runs successfully within 5 seconds
     */
    public static boolean isExecutableInPath(String executable) {
        return ProcessRunner.run(List.of(executable, "--version"), 5).success();
    }

    /**
     * Detect a tool by trying PATH names first, then platform-specific paths.
     *
     * @param locations where to look
     * @return the detected path/name, or empty string if not found
     */
    public static String detect(final ToolLocations locations) {
        for (String name : locations.pathNames()) {
            if (isExecutableInPath(name)) {
                return name;
            }
        }

        List<String> wellKnown;
        if (Environment.IS_WINDOWS) {
            wellKnown = locations.windowsPaths();
        } else if (Environment.IS_MAC_OSX) {
            wellKnown = locations.macPaths();
        } else {
            wellKnown = locations.unixPaths();
        }
        for (String path : wellKnown) {
            if (Files.isExecutable(Paths.get(path))) {
                return path;
            }
        }

        return "";
    }
}
