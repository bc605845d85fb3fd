package org.mediarenamer.model.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

public class Constants {

    public static final String APPLICATION_NAME = "media-renamer";
    public static final String VERSION_NUMBER = Environment.readVersionNumber();

    public static final String EMPTY_STRING = "";
    public static final String LOGGING_PROPERTIES = "/logging.properties";

    public static final String DEFAULT_SEASON_PREFIX = "Season ";
    public static final String UNRESOLVED_SEASON_REASON =
        "Could not determine season";

    // Season-from-year mapping only accepts results in this range.
    public static final int MIN_MAPPED_SEASON = 1;
    public static final int MAX_MAPPED_SEASON = 50;

    // Years outside this range are treated as noise in directory names.
    public static final int MIN_PLAUSIBLE_YEAR = 1980;
    public static final int MAX_PLAUSIBLE_YEAR = 2030;

    public static final List<String> DEFAULT_VIDEO_EXTENSIONS = List.of(
        ".mkv",
        ".mp4",
        ".avi",
        ".mov",
        ".wmv",
        ".flv",
        ".webm",
        ".m4v"
    );

    public static final String CONFIG_DIR_PROPERTY = "mediarenamer.config.dir";
    public static final Path CONFIGURATION_DIRECTORY = Paths.get(
        System.getProperty(
            CONFIG_DIR_PROPERTY,
            Paths.get(Environment.USER_HOME, ".mediarenamer").toString()
        )
    );
    public static final Path PREFERENCES_FILE =
        CONFIGURATION_DIRECTORY.resolve("preferences.xml");
    public static final Path IDENTITY_CATALOG_FILE =
        CONFIGURATION_DIRECTORY.resolve("identities.xml");

    private Constants() {
        // constants only
    }
}
