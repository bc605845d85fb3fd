package org.mediarenamer.model;

import static org.mediarenamer.model.util.Constants.*;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.mediarenamer.controller.ConsolidatorPreferencesPersistence;

/**
 * User-adjustable settings, read from and saved to the preferences file.
 */
public class ConsolidatorPreferences {

    private static final Logger logger = Logger.getLogger(
        ConsolidatorPreferences.class.getName()
    );

    static final int DEFAULT_PROBE_TIMEOUT_SECONDS = 30;

    private final List<String> videoExtensions;
    private boolean dryRun;
    private String mediaInfoExecutable;
    private int probeTimeoutSeconds;
    private String identityCatalogFile;

    public ConsolidatorPreferences() {
        videoExtensions = new ArrayList<>(DEFAULT_VIDEO_EXTENSIONS);
        dryRun = false;
        mediaInfoExecutable = EMPTY_STRING;
        probeTimeoutSeconds = DEFAULT_PROBE_TIMEOUT_SECONDS;
        identityCatalogFile = IDENTITY_CATALOG_FILE.toString();
    }

    /**
     * Read the preferences file, falling back to defaults if it is missing or
     * unreadable.  A missing file is created with the defaults.
     *
     * @return the preferences; never null
     */
    public static ConsolidatorPreferences load() {
        ConsolidatorPreferences prefs =
            ConsolidatorPreferencesPersistence.retrieve(PREFERENCES_FILE);
        if (prefs != null) {
            logger.fine("Successfully read preferences from: " + PREFERENCES_FILE.toAbsolutePath());
            return prefs;
        }
        prefs = new ConsolidatorPreferences();
        ConsolidatorPreferencesPersistence.persist(prefs, PREFERENCES_FILE);
        return prefs;
    }

    public List<String> getVideoExtensions() {
        if (videoExtensions == null || videoExtensions.isEmpty()) {
            return DEFAULT_VIDEO_EXTENSIONS;
        }
        return List.copyOf(videoExtensions);
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public void setDryRun(final boolean dryRun) {
        this.dryRun = dryRun;
    }

    /**
     * @return the configured mediainfo executable, or empty to auto-detect
     */
    public String getMediaInfoExecutable() {
        return (mediaInfoExecutable == null) ? EMPTY_STRING : mediaInfoExecutable;
    }

    public void setMediaInfoExecutable(final String executable) {
        mediaInfoExecutable = executable;
    }

    public int getProbeTimeoutSeconds() {
        return (probeTimeoutSeconds > 0) ? probeTimeoutSeconds : DEFAULT_PROBE_TIMEOUT_SECONDS;
    }

    public String getIdentityCatalogFile() {
        return (identityCatalogFile == null)
            ? IDENTITY_CATALOG_FILE.toString()
            : identityCatalogFile;
    }

    public void setIdentityCatalogFile(final String path) {
        identityCatalogFile = path;
    }
}
