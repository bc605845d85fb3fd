package org.mediarenamer.model.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.Logger;

public class Environment {

    private static final Logger logger = Logger.getLogger(
        Environment.class.getName()
    );

    public static final String USER_HOME = System.getProperty("user.home");
    public static final String TMP_DIR_NAME = System.getProperty(
        "java.io.tmpdir"
    );
    private static final String OS_NAME = System.getProperty("os.name", "");

    private enum OSType {
        WINDOWS,
        LINUX,
        MAC,
    }

    private static OSType chooseOSType() {
        if (OS_NAME.contains("Mac")) {
            return OSType.MAC;
        }
        if (OS_NAME.contains("Windows")) {
            return OSType.WINDOWS;
        }
        return OSType.LINUX;
    }

    private static final OSType JVM_OS_TYPE = chooseOSType();
    public static final boolean IS_MAC_OSX = (JVM_OS_TYPE == OSType.MAC);
    public static final boolean IS_WINDOWS = (JVM_OS_TYPE == OSType.WINDOWS);

    // A version must at least be "x.y".
    private static final int MIN_BYTES_FOR_VERSION = 3;
    private static final String UNKNOWN_VERSION = "unknown";

    private Environment() {
        // utility class
    }

    /**
     * Read the version number bundled as a classpath resource.
     *
     * <p>Unlike most of the environment, a missing version is not fatal: the
     * version only shows up in log output.
     *
     * @return the trimmed version string, or "unknown" if it cannot be read
     */
    static String readVersionNumber() {
        try (
            InputStream stream = Environment.class.getResourceAsStream(
                "/mediarenamer.version"
            )
        ) {
            if (stream == null) {
                logger.fine("version resource not found on classpath");
                return UNKNOWN_VERSION;
            }
            byte[] buffer = stream.readNBytes(32);
            if (buffer.length < MIN_BYTES_FOR_VERSION) {
                logger.warning("unable to extract version from version file");
                return UNKNOWN_VERSION;
            }
            return new String(buffer, StandardCharsets.UTF_8).trim();
        } catch (IOException ioe) {
            logger.log(Level.WARNING, "Exception when reading version", ioe);
            return UNKNOWN_VERSION;
        }
    }
}
