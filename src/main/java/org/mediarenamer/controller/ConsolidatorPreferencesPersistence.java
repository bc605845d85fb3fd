package org.mediarenamer.controller;

import com.thoughtworks.xstream.XStream;
import com.thoughtworks.xstream.XStreamException;
import com.thoughtworks.xstream.converters.reflection.AbstractReflectionConverter.UnknownFieldException;
import com.thoughtworks.xstream.converters.reflection.PureJavaReflectionProvider;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.mediarenamer.model.ConsolidatorPreferences;

public class ConsolidatorPreferencesPersistence {

    private static final Logger logger = Logger.getLogger(
        ConsolidatorPreferencesPersistence.class.getName()
    );

    // The reflection provider calls the default constructor, so fields missing
    // from the file keep their default values.
    private static final XStream xstream = new XStream(
        new PureJavaReflectionProvider()
    );

    static {
        xstream.allowTypes(new Class[] { ConsolidatorPreferences.class });
        xstream.allowTypesByWildcard(new String[] { "org.mediarenamer.model.**" });

        xstream.alias("preferences", ConsolidatorPreferences.class);
        xstream.alias("extension", String.class);
        xstream.aliasField("mediaInfo", ConsolidatorPreferences.class, "mediaInfoExecutable");
        xstream.aliasField("identityCatalog", ConsolidatorPreferences.class, "identityCatalogFile");
    }

    /**
     * Save the preferences object to the path.
     *
     * @param prefs the preferences object to save
     * @param path  the path to save it to
     */
    public static void persist(ConsolidatorPreferences prefs, Path path) {
        String xml = xstream.toXML(prefs);

        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            // Overwrite any existing file
            Files.writeString(path, xml);
        } catch (
            IOException
            | UnsupportedOperationException
            | SecurityException e
        ) {
            logger.log(
                Level.SEVERE,
                "Exception occurred when writing preferences file '" +
                    path.toAbsolutePath() +
                    "'",
                e
            );
        }
    }

    /**
     * Load the preferences from path.
     *
     * @param path the path to read
     * @return the populated preferences object, or null if the file is missing or unreadable
     */
    public static ConsolidatorPreferences retrieve(Path path) {
        if (Files.notExists(path)) {
            logger.fine(
                "Preferences file '" +
                    path.toAbsolutePath() +
                    "' does not exist - assuming defaults"
            );
            return null;
        }

        try (InputStream in = Files.newInputStream(path)) {
            try {
                return (ConsolidatorPreferences) xstream.fromXML(in);
            } catch (UnknownFieldException ufe) {
                // Files written by other versions may carry fields this one lacks.
                logger.log(
                    Level.INFO,
                    "Ignoring unknown field(s) while reading preferences file '" +
                        path.toAbsolutePath() +
                        "': " +
                        ufe.getMessage(),
                    ufe
                );

                xstream.ignoreUnknownElements();
                try (InputStream inRetry = Files.newInputStream(path)) {
                    return (ConsolidatorPreferences) xstream.fromXML(inRetry);
                }
            }
        } catch (
            IOException
            | XStreamException
            | IllegalArgumentException
            | SecurityException e
        ) {
            logger.log(
                Level.SEVERE,
                "Exception reading preferences file '" +
                    path.toAbsolutePath() +
                    "'",
                e
            );
            logger.info("assuming default preferences");
            return null;
        }
    }
}
