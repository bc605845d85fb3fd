package org.mediarenamer.controller;

import com.thoughtworks.xstream.XStream;
import com.thoughtworks.xstream.XStreamException;
import com.thoughtworks.xstream.converters.reflection.PureJavaReflectionProvider;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.mediarenamer.model.IdentityCatalog;
import org.mediarenamer.model.MediaKind;

public class IdentityCatalogPersistence {

    private static final Logger logger = Logger.getLogger(
        IdentityCatalogPersistence.class.getName()
    );

    private static final XStream xstream = new XStream(
        new PureJavaReflectionProvider()
    );

    static {
        xstream.allowTypes(
            new Class[] { IdentityCatalog.class, IdentityCatalog.Entry.class, MediaKind.class }
        );
        xstream.allowTypesByWildcard(new String[] { "org.mediarenamer.model.**" });

        xstream.alias("identities", IdentityCatalog.class);
        xstream.alias("identity", IdentityCatalog.Entry.class);
        xstream.alias("alias", String.class);
        xstream.addImplicitCollection(IdentityCatalog.class, "entries");
        xstream.aliasField("id", IdentityCatalog.Entry.class, "externalId");
    }

    /**
     * Save the catalog to the file.
     *
     * @param catalog the catalog to save
     * @param path the path to save it to
     */
    public static void persist(IdentityCatalog catalog, Path path) {
        String xml = xstream.toXML(catalog);

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
                "Exception occurred when writing identity catalog '" +
                    path.toAbsolutePath() +
                    "'",
                e
            );
        }
    }

    /**
     * Load the catalog from path.
     *
     * @param path the path to read
     * @return the populated catalog, or null if the file is missing or unreadable
     */
    public static IdentityCatalog retrieve(Path path) {
        if (Files.notExists(path)) {
            logger.fine(
                "Identity catalog '" +
                    path.toAbsolutePath() +
                    "' does not exist - no identities known"
            );
            return null;
        }

        try (InputStream in = Files.newInputStream(path)) {
            return (IdentityCatalog) xstream.fromXML(in);
        } catch (
            IOException
            | XStreamException
            | IllegalArgumentException
            | SecurityException e
        ) {
            logger.log(
                Level.SEVERE,
                "Exception reading identity catalog '" +
                    path.toAbsolutePath() +
                    "'",
                e
            );
            logger.info("assuming an empty identity catalog");
            return null;
        }
    }
}
