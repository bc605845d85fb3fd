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
import org.mediarenamer.model.ConsolidationReport;

public class ConsolidationReportPersistence {

    private static final Logger logger = Logger.getLogger(
        ConsolidationReportPersistence.class.getName()
    );

    private static final XStream xstream = new XStream(
        new PureJavaReflectionProvider()
    );

    static {
        xstream.allowTypes(
            new Class[] {
                ConsolidationReport.class,
                ConsolidationReport.Show.class,
                ConsolidationReport.Member.class,
            }
        );
        xstream.allowTypesByWildcard(new String[] { "org.mediarenamer.model.**" });

        xstream.alias("consolidation", ConsolidationReport.class);
        xstream.alias("show", ConsolidationReport.Show.class);
        xstream.alias("member", ConsolidationReport.Member.class);
        xstream.useAttributeFor(ConsolidationReport.class, "dryRun");
        xstream.useAttributeFor(ConsolidationReport.class, "version");
        xstream.useAttributeFor(ConsolidationReport.Member.class, "season");
        xstream.useAttributeFor(ConsolidationReport.Member.class, "success");
        xstream.addImplicitCollection(ConsolidationReport.class, "shows");
        xstream.addImplicitCollection(ConsolidationReport.Show.class, "members");
    }

    /**
     * Write the report, replacing any file already at the path.
     *
     * @param report the report to write
     * @param path   where to write it
     * @return true if the file was written
     */
    public static boolean persist(ConsolidationReport report, Path path) {
        String xml = xstream.toXML(report);

        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, xml);
            logger.info("Wrote consolidation report to " + path.toAbsolutePath());
            return true;
        } catch (
            IOException
            | UnsupportedOperationException
            | SecurityException e
        ) {
            logger.log(
                Level.SEVERE,
                "Exception occurred when writing report '" +
                    path.toAbsolutePath() +
                    "'",
                e
            );
            return false;
        }
    }

    /**
     * @param path the report file
     * @return the report, or null if it is missing or unreadable
     */
    public static ConsolidationReport retrieve(Path path) {
        if (Files.notExists(path)) {
            return null;
        }
        try (InputStream in = Files.newInputStream(path)) {
            return (ConsolidationReport) xstream.fromXML(in);
        } catch (
            IOException
            | XStreamException
            | IllegalArgumentException
            | SecurityException e
        ) {
            logger.log(
                Level.SEVERE,
                "Exception reading report '" + path.toAbsolutePath() + "'",
                e
            );
            return null;
        }
    }
}
