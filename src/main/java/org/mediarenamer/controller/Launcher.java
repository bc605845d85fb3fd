package org.mediarenamer.controller;

import static org.mediarenamer.model.util.Constants.*;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import org.mediarenamer.controller.metadata.MediaInfoProbe;
import org.mediarenamer.model.ConsolidationOperation;
import org.mediarenamer.model.ConsolidationReport;
import org.mediarenamer.model.ConsolidationResult;
import org.mediarenamer.model.ConsolidatorPreferences;
import org.mediarenamer.model.util.Environment;

/**
 * Command-line entry point.
 *
 * <pre>
 *   media-renamer &lt;root&gt; [--dry-run] [--report &lt;file&gt;]
 *   media-renamer --classify &lt;file&gt;...
 * </pre>
 *
 * Logging strategy:
 * - Primary configuration comes from {@code /logging.properties}.
 * - A file log ({@code mediarenamer.log}, in the temp directory) is created only when:
 *   - debug is enabled via {@code -Dmediarenamer.debug=true}, OR
 *   - a fatal error occurs (then we write exception + environment summary).
 * The log is overwritten each run.
 */
public class Launcher {

    private static final Logger logger = Logger.getLogger(
        Launcher.class.getName()
    );

    private static final String DEBUG_PROPERTY = "mediarenamer.debug";
    private static final String LOG_FILENAME = "mediarenamer.log";
    static final String DRY_RUN_ENV = "DRY_RUN";

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE =
        "usage: media-renamer <root> [--dry-run] [--report <file>]\n" +
        "       media-renamer --classify <file>...";

    private static volatile FileHandler fileHandler;

    /**
     * Parsed command line.
     *
     * @param root          the directory to consolidate; null in classify mode
     * @param dryRun        true if --dry-run was given
     * @param report        where to write the XML report; may be null
     * @param classifyFiles files to classify; empty unless in classify mode
     */
    record Arguments(Path root, boolean dryRun, Path report, List<Path> classifyFiles) {

        boolean isClassify() {
            return !classifyFiles.isEmpty();
        }
    }

    private Launcher() {
        // entry point only
    }

    static void initializeLoggingConfig() {
        try (
            InputStream in = Launcher.class.getResourceAsStream(
                LOGGING_PROPERTIES
            )
        ) {
            if (in == null) {
                logger.warning(
                    "logging.properties not found on classpath; using default JDK logging configuration."
                );
                return;
            }
            LogManager.getLogManager().readConfiguration(in);
        } catch (IOException | RuntimeException e) {
            // Logging config failures should not prevent startup.
            System.err.println("Failed to load logging configuration: " + e);
            logger.log(
                Level.WARNING,
                "Failed to load logging configuration",
                e
            );
        }
    }

    private static boolean isDebugEnabled() {
        return Boolean.parseBoolean(
            System.getProperty(DEBUG_PROPERTY, "false")
        );
    }

    private static Path resolveLogFilePath() {
        return Paths.get(Environment.TMP_DIR_NAME)
            .toAbsolutePath()
            .normalize()
            .resolve(LOG_FILENAME);
    }

    private static synchronized void ensureFileLoggingAttached() {
        if (fileHandler != null) {
            return;
        }

        Path logPath = resolveLogFilePath();

        try {
            // Overwrite each run (append=false)
            fileHandler = new FileHandler(logPath.toString(), false);
            fileHandler.setFormatter(new SimpleFormatter());
            fileHandler.setLevel(Level.ALL);

            Logger root = Logger.getLogger("");
            root.addHandler(fileHandler);

            // Do not force root level here; honor logging.properties.
            logger.info("File logging enabled: " + logPath);
        } catch (IOException | SecurityException e) {
            System.err.println(
                "Could not create log file at " +
                    logPath +
                    ": " +
                    e.getMessage()
            );
            logger.log(
                Level.WARNING,
                "Could not create log file at " + logPath,
                e
            );
        }
    }

    private static String buildEnvironmentSummary() {
        StringBuilder sb = new StringBuilder(512);
        sb.append("=== media-renamer Environment ===\n");
        sb.append("Version: ").append(VERSION_NUMBER).append('\n');
        sb
            .append("Java Version: ")
            .append(System.getProperty("java.version"))
            .append('\n');
        sb
            .append("OS: ")
            .append(System.getProperty("os.name"))
            .append(' ')
            .append(System.getProperty("os.arch"))
            .append('\n');
        sb
            .append("Working Directory: ")
            .append(System.getProperty("user.dir"))
            .append('\n');
        sb.append("Configuration: ").append(CONFIGURATION_DIRECTORY).append('\n');
        sb.append("Log File: ").append(resolveLogFilePath()).append('\n');
        return sb.toString();
    }

    private static String stackTraceToString(Throwable t) {
        StringWriter sw = new StringWriter(4096);
        PrintWriter pw = new PrintWriter(sw);
        t.printStackTrace(pw);
        pw.flush();
        return sw.toString();
    }

    private static void logFatal(String context, Throwable t) {
        ensureFileLoggingAttached();

        logger.severe("FATAL: " + context);
        logger.severe(buildEnvironmentSummary());
        logger.severe(stackTraceToString(t));
    }

    private static void closeFileLogging() {
        FileHandler handler = fileHandler;
        if (handler != null) {
            handler.close();
        }
    }

    /**
     * @param args the command line
     * @return the parsed arguments, or null if they do not make sense
     */
    static Arguments parseArguments(final String[] args) {
        if (args == null || args.length == 0) {
            return null;
        }

        if ("--classify".equals(args[0])) {
            List<Path> files = new ArrayList<>();
            for (int i = 1; i < args.length; i++) {
                files.add(Paths.get(args[i]));
            }
            if (files.isEmpty()) {
                return null;
            }
            return new Arguments(null, false, null, List.copyOf(files));
        }

        Path root = null;
        boolean dryRun = false;
        Path report = null;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--dry-run".equals(arg)) {
                dryRun = true;
            } else if ("--report".equals(arg)) {
                if (i + 1 >= args.length || report != null) {
                    return null;
                }
                report = Paths.get(args[++i]);
            } else if (arg.startsWith("--") || root != null) {
                return null;
            } else {
                root = Paths.get(arg);
            }
        }
        if (root == null) {
            return null;
        }
        return new Arguments(root, dryRun, report, List.of());
    }

    /**
     * Decide whether this run is a dry run.  The command line wins, then the
     * {@code DRY_RUN} environment variable, then the saved preference.
     *
     * @param fromCommandLine true if --dry-run was given
     * @param envValue        the value of DRY_RUN; may be null
     * @param prefs           the saved preferences
     * @return true for a dry run
     */
    static boolean resolveDryRun(
        final boolean fromCommandLine,
        final String envValue,
        final ConsolidatorPreferences prefs
    ) {
        if (fromCommandLine) {
            return true;
        }
        if (envValue != null && !envValue.isBlank()) {
            return Boolean.parseBoolean(envValue.trim());
        }
        return prefs.isDryRun();
    }

    static int run(final String[] args) {
        Arguments arguments = parseArguments(args);
        if (arguments == null) {
            System.err.println(USAGE);
            return EXIT_USAGE;
        }

        ConsolidatorPreferences prefs = ConsolidatorPreferences.load();

        if (arguments.isClassify()) {
            QualityClassifier classifier = new QualityClassifier(
                MediaInfoProbe.detect(
                    prefs.getMediaInfoExecutable(),
                    prefs.getProbeTimeoutSeconds()
                )
            );
            for (Path file : arguments.classifyFiles()) {
                System.out.println(
                    file.getFileName() + "\t" + QualityClassifier.format(classifier.classify(file))
                );
            }
            return EXIT_OK;
        }

        if (!Files.isDirectory(arguments.root())) {
            System.err.println("not a directory: " + arguments.root());
            return EXIT_USAGE;
        }

        boolean dryRun = resolveDryRun(
            arguments.dryRun(),
            System.getenv(DRY_RUN_ENV),
            prefs
        );

        ConsolidationEngine engine = ConsolidationEngine.create(
            new FilenameParser(),
            CatalogIdentityLookup.fromFile(Paths.get(prefs.getIdentityCatalogFile())),
            prefs.getVideoExtensions()
        );
        List<ConsolidationResult> results = engine.consolidate(arguments.root(), dryRun);
        logSummary(results, dryRun);

        if (arguments.report() != null) {
            ConsolidationReport report = new ConsolidationReport(
                arguments.root(),
                dryRun,
                VERSION_NUMBER,
                results
            );
            if (!ConsolidationReportPersistence.persist(report, arguments.report())) {
                return EXIT_FATAL;
            }
        }
        return EXIT_OK;
    }

    private static void logSummary(final List<ConsolidationResult> results, final boolean dryRun) {
        if (results.isEmpty()) {
            logger.info("Nothing to consolidate");
            return;
        }
        for (ConsolidationResult result : results) {
            logger.info(
                (dryRun ? "[dry run] " : "") + result.showTitle() + ": " +
                    result.successCount() + "/" + result.operations().size() +
                    " directories into " + result.unifiedDirectory()
            );
            for (ConsolidationOperation op : result.operations()) {
                if (!op.success()) {
                    logger.warning("  " + op.source() + ": " + op.error());
                }
            }
        }
    }

    public static void main(String[] args) {
        initializeLoggingConfig();

        if (isDebugEnabled()) {
            ensureFileLoggingAttached();
            logger.info("Debug enabled via -D" + DEBUG_PROPERTY + "=true");
        }

        Thread.setDefaultUncaughtExceptionHandler((thread, throwable) -> {
            logFatal(
                "Uncaught exception in thread " + thread.getName(),
                throwable
            );
            closeFileLogging();
        });

        int status;
        try {
            logger.info("=== " + APPLICATION_NAME + " " + VERSION_NUMBER + " ===");
            status = run(args);
        } catch (RuntimeException | Error t) {
            logFatal("Exception in main()", t);
            status = EXIT_FATAL;
        }
        closeFileLogging();
        System.exit(status);
    }
}
