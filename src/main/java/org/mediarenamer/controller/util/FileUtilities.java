package org.mediarenamer.controller.util;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Thin, logging wrappers around java.nio.file for the operations the
 * consolidation needs.  None of these throw; failure is reported through the
 * return value and the log.
 */
public class FileUtilities {

    private static final Logger logger = Logger.getLogger(
        FileUtilities.class.getName()
    );

    private FileUtilities() {
        // utility class
    }

    /**
     * Returns a safe string representation of a Path, handling null gracefully.
     *
     * @param p the path to convert (may be null)
     * @return the path as a string, or "&lt;null&gt;" if the path is null
     */
    public static String safePath(Path p) {
        return (p == null) ? "<null>" : p.toString();
    }

    /**
     * Move a file or a whole directory to the given destination.  The
     * destination must not exist; this method never overwrites.
     *
     * @param src
     *    the file or directory to move
     * @param dest
     *    the full destination path, including the final name
     * @return
     *    the new location if the move happened; null if it did not
     */
    public static Path movePath(final Path src, final Path dest) {
        if (src == null || dest == null) {
            logger.warning(
                "cannot move: src/dest is null\n  src=" +
                    safePath(src) +
                    "\n  dest=" +
                    safePath(dest)
            );
            return null;
        }
        if (Files.notExists(src)) {
            logger.warning("cannot move, does not exist: " + src);
            return null;
        }
        if (Files.exists(dest)) {
            logger.warning("will not overwrite existing path: " + dest);
            return null;
        }
        try {
            Path actualDest = Files.move(src, dest);
            if (actualDest != null && Files.exists(actualDest)) {
                return actualDest;
            }
        } catch (AccessDeniedException ade) {
            logger.warning("Could not move \"" + src + "\"; access denied");
        } catch (IOException ioe) {
            logger.log(Level.WARNING, "Error moving " + src + " to " + dest, ioe);
        }
        if (Files.exists(src) && Files.notExists(dest)) {
            // Nothing happened.
            return null;
        }
        logger.warning(
            "move of " + src + " to " + dest + " left an unexpected state; " +
                "src exists=" + Files.exists(src) +
                ", dest exists=" + Files.exists(dest)
        );
        return null;
    }

    /**
     * Creates a directory, and any missing parents.  Succeeds if the
     * directory already exists.
     *
     * @param dir the directory to create
     * @return true if the directory exists when this method returns
     */
    public static boolean ensureDirectory(final Path dir) {
        if (Files.notExists(dir)) {
            try {
                Files.createDirectories(dir);
            } catch (IOException ioe) {
                logger.log(
                    Level.SEVERE,
                    "Unable to create directory " + dir,
                    ioe
                );
                return false;
            }
        }
        if (!Files.isDirectory(dir)) {
            logger.warning("cannot use " + dir + " because it is not a directory");
            return false;
        }
        return true;
    }

    /**
     * Return true if the given argument is an empty directory.
     *
     * @param dir
     *    the directory to check for emptiness
     * @return
     *    true if the path existed and was an empty directory; false otherwise
     */
    public static boolean isDirEmpty(final Path dir) {
        try (DirectoryStream<Path> dirStream = Files.newDirectoryStream(dir)) {
            return !dirStream.iterator().hasNext();
        } catch (IOException ioe) {
            logger.log(
                Level.WARNING,
                "exception checking directory " + dir,
                ioe
            );
            return false;
        }
    }

    /**
     * If the given argument is an empty directory, remove it.
     *
     * @param dir
     *    the directory to delete if empty
     * @return
     *    true if the path existed and was deleted; false if not
     */
    public static boolean rmdir(final Path dir) {
        if (!Files.isDirectory(dir)) {
            return false;
        }
        try {
            Files.delete(dir);
        } catch (IOException ioe) {
            logger.log(
                Level.WARNING,
                "exception trying to remove directory " + dir,
                ioe
            );
            return false;
        }
        return Files.notExists(dir);
    }

    /**
     * The immediate subdirectories of the given directory, sorted by name so
     * that repeated runs see them in the same order.
     *
     * @param root the directory to list
     * @return the subdirectories; empty if root cannot be read
     */
    public static List<Path> listSubdirectories(final Path root) {
        List<Path> dirs = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(root)) {
            for (Path entry : stream) {
                if (Files.isDirectory(entry)) {
                    dirs.add(entry);
                }
            }
        } catch (IOException ioe) {
            logger.log(Level.WARNING, "could not list directory " + root, ioe);
        }
        dirs.sort(null);
        return dirs;
    }

    /**
     * The immediate entries of the given directory, sorted by name.
     *
     * @param dir the directory to list
     * @return the entries; empty if the directory cannot be read
     */
    public static List<Path> listEntries(final Path dir) {
        List<Path> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path entry : stream) {
                entries.add(entry);
            }
        } catch (IOException ioe) {
            logger.log(Level.WARNING, "could not list directory " + dir, ioe);
        }
        entries.sort(null);
        return entries;
    }

    /**
     * Check if a filename ends with one of the given extensions, ignoring case.
     *
     * @param filename   the filename to check
     * @param extensions extensions including the leading dot, in lower case
     * @return true if the filename has one of the extensions
     */
    public static boolean hasVideoExtension(
        final String filename,
        final Collection<String> extensions
    ) {
        if (filename == null) {
            return false;
        }
        String lower = StringUtils.toLower(filename);
        return extensions.stream().anyMatch(lower::endsWith);
    }

    /**
     * Every regular file beneath the directory, at any depth, that has one of
     * the given extensions.
     *
     * @param dir        the directory to search
     * @param extensions extensions including the leading dot, in lower case
     * @return the matching files in walk order; empty if the walk fails
     */
    public static List<Path> findVideoFiles(
        final Path dir,
        final Collection<String> extensions
    ) {
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk
                .filter(Files::isRegularFile)
                .filter(p -> hasVideoExtension(p.getFileName().toString(), extensions))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            logger.log(Level.WARNING, "could not walk directory " + dir, e);
            return List.of();
        }
    }
}
