package org.mediarenamer.controller;

import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.logging.Logger;
import org.mediarenamer.controller.util.FileUtilities;

/**
 * Moves the contents of one directory into another, merging into any
 * subdirectories that already exist there.
 *
 * <p>A file whose name is already taken at the destination is left where it
 * is, with a warning.  Source directories are removed bottom-up, and only once
 * they are empty, so nothing that could not be moved is ever deleted.  A
 * symbolic link is moved as a link and never descended into.
 *
 * <p>Instances hold no state between calls.
 */
public class DirectoryMerger {

    private static final Logger logger = Logger.getLogger(
        DirectoryMerger.class.getName()
    );

    /**
     * Tally of one merge.
     *
     * @param moved         files and directories moved as a whole
     * @param skipped       files left behind because of a name conflict or a failed move
     * @param sourceRemoved true if the source directory was emptied and removed
     */
    public record Summary(int moved, int skipped, boolean sourceRemoved) {
    }

    /** Running counts for one call to {@link #merge}. */
    private static class Tally {
        int moved;
        int skipped;
    }

    /**
     * @param source      the directory to empty
     * @param destination the directory to fill; must exist
     * @return what was done
     */
    public Summary merge(final Path source, final Path destination) {
        Tally tally = new Tally();
        boolean removed = mergeInto(source, destination, tally);
        if (removed) {
            logger.info("Removed empty directory: " + source);
        }
        return new Summary(tally.moved, tally.skipped, removed);
    }

    private boolean mergeInto(final Path source, final Path destination, final Tally tally) {
        for (Path item : FileUtilities.listEntries(source)) {
            Path destItem = destination.resolve(item.getFileName().toString());

            if (Files.isDirectory(item, LinkOption.NOFOLLOW_LINKS)) {
                if (Files.isDirectory(destItem)) {
                    mergeInto(item, destItem, tally);
                } else if (Files.exists(destItem, LinkOption.NOFOLLOW_LINKS)) {
                    logger.warning(
                        "A file is in the way of directory, skipping: " + destItem
                    );
                    tally.skipped++;
                } else {
                    moveOne(item, destItem, tally);
                }
            } else if (Files.exists(destItem, LinkOption.NOFOLLOW_LINKS)) {
                logger.warning("File already exists, skipping: " + destItem);
                tally.skipped++;
            } else {
                moveOne(item, destItem, tally);
            }
        }

        if (FileUtilities.isDirEmpty(source)) {
            return FileUtilities.rmdir(source);
        }
        return false;
    }

    private void moveOne(final Path item, final Path destItem, final Tally tally) {
        if (FileUtilities.movePath(item, destItem) != null) {
            logger.fine("moved " + item + " to " + destItem);
            tally.moved++;
        } else {
            tally.skipped++;
        }
    }
}
