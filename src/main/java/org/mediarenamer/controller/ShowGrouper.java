package org.mediarenamer.controller;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import org.mediarenamer.controller.util.StringUtils;
import org.mediarenamer.model.ShowDirectory;
import org.mediarenamer.model.ShowGroup;

/**
 * Partitions show directories into groups that hold the same show.
 *
 * <p>Single pass in input order: each directory not yet placed seeds a group,
 * and every later unplaced directory that matches <em>the seed</em> joins it.
 * Members are never compared with each other, so a chain A~B, B~C with A≁C
 * puts C in a group of its own.
 */
public class ShowGrouper {

    private static final Logger logger = Logger.getLogger(
        ShowGrouper.class.getName()
    );

    static final double TITLE_SIMILARITY_THRESHOLD = 0.8;
    static final double WORD_OVERLAP_THRESHOLD = 0.6;

    /**
     * @param directories the candidates, in discovery order
     * @return the groups, in seed order; every group is frozen
     */
    public List<ShowGroup> group(final List<ShowDirectory> directories) {
        List<ShowGroup> groups = new ArrayList<>();
        boolean[] assigned = new boolean[directories.size()];

        for (int i = 0; i < directories.size(); i++) {
            if (assigned[i]) {
                continue;
            }
            ShowDirectory seed = directories.get(i);
            ShowGroup group = new ShowGroup(seed);
            assigned[i] = true;

            for (int j = 0; j < directories.size(); j++) {
                if (assigned[j]) {
                    continue;
                }
                ShowDirectory other = directories.get(j);
                if (areSameShow(seed, other)) {
                    group.addMember(other);
                    assigned[j] = true;
                }
            }
            group.freeze();
            groups.add(group);
        }

        logger.info("Grouped directories into " + groups.size() + " shows");
        return groups;
    }

    /**
     * Decide whether two directories hold the same show.  Symmetric.
     *
     * @param a one directory
     * @param b another directory
     * @return true if the normalized titles are equal or very similar, or the
     *   raw titles share most of their words
     */
    public static boolean areSameShow(final ShowDirectory a, final ShowDirectory b) {
        if (a.normalizedTitle().equals(b.normalizedTitle())) {
            return true;
        }
        double similarity = StringUtils.similarity(
            a.normalizedTitle(),
            b.normalizedTitle()
        );
        if (similarity > TITLE_SIMILARITY_THRESHOLD) {
            return true;
        }
        return wordOverlap(a.rawTitle(), b.rawTitle()) > WORD_OVERLAP_THRESHOLD;
    }

    /**
     * Jaccard ratio of the two titles' lower-cased word sets; 0 if either is empty.
     */
    static double wordOverlap(final String title1, final String title2) {
        Set<String> words1 = words(title1);
        Set<String> words2 = words(title2);
        if (words1.isEmpty() || words2.isEmpty()) {
            return 0.0;
        }
        Set<String> common = new HashSet<>(words1);
        common.retainAll(words2);
        Set<String> union = new HashSet<>(words1);
        union.addAll(words2);
        return (double) common.size() / union.size();
    }

    private static Set<String> words(final String title) {
        String squeezed = StringUtils.collapseWhitespace(StringUtils.toLower(title));
        if (squeezed.isEmpty()) {
            return Set.of();
        }
        return new HashSet<>(Arrays.asList(squeezed.split(" ")));
    }
}
