package org.mediarenamer.controller;

import static org.mediarenamer.model.util.Constants.*;

import java.util.OptionalInt;
import org.mediarenamer.model.ShowDirectory;
import org.mediarenamer.model.ShowGroup;

/**
 * Chooses the season a member directory is filed under.
 *
 * <p>An explicit (or file-inferred) season always wins.  Otherwise, for shows
 * released as one directory per year, the season is the member's year counted
 * from the group's first year: with a first year of 1999, 1999 is season 1 and
 * 2012 is season 14.  Results outside 1..50 are rejected.
 */
public class SeasonResolver {

    public OptionalInt resolve(final ShowDirectory member, final ShowGroup group) {
        if (member.season() != null) {
            return OptionalInt.of(member.season());
        }
        if (member.year() == null || group.getYear() == null) {
            return OptionalInt.empty();
        }
        int season = member.year() - group.getYear() + 1;
        if (season < MIN_MAPPED_SEASON || season > MAX_MAPPED_SEASON) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(season);
    }
}
