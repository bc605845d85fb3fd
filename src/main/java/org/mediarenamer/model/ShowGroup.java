package org.mediarenamer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A set of directories believed to hold the same show.
 *
 * <p>Members are appended while grouping and the group is frozen afterwards.
 * The identity (title, year, external id) starts out as the seed directory's
 * and may be replaced exactly once by {@link #enhance(ShowIdentity)}.
 */
public class ShowGroup {

    private final List<ShowDirectory> members = new ArrayList<>();
    private String canonicalTitle;
    private Integer year;
    private String externalId;
    private boolean frozen = false;
    private boolean enhanced = false;

    public ShowGroup(final ShowDirectory seed) {
        Objects.requireNonNull(seed, "seed");
        members.add(seed);
        canonicalTitle = seed.rawTitle();
        year = seed.year();
    }

    public void addMember(final ShowDirectory member) {
        if (frozen) {
            throw new IllegalStateException(
                "cannot add " + member.path() + " to frozen group " + canonicalTitle
            );
        }
        members.add(Objects.requireNonNull(member, "member"));
    }

    public void freeze() {
        frozen = true;
    }

    /**
     * Replace the discovered identity with one confirmed by a lookup.
     *
     * @param identity the confirmed identity
     * @throws IllegalStateException if this group was already enhanced
     */
    public void enhance(final ShowIdentity identity) {
        if (enhanced) {
            throw new IllegalStateException(
                "group " + canonicalTitle + " was already enhanced"
            );
        }
        enhanced = true;
        // A lookup that confirms an id but lacks a title or year keeps the discovered ones.
        if (identity.title() != null && !identity.title().isBlank()) {
            canonicalTitle = identity.title();
        }
        if (identity.year() != null) {
            year = identity.year();
        }
        externalId = identity.externalId();
    }

    public ShowDirectory getSeed() {
        return members.get(0);
    }

    public List<ShowDirectory> getMembers() {
        return Collections.unmodifiableList(members);
    }

    public int size() {
        return members.size();
    }

    public String getCanonicalTitle() {
        return canonicalTitle;
    }

    public Integer getYear() {
        return year;
    }

    public String getExternalId() {
        return externalId;
    }

    public boolean isEnhanced() {
        return enhanced;
    }

    @Override
    public String toString() {
        return "ShowGroup{" + canonicalTitle + " (" + year + ") [" + externalId
            + "], " + members.size() + " member(s)}";
    }
}
