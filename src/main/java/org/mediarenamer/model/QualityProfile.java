package org.mediarenamer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Normalized bundle of the technical and quality attributes of one media file.
 *
 * <p>Every scalar attribute is nullable; null means "unset".  Quality tags are
 * an ordered list that may repeat a tag if the name mentioned it twice.
 * Instances are immutable; use {@link Builder} to create one.
 */
public final class QualityProfile {

    public static final QualityProfile EMPTY = new Builder().build();

    private final String resolution;
    private final String videoCodec;
    private final String audioCodec;
    private final String audioChannels;
    private final String source;
    private final List<String> qualityTags;
    private final String releaseGroup;

    private QualityProfile(final Builder builder) {
        resolution = builder.resolution;
        videoCodec = builder.videoCodec;
        audioCodec = builder.audioCodec;
        audioChannels = builder.audioChannels;
        source = builder.source;
        qualityTags = Collections.unmodifiableList(
            new ArrayList<>(builder.qualityTags)
        );
        releaseGroup = builder.releaseGroup;
    }

    public String getResolution() {
        return resolution;
    }

    public String getVideoCodec() {
        return videoCodec;
    }

    public String getAudioCodec() {
        return audioCodec;
    }

    public String getAudioChannels() {
        return audioChannels;
    }

    public String getSource() {
        return source;
    }

    public List<String> getQualityTags() {
        return qualityTags;
    }

    public String getReleaseGroup() {
        return releaseGroup;
    }

    /**
     * @return true if this profile has a value for at least two of resolution,
     *   video codec and source; the filename alone is then considered good enough
     */
    public boolean hasEssentials() {
        int populated = 0;
        if (resolution != null) {
            populated++;
        }
        if (videoCodec != null) {
            populated++;
        }
        if (source != null) {
            populated++;
        }
        return populated >= 2;
    }

    public boolean isEmpty() {
        return resolution == null
            && videoCodec == null
            && audioCodec == null
            && audioChannels == null
            && source == null
            && qualityTags.isEmpty()
            && releaseGroup == null;
    }

    /**
     * Merge field by field, preferring this profile's values.
     *
     * @param fallback
     *    the profile consulted for every field this one leaves unset
     * @return a new profile; neither input is modified
     */
    public QualityProfile mergedWith(final QualityProfile fallback) {
        if (fallback == null) {
            return this;
        }
        return new Builder()
            .resolution(firstSet(resolution, fallback.resolution))
            .videoCodec(firstSet(videoCodec, fallback.videoCodec))
            .audioCodec(firstSet(audioCodec, fallback.audioCodec))
            .audioChannels(firstSet(audioChannels, fallback.audioChannels))
            .source(firstSet(source, fallback.source))
            .qualityTags(
                qualityTags.isEmpty() ? fallback.qualityTags : qualityTags
            )
            .releaseGroup(firstSet(releaseGroup, fallback.releaseGroup))
            .build();
    }

    private static String firstSet(final String preferred, final String other) {
        return (preferred != null) ? preferred : other;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QualityProfile)) {
            return false;
        }
        QualityProfile that = (QualityProfile) o;
        return Objects.equals(resolution, that.resolution)
            && Objects.equals(videoCodec, that.videoCodec)
            && Objects.equals(audioCodec, that.audioCodec)
            && Objects.equals(audioChannels, that.audioChannels)
            && Objects.equals(source, that.source)
            && qualityTags.equals(that.qualityTags)
            && Objects.equals(releaseGroup, that.releaseGroup);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
            resolution,
            videoCodec,
            audioCodec,
            audioChannels,
            source,
            qualityTags,
            releaseGroup
        );
    }

    @Override
    public String toString() {
        return "QualityProfile{resolution=" + resolution
            + ", videoCodec=" + videoCodec
            + ", audioCodec=" + audioCodec
            + ", audioChannels=" + audioChannels
            + ", source=" + source
            + ", qualityTags=" + qualityTags
            + ", releaseGroup=" + releaseGroup + "}";
    }

    public static class Builder {

        private String resolution;
        private String videoCodec;
        private String audioCodec;
        private String audioChannels;
        private String source;
        private final List<String> qualityTags = new ArrayList<>();
        private String releaseGroup;

        public Builder resolution(final String val) {
            resolution = val;
            return this;
        }

        public Builder videoCodec(final String val) {
            videoCodec = val;
            return this;
        }

        public Builder audioCodec(final String val) {
            audioCodec = val;
            return this;
        }

        public Builder audioChannels(final String val) {
            audioChannels = val;
            return this;
        }

        public Builder source(final String val) {
            source = val;
            return this;
        }

        public Builder qualityTags(final List<String> val) {
            qualityTags.clear();
            if (val != null) {
                qualityTags.addAll(val);
            }
            return this;
        }

        public Builder addQualityTag(final String val) {
            qualityTags.add(val);
            return this;
        }

        public Builder releaseGroup(final String val) {
            releaseGroup = val;
            return this;
        }

        public QualityProfile build() {
            return new QualityProfile(this);
        }
    }
}
