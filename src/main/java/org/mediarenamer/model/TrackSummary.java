package org.mediarenamer.model;

/**
 * Track-level facts reported by a technical probe of a media container.
 * Each field is null when the probe did not report it.
 *
 * @param videoHeight   height in pixels of the first video track
 * @param videoCodec    codec/format tag of the first video track
 * @param audioCodec    codec/format tag of the first audio track
 * @param audioChannels channel count of the first audio track
 */
public record TrackSummary(
    Integer videoHeight,
    String videoCodec,
    String audioCodec,
    Integer audioChannels
) {
}
