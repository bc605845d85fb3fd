package org.mediarenamer.model;

/**
 * A confirmed identity for a show or movie, as returned by an identity lookup.
 *
 * @param title      the canonical title
 * @param year       first-aired (or release) year; may be null
 * @param externalId the provider id; may be null
 */
public record ShowIdentity(String title, Integer year, String externalId) {
}
