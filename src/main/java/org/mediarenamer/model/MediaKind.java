package org.mediarenamer.model;

public enum MediaKind {
    MOVIE,
    EPISODE,
    UNKNOWN,
}
