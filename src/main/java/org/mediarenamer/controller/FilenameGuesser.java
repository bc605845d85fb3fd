package org.mediarenamer.controller;

import org.mediarenamer.model.FilenameGuess;

/**
 * Guesses structured fields from a bare filename.  Implementations must never
 * throw; fields they cannot find are left null.
 */
@FunctionalInterface
public interface FilenameGuesser {

    FilenameGuess guess(String filename);
}
