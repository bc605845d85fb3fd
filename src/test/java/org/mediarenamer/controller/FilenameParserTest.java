package org.mediarenamer.controller;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.mediarenamer.model.FilenameGuess;
import org.mediarenamer.model.MediaKind;

public class FilenameParserTest {

    private final FilenameParser parser = new FilenameParser();

    @Test
    public void testSceneEpisode() {
        FilenameGuess guess = parser.guess("Breaking.Bad.S03E07.One.Minute.720p.HDTV.x264-GRP.mkv");
        assertEquals("Breaking Bad", guess.title());
        assertEquals(3, guess.season());
        assertEquals(7, guess.episode());
        assertEquals("One Minute", guess.episodeTitle());
        assertEquals(MediaKind.EPISODE, guess.kind());
    }

    @Test
    public void testSeasonEpisodeWords() {
        FilenameGuess guess = parser.guess("Lost Season 2 Episode 10.avi");
        assertEquals("Lost", guess.title());
        assertEquals(2, guess.season());
        assertEquals(10, guess.episode());
        assertEquals(MediaKind.EPISODE, guess.kind());
    }

    @Test
    public void testCrossFormat() {
        FilenameGuess guess = parser.guess("futurama.4x08.mp4");
        assertEquals("futurama", guess.title());
        assertEquals(4, guess.season());
        assertEquals(8, guess.episode());
    }

    @Test
    public void testEpisodeWithYearInTitle() {
        FilenameGuess guess = parser.guess("Doctor Who (2005) - S01E01 - Rose [1080p].mkv");
        assertEquals("Doctor Who", guess.title());
        assertEquals(2005, guess.year());
        assertEquals(1, guess.season());
        assertEquals("Rose", guess.episodeTitle());
    }

    @Test
    public void testMovie() {
        FilenameGuess guess = parser.guess("Heat.1995.1080p.BluRay.x264.mkv");
        assertEquals("Heat", guess.title());
        assertEquals(1995, guess.year());
        assertNull(guess.season());
        assertEquals(MediaKind.MOVIE, guess.kind());
    }

    @Test
    public void testUnrecognised() {
        FilenameGuess guess = parser.guess("sample.mkv");
        assertEquals("sample", guess.title());
        assertNull(guess.season());
        assertNull(guess.year());
        assertEquals(MediaKind.UNKNOWN, guess.kind());
    }

    @Test
    public void testBlankIsNothing() {
        assertSame(FilenameGuess.NOTHING, parser.guess(""));
        assertSame(FilenameGuess.NOTHING, parser.guess(null));
    }
}
