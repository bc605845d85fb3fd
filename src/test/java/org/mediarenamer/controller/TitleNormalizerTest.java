package org.mediarenamer.controller;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class TitleNormalizerTest {

    private final TitleNormalizer normalizer = new TitleNormalizer();

    @Test
    public void testLowerCasesAndStripsPunctuation() {
        assertEquals("marvels agents of shield", normalizer.normalize("Marvel's Agents of S.H.I.E.L.D."));
        assertEquals("the office us", normalizer.normalize("  The   Office (US) "));
    }

    @Test
    public void testKeepsNonAsciiLetters() {
        assertEquals("amélie", normalizer.normalize("Amélie!"));
    }

    @Test
    public void testFranchiseVariantsFoldToCanonical() {
        assertEquals("smackdown", normalizer.normalize("WWE SmackDown"));
        assertEquals("smackdown", normalizer.normalize("Friday Night SmackDown"));
        assertEquals("smackdown", normalizer.normalize("SmackDown Live"));
        assertEquals("smackdown", normalizer.normalize("SmackDown XWT"));
        assertEquals("raw", normalizer.normalize("WWE Monday Night RAW"));
        assertEquals("nxt", normalizer.normalize("NXT"));
    }

    @Test
    public void testCanonicalWordMustBeAWholeWord() {
        assertEquals("drawn together", normalizer.normalize("Drawn Together"));
        assertEquals("next generation", normalizer.normalize("Next Generation"));
    }

    @Test
    public void testEmptyAndNull() {
        assertEquals("", normalizer.normalize(""));
        assertEquals("", normalizer.normalize(null));
    }
}
