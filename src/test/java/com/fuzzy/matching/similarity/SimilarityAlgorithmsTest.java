package com.fuzzy.matching.similarity;

import com.fuzzy.matching.core.model.CodePointSequence;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityAlgorithmsTest {

    private static CodePointSequence cp(String s) {
        return CodePointSequence.of(s);
    }

    // ============ Hamming Tests ============

    @Nested
    @DisplayName("Hamming")
    class HammingTests {

        @Test
        @DisplayName("Hamming: counts differing positions")
        void countsDifferences() {
            assertEquals(7, Hamming.distance(cp("Hello world!"), cp("Holly grail!")));
            assertEquals(5, Hamming.distance(cp("Brian"), cp("Jesus")));
            assertEquals(0, Hamming.distance(cp(""), cp("")));
        }

        @Test
        @DisplayName("Hamming: different lengths throw LengthMismatchException")
        void lengthMismatch() {
            LengthMismatchException e = assertThrows(LengthMismatchException.class,
                    () -> Hamming.distance(cp("abc"), cp("ab")));
            assertEquals(3, e.getFirstLength());
            assertEquals(2, e.getSecondLength());
            assertInstanceOf(IllegalArgumentException.class, e);
        }
    }

    // ============ Jaro Tests ============

    @Nested
    @DisplayName("Jaro")
    class JaroTests {

        private JaroSimilarity jaro;

        @BeforeEach
        void setUp() {
            jaro = new JaroSimilarity();
        }

        @Test
        @DisplayName("Jaro: classic examples")
        void classicExamples() {
            assertEquals(0.0, JaroSimilarity.jaro(cp("Brian"), cp("Jesus")));
            assertEquals(0.7798, JaroSimilarity.jaro(cp("Thorkel"), cp("Thorgier")), 1e-4);
            assertEquals(0.7083, JaroSimilarity.jaro(cp("Dinsdale"), cp("D")), 1e-4);
            assertEquals(0.9444, JaroSimilarity.jaro(cp("MARTHA"), cp("MARHTA")), 1e-4);
        }

        @Test
        @DisplayName("Jaro: empty inputs")
        void emptyInputs() {
            assertEquals(1.0, JaroSimilarity.jaro(cp(""), cp("")));
            assertEquals(0.0, JaroSimilarity.jaro(cp(""), cp("abc")));
            assertEquals(0.0, JaroSimilarity.jaro(cp("abc"), cp("")));
        }

        @Test
        @DisplayName("Jaro: String adapter treats null as no similarity")
        void stringAdapter() {
            assertEquals(1.0, jaro.compute("test", "test"));
            assertEquals(0.0, jaro.compute(null, "test"));
            assertEquals("Jaro", jaro.getName());
        }
    }

    // ============ Jaro-Winkler Tests ============

    @Nested
    @DisplayName("Jaro-Winkler")
    class JaroWinklerTests {

        @Test
        @DisplayName("Jaro-Winkler: classic examples with the default prefix weight")
        void classicExamples() {
            assertEquals(0.8679, JaroWinklerSimilarity.jaroWinkler(cp("Thorkel"), cp("Thorgier")), 1e-4);
            assertEquals(0.7375, JaroWinklerSimilarity.jaroWinkler(cp("Dinsdale"), cp("D")), 1e-4);
            assertEquals(0.0, JaroWinklerSimilarity.jaroWinkler(cp("Brian"), cp("Jesus")));
        }

        @Test
        @DisplayName("Jaro-Winkler: prefix weight 0.25 saturates at 1.0")
        void saturatedPrefixWeight() {
            assertEquals(1.0, JaroWinklerSimilarity.jaroWinkler(cp("Thorkel"), cp("Thorgier"), 0.25), 1e-9);
        }

        @Test
        @DisplayName("Jaro-Winkler: large prefix weights are capped at 1.0")
        void cappedAtOne() {
            double score = JaroWinklerSimilarity.jaroWinkler(cp("Thorkel"), cp("Thorgier"), 10.0);
            assertEquals(1.0, score);
        }

        @Test
        @DisplayName("Jaro-Winkler: zero prefix weight equals Jaro")
        void zeroPrefixWeight() {
            assertEquals(JaroSimilarity.jaro(cp("Thorkel"), cp("Thorgier")),
                    JaroWinklerSimilarity.jaroWinkler(cp("Thorkel"), cp("Thorgier"), 0.0));
        }

        @Test
        @DisplayName("Jaro-Winkler: common prefix increases the score")
        void prefixIncreasesScore() {
            JaroWinklerSimilarity jaroWinkler = new JaroWinklerSimilarity();
            double withPrefix = jaroWinkler.compute("MARTHA", "MARHTA");
            double withoutPrefix = jaroWinkler.compute("MARTHA", "AMRTHA");
            assertTrue(withPrefix > withoutPrefix, "Common prefix should increase score");
        }

        @Test
        @DisplayName("Jaro-Winkler: negative or NaN prefix weight is rejected")
        void invalidPrefixWeight() {
            assertThrows(IllegalArgumentException.class, () -> new JaroWinklerSimilarity(-0.1));
            assertThrows(IllegalArgumentException.class,
                    () -> JaroWinklerSimilarity.jaroWinkler(cp("a"), cp("a"), Double.NaN));
            assertEquals(0.2, new JaroWinklerSimilarity(0.2).getPrefixWeight());
        }
    }
}
