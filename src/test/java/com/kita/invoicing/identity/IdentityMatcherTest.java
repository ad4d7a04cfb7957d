package com.kita.invoicing.identity;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for IdentityMatcher
 */
class IdentityMatcherTest {

    private IdentityMatcher matcher;

    @BeforeEach
    void setUp() {
        matcher = new IdentityMatcher();
    }

    @Nested
    @DisplayName("normalize")
    class Normalize {

        @Test
        @DisplayName("should strip S.A. de C.V. with punctuation")
        void shouldStripSaDeCv() {
            assertEquals("ESCUELA KEMPER URGATE", matcher.normalize("Escuela Kemper Urgate, S.A. de C.V."));
            assertEquals("ESCUELA KEMPER URGATE", matcher.normalize("ESCUELA KEMPER URGATE SA DE CV"));
        }

        @Test
        @DisplayName("should strip S. de R.L. de C.V.")
        void shouldStripSdeRl() {
            assertEquals("SERVICIOS INTEGRALES", matcher.normalize("Servicios Integrales S. de R.L. de C.V."));
        }

        @Test
        @DisplayName("should strip civil association suffix")
        void shouldStripAc() {
            assertEquals("FUNDACION AMIGOS", matcher.normalize("Fundación Amigos A.C."));
        }

        @Test
        @DisplayName("should fold accents and eñe")
        void shouldFoldAccents() {
            assertEquals("COMPANIA NANDU", matcher.normalize("Compañía Ñandú"));
        }

        @Test
        @DisplayName("should keep suffix-like letters inside words")
        void shouldKeepWordsEndingLikeSuffixes() {
            assertEquals("COMERCIAL SAN", matcher.normalize("Comercial San"));
        }

        @Test
        @DisplayName("should return empty string for null")
        void shouldHandleNull() {
            assertEquals("", matcher.normalize(null));
        }
    }

    @Nested
    @DisplayName("similarity")
    class Similarity {

        @Test
        @DisplayName("should score equal names after normalization as 1.0")
        void shouldScoreEqualNames() {
            assertEquals(1.0, matcher.similarity("ESCUELA KEMPER URGATE SA DE CV", "Escuela Kemper Urgate"));
        }

        @Test
        @DisplayName("should score a one-letter difference above the default threshold")
        void shouldTolerateSmallDifferences() {
            assertTrue(matcher.matches("Escuela Kemper Urgate", "Escuela Kemper Urgates"));
        }

        @Test
        @DisplayName("should reject unrelated names")
        void shouldRejectUnrelatedNames() {
            double score = matcher.similarity("Escuela Kemper Urgate", "Comercializadora del Norte");

            assertTrue(score < 0.85, "score was " + score);
            assertFalse(matcher.matches("Escuela Kemper Urgate", "Comercializadora del Norte"));
        }

        @Test
        @DisplayName("should be symmetric")
        void shouldBeSymmetric() {
            String a = "ESCUELA KEMPER";
            String b = "KEMPER ESCUELA URGATE";

            assertEquals(matcher.similarity(a, b), matcher.similarity(b, a));
        }

        @Test
        @DisplayName("should treat two empty names as identical")
        void shouldTreatEmptyAsIdentical() {
            assertEquals(1.0, matcher.similarity(null, ""));
        }

        @Test
        @DisplayName("should not match names made only of a legal form")
        void shouldNotMatchLegalFormOnly() {
            assertEquals(0.0, matcher.similarity("S.A.", "A.C."));
            assertFalse(matcher.matches("S.A.", "A.C."));
        }

        @Test
        @DisplayName("should score a blank name against a real one as zero")
        void shouldScoreBlankAgainstNameAsZero() {
            assertEquals(0.0, matcher.similarity("", "Escuela Kemper Urgate"));
            assertEquals(0.0, matcher.similarity("Escuela Kemper Urgate", null));
        }

        @Test
        @DisplayName("should return zero when nothing matches")
        void shouldReturnZero() {
            assertEquals(0.0, matcher.similarity("ABC", "XYZ"));
        }
    }

    @Nested
    @DisplayName("threshold")
    class Threshold {

        @Test
        @DisplayName("should reject thresholds outside (0, 1]")
        void shouldRejectInvalidThreshold() {
            assertThrows(IllegalArgumentException.class, () -> new IdentityMatcher(0.0));
            assertThrows(IllegalArgumentException.class, () -> new IdentityMatcher(1.01));
        }

        @Test
        @DisplayName("should require exact match at threshold 1.0")
        void shouldRequireExactMatch() {
            IdentityMatcher strict = new IdentityMatcher(1.0);

            assertFalse(strict.matches("Escuela Kemper Urgate", "Escuela Kemper Urgates"));
            assertTrue(strict.matches("Escuela Kemper Urgate S.A.", "ESCUELA KEMPER URGATE"));
        }
    }
}
