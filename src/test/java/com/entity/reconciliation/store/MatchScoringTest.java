package com.entity.reconciliation.store;

import com.entity.reconciliation.core.model.Candidate;
import com.entity.reconciliation.core.model.Entity;
import com.entity.reconciliation.core.model.EntityType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MatchScoring Tests")
class MatchScoringTest {

    private static final Entity ADAMS = Entity.builder()
            .id("person:q42")
            .name("Douglas Adams")
            .type(EntityType.of("person", "Person"))
            .build();

    @Nested
    @DisplayName("Match threshold")
    class ThresholdTests {

        @Test
        @DisplayName("A score of exactly 80 is not a match")
        void thresholdIsExclusive() {
            assertFalse(MatchScoring.isMatch(80.0));
            assertTrue(MatchScoring.isMatch(80.0001));
        }

        @Test
        @DisplayName("Exact id candidates score 100 and match")
        void exactMatch() {
            Candidate c = MatchScoring.exactMatch(ADAMS);
            assertEquals(100.0, c.score());
            assertTrue(c.match());
            assertEquals("person:q42", c.id());
        }

        @Test
        @DisplayName("Scored candidates derive the match flag from the score")
        void scored() {
            assertFalse(MatchScoring.scored(ADAMS, 53.8).match());
            assertTrue(MatchScoring.scored(ADAMS, 95.0).match());
        }
    }

    @Nested
    @DisplayName("Heuristic score")
    class HeuristicTests {

        @Test
        @DisplayName("Raw key equal ignoring case scores 95")
        void rawKeyIgnoringCase() {
            assertEquals(95.0, MatchScoring.heuristicScore("Q42", ADAMS, ""));
        }

        @Test
        @DisplayName("Name containment scores the length ratio")
        void nameContainment() {
            assertEquals(7 * 100.0 / 13, MatchScoring.heuristicScore("douglas", ADAMS, ""), 1e-9);
            assertEquals(100.0, MatchScoring.heuristicScore("DOUGLAS ADAMS", ADAMS, ""), 1e-9);
        }

        @Test
        @DisplayName("A matching type adds 10")
        void typeBonus() {
            double plain = MatchScoring.heuristicScore("Douglas", ADAMS, "");
            double typed = MatchScoring.heuristicScore("Douglas", ADAMS, "person");

            assertEquals(plain + 10.0, typed, 1e-9);
            assertEquals(plain, MatchScoring.heuristicScore("Douglas", ADAMS, "place"), 1e-9);
        }

        @Test
        @DisplayName("Type bonus applies without a text match")
        void typeBonusAlone() {
            assertEquals(10.0, MatchScoring.heuristicScore("Hofstadter", ADAMS, "person"));
            assertEquals(0.0, MatchScoring.heuristicScore("Hofstadter", ADAMS, ""));
        }
    }

    @Nested
    @DisplayName("Normalization")
    class NormalizationTests {

        @Test
        @DisplayName("Best hit is mapped to the larger length ratio")
        void bestHitScale() {
            double scale = MatchScoring.normalizationScale("Douglas Adams", "person:q42", "Douglas Adams", -2.0);

            // 13 chars against a 10-char id
            assertEquals(130.0, MatchScoring.normalize(-2.0, scale), 1e-9);
        }

        @Test
        @DisplayName("Negative native scores yield positive, ordered scores")
        void negativeNativeScores() {
            double scale = MatchScoring.normalizationScale("Douglas", "person:q2", "Kirk Douglas", -1.5);

            double best = MatchScoring.normalize(-1.5, scale);
            double worse = MatchScoring.normalize(-0.75, scale);
            assertTrue(best > worse);
            assertTrue(worse > 0.0);
            assertEquals(best / 2, worse, 1e-9);
        }

        @Test
        @DisplayName("Zero native score yields a zero scale")
        void zeroNativeScore() {
            assertEquals(0.0, MatchScoring.normalizationScale("x", "t:x", "x", 0.0));
            assertEquals(0.0, MatchScoring.normalize(-3.0, 0.0));
        }
    }
}
