package com.pricecheck.common.matching;

import com.pricecheck.common.model.MatchConfidence;
import com.pricecheck.common.model.MatchScore;
import com.pricecheck.common.model.ProductCandidate;
import com.pricecheck.common.model.RankedCandidate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link ProductMatcher} scoring, ranking and selection.
 */
class ProductMatcherTest {

    private final ProductMatcher matcher = new ProductMatcher();

    private static ProductCandidate candidate(String name, double price) {
        return ProductCandidate.of(name, price, "woolworths");
    }

    // ── score() ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("score()")
    class ScoreTests {

        @Test
        @DisplayName("identical query and name → at least 0.9 and HIGH")
        void identicalStrings() {
            MatchScore score = matcher.score("milk 2L", "milk 2L");
            assertTrue(score.totalScore() >= 0.9, "Expected >= 0.9 but got " + score.totalScore());
            assertEquals(MatchConfidence.HIGH, score.confidence());
        }

        @Test
        @DisplayName("unrelated product → below 0.3")
        void unrelatedProduct() {
            MatchScore score = matcher.score("milk", "chocolate biscuits 300g");
            assertTrue(score.totalScore() < 0.3, "Expected < 0.3 but got " + score.totalScore());
            assertEquals(MatchConfidence.LOW, score.confidence());
        }

        @Test
        @DisplayName("unit spelling variants score as the same product")
        void unitVariants() {
            MatchScore score = matcher.score("milk 2L", "Milk 2 Litres");
            assertEquals(1.0, score.totalScore(), 1e-9);
        }

        @Test
        @DisplayName("total never exceeds 1.0")
        void totalCapped() {
            MatchScore score = matcher.score("cadbury dairy milk 180g", "Cadbury Dairy Milk 180g");
            assertEquals(1.0, score.totalScore(), 1e-9);
            assertTrue(score.baseSimilarity() + score.totalBonus() > 1.0);
        }

        @Test
        @DisplayName("blank input → NONE")
        void blankInput() {
            assertEquals(MatchScore.NONE, matcher.score("", "milk"));
            assertEquals(MatchScore.NONE, matcher.score("milk", null));
        }

        @Test
        @DisplayName("known brand in both strings → flat brand bonus")
        void brandBonus() {
            MatchScore score = matcher.score("cadbury chocolate", "Cadbury Dairy Milk Chocolate 180g");
            assertEquals(0.15, score.brandMatchBonus(), 1e-9);
        }

        @Test
        @DisplayName("brand must appear as a whole word")
        void brandWholeWord() {
            MatchScore score = matcher.score("iga cheese", "Bigas Cheese Slices");
            assertEquals(0.0, score.brandMatchBonus(), 1e-9);
        }

        @Test
        @DisplayName("brand bonus does not depend on the default locale")
        void brandBonusUnderTurkishLocale() {
            Locale previous = Locale.getDefault();
            Locale.setDefault(new Locale("tr", "TR"));
            try {
                MatchScore score = matcher.score("IGA MILK 2L", "IGA Milk 2 Litres");
                assertEquals(0.15, score.brandMatchBonus(), 1e-9);
            } finally {
                Locale.setDefault(previous);
            }
        }

        @Test
        @DisplayName("identical size token → full size bonus")
        void exactSizeBonus() {
            MatchScore score = matcher.score("milk 2L", "Dairy Farmers Milk 2 Litre");
            assertEquals(0.1, score.sizeMatchBonus(), 1e-9);
        }

        @Test
        @DisplayName("same unit type, different value → half size bonus")
        void partialSizeBonus() {
            MatchScore score = matcher.score("milk 2L", "Full Cream Milk 1L");
            assertEquals(0.05, score.sizeMatchBonus(), 1e-9);
        }

        @Test
        @DisplayName("exact-word bonus scales with the fraction of query words found")
        void exactMatchBonus() {
            MatchScore score = matcher.score("milk bread", "milk 2l");
            assertEquals(0.1, score.exactMatchBonus(), 1e-9);
        }

        @Test
        @DisplayName("keyword-count bonus is capped at three keywords")
        void keywordBonusCapped() {
            MatchScore score = matcher.score("fresh full cream milk", "Fresh Full Cream Milk 2L");
            assertEquals(0.15, score.keywordMatchBonus(), 1e-9);
        }

        @Test
        @DisplayName("custom thresholds change the confidence label")
        void customThresholds() {
            ProductMatcher strict = new ProductMatcher(new MatchingThresholds(0.3, 1.01, 1.0, 0.2, 0.15, 0.1, 0.05));
            assertEquals(MatchConfidence.MEDIUM, strict.score("milk 2L", "milk 2L").confidence());
        }
    }

    // ── rank() / bestMatch() ──────────────────────────────────────────────

    @Nested
    @DisplayName("rank() and bestMatch()")
    class RankTests {

        private final List<ProductCandidate> candidates = List.of(
            candidate("Chocolate Biscuits 300g", 3.50),
            candidate("Woolworths Full Cream Milk 2L", 3.10),
            candidate("Dairy Farmers Milk 2L", 3.60),
            candidate("Full Cream Milk 1L", 1.80)
        );

        @Test
        @DisplayName("scores are non-increasing")
        void nonIncreasing() {
            List<RankedCandidate> ranked = matcher.rank("full cream milk 2L", candidates);
            assertFalse(ranked.isEmpty());
            for (int i = 1; i < ranked.size(); i++) {
                assertTrue(ranked.get(i - 1).score().totalScore() >= ranked.get(i).score().totalScore(),
                    "Ranking not descending at index " + i);
            }
        }

        @Test
        @DisplayName("candidates below minSimilarity never appear")
        void belowThresholdExcluded() {
            List<RankedCandidate> ranked = matcher.rank("full cream milk 2L", candidates);
            assertTrue(ranked.stream().noneMatch(r -> r.candidate().name().startsWith("Chocolate")));
            assertTrue(ranked.stream().allMatch(r -> r.score().totalScore() >= 0.3));
        }

        @Test
        @DisplayName("best match is the closest name")
        void bestMatch() {
            Optional<RankedCandidate> best = matcher.bestMatch("full cream milk 2L", candidates);
            assertTrue(best.isPresent());
            assertEquals("Woolworths Full Cream Milk 2L", best.get().candidate().name());
        }

        @Test
        @DisplayName("no candidate over the bar → empty")
        void noMatch() {
            assertTrue(matcher.bestMatch("milk", List.of(candidate("Chocolate Biscuits 300g", 3.5))).isEmpty());
            assertTrue(matcher.bestMatch("milk", List.of()).isEmpty());
        }

        @Test
        @DisplayName("equal scores keep source order")
        void stableTies() {
            List<ProductCandidate> twins = List.of(
                candidate("Milk 2L", 3.10),
                candidate("Milk 2L", 2.90)
            );
            List<RankedCandidate> ranked = matcher.rank("milk 2L", twins);
            assertEquals(2, ranked.size());
            assertEquals(3.10, ranked.get(0).candidate().price());
            assertEquals(2.90, ranked.get(1).candidate().price());
        }

        @Test
        @DisplayName("nameless candidates are skipped")
        void namelessSkipped() {
            List<ProductCandidate> withBlank = List.of(candidate(" ", 1.0), candidate("Milk 2L", 3.0));
            assertEquals(1, matcher.rank("milk 2L", withBlank).size());
        }

        @Test
        @DisplayName("topMatches() limits the result size")
        void topMatchesLimit() {
            assertEquals(2, matcher.topMatches("full cream milk 2L", candidates, 2).size());
        }
    }
}
