package com.pricecheck.common.matching;

import com.pricecheck.common.matching.ProductNameNormalizer.SizeToken;
import com.pricecheck.common.model.MatchConfidence;
import com.pricecheck.common.model.MatchScore;
import com.pricecheck.common.model.ProductCandidate;
import com.pricecheck.common.model.RankedCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Scores free-text grocery queries against noisy retailer product names.
 *
 * <h3>Scoring</h3>
 * <ol>
 *   <li><strong>Base similarity</strong>: 0.6 &times; character sequence ratio of the
 *       normalized strings + 0.4 &times; Jaccard similarity of their keywords.</li>
 *   <li><strong>Exact-word bonus</strong>: fraction of query keywords present in the
 *       candidate, scaled by {@link MatchingThresholds#exactMatchBonus()}.</li>
 *   <li><strong>Brand bonus</strong>: flat, when a known brand appears in both.</li>
 *   <li><strong>Size bonus</strong>: full for an identical size token ({@code 2l}), half for
 *       a shared unit type or pack word; capped.</li>
 *   <li><strong>Keyword-count bonus</strong>: per overlapping keyword, at most three.</li>
 * </ol>
 * The total is capped at 1.0 and labelled HIGH / MEDIUM / LOW by the configured thresholds.
 *
 * <p>No I/O, no mutable state: a single instance is safe to share across threads.
 */
public class ProductMatcher {

    private static final Logger log = LoggerFactory.getLogger(ProductMatcher.class);

    private static final double SEQUENCE_WEIGHT = 0.6;
    private static final double KEYWORD_WEIGHT  = 0.4;
    private static final int    MAX_COUNTED_KEYWORDS = 3;

    private static final Set<String> KNOWN_BRANDS = Set.of(
        "woolworths", "coles", "iga", "aldi", "macro", "homebrand",
        "cadbury", "nestle", "kellogg", "uncle tobys", "sanitarium",
        "bega", "devondale", "paul's", "dairy farmers", "norco",
        "steggles", "lilydale", "ingham's", "tegel", "primo",
        "masterfoods", "maggi", "continental", "praise", "fountain"
    );

    private static final Set<String> PACK_WORDS = Set.of(
        "pack", "each", "dozen", "bunch", "bag", "box", "bottle",
        "can", "jar", "tube", "punnet", "tray", "roll", "sheet"
    );

    private static final List<Pattern> BRAND_PATTERNS = KNOWN_BRANDS.stream()
        .sorted()
        .map(brand -> Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(brand) + "(?![\\p{L}\\p{N}])"))
        .collect(Collectors.toUnmodifiableList());

    private final MatchingThresholds thresholds;

    public ProductMatcher() {
        this(MatchingThresholds.DEFAULTS);
    }

    public ProductMatcher(MatchingThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public MatchingThresholds thresholds() {
        return thresholds;
    }

    /**
     * Scores {@code candidateName} against {@code query}. Blank input on either side
     * yields {@link MatchScore#NONE}.
     */
    public MatchScore score(String query, String candidateName) {
        if (isBlank(query) || isBlank(candidateName)) {
            return MatchScore.NONE;
        }

        Set<String> queryKeywords     = new HashSet<>(ProductNameNormalizer.keywords(query));
        Set<String> candidateKeywords = new HashSet<>(ProductNameNormalizer.keywords(candidateName));
        Set<String> shared = new HashSet<>(queryKeywords);
        shared.retainAll(candidateKeywords);

        double base = SEQUENCE_WEIGHT * sequenceSimilarity(query, candidateName)
                    + KEYWORD_WEIGHT  * jaccard(queryKeywords, candidateKeywords, shared);

        double exact   = exactMatchBonus(queryKeywords, shared);
        double brand   = brandMatchBonus(query, candidateName);
        double size    = sizeMatchBonus(query, candidateName);
        double keyword = Math.min(shared.size(), MAX_COUNTED_KEYWORDS) * thresholds.keywordMatchBonus();

        double total = Math.min(1.0, base + exact + brand + size + keyword);
        return new MatchScore(total, base, exact, brand, size, keyword, confidenceFor(total));
    }

    /**
     * Scores every candidate, drops those below {@code minSimilarity} (and those without a
     * name) and sorts by total score, highest first. The sort is stable: equal scores keep
     * their input order.
     */
    public List<RankedCandidate> rank(String query, List<ProductCandidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        List<RankedCandidate> ranked = new ArrayList<>();
        for (ProductCandidate candidate : candidates) {
            if (candidate == null || isBlank(candidate.name())) {
                continue;
            }
            MatchScore score = score(query, candidate.name());
            if (score.totalScore() >= thresholds.minSimilarity()) {
                ranked.add(new RankedCandidate(candidate, score));
            }
        }
        ranked.sort(Comparator.comparingDouble((RankedCandidate r) -> r.score().totalScore()).reversed());
        return ranked;
    }

    public Optional<RankedCandidate> bestMatch(String query, List<ProductCandidate> candidates) {
        List<RankedCandidate> ranked = rank(query, candidates);
        if (ranked.isEmpty()) {
            log.debug("No match above minSimilarity. query={} candidates={} minSimilarity={}",
                query, candidates == null ? 0 : candidates.size(), thresholds.minSimilarity());
            return Optional.empty();
        }
        RankedCandidate best = ranked.get(0);
        log.debug("Best match. query={} product={} score={} confidence={}",
            query, best.candidate().name(), best.score().totalScore(), best.score().confidence());
        return Optional.of(best);
    }

    /** Best match followed by runners-up, at most {@code maxResults} entries. */
    public List<RankedCandidate> topMatches(String query, List<ProductCandidate> candidates, int maxResults) {
        List<RankedCandidate> ranked = rank(query, candidates);
        return ranked.size() <= maxResults ? ranked : List.copyOf(ranked.subList(0, maxResults));
    }

    // ── components ──────────────────────────────────────────────────────────

    double sequenceSimilarity(String query, String candidateName) {
        String a = ProductNameNormalizer.normalize(query);
        String b = ProductNameNormalizer.normalize(candidateName);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        return SequenceSimilarity.ratio(a, b);
    }

    private static double jaccard(Set<String> a, Set<String> b, Set<String> shared) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int union = a.size() + b.size() - shared.size();
        return union == 0 ? 0.0 : (double) shared.size() / union;
    }

    private double exactMatchBonus(Set<String> queryKeywords, Set<String> shared) {
        if (queryKeywords.isEmpty()) {
            return 0.0;
        }
        return ((double) shared.size() / queryKeywords.size()) * thresholds.exactMatchBonus();
    }

    private double brandMatchBonus(String query, String candidateName) {
        String q = query.toLowerCase(Locale.ROOT);
        String c = candidateName.toLowerCase(Locale.ROOT);
        for (Pattern brand : BRAND_PATTERNS) {
            if (brand.matcher(q).find() && brand.matcher(c).find()) {
                return thresholds.brandMatchBonus();
            }
        }
        return 0.0;
    }

    private double sizeMatchBonus(String query, String candidateName) {
        double cap  = thresholds.sizeMatchBonus();
        double half = cap * 0.5;

        List<SizeToken> querySizes     = ProductNameNormalizer.sizes(query);
        List<SizeToken> candidateSizes = ProductNameNormalizer.sizes(candidateName);
        Set<String> candidateSizeText  = candidateSizes.stream().map(SizeToken::text).collect(Collectors.toSet());
        Set<String> candidateUnits     = candidateSizes.stream().map(SizeToken::unit).collect(Collectors.toSet());

        double bonus = 0.0;
        Set<String> creditedUnits = new HashSet<>();
        for (SizeToken size : querySizes) {
            if (candidateSizeText.contains(size.text())) {
                bonus += cap;
            } else if (candidateUnits.contains(size.unit()) && creditedUnits.add(size.unit())) {
                bonus += half;
            }
        }

        Set<String> candidateTokens = new HashSet<>(ProductNameNormalizer.tokens(candidateName));
        for (String token : new HashSet<>(ProductNameNormalizer.tokens(query))) {
            if (PACK_WORDS.contains(token) && candidateTokens.contains(token)) {
                bonus += half;
            }
        }
        return Math.min(bonus, cap);
    }

    private MatchConfidence confidenceFor(double total) {
        if (total >= thresholds.highConfidence()) {
            return MatchConfidence.HIGH;
        }
        if (total >= thresholds.mediumConfidence()) {
            return MatchConfidence.MEDIUM;
        }
        return MatchConfidence.LOW;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
