package com.pricecheck.common.matching;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text normalization shared by all matcher components.
 *
 * <p>Normalized form: lower case, first known retailer/descriptor prefix removed, unit
 * spellings collapsed onto the value ({@code "2 litres" → "2l"}, {@code "500 grams" → "500g"}),
 * single spaces.
 */
public final class ProductNameNormalizer {

    private static final List<String> PREFIXES = List.of(
        "woolworths ", "coles ", "iga ", "aldi ", "macro ", "homebrand ",
        "select ", "brand ", "organic ", "free range ", "natural "
    );

    private static final Map<Pattern, String> UNIT_SPELLINGS = new LinkedHashMap<>();

    static {
        UNIT_SPELLINGS.put(Pattern.compile("\\b(\\d+(?:\\.\\d+)?)\\s*(?:millilitres?|milliliters?|mls?)\\b"), "$1ml");
        UNIT_SPELLINGS.put(Pattern.compile("\\b(\\d+(?:\\.\\d+)?)\\s*(?:litres?|liters?|ltrs?|l)\\b"), "$1l");
        UNIT_SPELLINGS.put(Pattern.compile("\\b(\\d+(?:\\.\\d+)?)\\s*(?:kilograms?|kilos?|kgs?)\\b"), "$1kg");
        UNIT_SPELLINGS.put(Pattern.compile("\\b(\\d+(?:\\.\\d+)?)\\s*(?:grams?|gms?|g)\\b"), "$1g");
    }

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TOKEN      = Pattern.compile("\\d+\\.\\d+[a-z]*|\\w+");
    private static final Pattern SIZE_TOKEN = Pattern.compile("\\b(\\d+(?:\\.\\d+)?)(ml|kg|l|g)\\b");

    private static final Set<String> STOP_WORDS = Set.of(
        "the", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with",
        "by", "from", "as", "is", "was", "are", "were", "be", "been", "being",
        "have", "has", "had", "do", "does", "did", "will", "would", "could",
        "should", "may", "might", "must", "can", "this", "that", "these",
        "those", "a", "an"
    );

    private ProductNameNormalizer() { /* utility class */ }

    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String normalized = WHITESPACE.matcher(name.toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
        for (String prefix : PREFIXES) {
            if (normalized.startsWith(prefix)) {
                normalized = normalized.substring(prefix.length());
                break;
            }
        }
        for (Map.Entry<Pattern, String> unit : UNIT_SPELLINGS.entrySet()) {
            normalized = unit.getKey().matcher(normalized).replaceAll(unit.getValue());
        }
        return WHITESPACE.matcher(normalized).replaceAll(" ").trim();
    }

    /** All tokens of the normalized text, in order. */
    public static List<String> tokens(String text) {
        List<String> tokens = new ArrayList<>();
        Matcher m = TOKEN.matcher(normalize(text));
        while (m.find()) {
            tokens.add(m.group());
        }
        return tokens;
    }

    /** Tokens of at least two characters that are not stop words. */
    public static List<String> keywords(String text) {
        List<String> keywords = new ArrayList<>();
        for (String token : tokens(text)) {
            if (token.length() >= 2 && !STOP_WORDS.contains(token)) {
                keywords.add(token);
            }
        }
        return keywords;
    }

    /** Normalized size tokens such as {@code "2l"} or {@code "500g"}. */
    public static List<SizeToken> sizes(String text) {
        List<SizeToken> sizes = new ArrayList<>();
        Matcher m = SIZE_TOKEN.matcher(normalize(text));
        while (m.find()) {
            sizes.add(new SizeToken(m.group(1), m.group(2)));
        }
        return sizes;
    }

    public record SizeToken(String value, String unit) {
        public String text() {
            return value + unit;
        }
    }
}
