package org.catalogsearch.ranking.service.scoring;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Text normalization shared by the textual and categorical scorers.
 */
public final class TextTokens {

    /** Anything that is not a letter or digit separates tokens. */
    private static final Pattern SEPARATOR = Pattern.compile("[^\\p{L}\\p{Nd}]+");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /** Tokens shorter than this only match whole field tokens, never substrings. */
    private static final int MIN_SUBSTRING_TOKEN = 3;

    private TextTokens() {}

    /**
     * Lower-cases and collapses whitespace.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    /**
     * Splits text into its distinct lower-case tokens, in order of appearance.
     */
    public static Set<String> tokens(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        for (String token : SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * Returns whether a field mentions any of the tokens: either as one of its own tokens, or,
     * for tokens of at least three characters, as a substring ("shoe" in "running shoes").
     */
    public static boolean mentions(String field, Collection<String> tokens) {
        if (field == null || field.isBlank() || tokens.isEmpty()) {
            return false;
        }
        String normalized = normalize(field);
        Set<String> fieldTokens = tokens(field);
        for (String token : tokens) {
            if (fieldTokens.contains(token)) {
                return true;
            }
            if (token.length() >= MIN_SUBSTRING_TOKEN && normalized.contains(token)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Token-set Jaccard similarity.
     */
    public static double jaccard(Set<String> left, Set<String> right) {
        if (left.isEmpty() && right.isEmpty()) {
            return 0.0d;
        }
        Set<String> union = new LinkedHashSet<>(left);
        union.addAll(right);
        int intersection = 0;
        for (String token : left) {
            if (right.contains(token)) {
                intersection++;
            }
        }
        return (double) intersection / union.size();
    }

    public static boolean equalsIgnoreCase(String left, String right) {
        return left != null && right != null && normalize(left).equals(normalize(right));
    }

    public static boolean containsIgnoreCase(Collection<String> values, String value) {
        if (values == null || value == null) {
            return false;
        }
        for (String candidate : values) {
            if (equalsIgnoreCase(candidate, value)) {
                return true;
            }
        }
        return false;
    }
}
