package com.padelrank.padelrank_api.service;

import com.padelrank.padelrank_api.model.Pair;

import java.util.Locale;

/**
 * Reads category and division out of a pair.
 *
 * Category is two-tier: the explicit {@code category} attribute wins; otherwise the
 * first whitespace-delimited token of the group label is used ("Femenino A" → femenino).
 * Single-letter explicit values ("M"/"F") are expanded so both tiers compare equal.
 * Results are lower-cased; null means the category cannot be determined.
 */
public final class CategoryResolver {

    private CategoryResolver() {}

    public static String categoryOf(Pair pair) {
        String explicit = pair.getCategory();
        if (explicit != null && !explicit.isBlank()) {
            return normalizeCategory(explicit.trim());
        }
        String label = pair.getGroupLabel();
        if (label == null || label.isBlank()) {
            return null;
        }
        String[] tokens = label.trim().split("\\s+");
        // A bare division letter ("A") carries no category
        if (tokens.length < 2) {
            return null;
        }
        return normalizeCategory(tokens[0]);
    }

    /**
     * Division letter: last token of the label, upper-cased. A legacy single-token
     * label ("B") is the division itself.
     */
    public static String divisionOf(Pair pair) {
        String label = pair.getGroupLabel();
        if (label == null || label.isBlank()) {
            return null;
        }
        String[] tokens = label.trim().split("\\s+");
        return tokens[tokens.length - 1].toUpperCase(Locale.ROOT);
    }

    public static boolean sameCategory(Pair a, Pair b) {
        String categoryA = categoryOf(a);
        return categoryA != null && categoryA.equals(categoryOf(b));
    }

    public static boolean sameGroup(Pair a, Pair b) {
        return a.getGroupLabel() != null && b.getGroupLabel() != null
                && a.getGroupLabel().trim().equalsIgnoreCase(b.getGroupLabel().trim());
    }

    /**
     * True when the filter names this pair's exact group ("Masculino B") or
     * just its category ("Masculino"). Case-insensitive.
     */
    public static boolean matchesGroupFilter(Pair pair, String filter) {
        if (filter == null || filter.isBlank()) {
            return true;
        }
        String f = filter.trim();
        if (pair.getGroupLabel() != null && pair.getGroupLabel().trim().equalsIgnoreCase(f)) {
            return true;
        }
        return !f.contains(" ") && normalizeCategory(f).equals(categoryOf(pair));
    }

    static String normalizeCategory(String raw) {
        String c = raw.toLowerCase(Locale.ROOT);
        return switch (c) {
            case "m" -> "masculino";
            case "f" -> "femenino";
            default -> c;
        };
    }
}
