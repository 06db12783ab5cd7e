package com.tendersearch.search.consolidation;

import com.tendersearch.search.model.Tender;

import java.util.Locale;

/**
 * Fixed-weight substring match of the search term against title, description and organization.
 * Weights add up independently and the result is capped at 1.0.
 */
public final class RelevanceScorer {
    static final double TITLE_WEIGHT = 0.5;
    static final double DESCRIPTION_WEIGHT = 0.3;
    static final double ORGANIZATION_WEIGHT = 0.2;

    private RelevanceScorer() {
    }

    public static double score(Tender tender, String searchTerm) {
        if (tender == null || searchTerm == null || searchTerm.isEmpty()) {
            return 0.0;
        }
        String term = searchTerm.toLowerCase(Locale.ROOT);
        double score = 0.0;
        if (contains(tender.title(), term)) {
            score += TITLE_WEIGHT;
        }
        if (contains(tender.description(), term)) {
            score += DESCRIPTION_WEIGHT;
        }
        if (contains(tender.organization(), term)) {
            score += ORGANIZATION_WEIGHT;
        }
        return Math.min(score, 1.0);
    }

    private static boolean contains(String field, String lowerTerm) {
        return field != null && field.toLowerCase(Locale.ROOT).contains(lowerTerm);
    }
}
