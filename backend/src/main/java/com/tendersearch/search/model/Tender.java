package com.tendersearch.search.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Canonical procurement notice. Built once by the normalizer; the relevance score is applied
 * through {@link #withRelevanceScore(double)}.
 */
public record Tender(
    String id,
    String title,
    String description,
    String organization,
    BigDecimal value,
    String currency,
    LocalDate publishDate,
    LocalDate deadline,
    String country,
    String city,
    String url,
    SourceApi sourceApi,
    double relevanceScore,
    String normalizationError
) {
    public static final String UNKNOWN_ID = "unknown";

    public Tender {
        if (sourceApi == null) {
            throw new IllegalArgumentException("sourceApi is required");
        }
        id = safe(id);
        title = safe(title);
        description = safe(description);
        organization = safe(organization);
        value = value == null || value.signum() < 0 ? BigDecimal.ZERO : value;
        currency = currency == null || currency.isBlank() ? sourceApi.defaultCurrency() : currency.trim();
        country = safe(country);
        city = safe(city);
        url = safe(url);
    }

    public static Tender degraded(SourceApi sourceApi, String error) {
        return new Tender(
            UNKNOWN_ID,
            "",
            "",
            "",
            BigDecimal.ZERO,
            sourceApi.defaultCurrency(),
            null,
            null,
            "",
            "",
            "",
            sourceApi,
            0.0,
            error == null || error.isBlank() ? "normalization_failed" : error
        );
    }

    public boolean isDegraded() {
        return normalizationError != null;
    }

    public Tender withRelevanceScore(double score) {
        return new Tender(
            id,
            title,
            description,
            organization,
            value,
            currency,
            publishDate,
            deadline,
            country,
            city,
            url,
            sourceApi,
            score,
            normalizationError
        );
    }

    private static String safe(String value) {
        return value == null ? "" : value.trim();
    }
}
