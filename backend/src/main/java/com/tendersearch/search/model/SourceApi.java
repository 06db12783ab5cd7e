package com.tendersearch.search.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SourceApi {
    TED("ted", "EUR", "https://ted.europa.eu/udl?uri=TED:NOTICE:%s"),
    SAM("sam", "USD", "https://sam.gov/opp/%s/view"),
    OPENOPPS("openopps", "GBP", "https://openopps.com/tender/%s"),
    CONTRACTS_FINDER("contracts_finder", "GBP", "https://www.contractsfinder.service.gov.uk/Notice/%s");

    private final String id;
    private final String defaultCurrency;
    private final String urlTemplate;

    SourceApi(String id, String defaultCurrency, String urlTemplate) {
        this.id = id;
        this.defaultCurrency = defaultCurrency;
        this.urlTemplate = urlTemplate;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public String defaultCurrency() {
        return defaultCurrency;
    }

    /**
     * Public notice URL for a source-scoped identifier, or an empty string when the identifier
     * is blank.
     */
    public String noticeUrl(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return "";
        }
        return String.format(Locale.ROOT, urlTemplate, identifier.trim());
    }

    public static SourceApi fromId(String candidate) {
        if (candidate == null) {
            return null;
        }
        String normalized = candidate.trim().toLowerCase(Locale.ROOT);
        for (SourceApi source : values()) {
            if (source.id.equals(normalized)) {
                return source;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return id;
    }
}
