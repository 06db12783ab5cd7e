package com.tendersearch.search.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public record SearchRequest(
    String searchTerm,
    List<String> sources,
    LocalDate dateFrom,
    LocalDate dateTo,
    Long minValue
) {
    public List<String> normalizedSources() {
        if (sources == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String source : sources) {
            if (source == null) {
                continue;
            }
            String normalized = source.trim().toLowerCase(Locale.ROOT);
            if (!normalized.isEmpty() && !out.contains(normalized)) {
                out.add(normalized);
            }
        }
        return out;
    }
}
