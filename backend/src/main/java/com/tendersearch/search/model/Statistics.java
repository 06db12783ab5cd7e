package com.tendersearch.search.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.Map;

/**
 * Summary over a final tender sequence. {@code valueStatistics} and {@code dateRange} are null
 * when no tender carries a positive value or a publish date.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Statistics(
    int totalCount,
    Map<String, Integer> apiBreakdown,
    ValueStatistics valueStatistics,
    Map<String, Integer> countryBreakdown,
    DateRange dateRange,
    int degradedCount
) {
    public Statistics {
        apiBreakdown = apiBreakdown == null ? Map.of() : Collections.unmodifiableMap(apiBreakdown);
        countryBreakdown = countryBreakdown == null ? Map.of() : Collections.unmodifiableMap(countryBreakdown);
    }
}
