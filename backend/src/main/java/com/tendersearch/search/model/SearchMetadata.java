package com.tendersearch.search.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record SearchMetadata(
    String searchId,
    String searchTerm,
    List<SourceApi> apisUsed,
    LocalDate dateFrom,
    LocalDate dateTo,
    long minValue,
    Instant searchTimestamp
) {
}
