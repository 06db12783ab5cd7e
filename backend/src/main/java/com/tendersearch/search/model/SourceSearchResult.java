package com.tendersearch.search.model;

import java.time.Instant;
import java.util.List;

public record SourceSearchResult(
    SourceApi source,
    boolean success,
    List<Tender> tenders,
    int rawCount,
    int normalizedCount,
    String error,
    Instant searchTime
) {
    public static SourceSearchResult success(SourceApi source, List<Tender> tenders, int rawCount, Instant searchTime) {
        return new SourceSearchResult(source, true, List.copyOf(tenders), rawCount, tenders.size(), null, searchTime);
    }

    public static SourceSearchResult failure(SourceApi source, String error, Instant searchTime) {
        String message = error == null || error.isBlank() ? "unknown_error" : error;
        return new SourceSearchResult(source, false, List.of(), 0, 0, message, searchTime);
    }
}
