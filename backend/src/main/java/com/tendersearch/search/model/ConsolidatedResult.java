package com.tendersearch.search.model;

import java.util.List;

public record ConsolidatedResult(
    SearchMetadata searchMetadata,
    List<Tender> tenders,
    Statistics statistics,
    List<SourceError> errors,
    List<SourceSearchResult> sourceResults
) {
}
