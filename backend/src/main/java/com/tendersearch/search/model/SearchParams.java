package com.tendersearch.search.model;

import java.time.LocalDate;

/** Canonical query handed to every source adapter. */
public record SearchParams(
    String searchTerm,
    LocalDate dateFrom,
    LocalDate dateTo,
    long minValue
) {
}
