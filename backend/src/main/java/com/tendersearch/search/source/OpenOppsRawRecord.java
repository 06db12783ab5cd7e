package com.tendersearch.search.source;

public record OpenOppsRawRecord(
    String id,
    String title,
    String description,
    String buyerName,
    String amount,
    String currency,
    String releaseDate,
    String tenderEndDate,
    String country,
    String locality
) implements RawTenderRecord {
}
