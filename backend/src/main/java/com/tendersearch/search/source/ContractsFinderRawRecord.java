package com.tendersearch.search.source;

public record ContractsFinderRawRecord(
    String id,
    String title,
    String description,
    String organisationName,
    String publishedDate,
    String deadlineDate,
    String valueLow,
    String valueHigh,
    String region
) implements RawTenderRecord {
}
