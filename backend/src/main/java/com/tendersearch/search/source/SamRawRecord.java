package com.tendersearch.search.source;

public record SamRawRecord(
    String noticeId,
    String title,
    String postedDate,
    String responseDeadline,
    String awardAmount,
    String department,
    String countryCode,
    String city
) implements RawTenderRecord {
}
