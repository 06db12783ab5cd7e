package com.tendersearch.search.source;

import java.util.List;
import java.util.Objects;

/** TED returns every field as an ordered list of values, keyed by its two-letter field code. */
public record TedRawRecord(
    List<String> noticeNumber,
    List<String> title,
    List<String> publicationDate,
    List<String> deadline,
    List<String> value,
    List<String> currency,
    List<String> country,
    List<String> town,
    List<String> authorityName
) implements RawTenderRecord {
    public TedRawRecord {
        noticeNumber = copy(noticeNumber);
        title = copy(title);
        publicationDate = copy(publicationDate);
        deadline = copy(deadline);
        value = copy(value);
        currency = copy(currency);
        country = copy(country);
        town = copy(town);
        authorityName = copy(authorityName);
    }

    private static List<String> copy(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().filter(Objects::nonNull).toList();
    }
}
