package com.tendersearch.search.source;

import java.util.List;

/** Outcome of one adapter call: the raw records on success, a failure message otherwise. */
public record SourceResponse(boolean success, List<RawTenderRecord> records, String error) {

    public static SourceResponse success(List<RawTenderRecord> records) {
        return new SourceResponse(true, records == null ? List.of() : List.copyOf(records), null);
    }

    public static SourceResponse failure(String error) {
        return new SourceResponse(false, List.of(), error == null || error.isBlank() ? "unknown_error" : error);
    }
}
