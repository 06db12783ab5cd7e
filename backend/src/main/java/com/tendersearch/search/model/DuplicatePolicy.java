package com.tendersearch.search.model;

public enum DuplicatePolicy {
    /** Keep the first record seen in merge order. */
    FIRST_SEEN,
    /** Keep the record with the most populated fields, at the first-seen position. */
    MOST_COMPLETE
}
