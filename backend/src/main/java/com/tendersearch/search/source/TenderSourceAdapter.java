package com.tendersearch.search.source;

import com.tendersearch.search.model.SearchParams;
import com.tendersearch.search.model.SourceApi;

/**
 * Wraps one procurement API. Implementations report transport, credential and payload problems
 * through {@link SourceResponse#failure(String)} rather than throwing.
 */
public interface TenderSourceAdapter {

    SourceApi source();

    SourceResponse search(SearchParams params);
}
