package com.tendersearch.search.source;

/**
 * Record as returned by one source API, before normalization. Each source has its own shape;
 * nothing past the normalizer sees these types.
 */
public sealed interface RawTenderRecord
    permits TedRawRecord, SamRawRecord, OpenOppsRawRecord, ContractsFinderRawRecord {
}
