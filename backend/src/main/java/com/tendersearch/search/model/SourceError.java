package com.tendersearch.search.model;

import java.time.Instant;

public record SourceError(SourceApi source, String message, Instant occurredAt) {}
