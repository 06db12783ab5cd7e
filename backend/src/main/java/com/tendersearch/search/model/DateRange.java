package com.tendersearch.search.model;

import java.time.LocalDate;

public record DateRange(LocalDate earliest, LocalDate latest) {}
