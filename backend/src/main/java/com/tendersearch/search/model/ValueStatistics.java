package com.tendersearch.search.model;

import java.math.BigDecimal;

public record ValueStatistics(
    BigDecimal total,
    BigDecimal average,
    BigDecimal min,
    BigDecimal max,
    int countWithValue
) {
}
