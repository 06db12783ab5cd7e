package com.tendersearch.search.consolidation;

import com.tendersearch.search.model.DateRange;
import com.tendersearch.search.model.Statistics;
import com.tendersearch.search.model.Tender;
import com.tendersearch.search.model.ValueStatistics;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class TenderStatisticsAggregator {
    static final String UNKNOWN_COUNTRY = "unknown";
    private static final int AVERAGE_SCALE = 2;

    private TenderStatisticsAggregator() {
    }

    public static Statistics aggregate(List<Tender> tenders) {
        if (tenders == null || tenders.isEmpty()) {
            return new Statistics(0, Map.of(), null, Map.of(), null, 0);
        }

        Map<String, Integer> apiCounts = new LinkedHashMap<>();
        Map<String, Integer> countryCounts = new LinkedHashMap<>();
        BigDecimal total = BigDecimal.ZERO;
        BigDecimal min = null;
        BigDecimal max = null;
        int countWithValue = 0;
        LocalDate earliest = null;
        LocalDate latest = null;
        int degraded = 0;

        for (Tender tender : tenders) {
            apiCounts.merge(tender.sourceApi().id(), 1, Integer::sum);
            String country = tender.country().isBlank() ? UNKNOWN_COUNTRY : tender.country();
            countryCounts.merge(country, 1, Integer::sum);
            if (tender.isDegraded()) {
                degraded++;
            }

            BigDecimal value = tender.value();
            if (value.signum() > 0) {
                total = total.add(value);
                min = min == null || value.compareTo(min) < 0 ? value : min;
                max = max == null || value.compareTo(max) > 0 ? value : max;
                countWithValue++;
            }

            LocalDate published = tender.publishDate();
            if (published != null) {
                earliest = earliest == null || published.isBefore(earliest) ? published : earliest;
                latest = latest == null || published.isAfter(latest) ? published : latest;
            }
        }

        ValueStatistics valueStatistics = countWithValue == 0
            ? null
            : new ValueStatistics(
                total,
                total.divide(BigDecimal.valueOf(countWithValue), AVERAGE_SCALE, RoundingMode.HALF_UP),
                min,
                max,
                countWithValue
            );
        DateRange dateRange = earliest == null ? null : new DateRange(earliest, latest);
        return new Statistics(
            tenders.size(),
            apiCounts,
            valueStatistics,
            sortByCountDescending(countryCounts),
            dateRange,
            degraded
        );
    }

    // List.sort is stable, so equal counts keep first-encountered order.
    private static Map<String, Integer> sortByCountDescending(Map<String, Integer> counts) {
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Integer>comparingByValue().reversed());
        Map<String, Integer> sorted = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : entries) {
            sorted.put(entry.getKey(), entry.getValue());
        }
        return sorted;
    }
}
