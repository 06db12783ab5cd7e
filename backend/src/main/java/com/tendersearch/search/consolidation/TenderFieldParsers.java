package com.tendersearch.search.consolidation;

import org.jsoup.Jsoup;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

/** Lenient field conversions used while normalizing raw source records. */
public final class TenderFieldParsers {
    private static final int DATE_LENGTH = 10;
    private static final int MAX_INTEGER_DIGITS = 18;
    private static final int MAX_FRACTION_DIGITS = 10;

    private TenderFieldParsers() {
    }

    /** Element 0 of a multi-valued field, trimmed; later values are never consulted. */
    public static String first(List<String> values) {
        if (values == null || values.isEmpty()) {
            return "";
        }
        return safe(values.get(0));
    }

    public static String safe(String value) {
        return value == null ? "" : value.trim();
    }

    /**
     * Parses numbers such as {@code "1000"}, {@code " 1,250.50 "} or {@code "5e3"}. Returns null
     * when the value is absent, not numeric, or outside 18 integer and 10 fraction digits.
     */
    public static BigDecimal parseAmount(String raw) {
        if (raw == null) {
            return null;
        }
        String cleaned = raw.trim().replace(",", "").replace("_", "").replace(" ", "");
        if (cleaned.isEmpty()) {
            return null;
        }
        BigDecimal parsed;
        try {
            parsed = new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            return null;
        }
        BigDecimal significant = parsed.stripTrailingZeros();
        if (significant.precision() - significant.scale() > MAX_INTEGER_DIGITS
            || significant.scale() > MAX_FRACTION_DIGITS) {
            return null;
        }
        return significant.scale() < 0 ? significant.setScale(0) : significant;
    }

    /**
     * Reads the leading date portion of {@code raw}. Values shorter than ten characters, or whose
     * first ten characters match none of {@code formats}, are treated as absent.
     */
    public static LocalDate parseDate(String raw, List<DateTimeFormatter> formats) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.length() < DATE_LENGTH) {
            return null;
        }
        String candidate = trimmed.substring(0, DATE_LENGTH);
        for (DateTimeFormatter format : formats) {
            LocalDate parsed = tryParse(candidate, format);
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    private static LocalDate tryParse(String candidate, DateTimeFormatter format) {
        try {
            return LocalDate.parse(candidate, format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public static String htmlToText(String value) {
        if (value == null || value.isBlank()) {
            return "";
        }
        if (value.indexOf('<') < 0 && value.indexOf('&') < 0) {
            return value.trim();
        }
        return Jsoup.parse(value).text().trim();
    }
}
