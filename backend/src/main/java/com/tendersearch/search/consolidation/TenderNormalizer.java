package com.tendersearch.search.consolidation;

import com.tendersearch.search.model.SourceApi;
import com.tendersearch.search.model.Tender;
import com.tendersearch.search.source.ContractsFinderRawRecord;
import com.tendersearch.search.source.OpenOppsRawRecord;
import com.tendersearch.search.source.RawTenderRecord;
import com.tendersearch.search.source.SamRawRecord;
import com.tendersearch.search.source.TedRawRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import static com.tendersearch.search.consolidation.TenderFieldParsers.first;
import static com.tendersearch.search.consolidation.TenderFieldParsers.htmlToText;
import static com.tendersearch.search.consolidation.TenderFieldParsers.parseAmount;
import static com.tendersearch.search.consolidation.TenderFieldParsers.parseDate;
import static com.tendersearch.search.consolidation.TenderFieldParsers.safe;

/**
 * Converts source-specific raw records into {@link Tender}s. Never throws for bad input: fields
 * that cannot be read fall back to their defaults, and an unexpected failure yields a degraded
 * tender carrying the error.
 */
@Component
public class TenderNormalizer {
    private static final Logger log = LoggerFactory.getLogger(TenderNormalizer.class);
    private static final List<DateTimeFormatter> ISO_DATES = List.of(DateTimeFormatter.ISO_LOCAL_DATE);
    private static final List<DateTimeFormatter> SAM_DATES = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE,
        DateTimeFormatter.ofPattern("MM/dd/uuuu").withResolverStyle(ResolverStyle.STRICT)
    );
    private static final String CONTRACTS_FINDER_COUNTRY = "GB";

    public Tender normalize(SourceApi sourceApi, RawTenderRecord raw) {
        Objects.requireNonNull(sourceApi, "sourceApi");
        if (raw == null) {
            return Tender.degraded(sourceApi, "raw_record_missing");
        }
        try {
            if (sourceApi == SourceApi.TED && raw instanceof TedRawRecord ted) {
                return fromTed(ted);
            }
            if (sourceApi == SourceApi.SAM && raw instanceof SamRawRecord sam) {
                return fromSam(sam);
            }
            if (sourceApi == SourceApi.OPENOPPS && raw instanceof OpenOppsRawRecord openOpps) {
                return fromOpenOpps(openOpps);
            }
            if (sourceApi == SourceApi.CONTRACTS_FINDER && raw instanceof ContractsFinderRawRecord contractsFinder) {
                return fromContractsFinder(contractsFinder);
            }
            log.warn("Record type {} does not belong to source {}", raw.getClass().getSimpleName(), sourceApi);
            return Tender.degraded(sourceApi, "source_mismatch: " + raw.getClass().getSimpleName());
        } catch (RuntimeException e) {
            log.warn("Failed to normalize {} record", sourceApi, e);
            return Tender.degraded(sourceApi, "normalization_error: " + e.getClass().getSimpleName());
        }
    }

    private Tender fromTed(TedRawRecord raw) {
        String id = first(raw.noticeNumber());
        String title = first(raw.title());
        Amount amount = amount(first(raw.value()), first(raw.currency()), SourceApi.TED);
        return new Tender(
            id,
            title,
            title,
            first(raw.authorityName()),
            amount.value(),
            amount.currency(),
            parseDate(first(raw.publicationDate()), ISO_DATES),
            parseDate(first(raw.deadline()), ISO_DATES),
            first(raw.country()),
            first(raw.town()),
            SourceApi.TED.noticeUrl(id),
            SourceApi.TED,
            0.0,
            null
        );
    }

    private Tender fromSam(SamRawRecord raw) {
        String id = safe(raw.noticeId());
        String title = safe(raw.title());
        Amount amount = amount(raw.awardAmount(), null, SourceApi.SAM);
        return new Tender(
            id,
            title,
            title,
            safe(raw.department()),
            amount.value(),
            amount.currency(),
            parseDate(raw.postedDate(), SAM_DATES),
            parseDate(raw.responseDeadline(), SAM_DATES),
            safe(raw.countryCode()),
            safe(raw.city()),
            SourceApi.SAM.noticeUrl(id),
            SourceApi.SAM,
            0.0,
            null
        );
    }

    private Tender fromOpenOpps(OpenOppsRawRecord raw) {
        String id = safe(raw.id());
        String title = safe(raw.title());
        Amount amount = amount(raw.amount(), raw.currency(), SourceApi.OPENOPPS);
        return new Tender(
            id,
            title,
            descriptionOrTitle(raw.description(), title),
            safe(raw.buyerName()),
            amount.value(),
            amount.currency(),
            parseDate(raw.releaseDate(), ISO_DATES),
            parseDate(raw.tenderEndDate(), ISO_DATES),
            safe(raw.country()),
            safe(raw.locality()),
            SourceApi.OPENOPPS.noticeUrl(id),
            SourceApi.OPENOPPS,
            0.0,
            null
        );
    }

    private Tender fromContractsFinder(ContractsFinderRawRecord raw) {
        String id = safe(raw.id());
        String title = safe(raw.title());
        BigDecimal high = parseAmount(raw.valueHigh());
        String rawValue = high != null && high.signum() > 0 ? raw.valueHigh() : raw.valueLow();
        Amount amount = amount(rawValue, null, SourceApi.CONTRACTS_FINDER);
        return new Tender(
            id,
            title,
            descriptionOrTitle(raw.description(), title),
            safe(raw.organisationName()),
            amount.value(),
            amount.currency(),
            parseDate(raw.publishedDate(), ISO_DATES),
            parseDate(raw.deadlineDate(), ISO_DATES),
            CONTRACTS_FINDER_COUNTRY,
            "",
            SourceApi.CONTRACTS_FINDER.noticeUrl(id),
            SourceApi.CONTRACTS_FINDER,
            0.0,
            null
        );
    }

    private Amount amount(String rawValue, String rawCurrency, SourceApi source) {
        BigDecimal parsed = parseAmount(rawValue);
        if (parsed == null) {
            return new Amount(BigDecimal.ZERO, source.defaultCurrency());
        }
        String currency = rawCurrency == null || rawCurrency.isBlank()
            ? source.defaultCurrency()
            : rawCurrency.trim().toUpperCase(Locale.ROOT);
        return new Amount(parsed.signum() < 0 ? BigDecimal.ZERO : parsed, currency);
    }

    private String descriptionOrTitle(String description, String title) {
        String text = htmlToText(description);
        return text.isEmpty() ? title : text;
    }

    private record Amount(BigDecimal value, String currency) {
    }
}
