package com.tendersearch.search.service;

import com.tendersearch.config.SearchProperties;
import com.tendersearch.search.consolidation.RelevanceScorer;
import com.tendersearch.search.consolidation.TenderDeduplicator;
import com.tendersearch.search.consolidation.TenderNormalizer;
import com.tendersearch.search.consolidation.TenderStatisticsAggregator;
import com.tendersearch.search.model.ConsolidatedResult;
import com.tendersearch.search.model.DuplicatePolicy;
import com.tendersearch.search.model.SearchMetadata;
import com.tendersearch.search.model.SearchParams;
import com.tendersearch.search.model.SearchRequest;
import com.tendersearch.search.model.SourceApi;
import com.tendersearch.search.model.SourceError;
import com.tendersearch.search.model.SourceSearchResult;
import com.tendersearch.search.model.Statistics;
import com.tendersearch.search.model.Tender;
import com.tendersearch.search.source.RawTenderRecord;
import com.tendersearch.search.source.SourceResponse;
import com.tendersearch.search.source.TenderSourceAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one search across the requested sources and consolidates the results. Sources are
 * queried concurrently; a failing source only contributes an error entry. Normalization,
 * deduplication, scoring and aggregation then run on the calling thread, over the source
 * results merged in query order.
 */
@Service
public class TenderSearchService {
    private static final Logger log = LoggerFactory.getLogger(TenderSearchService.class);
    private static final DateTimeFormatter SEARCH_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    /** Highest relevance first; equal relevance puts the later publish date first and undated last. */
    static final Comparator<Tender> RESULT_ORDER = Comparator
        .comparingDouble(Tender::relevanceScore)
        .thenComparing(Tender::publishDate, Comparator.nullsFirst(Comparator.naturalOrder()))
        .reversed();

    private final Map<SourceApi, TenderSourceAdapter> adapters;
    private final TenderNormalizer normalizer;
    private final ExecutorService sourceExecutor;
    private final SearchProperties properties;
    private final Clock clock;

    public TenderSearchService(
        List<TenderSourceAdapter> adapters,
        TenderNormalizer normalizer,
        @Qualifier("sourceExecutor") ExecutorService sourceExecutor,
        SearchProperties properties,
        Clock clock
    ) {
        this.adapters = new EnumMap<>(SourceApi.class);
        for (TenderSourceAdapter adapter : adapters) {
            this.adapters.put(adapter.source(), adapter);
        }
        this.normalizer = normalizer;
        this.sourceExecutor = sourceExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    public List<SourceApi> availableSources() {
        return List.copyOf(adapters.keySet());
    }

    /** Fills request gaps from configuration, then runs the search. */
    public ConsolidatedResult search(SearchRequest request) {
        if (request == null) {
            throw new InvalidSearchRequestException("search request is required");
        }
        List<String> sourceIds = request.normalizedSources();
        if (sourceIds.isEmpty()) {
            sourceIds = new SearchRequest(null, properties.getDefaultSources(), null, null, null).normalizedSources();
        }
        List<SourceApi> sources = new ArrayList<>();
        for (String sourceId : sourceIds) {
            SourceApi source = SourceApi.fromId(sourceId);
            if (source == null) {
                throw new InvalidSearchRequestException("Unknown source: " + sourceId);
            }
            sources.add(source);
        }
        LocalDate today = LocalDate.now(clock);
        LocalDate dateTo = request.dateTo() == null ? today : request.dateTo();
        LocalDate dateFrom = request.dateFrom() == null
            ? today.minusDays(properties.getDefaultLookbackDays())
            : request.dateFrom();
        long minValue = request.minValue() == null ? 0L : request.minValue();
        return run(request.searchTerm(), dateFrom, dateTo, minValue, sources);
    }

    public ConsolidatedResult run(
        String queryTerm,
        LocalDate dateFrom,
        LocalDate dateTo,
        long minValue,
        Collection<SourceApi> sources
    ) {
        List<SourceApi> ordered = validate(queryTerm, dateFrom, dateTo, minValue, sources);
        String searchTerm = queryTerm.trim();
        SearchParams params = new SearchParams(searchTerm, dateFrom, dateTo, minValue);
        Instant startedAt = clock.instant();
        log.info(
            "Starting search term='{}' sources={} dateFrom={} dateTo={} minValue={}",
            searchTerm,
            ordered,
            dateFrom,
            dateTo,
            minValue
        );

        List<CompletableFuture<SourceSearchResult>> futures = new ArrayList<>();
        for (SourceApi source : ordered) {
            futures.add(submitSource(adapters.get(source), params));
        }

        List<SourceSearchResult> sourceResults = new ArrayList<>();
        List<SourceError> errors = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            SourceApi source = ordered.get(i);
            SourceSearchResult result;
            try {
                result = futures.get(i).join();
            } catch (CompletionException e) {
                result = SourceSearchResult.failure(source, describeFailure(source, e), clock.instant());
                log.warn("Source {} failed: {}", source, result.error(), e.getCause() == null ? e : e.getCause());
            }
            sourceResults.add(result);
            if (result.success()) {
                log.info("Source {}: raw={} normalized={}", source, result.rawCount(), result.normalizedCount());
            } else {
                errors.add(new SourceError(source, result.error(), result.searchTime()));
            }
        }

        List<Tender> merged = new ArrayList<>();
        for (SourceSearchResult result : sourceResults) {
            if (result.success()) {
                merged.addAll(result.tenders());
            }
        }
        List<Tender> tenders = consolidate(merged, searchTerm, properties.getDuplicatePolicy());
        Statistics statistics = TenderStatisticsAggregator.aggregate(tenders);
        SearchMetadata metadata = new SearchMetadata(
            searchId(startedAt),
            searchTerm,
            ordered,
            dateFrom,
            dateTo,
            minValue,
            startedAt
        );
        log.info(
            "Search {} finished: merged={} consolidated={} errors={}",
            metadata.searchId(),
            merged.size(),
            tenders.size(),
            errors.size()
        );
        return new ConsolidatedResult(metadata, tenders, statistics, errors, sourceResults);
    }

    /** Deduplicates, scores against {@code searchTerm} and sorts by {@link #RESULT_ORDER}. */
    static List<Tender> consolidate(List<Tender> merged, String searchTerm, DuplicatePolicy policy) {
        List<Tender> deduplicated = TenderDeduplicator.deduplicate(merged, policy);
        List<Tender> scored = new ArrayList<>(deduplicated.size());
        for (Tender tender : deduplicated) {
            scored.add(tender.withRelevanceScore(RelevanceScorer.score(tender, searchTerm)));
        }
        scored.sort(RESULT_ORDER);
        return scored;
    }

    /**
     * Queues one source search. The deadline starts when a worker picks the task up, so time
     * spent waiting for a free thread does not count; on expiry the worker is interrupted.
     */
    private CompletableFuture<SourceSearchResult> submitSource(TenderSourceAdapter adapter, SearchParams params) {
        int timeoutSeconds = properties.getSourceTimeoutSeconds();
        CompletableFuture<SourceSearchResult> outcome = new CompletableFuture<>();
        AtomicReference<Future<?>> task = new AtomicReference<>();
        task.set(sourceExecutor.submit(() -> {
            CompletableFuture.runAsync(() -> {
                if (outcome.completeExceptionally(new TimeoutException())) {
                    Future<?> running = task.get();
                    if (running != null) {
                        running.cancel(true);
                    }
                }
            }, CompletableFuture.delayedExecutor(timeoutSeconds, TimeUnit.SECONDS));
            try {
                outcome.complete(searchSource(adapter, params));
            } catch (RuntimeException | Error e) {
                outcome.completeExceptionally(e);
            }
        }));
        return outcome;
    }

    private SourceSearchResult searchSource(TenderSourceAdapter adapter, SearchParams params) {
        SourceApi source = adapter.source();
        SourceResponse response = adapter.search(params);
        Instant searchTime = clock.instant();
        if (response == null) {
            return SourceSearchResult.failure(source, source.id() + "_empty_response", searchTime);
        }
        if (!response.success()) {
            return SourceSearchResult.failure(source, response.error(), searchTime);
        }
        List<Tender> tenders = new ArrayList<>(response.records().size());
        int degraded = 0;
        for (RawTenderRecord raw : response.records()) {
            Tender tender = normalizer.normalize(source, raw);
            if (tender.isDegraded()) {
                degraded++;
            }
            tenders.add(tender);
        }
        if (degraded > 0) {
            log.warn("Source {} produced {} degraded records", source, degraded);
        }
        return SourceSearchResult.success(source, tenders, response.records().size(), searchTime);
    }

    private List<SourceApi> validate(
        String queryTerm,
        LocalDate dateFrom,
        LocalDate dateTo,
        long minValue,
        Collection<SourceApi> sources
    ) {
        if (queryTerm == null || queryTerm.isBlank()) {
            throw new InvalidSearchRequestException("searchTerm is required");
        }
        if (dateFrom == null || dateTo == null) {
            throw new InvalidSearchRequestException("dateFrom and dateTo are required");
        }
        if (dateFrom.isAfter(dateTo)) {
            throw new InvalidSearchRequestException("dateFrom " + dateFrom + " is after dateTo " + dateTo);
        }
        if (minValue < 0) {
            throw new InvalidSearchRequestException("minValue must not be negative");
        }
        if (sources == null || sources.isEmpty()) {
            throw new InvalidSearchRequestException("at least one source is required");
        }
        List<SourceApi> ordered = new ArrayList<>(new LinkedHashSet<>(sources));
        for (SourceApi source : ordered) {
            if (source == null) {
                throw new InvalidSearchRequestException("Unknown source: null");
            }
            if (!adapters.containsKey(source)) {
                throw new InvalidSearchRequestException("No adapter registered for source: " + source.id());
            }
        }
        return ordered;
    }

    private String describeFailure(SourceApi source, CompletionException e) {
        Throwable cause = e.getCause() == null ? e : e.getCause();
        if (cause instanceof TimeoutException) {
            return source.id() + "_timeout: no response after " + properties.getSourceTimeoutSeconds() + "s";
        }
        String message = cause.getMessage();
        return source.id() + "_exception: " + cause.getClass().getSimpleName()
            + (message == null || message.isBlank() ? "" : " " + message);
    }

    private String searchId(Instant startedAt) {
        return "search_" + LocalDateTime.ofInstant(startedAt, clock.getZone()).format(SEARCH_ID_FORMAT);
    }
}
