package com.tendersearch.search.service;

import com.tendersearch.config.SearchProperties;
import com.tendersearch.search.export.SearchResultExporter;
import com.tendersearch.search.model.ConsolidatedResult;
import com.tendersearch.search.model.SearchRequest;
import com.tendersearch.search.model.SourceError;
import com.tendersearch.search.model.SourceSearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;

@Component
public class SearchCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(SearchCliRunner.class);

    private final SearchProperties properties;
    private final TenderSearchService searchService;
    private final SearchResultExporter exporter;
    private final ConfigurableApplicationContext applicationContext;

    public SearchCliRunner(
        SearchProperties properties,
        TenderSearchService searchService,
        SearchResultExporter exporter,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.searchService = searchService;
        this.exporter = exporter;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        ConsolidatedResult result = searchService.search(buildRequest(properties.getCli()));
        log.info(
            "Search {} completed: {} tenders from {}",
            result.searchMetadata().searchId(),
            result.tenders().size(),
            result.searchMetadata().apisUsed()
        );
        for (SourceSearchResult source : result.sourceResults()) {
            log.info(
                "Source {}: success={}, raw={}, normalized={}",
                source.source(),
                source.success(),
                source.rawCount(),
                source.normalizedCount()
            );
        }
        for (SourceError error : result.errors()) {
            log.warn("Source {} error: {}", error.source(), error.message());
        }
        log.info("Statistics: {}", result.statistics());

        if (properties.getCli().isExport()) {
            try {
                exporter.export(result);
            } catch (UncheckedIOException e) {
                log.error("Export failed for search {}", result.searchMetadata().searchId(), e);
            }
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }

    static SearchRequest buildRequest(SearchProperties.Cli cli) {
        List<String> sources = Arrays.stream(cli.getSources() == null ? new String[0] : cli.getSources().split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();
        return new SearchRequest(
            cli.getSearchTerm(),
            sources,
            parseDate("dateFrom", cli.getDateFrom()),
            parseDate("dateTo", cli.getDateTo()),
            (long) cli.getMinValue()
        );
    }

    private static LocalDate parseDate(String name, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidSearchRequestException(name + " must be YYYY-MM-DD, got '" + value + "'");
        }
    }
}
