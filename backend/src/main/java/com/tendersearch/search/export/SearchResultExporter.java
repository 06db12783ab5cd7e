package com.tendersearch.search.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tendersearch.config.SearchProperties;
import com.tendersearch.search.model.ConsolidatedResult;
import com.tendersearch.search.model.Tender;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Writes a consolidated search result to the configured output directory. */
@Service
public class SearchResultExporter {
    private static final Logger log = LoggerFactory.getLogger(SearchResultExporter.class);
    static final String[] CSV_HEADER = {
        "id",
        "title",
        "organization",
        "value",
        "currency",
        "publishDate",
        "deadline",
        "country",
        "city",
        "url",
        "sourceApi",
        "relevanceScore",
        "normalizationError"
    };

    private final ObjectMapper objectMapper;
    private final SearchProperties properties;

    public SearchResultExporter(ObjectMapper objectMapper, SearchProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public List<Path> export(ConsolidatedResult result) {
        Path directory = Path.of(properties.getOutput().getDirectory());
        String searchId = result.searchMetadata().searchId();
        List<Path> written = new ArrayList<>();
        try {
            Files.createDirectories(directory);
            if (properties.getOutput().isWriteJson()) {
                Path json = directory.resolve("search_results_" + searchId + ".json");
                writeJson(result, json);
                written.add(json);
            }
            if (properties.getOutput().isWriteCsv()) {
                Path csv = directory.resolve("search_results_" + searchId + ".csv");
                writeCsv(result.tenders(), csv);
                written.add(csv);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to export search " + searchId + " to " + directory, e);
        }
        log.info("Exported search {} to {}", searchId, written);
        return written;
    }

    void writeJson(ConsolidatedResult result, Path target) throws IOException {
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(writer, result);
        }
    }

    void writeCsv(List<Tender> tenders, Path target) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(CSV_HEADER).build();
        try (CSVPrinter printer = new CSVPrinter(Files.newBufferedWriter(target, StandardCharsets.UTF_8), format)) {
            for (Tender tender : tenders) {
                printer.printRecord(
                    tender.id(),
                    tender.title(),
                    tender.organization(),
                    tender.value().toPlainString(),
                    tender.currency(),
                    tender.publishDate() == null ? "" : tender.publishDate().toString(),
                    tender.deadline() == null ? "" : tender.deadline().toString(),
                    tender.country(),
                    tender.city(),
                    tender.url(),
                    tender.sourceApi().id(),
                    tender.relevanceScore(),
                    tender.normalizationError() == null ? "" : tender.normalizationError()
                );
            }
        }
    }
}
