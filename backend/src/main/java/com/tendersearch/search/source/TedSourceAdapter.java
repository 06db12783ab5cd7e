package com.tendersearch.search.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tendersearch.config.SearchProperties;
import com.tendersearch.search.http.TenderApiHttpClient;
import com.tendersearch.search.model.HttpFetchResult;
import com.tendersearch.search.model.SearchParams;
import com.tendersearch.search.model.SourceApi;
import org.springframework.stereotype.Service;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

@Service
public class TedSourceAdapter extends AbstractSourceAdapter {
    static final List<String> FIELDS = List.of("ND", "TI", "PD", "TD", "VA", "CU", "CY", "TW", "AN");

    private final SearchProperties properties;

    public TedSourceAdapter(TenderApiHttpClient httpClient, ObjectMapper objectMapper, SearchProperties properties) {
        super(httpClient, objectMapper);
        this.properties = properties;
    }

    @Override
    public SourceApi source() {
        return SourceApi.TED;
    }

    @Override
    public SourceResponse search(SearchParams params) {
        SearchProperties.Ted ted = properties.getTed();
        if (isBlank(ted.getApiKey())) {
            return SourceResponse.failure("ted_api_key_missing");
        }

        ObjectNode body = objectMapper.createObjectNode();
        body.put("query", buildQuery(params));
        ArrayNode fields = body.putArray("fields");
        FIELDS.forEach(fields::add);
        body.put("limit", ted.getPageSize());
        body.put("page", 1);

        HttpFetchResult fetch = httpClient.postJson(
            endpoint(ted.getBaseUrl(), "/notices/search"),
            body.toString(),
            JSON_ACCEPT,
            Map.of("Authorization", "Bearer " + ted.getApiKey().trim())
        );
        return toResponse(fetch, "/results", this::toRecord);
    }

    String buildQuery(SearchParams params) {
        String term = params.searchTerm().replace("[", " ").replace("]", " ").trim();
        DateTimeFormatter format = DateTimeFormatter.BASIC_ISO_DATE;
        return "(ND=[" + term + "] OR TI=[" + term + "])"
            + " AND PD=[" + params.dateFrom().format(format) + " TO " + params.dateTo().format(format) + "]"
            + " AND VA>=[" + params.minValue() + "]"
            + " AND DS=[CONTRACT_NOTICE]";
    }

    private RawTenderRecord toRecord(JsonNode item) {
        return new TedRawRecord(
            values(item, "ND"),
            values(item, "TI"),
            values(item, "PD"),
            values(item, "TD"),
            values(item, "VA"),
            values(item, "CU"),
            values(item, "CY"),
            values(item, "TW"),
            values(item, "AN")
        );
    }
}
