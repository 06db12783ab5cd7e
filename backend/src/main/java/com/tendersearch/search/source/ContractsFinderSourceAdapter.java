package com.tendersearch.search.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tendersearch.config.SearchProperties;
import com.tendersearch.search.http.TenderApiHttpClient;
import com.tendersearch.search.model.HttpFetchResult;
import com.tendersearch.search.model.SearchParams;
import com.tendersearch.search.model.SourceApi;
import org.springframework.stereotype.Service;

import java.util.Map;

/** Contracts Finder search needs no credential. */
@Service
public class ContractsFinderSourceAdapter extends AbstractSourceAdapter {

    private final SearchProperties properties;

    public ContractsFinderSourceAdapter(
        TenderApiHttpClient httpClient,
        ObjectMapper objectMapper,
        SearchProperties properties
    ) {
        super(httpClient, objectMapper);
        this.properties = properties;
    }

    @Override
    public SourceApi source() {
        return SourceApi.CONTRACTS_FINDER;
    }

    @Override
    public SourceResponse search(SearchParams params) {
        SearchProperties.ContractsFinder contractsFinder = properties.getContractsFinder();
        HttpFetchResult fetch = httpClient.postJson(
            endpoint(contractsFinder.getBaseUrl(), "/search_notices/json"),
            buildBody(params, contractsFinder.getPageSize()),
            JSON_ACCEPT,
            Map.of()
        );
        return toResponse(fetch, "/noticeList", this::toRecord);
    }

    String buildBody(SearchParams params, int pageSize) {
        ObjectNode body = objectMapper.createObjectNode();
        ObjectNode criteria = body.putObject("searchCriteria");
        criteria.putArray("types").add("Contract");
        criteria.put("keyword", params.searchTerm());
        criteria.put("publishedFrom", params.dateFrom() + "T00:00:00");
        criteria.put("publishedTo", params.dateTo() + "T23:59:59");
        if (params.minValue() > 0) {
            criteria.put("valueFrom", params.minValue());
        }
        body.put("size", pageSize);
        return body.toString();
    }

    private RawTenderRecord toRecord(JsonNode notice) {
        JsonNode item = notice.has("item") ? notice.path("item") : notice;
        return new ContractsFinderRawRecord(
            text(item, "id"),
            text(item, "title"),
            text(item, "description"),
            text(item, "organisationName"),
            text(item, "publishedDate"),
            text(item, "deadlineDate"),
            text(item, "valueLow"),
            text(item, "valueHigh"),
            text(item, "regionText")
        );
    }
}
