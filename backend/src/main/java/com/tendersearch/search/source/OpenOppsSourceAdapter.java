package com.tendersearch.search.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tendersearch.config.SearchProperties;
import com.tendersearch.search.http.TenderApiHttpClient;
import com.tendersearch.search.model.HttpFetchResult;
import com.tendersearch.search.model.SearchParams;
import com.tendersearch.search.model.SourceApi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/** OpenOpps requires a short-lived token from the auth endpoint before each search. */
@Service
public class OpenOppsSourceAdapter extends AbstractSourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(OpenOppsSourceAdapter.class);

    private final SearchProperties properties;

    public OpenOppsSourceAdapter(TenderApiHttpClient httpClient, ObjectMapper objectMapper, SearchProperties properties) {
        super(httpClient, objectMapper);
        this.properties = properties;
    }

    @Override
    public SourceApi source() {
        return SourceApi.OPENOPPS;
    }

    @Override
    public SourceResponse search(SearchParams params) {
        SearchProperties.OpenOpps openOpps = properties.getOpenopps();
        if (isBlank(openOpps.getUsername()) || isBlank(openOpps.getPassword())) {
            return SourceResponse.failure("openopps_credentials_missing");
        }

        ObjectNode credentials = objectMapper.createObjectNode();
        credentials.put("username", openOpps.getUsername());
        credentials.put("password", openOpps.getPassword());
        HttpFetchResult auth = httpClient.postJson(
            endpoint(openOpps.getBaseUrl(), "/api-token-auth/"),
            credentials.toString(),
            JSON_ACCEPT,
            Map.of()
        );
        if (auth == null || !auth.isSuccessful() || auth.body() == null) {
            return SourceResponse.failure("openopps_auth_failed: " + fetchStatus(auth));
        }
        String token = readToken(auth.body());
        if (token == null) {
            return SourceResponse.failure("openopps_auth_failed: token missing");
        }

        HttpFetchResult fetch = httpClient.get(
            buildUrl(openOpps, params),
            JSON_ACCEPT,
            Map.of("Authorization", "JWT " + token)
        );
        return toResponse(fetch, "/results", this::toRecord);
    }

    String buildUrl(SearchProperties.OpenOpps openOpps, SearchParams params) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("search", params.searchTerm());
        query.put("releasedate__gte", params.dateFrom().toString());
        query.put("releasedate__lte", params.dateTo().toString());
        query.put("min_amount", Long.toString(params.minValue()));
        query.put("page_size", Integer.toString(openOpps.getPageSize()));
        String encoded = query.entrySet().stream()
            .map(entry -> entry.getKey() + "=" + URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&"));
        return endpoint(openOpps.getBaseUrl(), "/tenders/") + "?" + encoded;
    }

    private String readToken(String body) {
        try {
            return text(objectMapper.readTree(body), "token");
        } catch (JsonProcessingException e) {
            log.warn("Unreadable OpenOpps auth response", e);
            return null;
        }
    }

    private RawTenderRecord toRecord(JsonNode item) {
        String id = text(item, "ocid");
        if (id == null) {
            id = text(item, "id");
        }
        return new OpenOppsRawRecord(
            id,
            text(item, "title"),
            text(item, "description"),
            text(item, "buyer_name"),
            text(item, "amount"),
            text(item, "currency"),
            text(item, "releasedate"),
            text(item, "tender_enddate"),
            text(item, "country"),
            text(item, "locality")
        );
    }
}
