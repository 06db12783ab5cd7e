package com.tendersearch.search.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tendersearch.config.SearchProperties;
import com.tendersearch.search.http.TenderApiHttpClient;
import com.tendersearch.search.model.HttpFetchResult;
import com.tendersearch.search.model.SearchParams;
import com.tendersearch.search.model.SourceApi;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@Service
public class SamSourceAdapter extends AbstractSourceAdapter {
    private static final DateTimeFormatter SAM_DATE = DateTimeFormatter.ofPattern("MM/dd/yyyy");
    private static final String NOTICE_TYPES = "Presolicitation,Combined Synopsis/Solicitation,Solicitation";

    private final SearchProperties properties;

    public SamSourceAdapter(TenderApiHttpClient httpClient, ObjectMapper objectMapper, SearchProperties properties) {
        super(httpClient, objectMapper);
        this.properties = properties;
    }

    @Override
    public SourceApi source() {
        return SourceApi.SAM;
    }

    @Override
    public SourceResponse search(SearchParams params) {
        SearchProperties.Sam sam = properties.getSam();
        if (isBlank(sam.getApiKey())) {
            return SourceResponse.failure("sam_api_key_missing");
        }
        HttpFetchResult fetch = httpClient.get(buildUrl(sam, params), JSON_ACCEPT, Map.of());
        return toResponse(fetch, "/opportunitiesData", this::toRecord);
    }

    String buildUrl(SearchProperties.Sam sam, SearchParams params) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("api_key", sam.getApiKey().trim());
        query.put("keywords", params.searchTerm());
        query.put("postedFrom", params.dateFrom().format(SAM_DATE));
        query.put("postedTo", params.dateTo().format(SAM_DATE));
        query.put("noticeType", NOTICE_TYPES);
        query.put("limit", Integer.toString(sam.getPageSize()));
        String encoded = query.entrySet().stream()
            .map(entry -> entry.getKey() + "=" + URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&"));
        return endpoint(sam.getBaseUrl(), "") + "?" + encoded;
    }

    private RawTenderRecord toRecord(JsonNode item) {
        JsonNode place = item.path("placeOfPerformance");
        String department = text(item, "department");
        if (department == null) {
            department = text(item, "fullParentPathName");
        }
        String countryCode = text(place, "countryCode");
        if (countryCode == null) {
            countryCode = text(place.path("country"), "code");
        }
        return new SamRawRecord(
            text(item, "noticeId"),
            text(item, "title"),
            text(item, "postedDate"),
            text(item, "responseDeadLine"),
            text(item.path("award"), "amount"),
            department,
            countryCode,
            text(place.path("city"), "name")
        );
    }
}
