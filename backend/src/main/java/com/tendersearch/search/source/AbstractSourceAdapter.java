package com.tendersearch.search.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tendersearch.search.http.TenderApiHttpClient;
import com.tendersearch.search.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;

abstract class AbstractSourceAdapter implements TenderSourceAdapter {
    protected static final String JSON_ACCEPT = "application/json,*/*;q=0.8";

    private final Logger log = LoggerFactory.getLogger(getClass());

    protected final TenderApiHttpClient httpClient;
    protected final ObjectMapper objectMapper;

    protected AbstractSourceAdapter(TenderApiHttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Maps every element of the array at {@code arrayPointer} through {@code mapper}. A failed
     * fetch, an unreadable body or a missing array yields a failed response.
     */
    protected SourceResponse toResponse(
        HttpFetchResult fetch,
        String arrayPointer,
        Function<JsonNode, RawTenderRecord> mapper
    ) {
        if (fetch == null || !fetch.isSuccessful() || fetch.body() == null) {
            String status = fetchStatus(fetch);
            log.warn("{} search failed: {}", source(), status);
            return SourceResponse.failure(status);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(fetch.body());
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse {} payload from {}", source(), fetch.requestedUrl(), e);
            return SourceResponse.failure(source().id() + "_parse_error");
        }
        JsonNode items = root == null ? null : root.at(arrayPointer);
        if (items == null || !items.isArray()) {
            log.warn("{} payload has no array at {}", source(), arrayPointer);
            return SourceResponse.failure(source().id() + "_invalid_payload");
        }
        List<RawTenderRecord> records = new ArrayList<>();
        for (JsonNode item : items) {
            records.add(mapper.apply(item));
        }
        log.info("{} returned {} records", source(), records.size());
        return SourceResponse.success(records);
    }

    protected String fetchStatus(HttpFetchResult fetch) {
        String prefix = source().id();
        if (fetch == null) {
            return prefix + "_unknown_error";
        }
        if (fetch.errorCode() != null && !fetch.errorCode().isBlank()) {
            if (fetch.errorMessage() != null && !fetch.errorMessage().isBlank()) {
                return prefix + "_" + fetch.errorCode() + ": " + fetch.errorMessage();
            }
            return prefix + "_" + fetch.errorCode();
        }
        if (fetch.statusCode() > 0) {
            return prefix + "_http_" + fetch.statusCode();
        }
        return prefix + "_unknown_error";
    }

    protected static String endpoint(String baseUrl, String path) {
        String base = baseUrl == null ? "" : baseUrl.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    protected static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /** Scalar text of {@code field}, or null when missing or JSON null. */
    protected static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isContainerNode()) {
            return firstText(value);
        }
        String text = value.asText();
        return text == null || text.isBlank() ? null : text.trim();
    }

    /**
     * All values of a possibly multi-valued field, in source order. Array positions are kept,
     * with empty strings for blank entries. Multilingual objects contribute their English entry
     * when present, otherwise their first entry.
     */
    protected static List<String> values(JsonNode node, String field) {
        List<String> out = new ArrayList<>();
        if (node == null) {
            return out;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return out;
        }
        if (value.isArray()) {
            for (JsonNode element : value) {
                String text = element.isContainerNode() ? firstText(element) : element.asText(null);
                out.add(text == null ? "" : text.trim());
            }
        } else if (value.isObject()) {
            addIfPresent(out, firstText(value));
        } else {
            addIfPresent(out, value.asText(null));
        }
        return out;
    }

    private static String firstText(JsonNode container) {
        if (container.isObject() && container.hasNonNull("eng")) {
            return container.get("eng").isArray() ? firstText(container.get("eng")) : container.get("eng").asText(null);
        }
        Iterator<JsonNode> elements = container.elements();
        while (elements.hasNext()) {
            JsonNode element = elements.next();
            String candidate = element.isContainerNode() ? firstText(element) : element.asText(null);
            if (candidate != null && !candidate.isBlank()) {
                return candidate.trim();
            }
        }
        return null;
    }

    private static void addIfPresent(List<String> target, String value) {
        if (value == null) {
            return;
        }
        String trimmed = value.trim();
        if (!trimmed.isBlank()) {
            target.add(trimmed);
        }
    }
}
