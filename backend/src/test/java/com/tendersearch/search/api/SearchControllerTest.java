package com.tendersearch.search.api;

import com.tendersearch.search.model.ConsolidatedResult;
import com.tendersearch.search.model.SearchMetadata;
import com.tendersearch.search.model.SearchRequest;
import com.tendersearch.search.model.SourceApi;
import com.tendersearch.search.model.Statistics;
import com.tendersearch.search.model.Tender;
import com.tendersearch.search.service.InvalidSearchRequestException;
import com.tendersearch.search.service.TenderSearchService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class SearchControllerTest {

    @Autowired
    private WebApplicationContext context;

    @MockBean
    private TenderSearchService searchService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void searchReturnsConsolidatedResult() throws Exception {
        when(searchService.search(any())).thenReturn(sampleResult());

        mockMvc.perform(post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"searchTerm": "road", "sources": ["ted"], "dateFrom": "2024-01-01",
                     "dateTo": "2024-03-31", "minValue": 1000}
                    """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.searchMetadata.searchId").value("search_20240315_103000"))
            .andExpect(jsonPath("$.searchMetadata.apisUsed[0]").value("ted"))
            .andExpect(jsonPath("$.tenders.length()").value(1))
            .andExpect(jsonPath("$.tenders[0].sourceApi").value("ted"))
            .andExpect(jsonPath("$.tenders[0].publishDate").value("2024-02-01"))
            .andExpect(jsonPath("$.statistics.totalCount").value(1))
            .andExpect(jsonPath("$.errors.length()").value(0));

        ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);
        verify(searchService).search(captor.capture());
        SearchRequest request = captor.getValue();
        assertThat(request.searchTerm()).isEqualTo("road");
        assertThat(request.sources()).containsExactly("ted");
        assertThat(request.dateFrom()).isEqualTo(LocalDate.of(2024, 1, 1));
        assertThat(request.dateTo()).isEqualTo(LocalDate.of(2024, 3, 31));
        assertThat(request.minValue()).isEqualTo(1000L);
    }

    @Test
    void invalidRequestMapsToBadRequest() throws Exception {
        when(searchService.search(any())).thenThrow(new InvalidSearchRequestException("Unknown source: ebay"));

        mockMvc.perform(post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"searchTerm\": \"road\", \"sources\": [\"ebay\"]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_search_request"))
            .andExpect(jsonPath("$.message").value("Unknown source: ebay"));
    }

    @Test
    void missingOrMalformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/search").contentType(MediaType.APPLICATION_JSON))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_search_request"));

        mockMvc.perform(post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"searchTerm\": \"road\", \"dateFrom\": \"15/01/2024\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_search_request"));

        verify(searchService, never()).search(any());
    }

    @Test
    void searchIsPostOnly() throws Exception {
        mockMvc.perform(get("/api/search"))
            .andExpect(status().isMethodNotAllowed());
    }

    @Test
    void sourcesListsRegisteredSourceIds() throws Exception {
        when(searchService.availableSources()).thenReturn(List.of(SourceApi.TED, SourceApi.CONTRACTS_FINDER));

        mockMvc.perform(get("/api/sources"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(2))
            .andExpect(jsonPath("$[0]").value("ted"))
            .andExpect(jsonPath("$[1]").value("contracts_finder"));
    }

    private static ConsolidatedResult sampleResult() {
        Tender tender = new Tender(
            "123456-2024",
            "Road maintenance",
            "Road maintenance",
            "Stadt Berlin",
            new BigDecimal("250000"),
            "EUR",
            LocalDate.of(2024, 2, 1),
            null,
            "DE",
            "Berlin",
            SourceApi.TED.noticeUrl("123456-2024"),
            SourceApi.TED,
            0.8,
            null
        );
        SearchMetadata metadata = new SearchMetadata(
            "search_20240315_103000",
            "road",
            List.of(SourceApi.TED),
            LocalDate.of(2024, 1, 1),
            LocalDate.of(2024, 3, 31),
            1000,
            Instant.parse("2024-03-15T10:30:00Z")
        );
        Statistics statistics = new Statistics(1, Map.of("ted", 1), null, Map.of("DE", 1), null, 0);
        return new ConsolidatedResult(metadata, List.of(tender), statistics, List.of(), List.of());
    }
}
