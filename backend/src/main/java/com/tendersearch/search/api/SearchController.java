package com.tendersearch.search.api;

import com.tendersearch.search.model.ConsolidatedResult;
import com.tendersearch.search.model.SearchRequest;
import com.tendersearch.search.model.SourceApi;
import com.tendersearch.search.service.InvalidSearchRequestException;
import com.tendersearch.search.service.TenderSearchService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class SearchController {
    private final TenderSearchService searchService;

    public SearchController(TenderSearchService searchService) {
        this.searchService = searchService;
    }

    @PostMapping("/search")
    public ConsolidatedResult search(@RequestBody(required = false) SearchRequest request) {
        if (request == null) {
            throw new InvalidSearchRequestException("search request body is required");
        }
        return searchService.search(request);
    }

    @GetMapping("/sources")
    public List<String> sources() {
        return searchService.availableSources().stream().map(SourceApi::id).toList();
    }
}
