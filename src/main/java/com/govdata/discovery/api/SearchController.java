package com.govdata.discovery.api;

import com.govdata.discovery.search.SearchModels.SearchResponse;
import com.govdata.discovery.search.SearchService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/search")
public class SearchController {
    private final SearchService searchService;

    public SearchController(SearchService searchService) {
        this.searchService = searchService;
    }

    @GetMapping
    public ResponseEntity<SearchResponse> search(@RequestParam(required = false) String q,
                                                 @RequestParam(required = false) String domain,
                                                 @RequestParam(required = false) String agency) {
        return ResponseEntity.ok(searchService.search(q, domain, agency));
    }
}
