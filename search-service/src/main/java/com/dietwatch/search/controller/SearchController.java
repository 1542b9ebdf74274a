package com.dietwatch.search.controller;

import com.dietwatch.search.model.SearchOutcome;
import com.dietwatch.search.model.SearchRequest;
import com.dietwatch.search.model.SearchResponse;
import com.dietwatch.search.service.QueryOrchestrator;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/search")
@CrossOrigin(origins = "*")
public class SearchController {

    private final QueryOrchestrator queryOrchestrator;

    public SearchController(QueryOrchestrator queryOrchestrator) {
        this.queryOrchestrator = queryOrchestrator;
    }

    @PostMapping
    public SearchResponse search(
            @RequestBody SearchRequest request,
            @RequestHeader(value = "X-Trace-Id", required = false) String traceId
    ) {
        String effectiveTraceId = (traceId == null || traceId.isBlank()) ? UUID.randomUUID().toString() : traceId;
        SearchOutcome outcome = queryOrchestrator.search(
                request.getQuery(),
                request.getFilters(),
                request.getPage(),
                request.getPageSize(),
                effectiveTraceId
        );
        int page = request.getPage() == null ? QueryOrchestrator.DEFAULT_PAGE : request.getPage();
        int pageSize = request.getPageSize() == null ? QueryOrchestrator.DEFAULT_PAGE_SIZE : request.getPageSize();
        return SearchResponse.from(outcome, page, pageSize);
    }
}
