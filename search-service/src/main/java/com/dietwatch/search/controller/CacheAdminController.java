package com.dietwatch.search.controller;

import com.dietwatch.search.model.CacheStats;
import com.dietwatch.search.service.ResultCache;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/admin/cache")
public class CacheAdminController {

    private final ResultCache resultCache;

    public CacheAdminController(ResultCache resultCache) {
        this.resultCache = resultCache;
    }

    @GetMapping("/stats")
    public CacheStats stats() {
        return resultCache.stats();
    }

    @DeleteMapping
    public Map<String, Integer> clear() {
        return Map.of("cleared", resultCache.clear());
    }
}
