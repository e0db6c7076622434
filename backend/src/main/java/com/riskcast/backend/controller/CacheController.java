package com.riskcast.backend.controller;

import com.riskcast.backend.dto.InvalidationResponse;
import com.riskcast.backend.exception.ValidationInputException;
import com.riskcast.backend.service.cache.CachePrefetcher;
import com.riskcast.backend.service.cache.CacheStats;
import com.riskcast.backend.service.cache.ResultCache;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/cache")
@RequiredArgsConstructor
public class CacheController {

    private final ResultCache resultCache;
    private final CachePrefetcher cachePrefetcher;

    @GetMapping("/stats")
    public CacheStats stats() {
        return resultCache.stats();
    }

    @DeleteMapping
    public InvalidationResponse invalidate(@RequestParam(required = false) String pattern,
                                           @RequestParam(required = false) String tag) {
        boolean hasPattern = pattern != null && !pattern.isBlank();
        boolean hasTag = tag != null && !tag.isBlank();
        if (hasPattern == hasTag) {
            throw new ValidationInputException("Exactly one of 'pattern' or 'tag' is required");
        }
        long removed = hasPattern ? resultCache.invalidate(pattern) : resultCache.invalidateTag(tag);
        return new InvalidationResponse(hasPattern ? pattern : null, hasTag ? tag : null, removed);
    }

    @PostMapping("/prefetch")
    public CachePrefetcher.PrefetchReport prefetch() {
        return cachePrefetcher.prefetchOnce();
    }
}
