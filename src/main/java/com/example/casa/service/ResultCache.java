package com.example.casa.service;

import com.example.casa.config.CasaProperties;
import com.example.casa.dto.AnalysisJob;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * 已进入终态的任务快照的读缓存
 */
@Component
public class ResultCache {

    private final Cache<String, AnalysisJob> cache;

    @Autowired
    public ResultCache(CasaProperties properties) {
        this(properties.getCache().getMaximumSize(),
                Duration.ofMinutes(properties.getCache().getExpireAfterAccessMinutes()));
    }

    public ResultCache(long maximumSize, Duration expireAfterAccess) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterAccess(expireAfterAccess)
                .build();
    }

    public Optional<AnalysisJob> get(String analysisId) {
        return Optional.ofNullable(cache.getIfPresent(analysisId));
    }

    public void put(AnalysisJob job) {
        cache.put(job.getAnalysisId(), job);
    }

    public void invalidate(String analysisId) {
        cache.invalidate(analysisId);
    }
}
