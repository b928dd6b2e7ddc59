package com.my.blog.domain.model;

/**
 * 캐시 적중률과 읽기 지연(지수 이동 평균, ms)의 스냅샷.
 */
public record CacheMetrics(long hits, long misses, double hitRate, double averageLatencyMs) {

    public long totalRequests() {
        return hits + misses;
    }
}
