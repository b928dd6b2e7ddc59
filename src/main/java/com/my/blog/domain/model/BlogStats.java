package com.my.blog.domain.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * 왜: 인덱스와 원격 저장소 어느 쪽에서 집계하든 같은 모양의 통계를 캐시에 담기 위함.
 */
public record BlogStats(
        long totalPosts,
        long publishedPosts,
        long draftPosts,
        long featuredPosts,
        Map<String, Long> categories,
        Map<String, Long> tags
) {
    public BlogStats {
        categories = categories == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(categories));
        tags = tags == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(tags));
    }
}
