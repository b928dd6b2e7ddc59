package com.my.blog.domain.model;

public record CacheOccupancy(int cachedPosts, int cachedLists, boolean statsCached) {
}
