package com.my.blog.domain.service;

import com.my.blog.domain.model.BlogStats;
import com.my.blog.domain.model.CacheMetrics;
import com.my.blog.domain.model.CacheOccupancy;
import com.my.blog.domain.model.Post;
import com.my.blog.domain.model.PostPage;
import com.my.blog.domain.model.PostQuery;
import com.my.blog.domain.port.out.ClockPort;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * 왜: 원격 저장소와 관계형 인덱스 앞에서 글, 목록 조회 결과, 통계를 TTL 로 보관해 반복 조회 비용을 줄이기 위함.
 * <p>
 * 세 맵은 각자의 읽기/쓰기 락으로 보호되어 동시 조회끼리는 막지 않는다. 조회 실패는 오류가 아니라 정상적인 miss 다.
 * 글 하나가 바뀌면 목록 전체와 통계를 비우는 거친 무효화 정책을 쓴다.
 */
public class ContentCache {

    private static final Logger log = Logger.getLogger(ContentCache.class);

    public static final String ALL_POSTS_KEY = "all_posts";
    private static final double LATENCY_SMOOTHING = 0.1;

    private final Settings settings;
    private final ClockPort clock;

    private final Map<String, Entry<Post>> posts = new LinkedHashMap<>();
    private final Map<String, Entry<PostPage>> lists = new LinkedHashMap<>();
    private Entry<BlogStats> stats;

    private final ReentrantReadWriteLock postsLock = new ReentrantReadWriteLock();
    private final ReentrantReadWriteLock listsLock = new ReentrantReadWriteLock();
    private final ReentrantReadWriteLock statsLock = new ReentrantReadWriteLock();

    private final ReentrantLock metricsLock = new ReentrantLock();
    private long hits;
    private long misses;
    private double hitRate;
    private Double averageLatencyMs;

    private final AtomicLong lastCleanup;

    public ContentCache(Settings settings, ClockPort clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.lastCleanup = new AtomicLong(clock.monotonicNanos());
    }

    public Optional<Post> getPost(String slug) {
        return lookup(posts, postsLock, slug, "post");
    }

    public void setPost(String slug, Post post) {
        cleanupIfNeeded();
        store(posts, postsLock, slug, post, settings.postTtl(), settings.maxPosts(), "post");
    }

    public Optional<PostPage> getList(String key) {
        return lookup(lists, listsLock, key, "list");
    }

    public void setList(String key, List<Post> page, long total) {
        cleanupIfNeeded();
        store(lists, listsLock, key, new PostPage(page, total), settings.listTtl(), settings.maxLists(), "list");
    }

    public Optional<BlogStats> getStats() {
        statsLock.readLock().lock();
        try {
            if (stats != null && !stats.isExpiredAt(clock.monotonicNanos())) {
                recordHit();
                return Optional.of(stats.payload());
            }
        } finally {
            statsLock.readLock().unlock();
        }
        recordMiss();
        return Optional.empty();
    }

    public void setStats(BlogStats blogStats) {
        cleanupIfNeeded();
        statsLock.writeLock().lock();
        try {
            stats = Entry.of(blogStats, clock.monotonicNanos(), settings.statsTtl());
        } finally {
            statsLock.writeLock().unlock();
        }
    }

    /** 글 항목을 지우고, 그 글이 포함됐을 수 있는 모든 목록과 통계를 함께 비운다. */
    public void invalidatePost(String slug) {
        cleanupIfNeeded();
        withWriteLock(postsLock, () -> {
            posts.remove(slug);
        });
        withWriteLock(listsLock, lists::clear);
        withWriteLock(statsLock, () -> {
            stats = null;
        });
        log.debugf("캐시 무효화: post=%s", slug);
    }

    public void invalidateAll() {
        withWriteLock(postsLock, posts::clear);
        withWriteLock(listsLock, lists::clear);
        withWriteLock(statsLock, () -> {
            stats = null;
        });
        lastCleanup.set(clock.monotonicNanos());
        log.info("캐시 전체를 비웠습니다.");
    }

    public void recordHit() {
        metricsLock.lock();
        try {
            hits++;
            recomputeHitRate();
        } finally {
            metricsLock.unlock();
        }
    }

    public void recordMiss() {
        metricsLock.lock();
        try {
            misses++;
            recomputeHitRate();
        } finally {
            metricsLock.unlock();
        }
    }

    /** 지수 이동 평균(평활 계수 0.1). 첫 샘플은 그대로 평균이 된다. */
    public void updateLatency(double sampleMs) {
        metricsLock.lock();
        try {
            averageLatencyMs = averageLatencyMs == null
                    ? sampleMs
                    : (1 - LATENCY_SMOOTHING) * averageLatencyMs + LATENCY_SMOOTHING * sampleMs;
        } finally {
            metricsLock.unlock();
        }
    }

    public CacheMetrics metrics() {
        metricsLock.lock();
        try {
            return new CacheMetrics(hits, misses, hitRate, averageLatencyMs == null ? 0.0 : averageLatencyMs);
        } finally {
            metricsLock.unlock();
        }
    }

    public CacheOccupancy occupancy() {
        int postCount = computeWithReadLock(postsLock, posts::size);
        int listCount = computeWithReadLock(listsLock, lists::size);
        boolean statsCached = computeWithReadLock(statsLock, () -> stats != null);
        return new CacheOccupancy(postCount, listCount, statsCached);
    }

    /**
     * 목록 조회 필터의 정규 키. 존재하는 필드만 고정 순서(cat, tag, pub, feat, page, per_page)로
     * {@code name:value} 를 이어 붙이고, 필터가 하나도 없으면 {@value #ALL_POSTS_KEY} 를 쓴다.
     * 문자열 값 안의 {@code :} 와 {@code \} 는 이스케이프한다.
     */
    public static String listKey(PostQuery query) {
        List<String> parts = new ArrayList<>();
        if (query.category() != null) {
            parts.add("cat:" + escape(query.category()));
        }
        if (query.tag() != null) {
            parts.add("tag:" + escape(query.tag()));
        }
        if (query.published() != null) {
            parts.add("pub:" + query.published());
        }
        if (query.featured() != null) {
            parts.add("feat:" + query.featured());
        }
        if (query.page() != null) {
            parts.add("page:" + query.page());
        }
        if (query.perPage() != null) {
            parts.add("per_page:" + query.perPage());
        }
        return parts.isEmpty() ? ALL_POSTS_KEY : String.join(":", parts);
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace(":", "\\:");
    }

    private <T> Optional<T> lookup(Map<String, Entry<T>> map, ReentrantReadWriteLock lock, String key, String kind) {
        lock.readLock().lock();
        try {
            Entry<T> entry = map.get(key);
            if (entry != null && !entry.isExpiredAt(clock.monotonicNanos())) {
                recordHit();
                return Optional.of(entry.payload());
            }
        } finally {
            lock.readLock().unlock();
        }
        log.debugf("캐시 miss: %s=%s", kind, key);
        recordMiss();
        return Optional.empty();
    }

    private <T> void store(Map<String, Entry<T>> map, ReentrantReadWriteLock lock,
                           String key, T payload, Duration ttl, int capacity, String kind) {
        lock.writeLock().lock();
        try {
            if (map.size() >= capacity && !map.containsKey(key)) {
                evictOldest(map, kind);
            }
            map.remove(key);
            map.put(key, Entry.of(payload, clock.monotonicNanos(), ttl));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** 가장 오래 전에 캐시된 25%(최소 1건)를 제거한다. 호출자가 쓰기 락을 쥐고 있어야 한다. */
    private <T> void evictOldest(Map<String, Entry<T>> map, String kind) {
        int evictCount = Math.max(1, map.size() / 4);
        List<String> oldest = map.entrySet().stream()
                .sorted(Comparator.comparingLong(e -> e.getValue().cachedAt()))
                .limit(evictCount)
                .map(Map.Entry::getKey)
                .toList();
        oldest.forEach(map::remove);
        log.debugf("용량 초과로 %s 캐시 %d건 제거", kind, oldest.size());
    }

    private void cleanupIfNeeded() {
        long now = clock.monotonicNanos();
        long last = lastCleanup.get();
        if (now - last > settings.cleanupInterval().toNanos() && lastCleanup.compareAndSet(last, now)) {
            cleanupExpired(now);
        }
    }

    private void cleanupExpired(long now) {
        int removed = computeWithWriteLock(postsLock, () -> removeExpired(posts, now));
        removed += computeWithWriteLock(listsLock, () -> removeExpired(lists, now));
        removed += computeWithWriteLock(statsLock, () -> {
            if (stats != null && stats.isExpiredAt(now)) {
                stats = null;
                return 1;
            }
            return 0;
        });
        if (removed > 0) {
            log.debugf("만료된 캐시 항목 %d건 정리", removed);
        }
    }

    private static <T> int removeExpired(Map<String, Entry<T>> map, long now) {
        int before = map.size();
        map.values().removeIf(entry -> entry.isExpiredAt(now));
        return before - map.size();
    }

    private void recomputeHitRate() {
        long total = hits + misses;
        hitRate = total == 0 ? 0.0 : (double) hits / total * 100.0;
    }

    private static void withWriteLock(ReentrantReadWriteLock lock, Runnable action) {
        lock.writeLock().lock();
        try {
            action.run();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static <R> R computeWithWriteLock(ReentrantReadWriteLock lock, Supplier<R> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static <R> R computeWithReadLock(ReentrantReadWriteLock lock, Supplier<R> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** 페이로드는 교체로만 갱신된다. 시각은 단조 시계 나노초. */
    record Entry<T>(T payload, long cachedAt, long expiresAt) {
        static <T> Entry<T> of(T payload, long now, Duration ttl) {
            return new Entry<>(payload, now, now + ttl.toNanos());
        }

        boolean isExpiredAt(long now) {
            return now - expiresAt >= 0;
        }
    }

    public record Settings(
            Duration postTtl,
            Duration listTtl,
            Duration statsTtl,
            int maxPosts,
            int maxLists,
            Duration cleanupInterval
    ) {
        public Settings {
            Objects.requireNonNull(postTtl, "postTtl");
            Objects.requireNonNull(listTtl, "listTtl");
            Objects.requireNonNull(statsTtl, "statsTtl");
            Objects.requireNonNull(cleanupInterval, "cleanupInterval");
            if (maxPosts < 1 || maxLists < 1) {
                throw new IllegalArgumentException("캐시 용량은 1 이상이어야 합니다.");
            }
        }

        public static Settings defaults() {
            return new Settings(Duration.ofMinutes(10), Duration.ofMinutes(5), Duration.ofMinutes(15),
                    1000, 50, Duration.ofMinutes(5));
        }
    }
}
