package com.my.blog.domain.service;

import com.my.blog.domain.exception.InvalidRequestException;
import com.my.blog.domain.model.BlogStats;
import com.my.blog.domain.model.CacheMetrics;
import com.my.blog.domain.model.CacheOccupancy;
import com.my.blog.domain.model.Post;
import com.my.blog.domain.model.PostMetadata;
import com.my.blog.domain.model.PostPage;
import com.my.blog.domain.model.PostQuery;
import com.my.blog.domain.model.StoredPost;
import com.my.blog.domain.model.SyncReport;
import com.my.blog.domain.port.in.BlogContentUseCase;
import com.my.blog.domain.port.out.ClockPort;
import com.my.blog.domain.port.out.PostIndexPort;
import com.my.blog.domain.port.out.PostStorePort;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 왜: 읽기는 캐시 → 인덱스 → 원격 순으로, 쓰기는 원격 → 인덱스 → 캐시 무효화 순으로 고정해 저장소 간 순서를 한 곳에서 보장하기 위함.
 * <p>
 * 캐시 무효화는 변경이 성공적으로 반환된 뒤에만 일어난다. 변경이 예외로 끝나면 캐시는 건드리지 않는다.
 */
public class BlogContentService implements BlogContentUseCase {

    private static final Logger log = Logger.getLogger(BlogContentService.class);

    private final PostStorePort postStore;
    private final PostIndexPort postIndex;
    private final ContentCache cache;
    private final ClockPort clock;

    public BlogContentService(PostStorePort postStore, PostIndexPort postIndex, ContentCache cache, ClockPort clock) {
        this.postStore = postStore;
        this.postIndex = postIndex;
        this.cache = cache;
        this.clock = clock;
    }

    @Override
    public Optional<Post> getPost(String slug) {
        requireSlug(slug);
        return timed(() -> {
            Optional<Post> cached = cache.getPost(slug);
            if (cached.isPresent()) {
                return cached;
            }
            Optional<Post> found = postIndex.findBySlug(slug)
                    .or(() -> postStore.getPostBySlug(slug).map(stored -> {
                        log.infof("인덱스에 없는 글을 원격에서 찾아 반영합니다: %s", slug);
                        return postIndex.upsert(Post.fromStored(stored, false));
                    }));
            found.ifPresent(post -> cache.setPost(slug, post));
            return found;
        });
    }

    @Override
    public PostPage listPosts(PostQuery query) {
        if (query == null) {
            throw new InvalidRequestException("조회 조건이 비어 있습니다.");
        }
        String key = ContentCache.listKey(query);
        return timed(() -> cache.getList(key).orElseGet(() -> {
            PostPage page = postIndex.find(query);
            cache.setList(key, page.posts(), page.total());
            return page;
        }));
    }

    @Override
    public BlogStats stats() {
        return timed(() -> cache.getStats().orElseGet(() -> {
            BlogStats stats = postIndex.stats();
            cache.setStats(stats);
            return stats;
        }));
    }

    @Override
    public List<StoredPost> listDrafts() {
        return timed(postStore::listDraftPosts);
    }

    @Override
    public Post savePost(StoredPost post, boolean draft, boolean featured) {
        if (post == null) {
            throw new InvalidRequestException("저장할 글이 비어 있습니다.");
        }
        PostMetadata metadata = post.metadata();
        StoredPost aligned = metadata.published() == !draft
                ? post
                : post.withMetadata(metadata.withPublished(!draft, metadata.updatedAt()));
        StoredPost saved = postStore.savePost(aligned, draft);
        Post indexed = postIndex.upsert(Post.fromStored(saved, featured));
        cache.invalidatePost(saved.slug());
        log.infof("글 저장 완료: %s (draft=%s, featured=%s)", saved.slug(), draft, featured);
        return indexed;
    }

    @Override
    public boolean deletePost(String slug) {
        requireSlug(slug);
        boolean removed = postStore.deletePost(slug);
        boolean unindexed = postIndex.deleteBySlug(slug);
        cache.invalidatePost(slug);
        log.infof("글 삭제: %s (remote=%s, index=%s)", slug, removed, unindexed);
        return removed;
    }

    @Override
    public boolean publishPost(String slug) {
        requireSlug(slug);
        if (!postStore.publishPost(slug)) {
            return false;
        }
        refreshIndex(slug);
        cache.invalidatePost(slug);
        return true;
    }

    @Override
    public boolean unpublishPost(String slug) {
        requireSlug(slug);
        if (!postStore.unpublishPost(slug)) {
            return false;
        }
        refreshIndex(slug);
        cache.invalidatePost(slug);
        return true;
    }

    /**
     * 원격의 공개 글 중 인덱스에 없거나 원격 쪽 updatedAt 이 더 최신인 글만 반영한다.
     * 글 하나의 반영 실패는 집계만 하고 나머지를 계속 처리한다.
     */
    @Override
    public SyncReport syncRemoteToIndex() {
        List<StoredPost> remote = postStore.listPublishedPosts();
        log.infof("원격 → 인덱스 동기화 시작: 원격 공개 글 %d건", remote.size());
        int synced = 0;
        int skipped = 0;
        int failed = 0;
        for (StoredPost stored : remote) {
            Optional<Post> existing = postIndex.findBySlug(stored.slug());
            if (existing.isPresent()
                    && !stored.metadata().updatedAt().isAfter(existing.get().metadata().updatedAt())) {
                skipped++;
                continue;
            }
            try {
                postIndex.upsert(Post.fromStored(stored, existing.map(Post::featured).orElse(false)));
                synced++;
            } catch (RuntimeException e) {
                failed++;
                log.warnf(e, "인덱스 반영 실패: %s", stored.slug());
            }
        }
        cache.invalidateAll();
        log.infof("동기화 완료: synced=%d, skipped=%d, failed=%d", synced, skipped, failed);
        return new SyncReport(synced, skipped, failed, remote.size());
    }

    @Override
    public void flushCache() {
        cache.invalidateAll();
    }

    @Override
    public CacheMetrics cacheMetrics() {
        return cache.metrics();
    }

    @Override
    public CacheOccupancy cacheOccupancy() {
        return cache.occupancy();
    }

    private void refreshIndex(String slug) {
        boolean featured = postIndex.findBySlug(slug).map(Post::featured).orElse(false);
        postStore.getPostBySlug(slug)
                .ifPresentOrElse(stored -> postIndex.upsert(Post.fromStored(stored, featured)),
                        () -> log.warnf("이동한 글을 다시 읽지 못했습니다: %s", slug));
    }

    private <T> T timed(Supplier<T> read) {
        long start = clock.monotonicNanos();
        try {
            return read.get();
        } finally {
            cache.updateLatency((clock.monotonicNanos() - start) / 1_000_000.0);
        }
    }

    private static void requireSlug(String slug) {
        if (slug == null || slug.isBlank()) {
            throw new InvalidRequestException("slug 가 비어 있습니다.");
        }
        if (!PostMetadata.isUrlSafe(slug)) {
            throw new InvalidRequestException("URL 에 쓸 수 없는 slug 입니다: '" + slug + "'");
        }
    }
}
