package com.my.blog.adapter.out.index;

import com.my.blog.domain.model.BlogStats;
import com.my.blog.domain.model.Post;
import com.my.blog.domain.model.PostPage;
import com.my.blog.domain.model.PostQuery;
import com.my.blog.domain.port.out.PostIndexPort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 왜: 데이터베이스 없이 단일 프로세스에서 인덱스 계약을 그대로 제공해 로컬 실행과 테스트를 가볍게 하기 위함.
 */
@IfBuildProperty(name = "app.index.backend", stringValue = "memory")
@ApplicationScoped
public class InMemoryPostIndexAdapter implements PostIndexPort {

    static final Comparator<Post> NEWEST_FIRST = Comparator
            .comparing((Post post) -> post.metadata().createdAt().toInstant()).reversed()
            .thenComparing(Post::slug);

    private final Map<String, Post> posts = new ConcurrentHashMap<>();

    @Override
    public Optional<Post> findBySlug(String slug) {
        return Optional.ofNullable(posts.get(slug));
    }

    @Override
    public PostPage find(PostQuery query) {
        List<Post> matches = posts.values().stream()
                .filter(post -> matches(post, query))
                .sorted(NEWEST_FIRST)
                .toList();
        if (!query.isPaged()) {
            return new PostPage(matches, matches.size());
        }
        long offset = (long) (query.effectivePage() - 1) * query.effectivePerPage();
        List<Post> page = matches.stream()
                .skip(offset)
                .limit(query.effectivePerPage())
                .toList();
        return new PostPage(page, matches.size());
    }

    @Override
    public BlogStats stats() {
        long total = 0;
        long published = 0;
        long featured = 0;
        Map<String, Long> categories = new HashMap<>();
        Map<String, Long> tags = new HashMap<>();
        for (Post post : posts.values()) {
            total++;
            if (post.featured()) {
                featured++;
            }
            if (!post.metadata().published()) {
                continue;
            }
            published++;
            if (post.metadata().category() != null) {
                categories.merge(post.metadata().category(), 1L, Long::sum);
            }
            post.metadata().tags().forEach(tag -> tags.merge(tag, 1L, Long::sum));
        }
        return new BlogStats(total, published, total - published, featured, categories, tags);
    }

    @Override
    public Post upsert(Post post) {
        posts.put(post.slug(), post);
        return post;
    }

    @Override
    public boolean deleteBySlug(String slug) {
        return posts.remove(slug) != null;
    }

    private static boolean matches(Post post, PostQuery query) {
        if (query.category() != null && !query.category().equals(post.metadata().category())) {
            return false;
        }
        if (query.tag() != null && !post.metadata().tags().contains(query.tag())) {
            return false;
        }
        if (query.published() != null && query.published() != post.metadata().published()) {
            return false;
        }
        return query.featured() == null || query.featured() == post.featured();
    }
}
