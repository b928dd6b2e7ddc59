package com.my.blog.domain.model;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 왜: frontmatter 필드를 닫힌 스키마로 고정하고, 알 수 없는 키는 extra 에 보존해 렌더링 시 손실이 없도록 하기 위함.
 */
public record PostMetadata(
        String title,
        String slug,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        String category,
        Set<String> tags,
        boolean published,
        String author,
        String excerpt,
        Map<String, Object> extra
) {

    private static final Pattern URL_SAFE_SLUG = Pattern.compile("[a-z0-9]+(-[a-z0-9]+)*");

    public PostMetadata {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(slug, "slug");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
        if (!isUrlSafe(slug)) {
            throw new IllegalArgumentException("slug 는 소문자, 숫자, 단일 하이픈만 허용합니다: " + slug);
        }
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        extra = extra == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    public static boolean isUrlSafe(String slug) {
        return slug != null && URL_SAFE_SLUG.matcher(slug).matches();
    }

    public PostMetadata withPublished(boolean published, OffsetDateTime updatedAt) {
        return new PostMetadata(title, slug, createdAt, updatedAt, category, tags, published, author, excerpt, extra);
    }
}
