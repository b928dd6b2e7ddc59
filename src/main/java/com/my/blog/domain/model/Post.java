package com.my.blog.domain.model;

import java.util.Objects;

/**
 * 왜: 관계형 인덱스에 미러링된 조회용 사본을 원격 글과 구분하고, 인덱스에만 있는 featured 플래그를 담기 위함.
 */
public record Post(PostMetadata metadata, String body, String remotePath, boolean featured) {
    public Post {
        Objects.requireNonNull(metadata, "metadata");
        Objects.requireNonNull(body, "body");
    }

    public static Post fromStored(StoredPost stored, boolean featured) {
        return new Post(stored.metadata(), stored.body(), stored.remotePath(), featured);
    }

    public String slug() {
        return metadata.slug();
    }
}
