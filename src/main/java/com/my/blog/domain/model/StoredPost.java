package com.my.blog.domain.model;

import java.util.Objects;

/**
 * 왜: 원격 저장소에서 읽을 때마다 코덱으로 재구성되는 글 한 편을 경로와 함께 표현하기 위함.
 */
public record StoredPost(PostMetadata metadata, String body, String remotePath) {
    public StoredPost {
        Objects.requireNonNull(metadata, "metadata");
        Objects.requireNonNull(body, "body");
    }

    public String slug() {
        return metadata.slug();
    }

    public StoredPost withMetadata(PostMetadata updated) {
        return new StoredPost(updated, body, remotePath);
    }

    public StoredPost withRemotePath(String path) {
        return new StoredPost(metadata, body, path);
    }
}
