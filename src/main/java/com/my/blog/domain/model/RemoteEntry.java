package com.my.blog.domain.model;

import java.util.Locale;
import java.util.Objects;

/**
 * 원격 파일/폴더 메타데이터. size, contentHash, clientModified, serverModified 는 폴더일 때 null 이다.
 */
public record RemoteEntry(
        String name,
        String pathLower,
        String pathDisplay,
        Long size,
        String contentHash,
        String clientModified,
        String serverModified
) {
    public RemoteEntry {
        Objects.requireNonNull(name, "name");
    }

    public boolean isMarkdown() {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.endsWith(".md") || lower.endsWith(".markdown");
    }

    public String path() {
        return pathDisplay != null ? pathDisplay : pathLower;
    }
}
