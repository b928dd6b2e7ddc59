package com.my.blog.domain.model;

import java.util.List;

public record FolderPage(List<RemoteEntry> entries, String cursor, boolean hasMore) {
    public FolderPage {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }
}
