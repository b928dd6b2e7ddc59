package com.my.blog.domain.model;

import java.util.List;

public record PostPage(List<Post> posts, long total) {
    public PostPage {
        posts = posts == null ? List.of() : List.copyOf(posts);
    }
}
