package com.my.blog.domain.model;

public record AccountInfo(String accountId, String email, String displayName) {
}
