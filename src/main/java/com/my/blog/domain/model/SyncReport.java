package com.my.blog.domain.model;

/**
 * 원격 → 인덱스 동기화 결과. remoteTotal 은 원격에서 읽은 공개 글 수.
 */
public record SyncReport(int synced, int skipped, int failed, int remoteTotal) {
}
