package com.my.blog.domain.port.in;

import com.my.blog.domain.model.BlogStats;
import com.my.blog.domain.model.CacheMetrics;
import com.my.blog.domain.model.CacheOccupancy;
import com.my.blog.domain.model.Post;
import com.my.blog.domain.model.PostPage;
import com.my.blog.domain.model.PostQuery;
import com.my.blog.domain.model.StoredPost;
import com.my.blog.domain.model.SyncReport;

import java.util.List;
import java.util.Optional;

/**
 * 왜: 요청 처리기가 캐시, 인덱스, 원격 저장소의 조합 순서를 몰라도 되도록 읽기/쓰기 경로를 단일 유스케이스로 모으기 위함.
 */
public interface BlogContentUseCase {

    Optional<Post> getPost(String slug);

    PostPage listPosts(PostQuery query);

    BlogStats stats();

    List<StoredPost> listDrafts();

    Post savePost(StoredPost post, boolean draft, boolean featured);

    boolean deletePost(String slug);

    boolean publishPost(String slug);

    boolean unpublishPost(String slug);

    SyncReport syncRemoteToIndex();

    void flushCache();

    CacheMetrics cacheMetrics();

    CacheOccupancy cacheOccupancy();
}
