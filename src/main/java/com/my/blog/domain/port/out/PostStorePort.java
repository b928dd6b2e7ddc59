package com.my.blog.domain.port.out;

import com.my.blog.domain.model.BlogStats;
import com.my.blog.domain.model.StoredPost;

import java.util.List;
import java.util.Optional;

/**
 * 왜: 원격 마크다운 파일 위의 글 생명주기(초안, 공개, 삭제)를 도메인이 폴더 배치를 몰라도 다룰 수 있게 하기 위함.
 */
public interface PostStorePort {

    void initializeStructure();

    List<StoredPost> listPublishedPosts();

    List<StoredPost> listDraftPosts();

    Optional<StoredPost> getPostBySlug(String slug);

    StoredPost savePost(StoredPost post, boolean draft);

    boolean deletePost(String slug);

    boolean publishPost(String slug);

    boolean unpublishPost(String slug);

    BlogStats collectStats();
}
