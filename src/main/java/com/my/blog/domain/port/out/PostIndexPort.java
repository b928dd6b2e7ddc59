package com.my.blog.domain.port.out;

import com.my.blog.domain.model.BlogStats;
import com.my.blog.domain.model.Post;
import com.my.blog.domain.model.PostPage;
import com.my.blog.domain.model.PostQuery;

import java.util.Optional;

/**
 * 왜: 조회용 관계형 사본에 대한 읽기/쓰기 계약만 노출해 캐시와 오케스트레이션이 스키마에 종속되지 않도록 하기 위함.
 */
public interface PostIndexPort {

    Optional<Post> findBySlug(String slug);

    /** createdAt 내림차순, 같으면 slug 오름차순. total 은 페이지 적용 전 일치 건수. */
    PostPage find(PostQuery query);

    BlogStats stats();

    Post upsert(Post post);

    boolean deleteBySlug(String slug);
}
