package com.my.blog.domain.model;

/**
 * 목록 조회 필터. null 인 필드는 조건에서 제외된다. page 는 1부터 시작한다.
 */
public record PostQuery(
        String category,
        String tag,
        Boolean published,
        Boolean featured,
        Integer page,
        Integer perPage
) {

    public static final int DEFAULT_PER_PAGE = 10;

    public PostQuery {
        if (page != null && page < 1) {
            throw new IllegalArgumentException("page 는 1 이상이어야 합니다: " + page);
        }
        if (perPage != null && perPage < 1) {
            throw new IllegalArgumentException("perPage 는 1 이상이어야 합니다: " + perPage);
        }
    }

    public static PostQuery all() {
        return new PostQuery(null, null, null, null, null, null);
    }

    public static PostQuery publishedPage(int page, int perPage) {
        return new PostQuery(null, null, true, null, page, perPage);
    }

    public boolean isPaged() {
        return page != null || perPage != null;
    }

    public int effectivePage() {
        return page == null ? 1 : page;
    }

    public int effectivePerPage() {
        return perPage == null ? DEFAULT_PER_PAGE : perPage;
    }
}
