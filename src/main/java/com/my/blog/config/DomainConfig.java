package com.my.blog.config;

import com.my.blog.adapter.out.clock.OffsetClockAdapter;
import com.my.blog.domain.port.in.BlogContentUseCase;
import com.my.blog.domain.port.out.ClockPort;
import com.my.blog.domain.port.out.PostIndexPort;
import com.my.blog.domain.port.out.PostStorePort;
import com.my.blog.domain.service.BlogContentService;
import com.my.blog.domain.service.ContentCache;
import com.my.blog.domain.service.FrontmatterCodec;
import com.my.blog.domain.service.RateLimiter;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import java.time.Duration;

/**
 * 왜: 도메인 서비스와 포트 구현을 명시적으로 연결하여 헥사고날 구조를 보장하기 위함.
 * <p>
 * 요청 한도와 캐시는 프로세스 전체에서 하나만 존재해야 하므로 싱글톤으로 생산한다.
 */
@ApplicationScoped
public class DomainConfig {

    @Produces
    @Singleton
    public ClockPort clockPort() {
        return OffsetClockAdapter.system();
    }

    @Produces
    @Singleton
    public RateLimiter rateLimiter(AppConfig appConfig, ClockPort clockPort) {
        AppConfig.RateLimitConfig limit = appConfig.rateLimit();
        return new RateLimiter(limit.maxRequests(), Duration.ofSeconds(limit.windowSeconds()), clockPort);
    }

    @Produces
    @Singleton
    public FrontmatterCodec frontmatterCodec(ClockPort clockPort) {
        return new FrontmatterCodec(clockPort);
    }

    @Produces
    @Singleton
    public ContentCache contentCache(AppConfig appConfig, ClockPort clockPort) {
        AppConfig.CacheConfig cache = appConfig.cache();
        ContentCache.Settings settings = new ContentCache.Settings(
                Duration.ofSeconds(cache.postTtlSeconds()),
                Duration.ofSeconds(cache.listTtlSeconds()),
                Duration.ofSeconds(cache.statsTtlSeconds()),
                cache.maxPosts(),
                cache.maxLists(),
                Duration.ofSeconds(cache.cleanupIntervalSeconds()));
        return new ContentCache(settings, clockPort);
    }

    @Produces
    @Singleton
    public BlogContentUseCase blogContentUseCase(PostStorePort postStorePort,
                                                 PostIndexPort postIndexPort,
                                                 ContentCache contentCache,
                                                 ClockPort clockPort) {
        return new BlogContentService(postStorePort, postIndexPort, contentCache, clockPort);
    }
}
