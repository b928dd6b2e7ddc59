package com.my.blog.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

@StaticInitSafe
@ConfigMapping(prefix = "app")
public interface AppConfig {

    DropboxConfig dropbox();

    @WithName("rate-limit")
    RateLimitConfig rateLimit();

    CacheConfig cache();

    IndexConfig index();

    interface DropboxConfig {
        @WithName("access-token")
        Optional<String> accessToken();

        @WithName("api-base-url")
        @WithDefault("https://api.dropboxapi.com")
        String apiBaseUrl();

        @WithName("content-base-url")
        @WithDefault("https://content.dropboxapi.com")
        String contentBaseUrl();

        @WithName("root-path")
        @WithDefault("/BlogStorage")
        String rootPath();

        @WithName("connect-timeout-seconds")
        @WithDefault("5")
        int connectTimeoutSeconds();

        @WithName("request-timeout-seconds")
        @WithDefault("30")
        int requestTimeoutSeconds();

        @WithName("initialize-on-startup")
        @WithDefault("true")
        boolean initializeOnStartup();
    }

    interface RateLimitConfig {
        @WithName("max-requests")
        @WithDefault("450")
        int maxRequests();

        @WithName("window-seconds")
        @WithDefault("60")
        int windowSeconds();
    }

    interface CacheConfig {
        @WithName("post-ttl-seconds")
        @WithDefault("600")
        int postTtlSeconds();

        @WithName("list-ttl-seconds")
        @WithDefault("300")
        int listTtlSeconds();

        @WithName("stats-ttl-seconds")
        @WithDefault("900")
        int statsTtlSeconds();

        @WithName("max-posts")
        @WithDefault("1000")
        int maxPosts();

        @WithName("max-lists")
        @WithDefault("50")
        int maxLists();

        @WithName("cleanup-interval-seconds")
        @WithDefault("300")
        int cleanupIntervalSeconds();
    }

    interface IndexConfig {
        @WithName("backend")
        @WithDefault("sqlite")
        String backend();

        @WithName("sqlite-path")
        @WithDefault("./data/blog.db")
        String sqlitePath();
    }
}
