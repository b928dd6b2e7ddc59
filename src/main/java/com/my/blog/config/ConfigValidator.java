package com.my.blog.config;

import io.quarkus.runtime.Startup;
import io.quarkus.runtime.LaunchMode;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.net.URI;
import java.net.URISyntaxException;

@Startup
@ApplicationScoped
public class ConfigValidator {

    private static final Logger log = Logger.getLogger(ConfigValidator.class);

    private final AppConfig appConfig;

    public ConfigValidator(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @PostConstruct
    void validate() {
        boolean isProd = LaunchMode.current() == LaunchMode.NORMAL;
        AppConfig.DropboxConfig dropbox = appConfig.dropbox();
        validateRequired("DROPBOX_ACCESS_TOKEN", dropbox.accessToken().orElse(null), isProd);
        validateUrl("app.dropbox.api-base-url", dropbox.apiBaseUrl(), isProd);
        validateUrl("app.dropbox.content-base-url", dropbox.contentBaseUrl(), isProd);
        validateRootPath(dropbox.rootPath(), isProd);
        validatePositive("app.rate-limit.max-requests", appConfig.rateLimit().maxRequests(), isProd);
        validatePositive("app.rate-limit.window-seconds", appConfig.rateLimit().windowSeconds(), isProd);
        validatePositive("app.cache.max-posts", appConfig.cache().maxPosts(), isProd);
        validatePositive("app.cache.max-lists", appConfig.cache().maxLists(), isProd);
    }

    private void validateRequired(String name, String value, boolean strict) {
        if (value == null || value.isBlank()) {
            report("필수 설정이 비어 있습니다: " + name, strict);
        }
    }

    private void validateUrl(String name, String value, boolean strict) {
        try {
            URI uri = new URI(value);
            if (uri.getScheme() == null || uri.getHost() == null) {
                report("URL 형식이 아닙니다: " + name + "=" + value, strict);
            }
        } catch (URISyntaxException e) {
            report("URL 형식이 아닙니다: " + name + "=" + value, strict);
        }
    }

    private void validateRootPath(String rootPath, boolean strict) {
        if (rootPath != null && !rootPath.isBlank() && !rootPath.startsWith("/")) {
            report("root-path 는 '/' 로 시작해야 합니다: " + rootPath, strict);
        }
    }

    private void validatePositive(String name, int value, boolean strict) {
        if (value < 1) {
            report("1 이상이어야 합니다: " + name + "=" + value, strict);
        }
    }

    private void report(String message, boolean strict) {
        if (strict) {
            throw new IllegalStateException(message);
        }
        log.warn(message);
    }
}
