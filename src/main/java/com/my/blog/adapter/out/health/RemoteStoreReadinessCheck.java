package com.my.blog.adapter.out.health;

import com.my.blog.config.AppConfig;
import com.my.blog.domain.exception.RemoteStoreException;
import com.my.blog.domain.model.AccountInfo;
import com.my.blog.domain.port.out.RemoteFilePort;
import com.my.blog.domain.service.RateLimiter;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class RemoteStoreReadinessCheck implements HealthCheck {

    private final RemoteFilePort remoteFiles;
    private final RateLimiter rateLimiter;
    private final AppConfig appConfig;

    public RemoteStoreReadinessCheck(RemoteFilePort remoteFiles, RateLimiter rateLimiter, AppConfig appConfig) {
        this.remoteFiles = remoteFiles;
        this.rateLimiter = rateLimiter;
        this.appConfig = appConfig;
    }

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("remote-store-readiness")
                .withData("rootPath", appConfig.dropbox().rootPath());
        try {
            rateLimiter.acquire();
            AccountInfo account = remoteFiles.testConnection();
            return builder
                    .withData("accountId", String.valueOf(account.accountId()))
                    .up()
                    .build();
        } catch (RemoteStoreException e) {
            return builder
                    .withData("error", e.getClass().getSimpleName())
                    .withData("message", String.valueOf(e.getMessage()))
                    .down()
                    .build();
        }
    }
}
