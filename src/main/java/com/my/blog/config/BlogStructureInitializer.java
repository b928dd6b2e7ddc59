package com.my.blog.config;

import com.my.blog.domain.exception.RemoteStoreException;
import com.my.blog.domain.port.out.PostStorePort;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.runtime.LaunchMode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import org.jboss.logging.Logger;

/**
 * 왜: 첫 요청 전에 원격 폴더 구조(posts, drafts, media ...)가 존재하도록 기동 시점에 한 번 보장하기 위함.
 * <p>
 * prod 프로필에서는 실패 시 기동을 중단하고, 그 외에는 경고만 남겨 토큰 없이도 로컬 실행이 가능하게 한다.
 */
@ApplicationScoped
public class BlogStructureInitializer {

    private static final Logger log = Logger.getLogger(BlogStructureInitializer.class);

    private final PostStorePort postStore;
    private final AppConfig appConfig;

    public BlogStructureInitializer(PostStorePort postStore, AppConfig appConfig) {
        this.postStore = postStore;
        this.appConfig = appConfig;
    }

    void onStart(@Observes StartupEvent event) {
        if (!appConfig.dropbox().initializeOnStartup()) {
            log.info("기동 시 폴더 초기화가 비활성화되어 있습니다.");
            return;
        }
        boolean isProd = LaunchMode.current() == LaunchMode.NORMAL;
        try {
            postStore.initializeStructure();
        } catch (RemoteStoreException e) {
            if (isProd) {
                throw e;
            }
            log.warnf("원격 폴더 초기화 실패, 계속 진행합니다: %s", e.getMessage());
        }
    }
}
