package com.my.blog.adapter.out.dropbox;

import com.my.blog.config.AppConfig;
import com.my.blog.domain.exception.FrontmatterParseException;
import com.my.blog.domain.exception.InvalidRequestException;
import com.my.blog.domain.exception.RemoteConflictException;
import com.my.blog.domain.exception.RemoteNetworkException;
import com.my.blog.domain.exception.RemoteNotFoundException;
import com.my.blog.domain.model.BlogFolder;
import com.my.blog.domain.model.BlogStats;
import com.my.blog.domain.model.FolderPage;
import com.my.blog.domain.model.PostMetadata;
import com.my.blog.domain.model.RemoteEntry;
import com.my.blog.domain.model.StoredPost;
import com.my.blog.domain.port.out.ClockPort;
import com.my.blog.domain.port.out.PostStorePort;
import com.my.blog.domain.port.out.RemoteFilePort;
import com.my.blog.domain.service.FrontmatterCodec;
import com.my.blog.domain.service.RateLimiter;
import io.smallrye.faulttolerance.api.ExponentialBackoff;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 왜: 원격 저장소의 posts/drafts 폴더 위에서 글 생명주기를 구현해 도메인이 파일 배치와 호출 한도를 몰라도 되도록 하기 위함.
 * <p>
 * 모든 원격 호출은 {@link RateLimiter} 를 먼저 통과한다. 네트워크 오류만 지수 백오프로 재시도하며,
 * 재시도는 작업 전체를 다시 실행하므로 매 시도마다 한도 검사를 다시 거친다.
 */
@ApplicationScoped
public class FileBackedPostStore implements PostStorePort {

    private static final Logger log = Logger.getLogger(FileBackedPostStore.class);

    private static final List<String> MEDIA_SUBFOLDERS = List.of("images", "videos");

    private final RemoteFilePort remoteFiles;
    private final RateLimiter rateLimiter;
    private final FrontmatterCodec codec;
    private final ClockPort clock;
    private final String root;

    @Inject
    public FileBackedPostStore(RemoteFilePort remoteFiles,
                               RateLimiter rateLimiter,
                               FrontmatterCodec codec,
                               ClockPort clock,
                               AppConfig appConfig) {
        this(remoteFiles, rateLimiter, codec, clock, appConfig.dropbox().rootPath());
    }

    public FileBackedPostStore(RemoteFilePort remoteFiles,
                               RateLimiter rateLimiter,
                               FrontmatterCodec codec,
                               ClockPort clock,
                               String root) {
        this.remoteFiles = remoteFiles;
        this.rateLimiter = rateLimiter;
        this.codec = codec;
        this.clock = clock;
        this.root = root;
    }

    @Override
    @Retry(maxRetries = 3, delay = 500, jitter = 200,
            retryOn = RemoteNetworkException.class)
    @ExponentialBackoff(factor = 2, maxDelay = 10_000)
    public void initializeStructure() {
        log.info("블로그 폴더 구조를 초기화합니다.");
        for (String folder : requiredFolders()) {
            try {
                limited(() -> remoteFiles.listFolder(folder));
                log.debugf("폴더가 이미 존재합니다: %s", folder);
            } catch (RemoteNotFoundException e) {
                log.infof("폴더 생성: %s", folder);
                try {
                    limited(() -> remoteFiles.createFolder(folder));
                } catch (RemoteConflictException conflict) {
                    log.debugf("다른 호출자가 먼저 폴더를 만들었습니다: %s", folder);
                }
            }
        }
        log.info("블로그 폴더 구조 초기화 완료");
    }

    @Override
    @Retry(maxRetries = 3, delay = 500, jitter = 200,
            retryOn = RemoteNetworkException.class)
    @ExponentialBackoff(factor = 2, maxDelay = 10_000)
    public List<StoredPost> listPublishedPosts() {
        return publishedPosts();
    }

    @Override
    @Retry(maxRetries = 3, delay = 500, jitter = 200,
            retryOn = RemoteNetworkException.class)
    @ExponentialBackoff(factor = 2, maxDelay = 10_000)
    public List<StoredPost> listDraftPosts() {
        return draftPosts();
    }

    @Override
    @Retry(maxRetries = 3, delay = 500, jitter = 200,
            retryOn = RemoteNetworkException.class)
    @ExponentialBackoff(factor = 2, maxDelay = 10_000)
    public Optional<StoredPost> getPostBySlug(String slug) {
        log.debugf("slug 조회: %s", slug);
        Optional<StoredPost> published = findBySlug(publishedPosts(), slug);
        if (published.isPresent()) {
            return published;
        }
        return findBySlug(draftPosts(), slug);
    }

    @Override
    @Retry(maxRetries = 3, delay = 500, jitter = 200,
            retryOn = RemoteNetworkException.class)
    @ExponentialBackoff(factor = 2, maxDelay = 10_000)
    public StoredPost savePost(StoredPost post, boolean draft) {
        BlogFolder opposite = draft ? BlogFolder.POSTS : BlogFolder.DRAFTS;
        if (findBySlug(loadFolder(opposite), post.slug()).isPresent()) {
            String transition = draft ? "unpublishPost" : "publishPost";
            throw new InvalidRequestException("slug '" + post.slug() + "' 는 이미 " + opposite.folderName()
                    + " 폴더에 있습니다. 폴더 이동은 " + transition + " 를 사용하세요.");
        }
        return write(post, draft);
    }

    @Override
    @Retry(maxRetries = 3, delay = 500, jitter = 200,
            retryOn = RemoteNetworkException.class)
    @ExponentialBackoff(factor = 2, maxDelay = 10_000)
    public boolean deletePost(String slug) {
        for (BlogFolder folder : List.of(BlogFolder.POSTS, BlogFolder.DRAFTS)) {
            String path = slugPath(folder, slug);
            if (deleteIfPresent(path)) {
                log.infof("글 삭제: %s", path);
                return true;
            }
        }
        log.warnf("삭제할 글이 없습니다: %s", slug);
        return false;
    }

    /**
     * 초안 폴더에서 글을 찾아 공개 폴더에 쓰고 초안 파일을 지운다. 원자적이지 않다.
     * 쓰기와 삭제 사이에 중단되면 같은 slug 가 두 폴더에 남지만, 다시 호출하면 덮어쓰기 후 초안 삭제로 이어서 완료된다.
     */
    @Override
    @Retry(maxRetries = 3, delay = 500, jitter = 200,
            retryOn = RemoteNetworkException.class)
    @ExponentialBackoff(factor = 2, maxDelay = 10_000)
    public boolean publishPost(String slug) {
        return move(slug, BlogFolder.DRAFTS, BlogFolder.POSTS, true);
    }

    @Override
    @Retry(maxRetries = 3, delay = 500, jitter = 200,
            retryOn = RemoteNetworkException.class)
    @ExponentialBackoff(factor = 2, maxDelay = 10_000)
    public boolean unpublishPost(String slug) {
        return move(slug, BlogFolder.POSTS, BlogFolder.DRAFTS, false);
    }

    @Override
    @Retry(maxRetries = 3, delay = 500, jitter = 200,
            retryOn = RemoteNetworkException.class)
    @ExponentialBackoff(factor = 2, maxDelay = 10_000)
    public BlogStats collectStats() {
        List<StoredPost> published = publishedPosts();
        List<StoredPost> drafts = draftPosts();
        Map<String, Long> categories = new HashMap<>();
        Map<String, Long> tags = new HashMap<>();
        for (StoredPost post : published) {
            if (post.metadata().category() != null) {
                categories.merge(post.metadata().category(), 1L, Long::sum);
            }
            post.metadata().tags().forEach(tag -> tags.merge(tag, 1L, Long::sum));
        }
        return new BlogStats(published.size() + drafts.size(), published.size(), drafts.size(), 0,
                categories, tags);
    }

    private List<StoredPost> publishedPosts() {
        List<StoredPost> posts = loadFolder(BlogFolder.POSTS).stream()
                .filter(post -> {
                    if (!post.metadata().published()) {
                        log.debugf("비공개 글을 건너뜁니다: %s", post.remotePath());
                        return false;
                    }
                    return true;
                })
                .sorted(Comparator.comparing((StoredPost post) -> post.metadata().createdAt()).reversed()
                        .thenComparing(StoredPost::slug))
                .toList();
        log.infof("공개 글 %d건", posts.size());
        return posts;
    }

    private List<StoredPost> draftPosts() {
        List<StoredPost> drafts = loadFolder(BlogFolder.DRAFTS).stream()
                .sorted(Comparator.comparing((StoredPost post) -> post.metadata().updatedAt()).reversed()
                        .thenComparing(StoredPost::slug))
                .toList();
        log.infof("초안 %d건", drafts.size());
        return drafts;
    }

    private StoredPost write(StoredPost post, boolean draft) {
        String path = slugPath(draft ? BlogFolder.DRAFTS : BlogFolder.POSTS, post.slug());
        byte[] content = codec.render(post.metadata(), post.body()).getBytes(StandardCharsets.UTF_8);
        log.infof("글 저장 '%s' → %s", post.metadata().title(), path);
        limited(() -> remoteFiles.uploadFile(path, content));
        return post.withRemotePath(path);
    }

    private boolean move(String slug, BlogFolder from, BlogFolder to, boolean publish) {
        List<StoredPost> candidates = from == BlogFolder.DRAFTS ? draftPosts() : publishedPosts();
        Optional<StoredPost> source = findBySlug(candidates, slug);
        if (source.isEmpty()) {
            log.warnf("%s 폴더에 글이 없어 이동할 수 없습니다: %s", from.folderName(), slug);
            return false;
        }
        StoredPost post = source.get();
        PostMetadata updated = post.metadata()
                .withPublished(publish, clock.now().withOffsetSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.SECONDS));
        StoredPost written = write(post.withMetadata(updated), to == BlogFolder.DRAFTS);
        if (!written.remotePath().equalsIgnoreCase(post.remotePath())) {
            deleteIfPresent(post.remotePath());
        }
        log.infof("글 이동 완료 %s: %s → %s", slug, from.folderName(), to.folderName());
        return true;
    }

    private List<StoredPost> loadFolder(BlogFolder folder) {
        String path = folder.pathUnder(root);
        List<RemoteEntry> entries = new ArrayList<>();
        FolderPage page;
        try {
            page = limited(() -> remoteFiles.listFolder(path));
        } catch (RemoteNotFoundException e) {
            log.warnf("폴더가 없어 빈 목록으로 처리합니다: %s", path);
            return List.of();
        }
        entries.addAll(page.entries());
        while (page.hasMore()) {
            String cursor = page.cursor();
            page = limited(() -> remoteFiles.listFolderContinue(cursor));
            entries.addAll(page.entries());
        }

        List<StoredPost> posts = new ArrayList<>();
        for (RemoteEntry entry : entries) {
            if (!entry.isMarkdown()) {
                continue;
            }
            try {
                byte[] raw = limited(() -> remoteFiles.downloadFile(entry.path()));
                codec.decode(new String(raw, StandardCharsets.UTF_8), entry.name(), entry.path())
                        .ifPresentOrElse(posts::add,
                                () -> log.debugf("frontmatter 가 없는 파일을 건너뜁니다: %s", entry.name()));
            } catch (FrontmatterParseException | RemoteNotFoundException e) {
                log.warnf("글을 읽지 못해 건너뜁니다 %s: %s", entry.name(), e.getMessage());
            }
        }
        return posts;
    }

    private boolean deleteIfPresent(String path) {
        try {
            limited(() -> remoteFiles.deleteFile(path));
            return true;
        } catch (RemoteNotFoundException e) {
            return false;
        }
    }

    private <T> T limited(Supplier<T> call) {
        rateLimiter.acquire();
        return call.get();
    }

    private List<String> requiredFolders() {
        List<String> folders = new ArrayList<>();
        for (BlogFolder folder : BlogFolder.values()) {
            folders.add(folder.pathUnder(root));
        }
        for (String sub : MEDIA_SUBFOLDERS) {
            folders.add(BlogFolder.MEDIA.filePath(root, sub));
        }
        return folders;
    }

    private String slugPath(BlogFolder folder, String slug) {
        return folder.filePath(root, slug + ".md");
    }

    private static Optional<StoredPost> findBySlug(List<StoredPost> posts, String slug) {
        return posts.stream().filter(post -> post.slug().equals(slug)).findFirst();
    }
}
