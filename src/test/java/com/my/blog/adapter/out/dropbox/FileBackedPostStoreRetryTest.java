package com.my.blog.adapter.out.dropbox;

import com.my.blog.domain.exception.RemoteAuthException;
import com.my.blog.domain.exception.RemoteConflictException;
import com.my.blog.domain.exception.RemoteNetworkException;
import com.my.blog.domain.exception.RemoteNotFoundException;
import com.my.blog.domain.exception.RemoteQuotaException;
import com.my.blog.domain.model.FolderPage;
import com.my.blog.domain.model.RemoteEntry;
import com.my.blog.domain.model.StoredPost;
import com.my.blog.domain.port.out.PostStorePort;
import com.my.blog.domain.port.out.RemoteFilePort;
import com.my.blog.domain.service.RateLimiter;
import com.my.blog.support.Posts;
import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * 컨테이너가 붙인 재시도 정책을 확인한다. 네트워크 오류만 다시 시도하고, 시도마다 호출 한도를 다시 통과한다.
 */
@QuarkusTest
class FileBackedPostStoreRetryTest {

    private static final String POSTS = "/BlogStorage/posts";
    private static final String DRAFTS = "/BlogStorage/drafts";

    @InjectMock
    RemoteFilePort remote;

    @Inject
    PostStorePort store;

    @Inject
    RateLimiter rateLimiter;

    @Test
    void networkErrorIsRetriedAndEachAttemptPassesTheLimiter() {
        when(remote.listFolder(POSTS))
                .thenThrow(new RemoteNetworkException("list_folder", POSTS, "status=503"))
                .thenThrow(new RemoteNetworkException("list_folder", POSTS, "timeout"))
                .thenReturn(new FolderPage(List.of(), null, false));
        int before = rateLimiter.inFlightWindowSize();

        assertThat(store.listPublishedPosts()).isEmpty();

        verify(remote, times(3)).listFolder(POSTS);
        assertThat(rateLimiter.inFlightWindowSize() - before).isEqualTo(3);
    }

    @Test
    void retryRerunsTheWholeOperation() {
        RemoteEntry live = new RemoteEntry("live.md", POSTS.toLowerCase() + "/live.md", POSTS + "/live.md",
                10L, "hash", null, null);
        when(remote.listFolder(POSTS)).thenReturn(new FolderPage(List.of(live), null, false));
        when(remote.downloadFile(POSTS + "/live.md"))
                .thenThrow(new RemoteNetworkException("download", POSTS + "/live.md", "status=500"))
                .thenReturn(("---\ntitle: live\nslug: live\ncreated_at: 2024-01-01T00:00:00Z\n---\n\nbody")
                        .getBytes(StandardCharsets.UTF_8));

        assertThat(store.getPostBySlug("live")).isPresent();

        verify(remote, times(2)).listFolder(POSTS);
        verify(remote, times(2)).downloadFile(POSTS + "/live.md");
    }

    @Test
    void networkErrorSurfacesOnceRetriesAreExhausted() {
        when(remote.listFolder(DRAFTS)).thenThrow(new RemoteNetworkException("list_folder", DRAFTS, "status=502"));

        assertThatThrownBy(() -> store.listDraftPosts()).isInstanceOf(RemoteNetworkException.class);

        verify(remote, times(4)).listFolder(DRAFTS);
    }

    @Test
    void authErrorIsNotRetried() {
        when(remote.listFolder(POSTS)).thenThrow(new RemoteAuthException("list_folder", POSTS, "invalid_access_token"));

        assertThatThrownBy(() -> store.listPublishedPosts()).isInstanceOf(RemoteAuthException.class);

        verify(remote, times(1)).listFolder(POSTS);
    }

    @Test
    void notFoundOnUploadIsNotRetried() {
        when(remote.listFolder(DRAFTS)).thenReturn(new FolderPage(List.of(), null, false));
        when(remote.uploadFile(eq(POSTS + "/x.md"), any()))
                .thenThrow(new RemoteNotFoundException("upload", POSTS + "/x.md", "path/not_found/"));
        StoredPost post = Posts.stored("x", 0, true, "posts");

        assertThatThrownBy(() -> store.savePost(post, false)).isInstanceOf(RemoteNotFoundException.class);

        verify(remote, times(1)).uploadFile(eq(POSTS + "/x.md"), any());
    }

    @Test
    void quotaAndConflictErrorsAreNotRetried() {
        when(remote.listFolder(POSTS)).thenReturn(new FolderPage(List.of(), null, false));
        when(remote.uploadFile(eq(DRAFTS + "/x.md"), any()))
                .thenThrow(new RemoteQuotaException("upload", DRAFTS + "/x.md", "status=429"));
        when(remote.deleteFile(anyString()))
                .thenThrow(new RemoteConflictException("delete_v2", POSTS + "/x.md", "path_lookup/conflict/"));

        assertThatThrownBy(() -> store.savePost(Posts.stored("x", 0, false, "drafts"), true))
                .isInstanceOf(RemoteQuotaException.class);
        assertThatThrownBy(() -> store.deletePost("x")).isInstanceOf(RemoteConflictException.class);

        verify(remote, times(1)).uploadFile(eq(DRAFTS + "/x.md"), any());
        verify(remote, times(1)).deleteFile(POSTS + "/x.md");
        verify(remote, never()).deleteFile(DRAFTS + "/x.md");
    }
}
