package com.my.blog.domain.service;

import com.my.blog.domain.exception.InvalidRequestException;
import com.my.blog.domain.exception.RemoteNetworkException;
import com.my.blog.domain.model.BlogStats;
import com.my.blog.domain.model.Post;
import com.my.blog.domain.model.PostPage;
import com.my.blog.domain.model.PostQuery;
import com.my.blog.domain.model.StoredPost;
import com.my.blog.domain.model.SyncReport;
import com.my.blog.domain.port.out.PostIndexPort;
import com.my.blog.domain.port.out.PostStorePort;
import com.my.blog.support.MutableClock;
import com.my.blog.support.Posts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.my.blog.support.Posts.BASE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class BlogContentServiceTest {

    private PostStorePort postStore;
    private PostIndexPort postIndex;
    private ContentCache cache;
    private BlogContentService service;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(BASE);
        postStore = mock(PostStorePort.class);
        postIndex = mock(PostIndexPort.class);
        cache = new ContentCache(ContentCache.Settings.defaults(), clock);
        service = new BlogContentService(postStore, postIndex, cache, clock);
        when(postIndex.upsert(any())).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void readsPostThroughCache() {
        Post post = Posts.post("hello", 0, null, Set.of(), true, false);
        when(postIndex.findBySlug("hello")).thenReturn(Optional.of(post));

        assertThat(service.getPost("hello")).contains(post);
        assertThat(service.getPost("hello")).contains(post);

        verify(postIndex, times(1)).findBySlug("hello");
        verifyNoInteractions(postStore);
        assertThat(service.cacheMetrics().hits()).isEqualTo(1);
        assertThat(service.cacheMetrics().misses()).isEqualTo(1);
    }

    @Test
    void fallsBackToRemoteStoreAndBackfillsIndex() {
        StoredPost stored = Posts.stored("remote-only", 0, true, "posts");
        when(postIndex.findBySlug("remote-only")).thenReturn(Optional.empty());
        when(postStore.getPostBySlug("remote-only")).thenReturn(Optional.of(stored));

        Optional<Post> found = service.getPost("remote-only");

        assertThat(found).isPresent();
        assertThat(found.get().remotePath()).isEqualTo(stored.remotePath());
        verify(postIndex).upsert(any());
    }

    @Test
    void missingPostIsNotCached() {
        when(postIndex.findBySlug("ghost")).thenReturn(Optional.empty());
        when(postStore.getPostBySlug("ghost")).thenReturn(Optional.empty());

        assertThat(service.getPost("ghost")).isEmpty();
        assertThat(service.getPost("ghost")).isEmpty();

        verify(postStore, times(2)).getPostBySlug("ghost");
    }

    @Test
    void cachesListsPerCanonicalQuery() {
        PostQuery query = new PostQuery("tech", null, true, null, 1, 10);
        PostPage page = new PostPage(List.of(Posts.post("a", 0, "tech", Set.of(), true, false)), 1);
        when(postIndex.find(query)).thenReturn(page);

        assertThat(service.listPosts(query)).isEqualTo(page);
        assertThat(service.listPosts(new PostQuery("tech", null, true, null, 1, 10))).isEqualTo(page);

        verify(postIndex, times(1)).find(query);
    }

    @Test
    void cachesStats() {
        BlogStats stats = new BlogStats(3, 2, 1, 0, Map.of("tech", 2L), Map.of());
        when(postIndex.stats()).thenReturn(stats);

        assertThat(service.stats()).isEqualTo(stats);
        assertThat(service.stats()).isEqualTo(stats);

        verify(postIndex, times(1)).stats();
    }

    @Test
    void saveWritesRemoteThenIndexThenInvalidates() {
        Post cachedBefore = Posts.post("hello", 0, null, Set.of(), true, false);
        when(postIndex.findBySlug("hello")).thenReturn(Optional.of(cachedBefore));
        when(postIndex.find(any())).thenReturn(new PostPage(List.of(cachedBefore), 1));
        service.getPost("hello");
        service.listPosts(PostQuery.all());
        StoredPost draft = Posts.stored("hello", 0, true, "drafts");
        when(postStore.savePost(any(), eq(true))).thenAnswer(invocation -> invocation.getArgument(0));

        Post saved = service.savePost(draft, true, true);

        InOrder order = inOrder(postStore, postIndex);
        order.verify(postStore).savePost(any(), eq(true));
        order.verify(postIndex).upsert(any());
        assertThat(saved.featured()).isTrue();
        assertThat(saved.metadata().published()).isFalse();
        assertThat(cache.occupancy().cachedPosts()).isZero();
        assertThat(cache.occupancy().cachedLists()).isZero();
    }

    @Test
    void failedMutationLeavesCacheUntouched() {
        Post cached = Posts.post("hello", 0, null, Set.of(), true, false);
        when(postIndex.findBySlug("hello")).thenReturn(Optional.of(cached));
        service.getPost("hello");
        when(postStore.deletePost("hello")).thenThrow(new RemoteNetworkException("delete_v2", "/p", "status=500"));

        assertThatThrownBy(() -> service.deletePost("hello")).isInstanceOf(RemoteNetworkException.class);

        verify(postIndex, never()).deleteBySlug("hello");
        assertThat(cache.getPost("hello")).contains(cached);
    }

    @Test
    void deleteRemovesFromRemoteAndIndex() {
        when(postStore.deletePost("old")).thenReturn(true);
        when(postIndex.deleteBySlug("old")).thenReturn(true);

        assertThat(service.deletePost("old")).isTrue();

        verify(postIndex).deleteBySlug("old");
    }

    @Test
    void publishRefreshesIndexKeepingFeaturedFlag() {
        StoredPost published = Posts.stored("launch", 0, true, "posts");
        when(postStore.publishPost("launch")).thenReturn(true);
        when(postIndex.findBySlug("launch")).thenReturn(Optional.of(Posts.post("launch", 0, null, Set.of(), false, true)));
        when(postStore.getPostBySlug("launch")).thenReturn(Optional.of(published));

        assertThat(service.publishPost("launch")).isTrue();

        ArgumentCaptor<Post> indexed = ArgumentCaptor.forClass(Post.class);
        verify(postIndex).upsert(indexed.capture());
        assertThat(indexed.getValue().featured()).isTrue();
        assertThat(indexed.getValue().metadata().published()).isTrue();
    }

    @Test
    void publishOfMissingDraftTouchesNothingElse() {
        when(postStore.publishPost("none")).thenReturn(false);

        assertThat(service.publishPost("none")).isFalse();

        verify(postIndex, never()).upsert(any());
    }

    @Test
    void unpublishMovesPostOutOfIndexPublicView() {
        StoredPost draft = Posts.stored("back", 0, false, "drafts");
        when(postStore.unpublishPost("back")).thenReturn(true);
        when(postIndex.findBySlug("back")).thenReturn(Optional.empty());
        when(postStore.getPostBySlug("back")).thenReturn(Optional.of(draft));

        assertThat(service.unpublishPost("back")).isTrue();

        ArgumentCaptor<Post> indexed = ArgumentCaptor.forClass(Post.class);
        verify(postIndex).upsert(indexed.capture());
        assertThat(indexed.getValue().metadata().published()).isFalse();
    }

    @Test
    void syncUpsertsOnlyMissingOrNewerPosts() {
        StoredPost fresh = Posts.stored("fresh", 5, true, "posts");
        StoredPost unchanged = Posts.stored("unchanged", 1, true, "posts");
        StoredPost broken = Posts.stored("broken", 2, true, "posts");
        when(postStore.listPublishedPosts()).thenReturn(List.of(fresh, unchanged, broken));
        when(postIndex.findBySlug("fresh")).thenReturn(Optional.empty());
        when(postIndex.findBySlug("unchanged")).thenReturn(Optional.of(Post.fromStored(unchanged, false)));
        when(postIndex.findBySlug("broken")).thenReturn(Optional.empty());
        when(postIndex.upsert(any())).thenAnswer(invocation -> {
            Post post = invocation.getArgument(0);
            if (post.slug().equals("broken")) {
                throw new IllegalStateException("disk full");
            }
            return post;
        });

        SyncReport report = service.syncRemoteToIndex();

        assertThat(report).isEqualTo(new SyncReport(1, 1, 1, 3));
    }

    @Test
    void listsDraftsStraightFromRemote() {
        List<StoredPost> drafts = List.of(Posts.stored("d", 0, false, "drafts"));
        when(postStore.listDraftPosts()).thenReturn(drafts);

        assertThat(service.listDrafts()).isEqualTo(drafts);
        assertThat(service.listDrafts()).isEqualTo(drafts);

        verify(postStore, times(2)).listDraftPosts();
    }

    @Test
    void rejectsBlankSlugAndNullInput() {
        assertThatThrownBy(() -> service.getPost(" ")).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> service.deletePost(null)).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> service.savePost(null, false, false)).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> service.listPosts(null)).isInstanceOf(InvalidRequestException.class);
        verify(postStore, never()).savePost(any(), anyBoolean());
    }

    @Test
    void rejectsSlugsThatAreNotUrlSafeBeforeAnyRemoteCall() {
        assertThatThrownBy(() -> service.deletePost("../config/settings"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("../config/settings");
        assertThatThrownBy(() -> service.getPost("Hello World")).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> service.publishPost("drafts/x")).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> service.unpublishPost("-x-")).isInstanceOf(InvalidRequestException.class);

        verifyNoInteractions(postStore, postIndex);
    }

    @Test
    void refusedFolderChangeOnSaveLeavesIndexAndCacheUntouched() {
        Post cached = Posts.post("hello", 0, null, Set.of(), true, false);
        when(postIndex.findBySlug("hello")).thenReturn(Optional.of(cached));
        service.getPost("hello");
        when(postStore.savePost(any(), eq(true)))
                .thenThrow(new InvalidRequestException("slug 'hello' 는 이미 posts 폴더에 있습니다."));

        assertThatThrownBy(() -> service.savePost(Posts.stored("hello", 0, true, "posts"), true, false))
                .isInstanceOf(InvalidRequestException.class);

        verify(postIndex, never()).upsert(any());
        assertThat(cache.getPost("hello")).contains(cached);
    }

    @Test
    void flushEmptiesCache() {
        when(postIndex.findBySlug("a")).thenReturn(Optional.of(Posts.post("a", 0, null, Set.of(), true, false)));
        service.getPost("a");
        assertThat(service.cacheOccupancy().cachedPosts()).isEqualTo(1);

        service.flushCache();

        assertThat(service.cacheOccupancy().cachedPosts()).isZero();
        assertThat(service.cacheOccupancy().statsCached()).isFalse();
    }
}
