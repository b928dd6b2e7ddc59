package com.my.blog.domain.service;

import com.my.blog.domain.exception.FrontmatterParseException;
import com.my.blog.domain.model.PostMetadata;
import com.my.blog.domain.model.StoredPost;
import com.my.blog.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.my.blog.support.Posts.BASE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrontmatterCodecTest {

    private final MutableClock clock = new MutableClock(BASE);
    private final FrontmatterCodec codec = new FrontmatterCodec(clock);

    @Test
    void splitsFrontmatterAndDropsOneBlankLine() {
        FrontmatterCodec.Split split = codec.split("---\ntitle: Hi\n---\n\nBody\n");

        assertThat(split.frontmatter()).contains("title: Hi");
        assertThat(split.body()).isEqualTo("Body\n");
    }

    @Test
    void keepsBodyByteIdenticalAfterTheBlankLine() {
        FrontmatterCodec.Split split = codec.split("---\ntitle: Hi\n---\n\n\n  indented\n---\ntrailing");

        assertThat(split.body()).isEqualTo("\n  indented\n---\ntrailing");
    }

    @Test
    void treatsDocumentWithoutFrontmatterAsBody() {
        assertThat(codec.split("# Just markdown\n").frontmatter()).isEmpty();
        assertThat(codec.split("# Just markdown\n").body()).isEqualTo("# Just markdown\n");

        String unterminated = "---\ntitle: Hi\nno closing delimiter";
        assertThat(codec.split(unterminated).frontmatter()).isEmpty();
        assertThat(codec.split(unterminated).body()).isEqualTo(unterminated);
    }

    @Test
    void acceptsWindowsLineEndingsOnDelimiters() {
        FrontmatterCodec.Split split = codec.split("---\r\ntitle: Hi\r\n---\r\n\r\nBody");

        assertThat(split.frontmatter()).contains("title: Hi");
        assertThat(split.body()).isEqualTo("Body");
    }

    @Test
    void emptyBlockIsAnEmptyMapping() {
        FrontmatterCodec.Split split = codec.split("---\n---\nBody");

        assertThat(split.frontmatter()).contains("");
        PostMetadata metadata = codec.parseMetadata(split.frontmatter().get(), "Fallback Title");
        assertThat(metadata.title()).isEqualTo("Fallback Title");
        assertThat(metadata.slug()).isEqualTo("fallback-title");
    }

    @Test
    void fillsDefaultsForMissingFields() {
        PostMetadata metadata = codec.parseMetadata("title: Hello World", "ignored");

        assertThat(metadata.slug()).isEqualTo("hello-world");
        assertThat(metadata.createdAt()).isEqualTo(BASE);
        assertThat(metadata.updatedAt()).isEqualTo(metadata.createdAt());
        assertThat(metadata.tags()).isEmpty();
        assertThat(metadata.published()).isTrue();
        assertThat(metadata.category()).isNull();
        assertThat(metadata.extra()).isEmpty();
    }

    @Test
    void parsesAllKnownFieldsAndNormalisesTimestampsToUtc() {
        String block = """
                title: "Rust Tips"
                slug: rust-tips
                created_at: 2024-03-01T09:00:00+09:00
                updated_at: "2024-03-02T10:30:00Z"
                category: tech
                tags: [rust, perf]
                published: false
                author: kim
                excerpt: short
                """;

        PostMetadata metadata = codec.parseMetadata(block, "fallback");

        assertThat(metadata.title()).isEqualTo("Rust Tips");
        assertThat(metadata.slug()).isEqualTo("rust-tips");
        assertThat(metadata.createdAt()).isEqualTo(OffsetDateTime.of(2024, 3, 1, 0, 0, 0, 0, ZoneOffset.UTC));
        assertThat(metadata.updatedAt()).isEqualTo(OffsetDateTime.of(2024, 3, 2, 10, 30, 0, 0, ZoneOffset.UTC));
        assertThat(metadata.category()).isEqualTo("tech");
        assertThat(metadata.tags()).containsExactlyInAnyOrder("rust", "perf");
        assertThat(metadata.published()).isFalse();
        assertThat(metadata.author()).isEqualTo("kim");
        assertThat(metadata.excerpt()).isEqualTo("short");
    }

    @Test
    void slugifiesExplicitSlugThatIsNotUrlSafe() {
        PostMetadata metadata = codec.parseMetadata("title: x\nslug: My Slug!", "fallback");

        assertThat(metadata.slug()).isEqualTo("my-slug");
    }

    @Test
    void keepsUnknownKeysInExtraAndRendersThemBack() {
        PostMetadata metadata = codec.parseMetadata("title: Hi\nseries: intro\nweight: 3", "fallback");

        assertThat(metadata.extra()).containsEntry("series", "intro").containsEntry("weight", 3);
        String rendered = codec.render(metadata, "Body");
        assertThat(rendered).contains("series: \"intro\"").contains("weight: 3");
    }

    @Test
    void slugifyCollapsesNonAlphanumericRuns() {
        assertThat(FrontmatterCodec.slugify("Hello, World! 2024")).isEqualTo("hello-world-2024");
        assertThat(FrontmatterCodec.slugify("Hello World")).isEqualTo("hello-world");
        assertThat(FrontmatterCodec.slugify("Special Characters @#$%")).isEqualTo("special-characters");
        assertThat(FrontmatterCodec.slugify("  --Trim--  ")).isEqualTo("trim");
        assertThat(FrontmatterCodec.slugify("한글")).isEmpty();
    }

    @Test
    void rendersInExpectedLayoutAndRoundTrips() {
        PostMetadata metadata = new PostMetadata("Hello: World", "hello-world",
                OffsetDateTime.of(2024, 5, 1, 12, 0, 0, 0, ZoneOffset.UTC),
                OffsetDateTime.of(2024, 5, 2, 12, 0, 0, 0, ZoneOffset.UTC),
                "life", Set.of("a", "b"), true, "lee", null, Map.of("series", List.of("x", "y")));
        String body = "First line\n\n- item\n";

        String document = codec.render(metadata, body);

        assertThat(document).startsWith("---\n").contains("\n---\n\nFirst line");
        FrontmatterCodec.Split split = codec.split(document);
        assertThat(split.body()).isEqualTo(body);
        assertThat(codec.parseMetadata(split.frontmatter().get(), "unused")).isEqualTo(metadata);
    }

    @Test
    void decodeUsesFileNameAsFallbackTitle() {
        Optional<StoredPost> decoded = codec.decode("---\ntags: [x]\n---\n\nText", "My First Post.md",
                "/BlogStorage/posts/My First Post.md");

        assertThat(decoded).isPresent();
        assertThat(decoded.get().metadata().title()).isEqualTo("My First Post");
        assertThat(decoded.get().slug()).isEqualTo("my-first-post");
        assertThat(decoded.get().remotePath()).isEqualTo("/BlogStorage/posts/My First Post.md");
        assertThat(codec.decode("no frontmatter", "x.md", "/x.md")).isEmpty();
    }

    @Test
    void rejectsMalformedOrNonMappingFrontmatter() {
        assertThatThrownBy(() -> codec.parseMetadata("title: [unclosed", "fallback"))
                .isInstanceOf(FrontmatterParseException.class);
        assertThatThrownBy(() -> codec.parseMetadata("- just\n- a list", "fallback"))
                .isInstanceOf(FrontmatterParseException.class);
    }

    @Test
    void rejectsWhenNoSlugCanBeDerived() {
        assertThatThrownBy(() -> codec.parseMetadata("title: \"!!!\"", "???"))
                .isInstanceOf(FrontmatterParseException.class)
                .hasMessageContaining("slug");
    }
}
