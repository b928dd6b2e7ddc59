package com.my.blog.adapter.out.index;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.blog.config.AppConfig;
import com.my.blog.domain.model.BlogStats;
import com.my.blog.domain.model.Post;
import com.my.blog.domain.model.PostMetadata;
import com.my.blog.domain.model.PostPage;
import com.my.blog.domain.model.PostQuery;
import com.my.blog.domain.port.out.PostIndexPort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 왜: 원격 저장소를 매번 훑지 않고 필터/페이지 조회를 하기 위해 글 사본을 파일 기반 SQLite 에 유지한다.
 * <p>
 * 태그와 extra 는 JSON 문자열 컬럼으로 저장하고, 태그 필터는 SQLite JSON1 의 {@code json_each} 로 처리한다.
 */
@IfBuildProperty(name = "app.index.backend", stringValue = "sqlite", enableIfMissing = true)
@ApplicationScoped
public class SqlitePostIndexAdapter implements PostIndexPort {

    private static final Logger log = Logger.getLogger(SqlitePostIndexAdapter.class);

    private static final String TABLE_DDL = """
            CREATE TABLE IF NOT EXISTS posts (
                slug TEXT PRIMARY KEY,
                title TEXT NOT NULL,
                body TEXT NOT NULL,
                remote_path TEXT,
                created_at TEXT NOT NULL,
                created_epoch_ms INTEGER NOT NULL,
                updated_at TEXT NOT NULL,
                category TEXT,
                tags TEXT NOT NULL,
                published INTEGER NOT NULL,
                featured INTEGER NOT NULL,
                author TEXT,
                excerpt TEXT,
                extra TEXT NOT NULL
            )
            """;
    private static final String CREATED_INDEX_DDL =
            "CREATE INDEX IF NOT EXISTS idx_posts_created ON posts(created_epoch_ms DESC, slug)";
    private static final String CATEGORY_INDEX_DDL =
            "CREATE INDEX IF NOT EXISTS idx_posts_category ON posts(category)";
    private static final String ENABLE_WAL = "PRAGMA journal_mode=WAL";

    private static final String COLUMNS =
            "slug, title, body, remote_path, created_at, updated_at, category, tags, published, featured, author, excerpt, extra";
    private static final String SELECT_BY_SLUG_SQL = "SELECT " + COLUMNS + " FROM posts WHERE slug = ?";
    private static final String UPSERT_SQL = """
            INSERT INTO posts(slug, title, body, remote_path, created_at, created_epoch_ms, updated_at,
                              category, tags, published, featured, author, excerpt, extra)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(slug) DO UPDATE SET
                title = excluded.title,
                body = excluded.body,
                remote_path = excluded.remote_path,
                created_at = excluded.created_at,
                created_epoch_ms = excluded.created_epoch_ms,
                updated_at = excluded.updated_at,
                category = excluded.category,
                tags = excluded.tags,
                published = excluded.published,
                featured = excluded.featured,
                author = excluded.author,
                excerpt = excluded.excerpt,
                extra = excluded.extra
            """;
    private static final String DELETE_SQL = "DELETE FROM posts WHERE slug = ?";
    private static final String COUNTS_SQL = """
            SELECT COUNT(*),
                   COALESCE(SUM(published), 0),
                   COALESCE(SUM(featured), 0)
            FROM posts
            """;
    private static final String CATEGORY_COUNTS_SQL =
            "SELECT category, COUNT(*) FROM posts WHERE published = 1 AND category IS NOT NULL GROUP BY category";
    private static final String TAG_COUNTS_SQL = """
            SELECT t.value, COUNT(*)
            FROM posts p, json_each(p.tags) t
            WHERE p.published = 1
            GROUP BY t.value
            """;

    private static final TypeReference<List<String>> TAG_LIST = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> EXTRA_MAP = new TypeReference<>() {
    };

    private final DataSource dataSource;
    private final Path sqlitePath;
    private final ObjectMapper objectMapper;

    @Inject
    public SqlitePostIndexAdapter(DataSource dataSource, AppConfig appConfig, ObjectMapper objectMapper) {
        this(dataSource, Path.of(appConfig.index().sqlitePath()), objectMapper);
    }

    public SqlitePostIndexAdapter(DataSource dataSource, Path sqlitePath, ObjectMapper objectMapper) {
        this.dataSource = dataSource;
        this.sqlitePath = sqlitePath;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    void init() {
        try {
            Path parent = sqlitePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (Exception e) {
            throw new IllegalStateException("SQLite 경로 생성 실패", e);
        }
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(ENABLE_WAL);
            stmt.execute(TABLE_DDL);
            stmt.execute(CREATED_INDEX_DDL);
            stmt.execute(CATEGORY_INDEX_DDL);
        } catch (SQLException e) {
            throw new IllegalStateException("posts 테이블 초기화 실패", e);
        }
        log.infof("SQLite 인덱스 준비 완료: %s", sqlitePath);
    }

    @Override
    public Optional<Post> findBySlug(String slug) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_BY_SLUG_SQL)) {
            ps.setString(1, slug);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(toPost(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IllegalStateException("글 조회 실패: " + slug, e);
        }
    }

    @Override
    public PostPage find(PostQuery query) {
        List<Object> params = new ArrayList<>();
        String where = whereClause(query, params);
        long total;
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM posts" + where)) {
                bind(ps, params);
                try (ResultSet rs = ps.executeQuery()) {
                    total = rs.next() ? rs.getLong(1) : 0;
                }
            }

            StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM posts").append(where)
                    .append(" ORDER BY created_epoch_ms DESC, slug ASC");
            List<Object> pageParams = new ArrayList<>(params);
            if (query.isPaged()) {
                sql.append(" LIMIT ? OFFSET ?");
                pageParams.add(query.effectivePerPage());
                pageParams.add((long) (query.effectivePage() - 1) * query.effectivePerPage());
            }
            List<Post> posts = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
                bind(ps, pageParams);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        posts.add(toPost(rs));
                    }
                }
            }
            return new PostPage(posts, total);
        } catch (SQLException e) {
            throw new IllegalStateException("글 목록 조회 실패: " + query, e);
        }
    }

    @Override
    public BlogStats stats() {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            long total;
            long published;
            long featured;
            try (ResultSet rs = stmt.executeQuery(COUNTS_SQL)) {
                rs.next();
                total = rs.getLong(1);
                published = rs.getLong(2);
                featured = rs.getLong(3);
            }
            Map<String, Long> categories = new HashMap<>();
            try (ResultSet rs = stmt.executeQuery(CATEGORY_COUNTS_SQL)) {
                while (rs.next()) {
                    categories.put(rs.getString(1), rs.getLong(2));
                }
            }
            Map<String, Long> tags = new HashMap<>();
            try (ResultSet rs = stmt.executeQuery(TAG_COUNTS_SQL)) {
                while (rs.next()) {
                    tags.put(rs.getString(1), rs.getLong(2));
                }
            }
            return new BlogStats(total, published, total - published, featured, categories, tags);
        } catch (SQLException e) {
            throw new IllegalStateException("통계 조회 실패", e);
        }
    }

    @Override
    public Post upsert(Post post) {
        PostMetadata metadata = post.metadata();
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {
            ps.setString(1, metadata.slug());
            ps.setString(2, metadata.title());
            ps.setString(3, post.body());
            ps.setString(4, post.remotePath());
            ps.setString(5, format(metadata.createdAt()));
            ps.setLong(6, metadata.createdAt().toInstant().toEpochMilli());
            ps.setString(7, format(metadata.updatedAt()));
            ps.setString(8, metadata.category());
            ps.setString(9, toJson(new ArrayList<>(metadata.tags())));
            ps.setInt(10, metadata.published() ? 1 : 0);
            ps.setInt(11, post.featured() ? 1 : 0);
            ps.setString(12, metadata.author());
            ps.setString(13, metadata.excerpt());
            ps.setString(14, toJson(metadata.extra()));
            ps.executeUpdate();
            log.debugf("인덱스 upsert: %s", metadata.slug());
            return post;
        } catch (SQLException e) {
            throw new IllegalStateException("글 저장 실패: " + metadata.slug(), e);
        }
    }

    @Override
    public boolean deleteBySlug(String slug) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(DELETE_SQL)) {
            ps.setString(1, slug);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IllegalStateException("글 삭제 실패: " + slug, e);
        }
    }

    private static String whereClause(PostQuery query, List<Object> params) {
        List<String> conditions = new ArrayList<>();
        if (query.category() != null) {
            conditions.add("category = ?");
            params.add(query.category());
        }
        if (query.tag() != null) {
            conditions.add("EXISTS (SELECT 1 FROM json_each(posts.tags) WHERE json_each.value = ?)");
            params.add(query.tag());
        }
        if (query.published() != null) {
            conditions.add("published = ?");
            params.add(query.published() ? 1 : 0);
        }
        if (query.featured() != null) {
            conditions.add("featured = ?");
            params.add(query.featured() ? 1 : 0);
        }
        return conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
    }

    private static void bind(PreparedStatement ps, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            ps.setObject(i + 1, params.get(i));
        }
    }

    private Post toPost(ResultSet rs) throws SQLException {
        Set<String> tags = new LinkedHashSet<>(fromJson(rs.getString("tags"), TAG_LIST));
        PostMetadata metadata = new PostMetadata(
                rs.getString("title"),
                rs.getString("slug"),
                OffsetDateTime.parse(rs.getString("created_at")),
                OffsetDateTime.parse(rs.getString("updated_at")),
                rs.getString("category"),
                tags,
                rs.getInt("published") == 1,
                rs.getString("author"),
                rs.getString("excerpt"),
                fromJson(rs.getString("extra"), EXTRA_MAP));
        return new Post(metadata, rs.getString("body"), rs.getString("remote_path"), rs.getInt("featured") == 1);
    }

    private static String format(OffsetDateTime time) {
        return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(time.withOffsetSameInstant(ZoneOffset.UTC));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON 직렬화 실패", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON 역직렬화 실패: " + json, e);
        }
    }
}
