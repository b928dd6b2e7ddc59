package com.my.blog.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.my.blog.domain.exception.FrontmatterParseException;
import com.my.blog.domain.model.PostMetadata;
import com.my.blog.domain.model.StoredPost;
import com.my.blog.domain.port.out.ClockPort;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 왜: 마크다운 문서를 (메타데이터, 본문)으로 나누고 다시 합치는 규칙을 I/O 없이 한 곳에 고정하기 위함.
 * <p>
 * 문서 형식: 첫 줄 {@code ---}, YAML 매핑, 닫는 줄 {@code ---}, 빈 줄, 본문.
 */
public class FrontmatterCodec {

    public static final String DELIMITER = "---";

    private static final String TITLE = "title";
    private static final String SLUG = "slug";
    private static final String CREATED_AT = "created_at";
    private static final String UPDATED_AT = "updated_at";
    private static final String CATEGORY = "category";
    private static final String TAGS = "tags";
    private static final String PUBLISHED = "published";
    private static final String AUTHOR = "author";
    private static final String EXCERPT = "excerpt";
    private static final Set<String> KNOWN_KEYS =
            Set.of(TITLE, SLUG, CREATED_AT, UPDATED_AT, CATEGORY, TAGS, PUBLISHED, AUTHOR, EXCERPT);

    private final YAMLMapper yaml;
    private final ClockPort clock;

    public FrontmatterCodec(ClockPort clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.yaml = new YAMLMapper(YAMLFactory.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .build());
    }

    /**
     * frontmatter 블록과 본문을 분리한다. 닫는 구분자가 없으면 문서 전체를 본문으로 본다.
     */
    public Split split(String document) {
        Objects.requireNonNull(document, "document");
        if (!document.startsWith(DELIMITER)) {
            return Split.bodyOnly(document);
        }
        int firstLineEnd = document.indexOf('\n');
        if (firstLineEnd < 0) {
            return Split.bodyOnly(document);
        }
        int blockStart = firstLineEnd + 1;
        int lineStart = blockStart;
        while (lineStart <= document.length()) {
            int lineEnd = document.indexOf('\n', lineStart);
            int contentEnd = lineEnd < 0 ? document.length() : lineEnd;
            if (isDelimiterLine(document.substring(lineStart, contentEnd))) {
                String block = lineStart == blockStart ? "" : document.substring(blockStart, lineStart - 1);
                String rest = lineEnd < 0 ? "" : document.substring(lineEnd + 1);
                return new Split(Optional.of(stripCarriageReturns(block)), dropOneBlankLine(rest));
            }
            if (lineEnd < 0) {
                break;
            }
            lineStart = lineEnd + 1;
        }
        return Split.bodyOnly(document);
    }

    /**
     * YAML 블록을 메타데이터로 해석한다. 누락 필드는 기본값으로 채우고, 알 수 없는 키는 extra 로 보존한다.
     *
     * @throws FrontmatterParseException YAML 구문 오류, 매핑이 아닌 블록, slug 를 만들 수 없는 경우
     */
    public PostMetadata parseMetadata(String block, String fallbackTitle) {
        JsonNode root = readBlock(block);

        String title = text(root.get(TITLE)).orElse(fallbackTitle == null ? "" : fallbackTitle);
        String slug = text(root.get(SLUG))
                .map(explicit -> PostMetadata.isUrlSafe(explicit) ? explicit : slugify(explicit))
                .filter(candidate -> !candidate.isEmpty())
                .orElseGet(() -> slugify(title));
        if (slug.isEmpty()) {
            throw new FrontmatterParseException("제목에서 slug 를 만들 수 없습니다: '" + title + "'");
        }

        OffsetDateTime createdAt = timestamp(root.get(CREATED_AT))
                .orElseGet(() -> clock.now().withOffsetSameInstant(ZoneOffset.UTC));
        OffsetDateTime updatedAt = timestamp(root.get(UPDATED_AT)).orElse(createdAt);

        Set<String> tags = new LinkedHashSet<>();
        JsonNode tagNode = root.get(TAGS);
        if (tagNode != null && tagNode.isArray()) {
            tagNode.forEach(tag -> text(tag).ifPresent(tags::add));
        }

        boolean published = flag(root.get(PUBLISHED)).orElse(true);

        Map<String, Object> extra = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!KNOWN_KEYS.contains(field.getKey())) {
                extra.put(field.getKey(), yaml.convertValue(field.getValue(), Object.class));
            }
        }

        return new PostMetadata(title, slug, createdAt, updatedAt,
                text(root.get(CATEGORY)).orElse(null),
                tags,
                published,
                text(root.get(AUTHOR)).orElse(null),
                text(root.get(EXCERPT)).orElse(null),
                extra);
    }

    /** {@code ---\n<yaml>\n---\n\n<body>} 형태로 직렬화한다. */
    public String render(PostMetadata metadata, String body) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(TITLE, metadata.title());
        fields.put(SLUG, metadata.slug());
        fields.put(CREATED_AT, DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(metadata.createdAt()));
        fields.put(UPDATED_AT, DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(metadata.updatedAt()));
        if (metadata.category() != null) {
            fields.put(CATEGORY, metadata.category());
        }
        fields.put(TAGS, new ArrayList<>(metadata.tags()));
        fields.put(PUBLISHED, metadata.published());
        if (metadata.author() != null) {
            fields.put(AUTHOR, metadata.author());
        }
        if (metadata.excerpt() != null) {
            fields.put(EXCERPT, metadata.excerpt());
        }
        metadata.extra().forEach((key, value) -> {
            if (!KNOWN_KEYS.contains(key)) {
                fields.put(key, value);
            }
        });
        try {
            String block = yaml.writeValueAsString(fields).strip();
            return DELIMITER + "\n" + block + "\n" + DELIMITER + "\n\n" + (body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("frontmatter 직렬화 실패: " + metadata.slug(), e);
        }
    }

    /**
     * 파일 하나를 글로 복원한다. frontmatter 가 없는 문서는 글로 보지 않는다.
     */
    public Optional<StoredPost> decode(String document, String fileName, String remotePath) {
        Split split = split(document);
        if (split.frontmatter().isEmpty()) {
            return Optional.empty();
        }
        PostMetadata metadata = parseMetadata(split.frontmatter().get(), titleFromFileName(fileName));
        return Optional.of(new StoredPost(metadata, split.body(), remotePath));
    }

    /** 소문자로 바꾸고 [a-z0-9] 가 아닌 연속 문자를 하이픈 하나로 치환한 뒤 양끝 하이픈을 제거한다. */
    public static String slugify(String title) {
        if (title == null) {
            return "";
        }
        String slug = title.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
        int start = 0;
        int end = slug.length();
        while (start < end && slug.charAt(start) == '-') {
            start++;
        }
        while (end > start && slug.charAt(end - 1) == '-') {
            end--;
        }
        return slug.substring(start, end);
    }

    static String titleFromFileName(String fileName) {
        if (fileName == null) {
            return "";
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".markdown")) {
            return fileName.substring(0, fileName.length() - ".markdown".length());
        }
        if (lower.endsWith(".md")) {
            return fileName.substring(0, fileName.length() - ".md".length());
        }
        return fileName;
    }

    private JsonNode readBlock(String block) {
        if (block == null || block.isBlank()) {
            return yaml.createObjectNode();
        }
        JsonNode root;
        try {
            root = yaml.readTree(block);
        } catch (JsonProcessingException e) {
            throw new FrontmatterParseException("YAML frontmatter 구문 오류: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return yaml.createObjectNode();
        }
        if (!root.isObject()) {
            throw new FrontmatterParseException("frontmatter 는 YAML 매핑이어야 합니다.");
        }
        return root;
    }

    private static boolean isDelimiterLine(String line) {
        String content = line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
        return DELIMITER.equals(content);
    }

    private static String stripCarriageReturns(String block) {
        String normalized = block.replace("\r\n", "\n");
        return normalized.endsWith("\r") ? normalized.substring(0, normalized.length() - 1) : normalized;
    }

    private static String dropOneBlankLine(String rest) {
        if (rest.startsWith("\r\n")) {
            return rest.substring(2);
        }
        if (rest.startsWith("\n")) {
            return rest.substring(1);
        }
        return rest;
    }

    private static Optional<String> text(JsonNode node) {
        if (node == null || node.isNull() || !node.isValueNode()) {
            return Optional.empty();
        }
        return Optional.of(node.asText());
    }

    private static Optional<Boolean> flag(JsonNode node) {
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (node.isBoolean()) {
            return Optional.of(node.booleanValue());
        }
        if (node.isTextual()) {
            String value = node.textValue().strip().toLowerCase(Locale.ROOT);
            if (value.equals("true") || value.equals("false")) {
                return Optional.of(Boolean.parseBoolean(value));
            }
        }
        return Optional.empty();
    }

    private static Optional<OffsetDateTime> timestamp(JsonNode node) {
        return text(node).flatMap(value -> {
            try {
                return Optional.of(OffsetDateTime.parse(value.strip()).withOffsetSameInstant(ZoneOffset.UTC));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        });
    }

    /** 분리 결과. frontmatter 가 없으면 body 는 원문 그대로다. */
    public record Split(Optional<String> frontmatter, String body) {
        static Split bodyOnly(String document) {
            return new Split(Optional.empty(), document);
        }
    }
}
