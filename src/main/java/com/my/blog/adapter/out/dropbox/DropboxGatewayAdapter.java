package com.my.blog.adapter.out.dropbox;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.my.blog.config.AppConfig;
import com.my.blog.domain.exception.RemoteAuthException;
import com.my.blog.domain.exception.RemoteConflictException;
import com.my.blog.domain.exception.RemoteNetworkException;
import com.my.blog.domain.exception.RemoteNotFoundException;
import com.my.blog.domain.exception.RemoteQuotaException;
import com.my.blog.domain.exception.RemoteStoreException;
import com.my.blog.domain.model.AccountInfo;
import com.my.blog.domain.model.FolderPage;
import com.my.blog.domain.model.RemoteEntry;
import com.my.blog.domain.port.out.RemoteFilePort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * 왜: Dropbox HTTP API 호출을 캡슐화해 RemoteFilePort 구현을 전송 세부사항과 분리하기 위함.
 * <p>
 * RPC 엔드포인트는 JSON 본문을, 콘텐츠 엔드포인트는 {@code Dropbox-API-Arg} 헤더를 사용한다.
 * 이 클래스는 재시도하지 않는다.
 */
@ApplicationScoped
public class DropboxGatewayAdapter implements RemoteFilePort {

    private static final Logger log = Logger.getLogger(DropboxGatewayAdapter.class);

    static final String API_ARG_HEADER = "Dropbox-API-Arg";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ObjectWriter headerWriter;
    private final String apiBase;
    private final String contentBase;
    private final Optional<String> accessToken;
    private final Duration requestTimeout;

    @Inject
    public DropboxGatewayAdapter(AppConfig appConfig, ObjectMapper objectMapper) {
        this(appConfig.dropbox(), objectMapper);
    }

    public DropboxGatewayAdapter(AppConfig.DropboxConfig dropboxConfig, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        // HTTP 헤더는 ASCII 만 허용된다
        this.headerWriter = objectMapper.writer().with(JsonWriteFeature.ESCAPE_NON_ASCII);
        this.apiBase = stripTrailingSlash(dropboxConfig.apiBaseUrl());
        this.contentBase = stripTrailingSlash(dropboxConfig.contentBaseUrl());
        this.accessToken = dropboxConfig.accessToken().filter(token -> !token.isBlank());
        this.requestTimeout = Duration.ofSeconds(dropboxConfig.requestTimeoutSeconds());
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(dropboxConfig.connectTimeoutSeconds()))
                .build();
    }

    @Override
    public AccountInfo testConnection() {
        String operation = "get_current_account";
        HttpResponse<String> response = send(operation, "", rpcRequest("/2/users/get_current_account", operation, "")
                .POST(HttpRequest.BodyPublishers.noBody())
                .build());
        AccountResponse account = read(response.body(), AccountResponse.class, operation, "");
        String displayName = account.name() == null ? null : account.name().displayName();
        return new AccountInfo(account.accountId(), account.email(), displayName);
    }

    @Override
    public FolderPage listFolder(String path) {
        String operation = "list_folder";
        String body = json(new ListFolderRequest(path, false, false, false), operation, path);
        HttpResponse<String> response = send(operation, path, rpcRequest("/2/files/list_folder", operation, path)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build());
        return toFolderPage(read(response.body(), ListFolderResponse.class, operation, path));
    }

    @Override
    public FolderPage listFolderContinue(String cursor) {
        String operation = "list_folder/continue";
        String body = json(Map.of("cursor", cursor), operation, cursor);
        HttpResponse<String> response = send(operation, cursor, rpcRequest("/2/files/list_folder/continue", operation, cursor)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build());
        return toFolderPage(read(response.body(), ListFolderResponse.class, operation, cursor));
    }

    @Override
    public byte[] downloadFile(String path) {
        String operation = "download";
        HttpRequest request = contentRequest("/2/files/download", operation, path, Map.of("path", path))
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();
        return sendForBytes(operation, path, request);
    }

    @Override
    public RemoteEntry uploadFile(String path, byte[] content) {
        String operation = "upload";
        Map<String, Object> args = Map.of("path", path, "mode", "overwrite", "autorename", false);
        HttpRequest request = contentRequest("/2/files/upload", operation, path, args)
                .header("Content-Type", "application/octet-stream")
                .POST(HttpRequest.BodyPublishers.ofByteArray(content))
                .build();
        String body = new String(sendForBytes(operation, path, request), StandardCharsets.UTF_8);
        return toEntry(read(body, EntryResponse.class, operation, path));
    }

    @Override
    public RemoteEntry deleteFile(String path) {
        String operation = "delete_v2";
        String body = json(Map.of("path", path), operation, path);
        HttpResponse<String> response = send(operation, path, rpcRequest("/2/files/delete_v2", operation, path)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build());
        return toEntry(read(response.body(), MetadataEnvelope.class, operation, path).metadata());
    }

    @Override
    public RemoteEntry createFolder(String path) {
        String operation = "create_folder_v2";
        String body = json(Map.of("path", path, "autorename", false), operation, path);
        HttpResponse<String> response = send(operation, path, rpcRequest("/2/files/create_folder_v2", operation, path)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build());
        return toEntry(read(response.body(), MetadataEnvelope.class, operation, path).metadata());
    }

    private HttpRequest.Builder rpcRequest(String endpoint, String operation, String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(apiBase + endpoint))
                .timeout(requestTimeout)
                .header("Authorization", bearer(operation, path));
    }

    private HttpRequest.Builder contentRequest(String endpoint, String operation, String path, Map<String, Object> args) {
        String apiArg;
        try {
            apiArg = headerWriter.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Dropbox-API-Arg 직렬화 실패: " + path, e);
        }
        return HttpRequest.newBuilder()
                .uri(URI.create(contentBase + endpoint))
                .timeout(requestTimeout)
                .header("Authorization", bearer(operation, path))
                .header(API_ARG_HEADER, apiArg);
    }

    private String bearer(String operation, String path) {
        return "Bearer " + accessToken.orElseThrow(
                () -> new RemoteAuthException(operation, path, "Dropbox 액세스 토큰이 설정되지 않았습니다."));
    }

    private HttpResponse<String> send(String operation, String path, HttpRequest request) {
        HttpResponse<String> response = execute(operation, path, request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() >= 300) {
            throw translate(operation, path, response.statusCode(), response.body());
        }
        return response;
    }

    private byte[] sendForBytes(String operation, String path, HttpRequest request) {
        HttpResponse<byte[]> response = execute(operation, path, request, HttpResponse.BodyHandlers.ofByteArray());
        if (response.statusCode() >= 300) {
            throw translate(operation, path, response.statusCode(), new String(response.body(), StandardCharsets.UTF_8));
        }
        return response.body();
    }

    private <T> HttpResponse<T> execute(String operation, String path, HttpRequest request,
                                        HttpResponse.BodyHandler<T> handler) {
        try {
            return httpClient.send(request, handler);
        } catch (IOException e) {
            throw new RemoteNetworkException(operation, path, "전송 실패: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException(operation + " 요청이 인터럽트되었습니다: " + path);
        }
    }

    /**
     * 401 → 인증, 409 는 error_summary 로 구분(not_found, conflict, insufficient_space),
     * 429/507 → 쿼터, 나머지는 네트워크 오류로 본다.
     */
    RemoteStoreException translate(String operation, String path, int status, String body) {
        String summary = errorSummary(body);
        String message = "status=" + status + " " + summary;
        log.debugf("Dropbox %s 실패 path=%s %s", operation, path, message);
        if (status == 401) {
            return new RemoteAuthException(operation, path, message);
        }
        if (status == 429 || status == 507) {
            return new RemoteQuotaException(operation, path, message);
        }
        if (status == 409) {
            if (summary.contains("not_found")) {
                return new RemoteNotFoundException(operation, path, message);
            }
            if (summary.contains("insufficient_space")) {
                return new RemoteQuotaException(operation, path, message);
            }
            if (summary.contains("conflict")) {
                return new RemoteConflictException(operation, path, message);
            }
        }
        return new RemoteNetworkException(operation, path, message);
    }

    private String errorSummary(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            ErrorResponse error = objectMapper.readValue(body, ErrorResponse.class);
            return error.errorSummary() == null ? body : error.errorSummary();
        } catch (JsonProcessingException e) {
            return body;
        }
    }

    private String json(Object value, String operation, String path) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(operation + " 요청 직렬화 실패: " + path, e);
        }
    }

    private <T> T read(String body, Class<T> type, String operation, String path) {
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new RemoteNetworkException(operation, path, "응답 파싱 실패: " + e.getOriginalMessage(), e);
        }
    }

    private FolderPage toFolderPage(ListFolderResponse response) {
        List<RemoteEntry> entries = Optional.ofNullable(response.entries())
                .orElse(List.of())
                .stream()
                .map(this::toEntry)
                .toList();
        return new FolderPage(entries, response.cursor(), response.hasMore());
    }

    private RemoteEntry toEntry(EntryResponse entry) {
        return new RemoteEntry(entry.name(), entry.pathLower(), entry.pathDisplay(), entry.size(),
                entry.contentHash(), entry.clientModified(), entry.serverModified());
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private record ListFolderRequest(@JsonProperty("path") String path,
                                     @JsonProperty("recursive") boolean recursive,
                                     @JsonProperty("include_media_info") boolean includeMediaInfo,
                                     @JsonProperty("include_deleted") boolean includeDeleted) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ListFolderResponse(@JsonProperty("entries") List<EntryResponse> entries,
                                      @JsonProperty("cursor") String cursor,
                                      @JsonProperty("has_more") boolean hasMore) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record EntryResponse(@JsonProperty("name") String name,
                                 @JsonProperty("path_lower") String pathLower,
                                 @JsonProperty("path_display") String pathDisplay,
                                 @JsonProperty("size") Long size,
                                 @JsonProperty("content_hash") String contentHash,
                                 @JsonProperty("client_modified") String clientModified,
                                 @JsonProperty("server_modified") String serverModified) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record MetadataEnvelope(@JsonProperty("metadata") EntryResponse metadata) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record AccountResponse(@JsonProperty("account_id") String accountId,
                                   @JsonProperty("email") String email,
                                   @JsonProperty("name") AccountName name) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record AccountName(@JsonProperty("display_name") String displayName) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ErrorResponse(@JsonProperty("error_summary") String errorSummary) {
    }
}
