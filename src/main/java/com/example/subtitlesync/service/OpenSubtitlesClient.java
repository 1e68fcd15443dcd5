package com.example.subtitlesync.service;

import com.example.subtitlesync.config.AppSettings;
import com.example.subtitlesync.model.DownloadRequest;
import com.example.subtitlesync.model.DownloadResponse;
import com.example.subtitlesync.model.LoginRequest;
import com.example.subtitlesync.model.LoginResponse;
import com.example.subtitlesync.model.SearchQuery;
import com.example.subtitlesync.model.SubtitleCandidate;
import com.example.subtitlesync.model.SubtitleSearchResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Client for the OpenSubtitles REST API.
 * Handles login, pacing, rate-limit recovery and the daily download quota so callers
 * only see results or their absence.
 */
@Service
public class OpenSubtitlesClient {

    private static final Logger log = LoggerFactory.getLogger(OpenSubtitlesClient.class);

    static final int MAX_REAUTHENTICATIONS = 1;

    private static final int OK = 200;
    private static final int UNAUTHORIZED = 401;
    private static final int NOT_ACCEPTABLE = 406;
    private static final int TOO_MANY_REQUESTS = 429;

    private final AppSettings appSettings;
    private final RestClient restClient;
    private final RequestPacer pacer;
    private final JsonMapper jsonMapper;

    private String authToken;
    private Integer remainingDownloads;
    private LoginResponse.UserInfo accountInfo;
    private boolean authenticationFailed;

    public OpenSubtitlesClient(RestClient.Builder restClientBuilder, AppSettings appSettings, RequestPacer pacer) {
        this.restClient = restClientBuilder.build();
        this.jsonMapper = JsonMapper.builder().build();
        this.appSettings = appSettings;
        this.pacer = pacer;
    }

    /**
     * Result of an API key check, with the rate limit headers when the server sent them.
     */
    public record ApiKeyStatus(int statusCode, String rateLimitRemaining, String rateLimitLimit) {
    }

    /**
     * Quota as reported by the download endpoint.
     */
    public record QuotaStatus(Integer remaining, String resetTime) {
    }

    /**
     * Authenticate with OpenSubtitles and store the JWT token.
     *
     * @return true when a token was obtained
     */
    public synchronized boolean login() {
        String username = appSettings.getOpenSubtitlesUsername();
        String password = appSettings.getOpenSubtitlesPassword();
        if (isBlank(username) || isBlank(password)) {
            log.warn("No username/password provided. Downloads will not be available.");
            return false;
        }
        if (authenticationFailed) {
            log.debug("Skipping login - credentials were already rejected");
            return false;
        }

        log.info("Logging in to OpenSubtitles as user: {}", username);

        try {
            String body = jsonMapper.writeValueAsString(new LoginRequest(username, password));
            CatalogResponse response = send(() -> restClient.post()
                    .uri(baseUrl() + "/login")
                    .headers(this::addCommonHeaders)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body));

            if (response.status() == OK) {
                LoginResponse login = jsonMapper.readValue(response.body(), LoginResponse.class);
                if (isBlank(login.token())) {
                    log.error("Login response did not contain a token");
                    return false;
                }
                this.authToken = login.token();
                this.accountInfo = login.user();
                if (accountInfo != null) {
                    log.info("Successfully logged in (level: {}, daily downloads: {})",
                            accountInfo.level(), accountInfo.allowedDownloads());
                } else {
                    log.info("Successfully logged in");
                }
                return true;
            }
            if (response.status() == UNAUTHORIZED) {
                log.error("Invalid username or password. Downloads are disabled for this run.");
                this.authenticationFailed = true;
            } else {
                log.error("Login failed: {} - {}", response.status(), response.text());
            }
            return false;
        } catch (RestClientException | JacksonException e) {
            log.error("Login request failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Search for subtitles.
     *
     * @return the candidates (possibly empty when nothing matched), or empty on error
     */
    public synchronized Optional<List<SubtitleCandidate>> search(SearchQuery query) {
        if (authenticationFailed) {
            log.debug("Skipping search - OpenSubtitles rejected our credentials");
            return Optional.empty();
        }

        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(baseUrl() + "/subtitles");
        query.toParameters().forEach(builder::queryParam);
        URI uri = builder.encode().build().toUri();

        log.debug("Searching OpenSubtitles: {}", uri);

        try {
            CatalogResponse response = execute("search", () -> restClient.get()
                    .uri(uri)
                    .headers(this::addCommonHeaders));

            return switch (response.status()) {
                case OK -> Optional.of(toCandidates(
                        jsonMapper.readValue(response.body(), SubtitleSearchResponse.class)));
                case UNAUTHORIZED -> {
                    log.error("Invalid API key. Searches are disabled for this run.");
                    this.authenticationFailed = true;
                    yield Optional.empty();
                }
                case NOT_ACCEPTABLE -> {
                    log.debug("No subtitles found");
                    yield Optional.of(List.of());
                }
                default -> {
                    log.error("API error: {} - {}", response.status(), response.text());
                    yield Optional.empty();
                }
            };
        } catch (RestClientException | JacksonException e) {
            log.error("Search request failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Download a subtitle file. Logs in first when no token is held, and re-authenticates
     * at most once when the token is rejected.
     *
     * @return the subtitle bytes, or empty on any failure
     */
    public synchronized Optional<byte[]> download(int fileId) {
        if (authenticationFailed) {
            log.debug("Skipping download of file_id {} - OpenSubtitles rejected our credentials", fileId);
            return Optional.empty();
        }
        for (int attempt = 0; attempt <= MAX_REAUTHENTICATIONS; attempt++) {
            if (!isAuthenticated() && !login()) {
                log.error("Cannot download - not logged in");
                return Optional.empty();
            }

            if (remainingDownloads != null && remainingDownloads <= 0) {
                log.error("Daily download limit reached");
                return Optional.empty();
            }

            try {
                String body = jsonMapper.writeValueAsString(new DownloadRequest(fileId));
                CatalogResponse response = execute("download", () -> restClient.post()
                        .uri(baseUrl() + "/download")
                        .headers(this::addAuthHeaders)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(body));

                switch (response.status()) {
                    case OK:
                        return fetchSubtitle(jsonMapper.readValue(response.body(), DownloadResponse.class));
                    case UNAUTHORIZED:
                        this.authToken = null;
                        if (attempt < MAX_REAUTHENTICATIONS) {
                            log.warn("Invalid token - trying to re-login");
                            continue;
                        }
                        log.error("Download of file_id {} rejected again after re-login", fileId);
                        return Optional.empty();
                    case NOT_ACCEPTABLE:
                        updateQuota(response);
                        log.error("Download limit reached or subtitle unavailable (file_id {}, remaining: {})",
                                fileId, remainingDownloads);
                        return Optional.empty();
                    default:
                        log.error("Download API error: {} - {}", response.status(), response.text());
                        return Optional.empty();
                }
            } catch (RestClientException | JacksonException e) {
                log.error("Download request failed: {}", e.getMessage());
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Check the API key with a minimal search.
     */
    public synchronized ApiKeyStatus checkApiKey() {
        URI uri = UriComponentsBuilder.fromUriString(baseUrl() + "/subtitles")
                .queryParam("query", "test")
                .queryParam("languages", "en")
                .encode().build().toUri();
        CatalogResponse response = send(() -> restClient.get()
                .uri(uri)
                .headers(this::addCommonHeaders));
        return new ApiKeyStatus(response.status(), response.rateLimitRemaining(), response.rateLimitLimit());
    }

    /**
     * Ask the download endpoint for the current quota using an invalid file id.
     * The server reports the quota on 200 and 406 answers alike.
     */
    public synchronized Optional<QuotaStatus> probeQuota() {
        if (!isAuthenticated()) {
            return Optional.empty();
        }
        try {
            String body = jsonMapper.writeValueAsString(new DownloadRequest(0));
            CatalogResponse response = send(() -> restClient.post()
                    .uri(baseUrl() + "/download")
                    .headers(this::addAuthHeaders)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body));
            if (response.status() != OK && response.status() != NOT_ACCEPTABLE) {
                log.debug("Quota probe answered {}", response.status());
                return Optional.empty();
            }
            DownloadResponse quota = jsonMapper.readValue(response.body(), DownloadResponse.class);
            if (quota.remaining() != null) {
                this.remainingDownloads = quota.remaining();
            }
            return Optional.of(new QuotaStatus(quota.remaining(), quota.resetTime()));
        } catch (RestClientException | JacksonException e) {
            log.warn("Quota probe failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * True once the catalog has rejected the API key or the credentials. No further
     * requests are sent after that.
     */
    public synchronized boolean isAuthenticationFailed() {
        return authenticationFailed;
    }

    public synchronized boolean isAuthenticated() {
        return authToken != null && !authToken.isBlank();
    }

    /**
     * Remaining downloads as last reported by the server, or null if unknown.
     */
    public synchronized Integer getRemainingDownloads() {
        return remainingDownloads;
    }

    public synchronized Optional<LoginResponse.UserInfo> getAccountInfo() {
        return Optional.ofNullable(accountInfo);
    }

    private Optional<byte[]> fetchSubtitle(DownloadResponse download) {
        if (download.remaining() != null) {
            this.remainingDownloads = download.remaining();
        }
        if (isBlank(download.link())) {
            log.error("No download link in response");
            return Optional.empty();
        }

        URI link;
        try {
            link = URI.create(download.link());
        } catch (IllegalArgumentException e) {
            log.error("Malformed download link {}: {}", download.link(), e.getMessage());
            return Optional.empty();
        }
        CatalogResponse file = send(() -> restClient.get().uri(link));
        if (file.status() != OK) {
            log.error("Failed to download subtitle file: {}", file.status());
            return Optional.empty();
        }
        log.debug("Remaining downloads: {}", remainingDownloads);
        return Optional.of(file.body());
    }

    /**
     * Read the quota from a rejected download. The body is optional and not always JSON.
     */
    private void updateQuota(CatalogResponse response) {
        if (response.body().length == 0) {
            return;
        }
        try {
            DownloadResponse quota = jsonMapper.readValue(response.body(), DownloadResponse.class);
            if (quota.remaining() != null) {
                this.remainingDownloads = quota.remaining();
            }
        } catch (JacksonException e) {
            log.debug("No quota in download answer: {}", e.getMessage());
        }
    }

    private List<SubtitleCandidate> toCandidates(SubtitleSearchResponse response) {
        if (response == null || response.data() == null) {
            return List.of();
        }
        List<SubtitleCandidate> candidates = new ArrayList<>();
        for (SubtitleSearchResponse.SubtitleData data : response.data()) {
            var attrs = data.attributes();
            if (attrs == null) {
                continue;
            }
            Integer fileId = attrs.files() == null || attrs.files().isEmpty()
                    ? null
                    : attrs.files().get(0).fileId();
            if (fileId == null) {
                log.warn("Skipping {} subtitle {} without file id", attrs.language(), data.id());
                continue;
            }
            candidates.add(new SubtitleCandidate(
                    attrs.language(),
                    fileId,
                    attrs.ratings() == null ? 0.0 : attrs.ratings(),
                    attrs.downloadCount() == null ? 0 : attrs.downloadCount(),
                    attrs.release(),
                    attrs.uploader() == null ? null : attrs.uploader().name()));
        }
        return candidates;
    }

    /**
     * Send a request and, on 429, wait as told by Retry-After and send it once more.
     */
    private CatalogResponse execute(String operation, Supplier<RestClient.RequestHeadersSpec<?>> request) {
        CatalogResponse response = send(request);
        if (response.status() != TOO_MANY_REQUESTS) {
            return response;
        }
        Optional<Duration> wait = response.retryAfter();
        if (wait.isEmpty()) {
            log.error("Rate limit exceeded with no Retry-After header ({})", operation);
            return response;
        }
        log.warn("Rate limit exceeded. Waiting {} seconds...", wait.get().toSeconds());
        pacer.pause(wait.get());
        return send(request);
    }

    private CatalogResponse send(Supplier<RestClient.RequestHeadersSpec<?>> request) {
        pacer.awaitTurn();
        return request.get().exchange((req, res) -> new CatalogResponse(
                res.getStatusCode().value(),
                res.getHeaders().getFirst(HttpHeaders.RETRY_AFTER),
                res.getHeaders().getFirst("X-RateLimit-Remaining"),
                res.getHeaders().getFirst("X-RateLimit-Limit"),
                StreamUtils.copyToByteArray(res.getBody())));
    }

    private void addCommonHeaders(HttpHeaders headers) {
        headers.set("User-Agent", appSettings.getUserAgent());
        headers.set("Accept", "application/json");
        String apiKey = appSettings.getOpenSubtitlesApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            headers.set("Api-Key", apiKey);
        }
    }

    private void addAuthHeaders(HttpHeaders headers) {
        addCommonHeaders(headers);
        if (authToken != null && !authToken.isBlank()) {
            headers.set("Authorization", "Bearer " + authToken);
        }
    }

    private String baseUrl() {
        return appSettings.getOpenSubtitlesBaseUrl();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Status, selected headers and body of one catalog answer.
     */
    private record CatalogResponse(int status, String retryAfterHeader, String rateLimitRemaining,
            String rateLimitLimit, byte[] body) {

        String text() {
            return new String(body, StandardCharsets.UTF_8);
        }

        Optional<Duration> retryAfter() {
            if (retryAfterHeader == null || retryAfterHeader.isBlank()) {
                return Optional.empty();
            }
            try {
                return Optional.of(Duration.ofSeconds(Long.parseLong(retryAfterHeader.trim())));
            } catch (NumberFormatException e) {
                log.warn("Unparseable Retry-After header: {}", retryAfterHeader);
                return Optional.empty();
            }
        }
    }
}
