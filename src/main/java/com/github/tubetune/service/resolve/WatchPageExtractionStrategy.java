package com.github.tubetune.service.resolve;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.github.tubetune.exception.ExtractionStrategyException;
import com.github.tubetune.exception.ExtractionStrategyException.Reason;
import com.github.tubetune.model.CandidateItem;
import com.github.tubetune.model.MediaLocator;
import com.github.tubetune.service.parser.WatchPageParser;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves by reading the state the platform embeds in its own HTML pages.
 * Only works for videos whose audio formats are not signature-ciphered.
 */
@Slf4j
public class WatchPageExtractionStrategy implements ExtractionStrategy {

    public static final String NAME = "watch-page";

    private static final Set<String> AUTH_STATUSES = Set.of(
            "LOGIN_REQUIRED", "AGE_CHECK_REQUIRED", "AGE_VERIFICATION_REQUIRED", "CONTENT_CHECK_REQUIRED");

    private final OkHttpClient httpClient;
    private final WatchPageParser parser;
    private final HttpUrl baseUrl;

    public WatchPageExtractionStrategy(OkHttpClient httpClient, WatchPageParser parser,
                                       String baseUrl, Duration timeout) {
        this.httpClient = httpClient.newBuilder().callTimeout(timeout).build();
        this.parser = parser;
        this.baseUrl = HttpUrl.get(baseUrl);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<CandidateItem> resolve(MediaLocator locator, int maxResults) throws ExtractionStrategyException {
        return locator.isDirectUrl() ? resolveVideo(locator) : search(locator, maxResults);
    }

    private List<CandidateItem> resolveVideo(MediaLocator locator) throws ExtractionStrategyException {
        HttpUrl url = baseUrl.newBuilder()
                .addPathSegment("watch")
                .addQueryParameter("v", locator.getVideoId())
                .build();

        String html = fetch(url);
        JsonNode playerResponse = parse(() -> parser.parsePlayerResponse(html))
                .orElseThrow(() -> new ExtractionStrategyException(getName(), Reason.MALFORMED_RESPONSE,
                        "Watch page carries no player response"));

        String status = parser.playabilityStatus(playerResponse);
        if (!"OK".equals(status)) {
            String reason = parser.playabilityReason(playerResponse);
            throw new ExtractionStrategyException(getName(), classifyPlayability(status, reason),
                    "Not playable: " + status + " " + reason);
        }

        CandidateItem item = parser.toCandidate(playerResponse)
                .orElseThrow(() -> new ExtractionStrategyException(getName(), Reason.MALFORMED_RESPONSE,
                        "Player response has no video details"));
        if (!item.hasStream()) {
            throw new ExtractionStrategyException(getName(), Reason.UNAVAILABLE,
                    "Only ciphered audio formats for " + item.getId());
        }
        return List.of(item);
    }

    private List<CandidateItem> search(MediaLocator locator, int maxResults) throws ExtractionStrategyException {
        HttpUrl url = baseUrl.newBuilder()
                .addPathSegment("results")
                .addQueryParameter("search_query", locator.getText())
                .build();

        String html = fetch(url);
        JsonNode initialData = parse(() -> parser.parseInitialData(html))
                .orElseThrow(() -> new ExtractionStrategyException(getName(), Reason.MALFORMED_RESPONSE,
                        "Results page carries no initial data"));

        List<CandidateItem> items = parser.toSearchResults(initialData);
        if (items.isEmpty()) {
            throw new ExtractionStrategyException(getName(), Reason.NO_RESULTS,
                    "No usable search results for: " + locator.getText());
        }
        return items.size() > maxResults ? items.subList(0, maxResults) : items;
    }

    private String fetch(HttpUrl url) throws ExtractionStrategyException {
        Request request = new Request.Builder().url(url).build();

        try (Response response = httpClient.newCall(request).execute()) {
            String finalHost = response.request().url().host();
            if (finalHost.startsWith("consent.")) {
                throw new ExtractionStrategyException(getName(), Reason.AUTH_WALL,
                        "Redirected to consent page: " + finalHost);
            }
            if (!response.isSuccessful()) {
                throw new ExtractionStrategyException(getName(), classifyStatus(response.code()),
                        "Unexpected response code: " + response.code());
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new ExtractionStrategyException(getName(), Reason.MALFORMED_RESPONSE, "Empty response body");
            }
            return body.string();
        } catch (InterruptedIOException e) {
            throw new ExtractionStrategyException(getName(), Reason.TIMEOUT, "Page fetch timed out: " + url, e);
        } catch (IOException e) {
            throw new ExtractionStrategyException(getName(), Reason.TOOL_FAILURE,
                    "Page fetch failed: " + e.getMessage(), e);
        }
    }

    private <T> Optional<T> parse(PageSupplier<T> supplier) throws ExtractionStrategyException {
        try {
            return supplier.get();
        } catch (JsonProcessingException e) {
            throw new ExtractionStrategyException(getName(), Reason.MALFORMED_RESPONSE,
                    "Unreadable embedded JSON: " + e.getOriginalMessage(), e);
        }
    }

    static Reason classifyPlayability(String status, String reason) {
        if (AUTH_STATUSES.contains(status)) {
            return Reason.AUTH_WALL;
        }
        String normalized = reason == null ? "" : reason.toLowerCase(Locale.ROOT);
        if (normalized.contains("country")) {
            return Reason.GEO_BLOCKED;
        }
        if (normalized.contains("sign in")) {
            return Reason.AUTH_WALL;
        }
        return Reason.UNAVAILABLE;
    }

    private static Reason classifyStatus(int code) {
        if (code == 401 || code == 403 || code == 429) {
            return Reason.AUTH_WALL;
        }
        if (code == 404 || code == 410) {
            return Reason.UNAVAILABLE;
        }
        return Reason.TOOL_FAILURE;
    }

    @FunctionalInterface
    private interface PageSupplier<T> {
        Optional<T> get() throws JsonProcessingException;
    }
}
