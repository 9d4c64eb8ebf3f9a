package com.github.tubetune.service.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tubetune.model.CandidateItem;
import com.github.tubetune.model.PlayableStream;
import com.github.tubetune.util.PipelineConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.StreamSupport;

/**
 * Parser for the player and search state embedded in the platform's HTML pages.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WatchPageParser {

    public static final String PLAYER_RESPONSE_VAR = "ytInitialPlayerResponse";
    public static final String INITIAL_DATA_VAR = "ytInitialData";

    private final ObjectMapper objectMapper;

    /**
     * Locate and parse {@code ytInitialPlayerResponse} in a watch page.
     *
     * @param html Watch page
     * @return Player response, empty if the page embeds none
     * @throws JsonProcessingException if the embedded object is not valid JSON
     */
    public Optional<JsonNode> parsePlayerResponse(String html) throws JsonProcessingException {
        return extractObject(html, PLAYER_RESPONSE_VAR);
    }

    /**
     * Locate and parse {@code ytInitialData} in a results page.
     *
     * @param html Results page
     * @return Initial data, empty if the page embeds none
     * @throws JsonProcessingException if the embedded object is not valid JSON
     */
    public Optional<JsonNode> parseInitialData(String html) throws JsonProcessingException {
        return extractObject(html, INITIAL_DATA_VAR);
    }

    /**
     * @return playabilityStatus.status, "OK" for a playable video
     */
    public String playabilityStatus(JsonNode playerResponse) {
        return playerResponse.path("playabilityStatus").path("status").asText("UNKNOWN");
    }

    public String playabilityReason(JsonNode playerResponse) {
        return playerResponse.path("playabilityStatus").path("reason").asText("");
    }

    /**
     * Build a candidate from a player response. Only adaptive audio formats with a
     * plain URL are usable; ciphered formats are ignored.
     *
     * @param playerResponse Parsed player response
     * @return Candidate, without stream when no plain audio URL is offered
     */
    public Optional<CandidateItem> toCandidate(JsonNode playerResponse) {
        JsonNode details = playerResponse.path("videoDetails");
        String id = details.path("videoId").asText(null);
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }

        CandidateItem.CandidateItemBuilder builder = CandidateItem.builder()
                .id(id)
                .title(details.path("title").asText(PipelineConstants.UNKNOWN_TITLE))
                .uploader(details.path("author").asText(PipelineConstants.UNKNOWN_UPLOADER))
                .durationSeconds(details.path("lengthSeconds").asLong(0))
                .thumbnailUrl(lastThumbnail(details.path("thumbnail")))
                .sourceRef(PipelineConstants.WATCH_URL_PREFIX + id);

        StreamSupport.stream(playerResponse.path("streamingData").path("adaptiveFormats").spliterator(), false)
                .filter(f -> f.path("mimeType").asText("").startsWith("audio/"))
                .filter(f -> f.hasNonNull("url"))
                .max(Comparator.comparingLong(f -> f.path("bitrate").asLong(0)))
                .ifPresent(format -> builder.stream(toStream(format)));

        return Optional.of(builder.build());
    }

    /**
     * Collect video results from a results page's initial data, keeping page order.
     *
     * @param initialData Parsed initial data
     * @return Candidates without streams
     */
    public List<CandidateItem> toSearchResults(JsonNode initialData) {
        List<CandidateItem> items = new ArrayList<>();
        for (JsonNode renderer : initialData.findValues("videoRenderer")) {
            String id = renderer.path("videoId").asText("");
            if (id.length() != PipelineConstants.VIDEO_ID_LENGTH) {
                continue;
            }
            items.add(CandidateItem.builder()
                    .id(id)
                    .title(runsText(renderer.path("title"), PipelineConstants.UNKNOWN_TITLE))
                    .uploader(runsText(renderer.path("ownerText"), PipelineConstants.UNKNOWN_UPLOADER))
                    .durationSeconds(parseClock(renderer.path("lengthText").path("simpleText").asText("")))
                    .thumbnailUrl(lastThumbnail(renderer.path("thumbnail")))
                    .sourceRef(PipelineConstants.WATCH_URL_PREFIX + id)
                    .build());
        }
        return items;
    }

    private Optional<JsonNode> extractObject(String html, String variable) throws JsonProcessingException {
        if (html == null || html.isBlank()) {
            return Optional.empty();
        }
        Document document = Jsoup.parse(html);
        for (Element script : document.select("script")) {
            String data = script.data();
            int marker = data.indexOf(variable);
            if (marker < 0) {
                continue;
            }
            int start = data.indexOf('{', marker);
            if (start < 0) {
                continue;
            }
            int end = findObjectEnd(data, start);
            if (end < 0) {
                log.debug("Unterminated {} object in page script", variable);
                continue;
            }
            return Optional.of(objectMapper.readTree(data.substring(start, end + 1)));
        }
        return Optional.empty();
    }

    /**
     * Index of the brace closing the object opened at {@code start}, skipping
     * braces inside string literals; -1 if the object is unterminated.
     */
    static int findObjectEnd(String data, int start) {
        int depth = 0;
        boolean inString = false;
        for (int i = start; i < data.length(); i++) {
            char c = data.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private PlayableStream toStream(JsonNode format) {
        String mimeType = format.path("mimeType").asText("");
        PlayableStream.PlayableStreamBuilder builder = PlayableStream.builder()
                .url(format.path("url").asText())
                .ext(mimeType.startsWith("audio/webm") ? "webm" : "m4a");
        long size = format.path("contentLength").asLong(0);
        if (size > 0) {
            builder.expectedSize(size);
        }
        return builder.build();
    }

    private static String lastThumbnail(JsonNode thumbnailContainer) {
        JsonNode thumbnails = thumbnailContainer.path("thumbnails");
        if (thumbnails.isEmpty()) {
            return null;
        }
        return thumbnails.get(thumbnails.size() - 1).path("url").asText(null);
    }

    private static String runsText(JsonNode textNode, String fallback) {
        if (textNode.hasNonNull("simpleText")) {
            return textNode.get("simpleText").asText();
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode run : textNode.path("runs")) {
            text.append(run.path("text").asText(""));
        }
        return text.length() > 0 ? text.toString() : fallback;
    }

    /**
     * Parse "h:mm:ss" or "m:ss" into seconds, 0 when unparseable.
     */
    static long parseClock(String clock) {
        if (clock == null || clock.isBlank()) {
            return 0;
        }
        long seconds = 0;
        for (String part : clock.strip().split(":")) {
            try {
                seconds = seconds * 60 + Long.parseLong(part);
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return seconds;
    }
}
