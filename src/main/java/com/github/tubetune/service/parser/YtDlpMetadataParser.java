package com.github.tubetune.service.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tubetune.model.CandidateItem;
import com.github.tubetune.model.PlayableStream;
import com.github.tubetune.util.PipelineConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.StreamSupport;

/**
 * Parser for the JSON yt-dlp prints with {@code -J}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class YtDlpMetadataParser {

    private static final Set<String> DIRECT_PROTOCOLS = Set.of("https", "http");
    private static final Set<String> UNAVAILABLE_TITLES = Set.of("[deleted video]", "[private video]");
    private static final String NONE = "none";

    private final ObjectMapper objectMapper;

    /**
     * Parse the metadata of a single video, selecting the best directly
     * downloadable audio format as stream.
     *
     * @param json yt-dlp output
     * @return Candidate, without stream when no format can be fetched over plain HTTP
     * @throws JsonProcessingException if the output is not a JSON object with an id
     */
    public CandidateItem parseVideo(String json) throws JsonProcessingException {
        JsonNode root = readObject(json);
        String id = text(root, "id");
        if (id == null) {
            throw new MalformedMetadataException("Video metadata has no id");
        }

        CandidateItem.CandidateItemBuilder builder = baseItem(root, id)
                .thumbnailUrl(thumbnail(root));

        selectAudioFormat(root.path("formats")).ifPresent(format -> builder.stream(toStream(format)));
        return builder.build();
    }

    /**
     * Parse a flat search result, keeping platform order.
     * Entries without an 11-character id and deleted or private entries are skipped.
     *
     * @param json yt-dlp output
     * @return Candidates without streams
     * @throws JsonProcessingException if the output is not a JSON object
     */
    public List<CandidateItem> parseSearch(String json) throws JsonProcessingException {
        JsonNode root = readObject(json);
        List<CandidateItem> items = new ArrayList<>();

        for (JsonNode entry : root.path("entries")) {
            String id = text(entry, "id");
            if (id == null || id.length() != PipelineConstants.VIDEO_ID_LENGTH) {
                log.debug("Skipping search entry with invalid id: {}", id);
                continue;
            }
            String title = text(entry, "title");
            if (title != null && UNAVAILABLE_TITLES.contains(title.strip().toLowerCase())) {
                log.debug("Skipping unavailable search entry: {}", id);
                continue;
            }
            items.add(baseItem(entry, id)
                    .thumbnailUrl(thumbnail(entry))
                    .build());
        }

        return items;
    }

    private JsonNode readObject(String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            throw new MalformedMetadataException("Empty metadata output");
        }
        JsonNode root = objectMapper.readTree(json);
        if (root == null || !root.isObject()) {
            throw new MalformedMetadataException("Metadata output is not a JSON object");
        }
        return root;
    }

    private CandidateItem.CandidateItemBuilder baseItem(JsonNode node, String id) {
        String title = text(node, "title");
        String uploader = Optional.ofNullable(text(node, "uploader"))
                .orElse(text(node, "channel"));

        return CandidateItem.builder()
                .id(id)
                .title(title != null ? title : PipelineConstants.UNKNOWN_TITLE)
                .uploader(uploader != null ? uploader : PipelineConstants.UNKNOWN_UPLOADER)
                .durationSeconds(node.path("duration").asLong(0))
                .sourceRef(PipelineConstants.WATCH_URL_PREFIX + id);
    }

    private String thumbnail(JsonNode node) {
        String direct = text(node, "thumbnail");
        if (direct != null) {
            return direct;
        }
        // Flat entries only carry a list, ordered from smallest to largest
        JsonNode thumbnails = node.path("thumbnails");
        for (int i = thumbnails.size() - 1; i >= 0; i--) {
            String url = text(thumbnails.get(i), "url");
            if (url != null) {
                return url;
            }
        }
        return null;
    }

    /**
     * Audio-only formats first, then any format carrying audio; highest bitrate wins.
     */
    Optional<JsonNode> selectAudioFormat(JsonNode formats) {
        List<JsonNode> fetchable = StreamSupport.stream(formats.spliterator(), false)
                .filter(f -> text(f, "url") != null)
                .filter(f -> DIRECT_PROTOCOLS.contains(Optional.ofNullable(text(f, "protocol")).orElse("https")))
                .filter(f -> hasAudio(f))
                .toList();

        Comparator<JsonNode> byBitrate = Comparator.comparingDouble(this::audioBitrate);

        Optional<JsonNode> audioOnly = fetchable.stream()
                .filter(f -> NONE.equals(text(f, "vcodec")))
                .max(byBitrate);

        return audioOnly.or(() -> fetchable.stream().max(byBitrate));
    }

    private boolean hasAudio(JsonNode format) {
        String acodec = text(format, "acodec");
        return acodec == null || !NONE.equals(acodec);
    }

    private double audioBitrate(JsonNode format) {
        double abr = format.path("abr").asDouble(0);
        return abr > 0 ? abr : format.path("tbr").asDouble(0);
    }

    private PlayableStream toStream(JsonNode format) {
        PlayableStream.PlayableStreamBuilder builder = PlayableStream.builder()
                .url(text(format, "url"))
                .ext(Optional.ofNullable(text(format, "ext")).orElse("bin"));

        long size = format.path("filesize").asLong(0);
        if (size <= 0) {
            size = format.path("filesize_approx").asLong(0);
        }
        if (size > 0) {
            builder.expectedSize(size);
        }

        Iterator<Map.Entry<String, JsonNode>> headers = format.path("http_headers").fields();
        while (headers.hasNext()) {
            Map.Entry<String, JsonNode> header = headers.next();
            builder.header(header.getKey(), header.getValue().asText());
        }

        return builder.build();
    }

    private static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
