package com.github.tubetune;

import com.github.tubetune.exception.ExtractionStrategyException;
import com.github.tubetune.exception.ExtractionStrategyException.Reason;
import com.github.tubetune.model.CandidateItem;
import com.github.tubetune.model.MediaLocator;
import com.github.tubetune.model.PlayableStream;
import com.github.tubetune.service.resolve.ExtractionStrategy;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Strategy answering direct URLs with one streamable item built from the video id,
 * and searches with a fixed result list.
 */
public class StaticStrategy implements ExtractionStrategy {

    private final List<CandidateItem> searchResults = new ArrayList<>();
    private final List<MediaLocator> locators = new CopyOnWriteArrayList<>();
    private final Set<String> unavailable = ConcurrentHashMap.newKeySet();
    private long durationSeconds = 200;

    public StaticStrategy withSearchResults(List<CandidateItem> items) {
        searchResults.clear();
        searchResults.addAll(items);
        return this;
    }

    public StaticStrategy withDuration(long seconds) {
        this.durationSeconds = seconds;
        return this;
    }

    public StaticStrategy withUnavailableVideo(String videoId) {
        unavailable.add(videoId);
        return this;
    }

    public static String streamUrl(String videoId) {
        return "https://media.example.com/" + videoId + ".m4a";
    }

    public static CandidateItem searchItem(String videoId, String title) {
        return CandidateItem.builder()
                .id(videoId)
                .title(title)
                .uploader("Uploader " + videoId)
                .durationSeconds(180)
                .sourceRef("https://www.youtube.com/watch?v=" + videoId)
                .build();
    }

    @Override
    public List<CandidateItem> resolve(MediaLocator locator, int maxResults) throws ExtractionStrategyException {
        locators.add(locator);
        if (!locator.isDirectUrl()) {
            if (searchResults.isEmpty()) {
                throw new ExtractionStrategyException(getName(), Reason.NO_RESULTS, "No results");
            }
            return List.copyOf(searchResults);
        }

        String id = locator.getVideoId();
        if (unavailable.contains(id)) {
            throw new ExtractionStrategyException(getName(), Reason.UNAVAILABLE, "Video unavailable: " + id);
        }
        return List.of(CandidateItem.builder()
                .id(id)
                .title("Track " + id)
                .uploader("Artist " + id)
                .durationSeconds(durationSeconds)
                .sourceRef(locator.getNormalizedUrl())
                .stream(PlayableStream.builder().url(streamUrl(id)).ext("m4a").build())
                .build());
    }

    @Override
    public String getName() {
        return "static";
    }

    public List<MediaLocator> getLocators() {
        return locators;
    }
}
