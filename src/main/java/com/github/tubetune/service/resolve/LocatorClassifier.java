package com.github.tubetune.service.resolve;

import com.github.tubetune.exception.ClassificationException;
import com.github.tubetune.model.MediaLocator;
import com.github.tubetune.util.PipelineConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether incoming text is a link to a single video or a search phrase.
 * Links are reduced to the canonical watch form; playlist, timestamp and
 * tracking parameters are dropped.
 */
@Slf4j
@Component
public class LocatorClassifier {

    private static final String SCHEME_AND_HOST = "^(?:https?://)?(?:(?:www|m|music)\\.)?";
    private static final String ID = "([\\w-]+)";

    private static final Pattern WATCH_PATTERN = Pattern.compile(
            SCHEME_AND_HOST + "youtube\\.com/watch/?\\?(?:[^#\\s]*&)?v=" + ID + "[^\\s]*$",
            Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> PATH_PATTERNS = List.of(
            Pattern.compile("^(?:https?://)?(?:www\\.)?youtu\\.be/" + ID + "(?:[?#/][^\\s]*)?$",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile(SCHEME_AND_HOST + "youtube\\.com/(?:embed|v|shorts)/" + ID + "(?:[?#/][^\\s]*)?$",
                    Pattern.CASE_INSENSITIVE));

    /**
     * Classify user text.
     *
     * @param text Raw message text
     * @return Direct URL locator or search query locator
     * @throws ClassificationException if the text is empty or blank
     */
    public MediaLocator classify(String text) {
        if (text == null || text.isBlank()) {
            throw new ClassificationException("Nothing to search", text);
        }

        String trimmed = text.strip();

        Matcher watch = WATCH_PATTERN.matcher(trimmed);
        if (watch.matches()) {
            return direct(watch.group(1));
        }
        for (Pattern pattern : PATH_PATTERNS) {
            Matcher matcher = pattern.matcher(trimmed);
            if (matcher.matches()) {
                return direct(matcher.group(1));
            }
        }

        log.debug("Classified as search query: {}", trimmed);
        return MediaLocator.searchQuery(trimmed);
    }

    private MediaLocator direct(String videoId) {
        String normalized = PipelineConstants.WATCH_URL_PREFIX + videoId;
        log.debug("Classified as direct URL: {}", normalized);
        return MediaLocator.directUrl(normalized, videoId);
    }
}
