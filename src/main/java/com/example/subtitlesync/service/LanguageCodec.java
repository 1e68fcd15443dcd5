package com.example.subtitlesync.service;

import com.example.subtitlesync.model.MediaItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Normalizes language codes to two letters and works out which wanted languages an item lacks.
 * <p>
 * The three-letter table covers common codes only; anything else is truncated to its first
 * two letters. This is an approximation of ISO 639 and misclassifies some codes
 * (e.g. "slk" becomes "sl").
 */
@Component
public class LanguageCodec {

    private static final Logger log = LoggerFactory.getLogger(LanguageCodec.class);

    private static final String DEFAULT_LANGUAGE = "en";

    private static final Map<String, String> THREE_LETTER_CODES = Map.ofEntries(
            Map.entry("eng", "en"),
            Map.entry("spa", "es"),
            Map.entry("fra", "fr"), Map.entry("fre", "fr"),
            Map.entry("deu", "de"), Map.entry("ger", "de"),
            Map.entry("ita", "it"),
            Map.entry("por", "pt"),
            Map.entry("rus", "ru"),
            Map.entry("jpn", "ja"),
            Map.entry("kor", "ko"),
            Map.entry("zho", "zh"), Map.entry("chi", "zh"),
            Map.entry("ara", "ar"),
            Map.entry("nld", "nl"), Map.entry("dut", "nl"));

    /**
     * Lower-case a code and map three-letter codes to two letters.
     *
     * @return the normalized code, or null for null or blank input
     */
    public String normalize(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        String lower = code.trim().toLowerCase(Locale.ROOT);
        if (lower.length() == 3) {
            return THREE_LETTER_CODES.getOrDefault(lower, lower.substring(0, 2));
        }
        return lower;
    }

    /**
     * Normalized codes of the subtitles the item already has.
     */
    public Set<String> existingLanguages(MediaItem item) {
        Set<String> existing = new LinkedHashSet<>();
        for (String code : item.subtitleLanguages()) {
            String normalized = normalize(code);
            if (normalized != null) {
                existing.add(normalized);
            }
        }
        return existing;
    }

    /**
     * Wanted languages the item has no subtitle for, in wanted order.
     */
    public Set<String> missingLanguages(MediaItem item, Collection<String> wanted) {
        Set<String> missing = new LinkedHashSet<>();
        for (String code : wanted) {
            String normalized = normalize(code);
            if (normalized != null) {
                missing.add(normalized);
            }
        }
        missing.removeAll(existingLanguages(item));
        return missing;
    }

    /**
     * Build the wanted language set from configured codes. Falls back to English when
     * nothing is configured.
     */
    public Set<String> parseLanguages(Collection<String> codes) {
        Set<String> wanted = new LinkedHashSet<>();
        for (String code : codes) {
            String normalized = normalize(code);
            if (normalized == null) {
                continue;
            }
            if (normalized.length() != 2) {
                log.warn("Language code '{}' should be 2 letters (ISO 639-1)", code);
            }
            wanted.add(normalized);
        }
        if (wanted.isEmpty()) {
            log.warn("No subtitle languages configured, defaulting to '{}'", DEFAULT_LANGUAGE);
            wanted.add(DEFAULT_LANGUAGE);
        }
        return Collections.unmodifiableSet(wanted);
    }
}
