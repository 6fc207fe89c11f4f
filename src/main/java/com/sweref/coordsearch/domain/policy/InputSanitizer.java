package com.sweref.coordsearch.domain.policy;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Strips markup and unprintable characters from user text.
 *
 * Every method here is idempotent: feeding the output back in returns it unchanged.
 */
@Component
public class InputSanitizer {

    private static final Pattern HTML_TAG = Pattern.compile("<[^>]*>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int maxInputLength;
    private final int searchTermMaxLength;

    public InputSanitizer(
            @Value("${app.coordinates.max-input-length:200}") int maxInputLength,
            @Value("${app.coordinates.search-term-max-length:256}") int searchTermMaxLength) {
        this.maxInputLength = maxInputLength;
        this.searchTermMaxLength = searchTermMaxLength;
    }

    public int getMaxInputLength() {
        return maxInputLength;
    }

    /**
     * Sanitizes coordinate text and truncates it to the coordinate input limit.
     */
    public String sanitize(String raw) {
        return truncate(clean(raw), maxInputLength);
    }

    /**
     * Sanitizes coordinate text without truncating, so callers can detect over-long input.
     * Keeps printable ASCII and Latin-1; tabs and line breaks count as whitespace.
     */
    public String clean(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String withoutTags = HTML_TAG.matcher(WHITESPACE.matcher(raw).replaceAll(" ")).replaceAll("");
        StringBuilder kept = new StringBuilder(withoutTags.length());
        for (int i = 0; i < withoutTags.length(); i++) {
            char c = withoutTags.charAt(i);
            if ((c >= 32 && c <= 126) || (c >= 160 && c <= 255)) {
                kept.append(c);
            }
        }
        return WHITESPACE.matcher(kept).replaceAll(" ").trim();
    }

    /**
     * Sanitizer for the general (non-coordinate) search box: drops control characters
     * and angle brackets, then truncates.
     */
    public String sanitizeSearchTerm(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String spaced = WHITESPACE.matcher(raw).replaceAll(" ");
        StringBuilder kept = new StringBuilder(spaced.length());
        for (int i = 0; i < spaced.length(); i++) {
            char c = spaced.charAt(i);
            if (c >= 32 && c != 127 && c != '<' && c != '>') {
                kept.append(c);
            }
        }
        return truncate(WHITESPACE.matcher(kept).replaceAll(" ").trim(), searchTermMaxLength);
    }

    private static String truncate(String value, int maxLength) {
        if (value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength).trim();
    }
}
