package com.sweref.coordsearch.domain.policy;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Turns locale-ambiguous numeric text into a canonical decimal string.
 *
 * Separator policy:
 * - space-grouped triplets ("6 500 000") are thousands grouping
 * - a single '.' or ',' is the decimal point
 * - with several separators the last one is the decimal point and the rest are grouping,
 *   unless all of them are the same glyph and exactly three digits follow the last one,
 *   in which case all of them are grouping ("1.234.567")
 */
@Component
public class NumericNormalizer {

    static final int MAX_RAW_DIGITS = 18;
    static final int MAX_DIGITS = 15;
    static final double MAX_MAGNITUDE = 1e8;

    private static final Pattern NON_NUMERIC = Pattern.compile("[^0-9\\s.,+\\-]");
    private static final Pattern SEPARATOR_RUN = Pattern.compile("[.,]{3,}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern TRIPLET = Pattern.compile("\\d{3}");
    private static final Pattern LAST_GROUP = Pattern.compile("\\d{3}(?:[.,]\\d+)?");

    /**
     * @param raw numeric candidate, possibly with grouping, a sign and stray characters
     * @return canonical string such as "-1234.5" or "0", or empty when the text is rejected
     */
    public Optional<String> normalize(String raw) {
        if (raw == null || countDigits(raw) > MAX_RAW_DIGITS) {
            return Optional.empty();
        }

        String cleaned = NON_NUMERIC.matcher(raw.replace('\u00A0', ' ')).replaceAll("").trim();
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }

        boolean negative = false;
        char first = cleaned.charAt(0);
        if (first == '-' || first == '+') {
            negative = first == '-';
            cleaned = cleaned.substring(1).trim();
        }
        if (cleaned.isEmpty() || cleaned.indexOf('-') >= 0 || cleaned.indexOf('+') >= 0) {
            return Optional.empty();
        }
        if (SEPARATOR_RUN.matcher(cleaned).find()) {
            return Optional.empty();
        }

        String ungrouped = removeSpaceGrouping(cleaned);
        if (ungrouped == null) {
            return Optional.empty();
        }

        String unsigned = resolveSeparators(ungrouped);
        if (unsigned == null || countDigits(unsigned) > MAX_DIGITS) {
            return Optional.empty();
        }

        double magnitude = Double.parseDouble(unsigned);
        if (!Double.isFinite(magnitude) || magnitude > MAX_MAGNITUDE) {
            return Optional.empty();
        }
        if (magnitude < CoordinateRanges.PRECISION_EPSILON) {
            return Optional.of("0");
        }
        return Optional.of(negative ? "-" + unsigned : unsigned);
    }

    /**
     * Numeric value of {@link #normalize(String)}.
     */
    public OptionalDouble parse(String raw) {
        return normalize(raw)
                .map(value -> OptionalDouble.of(Double.parseDouble(value)))
                .orElse(OptionalDouble.empty());
    }

    /**
     * Joins "123 456 789" style groups. Returns null when whitespace is present but
     * does not form valid thousands grouping.
     */
    private String removeSpaceGrouping(String value) {
        String[] groups = WHITESPACE.split(value);
        if (groups.length == 1) {
            return value;
        }
        if (!DIGITS.matcher(groups[0]).matches() || groups[0].length() > 3) {
            return null;
        }
        for (int i = 1; i < groups.length - 1; i++) {
            if (!TRIPLET.matcher(groups[i]).matches()) {
                return null;
            }
        }
        if (!LAST_GROUP.matcher(groups[groups.length - 1]).matches()) {
            return null;
        }
        return String.join("", groups);
    }

    /**
     * @param value digits with '.' and ',' only
     * @return digits with at most one '.', or null when the separators are malformed
     */
    private String resolveSeparators(String value) {
        int dots = 0;
        int commas = 0;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '.') {
                dots++;
            } else if (c == ',') {
                commas++;
            }
        }
        int separators = dots + commas;
        if (countDigits(value) == 0) {
            return null;
        }
        if (separators == 0) {
            return value;
        }

        int decimalIndex = Math.max(value.lastIndexOf('.'), value.lastIndexOf(','));
        if (decimalIndex == value.length() - 1) {
            return null;
        }
        String fraction = value.substring(decimalIndex + 1);

        if (separators == 1) {
            String integer = value.substring(0, decimalIndex);
            return (integer.isEmpty() ? "0" : integer) + "." + fraction;
        }

        char leading = value.charAt(0);
        if (leading == '.' || leading == ',') {
            return null;
        }
        String integer = value.substring(0, decimalIndex).replace(".", "").replace(",", "");
        boolean singleGlyph = dots == 0 || commas == 0;
        if (singleGlyph && fraction.length() == 3) {
            return integer + fraction;
        }
        return integer + "." + fraction;
    }

    private static int countDigits(String value) {
        int count = 0;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c >= '0' && c <= '9') {
                count++;
            }
        }
        return count;
    }
}
