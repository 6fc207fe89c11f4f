package com.sweref.coordsearch.domain.policy;

import com.sweref.coordsearch.domain.model.AxisOrder;
import com.sweref.coordsearch.domain.model.CoordinateKeys;
import com.sweref.coordsearch.domain.model.InputFormat;
import com.sweref.coordsearch.domain.model.ParsedCoordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses free text into a SWEREF 99 easting/northing pair.
 *
 * Format detection priority: labeled ("E=... N=..."), comma-separated, space-separated.
 * Unlabeled input goes through {@link AxisOrderResolver}.
 */
@Component
public class CoordinateParser {

    private static final Logger logger = LoggerFactory.getLogger(CoordinateParser.class);

    private static final Pattern LABELED_VALUE = Pattern.compile("([ENen])\\s*[:=]?\\s*([-+]?\\d[\\d\\s.,]*)");
    private static final Pattern NUMBER_CAPTURE = Pattern.compile("[-+]?\\d[\\d\\s.,]*");
    private static final Pattern COMMA_BETWEEN_DIGITS = Pattern.compile("\\d\\s*,\\s*\\d");
    private static final Pattern SPACE_BETWEEN_DIGITS = Pattern.compile("\\d\\s+\\d");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LIST_SEPARATOR = Pattern.compile("[,;]");
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[,;\\s]+|[,;\\s]+$");

    private final InputSanitizer sanitizer;
    private final NumericNormalizer normalizer;
    private final AxisOrderResolver axisOrderResolver;

    public CoordinateParser(
            InputSanitizer sanitizer,
            NumericNormalizer normalizer,
            AxisOrderResolver axisOrderResolver) {
        this.sanitizer = sanitizer;
        this.normalizer = normalizer;
        this.axisOrderResolver = axisOrderResolver;
    }

    /**
     * Parses coordinate text. The text is sanitized again without truncation, so
     * over-long input is reported instead of silently cut.
     *
     * @param input raw or already sanitized text
     * @return success with the pair, or failure with an error key
     */
    public ParsedCoordinate parse(String input) {
        if (input == null || input.isEmpty()) {
            return ParsedCoordinate.failure(CoordinateKeys.ERROR_EMPTY);
        }
        String sanitized = sanitizer.clean(input);
        if (sanitized.isEmpty()) {
            return ParsedCoordinate.failure(CoordinateKeys.ERROR_EMPTY);
        }
        if (sanitized.length() > sanitizer.getMaxInputLength()) {
            return ParsedCoordinate.failure(CoordinateKeys.ERROR_TOO_LONG);
        }

        InputFormat format = detectFormat(sanitized);
        logger.debug("Parsing coordinate input '{}' detected as {}", sanitized, format);

        if (format == InputFormat.LABELED) {
            Double[] labeled = parseLabeled(sanitized);
            if (labeled[0] != null && labeled[1] != null) {
                return buildResult(labeled[0], labeled[1], InputFormat.LABELED, sanitized, null);
            }
            format = detectUnlabeledFormat(sanitized);
        }

        List<String> candidates = extractCandidates(sanitized);
        if (candidates.size() < 2) {
            return ParsedCoordinate.failure(CoordinateKeys.ERROR_PARSE);
        }

        OptionalDouble first = normalizer.parse(candidates.get(0));
        OptionalDouble second = normalizer.parse(candidates.get(1));
        if (first.isEmpty() || second.isEmpty()) {
            return ParsedCoordinate.failure(CoordinateKeys.ERROR_PARSE);
        }

        if (axisOrderResolver.isLikelyGeographic(first.getAsDouble(), second.getAsDouble())) {
            return ParsedCoordinate.failure(CoordinateKeys.ERROR_NOT_SWEREF);
        }
        Optional<AxisOrder> axisOrder = axisOrderResolver.resolve(first.getAsDouble(), second.getAsDouble());
        if (axisOrder.isEmpty()) {
            return ParsedCoordinate.failure(CoordinateKeys.ERROR_PARSE);
        }

        if (format == InputFormat.UNKNOWN) {
            format = sanitized.contains(",") ? InputFormat.COMMA_SEPARATED : InputFormat.SPACE_SEPARATED;
        }
        AxisOrder order = axisOrder.get();
        return buildResult(order.getEasting(), order.getNorthing(), format, sanitized, order.getWarning());
    }

    /**
     * Builds a result from numbers that are already separated, applying the same
     * geographic and range checks as text parsing.
     */
    public ParsedCoordinate normalizeCoordinates(double easting, double northing) {
        return buildResult(easting, northing, InputFormat.UNKNOWN, null, null);
    }

    InputFormat detectFormat(String value) {
        if (LABELED_VALUE.matcher(value).find()) {
            return InputFormat.LABELED;
        }
        return detectUnlabeledFormat(value);
    }

    private static InputFormat detectUnlabeledFormat(String value) {
        if (COMMA_BETWEEN_DIGITS.matcher(value).find()) {
            return InputFormat.COMMA_SEPARATED;
        }
        if (SPACE_BETWEEN_DIGITS.matcher(value).find()) {
            return InputFormat.SPACE_SEPARATED;
        }
        return InputFormat.UNKNOWN;
    }

    /**
     * Numeric candidates in text order: pattern matches first, then whitespace tokens,
     * then comma/semicolon separated tokens, whichever first yields two.
     */
    public List<String> extractCandidates(String sanitized) {
        List<String> numbers = new ArrayList<>();
        Matcher matcher = NUMBER_CAPTURE.matcher(sanitized);
        while (matcher.find()) {
            String candidate = stripEdges(matcher.group());
            if (!candidate.isEmpty()) {
                numbers.add(candidate);
            }
        }
        if (numbers.size() >= 2) {
            return numbers;
        }

        List<String> tokens = split(sanitized, WHITESPACE);
        if (tokens.size() >= 2) {
            return tokens;
        }

        List<String> listTokens = split(sanitized, LIST_SEPARATOR);
        if (listTokens.size() >= 2) {
            return listTokens;
        }
        return numbers;
    }

    /**
     * Last occurrence of each label wins; values that fail to normalize are skipped.
     *
     * @return {easting, northing}, either entry null when missing
     */
    private Double[] parseLabeled(String value) {
        Double easting = null;
        Double northing = null;
        Matcher matcher = LABELED_VALUE.matcher(value);
        while (matcher.find()) {
            OptionalDouble parsed = normalizer.parse(stripEdges(matcher.group(2)));
            if (parsed.isEmpty()) {
                continue;
            }
            if (Character.toUpperCase(matcher.group(1).charAt(0)) == 'E') {
                easting = parsed.getAsDouble();
            } else {
                northing = parsed.getAsDouble();
            }
        }
        return new Double[] {easting, northing};
    }

    private ParsedCoordinate buildResult(
            double easting, double northing, InputFormat format, String sanitized, String warning) {
        if (axisOrderResolver.isLikelyGeographic(easting, northing)) {
            return ParsedCoordinate.failure(CoordinateKeys.ERROR_NOT_SWEREF);
        }
        if (!CoordinateRanges.isSweref99Range(easting, northing)) {
            return ParsedCoordinate.failure(CoordinateKeys.ERROR_OUT_OF_RANGE);
        }
        return ParsedCoordinate.success(easting, northing, format, sanitized, warning);
    }

    private static List<String> split(String value, Pattern separator) {
        List<String> tokens = new ArrayList<>();
        for (String token : separator.split(value)) {
            String stripped = stripEdges(token);
            if (!stripped.isEmpty()) {
                tokens.add(stripped);
            }
        }
        return tokens;
    }

    private static String stripEdges(String token) {
        return EDGE_PUNCTUATION.matcher(token).replaceAll("");
    }
}
