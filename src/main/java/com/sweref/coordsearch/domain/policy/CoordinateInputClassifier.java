package com.sweref.coordsearch.domain.policy;

import com.sweref.coordsearch.domain.model.AxisOrder;
import com.sweref.coordsearch.domain.model.InputClassification;
import com.sweref.coordsearch.domain.model.InputClassification.Confidence;
import com.sweref.coordsearch.domain.model.InputClassification.Reason;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic that tells coordinate input apart from addresses and place names, so the
 * search box can route a query to coordinate search or to geocoding.
 */
@Component
public class CoordinateInputClassifier {

    private static final int MIN_COORDINATE_LENGTH = 5;

    private static final Pattern LETTERS = Pattern.compile("[A-Za-z]+");
    private static final Pattern AXIS_LABELS = Pattern.compile("[ENen]+");
    private static final List<Pattern> ADDRESS_PATTERNS = List.of(
            Pattern.compile("\\b(gata|gatan|väg|vägen|plan|torg|torget|allé|allén)\\b",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS),
            Pattern.compile("\\b\\d{3}\\s?\\d{2}\\b"),
            Pattern.compile("\\b(stockholm|göteborg|malmö|uppsala|linköping)\\b",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS));

    private final InputSanitizer sanitizer;
    private final CoordinateParser parser;
    private final NumericNormalizer normalizer;
    private final AxisOrderResolver axisOrderResolver;

    public CoordinateInputClassifier(
            InputSanitizer sanitizer,
            CoordinateParser parser,
            NumericNormalizer normalizer,
            AxisOrderResolver axisOrderResolver) {
        this.sanitizer = sanitizer;
        this.parser = parser;
        this.normalizer = normalizer;
        this.axisOrderResolver = axisOrderResolver;
    }

    public InputClassification classify(String input) {
        String sanitized = sanitizer.sanitize(input);
        if (sanitized.length() < MIN_COORDINATE_LENGTH) {
            return InputClassification.rejected(Confidence.HIGH, Reason.INPUT_TOO_SHORT);
        }
        if (hasUnsupportedLetters(sanitized)) {
            return InputClassification.rejected(Confidence.HIGH, Reason.UNSUPPORTED_CHARACTERS);
        }

        List<String> numbers = parser.extractCandidates(sanitized);
        if (numbers.size() != 2) {
            return InputClassification.rejected(
                    numbers.size() > 2 ? Confidence.MEDIUM : Confidence.HIGH, Reason.NOT_TWO_NUMBERS);
        }

        OptionalDouble first = normalizer.parse(numbers.get(0));
        OptionalDouble second = normalizer.parse(numbers.get(1));
        if (first.isEmpty() || second.isEmpty()) {
            return InputClassification.rejected(Confidence.HIGH, Reason.INVALID_NUMBERS);
        }

        for (Pattern pattern : ADDRESS_PATTERNS) {
            if (pattern.matcher(sanitized).find()) {
                return InputClassification.rejected(Confidence.HIGH, Reason.ADDRESS_PATTERN_DETECTED);
            }
        }

        Optional<AxisOrder> axisOrder = axisOrderResolver.resolve(first.getAsDouble(), second.getAsDouble());
        if (axisOrder.isPresent()) {
            Confidence confidence = axisOrder.get().getWarning() != null ? Confidence.MEDIUM : Confidence.HIGH;
            return new InputClassification(true, confidence, Reason.SWEREF99_RANGE);
        }
        if (axisOrderResolver.isLikelyGeographic(first.getAsDouble(), second.getAsDouble())) {
            return new InputClassification(true, Confidence.MEDIUM, Reason.WGS84_RANGE);
        }
        return InputClassification.rejected(Confidence.HIGH, Reason.OUT_OF_RANGE);
    }

    private static boolean hasUnsupportedLetters(String value) {
        Matcher matcher = LETTERS.matcher(value);
        while (matcher.find()) {
            if (!AXIS_LABELS.matcher(matcher.group()).matches()) {
                return true;
            }
        }
        return false;
    }
}
