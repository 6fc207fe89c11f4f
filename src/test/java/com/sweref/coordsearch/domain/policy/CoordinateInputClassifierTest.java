package com.sweref.coordsearch.domain.policy;

import com.sweref.coordsearch.domain.model.InputClassification;
import com.sweref.coordsearch.domain.model.InputClassification.Confidence;
import com.sweref.coordsearch.domain.model.InputClassification.Reason;
import com.sweref.coordsearch.module.test.support.TestFixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CoordinateInputClassifierTest {

    private final CoordinateInputClassifier classifier = new CoordinateInputClassifier(
            TestFixtures.sanitizer(), TestFixtures.parser(), new NumericNormalizer(), new AxisOrderResolver());

    @Test
    void testClassify_SwerefPair_CoordinateHighConfidence() {
        assertThat(classifier.classify("500000 6500000"))
                .isEqualTo(new InputClassification(true, Confidence.HIGH, Reason.SWEREF99_RANGE));
    }

    @Test
    void testClassify_AxisLabels_Allowed() {
        assertThat(classifier.classify("E 500000 N 6500000").isCoordinate()).isTrue();
    }

    @Test
    void testClassify_LatLon_CoordinateMediumConfidence() {
        assertThat(classifier.classify("59.33, 18.06"))
                .isEqualTo(new InputClassification(true, Confidence.MEDIUM, Reason.WGS84_RANGE));
    }

    @Test
    void testClassify_ShortInput_Rejected() {
        assertThat(classifier.classify("123"))
                .isEqualTo(InputClassification.rejected(Confidence.HIGH, Reason.INPUT_TOO_SHORT));
    }

    @Test
    void testClassify_StreetName_UnsupportedCharacters() {
        assertThat(classifier.classify("Drottninggatan 5").getReason()).isEqualTo(Reason.UNSUPPORTED_CHARACTERS);
    }

    @Test
    void testClassify_ManyNumbers_NotTwoNumbersMedium() {
        assertThat(classifier.classify("1 2 3 4 5"))
                .isEqualTo(InputClassification.rejected(Confidence.MEDIUM, Reason.NOT_TWO_NUMBERS));
    }

    @Test
    void testClassify_Postcode_AddressPattern() {
        assertThat(classifier.classify("114 55").getReason()).isEqualTo(Reason.ADDRESS_PATTERN_DETECTED);
    }

    @Test
    void testClassify_NumbersOutsideBothRanges_OutOfRange() {
        assertThat(classifier.classify("900000 100"))
                .isEqualTo(InputClassification.rejected(Confidence.HIGH, Reason.OUT_OF_RANGE));
    }
}
