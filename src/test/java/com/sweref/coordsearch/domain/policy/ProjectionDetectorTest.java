package com.sweref.coordsearch.domain.policy;

import com.sweref.coordsearch.domain.model.CoordinateKeys;
import com.sweref.coordsearch.domain.model.DetectionResult;
import com.sweref.coordsearch.domain.model.ProjectionPreference;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class ProjectionDetectorTest {

    private final ProjectionDetector detector = new ProjectionDetector();

    @ParameterizedTest
    @ValueSource(doubles = {300000, 310000, 450000.5, 500000, 699999, 700000})
    void testDetect_TmEasting_ReturnsTm(double easting) {
        DetectionResult result = detector.detect(easting, 6500000, null, ProjectionPreference.AUTO);

        assertThat(result.getProjection()).isEqualTo(ProjectionCatalog.SWEREF99_TM);
        assertThat(result.getConfidence()).isGreaterThanOrEqualTo(0.6);
        assertThat(result.getAlternatives()).isEmpty();
    }

    @Test
    void testDetect_ZoneEastingWithLongitude_ClosestMeridianWins() {
        DetectionResult result = detector.detect(150000, 6500000, 16.4, ProjectionPreference.AUTO);

        assertThat(result.getProjection().getEpsgCode()).isEqualTo(3010);
        assertThat(result.getConfidence()).isEqualTo(0.85);
        assertThat(result.getAlternatives()).hasSize(11);
        // 16.4 is 0.65 from 15.75 and 0.85 from 17.25
        assertThat(result.getAlternatives().get(0).getEpsgCode()).isEqualTo(3013);
    }

    @Test
    void testDetect_ZoneEastingWithoutLongitude_TableOrder() {
        DetectionResult result = detector.detect(150000, 6500000, null, ProjectionPreference.AUTO);

        assertThat(result.getProjection().getEpsgCode()).isEqualTo(3007);
        assertThat(result.getConfidence()).isEqualTo(0.7);
    }

    @Test
    void testDetect_InvalidLongitude_TreatedAsUnknown() {
        DetectionResult result = detector.detect(150000, 6500000, Double.NaN, ProjectionPreference.AUTO);

        assertThat(result.getConfidence()).isEqualTo(0.7);
        assertThat(detector.detect(150000, 6500000, 200.0, ProjectionPreference.AUTO).getConfidence())
                .isEqualTo(0.7);
    }

    @Test
    void testDetect_ZonePreference_FullConfidence() {
        DetectionResult result = detector.detect(150000, 6500000, 20.3, ProjectionPreference.ZONE);

        assertThat(result.getProjection().getEpsgCode()).isEqualTo(3016);
        assertThat(result.getConfidence()).isEqualTo(1.0);
    }

    @Test
    void testDetect_TmPreference_TmAtPointNine() {
        DetectionResult result = detector.detect(500000, 6500000, 18.0, ProjectionPreference.TM);

        assertThat(result.getProjection()).isEqualTo(ProjectionCatalog.SWEREF99_TM);
        assertThat(result.getConfidence()).isEqualTo(0.9);
    }

    @Test
    void testDetect_TmPreferenceWithZoneEasting_FallsBackToZones() {
        DetectionResult result = detector.detect(150000, 6500000, null, ProjectionPreference.TM);

        assertThat(result.getProjection().isZone()).isTrue();
    }

    @Test
    void testDetect_ZoneNorthingOutsideBounds_NoZone() {
        DetectionResult result = detector.detect(150000, 7750000, 15.0, ProjectionPreference.AUTO);

        assertThat(result.isDetected()).isFalse();
    }

    @Test
    void testDetect_EastingBetweenRanges_NoProjection() {
        DetectionResult result = detector.detect(275000, 6500000, 15.0, ProjectionPreference.AUTO);

        assertThat(result.isDetected()).isFalse();
        assertThat(result.getConfidence()).isZero();
        assertThat(result.getWarnings()).containsExactly(CoordinateKeys.ERROR_NO_PROJECTION);
    }

    @Test
    void testDetect_ExactlyBufferFromEdge_NearBoundaryWarning() {
        assertThat(detector.detect(305000, 6500000, null, ProjectionPreference.AUTO).getWarnings())
                .containsExactly(CoordinateKeys.WARNING_NEAR_BOUNDARY);
        assertThat(detector.detect(695000, 6500000, null, ProjectionPreference.AUTO).getWarnings())
                .containsExactly(CoordinateKeys.WARNING_NEAR_BOUNDARY);
        assertThat(detector.detect(55000, 6500000, 12.0, ProjectionPreference.AUTO).getWarnings())
                .containsExactly(CoordinateKeys.WARNING_NEAR_BOUNDARY);
    }

    @Test
    void testDetect_OneUnitBeyondBuffer_NoWarning() {
        assertThat(detector.detect(305001, 6500000, null, ProjectionPreference.AUTO).getWarnings()).isEmpty();
        assertThat(detector.detect(694999, 6500000, null, ProjectionPreference.AUTO).getWarnings()).isEmpty();
        assertThat(detector.detect(55001, 6500000, 12.0, ProjectionPreference.AUTO).getWarnings()).isEmpty();
    }
}
