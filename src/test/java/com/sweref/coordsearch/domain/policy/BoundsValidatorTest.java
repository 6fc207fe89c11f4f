package com.sweref.coordsearch.domain.policy;

import com.sweref.coordsearch.domain.model.CoordinateKeys;
import com.sweref.coordsearch.domain.model.Projection;
import com.sweref.coordsearch.domain.model.ValidationResult;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BoundsValidatorTest {

    private final BoundsValidator validator = new BoundsValidator();
    private final Projection zone1800 = ProjectionCatalog.byEpsg(3011).orElseThrow();

    @Test
    void testValidate_InsideTm_Valid() {
        ValidationResult result = validator.validate(500000, 6500000, ProjectionCatalog.SWEREF99_TM);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getErrors()).isEmpty();
        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    void testValidate_NearEdge_ValidWithWarning() {
        ValidationResult result = validator.validate(305000, 6500000, ProjectionCatalog.SWEREF99_TM);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getWarnings()).containsExactly(CoordinateKeys.WARNING_NEAR_BOUNDARY);
    }

    @Test
    void testValidate_JustBeyondWarningBuffer_NoWarning() {
        ValidationResult result = validator.validate(305001, 6500000, ProjectionCatalog.SWEREF99_TM);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    void testValidate_OutsideProjection_OutOfBounds() {
        ValidationResult result = validator.validate(250001, 6500000, zone1800);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).containsExactly(CoordinateKeys.ERROR_OUT_OF_BOUNDS);
        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    void testValidate_NoProjection_GlobalEnvelope() {
        assertThat(validator.validate(30000, 5900000, null).isValid()).isTrue();
        assertThat(validator.validate(900000, 6500000, null).getErrors())
                .containsExactly(CoordinateKeys.ERROR_OUT_OF_RANGE);
    }

    @Test
    void testValidate_NoProjection_NoBoundaryWarning() {
        assertThat(validator.validate(31000, 6500000, null).getWarnings()).isEmpty();
    }

    @Test
    void testValidate_NonFinite_InvalidNumber() {
        assertThat(validator.validate(Double.NaN, 6500000, null).getErrors())
                .containsExactly(CoordinateKeys.ERROR_INVALID_NUMBER);
        assertThat(validator.validate(500000, Double.POSITIVE_INFINITY, ProjectionCatalog.SWEREF99_TM).getErrors())
                .containsExactly(CoordinateKeys.ERROR_INVALID_NUMBER);
    }
}
