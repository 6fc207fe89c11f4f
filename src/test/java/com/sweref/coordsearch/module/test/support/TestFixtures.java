package com.sweref.coordsearch.module.test.support;

import com.sweref.coordsearch.api.dto.CoordinateSearchRequestDto;
import com.sweref.coordsearch.domain.model.ProjectionPreference;
import com.sweref.coordsearch.domain.policy.AxisOrderResolver;
import com.sweref.coordsearch.domain.policy.CoordinateParser;
import com.sweref.coordsearch.domain.policy.InputSanitizer;
import com.sweref.coordsearch.domain.policy.NumericNormalizer;

/**
 * Test fixtures for creating test data.
 * Provides factory methods for the domain stages and common inputs.
 */
public class TestFixtures {

    private TestFixtures() {
        // Utility class
    }

    /**
     * Sanitizer with the production limits.
     */
    public static InputSanitizer sanitizer() {
        return new InputSanitizer(200, 256);
    }

    /**
     * Parser wired with real collaborators.
     */
    public static CoordinateParser parser() {
        return new CoordinateParser(sanitizer(), new NumericNormalizer(), new AxisOrderResolver());
    }

    public static CoordinateSearchRequestDto searchRequest(String text) {
        return new CoordinateSearchRequestDto(text, null, null, null);
    }

    public static CoordinateSearchRequestDto searchRequest(
            String text, ProjectionPreference preference, Double centerLongitude, Integer targetWkid) {
        return new CoordinateSearchRequestDto(text, preference, centerLongitude, targetWkid);
    }

    /**
     * Common coordinate inputs.
     */
    public static class Inputs {
        public static final String TM_COMMA = "500000,6500000";
        public static final String TM_SPACE = "500000 6500000";
        public static final String TM_NEAR_WEST_EDGE = "305000 6500000";
        public static final String ZONE_LABELED = "E=125452 N=6178897";
        public static final String ZONE_REVERSED = "6178897,125452";
        public static final String GEOGRAPHIC = "13.5,60.5";
        public static final String EASTING_TOO_LARGE = "900000,6500000";
    }

    /**
     * Map values.
     */
    public static class MapView {
        public static final int WEB_MERCATOR = 3857;
        public static final int SWEREF99_TM = 3006;
        public static final double STOCKHOLM_LONGITUDE = 18.07;
        /** Web Mercator x of longitude 15 degrees. */
        public static final double X_AT_15_DEGREES = 1669792.36;
    }
}
