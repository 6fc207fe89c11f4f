package com.sweref.coordsearch.domain.policy;

import com.sweref.coordsearch.module.test.support.TestFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InputSanitizerTest {

    private final InputSanitizer sanitizer = TestFixtures.sanitizer();

    @Test
    void testSanitize_TabsAndPadding_CollapsedAndTrimmed() {
        assertThat(sanitizer.sanitize("  500000 ,\t6500000 \n")).isEqualTo("500000 , 6500000");
    }

    @Test
    void testSanitize_MarkupAndControlCharacters_Removed() {
        assertThat(sanitizer.sanitize("<b>500000</b>\u0007 6500000")).isEqualTo("500000 6500000");
    }

    @Test
    void testSanitize_NullOrEmpty_ReturnsEmpty() {
        assertThat(sanitizer.sanitize(null)).isEmpty();
        assertThat(sanitizer.sanitize("")).isEmpty();
    }

    @Test
    void testSanitize_LongInput_TruncatedTo200() {
        assertThat(sanitizer.sanitize("5".repeat(250))).hasSize(200);
    }

    @Test
    void testSanitize_KeepsLatin1Letters() {
        assertThat(sanitizer.sanitize("Malmö  Öster")).isEqualTo("Malmö Öster");
    }

    @Test
    void testSanitize_AppliedTwice_Unchanged() {
        List<String> samples = List.of(
                "  500000 ,\t6500000 ",
                "<script>alert(1)</script>E=1 N=2",
                "a".repeat(199) + "  b",
                "x ".repeat(150),
                "\u0000\u001f 12\u00A0345",
                "< 5 > 6",
                "");
        for (String sample : samples) {
            String once = sanitizer.sanitize(sample);
            assertThat(sanitizer.sanitize(once)).as("sanitize(%s)", sample).isEqualTo(once);
        }
    }

    @Test
    void testClean_LongInput_NotTruncated() {
        assertThat(sanitizer.clean("5".repeat(250))).hasSize(250);
    }

    @Test
    void testSanitizeSearchTerm_AngleBracketsAndControls_Dropped() {
        assertThat(sanitizer.sanitizeSearchTerm("Drottning<gatan>\u0001  5\u007f")).isEqualTo("Drottninggatan 5");
    }

    @Test
    void testSanitizeSearchTerm_LongInput_TruncatedTo256() {
        assertThat(sanitizer.sanitizeSearchTerm("a".repeat(300))).hasSize(256);
    }
}
