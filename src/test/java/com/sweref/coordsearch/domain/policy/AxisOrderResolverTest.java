package com.sweref.coordsearch.domain.policy;

import com.sweref.coordsearch.domain.model.AxisOrder;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AxisOrderResolverTest {

    private final AxisOrderResolver resolver = new AxisOrderResolver();

    @Test
    void testIsLikelyGeographic_LatLonPairs_True() {
        assertThat(resolver.isLikelyGeographic(59.33, 18.06)).isTrue();
        assertThat(resolver.isLikelyGeographic(-45, 170)).isTrue();
        assertThat(resolver.isLikelyGeographic(500000, 6500000)).isFalse();
        assertThat(resolver.isLikelyGeographic(120, 45)).isFalse();
    }

    @Test
    void testResolve_EastingThenNorthing_KeepsOrder() {
        assertThat(resolver.resolve(500000, 6500000)).contains(new AxisOrder(500000, 6500000));
    }

    @Test
    void testResolve_NorthingThenEasting_Swaps() {
        assertThat(resolver.resolve(6178897, 125452)).contains(new AxisOrder(125452, 6178897));
    }

    @Test
    void testResolve_OneEastingOtherNeither_EastingFirst() {
        assertThat(resolver.resolve(500000, 100)).contains(new AxisOrder(500000, 100));
        assertThat(resolver.resolve(100, 500000)).contains(new AxisOrder(500000, 100));
    }

    @Test
    void testResolve_NeitherFits_Empty() {
        assertThat(resolver.resolve(900000, 6500000)).isEmpty();
        assertThat(resolver.resolve(900000, 900000)).isEmpty();
    }

    @Test
    void testResolve_Geographic_Empty() {
        assertThat(resolver.resolve(13.5, 60.5)).isEmpty();
    }

    @Test
    void testResolve_DisjointRanges_NoAmbiguityWarning() {
        assertThat(resolver.resolve(500000, 6500000))
                .hasValueSatisfying(order -> assertThat(order.getWarning()).isNull());
    }
}
