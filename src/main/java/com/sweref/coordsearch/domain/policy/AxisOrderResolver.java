package com.sweref.coordsearch.domain.policy;

import com.sweref.coordsearch.domain.model.AxisOrder;
import com.sweref.coordsearch.domain.model.CoordinateKeys;
import org.springframework.stereotype.Component;

import java.util.Optional;

import static com.sweref.coordsearch.domain.policy.CoordinateRanges.isEasting;
import static com.sweref.coordsearch.domain.policy.CoordinateRanges.isNorthing;

/**
 * Decides which of two unlabeled numbers is the easting and which the northing.
 */
@Component
public class AxisOrderResolver {

    /**
     * True for pairs that read as latitude/longitude rather than projected metres.
     */
    public boolean isLikelyGeographic(double first, double second) {
        double absFirst = Math.abs(first);
        double absSecond = Math.abs(second);
        return (absFirst <= 90 && absSecond <= 180) || (absFirst <= 90 && absSecond <= 90);
    }

    /**
     * @return the resolved order, or empty when the pair is geographic or no order fits
     */
    public Optional<AxisOrder> resolve(double first, double second) {
        if (isLikelyGeographic(first, second)) {
            return Optional.empty();
        }

        boolean firstIsEasting = isEasting(first);
        boolean firstIsNorthing = isNorthing(first);
        boolean secondIsEasting = isEasting(second);
        boolean secondIsNorthing = isNorthing(second);

        if (firstIsEasting && !firstIsNorthing && secondIsNorthing && !secondIsEasting) {
            return Optional.of(new AxisOrder(first, second));
        }
        if (firstIsNorthing && !firstIsEasting && secondIsEasting && !secondIsNorthing) {
            return Optional.of(new AxisOrder(second, first));
        }

        // One value in range, the other in neither range
        if (firstIsEasting && !secondIsEasting && !secondIsNorthing) {
            return Optional.of(new AxisOrder(first, second));
        }
        if (secondIsEasting && !firstIsEasting && !firstIsNorthing) {
            return Optional.of(new AxisOrder(second, first));
        }

        // Ambiguous: easting-first wins; the two warning conditions are intentionally not mirror images
        if (firstIsEasting && secondIsNorthing) {
            return Optional.of(new AxisOrder(
                    first, second, secondIsEasting ? CoordinateKeys.WARNING_AMBIGUOUS_ORDER : null));
        }
        if (firstIsNorthing && secondIsEasting) {
            return Optional.of(new AxisOrder(
                    second, first, firstIsEasting ? CoordinateKeys.WARNING_AMBIGUOUS_ORDER : null));
        }

        return Optional.empty();
    }
}
