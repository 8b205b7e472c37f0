package io.github.jakubt4.meridian.source;

import io.github.jakubt4.meridian.kepler.KeplerModel;
import io.github.jakubt4.meridian.kepler.KeplerianElements;

import java.time.Instant;

/**
 * Operator-supplied elements that replace the selected source. Angles in degrees, {@code a} in meters.
 */
public record KeplerOverride(double semiMajorAxis,
                             double eccentricity,
                             double inclination,
                             double raan,
                             double argumentOfPeriapsis,
                             double meanAnomaly) {

    /**
     * Elements with the frame instant as epoch, so {@link #meanAnomaly()} is the anomaly shown.
     */
    public KeplerianElements toElements(final Instant epoch) {
        return new KeplerianElements(semiMajorAxis, eccentricity, inclination, raan,
                argumentOfPeriapsis, meanAnomaly, KeplerModel.EARTH_MU, epoch);
    }

    public static KeplerOverride of(final KeplerianElements elements) {
        return new KeplerOverride(elements.semiMajorAxis(), elements.eccentricity(), elements.inclination(),
                elements.raan(), elements.argumentOfPeriapsis(), elements.meanAnomaly());
    }
}
