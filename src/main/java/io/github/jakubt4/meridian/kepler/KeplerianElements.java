package io.github.jakubt4.meridian.kepler;

import java.time.Instant;

/**
 * Osculating Keplerian elements. Angles in degrees, lengths in meters.
 *
 * @param semiMajorAxis        a (m)
 * @param eccentricity         e
 * @param inclination          i (deg)
 * @param raan                 right ascension of the ascending node Ω (deg)
 * @param argumentOfPeriapsis  ω (deg)
 * @param meanAnomaly          M at {@code epoch} (deg)
 * @param mu                   gravitational parameter (m³/s²)
 * @param epoch                instant the elements refer to
 */
public record KeplerianElements(double semiMajorAxis,
                                double eccentricity,
                                double inclination,
                                double raan,
                                double argumentOfPeriapsis,
                                double meanAnomaly,
                                double mu,
                                Instant epoch) {

    public double semiMinorAxis() {
        return semiMajorAxis * Math.sqrt(1.0 - eccentricity * eccentricity);
    }

    /**
     * Orbital period in seconds.
     */
    public double period() {
        return KeplerModel.computePeriod(semiMajorAxis, mu);
    }

    public boolean isElliptical() {
        return semiMajorAxis > 0.0 && eccentricity >= 0.0 && eccentricity < 1.0;
    }

    public KeplerianElements withEpoch(final Instant newEpoch, final double newMeanAnomaly) {
        return new KeplerianElements(semiMajorAxis, eccentricity, inclination, raan,
                argumentOfPeriapsis, newMeanAnomaly, mu, newEpoch);
    }
}
