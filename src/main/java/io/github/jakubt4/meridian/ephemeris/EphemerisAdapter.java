package io.github.jakubt4.meridian.ephemeris;

import io.github.jakubt4.meridian.frame.OrbitalStateVector;

import java.time.Instant;

/**
 * Seam to the external SGP4 propagator.
 */
public interface EphemerisAdapter {

    /**
     * Parses a TLE and prepares its propagator.
     *
     * @throws IllegalArgumentException if the lines fail the format or checksum check
     * @throws org.orekit.errors.OrekitException if the lines cannot be parsed
     */
    Satellite createSatellite(String name, String line1, String line2, DisplayColor color);

    /**
     * Propagates the satellite's TLE.
     *
     * @param quantizationSeconds when positive, {@code instant} is floored to a bucket of this width
     *                            and the result is reused for every instant in the same bucket
     * @return position (m) and velocity (m/s) in {@link io.github.jakubt4.meridian.frame.ReferenceFrame#TEME}
     */
    OrbitalStateVector propagate(Satellite satellite, Instant instant, long quantizationSeconds);
}
