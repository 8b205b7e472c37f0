package io.github.jakubt4.meridian.source;

import io.github.jakubt4.meridian.ephemeris.Satellite;
import io.github.jakubt4.meridian.frame.OrbitalStateVector;

/**
 * Inputs available for the primary target in one frame. Any of them may be {@code null}.
 *
 * @param telemetry      latest complete telemetry state
 * @param ephemerisTable uploaded ephemeris
 * @param manualVector   operator state vector
 * @param tleSatellite   satellite whose TLE drives the TLE source
 */
public record PrimaryTargetSources(OrbitalStateVector telemetry,
                                   EphemerisTable ephemerisTable,
                                   OrbitalStateVector manualVector,
                                   Satellite tleSatellite) {
}
