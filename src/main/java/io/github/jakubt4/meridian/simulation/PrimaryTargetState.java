package io.github.jakubt4.meridian.simulation;

import io.github.jakubt4.meridian.frame.GeodeticPosition;
import io.github.jakubt4.meridian.frame.OrbitalStateVector;
import io.github.jakubt4.meridian.kepler.KeplerianElements;
import io.github.jakubt4.meridian.source.DataSource;

import java.util.List;

/**
 * Primary target in one frame.
 *
 * @param catalogNumber NORAD number of a TLE primary, otherwise {@code null}
 * @param raw          state as delivered by the data source
 * @param stateJ2000   state at the frame instant
 * @param displayState {@code stateJ2000} in the display frame
 * @param stateEcef    {@code stateJ2000} in ECEF
 * @param trail        orbit trail in the display frame, empty when disabled
 */
public record PrimaryTargetState(String name,
                                 String catalogNumber,
                                 DataSource source,
                                 OrbitalStateVector raw,
                                 OrbitalStateVector stateJ2000,
                                 OrbitalStateVector displayState,
                                 OrbitalStateVector stateEcef,
                                 KeplerianElements elements,
                                 GeodeticPosition geodetic,
                                 List<OrbitalStateVector> trail) {
}
