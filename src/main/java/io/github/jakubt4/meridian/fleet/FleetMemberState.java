package io.github.jakubt4.meridian.fleet;

import io.github.jakubt4.meridian.ephemeris.DisplayColor;
import io.github.jakubt4.meridian.frame.GeodeticPosition;
import io.github.jakubt4.meridian.frame.OrbitalStateVector;
import io.github.jakubt4.meridian.kepler.KeplerianElements;

/**
 * State of one fleet satellite in one frame.
 */
public record FleetMemberState(String name,
                               String catalogNumber,
                               OrbitalStateVector displayState,
                               GeodeticPosition geodetic,
                               KeplerianElements elements,
                               DisplayColor color) {
}
