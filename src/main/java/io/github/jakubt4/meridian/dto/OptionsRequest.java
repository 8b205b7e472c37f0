package io.github.jakubt4.meridian.dto;

import io.github.jakubt4.meridian.frame.DisplayFrame;
import io.github.jakubt4.meridian.source.DataSource;
import io.github.jakubt4.meridian.source.KeplerOverride;

/**
 * Partial update of the simulation options; {@code null} fields are left unchanged.
 *
 * @param clearKeplerOverride drop a previously set override
 */
public record OptionsRequest(DataSource dataSource,
                             DisplayFrame displayFrame,
                             Boolean fleetEnabled,
                             Boolean trailEnabled,
                             Double trailOrbitsBefore,
                             Double trailOrbitsAfter,
                             Integer trailPointsPerOrbit,
                             KeplerOverride keplerOverride,
                             boolean clearKeplerOverride) {
}
