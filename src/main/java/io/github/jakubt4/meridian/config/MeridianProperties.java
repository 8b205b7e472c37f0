package io.github.jakubt4.meridian.config;

import io.github.jakubt4.meridian.frame.DisplayFrame;
import io.github.jakubt4.meridian.kepler.KeplerModel;
import io.github.jakubt4.meridian.source.DataSource;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * {@code meridian.*} startup settings. Runtime changes go through {@code /api/simulation}.
 */
@ConfigurationProperties(prefix = "meridian")
public record MeridianProperties(@DefaultValue Simulation simulation,
                                 @DefaultValue Trail trail,
                                 @DefaultValue Fleet fleet) {

    /**
     * @param freeRunning start on the wall clock until a TLE set locks the clock to its epoch; when
     *                    {@code false} and {@code manualTime} is set the clock starts there, otherwise it
     *                    stays idle until a TLE set is loaded
     * @param manualTime  ISO-8601 instant, e.g. {@code 2021-12-22T12:00:00Z}
     * @param warpRate    simulated seconds added per frame while warp is enabled
     */
    public record Simulation(@DefaultValue("TWO_LINE_ELEMENTS") DataSource dataSource,
                             @DefaultValue("INERTIAL") DisplayFrame displayFrame,
                             @DefaultValue("true") boolean freeRunning,
                             String manualTime,
                             @DefaultValue("false") boolean warpEnabled,
                             @DefaultValue("1.0") double warpRate) {
    }

    public record Trail(@DefaultValue("true") boolean enabled,
                        @DefaultValue("0.5") double orbitsBefore,
                        @DefaultValue("0.5") double orbitsAfter,
                        @DefaultValue("120") int pointsPerOrbit) {

        public Trail {
            if (!isSpan(orbitsBefore) || !isSpan(orbitsAfter)) {
                throw new IllegalArgumentException(
                        "meridian.trail orbits must be between 0 and " + KeplerModel.MAX_TRAIL_ORBITS);
            }
            if (pointsPerOrbit <= 0 || pointsPerOrbit > KeplerModel.MAX_TRAIL_POINTS) {
                throw new IllegalArgumentException(
                        "meridian.trail.points-per-orbit must be between 1 and " + KeplerModel.MAX_TRAIL_POINTS);
            }
        }

        private static boolean isSpan(final double orbits) {
            return Double.isFinite(orbits) && orbits >= 0.0 && orbits <= KeplerModel.MAX_TRAIL_ORBITS;
        }
    }

    public record Fleet(@DefaultValue("true") boolean enabled) {
    }
}
