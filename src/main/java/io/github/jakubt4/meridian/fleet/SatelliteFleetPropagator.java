package io.github.jakubt4.meridian.fleet;

import io.github.jakubt4.meridian.ephemeris.EphemerisAdapter;
import io.github.jakubt4.meridian.ephemeris.Satellite;
import io.github.jakubt4.meridian.frame.DisplayFrame;
import io.github.jakubt4.meridian.frame.FrameTransform;
import io.github.jakubt4.meridian.frame.OrbitalStateVector;
import io.github.jakubt4.meridian.frame.Wgs84;
import io.github.jakubt4.meridian.kepler.KeplerModel;
import io.github.jakubt4.meridian.time.NutationTerms;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Propagates every satellite of the roster to the frame instant.
 *
 * <p>SGP4 output is converted TEME → J2000 → display frame, and each satellite's state is updated
 * in place. A satellite that throws, returns no usable position or ends up beyond
 * {@link #MAX_RADIUS} is left out of the frame; the others are unaffected.
 */
@Slf4j
@Component
public class SatelliteFleetPropagator {

    /** Positions farther than 100 000 km from the geocenter are treated as propagation garbage. */
    static final double MAX_RADIUS = 1.0e8;

    private final EphemerisAdapter ephemerisAdapter;
    private final long quantizationSeconds;

    public SatelliteFleetPropagator(final EphemerisAdapter ephemerisAdapter,
                                    @Value("${meridian.fleet.quantization-seconds:10}") final long quantizationSeconds) {
        this.ephemerisAdapter = ephemerisAdapter;
        this.quantizationSeconds = quantizationSeconds;
    }

    public List<FleetMemberState> propagate(final List<Satellite> satellites, final Instant instant,
                                            final NutationTerms nutation, final DisplayFrame displayFrame) {
        final var states = new ArrayList<FleetMemberState>(satellites.size());
        var failed = 0;
        for (final var satellite : satellites) {
            try {
                final var teme = ephemerisAdapter.propagate(satellite, instant, quantizationSeconds);
                if (!isUsable(teme)) {
                    failed++;
                    log.debug("[{}] Unusable SGP4 position, skipped", satellite.getName());
                    continue;
                }
                states.add(update(satellite, teme, nutation, displayFrame));
            } catch (final RuntimeException e) {
                failed++;
                log.debug("[{}] Propagation error, skipped: {}", satellite.getName(), e.getMessage());
            }
        }
        if (failed > 0) {
            log.warn("Fleet frame at {}: {} of {} satellites skipped", instant, failed, satellites.size());
        }
        return states;
    }

    private static FleetMemberState update(final Satellite satellite, final OrbitalStateVector teme,
                                           final NutationTerms nutation, final DisplayFrame displayFrame) {
        final var j2000 = FrameTransform.osvTemeToJ2000(teme, nutation);
        final var display = displayFrame.project(j2000, nutation);
        final var ecef = FrameTransform.osvJ2000ToECEF(j2000, nutation);
        final var geodetic = Wgs84.toGeodetic(ecef.framedPosition());
        final var elements = KeplerModel.osvToKepler(j2000);

        satellite.updateState(j2000, display, elements, geodetic);
        return new FleetMemberState(satellite.getName(), satellite.getCatalogNumber(), display, geodetic,
                elements, satellite.getColor());
    }

    private static boolean isUsable(final OrbitalStateVector teme) {
        if (teme == null) {
            return false;
        }
        final var position = teme.position();
        return !position.isNaN() && !position.isInfinite() && position.getNorm() <= MAX_RADIUS;
    }
}
