package io.github.jakubt4.meridian;

import io.github.jakubt4.meridian.clock.ClockMode;
import io.github.jakubt4.meridian.clock.ManualDelta;
import io.github.jakubt4.meridian.clock.SimulationClockState;
import io.github.jakubt4.meridian.ephemeris.DisplayColor;
import io.github.jakubt4.meridian.fleet.FleetMemberState;
import io.github.jakubt4.meridian.frame.DisplayFrame;
import io.github.jakubt4.meridian.frame.FrameTransform;
import io.github.jakubt4.meridian.frame.Wgs84;
import io.github.jakubt4.meridian.kepler.KeplerModel;
import io.github.jakubt4.meridian.simulation.FrameSnapshot;
import io.github.jakubt4.meridian.simulation.PrimaryTargetState;
import io.github.jakubt4.meridian.source.DataSource;
import io.github.jakubt4.meridian.source.TelemetryFeed;
import io.github.jakubt4.meridian.time.TimeSystem;

import java.util.List;

/**
 * Frame snapshot built from the reference ISS telemetry state, for web-layer tests.
 */
public final class TestFrames {

    private TestFrames() {
    }

    public static FrameSnapshot issFrame(final long frameNumber) {
        final var osv = TelemetryFeed.ISS_SAMPLE;
        final var instant = osv.timestamp();
        final var julianTime = TimeSystem.computeJulianTime(instant);
        final var nutation = TimeSystem.nutationTerms(julianTime);
        final var ecef = FrameTransform.osvJ2000ToECEF(osv, nutation);
        final var geodetic = Wgs84.toGeodetic(ecef.framedPosition());
        final var elements = KeplerModel.osvToKepler(osv);

        final var primary = new PrimaryTargetState("ISS", null, DataSource.TELEMETRY, osv, osv, osv, ecef,
                elements, geodetic, List.of(osv, osv));
        final var fleetMember = new FleetMemberState("ISS (ZARYA)", "25544", osv, geodetic, elements,
                new DisplayColor(255, 0, 0));

        return new FrameSnapshot(
                frameNumber,
                instant,
                julianTime,
                nutation,
                TimeSystem.computeSiderealTime(0.0, julianTime, nutation),
                DisplayFrame.INERTIAL,
                new SimulationClockState(ClockMode.MANUAL, instant, 0.0, ManualDelta.ZERO, 1.0, false, false),
                primary,
                List.of(fleetMember),
                -1);
    }
}
