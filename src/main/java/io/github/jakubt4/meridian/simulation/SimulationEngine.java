package io.github.jakubt4.meridian.simulation;

import io.github.jakubt4.meridian.clock.ClockMode;
import io.github.jakubt4.meridian.fleet.FleetMemberState;
import io.github.jakubt4.meridian.fleet.SatelliteFleetPropagator;
import io.github.jakubt4.meridian.frame.DisplayFrame;
import io.github.jakubt4.meridian.frame.FrameTransform;
import io.github.jakubt4.meridian.frame.OrbitalStateVector;
import io.github.jakubt4.meridian.frame.Wgs84;
import io.github.jakubt4.meridian.kepler.KeplerModel;
import io.github.jakubt4.meridian.source.DataSourceSelector;
import io.github.jakubt4.meridian.source.PrimarySelection;
import io.github.jakubt4.meridian.time.NutationTerms;
import io.github.jakubt4.meridian.time.TimeSystem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * One pass of the frame pipeline.
 *
 * <p>Order per frame: queued commands, clock advance, file switch, time and nutation, primary
 * target, fleet. Primary and fleet are evaluated at the same instant with the same nutation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SimulationEngine {

    private final DataSourceSelector dataSourceSelector;
    private final SatelliteFleetPropagator fleetPropagator;

    private long frameCounter;

    /**
     * @return the frame's snapshot, or empty while the clock is idle
     */
    public Optional<FrameSnapshot> advanceFrame(final SimulationContext context) {
        context.drainCommands();

        final var clock = context.getClock();
        if (clock.mode() == ClockMode.IDLE) {
            log.debug("WAITING_FOR_TIME — Clock idle, frame skipped");
            return Optional.empty();
        }
        clock.advanceFrame();
        final var instant = clock.currentInstant();

        final var switcher = context.getFileSwitcher();
        if (switcher != null && switcher.switchIfNeeded(instant)) {
            context.onFileSwitched(switcher.active());
        }

        final var julianTime = TimeSystem.computeJulianTime(instant);
        final var nutation = TimeSystem.nutationTerms(julianTime);
        final var siderealAngle = TimeSystem.computeSiderealTime(0.0, julianTime, nutation);

        final var options = context.getOptions();
        final var displayFrame = options.getDisplayFrame();

        final var primary = dataSourceSelector
                .select(options.getDataSource(), context.primarySources(), instant, nutation,
                        options.getKeplerOverride())
                .map(selection -> toPrimaryState(selection, instant, nutation, options))
                .orElse(null);

        final var fleet = options.isFleetEnabled()
                ? fleetPropagator.propagate(context.fleetMembers(), instant, nutation, displayFrame)
                : List.<FleetMemberState>of();

        final var snapshot = new FrameSnapshot(
                ++frameCounter,
                instant,
                julianTime,
                nutation,
                siderealAngle,
                displayFrame,
                clock.state(),
                primary,
                fleet,
                context.activeFileIndex());

        log.debug("Frame {} at {} — primary [{}], {} fleet satellites",
                snapshot.frameNumber(), instant, primary == null ? "NONE" : primary.name(), fleet.size());
        return Optional.of(snapshot);
    }

    private static PrimaryTargetState toPrimaryState(final PrimarySelection selection, final Instant instant,
                                                     final NutationTerms nutation, final SimulationOptions options) {
        final DisplayFrame displayFrame = options.getDisplayFrame();
        final var j2000 = selection.propagated();
        final var ecef = FrameTransform.osvJ2000ToECEF(j2000, nutation);
        final var geodetic = Wgs84.toGeodetic(ecef.framedPosition());

        final var trail = options.isTrailEnabled()
                ? KeplerModel.sampleTrail(selection.elements(), instant,
                        options.getTrailOrbitsBefore(), options.getTrailOrbitsAfter(),
                        options.getTrailPointsPerOrbit())
                    .stream()
                    .map(point -> displayFrame.project(point, nutation))
                    .toList()
                : List.<OrbitalStateVector>of();

        return new PrimaryTargetState(
                selection.targetName(),
                selection.catalogNumber(),
                selection.source(),
                selection.raw(),
                j2000,
                displayFrame.project(j2000, nutation),
                ecef,
                selection.elements(),
                geodetic,
                trail);
    }
}
