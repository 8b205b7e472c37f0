package io.github.jakubt4.meridian.simulation;

import io.github.jakubt4.meridian.clock.SimulationClockState;
import io.github.jakubt4.meridian.fleet.FleetMemberState;
import io.github.jakubt4.meridian.frame.DisplayFrame;
import io.github.jakubt4.meridian.time.JulianTime;
import io.github.jakubt4.meridian.time.NutationTerms;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Immutable output of one frame.
 *
 * @param siderealAngle   Greenwich apparent sidereal time, degrees
 * @param primary         primary target, {@code null} when its source produced nothing this frame
 * @param activeFileIndex index of the loaded time-sliced TLE file, {@code -1} without a file set
 */
public record FrameSnapshot(long frameNumber,
                            Instant instant,
                            JulianTime julianTime,
                            NutationTerms nutation,
                            double siderealAngle,
                            DisplayFrame displayFrame,
                            SimulationClockState clock,
                            PrimaryTargetState primary,
                            List<FleetMemberState> fleet,
                            int activeFileIndex) {

    public FrameSnapshot {
        fleet = List.copyOf(fleet);
    }

    public Optional<PrimaryTargetState> primaryTarget() {
        return Optional.ofNullable(primary);
    }
}
