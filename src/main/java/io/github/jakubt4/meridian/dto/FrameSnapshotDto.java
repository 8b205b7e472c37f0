package io.github.jakubt4.meridian.dto;

import io.github.jakubt4.meridian.clock.SimulationClockState;
import io.github.jakubt4.meridian.ephemeris.DisplayColor;
import io.github.jakubt4.meridian.fleet.FleetMemberState;
import io.github.jakubt4.meridian.frame.DisplayFrame;
import io.github.jakubt4.meridian.frame.GeodeticPosition;
import io.github.jakubt4.meridian.kepler.KeplerianElements;
import io.github.jakubt4.meridian.simulation.FrameSnapshot;
import io.github.jakubt4.meridian.simulation.PrimaryTargetState;
import io.github.jakubt4.meridian.source.DataSource;
import io.github.jakubt4.meridian.time.NutationTerms;

import java.time.Instant;
import java.util.List;

/**
 * JSON form of a {@link FrameSnapshot}, shared by the REST API and the render-layer publisher.
 */
public record FrameSnapshotDto(long frameNumber,
                               Instant instant,
                               double julianDate,
                               double julianTime,
                               NutationTerms nutation,
                               double siderealAngle,
                               DisplayFrame displayFrame,
                               SimulationClockState clock,
                               PrimaryTarget primary,
                               List<FleetMember> fleet,
                               int activeFileIndex) {

    public record PrimaryTarget(String name,
                                String catalogNumber,
                                DataSource source,
                                StateVectorDto raw,
                                StateVectorDto stateJ2000,
                                StateVectorDto displayState,
                                StateVectorDto stateEcef,
                                KeplerianElements elements,
                                GeodeticPosition geodetic,
                                List<double[]> trail) {
    }

    public record FleetMember(String name,
                              String catalogNumber,
                              StateVectorDto displayState,
                              GeodeticPosition geodetic,
                              DisplayColor color) {
    }

    public static FrameSnapshotDto from(final FrameSnapshot snapshot) {
        return new FrameSnapshotDto(
                snapshot.frameNumber(),
                snapshot.instant(),
                snapshot.julianTime().jd(),
                snapshot.julianTime().jt(),
                snapshot.nutation(),
                snapshot.siderealAngle(),
                snapshot.displayFrame(),
                snapshot.clock(),
                snapshot.primaryTarget().map(FrameSnapshotDto::toPrimary).orElse(null),
                snapshot.fleet().stream().map(FrameSnapshotDto::toFleetMember).toList(),
                snapshot.activeFileIndex());
    }

    private static PrimaryTarget toPrimary(final PrimaryTargetState primary) {
        return new PrimaryTarget(
                primary.name(),
                primary.catalogNumber(),
                primary.source(),
                StateVectorDto.from(primary.raw()),
                StateVectorDto.from(primary.stateJ2000()),
                StateVectorDto.from(primary.displayState()),
                StateVectorDto.from(primary.stateEcef()),
                primary.elements(),
                primary.geodetic(),
                primary.trail().stream().map(point -> point.position().toArray()).toList());
    }

    private static FleetMember toFleetMember(final FleetMemberState member) {
        return new FleetMember(
                member.name(),
                member.catalogNumber(),
                StateVectorDto.from(member.displayState()),
                member.geodetic(),
                member.color());
    }
}
