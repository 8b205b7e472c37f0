package io.github.jakubt4.meridian.clock;

import java.time.Instant;

/**
 * Read-only view of a {@link SimulationClock}.
 */
public record SimulationClockState(ClockMode mode,
                                   Instant base,
                                   double warpOffsetSeconds,
                                   ManualDelta manualDelta,
                                   double warpRate,
                                   boolean warpEnabled,
                                   boolean freeRunningRequested) {
}
