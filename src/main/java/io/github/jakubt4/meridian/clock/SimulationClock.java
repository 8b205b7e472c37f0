package io.github.jakubt4.meridian.clock;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Simulated time: a base instant plus an operator delta plus an accumulated warp offset.
 *
 * <p>{@link #advanceFrame()} is the only method that moves time on its own; everything else is an
 * explicit transition. Not thread-safe, owned by the frame thread.
 */
@Slf4j
public class SimulationClock {

    private final Clock wallClock;

    private ClockMode mode = ClockMode.IDLE;
    private Instant base;
    private ManualDelta manualDelta = ManualDelta.ZERO;
    private double warpOffsetSeconds;
    private double warpRate;
    private boolean warpEnabled;
    private boolean freeRunningRequested;

    public SimulationClock(final Clock wallClock, final double warpRate) {
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.warpRate = warpRate;
    }

    /**
     * Follows the wall clock from now on; epoch locks are ignored until manual time is set.
     */
    public void startFreeRunning() {
        freeRunningRequested = true;
        base = wallClock.instant();
        transitionTo(ClockMode.FREE_RUNNING);
    }

    /**
     * Follows the wall clock like {@link #startFreeRunning()}, but a later TLE set still locks the
     * clock to its epoch. Used for the startup default.
     */
    public void followWallClock() {
        base = wallClock.instant();
        transitionTo(ClockMode.FREE_RUNNING);
    }

    public void setManualTime(final Instant instant) {
        freeRunningRequested = false;
        base = Objects.requireNonNull(instant, "instant");
        transitionTo(ClockMode.MANUAL);
    }

    /**
     * Pins the base to a TLE epoch.
     *
     * @return {@code false} if free-running was requested and the lock was ignored
     */
    public boolean lockToEpoch(final Instant epoch) {
        if (freeRunningRequested) {
            log.debug("Epoch lock to {} ignored, clock is free-running", epoch);
            return false;
        }
        base = Objects.requireNonNull(epoch, "epoch");
        transitionTo(ClockMode.EPOCH_LOCKED);
        return true;
    }

    public void setManualDelta(final ManualDelta delta) {
        this.manualDelta = Objects.requireNonNull(delta, "delta");
    }

    /**
     * @param rate simulated seconds added per frame while warp is enabled; may be negative
     */
    public void setWarp(final boolean enabled, final double rate) {
        this.warpEnabled = enabled;
        this.warpRate = rate;
    }

    /**
     * Clears warp offset and manual delta and re-seeds the base from the wall clock. The clock keeps
     * following the wall clock if free-running was requested or is the current mode.
     */
    public void reset() {
        warpOffsetSeconds = 0.0;
        manualDelta = ManualDelta.ZERO;
        base = wallClock.instant();
        transitionTo(freeRunningRequested || mode == ClockMode.FREE_RUNNING
                ? ClockMode.FREE_RUNNING
                : ClockMode.MANUAL);
    }

    /**
     * Moves time by one frame: a free-running base follows the wall clock and, if warp is on,
     * the warp offset grows by the warp rate.
     */
    public void advanceFrame() {
        if (mode == ClockMode.IDLE) {
            return;
        }
        if (mode == ClockMode.FREE_RUNNING) {
            base = wallClock.instant();
        }
        if (warpEnabled) {
            warpOffsetSeconds += warpRate;
        }
    }

    /**
     * @throws IllegalStateException if no time source has been chosen yet
     */
    public Instant currentInstant() {
        if (mode == ClockMode.IDLE) {
            throw new IllegalStateException("Simulation clock is idle");
        }
        // whole seconds and fraction apart, a single nano count overflows after ~292 years
        final var wholeSeconds = Math.floor(warpOffsetSeconds);
        return base.plus(manualDelta.toDuration())
                .plusSeconds((long) wholeSeconds)
                .plusNanos(Math.round((warpOffsetSeconds - wholeSeconds) * 1e9));
    }

    public ClockMode mode() {
        return mode;
    }

    public SimulationClockState state() {
        return new SimulationClockState(mode, base, warpOffsetSeconds, manualDelta, warpRate, warpEnabled,
                freeRunningRequested);
    }

    private void transitionTo(final ClockMode next) {
        if (mode != next) {
            log.info("Simulation clock {} -> {}, base {}", mode, next, base);
            mode = next;
        }
    }
}
