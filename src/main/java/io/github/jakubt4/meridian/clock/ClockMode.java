package io.github.jakubt4.meridian.clock;

public enum ClockMode {
    /** No time source chosen yet; the clock cannot be read. */
    IDLE,
    /** Base follows the wall clock every frame. */
    FREE_RUNNING,
    /** Base set by the operator. */
    MANUAL,
    /** Base pinned to the epoch of the loaded TLE set. */
    EPOCH_LOCKED
}
