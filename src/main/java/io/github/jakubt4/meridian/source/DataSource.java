package io.github.jakubt4.meridian.source;

/**
 * Where the primary target's state comes from.
 */
public enum DataSource {
    /** Live telemetry state vectors, Kepler-propagated. */
    TELEMETRY,
    /** Closest entry of an uploaded ephemeris table, Kepler-propagated. */
    EPHEMERIS_TABLE,
    /** SGP4 on the primary TLE. */
    TWO_LINE_ELEMENTS,
    /** Operator-entered state vector, Kepler-propagated. */
    MANUAL_VECTOR
}
