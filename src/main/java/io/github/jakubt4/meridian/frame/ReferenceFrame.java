package io.github.jakubt4.meridian.frame;

/**
 * Coordinate frames a state vector can be expressed in.
 */
public enum ReferenceFrame {
    /** True equator, mean equinox of date; SGP4 output. */
    TEME,
    /** Mean equator and equinox of J2000.0 (EME2000). */
    J2000,
    /** Mean of date, after precession. */
    MOD,
    /** Celestial ephemeris pole, true of date, after nutation. */
    CEP,
    /** Earth-centered Earth-fixed. */
    ECEF
}
