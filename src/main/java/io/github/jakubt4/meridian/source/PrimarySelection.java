package io.github.jakubt4.meridian.source;

import io.github.jakubt4.meridian.frame.OrbitalStateVector;
import io.github.jakubt4.meridian.kepler.KeplerianElements;

/**
 * Primary target state for one frame.
 *
 * @param catalogNumber NORAD number when the state comes from a TLE, otherwise {@code null}
 * @param raw        state as delivered by the source, before propagation
 * @param elements   osculating elements used for propagation and the orbit trail
 * @param propagated J2000 state at the frame instant
 */
public record PrimarySelection(String targetName,
                               String catalogNumber,
                               DataSource source,
                               OrbitalStateVector raw,
                               KeplerianElements elements,
                               OrbitalStateVector propagated) {
}
