package io.github.jakubt4.meridian.source;

import io.github.jakubt4.meridian.frame.OrbitalStateVector;

/**
 * Parses an operator-entered state vector, e.g.
 * {@code 2021-12-05T18:10:00.000 5326.946850 4182.210271 -611.867277 -3.371625 3.426754 -5.962081}.
 */
public final class ManualVectorParser {

    private ManualVectorParser() {
    }

    /**
     * @return J2000 state vector in meters and m/s
     * @throws IllegalArgumentException if the text is not a single well-formed data line
     */
    public static OrbitalStateVector parse(final String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("State vector text is empty");
        }
        final var lines = text.strip().lines().filter(line -> !line.isBlank()).toList();
        if (lines.size() != 1) {
            throw new IllegalArgumentException("Expected a single state vector line, got " + lines.size());
        }
        return StateVectorLines.parse(lines.get(0));
    }
}
