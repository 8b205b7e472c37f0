package io.github.jakubt4.meridian.source;

import io.github.jakubt4.meridian.frame.OrbitalStateVector;
import io.github.jakubt4.meridian.frame.ReferenceFrame;
import org.hipparchus.geometry.euclidean.threed.Vector3D;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Reads the ephemeris data-line format {@code epoch x y z vx vy vz}: UTC epoch, position in km,
 * velocity in km/s, EME2000 axes. Trailing acceleration columns are ignored.
 */
final class StateVectorLines {

    private static final double KM = 1000.0;

    private StateVectorLines() {
    }

    static boolean looksLikeDataLine(final String line) {
        final var stripped = line.strip();
        return !stripped.isEmpty() && Character.isDigit(stripped.charAt(0)) && stripped.contains("T");
    }

    /**
     * @throws IllegalArgumentException if the line has fewer than seven fields or a field does not parse
     */
    static OrbitalStateVector parse(final String line) {
        final var fields = line.strip().split("\\s+");
        if (fields.length < 7) {
            throw new IllegalArgumentException(
                    "Expected 'epoch x y z vx vy vz', got " + fields.length + " fields");
        }
        final var timestamp = parseEpoch(fields[0]);
        final var values = new double[6];
        for (int i = 0; i < 6; i++) {
            try {
                values[i] = Double.parseDouble(fields[i + 1]);
            } catch (final NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number [" + fields[i + 1] + "]", e);
            }
        }
        return new OrbitalStateVector(
                new Vector3D(values[0] * KM, values[1] * KM, values[2] * KM),
                new Vector3D(values[3] * KM, values[4] * KM, values[5] * KM),
                timestamp,
                ReferenceFrame.J2000);
    }

    static Instant parseEpoch(final String text) {
        try {
            if (text.endsWith("Z") || text.matches(".*[+-]\\d{2}:\\d{2}$")) {
                return OffsetDateTime.parse(text).toInstant();
            }
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        } catch (final DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid epoch [" + text + "]", e);
        }
    }
}
