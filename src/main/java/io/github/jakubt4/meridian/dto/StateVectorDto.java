package io.github.jakubt4.meridian.dto;

import io.github.jakubt4.meridian.frame.OrbitalStateVector;
import io.github.jakubt4.meridian.frame.ReferenceFrame;

import java.time.Instant;

/**
 * Wire form of a state vector: meters and m/s as {@code [x, y, z]}.
 */
public record StateVectorDto(ReferenceFrame frame, Instant timestamp, double[] position, double[] velocity) {

    public static StateVectorDto from(final OrbitalStateVector osv) {
        if (osv == null) {
            return null;
        }
        return new StateVectorDto(osv.frame(), osv.timestamp(),
                osv.position().toArray(), osv.velocity().toArray());
    }
}
