package io.github.jakubt4.meridian.frame;

import org.hipparchus.geometry.euclidean.threed.Vector3D;

import java.time.Instant;
import java.util.Objects;

/**
 * Position (m) and velocity (m/s) at an instant, tagged with the frame they are expressed in.
 */
public record OrbitalStateVector(Vector3D position, Vector3D velocity, Instant timestamp, ReferenceFrame frame) {

    public OrbitalStateVector {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(velocity, "velocity");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(frame, "frame");
    }

    /**
     * @throws IllegalArgumentException if this vector is not expressed in {@code expected}
     */
    public OrbitalStateVector requireFrame(final ReferenceFrame expected) {
        if (frame != expected) {
            throw new IllegalArgumentException(
                    "Expected state vector in " + expected + " but got " + frame);
        }
        return this;
    }

    public FramedPosition framedPosition() {
        return new FramedPosition(position, frame);
    }

    public double radius() {
        return position.getNorm();
    }
}
