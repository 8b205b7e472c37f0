package io.github.jakubt4.meridian.frame;

import org.hipparchus.geometry.euclidean.threed.Vector3D;

import java.util.Objects;

public record FramedPosition(Vector3D position, ReferenceFrame frame) {

    public FramedPosition {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(frame, "frame");
    }

    public FramedPosition requireFrame(final ReferenceFrame expected) {
        if (frame != expected) {
            throw new IllegalArgumentException("Expected position in " + expected + " but got " + frame);
        }
        return this;
    }
}
