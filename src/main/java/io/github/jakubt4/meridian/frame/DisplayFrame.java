package io.github.jakubt4.meridian.frame;

import io.github.jakubt4.meridian.time.NutationTerms;

/**
 * Frame the render layer draws in.
 */
public enum DisplayFrame {
    INERTIAL,
    EARTH_FIXED;

    public OrbitalStateVector project(final OrbitalStateVector osvJ2000, final NutationTerms nutation) {
        return switch (this) {
            case INERTIAL -> osvJ2000.requireFrame(ReferenceFrame.J2000);
            case EARTH_FIXED -> FrameTransform.osvJ2000ToECEF(osvJ2000, nutation);
        };
    }
}
