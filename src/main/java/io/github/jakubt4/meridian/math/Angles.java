package io.github.jakubt4.meridian.math;

/**
 * Degree-based trigonometry used throughout the orbital mechanics code.
 */
public final class Angles {

    private Angles() {
    }

    public static double sind(final double degrees) {
        return Math.sin(Math.toRadians(degrees));
    }

    public static double cosd(final double degrees) {
        return Math.cos(Math.toRadians(degrees));
    }

    public static double acosd(final double value) {
        // clamp rounding noise so |value| slightly above 1 does not yield NaN
        return Math.toDegrees(Math.acos(Math.max(-1.0, Math.min(1.0, value))));
    }

    public static double atan2d(final double y, final double x) {
        return Math.toDegrees(Math.atan2(y, x));
    }

    /**
     * Wraps an angle into {@code [0, 360)}.
     */
    public static double normalizeDegrees(final double degrees) {
        final var wrapped = degrees % 360.0;
        return wrapped < 0.0 ? wrapped + 360.0 : wrapped;
    }
}
