package io.github.jakubt4.meridian.frame;

/**
 * IAU-1976 precession angles in degrees.
 */
record PrecessionAngles(double z, double nu, double zeta) {

    static PrecessionAngles at(final double t) {
        final var t2 = t * t;
        final var t3 = t2 * t;
        return new PrecessionAngles(
                0.6406161388 * t + 3.04e-4 * t2 + 5.05e-6 * t3,
                0.5567530277 * t - 1.185e-4 * t2 - 1.162e-5 * t3,
                0.6406161388 * t + 8.385e-5 * t2 + 4.999e-6 * t3);
    }
}
