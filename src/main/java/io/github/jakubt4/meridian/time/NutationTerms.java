package io.github.jakubt4.meridian.time;

import io.github.jakubt4.meridian.math.Angles;

/**
 * Nutation in longitude and obliquity plus the mean obliquity of the ecliptic, all in degrees.
 */
public record NutationTerms(double dpsi, double deps, double eps) {

    public double trueObliquity() {
        return eps + deps;
    }

    /**
     * Equation of the equinoxes, the GMST to GAST correction.
     */
    public double equationOfEquinoxes() {
        return dpsi * Angles.cosd(eps);
    }
}
