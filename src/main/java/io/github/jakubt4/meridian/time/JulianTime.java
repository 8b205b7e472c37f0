package io.github.jakubt4.meridian.time;

/**
 * Julian Date pair for one instant.
 *
 * @param jd Julian Date at 0h UT of the calendar day
 * @param jt Julian Date of the instant itself ({@code jd} plus the day fraction)
 */
public record JulianTime(double jd, double jt) {

    public static final double J2000 = 2451545.0;
    public static final double DAYS_PER_CENTURY = 36525.0;

    /**
     * Julian centuries of the instant since J2000.0.
     */
    public double centuries() {
        return (jt - J2000) / DAYS_PER_CENTURY;
    }

    /**
     * Julian centuries of 0h UT of the day since J2000.0, the argument of the GMST polynomial.
     */
    public double centuriesAtMidnight() {
        return (jd - J2000) / DAYS_PER_CENTURY;
    }

    public double daysSinceJ2000() {
        return jt - J2000;
    }

    public double dayFraction() {
        return jt - jd;
    }
}
