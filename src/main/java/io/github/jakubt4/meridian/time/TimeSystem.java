package io.github.jakubt4.meridian.time;

import io.github.jakubt4.meridian.math.Angles;

import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Julian date, sidereal time and nutation computations.
 *
 * <p>Julian dates follow Meeus, <i>Astronomical Algorithms</i> ch. 7 (Gregorian calendar).
 * GMST uses the IAU-1982 polynomial, nutation the four-term short series of ch. 22 and the
 * mean obliquity the IAU-1976 polynomial. All functions are pure.
 */
public final class TimeSystem {

    private static final double SECONDS_PER_DAY = 86400.0;
    private static final double ARCSEC_PER_DEGREE = 3600.0;
    private static final double SIDEREAL_RATE = 1.00273790935;
    private static final Instant J2000_INSTANT = Instant.parse("2000-01-01T12:00:00Z");

    private TimeSystem() {
    }

    public static JulianTime computeJulianTime(final Instant instant) {
        final var utc = instant.atOffset(ZoneOffset.UTC);
        var year = utc.getYear();
        var month = utc.getMonthValue();
        final var day = utc.getDayOfMonth();

        if (month <= 2) {
            year -= 1;
            month += 12;
        }
        final var a = Math.floor(year / 100.0);
        final var b = 2 - a + Math.floor(a / 4.0);
        final var jd = Math.floor(365.25 * (year + 4716))
                + Math.floor(30.6001 * (month + 1))
                + day + b - 1524.5;

        final var secondsOfDay = utc.getHour() * 3600.0
                + utc.getMinute() * 60.0
                + utc.getSecond()
                + (utc.getNano() / 1_000_000) / 1000.0;
        return new JulianTime(jd, jd + secondsOfDay / SECONDS_PER_DAY);
    }

    /**
     * Inverse of {@link #computeJulianTime}, rounded to the millisecond.
     */
    public static Instant julianToInstant(final double jt) {
        final var millis = Math.round((jt - JulianTime.J2000) * SECONDS_PER_DAY * 1000.0);
        return J2000_INSTANT.plusMillis(millis);
    }

    public static double centuries(final double jt) {
        return (jt - JulianTime.J2000) / JulianTime.DAYS_PER_CENTURY;
    }

    public static double daysSinceJ2000(final double jt) {
        return jt - JulianTime.J2000;
    }

    /**
     * Sidereal angle at the given longitude.
     *
     * @param longitude east longitude in degrees, 0 for Greenwich
     * @param jd        Julian Date at 0h UT
     * @param jt        Julian Date of the instant
     * @param nutation  when present the equation of the equinoxes is added (apparent time),
     *                  when {@code null} the result is mean sidereal time
     * @return angle in degrees, within {@code [0, 360)}
     */
    public static double computeSiderealTime(final double longitude, final double jd, final double jt,
                                             final NutationTerms nutation) {
        final var t0 = (jd - JulianTime.J2000) / JulianTime.DAYS_PER_CENTURY;
        final var gmstMidnightSeconds = 24110.54841
                + 8640184.812866 * t0
                + 0.093104 * t0 * t0
                - 6.2e-6 * t0 * t0 * t0;

        var theta = gmstMidnightSeconds / 240.0
                + SIDEREAL_RATE * 360.0 * (jt - jd)
                + longitude;
        if (nutation != null) {
            theta += nutation.equationOfEquinoxes();
        }
        return Angles.normalizeDegrees(theta);
    }

    public static double computeSiderealTime(final double longitude, final JulianTime julianTime,
                                             final NutationTerms nutation) {
        return computeSiderealTime(longitude, julianTime.jd(), julianTime.jt(), nutation);
    }

    /**
     * Nutation terms at {@code t} Julian centuries since J2000.0.
     */
    public static NutationTerms nutationTerms(final double t) {
        final var omega = 125.04452 - 1934.136261 * t;
        final var sunLongitude = 280.4665 + 36000.7698 * t;
        final var moonLongitude = 218.3165 + 481267.8813 * t;

        final var dpsiArcsec = -17.20 * Angles.sind(omega)
                - 1.32 * Angles.sind(2 * sunLongitude)
                - 0.23 * Angles.sind(2 * moonLongitude)
                + 0.21 * Angles.sind(2 * omega);
        final var depsArcsec = 9.20 * Angles.cosd(omega)
                + 0.57 * Angles.cosd(2 * sunLongitude)
                + 0.10 * Angles.cosd(2 * moonLongitude)
                - 0.09 * Angles.cosd(2 * omega);
        final var epsArcsec = 84381.448
                - 46.8150 * t
                - 0.00059 * t * t
                + 0.001813 * t * t * t;

        return new NutationTerms(
                dpsiArcsec / ARCSEC_PER_DEGREE,
                depsArcsec / ARCSEC_PER_DEGREE,
                epsArcsec / ARCSEC_PER_DEGREE);
    }

    public static NutationTerms nutationTerms(final JulianTime julianTime) {
        return nutationTerms(julianTime.centuries());
    }
}
