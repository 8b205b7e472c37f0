package io.github.jakubt4.meridian.frame;

import io.github.jakubt4.meridian.math.Angles;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.orekit.utils.Constants;

/**
 * WGS84 ellipsoid conversions between Earth-fixed Cartesian and geodetic coordinates.
 */
public final class Wgs84 {

    public static final double EQUATORIAL_RADIUS = Constants.WGS84_EARTH_EQUATORIAL_RADIUS;
    public static final double FLATTENING = Constants.WGS84_EARTH_FLATTENING;
    public static final double POLAR_RADIUS = EQUATORIAL_RADIUS * (1.0 - FLATTENING);
    public static final double ECCENTRICITY_SQUARED = FLATTENING * (2.0 - FLATTENING);

    static final int LATITUDE_ITERATIONS = 5;
    private static final double POLAR_AXIS_THRESHOLD = 1e-6;

    private Wgs84() {
    }

    /**
     * Converts an ECEF position to geodetic coordinates.
     *
     * <p>Latitude is refined with a fixed five iterations and no convergence check, which keeps
     * the per-frame cost bounded; the residual error is far below a meter for orbital altitudes.
     */
    public static GeodeticPosition toGeodetic(final FramedPosition ecef) {
        final var r = ecef.requireFrame(ReferenceFrame.ECEF).position();
        final var x = r.getX();
        final var y = r.getY();
        final var z = r.getZ();

        final var longitude = Angles.atan2d(y, x);
        final var p = Math.hypot(x, y);
        if (p < POLAR_AXIS_THRESHOLD) {
            final var latitude = z < 0.0 ? -90.0 : 90.0;
            return new GeodeticPosition(latitude, longitude, Math.abs(z) - POLAR_RADIUS);
        }

        var latitude = Math.atan(z / ((1.0 - ECCENTRICITY_SQUARED) * p));
        var height = 0.0;
        for (int i = 0; i < LATITUDE_ITERATIONS; i++) {
            final var n = primeVerticalRadius(latitude);
            height = p / Math.cos(latitude) - n;
            latitude = Math.atan(z / ((1.0 - ECCENTRICITY_SQUARED * n / (n + height)) * p));
        }
        height = p / Math.cos(latitude) - primeVerticalRadius(latitude);

        return new GeodeticPosition(Math.toDegrees(latitude), longitude, height);
    }

    public static FramedPosition toCartesian(final GeodeticPosition geodetic) {
        final var lat = Math.toRadians(geodetic.latitude());
        final var lon = Math.toRadians(geodetic.longitude());
        final var n = primeVerticalRadius(lat);
        final var h = geodetic.altitude();

        return new FramedPosition(new Vector3D(
                (n + h) * Math.cos(lat) * Math.cos(lon),
                (n + h) * Math.cos(lat) * Math.sin(lon),
                (n * (1.0 - ECCENTRICITY_SQUARED) + h) * Math.sin(lat)),
                ReferenceFrame.ECEF);
    }

    private static double primeVerticalRadius(final double latitudeRadians) {
        final var sin = Math.sin(latitudeRadians);
        return EQUATORIAL_RADIUS / Math.sqrt(1.0 - ECCENTRICITY_SQUARED * sin * sin);
    }
}
