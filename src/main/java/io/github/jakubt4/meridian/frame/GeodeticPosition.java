package io.github.jakubt4.meridian.frame;

/**
 * WGS84 geodetic coordinates.
 *
 * @param latitude  geodetic latitude in degrees
 * @param longitude east longitude in degrees, {@code (-180, 180]}
 * @param altitude  height above the ellipsoid in meters
 */
public record GeodeticPosition(double latitude, double longitude, double altitude) {
}
