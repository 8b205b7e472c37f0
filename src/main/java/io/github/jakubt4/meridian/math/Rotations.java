package io.github.jakubt4.meridian.math;

import org.hipparchus.geometry.euclidean.threed.Vector3D;

/**
 * Active (vector) rotations about the coordinate axes, angles in degrees.
 *
 * <p>A frame rotation {@code R3(θ)} is the active rotation {@code rotZ(v, -θ)}; the
 * precession, nutation and Earth-rotation chains are written in terms of these.
 */
public final class Rotations {

    private Rotations() {
    }

    public static Vector3D rotX(final Vector3D v, final double degrees) {
        final var c = Angles.cosd(degrees);
        final var s = Angles.sind(degrees);
        return new Vector3D(
                v.getX(),
                c * v.getY() - s * v.getZ(),
                s * v.getY() + c * v.getZ());
    }

    public static Vector3D rotY(final Vector3D v, final double degrees) {
        final var c = Angles.cosd(degrees);
        final var s = Angles.sind(degrees);
        return new Vector3D(
                c * v.getX() + s * v.getZ(),
                v.getY(),
                -s * v.getX() + c * v.getZ());
    }

    public static Vector3D rotZ(final Vector3D v, final double degrees) {
        final var c = Angles.cosd(degrees);
        final var s = Angles.sind(degrees);
        return new Vector3D(
                c * v.getX() - s * v.getY(),
                s * v.getX() + c * v.getY(),
                v.getZ());
    }
}
