package io.github.jakubt4.meridian.frame;

import io.github.jakubt4.meridian.time.JulianTime;
import io.github.jakubt4.meridian.time.NutationTerms;
import io.github.jakubt4.meridian.time.TimeSystem;
import org.hipparchus.geometry.euclidean.threed.Vector3D;

import static io.github.jakubt4.meridian.math.Rotations.rotX;
import static io.github.jakubt4.meridian.math.Rotations.rotY;
import static io.github.jakubt4.meridian.math.Rotations.rotZ;

/**
 * Rotation chain J2000 → MOD → CEP → ECEF → WGS84 and its inverse.
 *
 * <p>Precession is IAU-1976, nutation the short series from {@link TimeSystem#nutationTerms},
 * Earth rotation uses apparent sidereal time. Every method validates the frame tag of its input.
 * A {@code null} nutation argument is replaced by nutation computed at the vector's timestamp.
 */
public final class FrameTransform {

    /** Earth rotation rate, rad/s. */
    public static final double EARTH_ROTATION_RATE = Math.toRadians(360.985647366 / 86400.0);

    private FrameTransform() {
    }

    // --- state vectors --------------------------------------------------------------------------

    public static OrbitalStateVector osvJ2000ToCEP(final OrbitalStateVector osv, final NutationTerms nutation) {
        osv.requireFrame(ReferenceFrame.J2000);
        final var julianTime = TimeSystem.computeJulianTime(osv.timestamp());
        final var n = nutationOrCompute(nutation, julianTime);
        final var precession = PrecessionAngles.at(julianTime.centuries());

        return new OrbitalStateVector(
                nutate(precess(osv.position(), precession), n),
                nutate(precess(osv.velocity(), precession), n),
                osv.timestamp(),
                ReferenceFrame.CEP);
    }

    public static OrbitalStateVector osvCEPToJ2000(final OrbitalStateVector osv, final NutationTerms nutation) {
        osv.requireFrame(ReferenceFrame.CEP);
        final var julianTime = TimeSystem.computeJulianTime(osv.timestamp());
        final var n = nutationOrCompute(nutation, julianTime);
        final var precession = PrecessionAngles.at(julianTime.centuries());

        return new OrbitalStateVector(
                unprecess(unnutate(osv.position(), n), precession),
                unprecess(unnutate(osv.velocity(), n), precession),
                osv.timestamp(),
                ReferenceFrame.J2000);
    }

    public static OrbitalStateVector osvJ2000ToECEF(final OrbitalStateVector osv, final NutationTerms nutation) {
        osv.requireFrame(ReferenceFrame.J2000);
        final var julianTime = TimeSystem.computeJulianTime(osv.timestamp());
        final var n = nutationOrCompute(nutation, julianTime);
        final var cep = osvJ2000ToCEP(osv, n);
        final var gast = TimeSystem.computeSiderealTime(0.0, julianTime, n);

        final var rEcef = rotZ(cep.position(), -gast);
        final var vRotated = rotZ(cep.velocity(), -gast);
        final var vEcef = vRotated.add(new Vector3D(
                EARTH_ROTATION_RATE * rEcef.getY(),
                -EARTH_ROTATION_RATE * rEcef.getX(),
                0.0));

        return new OrbitalStateVector(rEcef, vEcef, osv.timestamp(), ReferenceFrame.ECEF);
    }

    public static OrbitalStateVector osvEcefToJ2000(final OrbitalStateVector osv, final NutationTerms nutation) {
        osv.requireFrame(ReferenceFrame.ECEF);
        final var julianTime = TimeSystem.computeJulianTime(osv.timestamp());
        final var n = nutationOrCompute(nutation, julianTime);
        final var gast = TimeSystem.computeSiderealTime(0.0, julianTime, n);

        final var rEcef = osv.position();
        final var vRotated = osv.velocity().subtract(new Vector3D(
                EARTH_ROTATION_RATE * rEcef.getY(),
                -EARTH_ROTATION_RATE * rEcef.getX(),
                0.0));
        final var cep = new OrbitalStateVector(
                rotZ(rEcef, gast),
                rotZ(vRotated, gast),
                osv.timestamp(),
                ReferenceFrame.CEP);

        return osvCEPToJ2000(cep, n);
    }

    /**
     * Converts SGP4 output to J2000: TEME to true-of-date through the equation of the
     * equinoxes, then inverse nutation and inverse precession.
     */
    public static OrbitalStateVector osvTemeToJ2000(final OrbitalStateVector osv, final NutationTerms nutation) {
        osv.requireFrame(ReferenceFrame.TEME);
        final var julianTime = TimeSystem.computeJulianTime(osv.timestamp());
        final var n = nutationOrCompute(nutation, julianTime);
        final var equationOfEquinoxes = n.equationOfEquinoxes();

        final var trueOfDate = new OrbitalStateVector(
                rotZ(osv.position(), equationOfEquinoxes),
                rotZ(osv.velocity(), equationOfEquinoxes),
                osv.timestamp(),
                ReferenceFrame.CEP);
        return osvCEPToJ2000(trueOfDate, n);
    }

    // --- positions ------------------------------------------------------------------------------

    public static FramedPosition posJ2000ToCEP(final FramedPosition position, final JulianTime julianTime,
                                               final NutationTerms nutation) {
        position.requireFrame(ReferenceFrame.J2000);
        final var n = nutationOrCompute(nutation, julianTime);
        final var precession = PrecessionAngles.at(julianTime.centuries());
        return new FramedPosition(nutate(precess(position.position(), precession), n), ReferenceFrame.CEP);
    }

    public static FramedPosition posCEPToJ2000(final FramedPosition position, final JulianTime julianTime,
                                               final NutationTerms nutation) {
        position.requireFrame(ReferenceFrame.CEP);
        final var n = nutationOrCompute(nutation, julianTime);
        final var precession = PrecessionAngles.at(julianTime.centuries());
        return new FramedPosition(unprecess(unnutate(position.position(), n), precession), ReferenceFrame.J2000);
    }

    /**
     * @param siderealAngle Greenwich apparent sidereal time in degrees
     */
    public static FramedPosition posCEPToECEF(final FramedPosition position, final double siderealAngle) {
        position.requireFrame(ReferenceFrame.CEP);
        return new FramedPosition(rotZ(position.position(), -siderealAngle), ReferenceFrame.ECEF);
    }

    public static FramedPosition posECEFToCEP(final FramedPosition position, final double siderealAngle) {
        position.requireFrame(ReferenceFrame.ECEF);
        return new FramedPosition(rotZ(position.position(), siderealAngle), ReferenceFrame.CEP);
    }

    public static GeodeticPosition cartToWgs84(final FramedPosition ecef) {
        return Wgs84.toGeodetic(ecef);
    }

    public static FramedPosition wgs84ToCart(final double latitude, final double longitude, final double altitude) {
        return Wgs84.toCartesian(new GeodeticPosition(latitude, longitude, altitude));
    }

    // --- rotation stages ------------------------------------------------------------------------

    static Vector3D precess(final Vector3D v, final PrecessionAngles p) {
        return rotZ(rotY(rotZ(v, p.zeta()), -p.nu()), p.z());
    }

    static Vector3D unprecess(final Vector3D v, final PrecessionAngles p) {
        return rotZ(rotY(rotZ(v, -p.z()), p.nu()), -p.zeta());
    }

    static Vector3D nutate(final Vector3D v, final NutationTerms n) {
        return rotX(rotZ(rotX(v, -n.eps()), n.dpsi()), n.trueObliquity());
    }

    static Vector3D unnutate(final Vector3D v, final NutationTerms n) {
        return rotX(rotZ(rotX(v, -n.trueObliquity()), -n.dpsi()), n.eps());
    }

    private static NutationTerms nutationOrCompute(final NutationTerms nutation, final JulianTime julianTime) {
        return nutation != null ? nutation : TimeSystem.nutationTerms(julianTime);
    }
}
