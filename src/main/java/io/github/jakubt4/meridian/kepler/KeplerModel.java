package io.github.jakubt4.meridian.kepler;

import io.github.jakubt4.meridian.frame.OrbitalStateVector;
import io.github.jakubt4.meridian.frame.ReferenceFrame;
import io.github.jakubt4.meridian.math.Angles;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.orekit.utils.Constants;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static io.github.jakubt4.meridian.math.Rotations.rotX;
import static io.github.jakubt4.meridian.math.Rotations.rotZ;

/**
 * Two-body orbit determination and propagation for elliptical orbits.
 */
@Slf4j
public final class KeplerModel {

    public static final double EARTH_MU = Constants.WGS84_EARTH_MU;

    public static final double DEFAULT_TOLERANCE = 1e-12;
    public static final int DEFAULT_MAX_ITERATIONS = 50;

    static final double EQUATORIAL_INCLINATION = 1e-7;

    /** Largest trail span on either side of the center instant, in periods. */
    public static final double MAX_TRAIL_ORBITS = 10.0;
    /** Upper bound on the samples of one trail. */
    public static final int MAX_TRAIL_POINTS = 5_000;

    private KeplerModel() {
    }

    /**
     * Osculating elements of a J2000 state vector, with the Earth's μ.
     */
    public static KeplerianElements osvToKepler(final OrbitalStateVector osv) {
        osv.requireFrame(ReferenceFrame.J2000);
        return osvToKepler(osv.position(), osv.velocity(), osv.timestamp(), EARTH_MU);
    }

    public static KeplerianElements osvToKepler(final Vector3D r, final Vector3D v, final Instant epoch) {
        return osvToKepler(r, v, epoch, EARTH_MU);
    }

    public static KeplerianElements osvToKepler(final Vector3D r, final Vector3D v, final Instant epoch,
                                                final double mu) {
        final var k = Vector3D.crossProduct(r, v);
        final var radius = r.getNorm();
        final var eccVector = Vector3D.crossProduct(v, k).scalarMultiply(1.0 / mu)
                .subtract(r.scalarMultiply(1.0 / radius));
        final var e = eccVector.getNorm();

        final var energy = v.getNormSq() / 2.0 - mu / radius;
        final var a = -mu / (2.0 * energy);
        final var incl = Angles.acosd(k.getZ() / k.getNorm());

        final double raan;
        final double argPeriapsis;
        if (incl < EQUATORIAL_INCLINATION) {
            // node undefined, measure the periapsis from the x axis
            raan = 0.0;
            argPeriapsis = Angles.normalizeDegrees(Angles.atan2d(eccVector.getY(), eccVector.getX()));
        } else if (incl > 180.0 - EQUATORIAL_INCLINATION) {
            raan = 0.0;
            argPeriapsis = Angles.normalizeDegrees(-Angles.atan2d(eccVector.getY(), eccVector.getX()));
        } else {
            raan = Angles.normalizeDegrees(Angles.atan2d(k.getX(), -k.getY()));
            argPeriapsis = Angles.normalizeDegrees(Angles.atan2d(
                    eccVector.getZ() / Angles.sind(incl),
                    eccVector.getX() * Angles.cosd(raan) + eccVector.getY() * Angles.sind(raan)));
        }

        final var perifocal = rotZ(rotX(rotZ(r, -raan), -incl), -argPeriapsis);
        final var trueAnomaly = Angles.atan2d(perifocal.getY(), perifocal.getX());
        final var eccentricAnomaly = Math.atan2(
                Math.sqrt(Math.max(0.0, 1.0 - e * e)) * Angles.sind(trueAnomaly),
                e + Angles.cosd(trueAnomaly));
        final var meanAnomaly = Angles.normalizeDegrees(
                Math.toDegrees(eccentricAnomaly - e * Math.sin(eccentricAnomaly)));

        return new KeplerianElements(a, e, incl, raan, argPeriapsis, meanAnomaly, mu, epoch);
    }

    /**
     * Orbital period {@code 2π·sqrt(a³/μ)} in seconds.
     */
    public static double computePeriod(final double semiMajorAxis, final double mu) {
        return 2.0 * Math.PI * Math.sqrt(Math.pow(semiMajorAxis, 3) / mu);
    }

    /**
     * Solves {@code E − e·sin E = M} by Newton-Raphson starting from {@code E = M}.
     *
     * @param meanAnomaly   M in degrees
     * @param eccentricity  e in {@code [0, 1)}
     * @param tolerance     convergence threshold on the correction step, radians
     * @param maxIterations iteration cap
     */
    public static EccentricAnomalySolution solveEccentricAnomaly(final double meanAnomaly, final double eccentricity,
                                                                 final double tolerance, final int maxIterations) {
        final var m = Math.toRadians(meanAnomaly);
        var estimate = m;
        for (int i = 1; i <= maxIterations; i++) {
            final var step = (estimate - eccentricity * Math.sin(estimate) - m)
                    / (1.0 - eccentricity * Math.cos(estimate));
            estimate -= step;
            if (Math.abs(step) <= tolerance) {
                return new EccentricAnomalySolution.Converged(Math.toDegrees(estimate), i);
            }
        }
        return new EccentricAnomalySolution.DidNotConverge(Math.toDegrees(estimate), maxIterations);
    }

    /**
     * Two-body propagation of {@code elements} to {@code target}; negative offsets propagate backwards.
     *
     * @return the J2000 state at {@code target}, empty for a zero or non-elliptical orbit or when
     *         Kepler's equation does not converge
     */
    public static Optional<OrbitalStateVector> propagate(final KeplerianElements elements, final Instant target) {
        if (elements.semiMajorAxis() == 0.0) {
            return Optional.empty();
        }
        if (!elements.isElliptical()) {
            log.debug("Skipping non-elliptical orbit a={} e={}", elements.semiMajorAxis(), elements.eccentricity());
            return Optional.empty();
        }

        final var a = elements.semiMajorAxis();
        final var e = elements.eccentricity();
        final var mu = elements.mu();
        final var deltaSeconds = Duration.between(elements.epoch(), target).toNanos() / 1e9;
        final var meanAnomaly = Angles.normalizeDegrees(
                elements.meanAnomaly() + 360.0 * deltaSeconds / elements.period());

        final var solution = solveEccentricAnomaly(meanAnomaly, e, DEFAULT_TOLERANCE, DEFAULT_MAX_ITERATIONS);
        if (solution instanceof EccentricAnomalySolution.DidNotConverge failed) {
            log.debug("Kepler solve did not converge after {} iterations (M={}, e={})",
                    failed.iterations(), meanAnomaly, e);
            return Optional.empty();
        }
        final var eccentricAnomaly = Math.toRadians(((EccentricAnomalySolution.Converged) solution).eccentricAnomaly());

        final var cosE = Math.cos(eccentricAnomaly);
        final var sinE = Math.sin(eccentricAnomaly);
        final var radius = a * (1.0 - e * cosE);
        final var rOrbit = new Vector3D(a * (cosE - e), elements.semiMinorAxis() * sinE, 0.0);
        final var vOrbit = new Vector3D(-sinE, Math.sqrt(1.0 - e * e) * cosE, 0.0)
                .scalarMultiply(Math.sqrt(mu * a) / radius);

        return Optional.of(new OrbitalStateVector(
                toInertial(rOrbit, elements),
                toInertial(vOrbit, elements),
                target,
                ReferenceFrame.J2000));
    }

    /**
     * Positions along the orbit around {@code center}, for drawing the orbit trail.
     *
     * <p>Spans are clamped to {@link #MAX_TRAIL_ORBITS} per side. When the requested density would
     * exceed {@link #MAX_TRAIL_POINTS} samples the density is lowered to fit.
     *
     * @param orbitsBefore  how many periods to cover before {@code center}
     * @param orbitsAfter   how many periods to cover after {@code center}
     * @param pointsPerOrbit samples per period
     * @return J2000 state vectors in time order; samples that fail to propagate are left out
     */
    public static List<OrbitalStateVector> sampleTrail(final KeplerianElements elements, final Instant center,
                                                       final double orbitsBefore, final double orbitsAfter,
                                                       final int pointsPerOrbit) {
        if (!elements.isElliptical() || pointsPerOrbit <= 0
                || !Double.isFinite(orbitsBefore) || !Double.isFinite(orbitsAfter)) {
            return List.of();
        }
        final var before = clampTrailSpan(orbitsBefore);
        final var after = clampTrailSpan(orbitsAfter);
        final var span = before + after;
        // floor and ceil below add up to two extra samples, plus the center one
        final var density = span > 0.0
                ? Math.min(pointsPerOrbit, Math.floor((MAX_TRAIL_POINTS - 3) / span))
                : pointsPerOrbit;
        if (density < pointsPerOrbit) {
            log.debug("Trail density lowered from {} to {} points per orbit", pointsPerOrbit, density);
        }

        final var step = elements.period() / density;
        final var first = (long) Math.floor(-before * density);
        final var last = (long) Math.ceil(after * density);

        final var trail = new ArrayList<OrbitalStateVector>();
        for (long i = first; i <= last; i++) {
            final var at = center.plusNanos(Math.round(i * step * 1e9));
            propagate(elements, at).ifPresent(trail::add);
        }
        return trail;
    }

    private static double clampTrailSpan(final double orbits) {
        return Math.max(0.0, Math.min(orbits, MAX_TRAIL_ORBITS));
    }

    private static Vector3D toInertial(final Vector3D perifocal, final KeplerianElements elements) {
        return rotZ(rotX(rotZ(perifocal, elements.argumentOfPeriapsis()), elements.inclination()), elements.raan());
    }
}
