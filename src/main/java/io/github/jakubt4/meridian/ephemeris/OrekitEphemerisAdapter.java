package io.github.jakubt4.meridian.ephemeris;

import io.github.jakubt4.meridian.frame.OrbitalStateVector;
import io.github.jakubt4.meridian.frame.ReferenceFrame;
import lombok.extern.slf4j.Slf4j;
import org.orekit.attitudes.FrameAlignedProvider;
import org.orekit.frames.Frame;
import org.orekit.frames.Transform;
import org.orekit.propagation.Propagator;
import org.orekit.propagation.analytical.tle.TLE;
import org.orekit.propagation.analytical.tle.TLEPropagator;
import org.orekit.time.AbsoluteDate;
import org.orekit.time.TimeScale;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Date;

/**
 * SGP4/SDP4 through Orekit's {@link TLEPropagator}.
 *
 * <p>The propagator is bound to a pseudo-inertial frame labelled TEME that is not connected to
 * Orekit's frame tree, so no Earth orientation data is needed: SGP4 output is returned as-is
 * and converted to J2000 by {@link io.github.jakubt4.meridian.frame.FrameTransform#osvTemeToJ2000}.
 */
@Slf4j
@Component
public class OrekitEphemerisAdapter implements EphemerisAdapter {

    static final Frame TEME = new Frame(Frame.getRoot(), Transform.IDENTITY, "TEME", true);

    private final TimeScale utc;

    public OrekitEphemerisAdapter(final TimeScale utc) {
        this.utc = utc;
    }

    @Override
    public Satellite createSatellite(final String name, final String line1, final String line2,
                                     final DisplayColor color) {
        if (!TLE.isFormatOK(line1, line2)) {
            throw new IllegalArgumentException("TLE format or checksum check failed");
        }
        final var tle = new TLE(line1, line2, utc);
        final var propagator = TLEPropagator.selectExtrapolator(
                tle, new FrameAlignedProvider(TEME), Propagator.DEFAULT_MASS, TEME);
        final var epoch = tle.getDate().toDate(utc).toInstant();
        final var catalogNumber = String.valueOf(tle.getSatelliteNumber());
        final var displayName = name == null || name.isBlank() ? catalogNumber : name.trim();

        log.debug("Prepared {} for [{}], TLE epoch {}", propagator.getClass().getSimpleName(), displayName, epoch);
        return new Satellite(displayName, catalogNumber, line1, line2, epoch, propagator, color);
    }

    @Override
    public OrbitalStateVector propagate(final Satellite satellite, final Instant instant,
                                        final long quantizationSeconds) {
        if (quantizationSeconds <= 0) {
            return propagateAt(satellite, instant);
        }
        final var bucket = Math.floorDiv(instant.getEpochSecond(), quantizationSeconds);
        final var cached = satellite.cachedTemeState(bucket);
        if (cached != null) {
            return cached;
        }
        final var state = propagateAt(satellite, Instant.ofEpochSecond(bucket * quantizationSeconds));
        satellite.cacheTemeState(bucket, state);
        return state;
    }

    private OrbitalStateVector propagateAt(final Satellite satellite, final Instant instant) {
        final var date = new AbsoluteDate(Date.from(instant), utc);
        final var pv = satellite.getPropagator().getPVCoordinates(date);
        return new OrbitalStateVector(pv.getPosition(), pv.getVelocity(), instant, ReferenceFrame.TEME);
    }
}
