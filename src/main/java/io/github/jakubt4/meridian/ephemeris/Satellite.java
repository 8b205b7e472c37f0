package io.github.jakubt4.meridian.ephemeris;

import io.github.jakubt4.meridian.frame.GeodeticPosition;
import io.github.jakubt4.meridian.frame.OrbitalStateVector;
import io.github.jakubt4.meridian.kepler.KeplerianElements;
import lombok.Getter;
import lombok.Setter;
import org.orekit.propagation.analytical.tle.TLEPropagator;

import java.time.Instant;

/**
 * One tracked object of a TLE catalog.
 *
 * <p>Identity fields are fixed at parse time. The state fields are overwritten by the frame
 * thread each frame and must not be mutated elsewhere.
 */
@Getter
public class Satellite {

    private final String name;
    private final String catalogNumber;
    private final String line1;
    private final String line2;
    private final Instant epoch;
    private final TLEPropagator propagator;

    @Setter
    private DisplayColor color;

    private OrbitalStateVector stateJ2000;
    private OrbitalStateVector displayState;
    private KeplerianElements elements;
    private GeodeticPosition geodetic;

    // last SGP4 result, keyed by the quantization bucket it was computed for
    private long cachedBucket = Long.MIN_VALUE;
    private OrbitalStateVector cachedTemeState;

    public Satellite(final String name, final String catalogNumber, final String line1, final String line2,
                     final Instant epoch, final TLEPropagator propagator, final DisplayColor color) {
        this.name = name;
        this.catalogNumber = catalogNumber;
        this.line1 = line1;
        this.line2 = line2;
        this.epoch = epoch;
        this.propagator = propagator;
        this.color = color;
    }

    public void updateState(final OrbitalStateVector stateJ2000, final OrbitalStateVector displayState,
                            final KeplerianElements elements, final GeodeticPosition geodetic) {
        this.stateJ2000 = stateJ2000;
        this.displayState = displayState;
        this.elements = elements;
        this.geodetic = geodetic;
    }

    OrbitalStateVector cachedTemeState(final long bucket) {
        return bucket == cachedBucket ? cachedTemeState : null;
    }

    void cacheTemeState(final long bucket, final OrbitalStateVector state) {
        this.cachedBucket = bucket;
        this.cachedTemeState = state;
    }

    @Override
    public String toString() {
        return name + " (" + catalogNumber + ")";
    }
}
