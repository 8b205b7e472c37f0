package io.github.jakubt4.meridian.ephemeris;

import io.github.jakubt4.meridian.kepler.KeplerianElements;
import org.orekit.propagation.analytical.tle.TLE;
import org.orekit.time.AbsoluteDate;
import org.orekit.time.TimeScale;
import org.springframework.stereotype.Component;

import java.util.Date;

/**
 * Builds a checksummed TLE from osculating elements.
 *
 * <p>Osculating elements are written as if they were SGP4 mean elements, with zero drag terms,
 * so the result only approximates the source orbit and drifts away from it over a few revolutions.
 */
@Component
public class TleComposer {

    static final int PLACEHOLDER_CATALOG_NUMBER = 0;
    static final int PLACEHOLDER_ELEMENT_NUMBER = 999;

    private final TimeScale utc;

    public TleComposer(final TimeScale utc) {
        this.utc = utc;
    }

    public TleLines fromElements(final String name, final KeplerianElements elements) {
        return fromElements(name, PLACEHOLDER_CATALOG_NUMBER, elements);
    }

    public TleLines fromElements(final String name, final int catalogNumber, final KeplerianElements elements) {
        if (!elements.isElliptical()) {
            throw new IllegalArgumentException("Only elliptical orbits can be written as TLE");
        }
        final var epoch = new AbsoluteDate(Date.from(elements.epoch()), utc);
        final var meanMotion = 2.0 * Math.PI / elements.period();

        final var tle = new TLE(catalogNumber, 'U', 2000, 0, "A", TLE.DEFAULT, PLACEHOLDER_ELEMENT_NUMBER,
                epoch, meanMotion, 0.0, 0.0,
                elements.eccentricity(),
                Math.toRadians(elements.inclination()),
                Math.toRadians(elements.argumentOfPeriapsis()),
                Math.toRadians(elements.raan()),
                Math.toRadians(elements.meanAnomaly()),
                0, 0.0, utc);
        return new TleLines(name, tle.getLine1(), tle.getLine2());
    }
}
