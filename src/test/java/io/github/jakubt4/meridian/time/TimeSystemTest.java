package io.github.jakubt4.meridian.time;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TimeSystemTest {

    @Test
    void julianDateAtJ2000Epoch() {
        final var julian = TimeSystem.computeJulianTime(Instant.parse("2000-01-01T12:00:00Z"));

        assertThat(julian.jd()).isEqualTo(2451544.5);
        assertThat(julian.jt()).isCloseTo(JulianTime.J2000, within(1e-9));
        assertThat(julian.centuries()).isCloseTo(0.0, within(1e-12));
    }

    @Test
    void julianDateMatchesMeeusExamples() {
        // Meeus, Astronomical Algorithms, examples 7.a and 12.a
        assertThat(TimeSystem.computeJulianTime(Instant.parse("1957-10-04T19:26:24Z")).jt())
                .isCloseTo(2436116.31, within(1e-6));
        assertThat(TimeSystem.computeJulianTime(Instant.parse("1987-04-10T00:00:00Z")).jd())
                .isEqualTo(2446895.5);
    }

    @Test
    void januaryAndFebruaryUsePreviousYearMonths() {
        assertThat(TimeSystem.computeJulianTime(Instant.parse("1988-01-27T00:00:00Z")).jd())
                .isEqualTo(2447187.5);
        assertThat(TimeSystem.computeJulianTime(Instant.parse("2024-02-29T00:00:00Z")).jd())
                .isEqualTo(2460369.5);
    }

    @Test
    void dayFractionIncludesMilliseconds() {
        final var julian = TimeSystem.computeJulianTime(Instant.parse("2021-11-20T18:00:00.500Z"));

        assertThat(julian.dayFraction()).isCloseTo(0.75 + 0.5 / 86400.0, within(1e-10));
    }

    @Test
    void julianToInstantInvertsComputeJulianTime() {
        final var instant = Instant.parse("2021-12-22T16:58:31.482Z");

        final var back = TimeSystem.julianToInstant(TimeSystem.computeJulianTime(instant).jt());

        assertThat(back).isEqualTo(instant);
    }

    @Test
    void meanSiderealTimeMatchesMeeusExample() {
        // Meeus example 12.a: 1987-04-10 0h UT, GMST = 13h10m46.3668s
        final var julian = TimeSystem.computeJulianTime(Instant.parse("1987-04-10T00:00:00Z"));

        final var gmst = TimeSystem.computeSiderealTime(0.0, julian, null);

        assertThat(gmst).isCloseTo(197.693195, within(1e-5));
    }

    @Test
    void siderealTimeAddsLongitudeAndWraps() {
        final var julian = TimeSystem.computeJulianTime(Instant.parse("1987-04-10T00:00:00Z"));

        final var local = TimeSystem.computeSiderealTime(200.0, julian, null);

        assertThat(local).isCloseTo(197.693195 + 200.0 - 360.0, within(1e-5));
    }

    @Test
    void siderealTimeAdvancesFasterThanSolarTime() {
        final var midnight = TimeSystem.computeJulianTime(Instant.parse("2021-12-22T00:00:00Z"));
        final var sixHoursLater = TimeSystem.computeJulianTime(Instant.parse("2021-12-22T06:00:00Z"));

        final var delta = TimeSystem.computeSiderealTime(0.0, sixHoursLater, null)
                - TimeSystem.computeSiderealTime(0.0, midnight, null);

        assertThat(delta).isCloseTo(90.0 * 1.00273790935, within(1e-6));
    }

    @Test
    void apparentSiderealTimeAddsEquationOfEquinoxes() {
        final var julian = TimeSystem.computeJulianTime(Instant.parse("1987-04-10T00:00:00Z"));
        final var nutation = TimeSystem.nutationTerms(julian);

        final var gast = TimeSystem.computeSiderealTime(0.0, julian, nutation);
        final var gmst = TimeSystem.computeSiderealTime(0.0, julian, null);

        assertThat(gast - gmst).isCloseTo(nutation.equationOfEquinoxes(), within(1e-12));
    }

    @Test
    void nutationMatchesShortSeriesForMeeusExample() {
        // Meeus example 22.a (1987-04-10 0h TD): full series gives dpsi = -3.788", deps = 9.443"
        final var t = TimeSystem.centuries(2446895.5);

        final var nutation = TimeSystem.nutationTerms(t);

        assertThat(nutation.dpsi() * 3600.0).isCloseTo(-3.788, within(0.5));
        assertThat(nutation.deps() * 3600.0).isCloseTo(9.443, within(0.5));
        assertThat(nutation.eps()).isCloseTo(23.440946, within(1e-6));
    }

    @Test
    void nutationIsPureFunctionOfTime() {
        assertThat(TimeSystem.nutationTerms(0.21)).isEqualTo(TimeSystem.nutationTerms(0.21));
    }
}
