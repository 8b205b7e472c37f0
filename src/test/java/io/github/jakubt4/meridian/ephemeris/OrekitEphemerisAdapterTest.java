package io.github.jakubt4.meridian.ephemeris;

import io.github.jakubt4.meridian.config.OrekitConfig;
import io.github.jakubt4.meridian.frame.FrameTransform;
import io.github.jakubt4.meridian.frame.ReferenceFrame;
import io.github.jakubt4.meridian.time.TimeSystem;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static io.github.jakubt4.meridian.TestTles.HST_LINE1;
import static io.github.jakubt4.meridian.TestTles.HST_LINE2;
import static io.github.jakubt4.meridian.TestTles.ISS_LINE1;
import static io.github.jakubt4.meridian.TestTles.ISS_LINE2;
import static io.github.jakubt4.meridian.TestTles.ISS_NAME;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrekitEphemerisAdapterTest {

    private final OrekitEphemerisAdapter adapter =
            new OrekitEphemerisAdapter(OrekitConfig.embeddedTimeScales().getUTC());

    @Test
    void createsSatelliteWithTleEpoch() {
        final var satellite = adapter.createSatellite(ISS_NAME, ISS_LINE1, ISS_LINE2, DisplayColor.DEFAULT);

        assertThat(satellite.getName()).isEqualTo(ISS_NAME);
        assertThat(satellite.getCatalogNumber()).isEqualTo("25544");
        assertThat(satellite.getEpoch()).isBetween(
                Instant.parse("2021-12-22T16:58:00Z"), Instant.parse("2021-12-22T16:59:00Z"));
        assertThat(satellite.getColor()).isEqualTo(DisplayColor.DEFAULT);
    }

    @Test
    void blankNameFallsBackToCatalogNumber() {
        final var satellite = adapter.createSatellite("  ", HST_LINE1, HST_LINE2, DisplayColor.DEFAULT);

        assertThat(satellite.getName()).isEqualTo("20580");
    }

    @Test
    void rejectsBadChecksum() {
        final var corrupted = ISS_LINE1.substring(0, 68) + "0";

        assertThatThrownBy(() -> adapter.createSatellite(ISS_NAME, corrupted, ISS_LINE2, DisplayColor.DEFAULT))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void propagatedIssSitsInLowEarthOrbit() {
        final var satellite = adapter.createSatellite(ISS_NAME, ISS_LINE1, ISS_LINE2, DisplayColor.DEFAULT);
        final var instant = Instant.parse("2021-12-22T18:00:00Z");

        final var teme = adapter.propagate(satellite, instant, 0);
        final var nutation = TimeSystem.nutationTerms(TimeSystem.computeJulianTime(instant));
        final var j2000 = FrameTransform.osvTemeToJ2000(teme, nutation);
        final var ecef = FrameTransform.osvJ2000ToECEF(j2000, nutation);
        final var geodetic = FrameTransform.cartToWgs84(ecef.framedPosition());

        assertThat(teme.frame()).isEqualTo(ReferenceFrame.TEME);
        assertThat(teme.timestamp()).isEqualTo(instant);
        assertThat(teme.velocity().getNorm()).isBetween(7600.0, 7700.0);
        assertThat(geodetic.altitude()).isBetween(350_000.0, 450_000.0);
        assertThat(Math.abs(geodetic.latitude())).isLessThanOrEqualTo(52.0);
    }

    @Test
    void quantizedPropagationReusesStateWithinBucket() {
        final var satellite = adapter.createSatellite(ISS_NAME, ISS_LINE1, ISS_LINE2, DisplayColor.DEFAULT);
        final var bucketStart = Instant.parse("2021-12-22T18:00:00Z");

        final var first = adapter.propagate(satellite, bucketStart.plusSeconds(3), 10);
        final var second = adapter.propagate(satellite, bucketStart.plusSeconds(8), 10);
        final var next = adapter.propagate(satellite, bucketStart.plusSeconds(12), 10);

        assertThat(first.timestamp()).isEqualTo(bucketStart);
        assertThat(second).isSameAs(first);
        assertThat(next.timestamp()).isEqualTo(bucketStart.plusSeconds(10));
        assertThat(next.position().distance(first.position())).isGreaterThan(50_000.0);
    }
}
