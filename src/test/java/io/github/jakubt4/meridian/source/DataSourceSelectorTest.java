package io.github.jakubt4.meridian.source;

import io.github.jakubt4.meridian.ephemeris.DisplayColor;
import io.github.jakubt4.meridian.ephemeris.EphemerisAdapter;
import io.github.jakubt4.meridian.ephemeris.Satellite;
import io.github.jakubt4.meridian.frame.OrbitalStateVector;
import io.github.jakubt4.meridian.frame.ReferenceFrame;
import io.github.jakubt4.meridian.time.TimeSystem;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DataSourceSelectorTest {

    private static final Instant FRAME = Instant.parse("2021-11-20T19:58:04Z");

    @Mock
    private EphemerisAdapter ephemerisAdapter;

    private DataSourceSelector selector;

    @BeforeEach
    void setUp() {
        selector = new DataSourceSelector(ephemerisAdapter);
    }

    @Test
    void telemetryIsKeplerPropagatedToFrameInstant() {
        final var sources = new PrimaryTargetSources(TelemetryFeed.ISS_SAMPLE, null, null, null);

        final var selection = selector.select(DataSource.TELEMETRY, sources, FRAME, null, null).orElseThrow();

        assertThat(selection.targetName()).isEqualTo("ISS");
        assertThat(selection.catalogNumber()).isNull();
        assertThat(selection.raw()).isEqualTo(TelemetryFeed.ISS_SAMPLE);
        assertThat(selection.propagated().timestamp()).isEqualTo(FRAME);
        assertThat(selection.propagated().position().distance(TelemetryFeed.ISS_SAMPLE.position()))
                .isGreaterThan(1.0e6);
        assertThat(selection.elements().semiMajorAxis()).isCloseTo(6800571.7, within(1.0));
        verifyNoInteractions(ephemerisAdapter);
    }

    @Test
    void ephemerisTableUsesClosestEntryAndObjectName() {
        final var table = EphemerisTable.parse("""
                OBJECT_NAME = ISS-OEM
                2021-11-20T19:28:04 -4228.282012 4080.666827 -3421.191697 -1.90450887 -5.82153009 -4.59477013
                2021-11-20T21:28:04 -4228.282012 4080.666827 -3421.191697 -1.90450887 -5.82153009 -4.59477013
                """);
        final var sources = new PrimaryTargetSources(null, table, null, null);

        final var selection = selector.select(DataSource.EPHEMERIS_TABLE, sources, FRAME, null, null).orElseThrow();

        assertThat(selection.targetName()).isEqualTo("ISS-OEM");
        assertThat(selection.raw().timestamp()).isEqualTo(Instant.parse("2021-11-20T19:28:04Z"));
    }

    @Test
    void manualVectorSelectionIsNamedOsv() {
        final var sources = new PrimaryTargetSources(null, null, TelemetryFeed.ISS_SAMPLE, null);

        final var selection = selector.select(DataSource.MANUAL_VECTOR, sources, FRAME, null, null).orElseThrow();

        assertThat(selection.targetName()).isEqualTo("OSV");
        assertThat(selection.source()).isEqualTo(DataSource.MANUAL_VECTOR);
    }

    @Test
    void missingSourceDataGivesNoSelection() {
        final var none = new PrimaryTargetSources(null, null, null, null);

        for (final var source : DataSource.values()) {
            assertThat(selector.select(source, none, FRAME, null, null)).isEmpty();
        }
    }

    @Test
    void unboundStateVectorGivesNoSelection() {
        final var escaping = new OrbitalStateVector(
                new Vector3D(7.0e6, 0.0, 0.0), new Vector3D(0.0, 12000.0, 0.0), FRAME, ReferenceFrame.J2000);

        assertThat(selector.select(DataSource.MANUAL_VECTOR,
                new PrimaryTargetSources(null, null, escaping, null), FRAME, null, null)).isEmpty();
    }

    @Test
    void tleSourceConvertsSgp4OutputToJ2000() {
        final var satellite = satellite("ISS (ZARYA)");
        final var teme = new OrbitalStateVector(
                new Vector3D(6.8e6, 0.0, 0.0), new Vector3D(0.0, 5000.0, 5000.0), FRAME, ReferenceFrame.TEME);
        when(ephemerisAdapter.propagate(satellite, FRAME, 0)).thenReturn(teme);
        final var nutation = TimeSystem.nutationTerms(TimeSystem.computeJulianTime(FRAME));

        final var selection = selector.select(DataSource.TWO_LINE_ELEMENTS,
                new PrimaryTargetSources(null, null, null, satellite), FRAME, nutation, null).orElseThrow();

        assertThat(selection.targetName()).isEqualTo("ISS (ZARYA)");
        assertThat(selection.catalogNumber()).isEqualTo("25544");
        assertThat(selection.propagated().frame()).isEqualTo(ReferenceFrame.J2000);
        assertThat(selection.propagated().radius()).isCloseTo(6.8e6, within(1e-6));
        assertThat(selection.raw()).isEqualTo(selection.propagated());
    }

    @Test
    void sgp4FailureGivesNoSelection() {
        final var satellite = satellite("DECAYED");
        when(ephemerisAdapter.propagate(eq(satellite), any(), anyLong()))
                .thenThrow(new IllegalStateException("satellite has decayed"));

        assertThat(selector.select(DataSource.TWO_LINE_ELEMENTS,
                new PrimaryTargetSources(null, null, null, satellite), FRAME, null, null)).isEmpty();
        verify(ephemerisAdapter).propagate(satellite, FRAME, 0);
    }

    @Test
    void keplerOverrideWinsOverSource() {
        final var override = new KeplerOverride(7.0e6, 0.001, 98.0, 10.0, 0.0, 45.0);

        final var selection = selector.select(DataSource.TELEMETRY,
                new PrimaryTargetSources(TelemetryFeed.ISS_SAMPLE, null, null, null), FRAME, null, override)
                .orElseThrow();

        assertThat(selection.targetName()).isEqualTo("KEPLER");
        assertThat(selection.elements().epoch()).isEqualTo(FRAME);
        assertThat(selection.elements().meanAnomaly()).isEqualTo(45.0);
        assertThat(selection.propagated().radius()).isBetween(6.99e6, 7.01e6);
    }

    private static Satellite satellite(final String name) {
        return new Satellite(name, "25544", "1", "2", FRAME, null, DisplayColor.DEFAULT);
    }
}
