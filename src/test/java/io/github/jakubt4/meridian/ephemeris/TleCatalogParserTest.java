package io.github.jakubt4.meridian.ephemeris;

import io.github.jakubt4.meridian.config.OrekitConfig;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static io.github.jakubt4.meridian.TestTles.HST_LINE1;
import static io.github.jakubt4.meridian.TestTles.HST_LINE2;
import static io.github.jakubt4.meridian.TestTles.HST_NAME;
import static io.github.jakubt4.meridian.TestTles.ISS_LINE1;
import static io.github.jakubt4.meridian.TestTles.ISS_LINE2;
import static io.github.jakubt4.meridian.TestTles.ISS_NAME;
import static io.github.jakubt4.meridian.TestTles.ISS_NOV01_LINE1;
import static io.github.jakubt4.meridian.TestTles.ISS_NOV01_LINE2;
import static io.github.jakubt4.meridian.TestTles.catalog;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TleCatalogParserTest {

    private final TleCatalogParser parser = new TleCatalogParser(
            new OrekitEphemerisAdapter(OrekitConfig.embeddedTimeScales().getUTC()));

    @Test
    void parsesNamedEntriesInFileOrder() {
        final var result = parser.parse(catalog(ISS_NAME, ISS_LINE1, ISS_LINE2, HST_NAME, HST_LINE1, HST_LINE2));

        assertThat(result.satellites()).extracting(Satellite::getName).containsExactly(ISS_NAME, HST_NAME);
        assertThat(result.rejected()).isEmpty();
    }

    @Test
    void acceptsNamelessPairsAndThreeLineElementPrefix() {
        final var result = parser.parse(catalog(ISS_LINE1, ISS_LINE2, "0 " + HST_NAME, HST_LINE1, HST_LINE2));

        assertThat(result.satellites()).extracting(Satellite::getName).containsExactly("25544", HST_NAME);
    }

    @Test
    void toleratesBlankLinesAndWindowsLineEndings() {
        final var text = ISS_NAME + "\r\n" + ISS_LINE1 + "\r\n\r\n" + ISS_LINE2 + "\r\n";

        final var result = parser.parse(text);

        assertThat(result.satellites()).hasSize(1);
        assertThat(result.satellites().get(0).getLine2()).isEqualTo(ISS_LINE2);
    }

    @Test
    void dropsTruncatedEntryAndResynchronizes() {
        final var result = parser.parse(catalog("BROKEN", ISS_LINE1, HST_NAME, HST_LINE1, HST_LINE2));

        assertThat(result.satellites()).extracting(Satellite::getName).containsExactly(HST_NAME);
        assertThat(result.rejected()).isNotEmpty();
        assertThat(result.rejected().get(0)).startsWith("Line 1:");
    }

    @Test
    void recordsEntryWithBadChecksum() {
        final var corrupted = ISS_LINE2.substring(0, 68) + "0";

        final var result = parser.parse(catalog(ISS_NAME, ISS_LINE1, corrupted, HST_NAME, HST_LINE1, HST_LINE2));

        assertThat(result.satellites()).extracting(Satellite::getName).containsExactly(HST_NAME);
        assertThat(result.rejected()).hasSize(1);
    }

    @Test
    void adapterFailureIsRecordedNotThrown() {
        final var adapter = mock(EphemerisAdapter.class);
        when(adapter.createSatellite(eq(ISS_NAME), anyString(), anyString(), any()))
                .thenThrow(new IllegalStateException("propagator unavailable"));

        final var result = new TleCatalogParser(adapter).parse(catalog(ISS_NAME, ISS_LINE1, ISS_LINE2));

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.rejected()).containsExactly("Line 1: propagator unavailable");
    }

    @Test
    void firstEpochComesFromFirstSatellite() {
        final var result = parser.parse(catalog("ISS NOV", ISS_NOV01_LINE1, ISS_NOV01_LINE2, ISS_NAME, ISS_LINE1, ISS_LINE2));

        assertThat(result.firstEpoch()).contains(Instant.parse("2023-11-01T00:00:00Z"));
    }

    @Test
    void findMatchesNameIgnoringCaseOrCatalogNumber() {
        final var result = parser.parse(catalog(ISS_NAME, ISS_LINE1, ISS_LINE2, HST_NAME, HST_LINE1, HST_LINE2));

        assertThat(result.find("iss (zarya)")).map(Satellite::getName).contains(ISS_NAME);
        assertThat(result.find("20580")).map(Satellite::getName).contains(HST_NAME);
        assertThat(result.find("MIR")).isEmpty();
    }

    @Test
    void blankTextGivesEmptyCatalog() {
        assertThat(parser.parse("  \n ").isEmpty()).isTrue();
        assertThat(parser.parse(null).firstEpoch()).isEmpty();
    }
}
