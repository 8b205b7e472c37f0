package io.github.jakubt4.meridian.source;

import io.github.jakubt4.meridian.ephemeris.EphemerisAdapter;
import io.github.jakubt4.meridian.frame.FrameTransform;
import io.github.jakubt4.meridian.frame.OrbitalStateVector;
import io.github.jakubt4.meridian.kepler.KeplerModel;
import io.github.jakubt4.meridian.time.NutationTerms;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Produces the primary target's J2000 state for a frame from the active data source.
 *
 * <p>State-vector sources (telemetry, ephemeris table, manual vector) are converted to osculating
 * elements and Kepler-propagated to the frame instant. The TLE source is evaluated by SGP4 at the
 * frame instant directly. A Keplerian override, when present, wins over every source.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DataSourceSelector {

    static final String TELEMETRY_TARGET = "ISS";
    static final String MANUAL_TARGET = "OSV";
    static final String OVERRIDE_TARGET = "KEPLER";

    private final EphemerisAdapter ephemerisAdapter;

    /**
     * @param override  elements that replace the source, or {@code null}
     * @param nutation  nutation at {@code instant}, used for the TEME conversion
     * @return empty when the source has no data or propagation fails
     */
    public Optional<PrimarySelection> select(final DataSource source, final PrimaryTargetSources sources,
                                             final Instant instant, final NutationTerms nutation,
                                             final KeplerOverride override) {
        if (override != null) {
            final var elements = override.toElements(instant);
            return KeplerModel.propagate(elements, instant)
                    .map(osv -> new PrimarySelection(OVERRIDE_TARGET, null, source, osv, elements, osv));
        }

        return switch (source) {
            case TELEMETRY -> propagateVector(TELEMETRY_TARGET, source, sources.telemetry(), instant);
            case EPHEMERIS_TABLE -> {
                final var table = sources.ephemerisTable();
                if (table == null) {
                    yield Optional.empty();
                }
                yield table.closestTo(instant)
                        .flatMap(osv -> propagateVector(table.objectName(), source, osv, instant));
            }
            case MANUAL_VECTOR -> propagateVector(MANUAL_TARGET, source, sources.manualVector(), instant);
            case TWO_LINE_ELEMENTS -> fromTle(sources, instant, nutation);
        };
    }

    private Optional<PrimarySelection> propagateVector(final String targetName, final DataSource source,
                                                       final OrbitalStateVector raw, final Instant instant) {
        if (raw == null) {
            return Optional.empty();
        }
        final var elements = KeplerModel.osvToKepler(raw);
        final var propagated = KeplerModel.propagate(elements, instant);
        if (propagated.isEmpty()) {
            log.debug("[{}] Kepler propagation failed for source {}", targetName, source);
        }
        return propagated.map(osv -> new PrimarySelection(targetName, null, source, raw, elements, osv));
    }

    private Optional<PrimarySelection> fromTle(final PrimaryTargetSources sources, final Instant instant,
                                               final NutationTerms nutation) {
        final var satellite = sources.tleSatellite();
        if (satellite == null) {
            return Optional.empty();
        }
        try {
            final var teme = ephemerisAdapter.propagate(satellite, instant, 0);
            final var j2000 = FrameTransform.osvTemeToJ2000(teme, nutation);
            final var elements = KeplerModel.osvToKepler(j2000);
            return Optional.of(new PrimarySelection(
                    satellite.getName(), satellite.getCatalogNumber(), DataSource.TWO_LINE_ELEMENTS,
                    j2000, elements, j2000));
        } catch (final RuntimeException e) {
            log.warn("[{}] SGP4 propagation failed: {}", satellite.getName(), e.getMessage());
            return Optional.empty();
        }
    }
}
