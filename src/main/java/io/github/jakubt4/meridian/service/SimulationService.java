package io.github.jakubt4.meridian.service;

import io.github.jakubt4.meridian.clock.TimeSlicedFile;
import io.github.jakubt4.meridian.clock.TimeSlicedFileSet;
import io.github.jakubt4.meridian.dto.TelemetrySample;
import io.github.jakubt4.meridian.dto.TleFile;
import io.github.jakubt4.meridian.ephemeris.DisplayColor;
import io.github.jakubt4.meridian.ephemeris.EphemerisAdapter;
import io.github.jakubt4.meridian.ephemeris.Satellite;
import io.github.jakubt4.meridian.ephemeris.SatelliteColorMap;
import io.github.jakubt4.meridian.ephemeris.TleCatalog;
import io.github.jakubt4.meridian.ephemeris.TleCatalogParser;
import io.github.jakubt4.meridian.ephemeris.TleComposer;
import io.github.jakubt4.meridian.ephemeris.TleLines;
import io.github.jakubt4.meridian.frame.OrbitalStateVector;
import io.github.jakubt4.meridian.simulation.FrameSink;
import io.github.jakubt4.meridian.simulation.FrameSnapshot;
import io.github.jakubt4.meridian.simulation.SimulationContext;
import io.github.jakubt4.meridian.simulation.SimulationEngine;
import io.github.jakubt4.meridian.simulation.SimulationOptions;
import io.github.jakubt4.meridian.source.DataSource;
import io.github.jakubt4.meridian.source.EphemerisTable;
import io.github.jakubt4.meridian.source.ManualVectorParser;
import io.github.jakubt4.meridian.source.TelemetryFeed;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Drives the tracking simulation.
 *
 * <p>A {@code @Scheduled} loop runs one {@link SimulationEngine} frame per tick on the scheduler
 * thread and publishes the snapshot to the {@link FrameSink}. Requests from other threads are
 * validated here, where parsing happens, and then queued on the {@link SimulationContext} so the
 * state changes between frames.
 *
 * <p>On startup a default ISS TLE is pinned as primary target so frames flow immediately.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SimulationService {

    // Default ISS TLE for immediate out-of-the-box propagation
    private static final String DEFAULT_SAT_NAME = "ISS (ZARYA)";
    private static final String DEFAULT_TLE_LINE1 =
            "1 25544U 98067A   26046.82773376  .00012360  00000+0  23475-3 0  9996";
    private static final String DEFAULT_TLE_LINE2 =
            "2 25544  51.6318 180.4216 0010986 102.2508 257.9711 15.48632468552944";

    private final SimulationContext context;
    private final SimulationEngine engine;
    private final FrameSink frameSink;
    private final EphemerisAdapter ephemerisAdapter;
    private final TleCatalogParser tleCatalogParser;
    private final TleComposer tleComposer;

    private final AtomicReference<FrameSnapshot> latestSnapshot = new AtomicReference<>();

    @PostConstruct
    void init() {
        try {
            updateTle(DEFAULT_SAT_NAME, DEFAULT_TLE_LINE1, DEFAULT_TLE_LINE2);
            log.info("Default TLE loaded — primary target [{}]", DEFAULT_SAT_NAME);
        } catch (final Exception e) {
            log.warn("Failed to load default TLE, awaiting manual ingestion: {}", e.getMessage());
        }
    }

    @Scheduled(fixedRateString = "${meridian.loop.period-ms:100}",
               initialDelayString = "${meridian.loop.initial-delay-ms:1000}")
    public void runFrame() {
        try {
            engine.advanceFrame(context).ifPresent(snapshot -> {
                latestSnapshot.set(snapshot);
                frameSink.publish(snapshot);
            });
        } catch (final Exception e) {
            log.error("Frame failed: {}", e.getMessage(), e);
        }
    }

    public Optional<FrameSnapshot> latestSnapshot() {
        return Optional.ofNullable(latestSnapshot.get());
    }

    /**
     * Parses a TLE and makes it the primary target of the TLE data source from the next frame on.
     *
     * @throws org.orekit.errors.OrekitException if the TLE cannot be parsed
     */
    public Satellite updateTle(final String satelliteName, final String line1, final String line2) {
        final var satellite = ephemerisAdapter.createSatellite(satelliteName, line1, line2, DisplayColor.DEFAULT);
        context.submit(ctx -> {
            ctx.pinPrimary(satellite);
            ctx.getOptions().setDataSource(DataSource.TWO_LINE_ELEMENTS);
        });
        return satellite;
    }

    /**
     * Parses a catalog and queues it as the new roster.
     *
     * @throws IllegalArgumentException if no entry of the catalog parses
     */
    public TleCatalog loadCatalog(final String content) {
        final var catalog = tleCatalogParser.parse(content);
        if (catalog.isEmpty()) {
            throw new IllegalArgumentException("No valid TLE entries ("
                    + catalog.rejected().size() + " rejected)");
        }
        context.submit(ctx -> ctx.installCatalog(catalog));
        return catalog;
    }

    /**
     * Orders the files by the epoch of their first entry and queues them for epoch switching.
     *
     * @throws IllegalArgumentException if a file has no valid TLE entry
     */
    public TimeSlicedFileSet loadFileSet(final List<TleFile> files) {
        if (files == null || files.isEmpty()) {
            throw new IllegalArgumentException("At least one TLE file is required");
        }
        final var sliced = new ArrayList<TimeSlicedFile>(files.size());
        for (final var file : files) {
            final var epoch = tleCatalogParser.parse(file.content()).firstEpoch()
                    .orElseThrow(() -> new IllegalArgumentException(
                            "File [" + file.filename() + "] has no valid TLE entry"));
            sliced.add(new TimeSlicedFile(file.filename(), file.content(), epoch));
        }
        final var fileSet = new TimeSlicedFileSet(sliced);
        context.submit(ctx -> ctx.installFileSet(fileSet, file -> tleCatalogParser.parse(file.content())));
        return fileSet;
    }

    /**
     * @throws IllegalArgumentException if the table has no data lines
     */
    public EphemerisTable loadEphemerisTable(final String content) {
        final var table = EphemerisTable.parse(content);
        if (table.isEmpty()) {
            throw new IllegalArgumentException("Ephemeris contains no state vectors");
        }
        context.submit(ctx -> {
            ctx.setEphemerisTable(table);
            ctx.getOptions().setDataSource(DataSource.EPHEMERIS_TABLE);
        });
        log.info("AOS — Ephemeris [{}] loaded, {} state vectors", table.objectName(), table.size());
        return table;
    }

    public OrbitalStateVector setManualVector(final String text) {
        final var osv = ManualVectorParser.parse(text);
        context.submit(ctx -> {
            ctx.setManualVector(osv);
            ctx.getOptions().setDataSource(DataSource.MANUAL_VECTOR);
        });
        return osv;
    }

    /**
     * Queues telemetry samples; the batch is rejected as a whole if any parameter is unknown.
     *
     * @throws IllegalArgumentException for a parameter the feed does not know
     */
    public void acceptTelemetry(final List<TelemetrySample> samples) {
        samples.stream()
                .filter(sample -> !TelemetryFeed.PARAMETERS.contains(sample.parameter()))
                .findFirst()
                .ifPresent(sample -> {
                    throw new IllegalArgumentException("Unknown telemetry parameter [" + sample.parameter() + "]");
                });
        final var received = Instant.now();
        context.submit(ctx -> samples.forEach(sample -> ctx.getTelemetryFeed().accept(
                sample.parameter(),
                sample.value(),
                sample.timestamp() == null ? received : sample.timestamp())));
    }

    public Map<String, DisplayColor> applyColorMap(final String content) {
        final var colors = SatelliteColorMap.parse(content);
        context.submit(ctx -> ctx.applyFleetSelection(colors));
        return colors;
    }

    public void selectPrimary(final String nameOrCatalogNumber) {
        context.submit(ctx -> {
            if (!ctx.selectPrimary(nameOrCatalogNumber)) {
                log.warn("Satellite [{}] not found in roster", nameOrCatalogNumber);
            }
        });
    }

    public void updateOptions(final Consumer<SimulationOptions> change) {
        context.submit(ctx -> change.accept(ctx.getOptions()));
    }

    public void updateContext(final Consumer<SimulationContext> change) {
        context.submit(change);
    }

    /**
     * TLE built from the primary target's current osculating elements.
     *
     * @return empty before the first frame with a primary target
     */
    public Optional<TleLines> exportPrimaryTle() {
        return latestSnapshot()
                .flatMap(FrameSnapshot::primaryTarget)
                .map(primary -> primary.catalogNumber() == null
                        ? tleComposer.fromElements(primary.name(), primary.elements())
                        : tleComposer.fromElements(primary.name(), Integer.parseInt(primary.catalogNumber()),
                                primary.elements()));
    }
}
