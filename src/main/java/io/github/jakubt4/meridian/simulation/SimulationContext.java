package io.github.jakubt4.meridian.simulation;

import io.github.jakubt4.meridian.clock.EpochFileSwitcher;
import io.github.jakubt4.meridian.clock.SimulationClock;
import io.github.jakubt4.meridian.clock.TimeSlicedFile;
import io.github.jakubt4.meridian.clock.TimeSlicedFileSet;
import io.github.jakubt4.meridian.ephemeris.DisplayColor;
import io.github.jakubt4.meridian.ephemeris.Satellite;
import io.github.jakubt4.meridian.ephemeris.TleCatalog;
import io.github.jakubt4.meridian.frame.OrbitalStateVector;
import io.github.jakubt4.meridian.source.EphemerisTable;
import io.github.jakubt4.meridian.source.PrimaryTargetSources;
import io.github.jakubt4.meridian.source.TelemetryFeed;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * All mutable simulation state: clock, options, satellite roster and primary target inputs.
 *
 * <p>Only the frame thread touches the state. Other threads go through {@link #submit}, and the
 * queued commands run at the start of the next frame in submission order.
 */
@Slf4j
@Getter
public class SimulationContext {

    private final SimulationClock clock;
    private final SimulationOptions options;
    private final TelemetryFeed telemetryFeed;

    @Getter(AccessLevel.NONE)
    private final Queue<Consumer<SimulationContext>> commands = new ConcurrentLinkedQueue<>();

    private TleCatalog catalog = TleCatalog.empty();
    private Satellite primarySatellite;
    // a pinned primary came from a single TLE and survives roster swaps
    private boolean primaryPinned;
    private EphemerisTable ephemerisTable = EphemerisTable.empty();
    private OrbitalStateVector manualVector;
    private EpochFileSwitcher<TleCatalog> fileSwitcher;
    // kept across roster swaps, reapplied to every newly loaded catalog
    private Map<String, DisplayColor> fleetColors = Map.of();

    public SimulationContext(final SimulationClock clock, final SimulationOptions options,
                             final TelemetryFeed telemetryFeed) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.options = Objects.requireNonNull(options, "options");
        this.telemetryFeed = Objects.requireNonNull(telemetryFeed, "telemetryFeed");
    }

    /**
     * Queues a state change for the frame thread. Safe to call from any thread.
     */
    public void submit(final Consumer<SimulationContext> command) {
        commands.add(Objects.requireNonNull(command, "command"));
    }

    /**
     * Runs every queued command. A failing command is logged and does not stop the others.
     *
     * @return number of commands run
     */
    public int drainCommands() {
        var count = 0;
        Consumer<SimulationContext> command;
        while ((command = commands.poll()) != null) {
            count++;
            try {
                command.accept(this);
            } catch (final RuntimeException e) {
                log.warn("Simulation command failed: {}", e.getMessage());
            }
        }
        return count;
    }

    /**
     * Replaces the roster with a directly loaded catalog and locks the clock to its first epoch.
     * Any time-sliced file set is dropped.
     */
    public void installCatalog(final TleCatalog newCatalog) {
        fileSwitcher = null;
        swapCatalog(newCatalog);
        newCatalog.firstEpoch().ifPresent(clock::lockToEpoch);
    }

    /**
     * Installs a time-sliced file set. The clock locks to the earliest file's epoch and the file
     * for the resulting instant is loaded right away.
     */
    public void installFileSet(final TimeSlicedFileSet fileSet, final Function<TimeSlicedFile, TleCatalog> loader) {
        if (fileSet.isEmpty()) {
            throw new IllegalArgumentException("TLE file set is empty");
        }
        fileSwitcher = new EpochFileSwitcher<>(fileSet, loader);
        clock.lockToEpoch(fileSet.get(0).epoch());
        if (fileSwitcher.switchIfNeeded(clock.currentInstant())) {
            swapCatalog(fileSwitcher.active());
        }
    }

    /**
     * Called by the engine after the switcher loaded another file.
     */
    void onFileSwitched(final TleCatalog switched) {
        swapCatalog(switched);
    }

    /**
     * Makes a roster satellite the primary target of the TLE source.
     *
     * @return {@code false} if no satellite matches
     */
    public boolean selectPrimary(final String nameOrCatalogNumber) {
        final var match = catalog.find(nameOrCatalogNumber);
        match.ifPresent(satellite -> {
            primarySatellite = satellite;
            primaryPinned = false;
            log.info("AOS — Acquired signal for [{}], TLE epoch: {}", satellite.getName(), satellite.getEpoch());
        });
        return match.isPresent();
    }

    /**
     * Makes a satellite that is not part of the roster the primary target.
     */
    public void pinPrimary(final Satellite satellite) {
        primarySatellite = Objects.requireNonNull(satellite, "satellite");
        primaryPinned = true;
        log.info("AOS — Acquired signal for [{}], TLE epoch: {}", satellite.getName(), satellite.getEpoch());
    }

    public void setEphemerisTable(final EphemerisTable table) {
        this.ephemerisTable = Objects.requireNonNull(table, "table");
    }

    public void setManualVector(final OrbitalStateVector manualVector) {
        this.manualVector = manualVector;
    }

    /**
     * Applies colors to matching satellites and restricts the fleet to the named satellites.
     * The map also applies to rosters loaded later. An empty map shows the whole roster again.
     */
    public void applyFleetSelection(final Map<String, DisplayColor> colors) {
        fleetColors = Map.copyOf(colors);
        paintFleet(catalog);
    }

    public List<Satellite> fleetMembers() {
        if (fleetColors.isEmpty()) {
            return catalog.satellites();
        }
        return catalog.satellites().stream()
                .filter(satellite -> fleetColors.containsKey(satellite.getName()))
                .toList();
    }

    public PrimaryTargetSources primarySources() {
        return new PrimaryTargetSources(
                telemetryFeed.latest().orElse(null),
                ephemerisTable,
                manualVector,
                primarySatellite);
    }

    public int activeFileIndex() {
        return fileSwitcher == null ? -1 : fileSwitcher.activeIndex();
    }

    private void paintFleet(final TleCatalog target) {
        target.satellites().forEach(satellite -> {
            final var color = fleetColors.get(satellite.getName());
            if (color != null) {
                satellite.setColor(color);
            }
        });
    }

    private void swapCatalog(final TleCatalog newCatalog) {
        catalog = newCatalog;
        paintFleet(newCatalog);
        if (primaryPinned) {
            log.info("AOS — Roster swapped, {} satellites, primary [{}] kept",
                    newCatalog.satellites().size(), primarySatellite.getName());
            return;
        }
        final var previousPrimary = primarySatellite == null ? null : primarySatellite.getName();
        primarySatellite = previousPrimary == null
                ? null
                : newCatalog.find(previousPrimary).orElse(null);
        if (primarySatellite == null && !newCatalog.isEmpty()) {
            primarySatellite = newCatalog.satellites().get(0);
        }
        log.info("AOS — Roster swapped, {} satellites, primary [{}]",
                newCatalog.satellites().size(),
                primarySatellite == null ? "NONE" : primarySatellite.getName());
    }
}
