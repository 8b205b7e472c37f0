package io.github.jakubt4.meridian.source;

import io.github.jakubt4.meridian.frame.OrbitalStateVector;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Time-ordered state vectors read from a CCSDS OEM style ephemeris.
 *
 * <p>Only data lines are used. Header keywords, {@code META}/{@code COMMENT} blocks and covariance
 * sections are skipped; {@code OBJECT_NAME} is kept as the target name.
 */
@Slf4j
public final class EphemerisTable {

    private static final String DEFAULT_OBJECT_NAME = "OEM";

    private final String objectName;
    private final NavigableMap<Instant, OrbitalStateVector> states;

    private EphemerisTable(final String objectName, final NavigableMap<Instant, OrbitalStateVector> states) {
        this.objectName = objectName;
        this.states = Collections.unmodifiableNavigableMap(states);
    }

    public static EphemerisTable empty() {
        return new EphemerisTable(DEFAULT_OBJECT_NAME, new TreeMap<>());
    }

    public static EphemerisTable parse(final String text) {
        final var states = new TreeMap<Instant, OrbitalStateVector>();
        var objectName = DEFAULT_OBJECT_NAME;
        var inCovariance = false;
        var skipped = 0;

        for (final var raw : (text == null ? "" : text).lines().toList()) {
            final var line = raw.strip();
            if (line.isEmpty() || line.startsWith("COMMENT")) {
                continue;
            }
            if (line.startsWith("COVARIANCE_START")) {
                inCovariance = true;
                continue;
            }
            if (line.startsWith("COVARIANCE_STOP")) {
                inCovariance = false;
                continue;
            }
            if (inCovariance) {
                continue;
            }
            if (line.startsWith("OBJECT_NAME") && line.contains("=")) {
                objectName = line.substring(line.indexOf('=') + 1).strip();
                continue;
            }
            if (!StateVectorLines.looksLikeDataLine(line)) {
                continue;
            }
            try {
                final var osv = StateVectorLines.parse(line);
                states.put(osv.timestamp(), osv);
            } catch (final IllegalArgumentException e) {
                skipped++;
                log.debug("Skipping ephemeris line [{}]: {}", line, e.getMessage());
            }
        }
        if (skipped > 0) {
            log.warn("Ephemeris [{}]: skipped {} malformed data lines, kept {}", objectName, skipped, states.size());
        }
        return new EphemerisTable(objectName, states);
    }

    public String objectName() {
        return objectName;
    }

    public int size() {
        return states.size();
    }

    public boolean isEmpty() {
        return states.isEmpty();
    }

    /**
     * Entry whose epoch is nearest to {@code instant}; ties resolve to the earlier entry.
     */
    public Optional<OrbitalStateVector> closestTo(final Instant instant) {
        final var floor = states.floorEntry(instant);
        final var ceiling = states.ceilingEntry(instant);
        if (floor == null) {
            return Optional.ofNullable(ceiling).map(Map.Entry::getValue);
        }
        if (ceiling == null) {
            return Optional.of(floor.getValue());
        }
        final var before = Duration.between(floor.getKey(), instant);
        final var after = Duration.between(instant, ceiling.getKey());
        return Optional.of(after.compareTo(before) < 0 ? ceiling.getValue() : floor.getValue());
    }
}
