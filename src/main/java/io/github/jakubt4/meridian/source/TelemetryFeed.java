package io.github.jakubt4.meridian.source;

import io.github.jakubt4.meridian.frame.OrbitalStateVector;
import io.github.jakubt4.meridian.frame.ReferenceFrame;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.geometry.euclidean.threed.Vector3D;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Assembles J2000 state vectors from ISS Live parameter samples.
 *
 * <p>Position arrives in km ({@code USLAB000032..34}), velocity in m/s ({@code USLAB000035..37}),
 * one parameter per sample. A new state vector is published once all six parameters have been
 * seen since the previous one; its timestamp is that of the newest contributing sample.
 */
@Slf4j
public class TelemetryFeed {

    public static final List<String> PARAMETERS = List.of(
            "USLAB000032", "USLAB000033", "USLAB000034",
            "USLAB000035", "USLAB000036", "USLAB000037");

    /** Reference ISS state used until live samples arrive. */
    public static final OrbitalStateVector ISS_SAMPLE = new OrbitalStateVector(
            new Vector3D(-4228282.012, 4080666.827, -3421191.697),
            new Vector3D(-1904.50887, -5821.53009, -4594.77013),
            Instant.parse("2021-11-20T19:28:04Z"),
            ReferenceFrame.J2000);

    private final Map<String, Double> pending = new HashMap<>();
    private Instant pendingTimestamp;
    private OrbitalStateVector latest;

    public static TelemetryFeed seeded() {
        final var feed = new TelemetryFeed();
        feed.latest = ISS_SAMPLE;
        return feed;
    }

    /**
     * Records one sample.
     *
     * @return {@code true} if the sample completed a new state vector
     * @throws IllegalArgumentException for a parameter outside {@link #PARAMETERS}
     */
    public boolean accept(final String parameter, final double value, final Instant timestamp) {
        if (!PARAMETERS.contains(parameter)) {
            throw new IllegalArgumentException("Unknown telemetry parameter [" + parameter + "]");
        }
        pending.put(parameter, value);
        if (pendingTimestamp == null || timestamp.isAfter(pendingTimestamp)) {
            pendingTimestamp = timestamp;
        }
        if (pending.size() < PARAMETERS.size()) {
            return false;
        }

        latest = new OrbitalStateVector(
                new Vector3D(value(0) * 1000.0, value(1) * 1000.0, value(2) * 1000.0),
                new Vector3D(value(3), value(4), value(5)),
                pendingTimestamp,
                ReferenceFrame.J2000);
        pending.clear();
        pendingTimestamp = null;
        log.debug("Telemetry state vector complete at {}", latest.timestamp());
        return true;
    }

    public Optional<OrbitalStateVector> latest() {
        return Optional.ofNullable(latest);
    }

    private double value(final int index) {
        return pending.get(PARAMETERS.get(index));
    }
}
