package io.github.jakubt4.meridian.ephemeris;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Result of parsing one TLE file.
 *
 * @param satellites satellites in file order
 * @param rejected   one human-readable reason per dropped entry
 */
public record TleCatalog(List<Satellite> satellites, List<String> rejected) {

    public TleCatalog {
        satellites = List.copyOf(satellites);
        rejected = List.copyOf(rejected);
    }

    public static TleCatalog empty() {
        return new TleCatalog(List.of(), List.of());
    }

    public boolean isEmpty() {
        return satellites.isEmpty();
    }

    /**
     * Epoch of the first satellite in the file, which anchors an epoch-locked clock.
     */
    public Optional<Instant> firstEpoch() {
        return satellites.isEmpty() ? Optional.empty() : Optional.of(satellites.get(0).getEpoch());
    }

    public Optional<Satellite> find(final String name) {
        return satellites.stream()
                .filter(s -> s.getName().equalsIgnoreCase(name) || s.getCatalogNumber().equals(name))
                .findFirst();
    }
}
