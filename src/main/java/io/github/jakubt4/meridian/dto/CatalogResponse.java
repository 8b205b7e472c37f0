package io.github.jakubt4.meridian.dto;

import io.github.jakubt4.meridian.ephemeris.Satellite;
import io.github.jakubt4.meridian.ephemeris.TleCatalog;

import java.time.Instant;
import java.util.List;

/**
 * Summary of a parsed TLE catalog.
 */
public record CatalogResponse(String status,
                              int loaded,
                              Instant firstEpoch,
                              List<String> satellites,
                              List<String> rejected) {

    public static CatalogResponse of(final String status, final TleCatalog catalog) {
        return new CatalogResponse(
                status,
                catalog.satellites().size(),
                catalog.firstEpoch().orElse(null),
                catalog.satellites().stream().map(Satellite::getName).toList(),
                catalog.rejected());
    }
}
