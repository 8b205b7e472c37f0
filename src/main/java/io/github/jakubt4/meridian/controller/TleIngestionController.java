package io.github.jakubt4.meridian.controller;

import io.github.jakubt4.meridian.dto.CatalogResponse;
import io.github.jakubt4.meridian.dto.CommandResponse;
import io.github.jakubt4.meridian.dto.FileSetResponse;
import io.github.jakubt4.meridian.dto.TextPayload;
import io.github.jakubt4.meridian.dto.TleFileSetRequest;
import io.github.jakubt4.meridian.dto.TleRequest;
import io.github.jakubt4.meridian.dto.TleResponse;
import io.github.jakubt4.meridian.ephemeris.TleCatalog;
import io.github.jakubt4.meridian.ephemeris.TleLines;
import io.github.jakubt4.meridian.service.SimulationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST endpoints for Two-Line Element (TLE) ingestion.
 *
 * <p>A single TLE via {@code POST /api/orbit/tle} hot-swaps the primary target. Catalogs replace
 * the satellite roster, and a set of time-sliced catalog files is switched by simulated epoch.
 */
@Slf4j
@RestController
@RequestMapping("/api/orbit")
@RequiredArgsConstructor
public class TleIngestionController {

    private final SimulationService simulationService;

    /**
     * Ingests a TLE set and makes the satellite the primary target.
     *
     * @param request satellite name and two-line element strings
     * @return {@code 200 OK} with ACTIVE status on success, {@code 400 Bad Request} on
     *         validation failure or Orekit parse error
     */
    @PostMapping("/tle")
    public ResponseEntity<TleResponse> ingestTle(@RequestBody final TleRequest request) {
        if (request.satelliteName() == null || request.satelliteName().isBlank()) {
            return ResponseEntity.badRequest()
                    .body(TleResponse.rejected(null, "Satellite name is required"));
        }
        if (!request.hasLines()) {
            return ResponseEntity.badRequest()
                    .body(TleResponse.rejected(request.satelliteName(), "TLE line1 and line2 are required"));
        }

        try {
            simulationService.updateTle(request.satelliteName(), request.line1(), request.line2());
            log.info("TLE ingested for satellite [{}]", request.satelliteName());
            return ResponseEntity.ok(
                    TleResponse.active(request.satelliteName(), "TLE loaded, primary target switched"));
        } catch (final Exception e) {
            log.error("Failed to parse TLE for [{}]: {}", request.satelliteName(), e.getMessage());
            return ResponseEntity.badRequest()
                    .body(TleResponse.rejected(request.satelliteName(), "Invalid TLE: " + e.getMessage()));
        }
    }

    /**
     * Replaces the satellite roster. Malformed entries are dropped and listed in the response.
     */
    @PostMapping("/catalog")
    public ResponseEntity<CatalogResponse> ingestCatalog(@RequestBody final TextPayload payload) {
        if (payload.isBlank()) {
            return ResponseEntity.badRequest().body(
                    new CatalogResponse(TleResponse.REJECTED, 0, null, List.of(), List.of("Catalog is empty")));
        }
        try {
            final TleCatalog catalog = simulationService.loadCatalog(payload.content());
            log.info("TLE catalog ingested, {} satellites, {} rejected",
                    catalog.satellites().size(), catalog.rejected().size());
            return ResponseEntity.ok(CatalogResponse.of(TleResponse.ACTIVE, catalog));
        } catch (final IllegalArgumentException e) {
            log.error("Rejected TLE catalog: {}", e.getMessage());
            return ResponseEntity.badRequest().body(
                    new CatalogResponse(TleResponse.REJECTED, 0, null, List.of(), List.of(e.getMessage())));
        }
    }

    @PostMapping("/catalog/files")
    public ResponseEntity<FileSetResponse> ingestFileSet(@RequestBody final TleFileSetRequest request) {
        try {
            final var fileSet = simulationService.loadFileSet(request.files());
            log.info("TLE file set ingested, {} files", fileSet.size());
            return ResponseEntity.ok(FileSetResponse.accepted(fileSet));
        } catch (final IllegalArgumentException e) {
            log.error("Rejected TLE file set: {}", e.getMessage());
            return ResponseEntity.badRequest().body(FileSetResponse.rejected(e.getMessage()));
        }
    }

    /**
     * Applies a {@code name,r,g,b} selection file: colors the named satellites and limits the fleet to them.
     */
    @PostMapping("/catalog/colors")
    public ResponseEntity<CommandResponse> ingestColorMap(@RequestBody final TextPayload payload) {
        final var colors = simulationService.applyColorMap(payload.content());
        return ResponseEntity.ok(CommandResponse.accepted(colors.size() + " satellites selected"));
    }

    @PostMapping("/primary/{name}")
    public ResponseEntity<CommandResponse> selectPrimary(@PathVariable final String name) {
        simulationService.selectPrimary(name);
        return ResponseEntity.ok(CommandResponse.accepted("Primary target [" + name + "] requested"));
    }

    /**
     * TLE generated from the primary target's osculating elements in the latest frame.
     */
    @GetMapping("/primary/tle")
    public ResponseEntity<TleLines> exportPrimaryTle() {
        return simulationService.exportPrimaryTle()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
