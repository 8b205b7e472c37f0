package io.github.jakubt4.meridian.controller;

import io.github.jakubt4.meridian.dto.CommandResponse;
import io.github.jakubt4.meridian.dto.TextPayload;
import io.github.jakubt4.meridian.service.SimulationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * State-vector sources for the primary target: ephemeris tables and manual vectors.
 * Both switch the data source on success.
 */
@Slf4j
@RestController
@RequestMapping("/api/orbit")
@RequiredArgsConstructor
public class StateVectorController {

    private final SimulationService simulationService;

    @PostMapping("/ephemeris")
    public ResponseEntity<CommandResponse> ingestEphemeris(@RequestBody final TextPayload payload) {
        try {
            final var table = simulationService.loadEphemerisTable(payload.content());
            return ResponseEntity.ok(CommandResponse.accepted(
                    "Ephemeris [" + table.objectName() + "] loaded, " + table.size() + " state vectors"));
        } catch (final IllegalArgumentException e) {
            log.error("Rejected ephemeris: {}", e.getMessage());
            return ResponseEntity.badRequest().body(CommandResponse.rejected(e.getMessage()));
        }
    }

    @PostMapping("/osv")
    public ResponseEntity<CommandResponse> ingestStateVector(@RequestBody final TextPayload payload) {
        try {
            final var osv = simulationService.setManualVector(payload.content());
            log.info("Manual state vector set, epoch {}", osv.timestamp());
            return ResponseEntity.ok(CommandResponse.accepted("State vector at " + osv.timestamp() + " set"));
        } catch (final IllegalArgumentException e) {
            log.error("Rejected state vector: {}", e.getMessage());
            return ResponseEntity.badRequest().body(CommandResponse.rejected("Invalid state vector: " + e.getMessage()));
        }
    }
}
