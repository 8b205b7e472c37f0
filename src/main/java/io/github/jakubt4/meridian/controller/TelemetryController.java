package io.github.jakubt4.meridian.controller;

import io.github.jakubt4.meridian.dto.CommandResponse;
import io.github.jakubt4.meridian.dto.TelemetryRequest;
import io.github.jakubt4.meridian.service.SimulationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Ingests ISS Live telemetry samples ({@code USLAB000032..37}).
 */
@Slf4j
@RestController
@RequestMapping("/api/telemetry")
@RequiredArgsConstructor
public class TelemetryController {

    private final SimulationService simulationService;

    @PostMapping
    public ResponseEntity<CommandResponse> ingest(@RequestBody final TelemetryRequest request) {
        if (request.samples() == null || request.samples().isEmpty()) {
            return ResponseEntity.badRequest().body(CommandResponse.rejected("No telemetry samples"));
        }
        try {
            simulationService.acceptTelemetry(request.samples());
            return ResponseEntity.ok(CommandResponse.accepted(request.samples().size() + " samples queued"));
        } catch (final IllegalArgumentException e) {
            log.warn("Rejected telemetry: {}", e.getMessage());
            return ResponseEntity.badRequest().body(CommandResponse.rejected(e.getMessage()));
        }
    }
}
