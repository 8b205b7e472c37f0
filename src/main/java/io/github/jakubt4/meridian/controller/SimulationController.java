package io.github.jakubt4.meridian.controller;

import io.github.jakubt4.meridian.dto.CommandResponse;
import io.github.jakubt4.meridian.dto.FrameSnapshotDto;
import io.github.jakubt4.meridian.dto.ManualTimeRequest;
import io.github.jakubt4.meridian.dto.OptionsRequest;
import io.github.jakubt4.meridian.dto.WarpRequest;
import io.github.jakubt4.meridian.kepler.KeplerModel;
import io.github.jakubt4.meridian.service.SimulationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

/**
 * Latest frame, runtime options and clock control. Changes take effect at the next frame.
 */
@Slf4j
@RestController
@RequestMapping("/api/simulation")
@RequiredArgsConstructor
public class SimulationController {

    private final SimulationService simulationService;

    @GetMapping("/frame")
    public ResponseEntity<FrameSnapshotDto> latestFrame() {
        return simulationService.latestSnapshot()
                .map(FrameSnapshotDto::from)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PutMapping("/options")
    public ResponseEntity<CommandResponse> updateOptions(@RequestBody final OptionsRequest request) {
        if (request.trailPointsPerOrbit() != null
                && (request.trailPointsPerOrbit() <= 0 || request.trailPointsPerOrbit() > KeplerModel.MAX_TRAIL_POINTS)) {
            return ResponseEntity.badRequest().body(CommandResponse.rejected(
                    "trailPointsPerOrbit must be between 1 and " + KeplerModel.MAX_TRAIL_POINTS));
        }
        if (!isTrailSpan(request.trailOrbitsBefore()) || !isTrailSpan(request.trailOrbitsAfter())) {
            return ResponseEntity.badRequest().body(CommandResponse.rejected(
                    "Trail orbits must be between 0 and " + KeplerModel.MAX_TRAIL_ORBITS));
        }
        if (request.keplerOverride() != null
                && !request.keplerOverride().toElements(Instant.EPOCH).isElliptical()) {
            return ResponseEntity.badRequest().body(
                    CommandResponse.rejected("Kepler override must be elliptical (a > 0, 0 <= e < 1)"));
        }

        simulationService.updateOptions(options -> {
            if (request.dataSource() != null) {
                options.setDataSource(request.dataSource());
            }
            if (request.displayFrame() != null) {
                options.setDisplayFrame(request.displayFrame());
            }
            if (request.fleetEnabled() != null) {
                options.setFleetEnabled(request.fleetEnabled());
            }
            if (request.trailEnabled() != null) {
                options.setTrailEnabled(request.trailEnabled());
            }
            if (request.trailOrbitsBefore() != null) {
                options.setTrailOrbitsBefore(request.trailOrbitsBefore());
            }
            if (request.trailOrbitsAfter() != null) {
                options.setTrailOrbitsAfter(request.trailOrbitsAfter());
            }
            if (request.trailPointsPerOrbit() != null) {
                options.setTrailPointsPerOrbit(request.trailPointsPerOrbit());
            }
            if (request.clearKeplerOverride()) {
                options.setKeplerOverride(null);
            } else if (request.keplerOverride() != null) {
                options.setKeplerOverride(request.keplerOverride());
            }
        });
        log.info("Simulation options update queued: {}", request);
        return ResponseEntity.ok(CommandResponse.accepted("Options applied at next frame"));
    }

    @PostMapping("/clock/warp")
    public ResponseEntity<CommandResponse> setWarp(@RequestBody final WarpRequest request) {
        simulationService.updateContext(ctx -> ctx.getClock().setWarp(request.enabled(), request.rate()));
        return ResponseEntity.ok(CommandResponse.accepted(
                request.enabled() ? "Warp " + request.rate() + " s/frame" : "Warp disabled"));
    }

    @PostMapping("/clock/reset")
    public ResponseEntity<CommandResponse> resetClock() {
        simulationService.updateContext(ctx -> ctx.getClock().reset());
        return ResponseEntity.ok(CommandResponse.accepted("Clock reset to wall time"));
    }

    @PostMapping("/clock/free-running")
    public ResponseEntity<CommandResponse> startFreeRunning() {
        simulationService.updateContext(ctx -> ctx.getClock().startFreeRunning());
        return ResponseEntity.ok(CommandResponse.accepted("Clock follows wall time"));
    }

    @PostMapping("/clock/manual")
    public ResponseEntity<CommandResponse> setManualTime(@RequestBody final ManualTimeRequest request) {
        if (request.time() == null && request.delta() == null) {
            return ResponseEntity.badRequest().body(CommandResponse.rejected("time or delta is required"));
        }
        simulationService.updateContext(ctx -> {
            if (request.time() != null) {
                ctx.getClock().setManualTime(request.time());
            }
            if (request.delta() != null) {
                ctx.getClock().setManualDelta(request.delta());
            }
        });
        return ResponseEntity.ok(CommandResponse.accepted("Manual time applied at next frame"));
    }

    private static boolean isTrailSpan(final Double orbits) {
        return orbits == null || (Double.isFinite(orbits) && orbits >= 0.0 && orbits <= KeplerModel.MAX_TRAIL_ORBITS);
    }
}
