package io.github.jakubt4.meridian.config;

import io.github.jakubt4.meridian.clock.SimulationClock;
import io.github.jakubt4.meridian.simulation.SimulationContext;
import io.github.jakubt4.meridian.simulation.SimulationOptions;
import io.github.jakubt4.meridian.source.TelemetryFeed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Instant;

@Slf4j
@Configuration
@EnableConfigurationProperties(MeridianProperties.class)
public class SimulationConfig {

    @Bean
    Clock wallClock() {
        return Clock.systemUTC();
    }

    @Bean
    SimulationContext simulationContext(final Clock wallClock, final MeridianProperties properties) {
        final var simulation = properties.simulation();
        final var clock = new SimulationClock(wallClock, simulation.warpRate());
        clock.setWarp(simulation.warpEnabled(), simulation.warpRate());

        if (simulation.freeRunning()) {
            clock.followWallClock();
        } else if (simulation.manualTime() != null && !simulation.manualTime().isBlank()) {
            clock.setManualTime(Instant.parse(simulation.manualTime()));
        }

        final var options = new SimulationOptions();
        options.setDataSource(simulation.dataSource());
        options.setDisplayFrame(simulation.displayFrame());
        options.setFleetEnabled(properties.fleet().enabled());
        options.setTrailEnabled(properties.trail().enabled());
        options.setTrailOrbitsBefore(properties.trail().orbitsBefore());
        options.setTrailOrbitsAfter(properties.trail().orbitsAfter());
        options.setTrailPointsPerOrbit(properties.trail().pointsPerOrbit());

        log.info("Simulation context ready — clock {}, source {}, display frame {}",
                clock.mode(), options.getDataSource(), options.getDisplayFrame());
        return new SimulationContext(clock, options, TelemetryFeed.seeded());
    }
}
