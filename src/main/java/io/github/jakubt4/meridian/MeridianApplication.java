package io.github.jakubt4.meridian;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Meridian: orbit determination and reference-frame engine for real-time satellite tracking.
 *
 * <p>Each frame turns the active data source (telemetry, ephemeris table, TLE or manual state
 * vector) into a J2000 state for the primary target, propagates the TLE fleet with Orekit SGP4,
 * and projects everything into the display frame for the render layer.
 *
 * @see io.github.jakubt4.meridian.simulation.SimulationEngine
 * @see io.github.jakubt4.meridian.service.SimulationService
 */
@SpringBootApplication
@EnableScheduling
@EnableRetry
public class MeridianApplication {

    public static void main(String[] args) {
        SpringApplication.run(MeridianApplication.class, args);
    }
}
