package io.github.jakubt4.meridian.kepler;

/**
 * Outcome of solving Kepler's equation.
 */
public sealed interface EccentricAnomalySolution {

    int iterations();

    /**
     * @param eccentricAnomaly E in degrees
     */
    record Converged(double eccentricAnomaly, int iterations) implements EccentricAnomalySolution {
    }

    /**
     * @param lastEstimate E in degrees after the final iteration
     */
    record DidNotConverge(double lastEstimate, int iterations) implements EccentricAnomalySolution {
    }
}
