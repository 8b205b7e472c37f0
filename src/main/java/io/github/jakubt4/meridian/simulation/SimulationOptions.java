package io.github.jakubt4.meridian.simulation;

import io.github.jakubt4.meridian.frame.DisplayFrame;
import io.github.jakubt4.meridian.source.DataSource;
import io.github.jakubt4.meridian.source.KeplerOverride;
import lombok.Getter;
import lombok.Setter;

/**
 * Per-frame configuration. Mutated only by commands on the frame thread.
 */
@Getter
@Setter
public class SimulationOptions {

    private DataSource dataSource = DataSource.TWO_LINE_ELEMENTS;
    private DisplayFrame displayFrame = DisplayFrame.INERTIAL;
    private boolean fleetEnabled = true;

    /** Replaces the data source while non-null. */
    private KeplerOverride keplerOverride;

    private boolean trailEnabled = true;
    private double trailOrbitsBefore = 0.5;
    private double trailOrbitsAfter = 0.5;
    private int trailPointsPerOrbit = 120;
}
