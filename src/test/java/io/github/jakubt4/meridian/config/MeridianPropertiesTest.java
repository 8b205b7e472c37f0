package io.github.jakubt4.meridian.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MeridianPropertiesTest {

    @Test
    void trailDefaultsAreAccepted() {
        final var trail = new MeridianProperties.Trail(true, 0.5, 0.5, 120);

        assertThat(trail.pointsPerOrbit()).isEqualTo(120);
    }

    @Test
    void trailRejectsNegativeOversizedOrNonFiniteSpan() {
        assertThatThrownBy(() -> new MeridianProperties.Trail(true, -1.0, 0.5, 120))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MeridianProperties.Trail(true, 0.5, 20000.0, 120))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MeridianProperties.Trail(true, Double.NaN, 0.5, 120))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void trailRejectsDensityOutsideBounds() {
        assertThatThrownBy(() -> new MeridianProperties.Trail(true, 0.5, 0.5, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MeridianProperties.Trail(true, 0.5, 0.5, 1_000_000))
                .hasMessageContaining("points-per-orbit");
    }
}
