package io.github.jakubt4.meridian.math;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RotationsTest {

    private static final double EPS = 1e-12;

    @Test
    void rotZByNinetyDegreesTurnsXIntoY() {
        final var rotated = Rotations.rotZ(Vector3D.PLUS_I, 90.0);

        assertThat(rotated.getX()).isCloseTo(0.0, within(EPS));
        assertThat(rotated.getY()).isCloseTo(1.0, within(EPS));
        assertThat(rotated.getZ()).isCloseTo(0.0, within(EPS));
    }

    @Test
    void rotXByNinetyDegreesTurnsYIntoZ() {
        final var rotated = Rotations.rotX(Vector3D.PLUS_J, 90.0);

        assertThat(rotated.getY()).isCloseTo(0.0, within(EPS));
        assertThat(rotated.getZ()).isCloseTo(1.0, within(EPS));
    }

    @Test
    void rotYByNinetyDegreesTurnsZIntoX() {
        final var rotated = Rotations.rotY(Vector3D.PLUS_K, 90.0);

        assertThat(rotated.getX()).isCloseTo(1.0, within(EPS));
        assertThat(rotated.getZ()).isCloseTo(0.0, within(EPS));
    }

    @Test
    void oppositeAnglesCancel() {
        final var v = new Vector3D(1.5, -2.0, 3.25);

        final var back = Rotations.rotY(Rotations.rotY(v, 33.3), -33.3);

        assertThat(back.distance(v)).isLessThan(EPS);
    }

    @Test
    void normalizeDegreesWrapsIntoZeroTo360() {
        assertThat(Angles.normalizeDegrees(-90.0)).isEqualTo(270.0);
        assertThat(Angles.normalizeDegrees(720.5)).isCloseTo(0.5, within(EPS));
        assertThat(Angles.normalizeDegrees(360.0)).isEqualTo(0.0);
    }

    @Test
    void acosdClampsRoundingNoise() {
        assertThat(Angles.acosd(1.0000000001)).isEqualTo(0.0);
        assertThat(Angles.acosd(-1.0000000001)).isEqualTo(180.0);
    }
}
