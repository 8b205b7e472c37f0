package io.github.jakubt4.meridian.ephemeris;

/**
 * RGB color, components {@code 0..255}, the render layer uses for a satellite.
 */
public record DisplayColor(int red, int green, int blue) {

    public static final DisplayColor DEFAULT = new DisplayColor(200, 200, 200);

    public DisplayColor {
        if (red < 0 || red > 255 || green < 0 || green > 255 || blue < 0 || blue > 255) {
            throw new IllegalArgumentException(
                    "Color components must be within 0..255, got [%d, %d, %d]".formatted(red, green, blue));
        }
    }
}
