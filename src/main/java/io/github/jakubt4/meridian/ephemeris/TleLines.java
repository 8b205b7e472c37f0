package io.github.jakubt4.meridian.ephemeris;

/**
 * A named two-line element set in its text form.
 */
public record TleLines(String name, String line1, String line2) {

    public String asText() {
        return name + "\n" + line1 + "\n" + line2;
    }
}
