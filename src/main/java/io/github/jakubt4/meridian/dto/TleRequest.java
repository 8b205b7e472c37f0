package io.github.jakubt4.meridian.dto;

/**
 * A single TLE that becomes the primary target.
 */
public record TleRequest(String satelliteName, String line1, String line2) {

    public boolean hasLines() {
        return line1 != null && !line1.isBlank() && line2 != null && !line2.isBlank();
    }
}
