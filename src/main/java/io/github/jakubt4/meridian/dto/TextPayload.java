package io.github.jakubt4.meridian.dto;

/**
 * Already-read file content: a TLE catalog, an ephemeris table, a manual state vector or a color map.
 */
public record TextPayload(String content) {

    public boolean isBlank() {
        return content == null || content.isBlank();
    }
}
