package io.github.jakubt4.meridian.dto;

public record TleResponse(String satelliteName, String status, String message) {

    public static final String ACTIVE = "ACTIVE";
    public static final String REJECTED = "REJECTED";

    public static TleResponse active(final String satelliteName, final String message) {
        return new TleResponse(satelliteName, ACTIVE, message);
    }

    public static TleResponse rejected(final String satelliteName, final String message) {
        return new TleResponse(satelliteName, REJECTED, message);
    }
}
